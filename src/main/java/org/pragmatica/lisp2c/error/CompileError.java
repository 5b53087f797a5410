package org.pragmatica.lisp2c.error;

import io.vavr.control.Option;
import org.pragmatica.lisp2c.lexer.TokenKind;
import org.pragmatica.lisp2c.tree.SourceLocation;
import org.pragmatica.lisp2c.tree.SourceSpan;

/**
 * Compilation failure. Every stage stops at the first one and hands it back unchanged.
 */
public sealed interface CompileError {

    String message();

    /**
     * Where in the input the failure was detected, if it relates to the input at all.
     */
    Option<SourceLocation> location();

    /**
     * Rich rendering of this error for display against the source text.
     */
    Diagnostic toDiagnostic();

    /**
     * Character that starts no token.
     */
    record UnrecognizedCharacter(char character, SourceLocation at) implements CompileError {
        @Override
        public String message() {
            return "Unrecognized character '" + character + "' at " + at;
        }

        @Override
        public Option<SourceLocation> location() {
            return Option.some(at);
        }

        @Override
        public Diagnostic toDiagnostic() {
            return Diagnostic.error("E0001", "unrecognized character '" + character + "'", SourceSpan.of(at, at.after(character)))
                             .withLabel("not part of any token")
                             .withHelp("only parentheses, digits, letters and double-quoted strings are allowed");
        }
    }

    /**
     * Input ended inside a string literal.
     */
    record UnterminatedString(SourceLocation at) implements CompileError {
        @Override
        public String message() {
            return "Unterminated string literal starting at " + at;
        }

        @Override
        public Option<SourceLocation> location() {
            return Option.some(at);
        }

        @Override
        public Diagnostic toDiagnostic() {
            return Diagnostic.error("E0002", "unterminated string literal", SourceSpan.of(at, at.after('"')))
                             .withLabel("string starts here")
                             .withHelp("add a closing '\"'");
        }
    }

    /**
     * Token that cannot appear where it was found.
     */
    record UnexpectedToken(TokenKind found, SourceLocation at, String expected) implements CompileError {
        @Override
        public String message() {
            return "Unexpected " + found.display() + " at " + at + ", expected " + expected;
        }

        @Override
        public Option<SourceLocation> location() {
            return Option.some(at);
        }

        @Override
        public Diagnostic toDiagnostic() {
            return Diagnostic.error("E0003", "unexpected " + found.display(), SourceSpan.at(at))
                             .withLabel("expected " + expected);
        }
    }

    /**
     * Tokens ran out inside a call.
     */
    record UnexpectedEndOfInput(SourceLocation at, String expected, SourceLocation openedAt) implements CompileError {
        @Override
        public String message() {
            return "Unexpected end of input at " + at + ", expected " + expected
                   + " to finish the call opened at " + openedAt;
        }

        @Override
        public Option<SourceLocation> location() {
            return Option.some(at);
        }

        @Override
        public Diagnostic toDiagnostic() {
            return Diagnostic.error("E0004", "unexpected end of input", SourceSpan.at(at))
                             .withLabel("expected " + expected)
                             .withSecondaryLabel(SourceSpan.of(openedAt, openedAt.after('(')), "call opened here");
        }
    }

    /**
     * Tree node of a kind the walking stage has no rule for.
     */
    record UnknownNodeKind(String kind) implements CompileError {
        @Override
        public String message() {
            return "Unknown node kind: " + kind;
        }

        @Override
        public Option<SourceLocation> location() {
            return Option.none();
        }

        @Override
        public Diagnostic toDiagnostic() {
            return Diagnostic.error("E0005", "unknown node kind '" + kind + "'", SourceSpan.at(SourceLocation.START))
                             .withNote("the tree was not produced by this compiler's parser or transformer");
        }
    }

    /**
     * Input longer than the configured limit.
     */
    record InputTooLarge(int size, int limit) implements CompileError {
        @Override
        public String message() {
            return "Input of " + size + " characters exceeds maximum size of " + limit + " characters";
        }

        @Override
        public Option<SourceLocation> location() {
            return Option.none();
        }

        @Override
        public Diagnostic toDiagnostic() {
            return Diagnostic.error("E0006", "input too large", SourceSpan.at(SourceLocation.START))
                             .withNote("input has " + size + " characters, limit is " + limit);
        }
    }

    /**
     * Calls nested deeper than the configured limit.
     */
    record NestingTooDeep(SourceLocation at, int limit) implements CompileError {
        @Override
        public String message() {
            return "Call at " + at + " nests deeper than the maximum of " + limit + " calls";
        }

        @Override
        public Option<SourceLocation> location() {
            return Option.some(at);
        }

        @Override
        public Diagnostic toDiagnostic() {
            return Diagnostic.error("E0007", "calls nested too deeply", SourceSpan.of(at, at.after('(')))
                             .withLabel("call nested too deeply")
                             .withNote("at most " + limit + " calls may be nested inside each other");
        }
    }
}
