package org.pragmatica.lisp2c.parser;

import org.pragmatica.lisp2c.lexer.Token;
import org.pragmatica.lisp2c.tree.SourceLocation;

import java.util.List;

/**
 * Mutable read position over a token list, shared by all recursive parser calls.
 */
public final class TokenCursor {
    private final List<Token> tokens;
    private final SourceLocation endLocation;
    private int pos;

    private TokenCursor(List<Token> tokens) {
        this.tokens = tokens;
        this.endLocation = tokens.isEmpty()
                           ? SourceLocation.START
                           : tokens.get(tokens.size() - 1).span().end();
        this.pos = 0;
    }

    public static TokenCursor over(List<Token> tokens) {
        return new TokenCursor(tokens);
    }

    int pos() {
        return pos;
    }

    public boolean isAtEnd() {
        return pos >= tokens.size();
    }

    /**
     * Current token. Callers check {@link #isAtEnd()} first.
     */
    public Token peek() {
        if (isAtEnd()) {
            throw new IllegalStateException("No token at position " + pos + " of " + tokens.size());
        }
        return tokens.get(pos);
    }

    public Token advance() {
        var token = peek();
        pos++;
        return token;
    }

    /**
     * Location of the current token, or the end of the last token once exhausted.
     */
    public SourceLocation location() {
        return isAtEnd()
               ? endLocation
               : tokens.get(pos).span().start();
    }
}
