package org.pragmatica.lisp2c.error;

import org.junit.jupiter.api.Test;
import org.pragmatica.lisp2c.LispToC;
import org.pragmatica.lisp2c.tree.SourceLocation;
import org.pragmatica.lisp2c.tree.SourceSpan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Rust-style rendering of compile errors.
 */
class DiagnosticTest {

    @Test
    void format_unrecognizedCharacter_pointsAtCharacter() {
        var source = "(add 2 #)";
        var diagnostic = LispToC.compile(source).getLeft().toDiagnostic();

        var expected = """
            error[E0001]: unrecognized character '#'
              --> input:1:8
              |
            1 | (add 2 #)
              |        ^ not part of any token
              |
              = help: only parentheses, digits, letters and double-quoted strings are allowed
            """;
        assertEquals(expected, diagnostic.format(source, null));
    }

    @Test
    void format_unclosedCall_labelsEndAndOpeningParen() {
        var source = "(add 2 (sub 4 2)";
        var diagnostic = LispToC.compile(source).getLeft().toDiagnostic();

        var expected = "error[E0004]: unexpected end of input\n"
                       + "  --> calc.lisp:1:17\n"
                       + "  |\n"
                       + "1 | (add 2 (sub 4 2)\n"
                       + "  | -" + " ".repeat(15) + "^ expected ')'\n"
                       + "  | call opened here\n"
                       + "  |\n";
        assertEquals(expected, diagnostic.format(source, "calc.lisp"));
    }

    @Test
    void format_errorSpanningLines_showsEveryLine() {
        var source = "(add 1\n  (f 2)";
        var diagnostic = LispToC.compile(source).getLeft().toDiagnostic();

        var formatted = diagnostic.format(source, null);

        assertThat(formatted).contains("  --> input:2:8\n")
                             .contains("1 | (add 1\n  | - call opened here\n")
                             .contains("2 |   (f 2)\n  |        ^ expected ')'\n");
    }

    @Test
    void format_unlabeledDiagnostic_underlinesSpan() {
        var span = SourceSpan.of(SourceLocation.at(1, 2, 1), SourceLocation.at(1, 5, 4));
        var diagnostic = Diagnostic.error("E0003", "unexpected name", span)
                                   .withNote("names only follow '('");

        var formatted = diagnostic.format("(add)", null);

        assertThat(formatted).contains("1 | (add)\n  |  ^^^\n")
                             .endsWith("  = names only follow '('\n");
    }

    @Test
    void formatSimple_isSingleLine() {
        var diagnostic = LispToC.compile("(add 2 #)").getLeft().toDiagnostic();

        assertEquals("input:1:8: error[E0001]: unrecognized character '#'", diagnostic.formatSimple());
    }

    @Test
    void builders_doNotModifyOriginal() {
        var original = Diagnostic.error("E0001", "message", SourceSpan.at(SourceLocation.START));

        var labeled = original.withLabel("label").withHelp("do this");

        assertTrue(original.labels().isEmpty());
        assertTrue(original.notes().isEmpty());
        assertEquals(1, labeled.labels().size());
        assertTrue(labeled.labels().get(0).primary());
        assertEquals("help: do this", labeled.notes().get(0));
    }
}
