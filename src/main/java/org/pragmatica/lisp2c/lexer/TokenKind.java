package org.pragmatica.lisp2c.lexer;

/**
 * Kinds of tokens produced by the {@link Lexer}.
 */
public enum TokenKind {
    OPEN_PAREN("'('"),
    CLOSE_PAREN("')'"),
    NUMBER("number"),
    STRING("string"),
    NAME("name");

    private final String display;

    TokenKind(String display) {
        this.display = display;
    }

    public String display() {
        return display;
    }
}
