package org.pragmatica.lisp2c.tree;

/**
 * A position in source text (line and column are 1-based, offset is 0-based).
 */
public record SourceLocation(int line, int column, int offset) {

    public static final SourceLocation START = new SourceLocation(1, 1, 0);

    public static SourceLocation at(int line, int column, int offset) {
        return new SourceLocation(line, column, offset);
    }

    /**
     * Location right after the given character, which is assumed to sit at this location.
     */
    public SourceLocation after(char c) {
        return c == '\n'
               ? new SourceLocation(line + 1, 1, offset + 1)
               : new SourceLocation(line, column + 1, offset + 1);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
