package org.pragmatica.fnsyntax.reader;

/**
 * A position in source text (line and column, both 1-based).
 */
public record SourceLocation(int line, int column) {

    public static final SourceLocation START = new SourceLocation(1, 1);

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
