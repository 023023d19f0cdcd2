package org.pragmatica.fnsyntax.reader;

/**
 * Token types for the form lexer.
 */
public sealed interface FormToken {
    SourceLocation location();

    /**
     * Symbol, keyword, number, boolean or nil; decoded by the reader.
     */
    record Atom(SourceLocation location, String text) implements FormToken {}

    record StringLiteral(SourceLocation location, String value) implements FormToken {}

    record CharLiteral(SourceLocation location, char value) implements FormToken {}

    // '
    record Quote(SourceLocation location) implements FormToken {}

    // (
    record LParen(SourceLocation location) implements FormToken {}

    // )
    record RParen(SourceLocation location) implements FormToken {}

    // [
    record LBracket(SourceLocation location) implements FormToken {}

    // ]
    record RBracket(SourceLocation location) implements FormToken {}

    // {
    record LBrace(SourceLocation location) implements FormToken {}

    // }
    record RBrace(SourceLocation location) implements FormToken {}

    record Eof(SourceLocation location) implements FormToken {}

    record Error(SourceLocation location, String message) implements FormToken {}
}
