package org.pragmatica.fnsyntax.reader;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Lexer for host-language forms.
 */
public final class FormLexer {
    private static final int MAX_INPUT_SIZE = 1_000_000;
    private static final int DEFAULT_TOKEN_CAPACITY = 32;
    private static final Map<String, Character> NAMED_CHARACTERS = Map.of(
        "space", ' ',
        "newline", '\n',
        "tab", '\t',
        "return", '\r');
    private static final Pattern UNICODE_ESCAPE = Pattern.compile("u[0-9a-fA-F]{4}");

    private final String input;
    private int pos;
    private int line;
    private int column;

    private FormLexer(String input) {
        this.input = input;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
    }

    public static List<FormToken> tokenize(String input) {
        if (input.length() > MAX_INPUT_SIZE) {
            throw new IllegalArgumentException(
            "Form input exceeds maximum size of " + MAX_INPUT_SIZE + " characters");
        }
        return new FormLexer(input).tokenizeAll();
    }

    private List<FormToken> tokenizeAll() {
        var tokens = new ArrayList<FormToken>();
        while (!isAtEnd()) {
            skipWhitespaceAndComments();
            if (!isAtEnd()) {
                tokens.add(nextToken());
            }
        }
        tokens.add(new FormToken.Eof(currentLocation()));
        return tokens;
    }

    private FormToken nextToken() {
        var start = currentLocation();
        char c = peek();
        if (c == '"') {
            return scanString(start);
        }
        if (c == '\\') {
            return scanCharacter(start);
        }
        if (isUnsupportedPrefix(c)) {
            advance();
            return new FormToken.Error(start, "Unsupported reader syntax: " + c);
        }
        if (isDelimiter(c) || c == '\'') {
            advance();
            return switch (c) {
                case '(' -> new FormToken.LParen(start);
                case ')' -> new FormToken.RParen(start);
                case '[' -> new FormToken.LBracket(start);
                case ']' -> new FormToken.RBracket(start);
                case '{' -> new FormToken.LBrace(start);
                case '}' -> new FormToken.RBrace(start);
                case '\'' -> new FormToken.Quote(start);
                default -> new FormToken.Error(start, "Unexpected character: " + c);
            };
        }
        return scanAtom(start);
    }

    private FormToken scanAtom(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && !isWhitespace(peek()) && !isDelimiter(peek()) && peek() != '"' && peek() != ';') {
            sb.append(advance());
        }
        return new FormToken.Atom(start, sb.toString());
    }

    private FormToken scanString(SourceLocation start) {
        advance();
        // skip opening quote
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && peek() != '"') {
            if (peek() == '\\') {
                advance();
                if (isAtEnd()) {
                    break;
                }
                char escaped = advance();
                switch (escaped) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    case '"' -> sb.append('"');
                    case '\\' -> sb.append('\\');
                    default -> {
                        return new FormToken.Error(start, "Unsupported escape sequence: \\" + escaped);
                    }
                }
            } else {
                sb.append(advance());
            }
        }
        if (isAtEnd()) {
            return new FormToken.Error(start, "Unterminated string literal");
        }
        advance();
        // skip closing quote
        return new FormToken.StringLiteral(start, sb.toString());
    }

    private FormToken scanCharacter(SourceLocation start) {
        advance();
        // skip backslash
        if (isAtEnd()) {
            return new FormToken.Error(start, "Incomplete character literal");
        }
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        sb.append(advance());
        while (!isAtEnd() && Character.isLetterOrDigit(peek())) {
            sb.append(advance());
        }
        var name = sb.toString();
        if (name.length() == 1) {
            return new FormToken.CharLiteral(start, name.charAt(0));
        }
        if (UNICODE_ESCAPE.matcher(name)
                          .matches()) {
            return new FormToken.CharLiteral(start, (char) Integer.parseInt(name.substring(1), 16));
        }
        var named = NAMED_CHARACTERS.get(name);
        if (named == null) {
            return new FormToken.Error(start, "Unsupported character: \\" + name);
        }
        return new FormToken.CharLiteral(start, named);
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (isWhitespace(c)) {
                advance();
            } else if (c == ';') {
                // Line comment
                while (!isAtEnd() && peek() != '\n') {
                    advance();
                }
            } else {
                break;
            }
        }
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char advance() {
        char c = input.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private SourceLocation currentLocation() {
        return new SourceLocation(line, column);
    }

    // Commas are whitespace in forms
    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\n' || c == ',';
    }

    // Dispatch, metadata, syntax-quote, unquote and deref forms are not read
    private static boolean isUnsupportedPrefix(char c) {
        return c == '#' || c == '^' || c == '`' || c == '~' || c == '@';
    }

    private static boolean isDelimiter(char c) {
        return c == '(' || c == ')' || c == '[' || c == ']' || c == '{' || c == '}';
    }
}
