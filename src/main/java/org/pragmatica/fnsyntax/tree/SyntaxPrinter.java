package org.pragmatica.fnsyntax.tree;

import java.util.List;

/**
 * Renders syntax trees back to host-language text.
 *
 * <p>Trees produced by {@link org.pragmatica.fnsyntax.reader.FormReader} print to text that reads back as an
 * equal tree. Hand-built trees carry no such guarantee: a symbol whose name contains whitespace or a
 * delimiter, or an opaque payload such as {@code Double.NaN} or an arbitrary object, prints as-is.
 */
public final class SyntaxPrinter {
    private static final int DEFAULT_CAPACITY = 64;

    private SyntaxPrinter() {}

    public static String print(SyntaxNode node) {
        var sb = new StringBuilder(DEFAULT_CAPACITY);
        append(sb, node);
        return sb.toString();
    }

    /**
     * Print a bare sequence of forms as a list, e.g. the remainder of a declaration.
     */
    public static String print(List<SyntaxNode> forms) {
        var sb = new StringBuilder(DEFAULT_CAPACITY);
        appendAll(sb, "(", forms, ")");
        return sb.toString();
    }

    private static void append(StringBuilder sb, SyntaxNode node) {
        if (node instanceof SyntaxNode.Symbol symbol) {
            sb.append(symbol.name());
        } else if (node instanceof SyntaxNode.Keyword keyword) {
            sb.append(':')
              .append(keyword.name());
        } else if (node instanceof SyntaxNode.Vector vector) {
            appendAll(sb, "[", vector.items(), "]");
        } else if (node instanceof SyntaxNode.ListForm list) {
            appendAll(sb, "(", list.items(), ")");
        } else if (node instanceof SyntaxNode.Mapping mapping) {
            appendMapping(sb, mapping);
        } else if (node instanceof SyntaxNode.StringLiteral string) {
            appendString(sb, string.value());
        } else if (node instanceof SyntaxNode.Opaque opaque) {
            appendOpaque(sb, opaque.payload());
        }
    }

    private static void appendAll(StringBuilder sb, String open, List<SyntaxNode> items, String close) {
        sb.append(open);
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) {
                sb.append(' ');
            }
            append(sb, items.get(i));
        }
        sb.append(close);
    }

    private static void appendMapping(StringBuilder sb, SyntaxNode.Mapping mapping) {
        sb.append('{');
        var entries = mapping.entries();
        for (int i = 0; i < entries.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            append(sb, entries.get(i).key());
            sb.append(' ');
            append(sb, entries.get(i).value());
        }
        sb.append('}');
    }

    private static void appendString(StringBuilder sb, String value) {
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                default -> sb.append(c);
            }
        }
        sb.append('"');
    }

    private static void appendOpaque(StringBuilder sb, Object payload) {
        if (payload instanceof Character c) {
            sb.append('\\')
              .append(characterName(c));
        } else {
            sb.append(payload);
        }
    }

    private static String characterName(char c) {
        return switch (c) {
            case ' ' -> "space";
            case '\n' -> "newline";
            case '\t' -> "tab";
            case '\r' -> "return";
            default -> Character.isWhitespace(c) || Character.isISOControl(c)
                       ? String.format("u%04x", (int) c)
                       : String.valueOf(c);
        };
    }
}
