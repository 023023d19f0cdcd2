package org.pragmatica.fnsyntax.parser;

import org.pragmatica.fnsyntax.tree.SyntaxNode;

import java.util.Objects;

/**
 * Syntax configuration: leading symbols of rebuilt forms and the metadata key a docstring is stored under.
 */
public record SyntaxConfig(
    String fnHead,
    String defnHead,
    String docKey
) {
    public static final SyntaxConfig DEFAULT = new SyntaxConfig(
        "fn",
        "defn",
        "doc"
    );

    public SyntaxConfig {
        Objects.requireNonNull(fnHead, "fnHead");
        Objects.requireNonNull(defnHead, "defnHead");
        Objects.requireNonNull(docKey, "docKey");
    }

    public SyntaxNode.Symbol fnSymbol() {
        return SyntaxNode.symbol(fnHead);
    }

    public SyntaxNode.Symbol defnSymbol() {
        return SyntaxNode.symbol(defnHead);
    }

    public SyntaxNode.Keyword docKeyword() {
        return SyntaxNode.keyword(docKey);
    }
}
