package org.pragmatica.fnsyntax.parser;

import io.vavr.control.Option;
import org.pragmatica.fnsyntax.tree.SyntaxNode;

import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Disassembled named definition. A docstring given in source is folded into {@code metadata}.
 */
public record ParsedDefn(
    SyntaxNode.Symbol name,
    SyntaxNode.Mapping metadata,
    List<Clause> clauses
) {
    public ParsedDefn {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(metadata, "metadata");
        clauses = List.copyOf(clauses);
        if (clauses.isEmpty()) {
            throw new IllegalArgumentException("Named definition requires at least one clause");
        }
    }

    /**
     * Docstring stored under the default {@code :doc} key.
     */
    public Option<String> docstring() {
        return docstring(SyntaxConfig.DEFAULT.docKeyword());
    }

    public Option<String> docstring(SyntaxNode.Keyword docKey) {
        return metadata.get(docKey)
                       .filter(SyntaxNode.StringLiteral.class::isInstance)
                       .map(node -> ((SyntaxNode.StringLiteral) node).value());
    }

    public ParsedDefn withMetadata(SyntaxNode.Mapping newMetadata) {
        return new ParsedDefn(name, newMetadata, clauses);
    }

    public ParsedDefn mapClauses(UnaryOperator<Clause> transform) {
        return new ParsedDefn(name,
                              metadata,
                              clauses.stream()
                                     .map(transform)
                                     .collect(Collectors.toList()));
    }

    /**
     * Same clauses as a named function literal. Metadata is dropped.
     */
    public ParsedFn toFn() {
        return new ParsedFn(Option.some(name), clauses);
    }
}
