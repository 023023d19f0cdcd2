package org.pragmatica.fnsyntax.parser;

import io.vavr.control.Option;
import org.pragmatica.fnsyntax.tree.SyntaxNode;

import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Disassembled function literal: optional name and one or more clauses.
 */
public record ParsedFn(
    Option<SyntaxNode.Symbol> name,
    List<Clause> clauses
) {
    public ParsedFn {
        Objects.requireNonNull(name, "name");
        clauses = List.copyOf(clauses);
        if (clauses.isEmpty()) {
            throw new IllegalArgumentException("Function literal requires at least one clause");
        }
    }

    public static ParsedFn anonymous(Clause... clauses) {
        return new ParsedFn(Option.none(), List.of(clauses));
    }

    public boolean isSingleClause() {
        return clauses.size() == 1;
    }

    public List<Integer> arities() {
        return clauses.stream()
                      .map(Clause::arity)
                      .collect(Collectors.toList());
    }

    public ParsedFn withName(Option<SyntaxNode.Symbol> newName) {
        return new ParsedFn(newName, clauses);
    }

    public ParsedFn mapClauses(UnaryOperator<Clause> transform) {
        return new ParsedFn(name,
                            clauses.stream()
                                   .map(transform)
                                   .collect(Collectors.toList()));
    }
}
