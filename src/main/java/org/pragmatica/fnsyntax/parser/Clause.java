package org.pragmatica.fnsyntax.parser;

import io.vavr.control.Option;
import org.pragmatica.fnsyntax.tree.SyntaxNode;

import java.util.List;
import java.util.Objects;

/**
 * One arity variant of a definition: {@code ([params] {prepost}? body...)}.
 */
public record Clause(
    SyntaxNode.Vector params,
    Option<SyntaxNode.Mapping> prepost,
    List<SyntaxNode> body
) {
    private static final SyntaxNode.Symbol VARIADIC_MARKER = SyntaxNode.symbol("&");

    public Clause {
        Objects.requireNonNull(params, "params");
        Objects.requireNonNull(prepost, "prepost");
        body = List.copyOf(body);
    }

    public static Clause of(SyntaxNode.Vector params, SyntaxNode... body) {
        return new Clause(params, Option.none(), List.of(body));
    }

    public Clause withBody(List<SyntaxNode> newBody) {
        return new Clause(params, prepost, newBody);
    }

    public Clause withPrepost(Option<SyntaxNode.Mapping> newPrepost) {
        return new Clause(params, newPrepost, body);
    }

    /**
     * Number of fixed parameters, not counting {@code &} and the rest binder after it.
     */
    public int arity() {
        var index = params.items()
                          .indexOf(VARIADIC_MARKER);
        return index < 0
               ? params.items()
                       .size()
               : index;
    }

    public boolean isVariadic() {
        return params.items()
                     .contains(VARIADIC_MARKER);
    }

    /**
     * Forms of this clause in source order: params, prepost when present, then body.
     */
    public List<SyntaxNode> toForms() {
        return ClauseParser.build(this);
    }
}
