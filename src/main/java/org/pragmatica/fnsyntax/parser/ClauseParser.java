package org.pragmatica.fnsyntax.parser;

import io.vavr.control.Either;
import org.pragmatica.fnsyntax.error.FnSyntaxError;
import org.pragmatica.fnsyntax.tree.SyntaxNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses and rebuilds a single {@code [params] {prepost}? body...} clause.
 */
public final class ClauseParser {
    private ClauseParser() {}

    /**
     * Parse the forms of one clause. {@code shape} selects the error wording when the parameter
     * declaration is not a vector: the parameter token itself ({@code nil} when absent) for multi-clause
     * declarations, the whole signature for single-clause ones.
     */
    public static Either<FnSyntaxError, Clause> parse(List<SyntaxNode> signature, ClauseShape shape) {
        if (signature.isEmpty()) {
            var offending = shape == ClauseShape.MULTI_CLAUSE
                            ? SyntaxNode.Opaque.NIL
                            : new SyntaxNode.ListForm(signature);
            return Either.left(new FnSyntaxError.MalformedSignature(shape.signatureVariant(), offending));
        }
        var first = signature.get(0);
        if (!(first instanceof SyntaxNode.Vector params)) {
            var offending = shape == ClauseShape.MULTI_CLAUSE
                            ? first
                            : new SyntaxNode.ListForm(signature);
            return Either.left(new FnSyntaxError.MalformedSignature(shape.signatureVariant(), offending));
        }
        var prepost = Prefix.optional(signature.subList(1, signature.size()), SyntaxNode.Mapping.class);
        return Either.right(new Clause(params, prepost.value(), prepost.rest()));
    }

    /**
     * Inverse of {@link #parse}: {@code [params] ++ [prepost if present] ++ body}.
     */
    public static List<SyntaxNode> build(Clause clause) {
        var forms = new ArrayList<SyntaxNode>(clause.body()
                                                    .size() + 2);
        forms.add(clause.params());
        clause.prepost()
              .forEach(forms::add);
        forms.addAll(clause.body());
        return List.copyOf(forms);
    }
}
