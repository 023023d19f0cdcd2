package org.pragmatica.fnsyntax.parser;

import io.vavr.control.Either;
import org.pragmatica.fnsyntax.error.FnSyntaxError;
import org.pragmatica.fnsyntax.tree.SyntaxNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses and rebuilds function literals: {@code (fn name? [params] body...)} or
 * {@code (fn name? ([params] body...)+)}.
 */
public final class FnParser {
    private final SyntaxConfig config;

    private FnParser(SyntaxConfig config) {
        this.config = config;
    }

    public static FnParser create(SyntaxConfig config) {
        return new FnParser(config);
    }

    /**
     * Parse the arguments of a function literal, i.e. everything after the leading {@code fn}.
     */
    public Either<FnSyntaxError, ParsedFn> parse(List<SyntaxNode> forms) {
        var name = Prefix.optional(forms, SyntaxNode.Symbol.class);
        return parseClauses(name.rest()).map(clauses -> new ParsedFn(name.value(), clauses));
    }

    /**
     * Rebuild {@code (fn name? clauses...)}.
     */
    public SyntaxNode.ListForm build(ParsedFn fn) {
        var forms = new ArrayList<SyntaxNode>();
        forms.add(config.fnSymbol());
        fn.name()
          .forEach(forms::add);
        forms.addAll(buildClauses(fn.clauses()));
        return new SyntaxNode.ListForm(forms);
    }

    /**
     * Resolve the single-clause/multi-clause layout of the forms following the name and parse every
     * clause with that one layout.
     */
    static Either<FnSyntaxError, List<Clause>> parseClauses(List<SyntaxNode> rest) {
        if (rest.isEmpty()) {
            return Either.left(new FnSyntaxError.MissingParameters());
        }
        var first = rest.get(0);
        if (first instanceof SyntaxNode.Vector) {
            return ClauseParser.parse(rest, ClauseShape.SINGLE_CLAUSE)
                               .map(clause -> List.of(clause));
        }
        if (!(first instanceof SyntaxNode.ListForm)) {
            return Either.left(new FnSyntaxError.MissingParameters());
        }
        var clauses = new ArrayList<Clause>(rest.size());
        for (var form : rest) {
            if (!(form instanceof SyntaxNode.ListForm signature)) {
                return Either.left(new FnSyntaxError.MalformedSignature(ClauseShape.MULTI_CLAUSE.signatureVariant(),
                                                                        parameterSlot(form)));
            }
            var clause = ClauseParser.parse(signature.items(), ClauseShape.MULTI_CLAUSE);
            if (clause.isLeft()) {
                return Either.left(clause.getLeft());
            }
            clauses.add(clause.get());
        }
        return Either.right(List.copyOf(clauses));
    }

    /**
     * What sits in the parameter position of a clause that is not a list: the first item of a vector
     * ({@code nil} if empty), otherwise the form itself.
     */
    private static SyntaxNode parameterSlot(SyntaxNode form) {
        if (form instanceof SyntaxNode.Vector vector) {
            return vector.isEmpty()
                   ? SyntaxNode.Opaque.NIL
                   : vector.items()
                           .get(0);
        }
        return form;
    }

    /**
     * A single clause is spliced in place; multiple clauses are each wrapped in their own list.
     */
    static List<SyntaxNode> buildClauses(List<Clause> clauses) {
        if (clauses.size() == 1) {
            return ClauseParser.build(clauses.get(0));
        }
        var forms = new ArrayList<SyntaxNode>(clauses.size());
        for (var clause : clauses) {
            forms.add(new SyntaxNode.ListForm(ClauseParser.build(clause)));
        }
        return List.copyOf(forms);
    }
}
