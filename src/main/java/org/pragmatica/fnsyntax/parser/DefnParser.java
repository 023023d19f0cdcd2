package org.pragmatica.fnsyntax.parser;

import io.vavr.control.Either;
import io.vavr.control.Option;
import org.pragmatica.fnsyntax.error.FnSyntaxError;
import org.pragmatica.fnsyntax.tree.SyntaxNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses and rebuilds named definitions: {@code (defn name "doc"? {meta}? clauses...)}.
 */
public final class DefnParser {
    private final SyntaxConfig config;

    private DefnParser(SyntaxConfig config) {
        this.config = config;
    }

    public static DefnParser create(SyntaxConfig config) {
        return new DefnParser(config);
    }

    /**
     * Parse the arguments of a named definition, i.e. everything after the leading {@code defn}.
     */
    public Either<FnSyntaxError, ParsedDefn> parse(List<SyntaxNode> forms) {
        if (forms.isEmpty()) {
            return Either.left(new FnSyntaxError.MissingName(Option.none()));
        }
        if (!(forms.get(0) instanceof SyntaxNode.Symbol name)) {
            return Either.left(new FnSyntaxError.MissingName(Option.some(forms.get(0))));
        }
        var doc = Prefix.extract(forms.subList(1, forms.size()),
                                 docstring -> SyntaxNode.mapping(config.docKeyword(), docstring),
                                 SyntaxNode.StringLiteral.class::isInstance,
                                 SyntaxNode.Mapping.EMPTY);
        var metadata = Prefix.extract(doc.rest(),
                                      attributes -> doc.value()
                                                       .merge((SyntaxNode.Mapping) attributes),
                                      SyntaxNode.Mapping.class::isInstance,
                                      doc.value());
        return FnParser.parseClauses(metadata.rest())
                       .map(clauses -> new ParsedDefn(name, metadata.value(), clauses));
    }

    /**
     * Rebuild {@code (defn name {metadata}? clauses...)}. Metadata is always emitted as one mapping,
     * a docstring is not split back out.
     */
    public SyntaxNode.ListForm build(ParsedDefn defn) {
        var forms = new ArrayList<SyntaxNode>();
        forms.add(config.defnSymbol());
        forms.add(defn.name());
        if (!defn.metadata()
                 .isEmpty()) {
            forms.add(defn.metadata());
        }
        forms.addAll(FnParser.buildClauses(defn.clauses()));
        return new SyntaxNode.ListForm(forms);
    }
}
