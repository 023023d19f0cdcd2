package org.pragmatica.fnsyntax;

import io.vavr.control.Either;
import org.pragmatica.fnsyntax.error.FnSyntaxError;
import org.pragmatica.fnsyntax.error.FnSyntaxException;
import org.pragmatica.fnsyntax.error.ReadError;
import org.pragmatica.fnsyntax.parser.DefnParser;
import org.pragmatica.fnsyntax.parser.FnParser;
import org.pragmatica.fnsyntax.parser.ParsedDefn;
import org.pragmatica.fnsyntax.parser.ParsedFn;
import org.pragmatica.fnsyntax.parser.SyntaxConfig;
import org.pragmatica.fnsyntax.reader.FormReader;
import org.pragmatica.fnsyntax.tree.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Entry point for taking apart and rebuilding function literals and named definitions.
 *
 * <p>Example usage:
 * <pre>{@code
 * var syntax = FnSyntax.create();
 *
 * var defn = syntax.readDefn("(defn inc \"Adds one\" [x] (+ x 1))");
 * var rebuilt = syntax.buildDefn(defn.mapClauses(clause -> clause.withBody(newBody)));
 * }</pre>
 */
public final class FnSyntax {
    private static final Logger log = LoggerFactory.getLogger(FnSyntax.class);

    private final SyntaxConfig config;
    private final FnParser fnParser;
    private final DefnParser defnParser;

    private FnSyntax(SyntaxConfig config) {
        this.config = config;
        this.fnParser = FnParser.create(config);
        this.defnParser = DefnParser.create(config);
    }

    public static FnSyntax create() {
        return create(SyntaxConfig.DEFAULT);
    }

    public static FnSyntax create(SyntaxConfig config) {
        return new FnSyntax(config);
    }

    public static Builder builder() {
        return new Builder();
    }

    public SyntaxConfig config() {
        return config;
    }

    // === Function literals ===

    /**
     * Parse the arguments of a function literal (everything after {@code fn}).
     */
    public Either<FnSyntaxError, ParsedFn> parseFn(List<SyntaxNode> forms) {
        return fnParser.parse(forms)
                       .peek(fn -> log.debug("Parsed function literal {} with {} clause(s)",
                                             fn.name()
                                               .map(SyntaxNode.Symbol::name)
                                               .getOrElse("<anonymous>"),
                                             fn.clauses()
                                               .size()))
                       .peekLeft(FnSyntax::logFailure);
    }

    /**
     * Parse a whole {@code (fn ...)} form. The head is dropped without being checked.
     */
    public Either<FnSyntaxError, ParsedFn> parseFnForm(SyntaxNode.ListForm form) {
        return parseFn(form.tail());
    }

    public ParsedFn parseFnOrThrow(List<SyntaxNode> forms) {
        return parseFn(forms).getOrElseThrow(FnSyntaxError::asException);
    }

    public SyntaxNode.ListForm buildFn(ParsedFn fn) {
        var form = fnParser.build(fn);
        log.debug("Built function literal with {} clause(s)",
                  fn.clauses()
                    .size());
        return form;
    }

    /**
     * Read a {@code (fn ...)} form from text and parse it.
     *
     * @throws FnSyntaxException if the text cannot be read or the form is malformed
     */
    public ParsedFn readFn(String text) {
        return parseFnForm(readList(text)).getOrElseThrow(FnSyntaxError::asException);
    }

    // === Named definitions ===

    /**
     * Parse the arguments of a named definition (everything after {@code defn}).
     */
    public Either<FnSyntaxError, ParsedDefn> parseDefn(List<SyntaxNode> forms) {
        return defnParser.parse(forms)
                         .peek(defn -> log.debug("Parsed definition {} with {} clause(s)",
                                                 defn.name()
                                                     .name(),
                                                 defn.clauses()
                                                     .size()))
                         .peekLeft(FnSyntax::logFailure);
    }

    /**
     * Parse a whole {@code (defn ...)} form. The head is dropped without being checked.
     */
    public Either<FnSyntaxError, ParsedDefn> parseDefnForm(SyntaxNode.ListForm form) {
        return parseDefn(form.tail());
    }

    public ParsedDefn parseDefnOrThrow(List<SyntaxNode> forms) {
        return parseDefn(forms).getOrElseThrow(FnSyntaxError::asException);
    }

    public SyntaxNode.ListForm buildDefn(ParsedDefn defn) {
        var form = defnParser.build(defn);
        log.debug("Built definition {} with {} clause(s)",
                  defn.name()
                      .name(),
                  defn.clauses()
                      .size());
        return form;
    }

    /**
     * Read a {@code (defn ...)} form from text and parse it.
     *
     * @throws FnSyntaxException if the text cannot be read or the form is malformed
     */
    public ParsedDefn readDefn(String text) {
        return parseDefnForm(readList(text)).getOrElseThrow(FnSyntaxError::asException);
    }

    private static SyntaxNode.ListForm readList(String text) {
        var form = FormReader.read(text)
                             .getOrElseThrow(ReadError::asException);
        if (!(form instanceof SyntaxNode.ListForm list)) {
            throw FnSyntaxException.invalidArgument("expected a list form, got `" + form + "`");
        }
        return list;
    }

    private static void logFailure(FnSyntaxError error) {
        log.debug("Rejected definition form: {}", error.message());
    }

    public static final class Builder {
        private String fnHead = SyntaxConfig.DEFAULT.fnHead();
        private String defnHead = SyntaxConfig.DEFAULT.defnHead();
        private String docKey = SyntaxConfig.DEFAULT.docKey();

        private Builder() {}

        public Builder fnHead(String head) {
            this.fnHead = head;
            return this;
        }

        public Builder defnHead(String head) {
            this.defnHead = head;
            return this;
        }

        public Builder docKey(String key) {
            this.docKey = key;
            return this;
        }

        public FnSyntax build() {
            return create(new SyntaxConfig(fnHead, defnHead, docKey));
        }
    }
}
