package org.pragmatica.fnsyntax.reader;

import io.vavr.control.Either;
import org.pragmatica.fnsyntax.error.ReadError;
import org.pragmatica.fnsyntax.tree.SyntaxNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reads host-language source text into syntax trees.
 *
 * <p>Example usage:
 * <pre>{@code
 * var form = FormReader.read("(fn [x] (+ x 1))").get();
 * }</pre>
 */
public final class FormReader {
    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?\\d+\\.\\d+([eE][+-]?\\d+)?");

    private final List<FormToken> tokens;
    private int pos;

    private FormReader(List<FormToken> tokens) {
        this.tokens = tokens;
        this.pos = 0;
    }

    /**
     * Read exactly one form.
     */
    public static Either<ReadError, SyntaxNode> read(String text) {
        var reader = new FormReader(FormLexer.tokenize(text));
        if (reader.peek() instanceof FormToken.Eof eof) {
            return Either.left(new ReadError.UnexpectedEof(eof.location(), "form"));
        }
        var form = reader.readForm();
        if (form.isLeft()) {
            return form;
        }
        var trailing = reader.peek();
        if (!(trailing instanceof FormToken.Eof)) {
            return Either.left(new ReadError.UnexpectedInput(trailing.location(),
                                                             describe(trailing),
                                                             "end of input"));
        }
        return form;
    }

    /**
     * Read every form in the text, in order.
     */
    public static Either<ReadError, List<SyntaxNode>> readAll(String text) {
        var reader = new FormReader(FormLexer.tokenize(text));
        var forms = new ArrayList<SyntaxNode>();
        while (!(reader.peek() instanceof FormToken.Eof)) {
            var form = reader.readForm();
            if (form.isLeft()) {
                return Either.left(form.getLeft());
            }
            forms.add(form.get());
        }
        return Either.right(List.copyOf(forms));
    }

    private Either<ReadError, SyntaxNode> readForm() {
        var token = advance();

        if (token instanceof FormToken.Atom atom) {
            return decodeAtom(atom);
        }
        if (token instanceof FormToken.StringLiteral string) {
            return Either.right(SyntaxNode.string(string.value()));
        }
        if (token instanceof FormToken.CharLiteral character) {
            return Either.right(SyntaxNode.opaque(character.value()));
        }
        if (token instanceof FormToken.Quote) {
            return readQuoted(token.location());
        }
        if (token instanceof FormToken.LParen) {
            return readSequence(FormToken.RParen.class, "')'").<SyntaxNode>map(SyntaxNode.ListForm::new);
        }
        if (token instanceof FormToken.LBracket) {
            return readSequence(FormToken.RBracket.class, "']'").<SyntaxNode>map(SyntaxNode.Vector::new);
        }
        if (token instanceof FormToken.LBrace) {
            return readMapping(token.location());
        }
        if (token instanceof FormToken.Error error) {
            return Either.left(new ReadError.InvalidToken(error.location(), error.message()));
        }
        if (token instanceof FormToken.Eof eof) {
            return Either.left(new ReadError.UnexpectedEof(eof.location(), "form"));
        }
        return Either.left(new ReadError.UnexpectedInput(token.location(), describe(token), "form"));
    }

    private Either<ReadError, SyntaxNode> readQuoted(SourceLocation location) {
        if (peek() instanceof FormToken.Eof eof) {
            return Either.left(new ReadError.UnexpectedEof(eof.location(), "form after quote at " + location));
        }
        return readForm().<SyntaxNode>map(quoted -> SyntaxNode.list(SyntaxNode.symbol("quote"), quoted));
    }

    private Either<ReadError, List<SyntaxNode>> readSequence(Class<? extends FormToken> closing, String expected) {
        var items = new ArrayList<SyntaxNode>();
        while (!closing.isInstance(peek())) {
            if (peek() instanceof FormToken.Eof eof) {
                return Either.left(new ReadError.UnexpectedEof(eof.location(), expected));
            }
            var item = readForm();
            if (item.isLeft()) {
                return Either.left(item.getLeft());
            }
            items.add(item.get());
        }
        advance();
        // skip closing delimiter
        return Either.right(items);
    }

    private Either<ReadError, SyntaxNode> readMapping(SourceLocation start) {
        var items = readSequence(FormToken.RBrace.class, "'}'");
        if (items.isLeft()) {
            return Either.left(items.getLeft());
        }
        var forms = items.get();
        if (forms.size() % 2 != 0) {
            return Either.left(new ReadError.InvalidMap(start, "odd number of forms (" + forms.size() + ")"));
        }
        var entries = new ArrayList<SyntaxNode.Mapping.Entry>(forms.size() / 2);
        var keys = new HashSet<SyntaxNode>();
        for (int i = 0; i < forms.size(); i += 2) {
            var key = forms.get(i);
            if (!keys.add(key)) {
                return Either.left(new ReadError.InvalidMap(start, "duplicate key " + key));
            }
            entries.add(new SyntaxNode.Mapping.Entry(key, forms.get(i + 1)));
        }
        return Either.right(new SyntaxNode.Mapping(entries));
    }

    private Either<ReadError, SyntaxNode> decodeAtom(FormToken.Atom atom) {
        var text = atom.text();
        switch (text) {
            case "nil":
                return Either.right(SyntaxNode.Opaque.NIL);
            case "true":
                return Either.right(SyntaxNode.opaque(Boolean.TRUE));
            case "false":
                return Either.right(SyntaxNode.opaque(Boolean.FALSE));
            default:
                break;
        }
        if (INTEGER.matcher(text)
                   .matches()) {
            try{
                return Either.right(SyntaxNode.opaque(Long.parseLong(text)));
            } catch (NumberFormatException e) {
                return Either.left(new ReadError.InvalidToken(atom.location(), "Integer out of range: " + text));
            }
        }
        if (DECIMAL.matcher(text)
                   .matches()) {
            return Either.right(SyntaxNode.opaque(Double.parseDouble(text)));
        }
        if (text.startsWith(":")) {
            if (text.length() == 1) {
                return Either.left(new ReadError.InvalidToken(atom.location(), "Keyword without a name"));
            }
            return Either.right(SyntaxNode.keyword(text.substring(1)));
        }
        return Either.right(SyntaxNode.symbol(text));
    }

    private FormToken peek() {
        return tokens.get(pos);
    }

    private FormToken advance() {
        var token = tokens.get(pos);
        if (!(token instanceof FormToken.Eof)) {
            pos++;
        }
        return token;
    }

    private static String describe(FormToken token) {
        if (token instanceof FormToken.Atom atom) {
            return atom.text();
        }
        if (token instanceof FormToken.StringLiteral string) {
            return "\"" + string.value() + "\"";
        }
        if (token instanceof FormToken.CharLiteral character) {
            return "\\" + character.value();
        }
        if (token instanceof FormToken.Quote) {
            return "'";
        }
        if (token instanceof FormToken.LParen) {
            return "(";
        }
        if (token instanceof FormToken.RParen) {
            return ")";
        }
        if (token instanceof FormToken.LBracket) {
            return "[";
        }
        if (token instanceof FormToken.RBracket) {
            return "]";
        }
        if (token instanceof FormToken.LBrace) {
            return "{";
        }
        if (token instanceof FormToken.RBrace) {
            return "}";
        }
        if (token instanceof FormToken.Error error) {
            return error.message();
        }
        return "end of input";
    }
}
