package org.pragmatica.fnsyntax.reader;

import org.junit.jupiter.api.Test;
import org.pragmatica.fnsyntax.error.ReadError;
import org.pragmatica.fnsyntax.tree.SyntaxNode;
import org.pragmatica.fnsyntax.tree.SyntaxPrinter;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.pragmatica.fnsyntax.tree.SyntaxNode.*;

class FormReaderTest {

    // === Atoms ===

    @Test
    void read_symbol() {
        assertEquals(symbol("hello-world?"), FormReader.read("hello-world?").get());
        assertEquals(symbol("+"), FormReader.read("+").get());
        assertEquals(symbol("&"), FormReader.read("&").get());
    }

    @Test
    void read_keyword() {
        assertEquals(keyword("private"), FormReader.read(":private").get());
    }

    @Test
    void read_numbers() {
        assertEquals(opaque(42L), FormReader.read("42").get());
        assertEquals(opaque(-17L), FormReader.read("-17").get());
        assertEquals(opaque(2.5), FormReader.read("2.5").get());
    }

    @Test
    void read_booleansAndNil() {
        assertEquals(opaque(true), FormReader.read("true").get());
        assertEquals(opaque(false), FormReader.read("false").get());
        assertEquals(Opaque.NIL, FormReader.read("nil").get());
    }

    @Test
    void read_string_withEscapes() {
        assertEquals(string("a \"quoted\"\nline\t\\"), FormReader.read("\"a \\\"quoted\\\"\\nline\\t\\\\\"").get());
    }

    @Test
    void read_characters() {
        assertEquals(opaque('a'), FormReader.read("\\a").get());
        assertEquals(opaque(' '), FormReader.read("\\space").get());
    }

    // === Composites ===

    @Test
    void read_nestedList() {
        assertEquals(list(symbol("+"), list(symbol("*"), opaque(2L), opaque(3L)), opaque(4L)),
                     FormReader.read("(+ (* 2 3) 4)").get());
    }

    @Test
    void read_vectorAndMapping() {
        var form = FormReader.read("[{:keys [a b]} c]").get();

        assertEquals(vector(mapping(keyword("keys"), vector(symbol("a"), symbol("b"))), symbol("c")), form);
    }

    @Test
    void read_commasAndComments_areWhitespace() {
        var form = FormReader.read("""
            ; leading comment
            {:a 1, :b 2} ; trailing comment
            """).get();

        assertEquals(mapping(keyword("a"), opaque(1L), keyword("b"), opaque(2L)), form);
    }

    @Test
    void read_quote_expandsToQuoteForm() {
        assertEquals(list(symbol("quote"), list(vector(symbol("x")))), FormReader.read("'([x])").get());
    }

    @Test
    void readAll_returnsFormsInOrder() {
        var forms = FormReader.readAll("f \"doc\" [x] x").get();

        assertEquals(List.of(symbol("f"), string("doc"), vector(symbol("x")), symbol("x")), forms);
    }

    @Test
    void readAll_emptyInput_returnsNoForms() {
        assertTrue(FormReader.readAll("  ; nothing here\n")
                             .get()
                             .isEmpty());
    }

    @Test
    void read_printedForm_yieldsEqualTree() {
        var text = "(defn f {:doc \"d\\n\", :private true} ([] nil) ([a & more] (apply str \\a 1.5 more)))";

        var form = FormReader.read(text).get();

        assertEquals(text, SyntaxPrinter.print(form));
        assertEquals(form, FormReader.read(SyntaxPrinter.print(form)).get());
    }

    // === Errors ===

    @Test
    void read_emptyInput_failsWithUnexpectedEof() {
        var error = FormReader.read("   ").getLeft();

        assertInstanceOf(ReadError.UnexpectedEof.class, error);
    }

    @Test
    void read_unterminatedList_reportsEndLocation() {
        var error = FormReader.read("(a\n  b").getLeft();

        var eof = assertInstanceOf(ReadError.UnexpectedEof.class, error);
        assertEquals(new SourceLocation(2, 4), eof.location());
        assertEquals("Form text ends at 2:4 before ')'", error.message());
    }

    @Test
    void read_strayClosingParen_failsWithUnexpectedInput() {
        var error = FormReader.read(")").getLeft();

        assertEquals("Cannot read form at 1:1: found ')' where form belongs", error.message());
    }

    @Test
    void read_mismatchedDelimiter_failsWithUnexpectedInput() {
        var error = FormReader.read("(a]").getLeft();

        var unexpected = assertInstanceOf(ReadError.UnexpectedInput.class, error);
        assertEquals("]", unexpected.found());
    }

    @Test
    void read_trailingForms_failsWithUnexpectedInput() {
        var error = FormReader.read("a b").getLeft();

        var unexpected = assertInstanceOf(ReadError.UnexpectedInput.class, error);
        assertEquals("b", unexpected.found());
        assertEquals("end of input", unexpected.expected());
    }

    @Test
    void read_trailingForms_namesEndOfInputInMessage() {
        var error = FormReader.read("a b").getLeft();

        assertEquals("Cannot read form at 1:3: found 'b' where end of input belongs", error.message());
    }

    @Test
    void read_oddMap_failsWithInvalidMap() {
        var error = FormReader.read("{:a 1 :b}").getLeft();

        assertInstanceOf(ReadError.InvalidMap.class, error);
        assertEquals("Invalid map literal at 1:1: odd number of forms (3)", error.message());
    }

    @Test
    void read_duplicateMapKey_failsWithInvalidMap() {
        var error = FormReader.read("{:a 1 :a 2}").getLeft();

        assertInstanceOf(ReadError.InvalidMap.class, error);
    }

    @Test
    void read_unterminatedString_failsWithInvalidToken() {
        var error = FormReader.read("\"abc").getLeft();

        var invalid = assertInstanceOf(ReadError.InvalidToken.class, error);
        assertEquals("Unterminated string literal", invalid.reason());
    }

    @Test
    void read_integerOutOfRange_failsWithInvalidToken() {
        var error = FormReader.read("99999999999999999999").getLeft();

        assertInstanceOf(ReadError.InvalidToken.class, error);
    }

    @Test
    void read_bareColon_failsWithInvalidToken() {
        assertInstanceOf(ReadError.InvalidToken.class, FormReader.read(":").getLeft());
    }

    @Test
    void readError_asException_carriesMessage() {
        var error = FormReader.read("(").getLeft();

        assertEquals(error.message(),
                     error.asException()
                          .getMessage());
    }

    @Test
    void read_keepsSymbolNodeTypes() {
        assertInstanceOf(SyntaxNode.Symbol.class, FormReader.read("nil?").get());
    }

    // === Unsupported reader syntax ===

    @Test
    void read_setLiteral_failsWithInvalidToken() {
        var error = FormReader.read("(f #{1 2})").getLeft();

        var invalid = assertInstanceOf(ReadError.InvalidToken.class, error);
        assertEquals(new SourceLocation(1, 4), invalid.location());
        assertEquals("Unsupported reader syntax: #", invalid.reason());
    }

    @Test
    void read_anonymousFunctionLiteral_failsWithInvalidToken() {
        var error = FormReader.read("(map #(inc %) xs)").getLeft();

        var invalid = assertInstanceOf(ReadError.InvalidToken.class, error);
        assertEquals("Unsupported reader syntax: #", invalid.reason());
    }

    @Test
    void read_metadataPrefix_failsWithInvalidToken() {
        var error = FormReader.read("(defn ^:private f [x] x)").getLeft();

        var invalid = assertInstanceOf(ReadError.InvalidToken.class, error);
        assertEquals(new SourceLocation(1, 7), invalid.location());
        assertEquals("Unsupported reader syntax: ^", invalid.reason());
    }

    @Test
    void read_syntaxQuoteUnquoteAndDeref_failWithInvalidToken() {
        for (var text : List.of("`(a b)", "(list ~x)", "(inc @counter)")) {
            var error = FormReader.read(text).getLeft();

            assertInstanceOf(ReadError.InvalidToken.class, error, text);
        }
    }

    @Test
    void read_unicodeCharacter_decodesCodePoint() {
        assertEquals(list(symbol("str"), opaque('A')), FormReader.read("(str \\u0041)").get());
    }

    @Test
    void read_printedControlCharacter_yieldsEqualTree() {
        var form = list(symbol("str"), opaque('\u0007'), opaque('\u00a0'));

        assertEquals(form, FormReader.read(SyntaxPrinter.print(form)).get());
    }
}
