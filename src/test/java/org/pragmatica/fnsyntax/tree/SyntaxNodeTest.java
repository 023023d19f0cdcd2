package org.pragmatica.fnsyntax.tree;

import io.vavr.control.Option;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.pragmatica.fnsyntax.tree.SyntaxNode.*;

class SyntaxNodeTest {

    // === Structural equality ===

    @Test
    void equalTrees_areEqual() {
        var left = list(symbol("fn"), vector(symbol("x")), list(symbol("+"), symbol("x"), opaque(1L)));
        var right = list(symbol("fn"), vector(symbol("x")), list(symbol("+"), symbol("x"), opaque(1L)));

        assertEquals(left, right);
        assertEquals(left.hashCode(), right.hashCode());
    }

    @Test
    void vectorAndList_withSameItems_areDistinct() {
        assertNotEquals(vector(symbol("x")), list(symbol("x")));
    }

    @Test
    void symbolAndKeyword_withSameName_areDistinct() {
        assertNotEquals(symbol("doc"), keyword("doc"));
    }

    @Test
    void composites_copyTheirItems() {
        var items = new ArrayList<SyntaxNode>(List.of(symbol("a")));
        var list = new ListForm(items);

        items.add(symbol("b"));

        assertEquals(1,
                     list.items()
                         .size());
        assertThrows(UnsupportedOperationException.class,
                     () -> list.items()
                               .add(symbol("c")));
    }

    @Test
    void listForm_headAndTail() {
        var form = list(symbol("fn"), vector(), opaque(1L));

        assertEquals(Option.some(symbol("fn")), form.head());
        assertEquals(List.of(vector(), opaque(1L)), form.tail());
        assertTrue(list().head()
                         .isEmpty());
        assertTrue(list().tail()
                         .isEmpty());
    }

    @Test
    void opaque_rejectsNullPayload() {
        assertThrows(NullPointerException.class, () -> new Opaque(null));
    }

    // === Mapping ===

    @Test
    void mapping_duplicateKeys_areRejected() {
        assertThrows(IllegalArgumentException.class, () -> mapping(keyword("a"), opaque(1L), keyword("a"), opaque(2L)));
    }

    @Test
    void mapping_oddArity_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> mapping(keyword("a")));
    }

    @Test
    void mapping_get_findsValueByKey() {
        var map = mapping(keyword("a"), opaque(1L), string("b"), opaque(2L));

        assertEquals(Option.some(opaque(2L)), map.get(string("b")));
        assertTrue(map.get(keyword("b"))
                      .isEmpty());
    }

    @Test
    void merge_otherWinsOnCollision_andKeepsLeftPosition() {
        var left = mapping(keyword("doc"), string("one"), keyword("line"), opaque(3L));
        var right = mapping(keyword("private"), opaque(true), keyword("doc"), string("two"));

        var merged = left.merge(right);

        assertThat(merged.entries()).containsExactly(new Mapping.Entry(keyword("doc"), string("two")),
                                                     new Mapping.Entry(keyword("line"), opaque(3L)),
                                                     new Mapping.Entry(keyword("private"), opaque(true)));
    }

    @Test
    void merge_intoEmpty_yieldsOther() {
        var other = mapping(keyword("private"), opaque(true));

        assertEquals(other, Mapping.EMPTY.merge(other));
    }

    @Test
    void merge_withEmpty_yieldsSame() {
        var map = mapping(keyword("private"), opaque(true));

        assertSame(map, map.merge(Mapping.EMPTY));
    }
}
