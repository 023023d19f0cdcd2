package org.pragmatica.fnsyntax.tree;

import io.vavr.control.Option;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * Code-as-data node. Immutable; composite nodes own unmodifiable copies of their children,
 * so trees can be shared freely between callers.
 */
public sealed interface SyntaxNode {

    /**
     * Identifier token, e.g. a definition name or a parameter binder.
     */
    record Symbol(String name) implements SyntaxNode {
        public Symbol {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String toString() {
            return SyntaxPrinter.print(this);
        }
    }

    /**
     * Keyword token ({@code :name}), used mostly as a mapping key.
     */
    record Keyword(String name) implements SyntaxNode {
        public Keyword {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String toString() {
            return SyntaxPrinter.print(this);
        }
    }

    /**
     * Positional grouping ({@code [a b c]}), used for parameter declarations.
     */
    record Vector(List<SyntaxNode> items) implements SyntaxNode {
        public Vector {
            items = List.copyOf(items);
        }

        public boolean isEmpty() {
            return items.isEmpty();
        }

        @Override
        public String toString() {
            return SyntaxPrinter.print(this);
        }
    }

    /**
     * Code list ({@code (f a b)}).
     */
    record ListForm(List<SyntaxNode> items) implements SyntaxNode {
        public ListForm {
            items = List.copyOf(items);
        }

        public boolean isEmpty() {
            return items.isEmpty();
        }

        /**
         * First item, if any.
         */
        public Option<SyntaxNode> head() {
            return items.isEmpty()
                   ? Option.none()
                   : Option.some(items.get(0));
        }

        /**
         * All items but the first.
         */
        public List<SyntaxNode> tail() {
            return items.isEmpty()
                   ? List.of()
                   : items.subList(1, items.size());
        }

        @Override
        public String toString() {
            return SyntaxPrinter.print(this);
        }
    }

    /**
     * Associative literal ({@code {k v}}). Entry order is preserved, keys are unique.
     */
    record Mapping(List<Entry> entries) implements SyntaxNode {
        public static final Mapping EMPTY = new Mapping(List.of());

        public Mapping {
            entries = List.copyOf(entries);
            var seen = new HashSet<SyntaxNode>();
            for (var entry : entries) {
                if (!seen.add(entry.key())) {
                    throw new IllegalArgumentException("Duplicate mapping key: " + entry.key());
                }
            }
        }

        public boolean isEmpty() {
            return entries.isEmpty();
        }

        public int size() {
            return entries.size();
        }

        public Option<SyntaxNode> get(SyntaxNode key) {
            for (var entry : entries) {
                if (entry.key()
                         .equals(key)) {
                    return Option.some(entry.value());
                }
            }
            return Option.none();
        }

        public boolean containsKey(SyntaxNode key) {
            return get(key).isDefined();
        }

        /**
         * Merge {@code other} over this mapping. Colliding keys take the value from {@code other}
         * but keep their position here; new keys are appended in {@code other}'s order.
         */
        public Mapping merge(Mapping other) {
            if (other.isEmpty()) {
                return this;
            }
            var merged = new ArrayList<Entry>(entries.size() + other.size());
            for (var entry : entries) {
                merged.add(new Entry(entry.key(),
                                     other.get(entry.key())
                                          .getOrElse(entry.value())));
            }
            for (var entry : other.entries()) {
                if (!containsKey(entry.key())) {
                    merged.add(entry);
                }
            }
            return new Mapping(merged);
        }

        @Override
        public String toString() {
            return SyntaxPrinter.print(this);
        }

        public record Entry(SyntaxNode key, SyntaxNode value) {
            public Entry {
                Objects.requireNonNull(key, "key");
                Objects.requireNonNull(value, "value");
            }
        }
    }

    /**
     * String literal, used for docstrings.
     */
    record StringLiteral(String value) implements SyntaxNode {
        public StringLiteral {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String toString() {
            return SyntaxPrinter.print(this);
        }
    }

    /**
     * Any other literal. The payload is carried through untouched and never inspected.
     */
    record Opaque(Object payload) implements SyntaxNode {
        public static final Opaque NIL = new Opaque(Nil.NIL);

        public Opaque {
            Objects.requireNonNull(payload, "payload");
        }

        @Override
        public String toString() {
            return SyntaxPrinter.print(this);
        }

        /**
         * Payload of the {@code nil} literal.
         */
        public enum Nil {
            NIL;

            @Override
            public String toString() {
                return "nil";
            }
        }
    }

    // Factories

    static Symbol symbol(String name) {
        return new Symbol(name);
    }

    static Keyword keyword(String name) {
        return new Keyword(name);
    }

    static Vector vector(SyntaxNode... items) {
        return new Vector(List.of(items));
    }

    static ListForm list(SyntaxNode... items) {
        return new ListForm(List.of(items));
    }

    static StringLiteral string(String value) {
        return new StringLiteral(value);
    }

    static Opaque opaque(Object payload) {
        return new Opaque(payload);
    }

    /**
     * Mapping from alternating keys and values.
     */
    static Mapping mapping(SyntaxNode... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Mapping requires an even number of forms, got " + keysAndValues.length);
        }
        var entries = new ArrayList<Mapping.Entry>(keysAndValues.length / 2);
        for (int i = 0; i < keysAndValues.length; i += 2) {
            entries.add(new Mapping.Entry(keysAndValues[i], keysAndValues[i + 1]));
        }
        return new Mapping(entries);
    }
}
