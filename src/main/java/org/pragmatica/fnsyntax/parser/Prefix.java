package org.pragmatica.fnsyntax.parser;

import io.vavr.control.Option;
import org.pragmatica.fnsyntax.tree.SyntaxNode;

import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Result of peeling at most one optional leading form off a sequence: the extracted value and the
 * forms that follow it.
 */
public record Prefix<T>(T value, List<SyntaxNode> rest) {

    /**
     * Take the first form if it satisfies {@code predicate}. On a match returns
     * {@code (transform(first), remaining forms)}; otherwise {@code (defaultValue, forms)} with the very
     * same list instance. Never consumes more than one form and never fails by itself: exceptions from
     * {@code predicate} or {@code transform} propagate.
     */
    public static <T> Prefix<T> extract(List<SyntaxNode> forms,
                                        Function<? super SyntaxNode, ? extends T> transform,
                                        Predicate<? super SyntaxNode> predicate,
                                        T defaultValue) {
        if (forms.isEmpty() || !predicate.test(forms.get(0))) {
            return new Prefix<>(defaultValue, forms);
        }
        return new Prefix<>(transform.apply(forms.get(0)),
                            List.copyOf(forms.subList(1, forms.size())));
    }

    /**
     * Take the first form if it is a node of the given type.
     */
    public static <N extends SyntaxNode> Prefix<Option<N>> optional(List<SyntaxNode> forms, Class<N> type) {
        return Prefix.<Option<N>>extract(forms, node -> Option.some(type.cast(node)), type::isInstance, Option.none());
    }
}
