package io.github.chirino.social.service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Shared logic of the per-user order lists (touch contacts and direct channels): deduplicating
 * the submitted ids, pruning them to the ids the owner may still order, and sorting a listing by
 * the stored ranks.
 */
public final class OrderPreferences {

    /** Rank given to entries the owner never placed; they sort after every explicit rank. */
    public static final int UNRANKED = Integer.MAX_VALUE;

    private OrderPreferences() {}

    /**
     * Deduplicates {@code requested} keeping first occurrences, then drops every id not in
     * {@code allowed}. The position of an id in the result is its new rank.
     */
    public static <T> List<T> sanitize(Collection<T> requested, Set<T> allowed) {
        List<T> result = new ArrayList<>();
        for (T id : new LinkedHashSet<>(requested)) {
            if (id != null && allowed.contains(id)) {
                result.add(id);
            }
        }
        return result;
    }

    /**
     * Orders by the owner's explicit rank ascending with unranked entries last, then by {@code
     * tieBreaker}.
     */
    public static <E, K> Comparator<E> byRank(
            Map<K, Integer> ranks, Function<E, K> key, Comparator<E> tieBreaker) {
        Comparator<E> rank =
                Comparator.comparingInt(entry -> ranks.getOrDefault(key.apply(entry), UNRANKED));
        return rank.thenComparing(tieBreaker);
    }
}
