package com.TRIE_SUGGEST.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Online best-K selection over a stream of candidates.
 * Order: distance ascending, then popularity descending.
 *
 * <p>Each offer costs O(K): once full, the worst retained entry is located and
 * replaced only when the newcomer is strictly better. Sorting happens once, in
 * {@link #finish()}.</p>
 */
public class SuggestionRanker {

    public static final int DEFAULT_CAPACITY = 10;

    public static final Comparator<Suggestion> ORDER = Comparator
            .comparingInt(Suggestion::getDistance)
            .thenComparing(Comparator.comparingLong(Suggestion::getPopularity).reversed());

    private final int capacity;
    private final List<Suggestion> retained;

    public SuggestionRanker() {
        this(DEFAULT_CAPACITY);
    }

    public SuggestionRanker(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got " + capacity);
        }
        this.capacity = capacity;
        this.retained = new ArrayList<>(capacity);
    }

    public void offer(String word, int distance, long popularity) {
        Suggestion candidate = new Suggestion(word, distance, popularity);
        if (retained.size() < capacity) {
            retained.add(candidate);
            return;
        }
        int worst = worstIndex();
        if (ORDER.compare(candidate, retained.get(worst)) < 0) {
            retained.set(worst, candidate);
        }
    }

    /**
     * Retained entries in presentation order. The ranker may keep receiving
     * offers afterwards.
     */
    public List<Suggestion> finish() {
        List<Suggestion> out = new ArrayList<>(retained);
        out.sort(ORDER);
        return out.size() > capacity ? out.subList(0, capacity) : out;
    }

    public int size() {
        return retained.size();
    }

    public int getCapacity() {
        return capacity;
    }

    // largest distance; among those the smallest popularity; earliest index on a full tie
    private int worstIndex() {
        int worst = 0;
        for (int i = 1; i < retained.size(); i++) {
            Suggestion s = retained.get(i);
            Suggestion w = retained.get(worst);
            if (s.getDistance() > w.getDistance()
                    || (s.getDistance() == w.getDistance() && s.getPopularity() < w.getPopularity())) {
                worst = i;
            }
        }
        return worst;
    }
}
