package com.TRIE_SUGGEST.service;

import com.TRIE_SUGGEST.data.TrieStore;
import org.apache.commons.text.similarity.LevenshteinDistance;

import java.util.List;

/**
 * Unit-cost Levenshtein distance and the dictionary scan behind "did you mean".
 */
public final class EditDistanceMatcher {

    public static final int DEFAULT_MAX_DISTANCE = 2;

    private static final LevenshteinDistance UNBOUNDED = LevenshteinDistance.getDefaultInstance();

    private EditDistanceMatcher() {}

    /**
     * Minimum number of single-character insertions, deletions and substitutions
     * turning {@code a} into {@code b}.
     */
    public static int distance(String a, String b) {
        return UNBOUNDED.apply(a, b);
    }

    public static List<Suggestion> matchDictionary(String input, WordDictionary dictionary) {
        return matchDictionary(input, dictionary, DEFAULT_MAX_DISTANCE, SuggestionRanker.DEFAULT_CAPACITY);
    }

    /**
     * Ranks every dictionary word within {@code maxDistance} of {@code input},
     * comparing case-folded forms. Popularity is reported as 0 for every match.
     */
    public static List<Suggestion> matchDictionary(String input, WordDictionary dictionary,
                                                   int maxDistance, int capacity) {
        // -1 from the bounded instance means "further than maxDistance"
        LevenshteinDistance bounded = new LevenshteinDistance(maxDistance);
        String folded = TrieStore.fold(input);
        SuggestionRanker ranker = new SuggestionRanker(capacity);
        for (String word : dictionary) {
            int d = bounded.apply(folded, TrieStore.fold(word));
            if (d != -1) {
                ranker.offer(word, d, 0L);
            }
        }
        return ranker.finish();
    }
}
