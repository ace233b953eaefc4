package com.TRIE_SUGGEST.service;

import java.util.Objects;

/**
 * A single ranked result: the stored spelling, its edit distance from the query
 * (always 0 on the prefix path) and its popularity.
 */
public class Suggestion {

    private final String word;
    private final int distance;
    private final long popularity;

    public Suggestion(String word, int distance, long popularity) {
        this.word = word;
        this.distance = distance;
        this.popularity = popularity;
    }

    public String getWord() {
        return word;
    }

    public int getDistance() {
        return distance;
    }

    public long getPopularity() {
        return popularity;
    }

    @Override
    public String toString() {
        return "Suggestion{" +
                "word='" + word + '\'' +
                ", distance=" + distance +
                ", popularity=" + popularity +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Suggestion)) return false;
        Suggestion that = (Suggestion) o;
        return distance == that.distance && popularity == that.popularity && Objects.equals(word, that.word);
    }

    @Override
    public int hashCode() {
        return Objects.hash(word, distance, popularity);
    }
}
