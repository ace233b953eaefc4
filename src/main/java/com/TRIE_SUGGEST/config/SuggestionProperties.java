package com.TRIE_SUGGEST.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tunables for the suggestion engine, bound from {@code suggest.*}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "suggest")
public class SuggestionProperties {

    /** How many suggestions a query returns at most. */
    private int maxSuggestions = 10;

    /** Largest edit distance accepted by spelling correction. */
    private int maxDistance = 2;

    /** Longest word accepted at the input boundary. */
    private int maxWordLength = 99;

    /** Seed vocabulary, a CSV with a {@code word,frequency} header. */
    private String seedLocation = "classpath:word_frequencies.csv";

    private final Cache cache = new Cache();

    @Getter
    @Setter
    public static class Cache {
        private long maximumSize = 10_000;
        private Duration expireAfterWrite = Duration.ofMinutes(10);
    }
}
