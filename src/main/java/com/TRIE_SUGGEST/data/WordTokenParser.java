package com.TRIE_SUGGEST.data;

import com.TRIE_SUGGEST.service.InvalidWordException;

/**
 * Parses raw {@code word[:frequency]} tokens into {@link WordEntry} values.
 * Words are ASCII letters only; a missing or blank frequency counts as 0.
 */
public class WordTokenParser {

    private final int maxWordLength;

    public WordTokenParser(int maxWordLength) {
        if (maxWordLength < 1) {
            throw new IllegalArgumentException("maxWordLength must be >= 1, got " + maxWordLength);
        }
        this.maxWordLength = maxWordLength;
    }

    public WordEntry parse(String token) {
        if (token == null) {
            throw new InvalidWordException(null, "Token is missing");
        }
        String trimmed = token.trim();
        int colon = trimmed.indexOf(':');
        String word = colon < 0 ? trimmed : trimmed.substring(0, colon);
        String rawFrequency = colon < 0 ? "" : trimmed.substring(colon + 1).trim();

        validateWord(word);
        return new WordEntry(word, parseFrequency(token, rawFrequency));
    }

    public WordEntry parse(String word, String rawFrequency) {
        validateWord(word);
        return new WordEntry(word, parseFrequency(word, rawFrequency == null ? "" : rawFrequency.trim()));
    }

    public String validateWord(String word) {
        if (word == null || word.isEmpty()) {
            throw new InvalidWordException(word, "Word is empty");
        }
        if (word.length() > maxWordLength) {
            throw new InvalidWordException(word, "Word is longer than " + maxWordLength + " characters");
        }
        for (int i = 0; i < word.length(); i++) {
            if (!isAsciiLetter(word.charAt(i))) {
                throw new InvalidWordException(word, "Only letters allowed: \"" + word + "\"");
            }
        }
        return word;
    }

    private static long parseFrequency(String token, String rawFrequency) {
        if (rawFrequency.isEmpty()) {
            return 0L;
        }
        long frequency;
        try {
            frequency = Long.parseLong(rawFrequency);
        } catch (NumberFormatException e) {
            throw new InvalidWordException(token, "Could not parse frequency \"" + rawFrequency + "\"");
        }
        if (frequency < 0) {
            throw new InvalidWordException(token, "Frequency must not be negative: " + frequency);
        }
        return frequency;
    }

    private static boolean isAsciiLetter(char ch) {
        return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z');
    }
}
