package com.TRIE_SUGGEST.service;

/**
 * No stored word starts with the requested prefix. Callers usually react by
 * trying {@link SuggestionEngine#correctSpelling(String)}.
 */
public class WordNotFoundException extends RuntimeException {

    private final String prefix;

    public WordNotFoundException(String prefix) {
        super("No words with prefix \"" + prefix + "\"");
        this.prefix = prefix;
    }

    public String getPrefix() {
        return prefix;
    }
}
