package com.TRIE_SUGGEST.data;

/**
 * A stored word in its canonical (original-case) spelling with its popularity.
 */
public record WordEntry(String word, long popularity) {
}
