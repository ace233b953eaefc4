package com.TRIE_SUGGEST.service;

import com.TRIE_SUGGEST.data.TrieStore;
import com.TRIE_SUGGEST.data.WordEntry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Flat, immutable snapshot of every canonical word in a {@link TrieStore},
 * in trie traversal order. It does not follow later inserts; take a new
 * snapshot instead.
 */
public final class WordDictionary implements Iterable<String> {

    private final List<String> words;

    private WordDictionary(List<String> words) {
        this.words = Collections.unmodifiableList(words);
    }

    public static WordDictionary snapshot(TrieStore store) {
        List<String> words = new ArrayList<>(store.size());
        for (WordEntry entry : store.enumerateAll()) {
            words.add(entry.word());
        }
        return new WordDictionary(words);
    }

    public static WordDictionary of(List<String> words) {
        return new WordDictionary(new ArrayList<>(words));
    }

    public List<String> getWords() {
        return words;
    }

    public int size() {
        return words.size();
    }

    public boolean isEmpty() {
        return words.isEmpty();
    }

    @Override
    public Iterator<String> iterator() {
        return words.iterator();
    }
}
