package com.TRIE_SUGGEST.data;

import lombok.Getter;

import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * One letter position in the trie.
 * Only {@link TrieStore} mutates nodes; everything else gets a read-only view.
 */
@Getter
public class TrieNode {

    // Sorted so traversal always visits children in letter order.
    private final NavigableMap<Character, TrieNode> children = new TreeMap<>();

    private boolean terminal;

    // original-case spelling, set iff terminal
    private String canonicalWord;

    private long popularity;

    TrieNode child(char letter) {
        return children.get(letter);
    }

    Iterable<TrieNode> childrenDescending() {
        return children.descendingMap().values();
    }

    TrieNode childOrCreate(char letter) {
        return children.computeIfAbsent(letter, c -> new TrieNode());
    }

    /**
     * Records a word ending here. First arrival wins on equal popularity.
     *
     * @return true if the stored spelling/popularity changed
     */
    boolean markTerminal(String word, long incomingPopularity) {
        if (!terminal || incomingPopularity > popularity) {
            terminal = true;
            canonicalWord = word;
            popularity = incomingPopularity;
            return true;
        }
        return false;
    }

    public Map<Character, TrieNode> getChildren() {
        return Collections.unmodifiableMap(children);
    }
}
