package com.TRIE_SUGGEST.data;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Letter-tree holding the vocabulary. Paths are case-folded; each terminal node
 * keeps the spelling that reached the highest popularity first.
 *
 * <p>Not thread-safe. The owner is expected to serialize inserts against reads.</p>
 */
public class TrieStore {

    private final TrieNode root = new TrieNode();
    private int wordCount;

    public static String fold(String s) {
        return s.toLowerCase(Locale.ROOT);
    }

    /**
     * Inserts {@code word} or merges its popularity into an existing entry.
     * Callers are expected to hand in non-empty alphabetic words.
     */
    public void insert(String word, long popularity) {
        String folded = fold(word);
        TrieNode current = root;
        for (int i = 0; i < folded.length(); i++) {
            current = current.childOrCreate(folded.charAt(i));
        }
        boolean wasTerminal = current.isTerminal();
        current.markTerminal(word, popularity);
        if (!wasTerminal) {
            wordCount++;
        }
    }

    /**
     * Walks the case-folded prefix. Empty when some letter has no child.
     * The node reached need not be terminal itself.
     */
    public Optional<TrieNode> lookupSubtree(String prefix) {
        String folded = fold(prefix);
        TrieNode current = root;
        for (int i = 0; i < folded.length(); i++) {
            current = current.child(folded.charAt(i));
            if (current == null) {
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }

    /**
     * Every word stored under {@code node}, depth first, children in letter order,
     * a node's own word before its descendants. Each call to {@code iterator()}
     * starts a fresh traversal.
     */
    public Iterable<WordEntry> enumerate(TrieNode node) {
        return () -> new DepthFirstIterator(node);
    }

    public Iterable<WordEntry> enumerateAll() {
        return enumerate(root);
    }

    public int size() {
        return wordCount;
    }

    public boolean isEmpty() {
        return wordCount == 0;
    }

    private static final class DepthFirstIterator implements Iterator<WordEntry> {

        private final Deque<TrieNode> stack = new ArrayDeque<>();
        private TrieNode pending;

        DepthFirstIterator(TrieNode start) {
            if (start != null) {
                stack.push(start);
            }
            advance();
        }

        private void advance() {
            pending = null;
            while (!stack.isEmpty()) {
                TrieNode node = stack.pop();
                // push in reverse so the smallest letter is popped first
                for (TrieNode child : node.childrenDescending()) {
                    stack.push(child);
                }
                if (node.isTerminal()) {
                    pending = node;
                    return;
                }
            }
        }

        @Override
        public boolean hasNext() {
            return pending != null;
        }

        @Override
        public WordEntry next() {
            if (pending == null) {
                throw new NoSuchElementException();
            }
            WordEntry entry = new WordEntry(pending.getCanonicalWord(), pending.getPopularity());
            advance();
            return entry;
        }
    }
}
