package com.TRIE_SUGGEST.service;

import com.TRIE_SUGGEST.config.SuggestionProperties;
import com.TRIE_SUGGEST.data.TrieNode;
import com.TRIE_SUGGEST.data.TrieStore;
import com.TRIE_SUGGEST.data.WordEntry;
import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Word suggestion facade: prefix lookup over the trie, with edit-distance
 * correction over a dictionary snapshot when the prefix matches nothing.
 *
 * <p>Owns its {@link TrieStore} and the prefix result cache. Inserts take the
 * write lock and clear the cache; queries read and fill the cache under the
 * read lock, so no result computed before an insert survives it.</p>
 */
@Slf4j
@Service
public class SuggestionEngine {

    private final TrieStore store = new TrieStore();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Object dictionaryMonitor = new Object();
    private final int maxSuggestions;
    private final int maxDistance;

    // case-folded prefix -> ranked suggestions; null disables caching
    private final Cache<String, List<Suggestion>> prefixCache;

    // null until first needed and after every insert
    private volatile WordDictionary dictionary;

    public SuggestionEngine() {
        this(SuggestionRanker.DEFAULT_CAPACITY, EditDistanceMatcher.DEFAULT_MAX_DISTANCE);
    }

    @Autowired
    public SuggestionEngine(SuggestionProperties properties,
                            @Qualifier("suggestionCache") Cache<String, List<Suggestion>> prefixCache) {
        this(properties.getMaxSuggestions(), properties.getMaxDistance(), prefixCache);
    }

    public SuggestionEngine(int maxSuggestions, int maxDistance) {
        this(maxSuggestions, maxDistance, null);
    }

    public SuggestionEngine(int maxSuggestions, int maxDistance, Cache<String, List<Suggestion>> prefixCache) {
        if (maxSuggestions < 1) {
            throw new IllegalArgumentException("maxSuggestions must be >= 1, got " + maxSuggestions);
        }
        if (maxDistance < 0) {
            throw new IllegalArgumentException("maxDistance must be >= 0, got " + maxDistance);
        }
        this.maxSuggestions = maxSuggestions;
        this.maxDistance = maxDistance;
        this.prefixCache = prefixCache;
    }

    public void insert(String word, long popularity) {
        lock.writeLock().lock();
        try {
            store.insert(word, popularity);
            dictionary = null;
            if (prefixCache != null) {
                prefixCache.invalidateAll();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Cached result of an earlier {@link #lookupPrefix(String)}, if still valid.
     */
    public Optional<List<Suggestion>> cachedPrefix(String prefix) {
        if (prefixCache == null) {
            return Optional.empty();
        }
        lock.readLock().lock();
        try {
            return Optional.ofNullable(prefixCache.getIfPresent(TrieStore.fold(prefix)));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Most popular words starting with {@code prefix}, case-insensitively.
     *
     * @throws WordNotFoundException if no stored word has this prefix
     */
    public List<Suggestion> lookupPrefix(String prefix) {
        lock.readLock().lock();
        try {
            String key = TrieStore.fold(prefix);
            if (prefixCache != null) {
                List<Suggestion> cached = prefixCache.getIfPresent(key);
                if (cached != null) {
                    return cached;
                }
            }
            TrieNode node = store.lookupSubtree(prefix)
                    .orElseThrow(() -> new WordNotFoundException(prefix));
            SuggestionRanker ranker = new SuggestionRanker(maxSuggestions);
            for (WordEntry entry : store.enumerate(node)) {
                ranker.offer(entry.word(), 0, entry.popularity());
            }
            List<Suggestion> out = List.copyOf(ranker.finish());
            if (out.isEmpty()) {
                throw new WordNotFoundException(prefix);
            }
            if (prefixCache != null) {
                prefixCache.put(key, out);
            }
            log.debug("prefix '{}' matched {} suggestion(s)", prefix, out.size());
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Closest stored words within the configured edit distance. Popularity is
     * always reported as 0 on this path. Empty when nothing is close enough.
     */
    public List<Suggestion> correctSpelling(String input) {
        lock.readLock().lock();
        try {
            WordDictionary snapshot = currentDictionary();
            List<Suggestion> out = EditDistanceMatcher.matchDictionary(input, snapshot, maxDistance, maxSuggestions);
            log.debug("correction for '{}' scanned {} word(s), {} within distance {}",
                    input, snapshot.size(), out.size(), maxDistance);
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Every stored word, ordered by canonical spelling (code point order, so
     * upper case sorts before lower case).
     */
    public List<WordEntry> listAll() {
        lock.readLock().lock();
        try {
            List<WordEntry> out = new ArrayList<>(store.size());
            for (WordEntry entry : store.enumerateAll()) {
                out.add(entry);
            }
            out.sort(Comparator.comparing(WordEntry::word));
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return store.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getMaxSuggestions() {
        return maxSuggestions;
    }

    // Called under the read lock: the tree cannot change while a snapshot is built.
    WordDictionary currentDictionary() {
        WordDictionary snapshot = dictionary;
        if (snapshot == null) {
            synchronized (dictionaryMonitor) {
                snapshot = dictionary;
                if (snapshot == null) {
                    snapshot = WordDictionary.snapshot(store);
                    dictionary = snapshot;
                    log.debug("rebuilt spelling dictionary with {} word(s)", snapshot.size());
                }
            }
        }
        return snapshot;
    }
}
