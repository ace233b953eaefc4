package com.TRIE_SUGGEST.Controller;

import com.TRIE_SUGGEST.config.MetricsConfig;
import com.TRIE_SUGGEST.data.WordEntry;
import com.TRIE_SUGGEST.data.WordTokenParser;
import com.TRIE_SUGGEST.service.InvalidWordException;
import com.TRIE_SUGGEST.service.Suggestion;
import com.TRIE_SUGGEST.service.SuggestionEngine;
import com.TRIE_SUGGEST.service.WordNotFoundException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.*;
import java.util.concurrent.TimeUnit;

@Slf4j
@RestController
@RequestMapping("/api")
public class AutocompleteController {

    private final SuggestionEngine engine;
    private final WordTokenParser parser;
    private final MeterRegistry meterRegistry;

    @Autowired
    public AutocompleteController(SuggestionEngine engine,
                                  WordTokenParser parser,
                                  MeterRegistry meterRegistry) {
        this.engine = engine;
        this.parser = parser;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Prefix suggestions; when nothing starts with {@code q}, spelling
     * corrections are returned in {@code didYouMean} instead.
     */
    @GetMapping("/suggest")
    public ResponseEntity<SuggestResponse> suggest(@RequestParam(value = "q", required = false) String q) {
        long start = System.currentTimeMillis();
        String prefix = parser.validateWord(q == null ? "" : q.trim());

        Optional<List<Suggestion>> cached = engine.cachedPrefix(prefix);
        if (cached.isPresent()) {
            meterRegistry.counter(MetricsConfig.REQUESTS, "result", "cache-hit").increment();
            return ResponseEntity.ok(new SuggestResponse(prefix, cached.get(), List.of(), finish(true, start)));
        }

        try {
            List<Suggestion> suggestions = engine.lookupPrefix(prefix);
            meterRegistry.counter(MetricsConfig.REQUESTS, "result", "prefix-hit").increment();
            return ResponseEntity.ok(new SuggestResponse(prefix, suggestions, List.of(), finish(false, start)));
        } catch (WordNotFoundException e) {
            log.debug("{}, trying spelling correction", e.getMessage());
            List<Suggestion> didYouMean = engine.correctSpelling(prefix);
            meterRegistry.counter(MetricsConfig.REQUESTS, "result", "fuzzy-fallback").increment();
            return ResponseEntity.ok(new SuggestResponse(prefix, List.of(), didYouMean, finish(false, start)));
        }
    }

    @GetMapping("/words")
    public ResponseEntity<List<WordEntry>> listAll() {
        return ResponseEntity.ok(engine.listAll());
    }

    /**
     * Inserts {@code word[:frequency]} tokens. Bad tokens are reported back,
     * the rest are still inserted.
     */
    @PostMapping("/words")
    public ResponseEntity<InsertResponse> insert(@RequestBody List<String> tokens) {
        if (tokens == null || tokens.isEmpty()) {
            return ResponseEntity.badRequest().build();
        }
        int inserted = 0;
        List<Rejected> rejected = new ArrayList<>();
        for (String token : tokens) {
            try {
                WordEntry entry = parser.parse(token);
                engine.insert(entry.word(), entry.popularity());
                inserted++;
            } catch (InvalidWordException e) {
                rejected.add(new Rejected(token, e.getMessage()));
            }
        }
        log.info("Inserted {} word(s), rejected {}", inserted, rejected.size());
        return ResponseEntity.ok(new InsertResponse(inserted, rejected));
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> stats() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("vocabularySize", engine.size());
        m.put("prefixHits", count("prefix-hit"));
        m.put("cacheHits", count("cache-hit"));
        m.put("fuzzyFallbacks", count("fuzzy-fallback"));
        return ResponseEntity.ok(m);
    }

    private double count(String result) {
        Counter c = meterRegistry.find(MetricsConfig.REQUESTS).tag("result", result).counter();
        return c == null ? 0.0 : c.count();
    }

    private Meta finish(boolean fromCache, long start) {
        long took = System.currentTimeMillis() - start;
        meterRegistry.timer(MetricsConfig.LATENCY).record(took, TimeUnit.MILLISECONDS);
        return new Meta(fromCache, took);
    }

    // DTOs
    public static class SuggestResponse {
        private final String prefix;
        private final List<Suggestion> suggestions;
        private final List<Suggestion> didYouMean;
        private final Meta meta;
        public SuggestResponse(String prefix, List<Suggestion> suggestions, List<Suggestion> didYouMean, Meta meta) {
            this.prefix = prefix; this.suggestions = suggestions; this.didYouMean = didYouMean; this.meta = meta;
        }
        public String getPrefix() { return prefix; }
        public List<Suggestion> getSuggestions() { return suggestions; }
        public List<Suggestion> getDidYouMean() { return didYouMean; }
        public Meta getMeta() { return meta; }
    }

    public static class Meta {
        private final boolean fromCache;
        private final long tookMs;
        public Meta(boolean fromCache, long tookMs) {
            this.fromCache = fromCache; this.tookMs = tookMs;
        }
        public boolean isFromCache() { return fromCache; }
        public long getTookMs() { return tookMs; }
    }

    public static class InsertResponse {
        private final int inserted;
        private final List<Rejected> rejected;
        public InsertResponse(int inserted, List<Rejected> rejected) {
            this.inserted = inserted; this.rejected = rejected;
        }
        public int getInserted() { return inserted; }
        public List<Rejected> getRejected() { return rejected; }
    }

    public static class Rejected {
        private final String token;
        private final String reason;
        public Rejected(String token, String reason) {
            this.token = token; this.reason = reason;
        }
        public String getToken() { return token; }
        public String getReason() { return reason; }
    }
}
