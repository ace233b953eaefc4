package com.TRIE_SUGGEST.Controller;

import com.TRIE_SUGGEST.data.WordTokenParser;
import com.TRIE_SUGGEST.service.Suggestion;
import com.TRIE_SUGGEST.service.SuggestionEngine;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class AutocompleteControllerTest {

    /**
     * Engine that, once armed, parks a prefix lookup after it has read the trie
     * until the test releases it.
     */
    static class PausingEngine extends SuggestionEngine {
        final CountDownLatch lookedUp = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
        volatile boolean armed;

        PausingEngine(Cache<String, List<Suggestion>> cache) {
            super(10, 2, cache);
        }

        @Override
        public List<Suggestion> lookupPrefix(String prefix) {
            List<Suggestion> out = super.lookupPrefix(prefix);
            if (armed) {
                armed = false;
                lookedUp.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return out;
        }
    }

    private PausingEngine engine;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        Cache<String, List<Suggestion>> cache = Caffeine.newBuilder().maximumSize(100).build();
        engine = new PausingEngine(cache);
        engine.insert("apple", 5);
        engine.insert("app", 3);
        engine.insert("apt", 1);
        WordTokenParser parser = new WordTokenParser(99);
        mvc = MockMvcBuilders
                .standaloneSetup(
                        new AutocompleteController(engine, parser, new SimpleMeterRegistry()),
                        new SpellingController(engine, parser))
                .setControllerAdvice(new ApiExceptionAdvice())
                .build();
    }

    @Test
    void suggestReturnsPrefixMatches() throws Exception {
        mvc.perform(get("/api/suggest").param("q", "Ap"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.prefix").value("Ap"))
                .andExpect(jsonPath("$.suggestions[*].word", contains("apple", "app", "apt")))
                .andExpect(jsonPath("$.suggestions[0].popularity").value(5))
                .andExpect(jsonPath("$.didYouMean", hasSize(0)))
                .andExpect(jsonPath("$.meta.fromCache").value(false));
    }

    @Test
    void repeatedSuggestIsServedFromCache() throws Exception {
        mvc.perform(get("/api/suggest").param("q", "ap")).andExpect(status().isOk());

        mvc.perform(get("/api/suggest").param("q", "AP"))
                .andExpect(jsonPath("$.meta.fromCache").value(true))
                .andExpect(jsonPath("$.suggestions", hasSize(3)));

        mvc.perform(get("/api/stats"))
                .andExpect(jsonPath("$.vocabularySize").value(3))
                .andExpect(jsonPath("$.prefixHits").value(1.0))
                .andExpect(jsonPath("$.cacheHits").value(1.0));
    }

    @Test
    void unknownPrefixFallsBackToSpellingCorrection() throws Exception {
        mvc.perform(get("/api/suggest").param("q", "aple"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.suggestions", hasSize(0)))
                .andExpect(jsonPath("$.didYouMean[*].word", contains("apple", "app", "apt")))
                .andExpect(jsonPath("$.didYouMean[0].distance").value(1));

        mvc.perform(get("/api/stats")).andExpect(jsonPath("$.fuzzyFallbacks").value(1.0));
    }

    @Test
    void invalidPrefixIsBadRequest() throws Exception {
        mvc.perform(get("/api/suggest").param("q", "ap1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid_word"));
        mvc.perform(get("/api/suggest"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void insertedWordsInvalidateCache() throws Exception {
        mvc.perform(get("/api/suggest").param("q", "ap")).andExpect(status().isOk());

        mvc.perform(post("/api/words")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[\"Apex:50\", \"bad1\", \"apron\"]"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.inserted").value(2))
                .andExpect(jsonPath("$.rejected[0].token").value("bad1"));

        mvc.perform(get("/api/suggest").param("q", "ap"))
                .andExpect(jsonPath("$.meta.fromCache").value(false))
                .andExpect(jsonPath("$.suggestions[0].word").value("Apex"));
    }

    @Test
    void insertDuringInFlightLookupIsNotHiddenByCache() throws Exception {
        engine.armed = true;
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<?> inFlight = executor.submit(() -> {
                mvc.perform(get("/api/suggest").param("q", "ap")).andExpect(status().isOk());
                return null;
            });
            assertThat(engine.lookedUp.await(5, TimeUnit.SECONDS)).isTrue();

            mvc.perform(post("/api/words")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("[\"apex:50\"]"))
                    .andExpect(jsonPath("$.inserted").value(1));
            engine.release.countDown();
            inFlight.get(5, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }

        mvc.perform(get("/api/suggest").param("q", "ap"))
                .andExpect(jsonPath("$.meta.fromCache").value(false))
                .andExpect(jsonPath("$.suggestions[0].word").value("apex"))
                .andExpect(jsonPath("$.suggestions", hasSize(4)));
    }

    @Test
    void emptyInsertIsBadRequest() throws Exception {
        mvc.perform(post("/api/words").contentType(MediaType.APPLICATION_JSON).content("[]"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void listsAllWordsSorted() throws Exception {
        engine.insert("Banana", 2);

        mvc.perform(get("/api/words"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].word", contains("Banana", "app", "apple", "apt")))
                .andExpect(jsonPath("$[0].popularity").value(2));
    }

    @Test
    void spellcheckEndpoint() throws Exception {
        mvc.perform(get("/api/spellcheck").param("word", "APTT"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].word").value("apt"))
                .andExpect(jsonPath("$[0].distance").value(1));

        mvc.perform(get("/api/spellcheck").param("word", "zzzzzz"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));

        mvc.perform(get("/api/spellcheck").param("word", "a b"))
                .andExpect(status().isBadRequest());
    }
}
