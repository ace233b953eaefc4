package com.TRIE_SUGGEST.config;

import com.TRIE_SUGGEST.service.Suggestion;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class CacheConfig {

    // case-folded prefix -> ranked prefix suggestions; cleared on every insert
    @Bean("suggestionCache")
    public Cache<String, List<Suggestion>> suggestionCache(SuggestionProperties properties) {
        return Caffeine.newBuilder()
                .maximumSize(properties.getCache().getMaximumSize())
                .expireAfterWrite(properties.getCache().getExpireAfterWrite())
                .build();
    }
}
