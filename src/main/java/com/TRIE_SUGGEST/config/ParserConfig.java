package com.TRIE_SUGGEST.config;

import com.TRIE_SUGGEST.data.WordTokenParser;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ParserConfig {

    @Bean
    public WordTokenParser wordTokenParser(SuggestionProperties properties) {
        return new WordTokenParser(properties.getMaxWordLength());
    }
}
