package com.TRIE_SUGGEST;

import com.TRIE_SUGGEST.config.SuggestionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(SuggestionProperties.class)
public class TrieSuggestApplication {

	public static void main(String[] args) {
		SpringApplication.run(TrieSuggestApplication.class, args);
	}

}
