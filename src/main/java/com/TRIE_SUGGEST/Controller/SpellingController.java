package com.TRIE_SUGGEST.Controller;

import com.TRIE_SUGGEST.data.WordTokenParser;
import com.TRIE_SUGGEST.service.Suggestion;
import com.TRIE_SUGGEST.service.SuggestionEngine;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
public class SpellingController {

    private final SuggestionEngine engine;
    private final WordTokenParser parser;

    @Autowired
    public SpellingController(SuggestionEngine engine, WordTokenParser parser) {
        this.engine = engine;
        this.parser = parser;
    }

    @GetMapping("/spellcheck")
    public ResponseEntity<List<Suggestion>> spellcheck(@RequestParam(value = "word", required = false) String word) {
        String input = parser.validateWord(word == null ? "" : word.trim());
        return ResponseEntity.ok(engine.correctSpelling(input));
    }
}
