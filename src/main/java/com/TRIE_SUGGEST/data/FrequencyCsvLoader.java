package com.TRIE_SUGGEST.data;

import com.TRIE_SUGGEST.config.SuggestionProperties;
import com.TRIE_SUGGEST.service.InvalidWordException;
import com.TRIE_SUGGEST.service.SuggestionEngine;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Seeds the engine from a {@code word,frequency} CSV at startup.
 * Rows are inserted in file order; invalid rows are logged and skipped.
 */
@Slf4j
@Component
public class FrequencyCsvLoader implements CommandLineRunner {

    private final ResourceLoader resourceLoader;
    private final WordTokenParser parser;
    private final SuggestionEngine engine;
    private final String seedLocation;

    public FrequencyCsvLoader(ResourceLoader resourceLoader,
                              WordTokenParser parser,
                              SuggestionEngine engine,
                              SuggestionProperties properties) {
        this.resourceLoader = resourceLoader;
        this.parser = parser;
        this.engine = engine;
        this.seedLocation = properties.getSeedLocation();
    }

    @Override
    public void run(String... args) throws IOException {
        if (seedLocation == null || seedLocation.isBlank()) {
            log.info("No seed vocabulary configured");
            return;
        }
        Resource resource = resourceLoader.getResource(seedLocation);
        if (!resource.exists()) {
            log.warn("Seed vocabulary {} not found, starting empty", seedLocation);
            return;
        }
        load(resource);
    }

    /**
     * @return number of rows inserted
     */
    public int load(Resource resource) throws IOException {
        log.info("Loading seed vocabulary from {}", resource.getDescription());
        CSVFormat csvFormat = CSVFormat.DEFAULT.builder()
                .setHeader("word", "frequency")
                .setSkipHeaderRecord(true)
                .setIgnoreEmptyLines(true)
                .setTrim(true)
                .build();
        int inserted = 0;
        int rejected = 0;
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8));
             CSVParser csvParser = new CSVParser(reader, csvFormat)) {
            for (CSVRecord csvRecord : csvParser) {
                String word = csvRecord.get("word");
                String frequency = csvRecord.isSet("frequency") ? csvRecord.get("frequency") : "";
                try {
                    WordEntry entry = parser.parse(word, frequency);
                    engine.insert(entry.word(), entry.popularity());
                    inserted++;
                } catch (InvalidWordException e) {
                    rejected++;
                    log.warn("Skipping seed row {}: {}", csvRecord.getRecordNumber(), e.getMessage());
                }
            }
        }
        log.info("Seed vocabulary loaded: {} row(s) inserted, {} rejected, {} distinct word(s)",
                inserted, rejected, engine.size());
        return inserted;
    }
}
