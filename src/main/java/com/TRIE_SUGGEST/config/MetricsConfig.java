package com.TRIE_SUGGEST.config;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MetricsConfig {

    public static final String REQUESTS = "autocomplete.requests";
    public static final String LATENCY = "autocomplete.latency";

    @Autowired
    public MetricsConfig(MeterRegistry registry) {
        registry.counter("autocomplete.startups", "app", "trie-suggest").increment();
    }
}
