package com.example.workflow_schema.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExtractionConfig {

    @Value("${app.workflow.max-paths:" + ExtractionOptions.DEFAULT_MAX_PATHS + "}")
    private int maxPaths;

    @Value("${app.workflow.max-loop-iterations:" + ExtractionOptions.DEFAULT_MAX_LOOP_ITERATIONS + "}")
    private int maxLoopIterations;

    @Value("${app.workflow.max-depth:" + ExtractionOptions.DEFAULT_MAX_DEPTH + "}")
    private int maxDepth;

    @Value("${app.workflow.max-expansions:" + ExtractionOptions.DEFAULT_MAX_EXPANSIONS + "}")
    private int maxExpansions;

    @Bean
    public ExtractionOptions extractionOptions() {
        return new ExtractionOptions()
                .maxPaths(maxPaths)
                .maxLoopIterations(maxLoopIterations)
                .maxDepth(maxDepth)
                .maxExpansions(maxExpansions);
    }
}
