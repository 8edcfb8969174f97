package com.router.config;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2.AllMiniLmL6V2EmbeddingModel;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Process-wide singletons of the routing pipeline.
 */
@Configuration
@Slf4j
public class PipelineConfig {

    /**
     * In-process sentence embedding model (384 dimensions). Loaded once; safe for concurrent queries.
     */
    @Bean
    public EmbeddingModel embeddingModel() {
        log.info("Loading in-process embedding model all-MiniLM-L6-v2");
        return new AllMiniLmL6V2EmbeddingModel();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
