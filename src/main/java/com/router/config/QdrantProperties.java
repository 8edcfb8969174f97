package com.router.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Vector store connection. One collection per namespace.
 */
@Data
@ConfigurationProperties(prefix = "qdrant")
public class QdrantProperties {

    private String url = "http://localhost:6333";

    /**
     * Sent as the {@code api-key} header when not blank.
     */
    private String apiKey = "";

    private int timeoutMs = 10_000;
}
