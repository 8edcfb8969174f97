package com.router.config;

import java.util.HashMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection settings of the OpenAI-compatible chat-completions provider.
 * <p>
 * API keys are looked up by full model id ({@code llm.api-keys[openai/gpt-4.1]}), then by
 * provider prefix ({@code llm.api-keys.openai}), then by bare model name.
 */
@Data
@ConfigurationProperties(prefix = "llm")
public class LlmProperties {

    private String endpoint = "https://api.openai.com/v1/chat/completions";

    /**
     * Model used when a request does not name one.
     */
    private String defaultModel = "openai/gpt-4.1-mini";

    private Map<String, String> apiKeys = new HashMap<>();

    private long timeoutMs = 120_000;
}
