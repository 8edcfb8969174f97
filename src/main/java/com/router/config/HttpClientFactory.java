package com.router.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Creates the shared {@link WebClient} used for every outbound call: the language model, the
 * vector store and the routed target APIs.
 * <p>
 * Requests are never retried. A failed call surfaces immediately to the caller, which aborts the
 * current session.
 */
@Configuration
public class HttpClientFactory {

    /**
     * Remote payloads and catalog scrolls are not size-bounded; the default 256 KiB codec buffer is
     * raised accordingly.
     */
    private static final int MAX_IN_MEMORY_SIZE = 16 * 1024 * 1024;

    @Bean
    public WebClient webClient() {
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE))
                .build();
        return WebClient.builder()
                .exchangeStrategies(strategies)
                .build();
    }
}
