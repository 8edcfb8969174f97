package com.router.service.api;

import com.router.dto.request.DeepRequest;
import reactor.core.publisher.Flux;

/**
 * Serializes a planning session as newline-delimited JSON events:
 * {@code metadata}, then {@code step_start}/{@code step_complete} per step, then
 * {@code final_response} and {@code complete}.
 */
public interface DeepStreamService {

    /**
     * @return a cold stream; each subscription runs one session. A failing step terminates the
     *         stream with an error after the events already emitted.
     */
    Flux<String> stream(DeepRequest request);
}
