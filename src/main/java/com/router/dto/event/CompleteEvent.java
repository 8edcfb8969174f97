package com.router.dto.event;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Last event of a session that ended normally.
 */
public record CompleteEvent() implements StreamEvent {

    @Override
    @JsonProperty("type")
    public String type() {
        return "complete";
    }
}
