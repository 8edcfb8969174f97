package com.router.dto.llm;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Chat-completions request body. Answers are always requested in JSON mode.
 */
@Data
@NoArgsConstructor
public class LlmRequest {

    private String model;

    private List<LlmMessage> messages;

    @JsonProperty("response_format")
    private ResponseFormat responseFormat = new ResponseFormat("json_object");

    public LlmRequest(String model, List<LlmMessage> messages) {
        this.model = model;
        this.messages = messages;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ResponseFormat {
        private String type;
    }
}
