package com.router.dto.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Optional;
import lombok.Data;

/**
 * Chat-completions response body; only the message content of the first choice is used.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class LlmResponse {

    private List<Choice> choices;

    /**
     * @return content of the first choice, empty when the provider sent none
     */
    public Optional<String> firstContent() {
        if (choices == null || choices.isEmpty() || choices.get(0).getMessage() == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(choices.get(0).getMessage().getContent());
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Choice {
        private Message message;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Message {
        private String role;
        private String content;
    }
}
