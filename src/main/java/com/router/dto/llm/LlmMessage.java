package com.router.dto.llm;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One chat message: {@code system} carries the task, {@code user} the serialized input record.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LlmMessage {

    private String role;

    private String content;

    public static LlmMessage system(String content) {
        return new LlmMessage("system", content);
    }

    public static LlmMessage user(String content) {
        return new LlmMessage("user", content);
    }
}
