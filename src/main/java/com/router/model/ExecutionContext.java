package com.router.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered, append-only record of the steps executed in one planning session.
 * <p>
 * Owned by a single session and discarded with it; instances are not thread-safe.
 */
public class ExecutionContext {

    private final List<StepRecord> records = new ArrayList<>();

    /**
     * Appends the outcome of the next step and returns the stored record.
     */
    public StepRecord append(String stepText, String namespace, JsonNode rawResponse, String reasoning, boolean guideUsed) {
        StepRecord record = new StepRecord(records.size() + 1, stepText, namespace, rawResponse, reasoning, guideUsed);
        records.add(record);
        return record;
    }

    public List<StepRecord> records() {
        return Collections.unmodifiableList(records);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    /**
     * Renders the context for the step generator: step, namespace and result of each entry.
     *
     * @return the rendered text, or {@code null} when nothing has been executed yet
     */
    public String describeForPlanning() {
        if (records.isEmpty()) {
            return null;
        }
        StringBuilder sb = new StringBuilder();
        for (StepRecord record : records) {
            sb.append(record.stepText()).append('\n')
                    .append("Integration: ").append(record.namespace()).append('\n')
                    .append("Result: ").append(record.rawResponse()).append("\n\n");
        }
        return sb.toString();
    }

    /**
     * Renders the context appended to extraction input.
     *
     * @return the rendered text, or an empty string when nothing has been executed yet
     */
    public String describeForExtraction() {
        if (records.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("Previous steps results:\n");
        for (StepRecord record : records) {
            sb.append(record.stepText()).append(": ").append(record.rawResponse()).append('\n');
        }
        return sb.toString();
    }

    /**
     * Renders the context for the final answer of a session.
     */
    public String describeForAnswer() {
        StringBuilder sb = new StringBuilder();
        for (StepRecord record : records) {
            sb.append("Step: ").append(record.stepText()).append('\n')
                    .append("Result: ").append(record.rawResponse()).append("\n\n");
        }
        return sb.toString();
    }
}
