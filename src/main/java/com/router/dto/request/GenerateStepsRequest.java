package com.router.dto.request;

import com.router.model.ModelConfig;
import java.util.List;

/**
 * Asks for a static decomposition of a goal over the given namespaces.
 */
public record GenerateStepsRequest(String goal, List<String> namespaces, ModelConfig model) {
}
