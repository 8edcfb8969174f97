package com.router.service.api;

import com.router.dto.request.GenerateStepsRequest;
import com.router.dto.response.GeneratedSteps;

/**
 * Static decomposition entry point: plans every step up front and assigns each to an
 * integration, without executing anything.
 */
public interface StepGenerationService {

    GeneratedSteps generate(GenerateStepsRequest request);
}
