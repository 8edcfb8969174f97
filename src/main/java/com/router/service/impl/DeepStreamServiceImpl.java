package com.router.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.router.dto.event.CompleteEvent;
import com.router.dto.event.FinalResponseEvent;
import com.router.dto.event.FinalResponseEvent.ExecutedStep;
import com.router.dto.event.MetadataEvent;
import com.router.dto.event.StepCompleteEvent;
import com.router.dto.event.StepStartEvent;
import com.router.dto.event.StreamEvent;
import com.router.dto.request.DeepRequest;
import com.router.dto.response.ActionResult;
import com.router.exception.ApiRouterException;
import com.router.model.Integration;
import com.router.model.Step;
import com.router.model.StepRecord;
import com.router.service.api.DeepStreamService;
import com.router.service.api.PlanningLoop;
import com.router.service.api.PlanningLoop.LoopListener;
import com.router.service.api.PlanningLoop.LoopOutcome;
import com.router.service.api.PlanningService;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.scheduler.Schedulers;

/**
 * Runs the planning loop on a bounded-elastic worker and pushes each event to the subscriber
 * as soon as it happens. The final answer is synthesized from the whole session context, not
 * from the per-step summaries.
 */
@Service
@Slf4j
public class DeepStreamServiceImpl implements DeepStreamService {

    private final PlanningLoop planningLoop;
    private final PlanningService planningService;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public DeepStreamServiceImpl(PlanningLoop planningLoop, PlanningService planningService) {
        this.planningLoop = planningLoop;
        this.planningService = planningService;
    }

    @Override
    public Flux<String> stream(DeepRequest request) {
        return Flux.<String>create(sink -> runSession(request, sink))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private void runSession(DeepRequest request, FluxSink<String> sink) {
        try {
            LoopOutcome outcome = planningLoop.run(request, new StreamingListener(request.goal(), sink));
            if (sink.isCancelled()) {
                log.info("Stream consumer left, skipping the final response");
                return;
            }
            String answer = planningService.finalAnswer(outcome.goal(), outcome.context(), request.model());
            List<ExecutedStep> executed = outcome.context().records().stream()
                    .map(r -> new ExecutedStep(r.stepText(), r.namespace()))
                    .toList();
            emit(sink, new FinalResponseEvent(answer, answer, executed.size(), executed, outcome.termination(), outcome.truncated()));
            emit(sink, new CompleteEvent());
            sink.complete();
        } catch (Exception e) {
            log.error("Deep session aborted: {}", e.getMessage(), e);
            sink.error(e);
        }
    }

    private void emit(FluxSink<String> sink, StreamEvent event) {
        try {
            sink.next(objectMapper.writeValueAsString(event) + "\n");
        } catch (JsonProcessingException e) {
            throw new ApiRouterException("Could not serialize " + event.type() + " event", e);
        }
    }

    private final class StreamingListener implements LoopListener {

        private final String query;
        private final FluxSink<String> sink;

        private StreamingListener(String query, FluxSink<String> sink) {
            this.query = query;
            this.sink = sink;
        }

        @Override
        public void onStart(List<Integration> integrations, int maxSteps) {
            emit(sink, new MetadataEvent(query, integrations, maxSteps));
        }

        @Override
        public void onStepStart(int stepNumber, Step step, Integration integration) {
            emit(sink, new StepStartEvent(stepNumber, step.text(), integration.id(), integration.name(), step.reasoning()));
        }

        @Override
        public void onStepComplete(StepRecord record, Integration integration, ActionResult result) {
            String prose = result.naturalLanguageResponse() == null ? "" : result.naturalLanguageResponse();
            emit(sink, new StepCompleteEvent(record.stepNumber(), record.stepText(), integration.id(), integration.name(),
                    result, prose, record.guideUsed(), record.reasoning()));
        }

        @Override
        public boolean isCancelled() {
            return sink.isCancelled();
        }
    }
}
