package com.router.service.impl;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.router.config.LlmProperties;
import com.router.config.RouterProperties;
import com.router.dto.request.ActionRequest;
import com.router.dto.request.DeepRequest;
import com.router.dto.response.ActionResult;
import com.router.exception.MissingCredentialException;
import com.router.model.Integration;
import com.router.model.ModelConfig;
import com.router.model.Step;
import com.router.model.StepRecord;
import com.router.model.TerminationReason;
import com.router.reasoning.Signatures.NextStepDecision;
import com.router.service.api.ActionService;
import com.router.service.api.IntegrationDirectory;
import com.router.service.api.IntegrationSelector;
import com.router.service.api.PlanningLoop.LoopListener;
import com.router.service.api.PlanningLoop.LoopOutcome;
import com.router.service.api.PlanningService;
import com.router.service.api.UsageGuideRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BoundedPlanningLoopTest {

    private static final ModelConfig MODEL = new ModelConfig("openai/gpt-4.1-mini");
    private static final Integration GITHUB = new Integration("github", "GitHub", "Code hosting");

    @Mock
    private PlanningService planningService;
    @Mock
    private IntegrationSelector integrationSelector;
    @Mock
    private IntegrationDirectory integrationDirectory;
    @Mock
    private ActionService actionService;
    @Mock
    private UsageGuideRepository guides;

    private BoundedPlanningLoop loop;
    private RecordingListener listener;

    @BeforeEach
    void setUp() {
        LlmProperties llm = new LlmProperties();
        llm.setApiKeys(Map.of("openai", "test-key"));
        loop = new BoundedPlanningLoop(planningService, integrationSelector, integrationDirectory, actionService, guides,
                new CredentialResolver(llm), new TemporalContext(Clock.systemUTC()), new RouterProperties());
        listener = new RecordingListener();
    }

    private static DeepRequest request() {
        return DeepRequest.builder()
                .namespaces(List.of("github"))
                .baseAddressByNamespace(Map.of("github", "https://api.github.com"))
                .headersByNamespace(Map.of("github", Map.of("Authorization", "token abc")))
                .goal("Close every stale issue")
                .model(MODEL)
                .build();
    }

    private void oneIntegration(String guide) {
        when(integrationDirectory.lookup(List.of("github"))).thenReturn(List.of(GITHUB));
        when(integrationSelector.select(anyString(), eq(List.of(GITHUB)), eq(MODEL))).thenReturn(GITHUB);
        when(guides.load("github")).thenReturn(guide);
        when(actionService.act(any())).thenAnswer(inv -> new ActionResult(null, null, null, null,
                JsonNodeFactory.instance.objectNode().put("ok", true), 1L, 1L, null));
    }

    @Test
    void run_shouldNeverExecuteMoreThanSevenSteps() {
        // --- Arrange ---
        oneIntegration("");
        when(planningService.nextStep(anyString(), any(), any(), eq(MODEL)))
                .thenReturn(new NextStepDecision("List more issues on GitHub", false, "keep going"));

        // --- Act ---
        LoopOutcome outcome = loop.run(request(), listener);

        // --- Assert ---
        assertThat(outcome.context().size()).isEqualTo(7);
        assertThat(outcome.termination()).isEqualTo(TerminationReason.ITERATION_CAP);
        assertThat(outcome.truncated()).isTrue();
        assertThat(listener.events).filteredOn(e -> e.startsWith("start:")).hasSize(7);
        assertThat(listener.maxSteps).isEqualTo(7);
        verify(actionService, times(7)).act(any());
    }

    @Test
    void run_shouldKeepSevenStepCapWhenConfiguredHigher() {
        // --- Arrange ---
        RouterProperties properties = new RouterProperties();
        properties.setMaxSteps(12);
        LlmProperties llm = new LlmProperties();
        llm.setApiKeys(Map.of("openai", "test-key"));
        BoundedPlanningLoop configured = new BoundedPlanningLoop(planningService, integrationSelector, integrationDirectory,
                actionService, guides, new CredentialResolver(llm), new TemporalContext(Clock.systemUTC()), properties);
        oneIntegration("");
        when(planningService.nextStep(anyString(), any(), any(), eq(MODEL)))
                .thenReturn(new NextStepDecision("List more issues on GitHub", false, "keep going"));

        // --- Act ---
        LoopOutcome outcome = configured.run(request(), listener);

        // --- Assert ---
        assertThat(outcome.context().size()).isEqualTo(7);
        assertThat(outcome.termination()).isEqualTo(TerminationReason.ITERATION_CAP);
        assertThat(listener.maxSteps).isEqualTo(7);
        verify(actionService, times(7)).act(any());
    }

    @Test
    void run_shouldExecuteStepReturnedWithCompletionAndStop() {
        oneIntegration("");
        when(planningService.nextStep(anyString(), any(), any(), eq(MODEL)))
                .thenReturn(new NextStepDecision("List open issues on GitHub", true, "single step"));

        LoopOutcome outcome = loop.run(request(), listener);

        assertThat(outcome.termination()).isEqualTo(TerminationReason.GOAL_SATISFIED);
        assertThat(outcome.truncated()).isFalse();
        assertThat(listener.events).containsExactly("begin:1", "start:1:List open issues on GitHub", "complete:1:github");
        verify(planningService, times(1)).nextStep(anyString(), any(), any(), any());
    }

    @Test
    void run_shouldPassContextAndSessionSettingsToEachStep() {
        oneIntegration("Use owner/repo.");
        when(planningService.nextStep(anyString(), any(), any(), eq(MODEL)))
                .thenReturn(new NextStepDecision("Find stale issues on GitHub", false, "first"))
                .thenReturn(new NextStepDecision("Close the stale issues on GitHub", false, "second"))
                .thenReturn(new NextStepDecision(null, true, "done"));

        LoopOutcome outcome = loop.run(request(), listener);

        assertThat(outcome.termination()).isEqualTo(TerminationReason.GOAL_SATISFIED);
        assertThat(outcome.goal()).startsWith("[Current date and time: ").endsWith("Close every stale issue");
        assertThat(outcome.context().records()).extracting(StepRecord::stepText)
                .containsExactly("Find stale issues on GitHub", "Close the stale issues on GitHub");
        assertThat(outcome.context().records()).allMatch(StepRecord::guideUsed);

        ArgumentCaptor<ActionRequest> requests = ArgumentCaptor.forClass(ActionRequest.class);
        verify(actionService, times(2)).act(requests.capture());
        ActionRequest second = requests.getAllValues().get(1);
        assertThat(second.namespace()).isEqualTo("github");
        assertThat(second.baseAddress()).isEqualTo("https://api.github.com");
        assertThat(second.headers()).containsEntry("Authorization", "token abc");
        assertThat(second.usageGuide()).isEqualTo("Use owner/repo.");
        assertThat(second.context()).isSameAs(outcome.context());
        assertThat(second.goal()).isEqualTo("Close the stale issues on GitHub");
    }

    @Test
    void run_shouldReportNoNextStepWithoutCompletion() {
        when(integrationDirectory.lookup(List.of("github"))).thenReturn(List.of(GITHUB));
        when(planningService.nextStep(anyString(), any(), any(), eq(MODEL)))
                .thenReturn(new NextStepDecision("  ", false, "stuck"));

        LoopOutcome outcome = loop.run(request(), listener);

        assertThat(outcome.termination()).isEqualTo(TerminationReason.NO_NEXT_STEP);
        assertThat(outcome.context().isEmpty()).isTrue();
        verifyNoInteractions(actionService);
    }

    @Test
    void run_shouldStopWhenListenerIsCancelled() {
        when(integrationDirectory.lookup(List.of("github"))).thenReturn(List.of(GITHUB));
        listener.cancelled = true;

        LoopOutcome outcome = loop.run(request(), listener);

        assertThat(outcome.termination()).isEqualTo(TerminationReason.CANCELLED);
        verifyNoInteractions(integrationSelector, actionService);
    }

    @Test
    void run_shouldFailFastWithoutCredential() {
        DeepRequest request = DeepRequest.builder()
                .namespaces(List.of("github"))
                .goal("anything")
                .model(new ModelConfig("mistral/large"))
                .build();

        assertThatThrownBy(() -> loop.run(request, listener)).isInstanceOf(MissingCredentialException.class);

        assertThat(listener.events).isEmpty();
        verifyNoInteractions(planningService, integrationSelector, actionService);
    }

    private static final class RecordingListener implements LoopListener {

        private final List<String> events = new ArrayList<>();
        private int maxSteps;
        private boolean cancelled;

        @Override
        public void onStart(List<Integration> integrations, int maxSteps) {
            this.maxSteps = maxSteps;
            events.add("begin:" + integrations.size());
        }

        @Override
        public void onStepStart(int stepNumber, Step step, Integration integration) {
            events.add("start:" + stepNumber + ":" + step.text());
        }

        @Override
        public void onStepComplete(StepRecord record, Integration integration, ActionResult result) {
            events.add("complete:" + record.stepNumber() + ":" + integration.id());
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }
    }
}
