package com.router.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.router.config.LlmProperties;
import com.router.dto.request.ActionRequest;
import com.router.dto.request.IdentifyRequest;
import com.router.dto.response.ActionResult;
import com.router.dto.response.IdentifiedEndpoint;
import com.router.exception.MissingCredentialException;
import com.router.model.Candidate;
import com.router.model.ModelConfig;
import com.router.reasoning.Signatures;
import com.router.reasoning.Signatures.EndpointSummary;
import com.router.retrieval.PayloadMapper;
import com.router.service.api.HybridRetriever;
import com.router.service.api.ReasoningFunction;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Runs the single-step pipeline with real resolver, extractor and executor; only the model and
 * the vector store are stubbed.
 */
@ExtendWith(MockitoExtension.class)
class ActionServiceImplTest {

    private static final ModelConfig MODEL = new ModelConfig("openai/gpt-4.1-mini");
    private static final String STAMP = "[Current date and time: 2026-01-15 09:30:00 UTC (Thursday, January 15, 2026)]\n\n";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockWebServer mockApi;
    private ActionServiceImpl actionService;

    @Mock
    private ReasoningFunction reasoningFunction;
    @Mock
    private HybridRetriever retriever;

    @BeforeEach
    void setUp() throws IOException {
        mockApi = new MockWebServer();
        mockApi.start();

        LlmProperties llm = new LlmProperties();
        llm.setApiKeys(Map.of("openai", "test-key"));
        TemporalContext temporalContext = new TemporalContext(
                Clock.fixed(Instant.parse("2026-01-15T09:30:00Z"), ZoneOffset.UTC));

        EndpointResolverImpl resolver = new EndpointResolverImpl(reasoningFunction, retriever,
                new LlmEndpointFilter(reasoningFunction), new PayloadMapper());
        OperationExecutorImpl executor = new OperationExecutorImpl(WebClient.builder().build(),
                new SchemaExtractorImpl(reasoningFunction), reasoningFunction, new OperationCommandFactory());
        actionService = new ActionServiceImpl(resolver, executor, new CredentialResolver(llm), temporalContext);
    }

    @AfterEach
    void tearDown() throws IOException {
        mockApi.shutdown();
    }

    private void issuesNamespace() {
        when(retriever.retrieve(eq("issues"), anyString())).thenReturn(List.of(
                new Candidate("post-issues", Map.of("url", "/issues", "method", "POST", "description", "Create an issue",
                        "body", "[{\"name\":\"title\",\"type\":\"string\",\"required\":true}]"), 0.58, 1),
                new Candidate("get-issues", Map.of("url", "/issues", "method", "GET", "description", "List issues"), 0.53, 2)));
        when(reasoningFunction.invoke(eq(Signatures.FILTER_ENDPOINTS), any(), eq(MODEL)))
                .thenReturn(new Signatures.FilterOutput(List.of(new EndpointSummary("/issues", "List issues", "GET"))));
    }

    @Test
    void act_shouldListOpenIssuesEndToEnd() throws Exception {
        // --- Arrange ---
        issuesNamespace();
        String payload = "[{\"id\":1,\"title\":\"Crash on start\",\"state\":\"open\"},{\"id\":2,\"title\":\"Typo\",\"state\":\"open\"}]";
        mockApi.enqueue(new MockResponse().setBody(payload).addHeader("Content-Type", "application/json"));

        // --- Act ---
        ActionResult result = actionService.act(ActionRequest.builder()
                .namespace("issues")
                .baseAddress(String.format("http://localhost:%s", mockApi.getPort()))
                .goal("list open issues")
                .model(MODEL)
                .build());

        // --- Assert ---
        assertThat(result.resolved()).isTrue();
        assertThat(result.operation().operationKey()).isEqualTo("GET /issues");
        assertThat(result.parameters().isEmpty()).isTrue();
        assertThat(result.body().isEmpty()).isTrue();
        assertThat(result.response()).isEqualTo(objectMapper.readTree(payload));
        assertThat(result.rephrasedQuery()).isEqualTo(STAMP + "list open issues");

        RecordedRequest recordedRequest = mockApi.takeRequest();
        assertThat(recordedRequest.getMethod()).isEqualTo("GET");
        assertThat(recordedRequest.getPath()).isEqualTo("/issues");

        // empty schemas never reach the model
        verify(reasoningFunction, never()).invoke(eq(Signatures.EXTRACT), any(), any());
        ArgumentCaptor<String> query = ArgumentCaptor.forClass(String.class);
        verify(retriever).retrieve(eq("issues"), query.capture());
        assertThat(query.getValue()).startsWith("[Current date and time: 2026-01-15 09:30:00 UTC");
    }

    @Test
    void act_shouldReturnUnresolvedResultWithoutCallingTheApi() {
        when(retriever.retrieve(eq("issues"), anyString())).thenReturn(List.of());

        ActionResult result = actionService.act(ActionRequest.builder()
                .namespace("issues")
                .baseAddress(String.format("http://localhost:%s", mockApi.getPort()))
                .goal("water the plants")
                .model(MODEL)
                .build());

        assertThat(result.resolved()).isFalse();
        assertThat(result.response()).isNull();
        assertThat(mockApi.getRequestCount()).isZero();
    }

    @Test
    void act_shouldFailFastWithoutCredential() {
        assertThatThrownBy(() -> actionService.act(ActionRequest.builder()
                .namespace("issues")
                .goal("list open issues")
                .model(new ModelConfig("mistral/large"))
                .build()))
                .isInstanceOf(MissingCredentialException.class);

        verifyNoInteractions(retriever, reasoningFunction);
    }

    @Test
    void identify_shouldJoinBaseAddressWithOperationPath() {
        issuesNamespace();

        IdentifiedEndpoint identified = actionService.identify(
                new IdentifyRequest("issues", "https://tracker.example.com/", "list open issues", false, null, MODEL));

        assertThat(identified.found()).isTrue();
        assertThat(identified.endpoint().pointId()).isEqualTo("get-issues");
        assertThat(identified.address()).isEqualTo("https://tracker.example.com/issues");
    }
}
