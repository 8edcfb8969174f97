package com.router.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.router.config.LlmProperties;
import com.router.dto.llm.LlmMessage;
import com.router.dto.llm.LlmRequest;
import com.router.dto.llm.LlmResponse;
import com.router.exception.ApiRouterException;
import com.router.exception.ReasoningException;
import com.router.model.ModelConfig;
import com.router.reasoning.Signature;
import com.router.service.api.ReasoningFunction;
import java.time.Duration;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * {@link ReasoningFunction} backed by an OpenAI-compatible chat-completions endpoint.
 * <p>
 * The signature's instructions and output skeleton become the system message, the input record
 * serialized as snake_case JSON becomes the user message, and the JSON-mode answer is read back
 * into the signature's output type. The model and its key are taken from the {@link ModelConfig}
 * of each call; nothing about the model is kept between calls.
 */
@Service
@Slf4j
public class LlmReasoningFunction implements ReasoningFunction {

    private final WebClient webClient;
    private final LlmProperties properties;
    private final CredentialResolver credentialResolver;
    private final ObjectMapper objectMapper = new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public LlmReasoningFunction(WebClient webClient, LlmProperties properties, CredentialResolver credentialResolver) {
        this.webClient = webClient;
        this.properties = properties;
        this.credentialResolver = credentialResolver;
    }

    @Override
    public <I, O> O invoke(Signature<I, O> signature, I input, ModelConfig model) {
        String apiKey = credentialResolver.resolve(model);
        try {
            LlmRequest request = new LlmRequest(model.modelName(), List.of(
                    LlmMessage.system(systemPrompt(signature)),
                    LlmMessage.user(objectMapper.writeValueAsString(input))));

            log.debug("Reasoning call '{}' on {} with input: {}", signature.name(), model.llm(), request.getMessages().get(1).getContent());
            LlmResponse response = webClient.post()
                    .uri(properties.getEndpoint())
                    .header("Authorization", "Bearer " + apiKey)
                    .body(Mono.just(request), LlmRequest.class)
                    .retrieve()
                    .bodyToMono(LlmResponse.class)
                    .block(Duration.ofMillis(properties.getTimeoutMs()));

            String content = response == null ? null : response.firstContent().orElse(null);
            if (content == null || content.isBlank()) {
                throw new ReasoningException("Received an empty response from the LLM for '" + signature.name() + "'.");
            }
            log.debug("Reasoning call '{}' answered: {}", signature.name(), content);

            O output = objectMapper.readValue(stripFences(content), signature.outputType());
            if (output == null) {
                throw new ReasoningException("The LLM answered 'null' for '" + signature.name() + "'.");
            }
            return output;
        } catch (ApiRouterException e) {
            throw e;
        } catch (JsonProcessingException e) {
            log.error("Failed to parse the LLM answer for '{}'", signature.name(), e);
            throw new ReasoningException("The answer for '" + signature.name() + "' was not valid JSON of the expected shape.", e);
        } catch (WebClientResponseException e) {
            log.error("LLM call '{}' failed with status {} and body: {}", signature.name(), e.getStatusCode(), e.getResponseBodyAsString());
            throw new ReasoningException("LLM call '" + signature.name() + "' failed: " + e.getStatusCode(), e);
        } catch (Exception e) {
            log.error("Error calling the LLM for '{}'", signature.name(), e);
            throw new ReasoningException("An error occurred while communicating with the LLM.", e);
        }
    }

    private static String systemPrompt(Signature<?, ?> signature) {
        return signature.instructions()
                + "\n\nThe input is a JSON object. Respond with ONLY a valid JSON object of this form, "
                + "without explanations or markdown:\n"
                + signature.outputFormat();
    }

    /**
     * Removes a surrounding markdown code fence, which some providers add even in JSON mode.
     */
    static String stripFences(String content) {
        String trimmed = content.trim();
        if (!trimmed.startsWith("```")) {
            return trimmed;
        }
        int firstNewline = trimmed.indexOf('\n');
        int closing = trimmed.lastIndexOf("```");
        if (firstNewline < 0 || closing <= firstNewline) {
            return trimmed;
        }
        return trimmed.substring(firstNewline + 1, closing).trim();
    }
}
