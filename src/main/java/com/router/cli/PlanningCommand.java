package com.router.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.router.cli.ui.JsonPrinter;
import com.router.config.LlmProperties;
import com.router.dto.request.DeepRequest;
import com.router.dto.request.GenerateStepsRequest;
import com.router.dto.response.CommandResponse;
import com.router.dto.response.GeneratedSteps;
import com.router.service.api.DeepStreamService;
import com.router.service.api.StepGenerationService;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * Multi-step commands: plan a goal up front, or run it step by step while streaming events.
 */
@ShellComponent
public class PlanningCommand {

    private final StepGenerationService stepGenerationService;
    private final DeepStreamService deepStreamService;
    private final LlmProperties llmProperties;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public PlanningCommand(StepGenerationService stepGenerationService, DeepStreamService deepStreamService,
                           LlmProperties llmProperties) {
        this.stepGenerationService = stepGenerationService;
        this.deepStreamService = deepStreamService;
        this.llmProperties = llmProperties;
    }

    @ShellMethod(key = "steps", value = "Decomposes a goal into single-integration steps without executing them.")
    public String steps(
            @ShellOption(value = {"--namespaces", "-n"}, help = "Comma-separated namespaces.") String namespaces,
            @ShellOption(value = {"--goal", "-g"}, arity = Integer.MAX_VALUE, help = "The natural language goal.") String[] goal,
            @ShellOption(value = {"--model", "-m"}, help = "Model id, e.g. openai/gpt-4.1.", defaultValue = ShellOption.NULL) String model
    ) {
        try {
            GeneratedSteps generated = stepGenerationService.generate(new GenerateStepsRequest(
                    String.join(" ", goal), split(namespaces), JsonOptions.model(model, llmProperties.getDefaultModel())));
            return JsonPrinter.colorize(objectMapper.valueToTree(generated));
        } catch (Exception e) {
            return CommandResponse.error("An error occurred: " + e.getMessage()).toAnsiString();
        }
    }

    /**
     * Prints every event line as soon as it is produced. A failing step ends the output with a red
     * error line after the events already printed.
     */
    @ShellMethod(key = "deep", value = "Executes a multi-step goal, printing NDJSON events as they happen.")
    public void deep(
            @ShellOption(value = {"--namespaces", "-n"}, help = "Comma-separated namespaces.") String namespaces,
            @ShellOption(value = {"--goal", "-g"}, arity = Integer.MAX_VALUE, help = "The natural language goal.") String[] goal,
            @ShellOption(value = "--base-addresses", help = "JSON object of namespace to base URL.", defaultValue = ShellOption.NULL) String baseAddresses,
            @ShellOption(value = "--headers", help = "JSON object of namespace to header object.", defaultValue = ShellOption.NULL) String headers,
            @ShellOption(value = "--rephrase", help = "Rephrase each step before retrieval.", defaultValue = "false", arity = 0) boolean rephrase,
            @ShellOption(value = "--instructions", help = "Rephrasing instructions.", defaultValue = ShellOption.NULL) String instructions,
            @ShellOption(value = {"--model", "-m"}, help = "Model id, e.g. openai/gpt-4.1.", defaultValue = ShellOption.NULL) String model,
            @ShellOption(value = "--no-prose", help = "Skip the per-step natural language summaries.", defaultValue = "false", arity = 0) boolean noProse
    ) {
        PrintStream out = System.out;
        try {
            DeepRequest request = DeepRequest.builder()
                    .namespaces(split(namespaces))
                    .goal(String.join(" ", goal))
                    .baseAddressByNamespace(JsonOptions.parse(baseAddresses, new TypeReference<Map<String, String>>() {
                    }, Map.of(), "--base-addresses"))
                    .headersByNamespace(JsonOptions.parse(headers, new TypeReference<Map<String, Map<String, Object>>>() {
                    }, Map.of(), "--headers"))
                    .rephrase(rephrase)
                    .rephraseInstructions(instructions)
                    .model(JsonOptions.model(model, llmProperties.getDefaultModel()))
                    .naturalLanguageResponse(!noProse)
                    .build();
            for (String line : deepStreamService.stream(request).toIterable()) {
                out.print(line);
                out.flush();
            }
        } catch (Exception e) {
            out.println(CommandResponse.error("Session aborted: " + e.getMessage()).toAnsiString());
        }
    }

    private static List<String> split(String namespaces) {
        return Arrays.stream(namespaces.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
