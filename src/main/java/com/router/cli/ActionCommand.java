package com.router.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.router.cli.ui.JsonPrinter;
import com.router.config.LlmProperties;
import com.router.dto.request.ActionRequest;
import com.router.dto.request.IdentifyRequest;
import com.router.dto.response.ActionResult;
import com.router.dto.response.CommandResponse;
import com.router.dto.response.IdentifiedEndpoint;
import com.router.service.api.ActionService;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * Single-step commands: find the operation serving a goal, or find and call it.
 */
@ShellComponent
@Slf4j
public class ActionCommand {

    private final ActionService actionService;
    private final LlmProperties llmProperties;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public ActionCommand(ActionService actionService, LlmProperties llmProperties) {
        this.actionService = actionService;
        this.llmProperties = llmProperties;
    }

    @ShellMethod(key = "identify", value = "Finds the operation of a namespace that serves a query.")
    public String identify(
            @ShellOption(value = {"--namespace", "-n"}, help = "The namespace to search.") String namespace,
            @ShellOption(value = {"--query", "-q"}, arity = Integer.MAX_VALUE, help = "The natural language query.") String[] query,
            @ShellOption(value = {"--base-address", "-b"}, help = "Base URL of the integration.", defaultValue = "") String baseAddress,
            @ShellOption(value = "--rephrase", help = "Rephrase the query before retrieval.", defaultValue = "false", arity = 0) boolean rephrase,
            @ShellOption(value = "--instructions", help = "Rephrasing instructions.", defaultValue = ShellOption.NULL) String instructions,
            @ShellOption(value = {"--model", "-m"}, help = "Model id, e.g. openai/gpt-4.1.", defaultValue = ShellOption.NULL) String model
    ) {
        try {
            IdentifiedEndpoint result = actionService.identify(new IdentifyRequest(namespace, baseAddress, String.join(" ", query),
                    rephrase, instructions, JsonOptions.model(model, llmProperties.getDefaultModel())));
            if (!result.found()) {
                return CommandResponse.error("No operation in namespace '" + namespace + "' matches the query.").toAnsiString();
            }
            return JsonPrinter.colorize(objectMapper.valueToTree(result));
        } catch (Exception e) {
            return CommandResponse.error("An error occurred: " + e.getMessage()).toAnsiString();
        }
    }

    /**
     * Resolves one operation for the goal and calls it. With {@code --verbose} the root logger is
     * lowered to DEBUG for the duration of the command, which shows prompts and raw model answers.
     */
    @ShellMethod(key = "action", value = "Resolves and calls the operation that serves a goal.")
    public String action(
            @ShellOption(value = {"--namespace", "-n"}, help = "The namespace to search.") String namespace,
            @ShellOption(value = {"--base-address", "-b"}, help = "Base URL of the integration.") String baseAddress,
            @ShellOption(value = {"--goal", "-g"}, arity = Integer.MAX_VALUE, help = "The natural language goal.") String[] goal,
            @ShellOption(value = "--headers", help = "Request headers as a JSON object.", defaultValue = ShellOption.NULL) String headers,
            @ShellOption(value = "--context", help = "Results of earlier steps as a JSON object of step to result.", defaultValue = ShellOption.NULL) String context,
            @ShellOption(value = "--rephrase", help = "Rephrase the goal before retrieval.", defaultValue = "false", arity = 0) boolean rephrase,
            @ShellOption(value = "--instructions", help = "Rephrasing instructions.", defaultValue = ShellOption.NULL) String instructions,
            @ShellOption(value = {"--model", "-m"}, help = "Model id, e.g. openai/gpt-4.1.", defaultValue = ShellOption.NULL) String model,
            @ShellOption(value = "--prose", help = "Also summarize the response in natural language.", defaultValue = "false", arity = 0) boolean prose,
            @ShellOption(value = {"--verbose", "-v"}, help = "Enable verbose debug logging.", defaultValue = "false", arity = 0) boolean verbose
    ) {
        Logger rootLogger = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        Level originalLevel = rootLogger.getLevel();
        if (verbose) {
            rootLogger.setLevel(Level.DEBUG);
        }
        try {
            ActionResult result = actionService.act(ActionRequest.builder()
                    .namespace(namespace)
                    .baseAddress(baseAddress)
                    .goal(String.join(" ", goal))
                    .rephrase(rephrase)
                    .rephraseInstructions(instructions)
                    .headers(JsonOptions.object(headers, "--headers"))
                    .context(JsonOptions.context(context, namespace, "--context"))
                    .model(JsonOptions.model(model, llmProperties.getDefaultModel()))
                    .naturalLanguageResponse(prose)
                    .build());
            if (!result.resolved()) {
                return CommandResponse.error("No operation in namespace '" + namespace + "' matches the goal.").toAnsiString();
            }
            String rendered = JsonPrinter.colorize(objectMapper.valueToTree(result));
            if (result.naturalLanguageResponse() != null) {
                rendered += "\n\n" + CommandResponse.ok(result.naturalLanguageResponse()).toAnsiString();
            }
            return rendered;
        } catch (Exception e) {
            log.debug("action command failed", e);
            return CommandResponse.error("An error occurred: " + e.getMessage()).toAnsiString();
        } finally {
            if (verbose) {
                rootLogger.setLevel(originalLevel);
            }
        }
    }
}
