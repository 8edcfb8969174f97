package com.router.reasoning;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.router.model.FieldSchema;
import com.router.model.Integration;
import java.util.List;

/**
 * The reasoning tasks of the pipeline and their typed input and output records.
 * <p>
 * Every record is serialized with snake_case property names, which is also the naming the
 * {@code outputFormat} skeletons use.
 */
public final class Signatures {

    private static final String TEMPORAL_NOTE =
            "The query may start with the current date and time in brackets; use it only when the request is time-dependent.";

    private Signatures() {
    }

    public record RephraseInput(String rephrasalInstructions, String query) {
    }

    public record RephraseOutput(String rephrasedQuery) {
    }

    public static final Signature<RephraseInput, RephraseOutput> REPHRASE = new Signature<>(
            "rephrase",
            "Rewrite the query in a slightly more formal and technical way so that it reads like the wording "
                    + "of API documentation. Follow the rephrasal instructions. " + TEMPORAL_NOTE,
            "{\"rephrased_query\": \"string\"}",
            RephraseOutput.class);

    public record EndpointSummary(String url, String description, String method) {
    }

    public record FilterInput(List<EndpointSummary> endpoints, String query) {
    }

    public record FilterOutput(List<EndpointSummary> filteredEndpoints) {
    }

    public static final Signature<FilterInput, FilterOutput> FILTER_ENDPOINTS = new Signature<>(
            "filter-endpoints",
            "You receive a list of API endpoints and a query. Judge each endpoint mainly by its description and "
                    + "select the single endpoint that best serves the query. A partial or loose match is acceptable; "
                    + "never answer with an empty list when endpoints are given. Copy url and method exactly as given. "
                    + "Return exactly one endpoint.",
            "{\"filtered_endpoints\": [{\"url\": \"string\", \"description\": \"string\", \"method\": \"string\"}]}",
            FilterOutput.class);

    public record DecomposeInput(String query, String workflowInstructions) {
    }

    public record DecomposeOutput(List<String> steps) {
    }

    public static final Signature<DecomposeInput, DecomposeOutput> DECOMPOSE = new Signature<>(
            "decompose",
            "Split the user's request into an ordered list of steps. Each step is one atomic action against exactly "
                    + "one platform or API, names that platform, and can be executed on its own. Order the steps so "
                    + "later ones can use the results of earlier ones. No step may be pure local computation: "
                    + "counting or analysing results belongs to the step that retrieves them. Follow the workflow "
                    + "instructions when present. " + TEMPORAL_NOTE,
            "{\"steps\": [\"string\"]}",
            DecomposeOutput.class);

    public record NextStepInput(String originalQuery, String contextFromPreviousSteps, String workflowInstructions) {
    }

    /**
     * Answer of the dynamic step generator.
     *
     * @param nextStep  the next action, or {@code null} when nothing remains
     * @param complete  whether the original query is fully addressed
     * @param reasoning why the step is needed or why the query is complete
     */
    public record NextStepDecision(
            String nextStep,
            @JsonProperty("is_complete") boolean complete,
            String reasoning) {

        public boolean hasNextStep() {
            return nextStep != null && !nextStep.isBlank();
        }
    }

    public static final Signature<NextStepInput, NextStepDecision> NEXT_STEP = new Signature<>(
            "next-step",
            "Decide the single next step towards fulfilling the original query, using the results of the steps "
                    + "already executed. The step is one concise sentence of 10 to 15 words, performs one action on "
                    + "one platform and always names that platform. When the query needs an operation on several "
                    + "resources and the API handles one resource at a time, plan one step per resource. "
                    + "If the previous results already satisfy the query, set is_complete to true and next_step to "
                    + "null; do not invent further work. If the step you return is the last one needed, you may set "
                    + "is_complete to true together with it. " + TEMPORAL_NOTE,
            "{\"next_step\": \"string or null\", \"is_complete\": false, \"reasoning\": \"string\"}",
            NextStepDecision.class);

    public record IntegrationPickInput(String query, List<Integration> integrations) {
    }

    public record IntegrationPickOutput(String integrationId) {
    }

    public static final Signature<IntegrationPickInput, IntegrationPickOutput> PICK_INTEGRATION = new Signature<>(
            "pick-integration",
            "Choose the one integration whose API can carry out the query. Answer with its id exactly as listed.",
            "{\"integration_id\": \"string\"}",
            IntegrationPickOutput.class);

    public record ExtractionInput(String query, FieldSchema schema, String schemaType) {
    }

    public record ExtractionOutput(JsonNode extractedData) {
    }

    public static final Signature<ExtractionInput, ExtractionOutput> EXTRACT = new Signature<>(
            "extract",
            "Extract structured data from the query for the given schema. The schema type tells whether the data "
                    + "are request parameters or a request body. Rules: use only the field names the schema declares, "
                    + "never add, rename or nest fields the schema does not define; fill every required field; include "
                    + "an optional field only when its value can be determined from the query or the previous results; "
                    + "respect the declared types. When an integration manual is part of the query, follow its "
                    + "platform-specific guidance. " + TEMPORAL_NOTE,
            "{\"extracted_data\": {}}",
            ExtractionOutput.class);

    public record SynthesisInput(String query, JsonNode structureOfData, JsonNode data) {
    }

    public record SynthesisOutput(String naturalLanguageResponse) {
    }

    public static final Signature<SynthesisInput, SynthesisOutput> SYNTHESIZE = new Signature<>(
            "synthesize",
            "Answer the query in clear natural language using the data, whose layout is described by "
                    + "structure_of_data. Include every concrete value present in the data: identifiers, names, "
                    + "statuses and all other attributes. Do not summarise values away. " + TEMPORAL_NOTE,
            "{\"natural_language_response\": \"string\"}",
            SynthesisOutput.class);

    public record AnswerInput(String query, String context) {
    }

    public record AnswerOutput(String response) {
    }

    public static final Signature<AnswerInput, AnswerOutput> FINAL_ANSWER = new Signature<>(
            "final-answer",
            "Answer the user's query in natural language from the results of the executed steps given as context. "
                    + TEMPORAL_NOTE,
            "{\"response\": \"string\"}",
            AnswerOutput.class);
}
