package com.router.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.router.cli.ui.JsonPrinter;
import com.router.dto.request.DocumentUpload;
import com.router.dto.response.CommandResponse;
import com.router.exception.NamespaceNotFoundException;
import com.router.model.OperationDocument;
import com.router.service.api.DocumentStore;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * Maintains the operation catalog of a namespace.
 */
@ShellComponent
@Slf4j
public class CatalogCommand {

    private final DocumentStore documentStore;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public CatalogCommand(DocumentStore documentStore) {
        this.documentStore = documentStore;
    }

    /**
     * Inserts either one document given inline, or every entry of a JSON file holding an array
     * of {@code {"text": ..., "metadata": {...}}} objects.
     */
    @ShellMethod(key = "upsert", value = "Embeds operation documents into a namespace.")
    public String upsert(
            @ShellOption(value = {"--namespace", "-n"}, help = "The target namespace.") String namespace,
            @ShellOption(value = {"--file", "-f"}, help = "JSON file with an array of {text, metadata}.", defaultValue = ShellOption.NULL) String file,
            @ShellOption(value = {"--text", "-t"}, help = "Text to embed for a single document.", defaultValue = ShellOption.NULL) String text,
            @ShellOption(value = "--metadata", help = "Metadata of a single document as JSON.", defaultValue = ShellOption.NULL) String metadata
    ) {
        try {
            List<DocumentUpload> uploads = new ArrayList<>();
            if (file != null) {
                uploads.addAll(objectMapper.readValue(new File(file), new TypeReference<List<DocumentUpload>>() {
                }));
            } else if (text != null) {
                uploads.add(new DocumentUpload(text, JsonOptions.object(metadata, "--metadata")));
            } else {
                return CommandResponse.error("Either --file or --text is required.").toAnsiString();
            }

            List<String> ids = new ArrayList<>();
            for (DocumentUpload upload : uploads) {
                ids.add(documentStore.insert(namespace, upload.text(), upload.metadata() == null ? Map.of() : upload.metadata()));
            }
            return CommandResponse.ok("Inserted " + ids.size() + " document(s) into '" + namespace + "': " + String.join(", ", ids))
                    .toAnsiString();
        } catch (IOException e) {
            return CommandResponse.error("Could not read " + file + ": " + e.getMessage()).toAnsiString();
        } catch (Exception e) {
            log.debug("upsert failed", e);
            return CommandResponse.error("An error occurred: " + e.getMessage()).toAnsiString();
        }
    }

    @ShellMethod(key = "catalog", value = "Lists the operations stored in a namespace.")
    public String catalog(
            @ShellOption(value = {"--namespace", "-n"}, help = "The namespace to list.") String namespace,
            @ShellOption(value = "--json", help = "Print full documents as JSON.", defaultValue = "false", arity = 0) boolean json
    ) {
        try {
            List<OperationDocument> documents = documentStore.list(namespace);
            if (json) {
                return JsonPrinter.colorize(objectMapper.valueToTree(documents));
            }
            StringBuilder sb = new StringBuilder(JsonPrinter.ANSI_CYAN + "Operations in namespace: " + JsonPrinter.ANSI_YELLOW
                    + namespace + JsonPrinter.ANSI_RESET + " (" + documents.size() + ")\n");
            for (OperationDocument doc : documents) {
                sb.append("  ").append(JsonPrinter.ANSI_GREEN).append(String.format("%-7s", doc.method())).append(JsonPrinter.ANSI_RESET)
                        .append(doc.url()).append("  ").append(doc.description() == null ? "" : doc.description())
                        .append(JsonPrinter.ANSI_PURPLE).append("  [").append(doc.pointId()).append(']').append(JsonPrinter.ANSI_RESET)
                        .append('\n');
            }
            return sb.toString();
        } catch (NamespaceNotFoundException e) {
            return CommandResponse.error(e.getMessage()).toAnsiString();
        } catch (Exception e) {
            return CommandResponse.error("An error occurred: " + e.getMessage()).toAnsiString();
        }
    }

    @ShellMethod(key = "edit-payload", value = "Replaces the metadata of one document.")
    public String editPayload(
            @ShellOption(value = {"--namespace", "-n"}, help = "The namespace of the document.") String namespace,
            @ShellOption(value = "--id", help = "The document identifier.") String id,
            @ShellOption(value = "--metadata", help = "The new metadata as JSON.") String metadata
    ) {
        try {
            documentStore.editPayload(namespace, id, JsonOptions.object(metadata, "--metadata"));
            return CommandResponse.ok("Updated document " + id + " in '" + namespace + "'.").toAnsiString();
        } catch (Exception e) {
            return CommandResponse.error("An error occurred: " + e.getMessage()).toAnsiString();
        }
    }
}
