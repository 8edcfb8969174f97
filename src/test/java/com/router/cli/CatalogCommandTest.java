package com.router.cli;

import com.router.exception.NamespaceNotFoundException;
import com.router.model.FieldSchema;
import com.router.model.OperationDocument;
import com.router.service.api.DocumentStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CatalogCommandTest {

    @Mock
    private DocumentStore documentStore;

    @InjectMocks
    private CatalogCommand command;

    @TempDir
    Path tempDir;

    @Test
    void upsert_shouldInsertEveryDocumentOfFile() throws Exception {
        Path file = tempDir.resolve("github.json");
        Files.writeString(file, "[{\"text\":\"List issues\",\"metadata\":{\"url\":\"/issues\",\"method\":\"GET\"}},"
                + "{\"text\":\"Create an issue\",\"metadata\":{\"url\":\"/issues\",\"method\":\"POST\"}}]");
        when(documentStore.insert(eq("github"), anyString(), anyMap())).thenReturn("id-1", "id-2");

        String output = command.upsert("github", file.toString(), null, null);

        assertThat(output).contains("Inserted 2 document(s)").contains("id-1, id-2");
        verify(documentStore).insert("github", "Create an issue", Map.of("url", "/issues", "method", "POST"));
    }

    @Test
    void upsert_shouldInsertInlineDocument() {
        when(documentStore.insert("github", "List issues", Map.of("url", "/issues"))).thenReturn("id-9");

        String output = command.upsert("github", null, "List issues", "{\"url\":\"/issues\"}");

        assertThat(output).contains("id-9");
    }

    @Test
    void upsert_shouldRequireFileOrText() {
        assertThat(command.upsert("github", null, null, null)).contains("Either --file or --text is required.");
        verifyNoInteractions(documentStore);
    }

    @Test
    void catalog_shouldListOperations() {
        when(documentStore.list("github")).thenReturn(List.of(new OperationDocument("id-1", "github", "/issues", "GET",
                "List issues", FieldSchema.empty(), FieldSchema.empty(), null)));

        String output = command.catalog("github", false);

        assertThat(output).contains("/issues").contains("List issues").contains("id-1").contains("(1)");
    }

    @Test
    void catalog_shouldReportMissingNamespace() {
        when(documentStore.list("nowhere")).thenThrow(new NamespaceNotFoundException("nowhere"));

        assertThat(command.catalog("nowhere", false)).contains("Namespace 'nowhere' does not exist");
    }

    @Test
    void editPayload_shouldReplaceMetadata() {
        String output = command.editPayload("github", "id-1", "{\"description\":\"List all issues\"}");

        assertThat(output).contains("Updated document id-1");
        verify(documentStore).editPayload("github", "id-1", Map.of("description", "List all issues"));
    }
}
