package com.router.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FieldSchemaTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void parse_shouldReadFieldList() throws Exception {
        FieldSchema schema = FieldSchema.parse(objectMapper.readTree("["
                + "{\"name\": \"owner\", \"type\": \"string\", \"in\": \"path\", \"required\": true, \"description\": \"Repository owner\"},"
                + "{\"name\": \"state\", \"type\": \"string\", \"in\": \"query\"},"
                + "{\"name\": \"per_page\", \"schema\": {\"type\": \"integer\"}, \"required\": false},"
                + "{\"key\": \"filter\", \"type\": \"object\", \"properties\": {\"label\": {\"type\": \"string\"}}}"
                + "]"));

        assertThat(schema.declaredNames()).containsExactly("owner", "state", "per_page", "filter");
        FieldDefinition owner = schema.find("owner").orElseThrow();
        assertThat(owner.isPathParameter()).isTrue();
        assertThat(owner.required()).isTrue();
        assertThat(owner.description()).isEqualTo("Repository owner");
        assertThat(schema.find("state").orElseThrow().required()).isFalse();
        FieldDefinition perPage = schema.find("per_page").orElseThrow();
        assertThat(perPage.type()).isEqualTo(FieldType.INTEGER);
        assertThat(perPage.required()).isFalse();
        assertThat(schema.find("filter").orElseThrow().properties())
                .extracting(FieldDefinition::name).containsExactly("label");
    }

    @Test
    void parse_shouldReadJsonSchemaObject() throws Exception {
        FieldSchema schema = FieldSchema.parse(objectMapper.readTree("{\"type\": \"object\","
                + "\"properties\": {\"title\": {\"type\": \"string\"}, \"labels\": {\"type\": \"array\", \"items\": {\"type\": \"string\"}}},"
                + "\"required\": [\"title\"]}"));

        assertThat(schema.declaredNames()).containsExactly("title", "labels");
        assertThat(schema.find("title").orElseThrow().required()).isTrue();
        FieldDefinition labels = schema.find("labels").orElseThrow();
        assertThat(labels.required()).isFalse();
        assertThat(labels.type()).isEqualTo(FieldType.ARRAY);
        assertThat(labels.items().type()).isEqualTo(FieldType.STRING);
    }

    @Test
    void parse_shouldTreatPropertiesAsOptionalWithoutRequiredArray() throws Exception {
        FieldSchema schema = FieldSchema.parse(objectMapper.readTree("{\"type\": \"object\","
                + "\"properties\": {\"assignee\": {\"type\": \"string\"},"
                + "\"meta\": {\"type\": \"object\", \"required\": [\"id\"], \"properties\": {\"id\": {\"type\": \"string\"}}}}}"));

        assertThat(schema.find("assignee").orElseThrow().required()).isFalse();
        FieldDefinition meta = schema.find("meta").orElseThrow();
        assertThat(meta.required()).isFalse();
        assertThat(meta.properties().get(0).required()).isTrue();
    }

    @Test
    void parse_shouldYieldEmptySchemaForMissingOrUnknownShapes() throws Exception {
        assertThat(FieldSchema.parse(null).isEmpty()).isTrue();
        assertThat(FieldSchema.parse(objectMapper.readTree("\"not a schema\"")).isEmpty()).isTrue();
        assertThat(FieldSchema.parse(objectMapper.readTree("{\"type\":\"object\"}")).isEmpty()).isTrue();
    }

    @Test
    void fieldType_shouldFallBackToString() {
        assertThat(FieldType.of("Integer")).isEqualTo(FieldType.INTEGER);
        assertThat(FieldType.of("uuid")).isEqualTo(FieldType.STRING);
        assertThat(FieldType.of(null)).isEqualTo(FieldType.STRING);
    }
}
