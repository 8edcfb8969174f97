package com.router.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * One declared field of a {@link FieldSchema}.
 *
 * @param name        field name as it must appear in the extracted object
 * @param type        declared type
 * @param required    whether the caller expects the field to be present
 * @param description free-text hint for extraction
 * @param location    for request parameters, where the value goes ({@code path}, {@code query}, {@code header});
 *                    {@code null} for body fields
 * @param properties  nested fields when {@code type} is {@link FieldType#OBJECT}, otherwise empty
 * @param items       element definition when {@code type} is {@link FieldType#ARRAY}, may be {@code null}
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record FieldDefinition(
        String name,
        FieldType type,
        boolean required,
        String description,
        String location,
        List<FieldDefinition> properties,
        FieldDefinition items) {

    public FieldDefinition {
        properties = properties == null ? List.of() : List.copyOf(properties);
    }

    public static FieldDefinition of(String name, FieldType type, boolean required, String description) {
        return new FieldDefinition(name, type, required, description, null, List.of(), null);
    }

    public boolean isPathParameter() {
        return "path".equalsIgnoreCase(location);
    }
}
