package com.router.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Declarative, possibly nested description of the fields a caller accepts for one part of a
 * request (parameters or body). It is the contract the schema extractor must not violate.
 * <p>
 * Two stored shapes are understood by {@link #parse(JsonNode)}:
 * <ul>
 *   <li>a list of field entries, each carrying {@code name} (or {@code key}), {@code type},
 *       {@code required}, {@code description}, optionally {@code in} and a nested
 *       {@code schema}, {@code properties} or {@code fields};</li>
 *   <li>a JSON-Schema object with {@code properties} and a {@code required} array.</li>
 * </ul>
 * Entries without a boolean {@code required} flag are optional, as are properties missing from
 * the {@code required} array.
 */
public final class FieldSchema {

    private static final FieldSchema EMPTY = new FieldSchema(List.of());

    private final List<FieldDefinition> fields;

    public FieldSchema(List<FieldDefinition> fields) {
        this.fields = List.copyOf(fields);
    }

    public static FieldSchema empty() {
        return EMPTY;
    }

    public static FieldSchema of(FieldDefinition... fields) {
        return new FieldSchema(List.of(fields));
    }

    /**
     * Reads a stored schema; {@code null}, missing or unrecognised nodes yield the empty schema.
     */
    public static FieldSchema parse(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return EMPTY;
        }
        if (node.isArray()) {
            List<FieldDefinition> defs = new ArrayList<>();
            for (JsonNode entry : node) {
                if (entry.isObject()) {
                    fromEntry(entry, null).ifPresent(defs::add);
                }
            }
            return new FieldSchema(defs);
        }
        if (node.isObject() && node.has("properties")) {
            return new FieldSchema(fromProperties(node));
        }
        return EMPTY;
    }

    private static Optional<FieldDefinition> fromEntry(JsonNode entry, String fallbackName) {
        String name = text(entry, "name");
        if (name == null) {
            name = text(entry, "key");
        }
        if (name == null) {
            name = fallbackName;
        }
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        JsonNode schema = entry.path("schema").isObject() ? entry.get("schema") : entry;
        String typeName = text(entry, "type") != null ? text(entry, "type") : text(schema, "type");
        FieldType type = FieldType.of(typeName);
        boolean required = entry.path("required").isBoolean() && entry.get("required").asBoolean();
        String description = text(entry, "description") != null ? text(entry, "description") : text(schema, "description");

        List<FieldDefinition> nested = List.of();
        JsonNode props = schema.has("properties") ? schema.get("properties") : schema.get("fields");
        if (props != null) {
            nested = props.isArray() ? parse(props).fields() : fromProperties(schema);
        }
        FieldDefinition items = null;
        JsonNode itemsNode = schema.get("items");
        if (itemsNode != null && itemsNode.isObject()) {
            items = fromEntry(itemsNode, "items").orElse(null);
        }
        return Optional.of(new FieldDefinition(name, type, required, description, text(entry, "in"), nested, items));
    }

    private static List<FieldDefinition> fromProperties(JsonNode objectSchema) {
        JsonNode props = objectSchema.path("properties");
        if (!props.isObject()) {
            return List.of();
        }
        Set<String> required = new HashSet<>();
        if (objectSchema.path("required").isArray()) {
            objectSchema.path("required").forEach(r -> required.add(r.asText()));
        }

        List<FieldDefinition> defs = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> it = props.properties().iterator();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> property = it.next();
            fromEntry(property.getValue(), property.getKey()).ifPresent(def -> {
                defs.add(new FieldDefinition(property.getKey(), def.type(), required.contains(property.getKey()), def.description(),
                        def.location(), def.properties(), def.items()));
            });
        }
        return defs;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    @JsonValue
    public List<FieldDefinition> fields() {
        return fields;
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    /**
     * @return top-level field names in declaration order
     */
    public Set<String> declaredNames() {
        Set<String> names = new LinkedHashSet<>();
        fields.forEach(f -> names.add(f.name()));
        return Collections.unmodifiableSet(names);
    }

    public Optional<FieldDefinition> find(String name) {
        return fields.stream().filter(f -> f.name().equals(name)).findFirst();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof FieldSchema other && fields.equals(other.fields));
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "FieldSchema" + fields;
    }
}
