package com.router.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Primitive and structural types a {@link FieldDefinition} may declare.
 */
public enum FieldType {
    STRING,
    INTEGER,
    NUMBER,
    BOOLEAN,
    OBJECT,
    ARRAY,
    NULL;

    /**
     * Lenient lookup; unknown or missing names fall back to {@link #STRING}.
     */
    public static FieldType of(String name) {
        if (name == null || name.isBlank()) {
            return STRING;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return STRING;
        }
    }

    @JsonValue
    public String jsonName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
