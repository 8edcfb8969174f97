package com.router.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which part of a request a {@link FieldSchema} describes.
 */
public enum SchemaType {
    PARAMETERS("parameters"),
    BODY("body");

    private final String jsonName;

    SchemaType(String jsonName) {
        this.jsonName = jsonName;
    }

    @JsonValue
    public String jsonName() {
        return jsonName;
    }
}
