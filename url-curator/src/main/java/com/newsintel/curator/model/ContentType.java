package com.newsintel.curator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Top-level classification of a URL.
 */
public enum ContentType {
    CONTENT("content"),
    NOISE("noise");

    private final String value;

    ContentType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ContentType fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("content_type must not be null");
        }
        String normalised = value.trim().toLowerCase(Locale.ROOT);
        for (ContentType type : values()) {
            if (type.value.equals(normalised)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown content_type: " + value);
    }
}
