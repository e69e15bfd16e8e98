package com.newsintel.curator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RuleScope {
    GLOBAL, SOURCE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RuleScope fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
