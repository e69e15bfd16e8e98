package com.newsintel.curator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A named regex pattern plus the content type it asserts.
 *
 * Scope and source key are implied by where the rule sits in the catalogue;
 * they are filled in when the rule is published into a snapshot.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ClassificationRule {

    @JsonProperty("name")
    String name;

    @JsonProperty("pattern")
    String pattern;

    @JsonProperty("content_type")
    ContentType contentType;

    @JsonProperty("scope")
    RuleScope scope;

    @JsonProperty("source_key")
    String sourceKey;

    @JsonProperty("metadata")
    RuleMetadata metadata;

    public String displayName() {
        return name == null || name.isBlank() ? "unnamed_rule" : name;
    }
}
