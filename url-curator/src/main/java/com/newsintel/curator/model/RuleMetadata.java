package com.newsintel.curator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Evidence recorded when a rule was discovered. Hand-written rules usually carry none.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RuleMetadata {

    @JsonProperty("example_count")
    Integer exampleCount;

    /** Share of the source's historical URLs matched, 0-100 */
    @JsonProperty("coverage_pct")
    Double coveragePct;

    /** Share of matches carrying the rule's content type, 0-100 */
    @JsonProperty("consistency_pct")
    Double consistencyPct;

    @JsonProperty("confidence")
    String confidence;

    @Singular
    @JsonProperty("sample_urls")
    List<String> sampleUrls;
}
