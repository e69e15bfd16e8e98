package com.newsintel.curator.discovery;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A set of candidate patterns the normalizer proposes to replace with one pattern.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NormalizedGroup(
        @JsonProperty("normalized_pattern") String normalizedPattern,
        @JsonProperty("original_patterns") List<String> originalPatterns,
        @JsonProperty("reason") String reason) {

    public NormalizedGroup {
        originalPatterns = originalPatterns == null ? List.of() : List.copyOf(originalPatterns);
    }
}
