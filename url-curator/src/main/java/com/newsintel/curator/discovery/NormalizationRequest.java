package com.newsintel.curator.discovery;

import java.util.List;

/**
 * One normalization call.
 *
 * @param patterns    candidate patterns to group
 * @param temperature sampling temperature for the model
 * @param strict      true on the retry after malformed output
 */
public record NormalizationRequest(List<String> patterns, double temperature, boolean strict) {

    public NormalizationRequest {
        patterns = List.copyOf(patterns);
    }
}
