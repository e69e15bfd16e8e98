package com.newsintel.curator.discovery;

import java.util.List;

/**
 * Groups structurally equivalent regex patterns under one generalized pattern.
 */
public interface PatternNormalizer {

    /**
     * @throws MalformedNormalizationException when the response cannot be parsed
     */
    List<NormalizedGroup> normalize(NormalizationRequest request);
}
