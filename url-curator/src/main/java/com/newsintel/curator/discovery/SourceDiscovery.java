package com.newsintel.curator.discovery;

import java.util.List;

/**
 * Discovery outcome for one source: validated rules plus exact noise URLs to cache.
 */
public record SourceDiscovery(String source, ValidationReport report, List<String> noiseUrls) {

    public SourceDiscovery {
        noiseUrls = List.copyOf(noiseUrls);
    }
}
