package com.newsintel.curator.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of a discovery run, keyed by source.
 *
 * @param globalRules       replacement global rules, or null to keep the persisted ones
 * @param rulesBySource     validated rules for each source that produced any
 * @param noiseUrlsBySource exact noise URLs to cache for each source
 */
public record DiscoveryResult(List<ClassificationRule> globalRules,
                              Map<String, List<ClassificationRule>> rulesBySource,
                              Map<String, List<String>> noiseUrlsBySource) {

    public DiscoveryResult {
        globalRules = globalRules == null ? null : List.copyOf(globalRules);
        rulesBySource = new LinkedHashMap<>(rulesBySource);
        noiseUrlsBySource = new LinkedHashMap<>(noiseUrlsBySource);
    }

    public static DiscoveryResult forSources(Map<String, List<ClassificationRule>> rulesBySource,
                                             Map<String, List<String>> noiseUrlsBySource) {
        return new DiscoveryResult(null, rulesBySource, noiseUrlsBySource);
    }

    public boolean isEmpty() {
        return globalRules == null && rulesBySource.isEmpty() && noiseUrlsBySource.isEmpty();
    }
}
