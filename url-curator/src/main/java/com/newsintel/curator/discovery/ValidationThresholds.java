package com.newsintel.curator.discovery;

import com.newsintel.curator.config.CurationProperties;

public record ValidationThresholds(int minCoverage, double minConsistencyPct) {

    public static ValidationThresholds from(CurationProperties.Discovery discovery) {
        return new ValidationThresholds(discovery.getMinCoverage(), discovery.getMinConsistencyPct());
    }
}
