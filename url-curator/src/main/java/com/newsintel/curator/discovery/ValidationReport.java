package com.newsintel.curator.discovery;

import com.newsintel.curator.model.ClassificationRule;

import java.util.List;

/**
 * Outcome of validating one source's candidate patterns.
 *
 * @param dedupRatio unique patterns over synthesized triples, 0 when there were none
 * @param normalized whether the candidates went through the normalizer
 * @param rejected   candidates dropped for low coverage, low consistency or a bad pattern
 */
public record ValidationReport(int totalTriples,
                               int uniquePatterns,
                               double dedupRatio,
                               boolean normalized,
                               int candidatesValidated,
                               int rejected,
                               List<ClassificationRule> rules) {

    public ValidationReport {
        rules = List.copyOf(rules);
    }
}
