package com.newsintel.curator.model;

import java.util.List;

/**
 * Partition of a batch into rule-classified links and links left for the fallback classifier.
 * Both lists keep the order of the input batch.
 */
public record BatchClassification(List<ClassifiedLink> classified, List<CandidateLink> unclassified) {

    public BatchClassification {
        classified = List.copyOf(classified);
        unclassified = List.copyOf(unclassified);
    }

    public int total() {
        return classified.size() + unclassified.size();
    }
}
