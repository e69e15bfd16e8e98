package com.newsintel.curator.model;

import lombok.Builder;
import lombok.Data;

/**
 * A link extracted from a source listing page, waiting for classification.
 */
@Data
@Builder
public class CandidateLink {

    private Long id;            // row id in the urls table, null for ad-hoc batches
    private String source;
    private String url;
    private String title;
}
