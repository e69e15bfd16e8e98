package com.newsintel.curator.model;

import lombok.Builder;
import lombok.Data;

/**
 * A candidate link with its rule-tier classification attached.
 */
@Data
@Builder
public class ClassifiedLink {

    public static final String METHOD_CACHED_URL = "cached_url";
    public static final String METHOD_REGEX_RULE = "regex_rule";

    private CandidateLink link;
    private ContentType contentType;
    private String classificationMethod;   // cached_url | regex_rule
    private String ruleName;

    /**
     * Secondary tag assigned by downstream classifiers. Opaque here, never set by rules.
     */
    private String contentSubtype;

    public static ClassifiedLink of(CandidateLink link, Classification classification) {
        return ClassifiedLink.builder()
                .link(link)
                .contentType(classification.contentType())
                .classificationMethod(classification.fromCache() ? METHOD_CACHED_URL : METHOD_REGEX_RULE)
                .ruleName(classification.ruleName())
                .build();
    }
}
