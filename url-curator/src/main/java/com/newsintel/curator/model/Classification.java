package com.newsintel.curator.model;

/**
 * Result of a rule-tier match.
 *
 * @param contentType type asserted by the matching rule or cache entry
 * @param ruleName    name of the matching rule, {@code cached_url} for cache hits
 */
public record Classification(ContentType contentType, String ruleName) {

    public static final String CACHED_URL = "cached_url";

    public boolean fromCache() {
        return CACHED_URL.equals(ruleName);
    }
}
