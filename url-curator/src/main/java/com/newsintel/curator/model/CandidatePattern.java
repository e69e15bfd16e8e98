package com.newsintel.curator.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * A synthesized pattern and the URLs that produced it. Lives only during a discovery run.
 */
@Getter
public class CandidatePattern {

    private final String pattern;
    private final Map<ContentType, Integer> contentTypeTally = new EnumMap<>(ContentType.class);
    private final List<String> exampleUrls = new ArrayList<>();

    public CandidatePattern(String pattern) {
        this.pattern = pattern;
    }

    public CandidatePattern add(String url, ContentType contentType) {
        exampleUrls.add(url);
        contentTypeTally.merge(contentType, 1, Integer::sum);
        return this;
    }

    /**
     * Folds another candidate's examples into this one, used when patterns are merged.
     */
    public CandidatePattern absorb(CandidatePattern other) {
        exampleUrls.addAll(other.exampleUrls);
        other.contentTypeTally.forEach((type, count) -> contentTypeTally.merge(type, count, Integer::sum));
        return this;
    }

    public ContentType dominantType() {
        return contentTypeTally.entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .map(Map.Entry::getKey)
                .orElse(ContentType.CONTENT);
    }

    public List<String> getExampleUrls() {
        return Collections.unmodifiableList(exampleUrls);
    }

    public Map<ContentType, Integer> getContentTypeTally() {
        return Collections.unmodifiableMap(contentTypeTally);
    }
}
