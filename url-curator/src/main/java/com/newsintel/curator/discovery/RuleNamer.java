package com.newsintel.curator.discovery;

import com.newsintel.curator.model.ContentType;

import java.util.HashMap;
import java.util.Map;

/**
 * Names accepted rules from the content type they assert and hints in their pattern.
 * Keeps names unique within one source.
 */
class RuleNamer {

    static final String WITH_ID = "articles_with_id";
    static final String TIMESTAMPED = "timestamped_articles";
    static final String DATED = "dated_articles";
    static final String WITH_SLUG = "with_slug";

    private final Map<String, Integer> used = new HashMap<>();
    private int ordinal = 0;

    String nameFor(String pattern, ContentType contentType) {
        ordinal++;
        String base = contentType.value() + "_" + shape(pattern, ordinal);
        int seen = used.merge(base, 1, Integer::sum);
        return seen == 1 ? base : base + "_" + seen;
    }

    static String shape(String pattern, int ordinal) {
        if (pattern.contains("_" + PatternSynthesizer.ID_CLASS)
                || pattern.contains("/" + PatternSynthesizer.ID_CLASS)
                || pattern.contains("-" + PatternSynthesizer.ID_CLASS)) {
            return WITH_ID;
        }
        if (pattern.contains(PatternSynthesizer.TIMESTAMP_CLASS) || pattern.contains("20[0-9]{12}")) {
            return TIMESTAMPED;
        }
        if (pattern.contains("20[0-9]{2}") || pattern.contains("[0-9]{4}")) {
            return DATED;
        }
        if (pattern.contains(PatternSynthesizer.SLUG_CLASS)) {
            return WITH_SLUG;
        }
        return String.valueOf(ordinal);
    }
}
