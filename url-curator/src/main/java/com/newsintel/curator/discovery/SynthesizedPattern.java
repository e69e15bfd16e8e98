package com.newsintel.curator.discovery;

import com.newsintel.curator.model.ContentType;

/**
 * A historical URL, the pattern synthesized from it, and its label.
 */
public record SynthesizedPattern(String url, String pattern, ContentType contentType) {
}
