package com.newsintel.curator.model;

/**
 * A historical URL with the content type it was finally labeled with.
 */
public record LabeledUrl(String source, String url, ContentType contentType) {
}
