package com.newsintel.curator.discovery;

/**
 * The normalizer answered, but the answer could not be parsed into groups.
 */
public class MalformedNormalizationException extends RuntimeException {

    public MalformedNormalizationException(String message) {
        super(message);
    }

    public MalformedNormalizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
