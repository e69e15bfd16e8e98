package com.newsintel.curator.rules;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives the keys a URL is looked up under in the per-source rule and cache maps.
 *
 * "https://www.bbc.com/news/x" → ["bbc.com", "bbc"]
 */
public final class SourceKeys {

    private static final Pattern HOST = Pattern.compile("^[a-z][a-z0-9+.-]*://(?:www\\.)?([^/?#:@]+)",
            Pattern.CASE_INSENSITIVE);

    private SourceKeys() {
    }

    /** Host without a leading "www.", lower-cased, or "" when the URL has no host. */
    public static String domain(String url) {
        if (url == null) return "";
        Matcher m = HOST.matcher(url.trim());
        return m.find() ? m.group(1).toLowerCase(Locale.ROOT) : "";
    }

    /** First label of the domain, or null when the domain has no dot. */
    public static String shortDomain(String domain) {
        int dot = domain.indexOf('.');
        return dot > 0 ? domain.substring(0, dot) : null;
    }

    public static List<String> candidateKeys(String url) {
        String domain = domain(url);
        if (domain.isEmpty()) return List.of();
        String shortDomain = shortDomain(domain);
        return shortDomain == null ? List.of(domain) : List.of(domain, shortDomain);
    }
}
