package com.newsintel.curator.discovery;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Generalizes one concrete URL into a candidate regex.
 *
 * Converts concrete components to regex classes, in this order:
 *  - timestamps:   20251110083000      → [0-9]{14}
 *  - dates:        2025-11-10          → 20[0-9]{2}[-/][0-9]{2}[-/][0-9]{2}
 *  - numeric ids:  _1234567, /1234567  → _[0-9]+, /[0-9]+
 *  - slugs:        /some-article/      → /[^/]+/
 *
 * Ids are replaced before slugs so an id never disappears into a slug class.
 * Replaced components are held as placeholder characters while the remaining
 * literal text is still raw; escaping happens once at the end, so the pattern
 * always matches the URL it was built from.
 */
@Component
@Slf4j
public class PatternSynthesizer {

    public static final String TIMESTAMP_CLASS = "[0-9]{14}";
    public static final String DATE_YMD_CLASS = "20[0-9]{2}[-/][0-9]{2}[-/][0-9]{2}";
    public static final String DATE_DMY_CLASS = "[0-9]{2}[-/][0-9]{2}[-/]20[0-9]{2}";
    public static final String ID_CLASS = "[0-9]+";
    public static final String SLUG_CLASS = "[^/]+";

    static final int MAX_SLUG_PASSES = 10;

    // Private-use code points stand in for already generalized components
    private static final char TIMESTAMP = '\uE000';
    private static final char DATE_YMD = '\uE001';
    private static final char DATE_DMY = '\uE002';
    private static final char ID = '\uE003';
    private static final char SLUG = '\uE004';
    private static final char FIRST_PLACEHOLDER = TIMESTAMP;
    private static final char LAST_PLACEHOLDER = SLUG;

    private static final Pattern SCHEME_AND_HOST = Pattern.compile("^(https?)://([^/?#]*)", Pattern.CASE_INSENSITIVE);

    private static final Pattern TIMESTAMP_RUN = Pattern.compile("(?<![0-9])[0-9]{14}(?![0-9])");
    private static final Pattern DATE_YMD_RUN = Pattern.compile("(?<![0-9])20[0-9]{2}[-/][0-9]{2}[-/][0-9]{2}(?![0-9])");
    private static final Pattern DATE_DMY_RUN = Pattern.compile("(?<![0-9])[0-9]{2}[-/][0-9]{2}[-/]20[0-9]{2}(?![0-9])");

    private static final Pattern UNDERSCORE_ID = Pattern.compile("_[0-9]{7,}(?![0-9])");
    private static final Pattern TRAILING_SEGMENT_ID = Pattern.compile("/[0-9]{7,}(?=/?$)");
    private static final Pattern TRAILING_HYPHEN_ID = Pattern.compile("-[0-9]{7,}(?=/?$)");
    private static final Pattern SLUG_BEFORE_ID = Pattern.compile("/[a-z0-9]+-[a-z0-9-]+(?=[_-]" + ID + ")",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern HYPHEN_SEGMENT = Pattern.compile("/[a-z0-9_]+-[a-z0-9_-]+(?=/|$)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern UNDERSCORE_SEGMENT = Pattern.compile("/[a-z0-9_]+_[a-z0-9_-]+(?=/|$)",
            Pattern.CASE_INSENSITIVE);

    private static final String REGEX_METACHARACTERS = "\\.[]{}()*+?^$|";

    /**
     * @param url a URL labeled as content
     * @return an anchored regex matching the URL and its structural siblings, or empty
     *         when the URL cannot be generalized
     */
    public Optional<String> synthesize(String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        try {
            String trimmed = url.trim();
            if (containsPlaceholder(trimmed)) {
                log.debug("Could not extract pattern from {}: reserved characters", url);
                return Optional.empty();
            }

            Matcher head = SCHEME_AND_HOST.matcher(trimmed);
            boolean hasScheme = head.find();
            String host = hasScheme ? head.group(2) : "";
            String rest = hasScheme ? trimmed.substring(head.end()) : trimmed;

            rest = replaceAll(TIMESTAMP_RUN, rest, String.valueOf(TIMESTAMP));
            rest = replaceAll(DATE_YMD_RUN, rest, String.valueOf(DATE_YMD));
            rest = replaceAll(DATE_DMY_RUN, rest, String.valueOf(DATE_DMY));

            rest = replaceAll(UNDERSCORE_ID, rest, "_" + ID);
            rest = replaceAll(TRAILING_SEGMENT_ID, rest, "/" + ID);
            rest = replaceAll(TRAILING_HYPHEN_ID, rest, "-" + ID);
            rest = replaceAll(SLUG_BEFORE_ID, rest, "/" + SLUG);

            rest = generalizeSlugs(rest);

            String pattern = assemble(hasScheme, host, rest);

            if (!Pattern.compile(pattern, Pattern.CASE_INSENSITIVE).matcher(trimmed).find()) {
                log.debug("Discarding pattern {} that does not match its own URL {}", pattern, url);
                return Optional.empty();
            }
            return Optional.of(pattern);

        } catch (RuntimeException e) {
            log.debug("Could not extract pattern from {}: {}", url, e.getMessage());
            return Optional.empty();
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private String generalizeSlugs(String path) {
        String previous;
        String current = path;
        int pass = 0;
        do {
            previous = current;
            current = replaceAll(HYPHEN_SEGMENT, current, "/" + SLUG);
            current = replaceAll(UNDERSCORE_SEGMENT, current, "/" + SLUG);
            pass++;
        } while (!current.equals(previous) && pass < MAX_SLUG_PASSES);
        return current;
    }

    private String assemble(boolean hasScheme, String host, String rest) {
        StringBuilder pattern = new StringBuilder("^");
        if (hasScheme) {
            pattern.append("https?://");
            appendLiteral(pattern, host);
        }

        boolean optionalTrailingSlash = rest.endsWith("/");
        String body = optionalTrailingSlash ? rest.substring(0, rest.length() - 1) : rest;

        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            switch (c) {
                case TIMESTAMP -> pattern.append(TIMESTAMP_CLASS);
                case DATE_YMD -> pattern.append(DATE_YMD_CLASS);
                case DATE_DMY -> pattern.append(DATE_DMY_CLASS);
                case ID -> pattern.append(ID_CLASS);
                case SLUG -> pattern.append(SLUG_CLASS);
                default -> appendLiteral(pattern, String.valueOf(c));
            }
        }

        if (optionalTrailingSlash) {
            pattern.append("/?");
        }
        return pattern.append('$').toString();
    }

    private void appendLiteral(StringBuilder out, String literal) {
        for (int i = 0; i < literal.length(); i++) {
            char c = literal.charAt(i);
            if (REGEX_METACHARACTERS.indexOf(c) >= 0) {
                out.append('\\');
            }
            out.append(c);
        }
    }

    private static String replaceAll(Pattern pattern, String input, String replacement) {
        return pattern.matcher(input).replaceAll(Matcher.quoteReplacement(replacement));
    }

    private static boolean containsPlaceholder(String url) {
        for (int i = 0; i < url.length(); i++) {
            char c = url.charAt(i);
            if (c >= FIRST_PLACEHOLDER && c <= LAST_PLACEHOLDER) {
                return true;
            }
        }
        return false;
    }
}
