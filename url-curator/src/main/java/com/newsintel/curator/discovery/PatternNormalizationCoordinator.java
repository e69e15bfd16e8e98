package com.newsintel.curator.discovery;

import com.newsintel.curator.config.CurationProperties;
import com.newsintel.curator.model.CandidatePattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Drives the normalizer over candidate groups in bounded batches.
 *
 * Each pass splits the patterns into batches of at most {@code batch-size}. If the
 * merged output is still larger than one batch, another pass runs, up to
 * {@code max-passes}. A batch whose response is malformed is retried once with half
 * the patterns at temperature 0; if that fails too the batch stays as it was.
 * Patterns the normalizer does not mention are carried over unchanged.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PatternNormalizationCoordinator {

    private final Optional<PatternNormalizer> normalizer;
    private final CurationProperties properties;

    public boolean isEnabled() {
        return normalizer.isPresent();
    }

    public Map<String, CandidatePattern> normalize(Map<String, CandidatePattern> groups) {
        if (normalizer.isEmpty() || groups.isEmpty()) {
            return groups;
        }
        CurationProperties.Normalizer config = properties.getNormalizer();
        int batchSize = Math.max(1, config.getBatchSize());
        int maxPasses = Math.max(1, config.getMaxPasses());

        Map<String, CandidatePattern> current = groups;
        for (int pass = 1; pass <= maxPasses; pass++) {
            List<String> patterns = new ArrayList<>(current.keySet());
            Map<String, CandidatePattern> next = new LinkedHashMap<>();

            for (int from = 0; from < patterns.size(); from += batchSize) {
                List<String> batch = patterns.subList(from, Math.min(from + batchSize, patterns.size()));
                mergeInto(next, normalizeBatch(batch, current, config.getTemperature()));
            }

            log.info("Normalization pass {}: {} -> {} patterns", pass, current.size(), next.size());
            boolean progressed = next.size() < current.size();
            current = next;

            if (current.size() <= batchSize) {
                break;
            }
            if (!progressed) {
                log.info("Normalization made no progress, stopping after pass {}", pass);
                break;
            }
            if (pass == maxPasses) {
                log.warn("Stopping normalization after {} passes with {} patterns left", maxPasses, current.size());
            }
        }
        return current;
    }

    // ── Batches ──────────────────────────────────────────────────────────────

    private Map<String, CandidatePattern> normalizeBatch(List<String> batch,
                                                         Map<String, CandidatePattern> groups,
                                                         double temperature) {
        try {
            List<NormalizedGroup> response = normalizer.get()
                    .normalize(new NormalizationRequest(batch, temperature, false));
            return apply(batch, response, groups);

        } catch (MalformedNormalizationException first) {
            List<String> reduced = batch.subList(0, Math.max(1, batch.size() / 2));
            log.warn("Malformed normalization response for {} patterns ({}), retrying with {}",
                    batch.size(), first.getMessage(), reduced.size());
            try {
                List<NormalizedGroup> response = normalizer.get()
                        .normalize(new NormalizationRequest(reduced, 0.0, true));
                Map<String, CandidatePattern> result = apply(reduced, response, groups);
                for (String carried : batch.subList(reduced.size(), batch.size())) {
                    mergeGroup(result, copyOf(groups.get(carried)));
                }
                return result;
            } catch (RuntimeException second) {
                log.warn("Normalization retry failed ({}), keeping {} patterns un-normalized",
                        second.getMessage(), batch.size());
                return unchanged(batch, groups);
            }

        } catch (RuntimeException e) {
            log.error("Normalizer call failed, keeping {} patterns un-normalized: {}", batch.size(), e.getMessage());
            return unchanged(batch, groups);
        }
    }

    /**
     * Applies the groups of one response to one batch. Each batch pattern is consumed by at
     * most one group; patterns no group consumed are kept as they were.
     */
    Map<String, CandidatePattern> apply(List<String> batch,
                                        List<NormalizedGroup> response,
                                        Map<String, CandidatePattern> groups) {
        Set<String> inBatch = new HashSet<>(batch);
        Set<String> consumed = new HashSet<>();
        Map<String, CandidatePattern> result = new LinkedHashMap<>();

        for (NormalizedGroup group : response) {
            String normalized = group.normalizedPattern();
            if (normalized == null || normalized.isBlank() || !compiles(normalized)) {
                log.debug("Ignoring normalized group with unusable pattern {}", normalized);
                continue;
            }
            CandidatePattern merged = new CandidatePattern(normalized);
            boolean any = false;
            for (String original : group.originalPatterns()) {
                if (inBatch.contains(original) && consumed.add(original)) {
                    merged.absorb(groups.get(original));
                    any = true;
                }
            }
            if (any) {
                mergeGroup(result, merged);
            }
        }

        for (String pattern : batch) {
            if (!consumed.contains(pattern)) {
                mergeGroup(result, copyOf(groups.get(pattern)));
            }
        }
        return result;
    }

    private static Map<String, CandidatePattern> unchanged(List<String> batch, Map<String, CandidatePattern> groups) {
        Map<String, CandidatePattern> result = new LinkedHashMap<>();
        batch.forEach(p -> mergeGroup(result, copyOf(groups.get(p))));
        return result;
    }

    private static void mergeInto(Map<String, CandidatePattern> target, Map<String, CandidatePattern> source) {
        source.values().forEach(candidate -> mergeGroup(target, candidate));
    }

    private static void mergeGroup(Map<String, CandidatePattern> target, CandidatePattern candidate) {
        CandidatePattern existing = target.get(candidate.getPattern());
        if (existing == null) {
            target.put(candidate.getPattern(), candidate);
        } else {
            existing.absorb(candidate);
        }
    }

    private static CandidatePattern copyOf(CandidatePattern candidate) {
        return new CandidatePattern(candidate.getPattern()).absorb(candidate);
    }

    private static boolean compiles(String pattern) {
        try {
            Pattern.compile(pattern);
            return true;
        } catch (PatternSyntaxException e) {
            log.warn("Normalizer proposed invalid pattern {}: {}", pattern, e.getDescription());
            return false;
        }
    }
}
