package com.newsintel.curator.discovery;

import com.newsintel.curator.config.CurationProperties;
import com.newsintel.curator.model.CandidatePattern;
import com.newsintel.curator.model.ClassificationRule;
import com.newsintel.curator.model.ContentType;
import com.newsintel.curator.model.LabeledUrl;
import com.newsintel.curator.model.RuleMetadata;
import com.newsintel.curator.model.RuleScope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Turns synthesized patterns for one source into validated, named rules.
 *
 * Identical patterns are grouped first. When most URLs produced a pattern of their
 * own (high dedup ratio) the groups are sent through the normalizer. Every remaining
 * candidate is then checked against the source's whole labeled history.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PatternValidator {

    static final int HIGH_CONFIDENCE_MATCHES = 10;
    static final int SAMPLE_URLS = 3;

    private final PatternNormalizationCoordinator coordinator;
    private final CurationProperties properties;

    public ValidationReport validate(String source, List<SynthesizedPattern> triples, List<LabeledUrl> history) {
        return validate(source, triples, history, ValidationThresholds.from(properties.getDiscovery()));
    }

    public ValidationReport validate(String source,
                                     List<SynthesizedPattern> triples,
                                     List<LabeledUrl> history,
                                     ValidationThresholds thresholds) {

        Map<String, CandidatePattern> groups = group(triples);
        int uniquePatterns = groups.size();
        double ratio = dedupRatio(uniquePatterns, triples.size());
        log.info("[{}] {} patterns from {} URLs, dedup ratio {}", source, groups.size(), triples.size(),
                String.format("%.2f", ratio));

        boolean normalized = false;
        CurationProperties.Discovery discovery = properties.getDiscovery();
        if (ratio > discovery.getDedupRatioThreshold()
                && groups.size() > discovery.getMinUniquePatternsForNormalization()) {
            if (coordinator.isEnabled()) {
                log.info("[{}] High dedup ratio, normalizing {} patterns", source, groups.size());
                groups = coordinator.normalize(groups);
                normalized = true;
                log.info("[{}] Normalized to {} patterns", source, groups.size());
            } else {
                log.info("[{}] High dedup ratio but no normalizer configured, validating raw patterns", source);
            }
        }

        List<ClassificationRule> rules = new ArrayList<>();
        RuleNamer namer = new RuleNamer();
        int rejected = 0;

        for (CandidatePattern candidate : groups.values()) {
            ClassificationRule rule = check(source, candidate.getPattern(), history, thresholds, namer);
            if (rule == null) {
                rejected++;
            } else {
                rules.add(rule);
            }
        }

        log.info("[{}] Validated {} rules, rejected {}", source, rules.size(), rejected);
        return new ValidationReport(triples.size(), uniquePatterns, ratio, normalized, groups.size(), rejected, rules);
    }

    public static double dedupRatio(int unique, int total) {
        return total == 0 ? 0.0 : (double) unique / total;
    }

    static Map<String, CandidatePattern> group(Collection<SynthesizedPattern> triples) {
        Map<String, CandidatePattern> groups = new LinkedHashMap<>();
        for (SynthesizedPattern triple : triples) {
            groups.computeIfAbsent(triple.pattern(), CandidatePattern::new)
                    .add(triple.url(), triple.contentType());
        }
        return groups;
    }

    // ── Validation ───────────────────────────────────────────────────────────

    private ClassificationRule check(String source,
                                     String pattern,
                                     List<LabeledUrl> history,
                                     ValidationThresholds thresholds,
                                     RuleNamer namer) {
        Pattern compiled;
        try {
            compiled = Pattern.compile(pattern, Pattern.CASE_INSENSITIVE);
        } catch (PatternSyntaxException e) {
            log.warn("[{}] Rejecting invalid pattern {}: {}", source, pattern, e.getDescription());
            return null;
        }

        Map<ContentType, Integer> tally = new EnumMap<>(ContentType.class);
        List<String> matched = new ArrayList<>();
        for (LabeledUrl labeled : history) {
            if (compiled.matcher(labeled.url()).find()) {
                tally.merge(labeled.contentType(), 1, Integer::sum);
                matched.add(labeled.url());
            }
        }

        int matchCount = matched.size();
        if (matchCount == 0 || matchCount < thresholds.minCoverage()) {
            log.debug("[{}] Pattern {} matched {} URLs, below minimum {}", source, pattern, matchCount,
                    thresholds.minCoverage());
            return null;
        }

        Map.Entry<ContentType, Integer> dominant = tally.entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .orElseThrow();
        double consistency = dominant.getValue() * 100.0 / matchCount;
        if (consistency < thresholds.minConsistencyPct()) {
            log.debug("[{}] Pattern {} consistency {}% below {}%", source, pattern,
                    String.format("%.1f", consistency), thresholds.minConsistencyPct());
            return null;
        }

        double coverage = history.isEmpty() ? 0.0 : matchCount * 100.0 / history.size();
        RuleMetadata metadata = RuleMetadata.builder()
                .exampleCount(matchCount)
                .coveragePct(round2(coverage))
                .consistencyPct(round2(consistency))
                .confidence(matchCount > HIGH_CONFIDENCE_MATCHES ? "high" : "medium")
                .sampleUrls(matched.subList(0, Math.min(SAMPLE_URLS, matchCount)))
                .build();

        return ClassificationRule.builder()
                .name(namer.nameFor(pattern, dominant.getKey()))
                .pattern(pattern)
                .contentType(dominant.getKey())
                .scope(RuleScope.SOURCE)
                .sourceKey(source)
                .metadata(metadata)
                .build();
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
