package com.newsintel.curator.rules;

import com.newsintel.curator.model.BatchClassification;
import com.newsintel.curator.model.CandidateLink;
import com.newsintel.curator.model.Classification;
import com.newsintel.curator.model.ClassifiedLink;
import com.newsintel.curator.model.ContentType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Classifies URLs against a rule snapshot.
 *
 * Priority order, first match wins:
 *  1. cached noise URLs (exact match)
 *  2. global rules, in list order
 *  3. source rules for the URL's domain, then its short domain
 *
 * Stateless: the result depends only on the URL and the snapshot passed in.
 * Unmatched URLs are left for the fallback classifier.
 */
@Component
@Slf4j
public class RuleMatcher {

    /**
     * @param url      URL to classify
     * @param title    link title, currently unused by the rule tier
     * @param snapshot rules to match against, null behaves like an empty snapshot
     * @return the classification, or empty when no rule matched
     */
    public Optional<Classification> classify(String url, String title, RuleSnapshot snapshot) {
        if (url == null || url.isBlank() || snapshot == null || snapshot.isEmpty()) {
            return Optional.empty();
        }

        List<String> keys = SourceKeys.candidateKeys(url);

        for (String key : keys) {
            if (snapshot.isCachedNoise(key, url)) {
                log.debug("URL found in cached noise list: {}", url);
                return Optional.of(new Classification(ContentType.NOISE, Classification.CACHED_URL));
            }
        }

        Optional<Classification> global = firstMatch(url, snapshot.globalRules());
        if (global.isPresent()) {
            return global;
        }

        for (String key : keys) {
            Optional<Classification> sourceMatch = firstMatch(url, snapshot.sourceRules(key));
            if (sourceMatch.isPresent()) {
                return sourceMatch;
            }
        }

        return Optional.empty();
    }

    /**
     * Splits a batch into classified and unclassified links, keeping input order in both.
     */
    public BatchClassification classifyBatch(List<CandidateLink> links, RuleSnapshot snapshot) {
        List<ClassifiedLink> classified = new ArrayList<>();
        List<CandidateLink> unclassified = new ArrayList<>();

        for (CandidateLink link : links) {
            classify(link.getUrl(), link.getTitle(), snapshot).ifPresentOrElse(
                    c -> classified.add(ClassifiedLink.of(link, c)),
                    () -> unclassified.add(link));
        }

        log.debug("Rule tier classified {}/{} links", classified.size(), links.size());
        return new BatchClassification(classified, unclassified);
    }

    private Optional<Classification> firstMatch(String url, List<RuleSnapshot.CompiledRule> rules) {
        for (RuleSnapshot.CompiledRule compiled : rules) {
            try {
                if (compiled.pattern().matcher(url).find()) {
                    log.debug("URL matched {} rule '{}': {}",
                            compiled.rule().getScope().value(), compiled.rule().displayName(), url);
                    return Optional.of(new Classification(compiled.rule().getContentType(),
                            compiled.rule().displayName()));
                }
            } catch (RuntimeException e) {
                log.warn("Rule '{}' failed on {}: {}", compiled.rule().displayName(), url, e.getMessage());
            }
        }
        return Optional.empty();
    }
}
