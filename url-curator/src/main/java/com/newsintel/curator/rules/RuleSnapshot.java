package com.newsintel.curator.rules;

import com.newsintel.curator.model.ClassificationRule;
import com.newsintel.curator.model.RuleScope;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Immutable bundle of the rules and noise cache used for classification.
 *
 * Patterns are compiled once when the snapshot is built; rules whose pattern
 * does not compile are logged and left out. A snapshot is never modified after
 * construction, a reload builds a new one.
 */
@Slf4j
public final class RuleSnapshot {

    public static final RuleSnapshot EMPTY = new RuleSnapshot(List.of(), Map.of(), Map.of(), null);

    private final List<CompiledRule> globalRules;
    private final Map<String, List<CompiledRule>> sourceRules;
    private final Map<String, Set<String>> noiseCache;
    private final LocalDateTime loadedAt;

    /**
     * A published rule with its compiled pattern.
     */
    public record CompiledRule(ClassificationRule rule, Pattern pattern) {
    }

    private RuleSnapshot(List<CompiledRule> globalRules,
                         Map<String, List<CompiledRule>> sourceRules,
                         Map<String, Set<String>> noiseCache,
                         LocalDateTime loadedAt) {
        this.globalRules = globalRules;
        this.sourceRules = sourceRules;
        this.noiseCache = noiseCache;
        this.loadedAt = loadedAt;
    }

    public static RuleSnapshot of(List<ClassificationRule> globalRules,
                                  Map<String, List<ClassificationRule>> sourceRules,
                                  Map<String, ? extends Collection<String>> noiseUrls) {
        List<CompiledRule> global = compileAll(globalRules, RuleScope.GLOBAL, null);

        Map<String, List<CompiledRule>> bySource = new LinkedHashMap<>();
        sourceRules.forEach((key, rules) -> bySource.put(key, compileAll(rules, RuleScope.SOURCE, key)));

        Map<String, Set<String>> cache = new LinkedHashMap<>();
        noiseUrls.forEach((key, urls) -> cache.put(key, Set.copyOf(urls)));

        return new RuleSnapshot(global, Collections.unmodifiableMap(bySource),
                Collections.unmodifiableMap(cache), LocalDateTime.now());
    }

    private static List<CompiledRule> compileAll(List<ClassificationRule> rules, RuleScope scope, String sourceKey) {
        if (rules == null || rules.isEmpty()) return List.of();
        List<CompiledRule> compiled = new ArrayList<>(rules.size());
        for (ClassificationRule rule : rules) {
            if (rule == null || rule.getPattern() == null || rule.getContentType() == null) {
                log.warn("Skipping incomplete {} rule {}", scope.value(), rule == null ? null : rule.displayName());
                continue;
            }
            try {
                Pattern pattern = Pattern.compile(rule.getPattern(), Pattern.CASE_INSENSITIVE);
                ClassificationRule published = rule.toBuilder().scope(scope).sourceKey(sourceKey).build();
                compiled.add(new CompiledRule(published, pattern));
            } catch (PatternSyntaxException e) {
                log.warn("Invalid regex pattern in rule '{}': {}", rule.displayName(), e.getDescription());
            }
        }
        return List.copyOf(compiled);
    }

    public List<CompiledRule> globalRules() {
        return globalRules;
    }

    public List<CompiledRule> sourceRules(String key) {
        return sourceRules.getOrDefault(key, List.of());
    }

    public boolean isCachedNoise(String key, String url) {
        Set<String> urls = noiseCache.get(key);
        return urls != null && urls.contains(url);
    }

    public boolean hasRulesForSource(String key) {
        return !sourceRules(key).isEmpty();
    }

    public int globalRuleCount() {
        return globalRules.size();
    }

    public int sourceRuleCount() {
        return sourceRules.values().stream().mapToInt(List::size).sum();
    }

    public int cachedUrlCount() {
        return noiseCache.values().stream().mapToInt(Set::size).sum();
    }

    public LocalDateTime loadedAt() {
        return loadedAt;
    }

    public boolean isEmpty() {
        return globalRules.isEmpty() && sourceRules.isEmpty() && noiseCache.isEmpty();
    }
}
