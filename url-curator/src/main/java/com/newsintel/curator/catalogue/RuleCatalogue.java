package com.newsintel.curator.catalogue;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.newsintel.curator.model.ClassificationRule;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The persisted rule catalogue (url_classification_rules.yml).
 *
 * <pre>
 * version: "1.0"
 * last_updated: 2025-11-10T03:00:12
 * global_rules:
 *   - name: live_blog
 *     pattern: /live/
 *     content_type: noise
 * sources:
 *   bbc.com:
 *     rules: [...]
 * </pre>
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RuleCatalogue {

    public static final String CURRENT_VERSION = "1.0";

    @JsonProperty("version")
    private String version = CURRENT_VERSION;

    @JsonProperty("last_updated")
    private String lastUpdated;

    @JsonProperty("global_rules")
    private List<ClassificationRule> globalRules = new ArrayList<>();

    @JsonProperty("sources")
    private Map<String, SourceRules> sources = new LinkedHashMap<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SourceRules {
        @JsonProperty("rules")
        private List<ClassificationRule> rules = new ArrayList<>();
    }

    public List<ClassificationRule> getGlobalRules() {
        return globalRules == null ? List.of() : globalRules;
    }

    public Map<String, SourceRules> getSources() {
        return sources == null ? Map.of() : sources;
    }

    public Map<String, List<ClassificationRule>> rulesBySource() {
        Map<String, List<ClassificationRule>> bySource = new LinkedHashMap<>();
        getSources().forEach((key, config) -> bySource.put(key,
                config == null || config.getRules() == null ? List.of() : config.getRules()));
        return bySource;
    }

    public int sourceRuleCount() {
        return rulesBySource().values().stream().mapToInt(List::size).sum();
    }
}
