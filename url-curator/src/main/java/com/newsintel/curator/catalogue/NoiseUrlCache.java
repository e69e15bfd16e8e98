package com.newsintel.curator.catalogue;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The persisted exact-match noise URL cache (cached_noise_urls.yml), keyed by source.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class NoiseUrlCache {

    @JsonProperty("version")
    private String version = RuleCatalogue.CURRENT_VERSION;

    @JsonProperty("last_updated")
    private String lastUpdated;

    @JsonProperty("sources")
    private Map<String, CachedSource> sources = new LinkedHashMap<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CachedSource {
        @JsonProperty("urls")
        private List<String> urls = new ArrayList<>();

        @JsonProperty("count")
        private int count;

        @JsonProperty("last_updated")
        private String lastUpdated;
    }

    public Map<String, CachedSource> getSources() {
        return sources == null ? Map.of() : sources;
    }

    public Map<String, List<String>> urlsBySource() {
        Map<String, List<String>> bySource = new LinkedHashMap<>();
        getSources().forEach((key, cached) -> bySource.put(key,
                cached == null || cached.getUrls() == null ? List.of() : cached.getUrls()));
        return bySource;
    }

    public int totalUrls() {
        return urlsBySource().values().stream().mapToInt(List::size).sum();
    }
}
