package com.newsintel.curator.catalogue;

import com.newsintel.curator.model.ClassificationRule;
import com.newsintel.curator.model.DiscoveryResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Merges discovery output into the persisted catalogue and noise cache.
 *
 * Only sources present in the input are replaced; every other source keeps its
 * rules and cached URLs. Global rules are replaced only when the input carries them.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RuleCatalogueMerger {

    private final CatalogueStore store;

    public RuleCatalogue merge(DiscoveryResult result) {
        return store.withWriteLock(() -> {
            RuleCatalogue merged = mergeRules(store.loadCatalogue(), result);
            store.saveCatalogue(merged);

            if (!result.noiseUrlsBySource().isEmpty()) {
                NoiseUrlCache cache = mergeNoiseUrls(store.loadNoiseCache(), result.noiseUrlsBySource());
                store.saveNoiseCache(cache);
            }

            log.info("Rules saved to {} ({} sources updated, {} total)",
                    store.getCatalogueFile(), result.rulesBySource().size(), merged.getSources().size());
            return merged;
        });
    }

    RuleCatalogue mergeRules(RuleCatalogue existing, DiscoveryResult result) {
        RuleCatalogue merged = new RuleCatalogue();
        merged.setVersion(existing.getVersion() == null ? RuleCatalogue.CURRENT_VERSION : existing.getVersion());
        merged.setLastUpdated(LocalDateTime.now().toString());
        merged.setGlobalRules(result.globalRules() != null
                ? stripPlacement(result.globalRules())
                : existing.getGlobalRules());

        Map<String, RuleCatalogue.SourceRules> sources = new LinkedHashMap<>(existing.getSources());
        result.rulesBySource().forEach((source, rules) -> {
            sources.put(source, new RuleCatalogue.SourceRules(stripPlacement(rules)));
            log.info("Updated rules for source: {} ({} rules)", source, rules.size());
        });
        merged.setSources(sources);
        return merged;
    }

    NoiseUrlCache mergeNoiseUrls(NoiseUrlCache existing, Map<String, List<String>> urlsBySource) {
        String now = LocalDateTime.now().toString();

        NoiseUrlCache merged = new NoiseUrlCache();
        merged.setLastUpdated(now);
        Map<String, NoiseUrlCache.CachedSource> sources = new LinkedHashMap<>(existing.getSources());

        urlsBySource.forEach((source, urls) -> {
            List<String> unique = List.copyOf(new TreeSet<>(urls));
            sources.put(source, new NoiseUrlCache.CachedSource(unique, unique.size(), now));
            log.info("Updated cached URLs for source: {} ({} URLs)", source, unique.size());
        });
        merged.setSources(sources);

        log.info("Saved cached URLs to {} ({} sources updated, {} total, {} URLs)",
                store.getNoiseCacheFile(), urlsBySource.size(), sources.size(), merged.totalUrls());
        return merged;
    }

    /** Scope and source key are implied by the catalogue layout, so they are not persisted. */
    private List<ClassificationRule> stripPlacement(List<ClassificationRule> rules) {
        return rules.stream()
                .map(r -> r.toBuilder().scope(null).sourceKey(null).build())
                .toList();
    }
}
