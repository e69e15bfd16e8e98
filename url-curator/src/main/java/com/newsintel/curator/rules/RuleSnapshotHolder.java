package com.newsintel.curator.rules;

import com.newsintel.curator.catalogue.CatalogueStore;
import com.newsintel.curator.catalogue.NoiseUrlCache;
import com.newsintel.curator.catalogue.RuleCatalogue;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the active rule snapshot.
 *
 * A reload builds a complete new snapshot from the catalogue files and swaps the
 * reference; readers that already fetched the previous snapshot keep using it.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RuleSnapshotHolder {

    private final CatalogueStore catalogueStore;
    private final AtomicReference<RuleSnapshot> active = new AtomicReference<>(RuleSnapshot.EMPTY);

    @PostConstruct
    public void loadOnStartup() {
        try {
            reload();
        } catch (RuntimeException e) {
            log.error("Failed to load rules, classifying with an empty rule set: {}", e.getMessage(), e);
        }
    }

    public RuleSnapshot current() {
        return active.get();
    }

    /**
     * Rebuilds the snapshot from disk. On failure the active snapshot is left in place
     * and the exception propagates.
     */
    public RuleSnapshot reload() {
        RuleCatalogue catalogue = catalogueStore.loadCatalogue();
        NoiseUrlCache cache = catalogueStore.loadNoiseCache();

        RuleSnapshot next = RuleSnapshot.of(catalogue.getGlobalRules(), catalogue.rulesBySource(),
                cache.urlsBySource());
        active.set(next);

        log.info("Loaded {} global rules, {} source-specific rules and {} cached noise URLs",
                next.globalRuleCount(), next.sourceRuleCount(), next.cachedUrlCount());
        return next;
    }
}
