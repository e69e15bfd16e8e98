package com.newsintel.curator.catalogue;

import com.newsintel.curator.model.ClassificationRule;
import com.newsintel.curator.model.ContentType;
import com.newsintel.curator.model.DiscoveryResult;
import com.newsintel.curator.model.RuleMetadata;
import com.newsintel.curator.model.RuleScope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RuleCatalogueMergerTest {

    @TempDir
    Path dir;

    private CatalogueStore store;
    private RuleCatalogueMerger merger;

    @BeforeEach
    void setUp() {
        store = new CatalogueStore(dir.resolve("config/rules.yml"), dir.resolve("config/noise.yml"));
        merger = new RuleCatalogueMerger(store);
    }

    private static ClassificationRule rule(String name, String pattern) {
        return ClassificationRule.builder()
                .name(name)
                .pattern(pattern)
                .contentType(ContentType.CONTENT)
                .scope(RuleScope.SOURCE)
                .sourceKey("ignored")
                .metadata(RuleMetadata.builder().exampleCount(12).confidence("high")
                        .sampleUrl("https://a.com/x").build())
                .build();
    }

    @Test
    void replacesOnlySourcesPresentInTheInput() {
        Map<String, List<ClassificationRule>> first = new LinkedHashMap<>();
        first.put("a.com", List.of(rule("content_with_slug", "^https?://a\\.com/[^/]+$")));
        first.put("b.com", List.of(rule("content_dated_articles", "^https?://b\\.com/20[0-9]{2}/")));
        merger.merge(DiscoveryResult.forSources(first, Map.of()));

        merger.merge(DiscoveryResult.forSources(
                Map.of("a.com", List.of(rule("content_articles_with_id", "^https?://a\\.com/art-[0-9]+$"))),
                Map.of()));

        RuleCatalogue catalogue = store.loadCatalogue();
        assertThat(catalogue.getSources()).containsOnlyKeys("a.com", "b.com");
        assertThat(catalogue.rulesBySource().get("a.com")).extracting(ClassificationRule::getName)
                .containsExactly("content_articles_with_id");
        assertThat(catalogue.rulesBySource().get("b.com")).extracting(ClassificationRule::getName)
                .containsExactly("content_dated_articles");
    }

    @Test
    void persistedRulesCarryMetadataButNoPlacement() {
        merger.merge(DiscoveryResult.forSources(
                Map.of("a.com", List.of(rule("content_with_slug", "^https?://a\\.com/[^/]+$"))), Map.of()));

        ClassificationRule saved = store.loadCatalogue().rulesBySource().get("a.com").get(0);
        assertThat(saved.getScope()).isNull();
        assertThat(saved.getSourceKey()).isNull();
        assertThat(saved.getMetadata().getExampleCount()).isEqualTo(12);
        assertThat(saved.getMetadata().getSampleUrls()).containsExactly("https://a.com/x");
        assertThat(saved.getPattern()).isEqualTo("^https?://a\\.com/[^/]+$");
    }

    @Test
    void globalRulesAreKeptUnlessProvided() {
        ClassificationRule global = ClassificationRule.builder()
                .name("noise_tags").pattern("/tag/").contentType(ContentType.NOISE).build();
        merger.merge(new DiscoveryResult(List.of(global), Map.of(), Map.of()));

        merger.merge(DiscoveryResult.forSources(Map.of("a.com", List.of(rule("r", "/x"))), Map.of()));

        assertThat(store.loadCatalogue().getGlobalRules()).extracting(ClassificationRule::getName)
                .containsExactly("noise_tags");
    }

    @Test
    void noiseUrlsAreDeduplicatedSortedAndCounted() {
        merger.merge(DiscoveryResult.forSources(Map.of(), Map.of("a.com",
                List.of("https://a.com/z", "https://a.com/b", "https://a.com/z"))));

        NoiseUrlCache cache = store.loadNoiseCache();
        NoiseUrlCache.CachedSource source = cache.getSources().get("a.com");
        assertThat(source.getUrls()).containsExactly("https://a.com/b", "https://a.com/z");
        assertThat(source.getCount()).isEqualTo(2);
        assertThat(source.getLastUpdated()).isNotBlank();
    }

    @Test
    void noiseCacheKeepsOtherSources() {
        merger.merge(DiscoveryResult.forSources(Map.of(), Map.of("a.com", List.of("https://a.com/1"))));
        merger.merge(DiscoveryResult.forSources(Map.of(), Map.of("b.com", List.of("https://b.com/1"))));

        assertThat(store.loadNoiseCache().urlsBySource()).containsOnlyKeys("a.com", "b.com");
    }
}
