package com.newsintel.curator.rules;

import com.newsintel.curator.catalogue.CatalogueStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuleSnapshotHolderTest {

    @TempDir
    Path dir;

    @Test
    void loadsRulesAndNoiseCacheFromYaml() throws IOException {
        Files.writeString(dir.resolve("rules.yml"), """
                version: "1.0"
                global_rules:
                  - name: noise_tags
                    pattern: "/tag/"
                    content_type: noise
                sources:
                  example.com:
                    rules:
                      - name: content_articles_with_id
                        pattern: "^https?://example\\\\.com/art-[0-9]+$"
                        content_type: content
                """);
        Files.writeString(dir.resolve("noise.yml"), """
                version: "1.0"
                sources:
                  example.com:
                    urls:
                      - https://example.com/subscribe
                    count: 1
                """);
        RuleSnapshotHolder holder = new RuleSnapshotHolder(
                new CatalogueStore(dir.resolve("rules.yml"), dir.resolve("noise.yml")));

        holder.loadOnStartup();

        RuleSnapshot snapshot = holder.current();
        assertThat(snapshot.globalRuleCount()).isEqualTo(1);
        assertThat(snapshot.sourceRuleCount()).isEqualTo(1);
        assertThat(snapshot.isCachedNoise("example.com", "https://example.com/subscribe")).isTrue();
        assertThat(new RuleMatcher().classify("https://example.com/art-1234567", null, snapshot))
                .map(c -> c.ruleName())
                .contains("content_articles_with_id");
    }

    @Test
    void ruleWithUnknownContentTypeIsSkippedAndTheRestStillLoad() throws IOException {
        Files.writeString(dir.resolve("rules.yml"), """
                global_rules:
                  - name: live_blog
                    pattern: "/live/"
                    content_type: noise
                  - name: bad_type
                    pattern: "/opinion/"
                    content_type: contenido
                """);
        RuleSnapshotHolder holder = new RuleSnapshotHolder(
                new CatalogueStore(dir.resolve("rules.yml"), dir.resolve("noise.yml")));

        holder.loadOnStartup();

        assertThat(holder.current().globalRuleCount()).isEqualTo(1);
        assertThat(new RuleMatcher().classify("https://x.com/live/123", "", holder.current()))
                .map(c -> c.ruleName())
                .contains("live_blog");
        assertThat(new RuleMatcher().classify("https://x.com/opinion/1", "", holder.current())).isEmpty();
    }

    @Test
    void missingFilesGiveAnEmptySnapshot() {
        RuleSnapshotHolder holder = new RuleSnapshotHolder(
                new CatalogueStore(dir.resolve("absent.yml"), dir.resolve("absent-noise.yml")));

        holder.loadOnStartup();

        assertThat(holder.current().isEmpty()).isTrue();
    }

    @Test
    void failedReloadKeepsThePreviousSnapshot() throws IOException {
        Path rules = dir.resolve("rules.yml");
        Files.writeString(rules, """
                global_rules:
                  - name: noise_tags
                    pattern: "/tag/"
                    content_type: noise
                """);
        RuleSnapshotHolder holder = new RuleSnapshotHolder(new CatalogueStore(rules, dir.resolve("noise.yml")));
        RuleSnapshot before = holder.reload();

        Files.writeString(rules, "global_rules: [ {name: broken, content_type: nonsense ");

        assertThatThrownBy(holder::reload).isInstanceOf(UncheckedIOException.class);
        assertThat(holder.current()).isSameAs(before);
    }
}
