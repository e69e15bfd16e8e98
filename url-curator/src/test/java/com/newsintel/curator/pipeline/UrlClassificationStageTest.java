package com.newsintel.curator.pipeline;

import com.newsintel.curator.input.UrlStore;
import com.newsintel.curator.model.ClassificationRule;
import com.newsintel.curator.model.ContentType;
import com.newsintel.curator.rules.RuleMatcher;
import com.newsintel.curator.rules.RuleSnapshot;
import com.newsintel.curator.rules.RuleSnapshotHolder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Timestamp;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class UrlClassificationStageTest {

    private static final LocalDate RUN_DATE = LocalDate.of(2025, 11, 10);

    private PipelineTestDatabase db;
    private UrlStore urlStore;
    private UrlClassificationStage stage;

    @BeforeEach
    void setUp() {
        db = new PipelineTestDatabase();
        urlStore = new UrlStore(db.jdbcTemplate);
        urlStore.ensureSchema();

        RuleSnapshot snapshot = RuleSnapshot.of(
                List.of(ClassificationRule.builder()
                        .name("noise_tags").pattern("/tags?/").contentType(ContentType.NOISE).build()),
                Map.of("bbc.com", List.of(ClassificationRule.builder()
                        .name("content_articles_with_id")
                        .pattern("^https?://www\\.bbc\\.com/news/articles/[^/]+-[0-9]+$")
                        .contentType(ContentType.CONTENT).build())),
                Map.of("bbc.com", List.of("https://www.bbc.com/sport")));
        RuleSnapshotHolder holder = mock(RuleSnapshotHolder.class);
        when(holder.current()).thenReturn(snapshot);

        stage = new UrlClassificationStage(urlStore, new RuleMatcher(), holder);
    }

    @AfterEach
    void tearDown() {
        db.shutdown();
    }

    private void insert(String url, String extractedAt, String contentType) {
        db.jdbcTemplate.update("INSERT INTO urls (source, url, title, extracted_at, content_type) VALUES (?, ?, ?, ?, ?)",
                "bbc.com", url, "title", Timestamp.valueOf(extractedAt), contentType);
    }

    private Map<String, Object> row(String url) {
        return db.jdbcTemplate.queryForMap(
                "SELECT content_type, classification_method, rule_name, classified_at FROM urls WHERE url = ?", url);
    }

    private StageContext context() {
        return new StageContext(1L, "daily-curation", RUN_DATE, 2,
                new StagePlan.PlannedStage(2, UrlClassificationStage.NAME, List.of(), 60_000));
    }

    @Test
    void classifiesTheRunDatesLinksAndLeavesMissesForTheFallback() throws Exception {
        insert("https://www.bbc.com/news/articles/uk-politics-67123456", "2025-11-10 08:00:00", null);
        insert("https://www.bbc.com/news/tags/weather", "2025-11-10 09:00:00", null);
        insert("https://www.bbc.com/sport", "2025-11-10 10:00:00", null);
        insert("https://www.bbc.com/weather/forecast", "2025-11-10 11:00:00", null);
        insert("https://www.bbc.com/news/articles/other-story-67999999", "2025-11-09 23:59:59", null);

        Map<String, Object> metrics = stage.execute(context());

        assertThat(metrics)
                .containsEntry("total", 4)
                .containsEntry("saved", 3)
                .containsEntry("routed_to_fallback", 1)
                .containsEntry("rule_coverage_pct", 75.0);

        Map<String, Object> article = row("https://www.bbc.com/news/articles/uk-politics-67123456");
        assertThat(article.get("content_type")).isEqualTo("content");
        assertThat(article.get("classification_method")).isEqualTo("regex_rule");
        assertThat(article.get("rule_name")).isEqualTo("content_articles_with_id");
        assertThat(article.get("classified_at")).isNotNull();

        assertThat(row("https://www.bbc.com/news/tags/weather").get("rule_name")).isEqualTo("noise_tags");
        assertThat(row("https://www.bbc.com/sport").get("classification_method")).isEqualTo("cached_url");
        assertThat(row("https://www.bbc.com/weather/forecast").get("content_type")).isNull();
        assertThat(row("https://www.bbc.com/news/articles/other-story-67999999").get("content_type")).isNull();
    }

    @Test
    void rerunningNeverOverwritesExistingLabels() throws Exception {
        insert("https://www.bbc.com/news/tags/weather", "2025-11-10 09:00:00", null);
        stage.execute(context());
        db.jdbcTemplate.update("UPDATE urls SET content_type = 'content', rule_name = 'manual'");

        Map<String, Object> metrics = stage.execute(context());

        assertThat(metrics).containsEntry("total", 0).containsEntry("saved", 0);
        assertThat(row("https://www.bbc.com/news/tags/weather").get("rule_name")).isEqualTo("manual");
    }
}
