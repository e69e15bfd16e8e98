package com.newsintel.curator.rules;

import com.newsintel.curator.model.BatchClassification;
import com.newsintel.curator.model.CandidateLink;
import com.newsintel.curator.model.Classification;
import com.newsintel.curator.model.ClassifiedLink;
import com.newsintel.curator.model.ContentType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ClassificationStatsTest {

    @Test
    void countsMethodsTypesAndCoverage() {
        CandidateLink a = CandidateLink.builder().url("https://x.com/a").build();
        CandidateLink b = CandidateLink.builder().url("https://x.com/b").build();
        CandidateLink c = CandidateLink.builder().url("https://x.com/c").build();
        BatchClassification batch = new BatchClassification(
                List.of(ClassifiedLink.of(a, new Classification(ContentType.NOISE, Classification.CACHED_URL)),
                        ClassifiedLink.of(b, new Classification(ContentType.CONTENT, "articles"))),
                List.of(c));

        ClassificationStats stats = ClassificationStats.of(batch);

        assertThat(stats.total()).isEqualTo(3);
        assertThat(stats.byMethod()).containsEntry("cached_url", 1).containsEntry("regex_rule", 1)
                .containsEntry(ClassificationStats.METHOD_UNMATCHED, 1);
        assertThat(stats.byContentType()).containsEntry("noise", 1).containsEntry("content", 1);
        assertThat(stats.ruleCoveragePct()).isEqualTo(66.67);
    }

    @Test
    void emptyBatchHasZeroCoverage() {
        ClassificationStats stats = ClassificationStats.of(new BatchClassification(List.of(), List.of()));

        assertThat(stats.ruleCoveragePct()).isZero();
        assertThat(stats.asMetrics()).containsEntry("total", 0);
    }
}
