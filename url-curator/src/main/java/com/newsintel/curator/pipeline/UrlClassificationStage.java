package com.newsintel.curator.pipeline;

import com.newsintel.curator.input.UrlStore;
import com.newsintel.curator.model.BatchClassification;
import com.newsintel.curator.model.CandidateLink;
import com.newsintel.curator.rules.ClassificationStats;
import com.newsintel.curator.rules.RuleMatcher;
import com.newsintel.curator.rules.RuleSnapshot;
import com.newsintel.curator.rules.RuleSnapshotHolder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Built-in stage: classifies the run date's unclassified links with the active rules.
 * Links no rule matches stay unclassified for the fallback classifier.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class UrlClassificationStage implements PipelineStage {

    public static final String NAME = "classify-urls";

    private final UrlStore urlStore;
    private final RuleMatcher ruleMatcher;
    private final RuleSnapshotHolder snapshotHolder;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Map<String, Object> execute(StageContext context) throws Exception {
        RuleSnapshot snapshot = snapshotHolder.current();
        List<CandidateLink> links = urlStore.findUnclassified(context.runDate());
        log.info("Classifying {} links for {} with {} global and {} source rules",
                links.size(), context.runDate(), snapshot.globalRuleCount(), snapshot.sourceRuleCount());

        BatchClassification batch = ruleMatcher.classifyBatch(links, snapshot);
        int saved = urlStore.saveClassifications(batch.classified());

        ClassificationStats stats = ClassificationStats.of(batch);
        log.info("Rule tier classified {}/{} links ({}%), {} left for the fallback classifier",
                batch.classified().size(), stats.total(), stats.ruleCoveragePct(), batch.unclassified().size());

        Map<String, Object> metrics = new LinkedHashMap<>(stats.asMetrics());
        metrics.put("saved", saved);
        metrics.put("routed_to_fallback", batch.unclassified().size());
        return metrics;
    }
}
