package com.newsintel.curator.rules;

import com.newsintel.curator.model.BatchClassification;
import com.newsintel.curator.model.ClassifiedLink;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * How a batch was classified: counts by method and by content type, plus the
 * share resolved without the fallback classifier.
 */
public record ClassificationStats(int total,
                                  Map<String, Integer> byMethod,
                                  Map<String, Integer> byContentType,
                                  double ruleCoveragePct) {

    public static final String METHOD_UNMATCHED = "unmatched";

    public static ClassificationStats of(BatchClassification batch) {
        Map<String, Integer> byMethod = new TreeMap<>();
        Map<String, Integer> byType = new TreeMap<>();

        for (ClassifiedLink link : batch.classified()) {
            byMethod.merge(link.getClassificationMethod(), 1, Integer::sum);
            byType.merge(link.getContentType().value(), 1, Integer::sum);
        }
        if (!batch.unclassified().isEmpty()) {
            byMethod.put(METHOD_UNMATCHED, batch.unclassified().size());
        }

        int total = batch.total();
        double coverage = total == 0 ? 0.0 : batch.classified().size() * 100.0 / total;
        return new ClassificationStats(total, byMethod, byType, Math.round(coverage * 100.0) / 100.0);
    }

    public Map<String, Object> asMetrics() {
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("total", total);
        metrics.put("by_method", byMethod);
        metrics.put("by_content_type", byContentType);
        metrics.put("rule_coverage_pct", ruleCoveragePct);
        return metrics;
    }
}
