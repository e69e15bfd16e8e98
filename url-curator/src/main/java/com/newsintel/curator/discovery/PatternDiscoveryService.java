package com.newsintel.curator.discovery;

import com.newsintel.curator.catalogue.RuleCatalogueMerger;
import com.newsintel.curator.config.CurationProperties;
import com.newsintel.curator.input.HistoricalUrlRouter;
import com.newsintel.curator.model.ClassificationRule;
import com.newsintel.curator.model.ContentType;
import com.newsintel.curator.model.DiscoveryResult;
import com.newsintel.curator.model.LabeledUrl;
import com.newsintel.curator.rules.RuleSnapshotHolder;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Learns classification rules from labeled history and publishes them.
 *
 * Flow per source:
 *  1. Synthesize a pattern from every content URL
 *  2. Validate the candidates against the source's whole history
 *  3. Collect noise URLs verbatim for the exact-match cache
 *
 * Sources run in parallel on a bounded pool; the same source never runs twice at once.
 * Results are merged into the catalogue in one serialized step, then the active
 * snapshot is reloaded. A source that fails or yields no rules keeps its existing rules.
 */
@Service
@Slf4j
public class PatternDiscoveryService {

    private final HistoricalUrlRouter router;
    private final PatternSynthesizer synthesizer;
    private final PatternValidator validator;
    private final RuleCatalogueMerger merger;
    private final RuleSnapshotHolder snapshotHolder;

    private final Map<String, ReentrantLock> sourceLocks = new ConcurrentHashMap<>();
    private final ExecutorService executor;

    public PatternDiscoveryService(HistoricalUrlRouter router,
                                   PatternSynthesizer synthesizer,
                                   PatternValidator validator,
                                   RuleCatalogueMerger merger,
                                   RuleSnapshotHolder snapshotHolder,
                                   CurationProperties properties) {
        this.router = router;
        this.synthesizer = synthesizer;
        this.validator = validator;
        this.merger = merger;
        this.snapshotHolder = snapshotHolder;
        this.executor = Executors.newFixedThreadPool(
                Math.max(1, properties.getDiscovery().getParallelism()),
                new CustomizableThreadFactory("discovery-"));
    }

    /**
     * Runs discovery for the given sources (all when empty), persists the result and
     * reloads the active rules.
     */
    public List<SourceDiscovery> discoverAndMerge(Collection<String> sources) {
        log.info("=== Pattern discovery starting ({}) ===", sources.isEmpty() ? "all sources" : sources);

        Map<String, List<LabeledUrl>> input = router.loadBySource(sources);
        List<SourceDiscovery> discoveries = discover(input);
        DiscoveryResult result = toResult(discoveries);

        if (result.isEmpty()) {
            log.info("=== Pattern discovery found nothing to publish ===");
            return discoveries;
        }

        merger.merge(result);
        snapshotHolder.reload();

        log.info("=== Pattern discovery complete: {} sources with rules, {} with cached noise URLs ===",
                result.rulesBySource().size(), result.noiseUrlsBySource().size());
        return discoveries;
    }

    /**
     * Discovers every source in parallel. Sources that fail are logged and left out.
     */
    public List<SourceDiscovery> discover(Map<String, List<LabeledUrl>> urlsBySource) {
        Map<String, Future<SourceDiscovery>> futures = new LinkedHashMap<>();
        urlsBySource.forEach((source, urls) ->
                futures.put(source, executor.submit(() -> discoverSource(source, urls))));

        List<SourceDiscovery> discoveries = new ArrayList<>();
        for (Map.Entry<String, Future<SourceDiscovery>> entry : futures.entrySet()) {
            try {
                discoveries.add(entry.getValue().get());
            } catch (ExecutionException e) {
                log.error("[{}] Discovery failed: {}", entry.getKey(), e.getCause().getMessage(), e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.values().forEach(f -> f.cancel(true));
                throw new IllegalStateException("Interrupted while waiting for discovery", e);
            }
        }
        return discoveries;
    }

    public SourceDiscovery discoverSource(String source, List<LabeledUrl> urls) {
        ReentrantLock lock = sourceLocks.computeIfAbsent(source, s -> new ReentrantLock());
        lock.lock();
        try {
            List<SynthesizedPattern> triples = new ArrayList<>();
            List<String> noiseUrls = new ArrayList<>();
            int unusable = 0;

            for (LabeledUrl labeled : urls) {
                if (labeled.contentType() == ContentType.NOISE) {
                    noiseUrls.add(labeled.url());
                    continue;
                }
                var pattern = synthesizer.synthesize(labeled.url());
                if (pattern.isPresent()) {
                    triples.add(new SynthesizedPattern(labeled.url(), pattern.get(), labeled.contentType()));
                } else {
                    unusable++;
                }
            }
            if (unusable > 0) {
                log.debug("[{}] {} content URLs could not be generalized", source, unusable);
            }

            ValidationReport report = validator.validate(source, triples, urls);
            log.info("[{}] {} rules, {} noise URLs from {} labeled URLs",
                    source, report.rules().size(), noiseUrls.size(), urls.size());
            return new SourceDiscovery(source, report, noiseUrls);
        } finally {
            lock.unlock();
        }
    }

    static DiscoveryResult toResult(List<SourceDiscovery> discoveries) {
        Map<String, List<ClassificationRule>> rules = new LinkedHashMap<>();
        Map<String, List<String>> noise = new LinkedHashMap<>();
        for (SourceDiscovery d : discoveries) {
            if (!d.report().rules().isEmpty()) {
                rules.put(d.source(), d.report().rules());
            }
            if (!d.noiseUrls().isEmpty()) {
                noise.put(d.source(), d.noiseUrls());
            }
        }
        return DiscoveryResult.forSources(rules, noise);
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
