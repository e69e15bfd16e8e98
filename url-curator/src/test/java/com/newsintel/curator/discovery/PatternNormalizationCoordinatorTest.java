package com.newsintel.curator.discovery;

import com.newsintel.curator.config.CurationProperties;
import com.newsintel.curator.model.CandidatePattern;
import com.newsintel.curator.model.ContentType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class PatternNormalizationCoordinatorTest {

    private final CurationProperties properties = new CurationProperties();
    private final List<NormalizationRequest> requests = Collections.synchronizedList(new ArrayList<>());

    @BeforeEach
    void setUp() {
        properties.getNormalizer().setBatchSize(40);
        properties.getNormalizer().setMaxPasses(5);
    }

    private static Map<String, CandidatePattern> candidates(int count) {
        Map<String, CandidatePattern> groups = new LinkedHashMap<>();
        for (int i = 0; i < count; i++) {
            String pattern = "^https?://x\\.com/p" + i + "$";
            groups.put(pattern, new CandidatePattern(pattern).add("https://x.com/p" + i, ContentType.CONTENT));
        }
        return groups;
    }

    private static int exampleCount(Map<String, CandidatePattern> groups) {
        return groups.values().stream().mapToInt(c -> c.getExampleUrls().size()).sum();
    }

    private PatternNormalizationCoordinator coordinator(PatternNormalizer normalizer) {
        PatternNormalizer recording = request -> {
            requests.add(request);
            return normalizer.normalize(request);
        };
        return new PatternNormalizationCoordinator(Optional.of(recording), properties);
    }

    /** Merges each request into the given number of groups. */
    private static PatternNormalizer mergingInto(int groupsPerRequest) {
        AtomicInteger counter = new AtomicInteger();
        return request -> {
            List<String> patterns = request.patterns();
            int size = (int) Math.ceil((double) patterns.size() / groupsPerRequest);
            List<NormalizedGroup> groups = new ArrayList<>();
            for (int from = 0; from < patterns.size(); from += size) {
                groups.add(new NormalizedGroup("^https?://x\\.com/merged" + counter.incrementAndGet() + "$",
                        patterns.subList(from, Math.min(from + size, patterns.size())), "same structure"));
            }
            return groups;
        };
    }

    @Test
    void requestsNeverExceedTheBatchSize() {
        Map<String, CandidatePattern> result = coordinator(mergingInto(1)).normalize(candidates(100));

        assertThat(requests).hasSize(3);
        assertThat(requests).allSatisfy(r -> assertThat(r.patterns().size()).isLessThanOrEqualTo(40));
        assertThat(result).hasSize(3);
        assertThat(exampleCount(result)).isEqualTo(100);
    }

    @Test
    void stopsAfterMaxPasses() {
        properties.getNormalizer().setBatchSize(4);
        properties.getNormalizer().setMaxPasses(2);

        Map<String, CandidatePattern> result = coordinator(mergingInto(2)).normalize(candidates(40));

        // 40 -> 20 -> 10, then the pass cap stops it
        assertThat(requests).hasSize(10 + 5);
        assertThat(result).hasSize(10);
        assertThat(exampleCount(result)).isEqualTo(40);
    }

    @Test
    void malformedResponseIsRetriedWithHalfThePatternsAtTemperatureZero() {
        PatternNormalizer normalizer = request -> {
            if (!request.strict()) {
                throw new MalformedNormalizationException("truncated JSON");
            }
            return List.of(new NormalizedGroup("^https?://x\\.com/p[0-9]+$", request.patterns(), "numbered"));
        };

        Map<String, CandidatePattern> result = coordinator(normalizer).normalize(candidates(10));

        assertThat(requests).hasSize(2);
        NormalizationRequest retry = requests.get(1);
        assertThat(retry.strict()).isTrue();
        assertThat(retry.temperature()).isZero();
        assertThat(retry.patterns()).hasSize(5);
        // the reduced half merged into one, the dropped half carried over unchanged
        assertThat(result).hasSize(6);
        assertThat(result.get("^https?://x\\.com/p[0-9]+$").getExampleUrls()).hasSize(5);
        assertThat(exampleCount(result)).isEqualTo(10);
    }

    @Test
    void secondFailureKeepsTheBatchUnchanged() {
        PatternNormalizer normalizer = request -> {
            throw new MalformedNormalizationException("not JSON");
        };
        Map<String, CandidatePattern> input = candidates(8);

        Map<String, CandidatePattern> result = coordinator(normalizer).normalize(input);

        assertThat(requests).hasSize(2);
        assertThat(result.keySet()).containsExactlyElementsOf(input.keySet());
    }

    @Test
    void transportFailureKeepsTheBatchUnchanged() {
        PatternNormalizer normalizer = request -> {
            throw new IllegalStateException("connection refused");
        };

        Map<String, CandidatePattern> result = coordinator(normalizer).normalize(candidates(8));

        assertThat(requests).hasSize(1);
        assertThat(result).hasSize(8);
    }

    @Test
    void patternsTheNormalizerDoesNotMentionAreCarriedOver() {
        Map<String, CandidatePattern> input = candidates(4);
        List<String> keys = new ArrayList<>(input.keySet());
        PatternNormalizer normalizer = request -> List.of(
                new NormalizedGroup("^https?://x\\.com/p[01]$", keys.subList(0, 2), "pair"));

        Map<String, CandidatePattern> result = coordinator(normalizer).normalize(input);

        assertThat(result.keySet()).containsExactly("^https?://x\\.com/p[01]$", keys.get(2), keys.get(3));
        assertThat(exampleCount(result)).isEqualTo(4);
    }

    @Test
    void invalidOrUnknownGroupsAreIgnored() {
        Map<String, CandidatePattern> input = candidates(3);
        List<String> keys = new ArrayList<>(input.keySet());
        PatternNormalizer normalizer = request -> List.of(
                new NormalizedGroup("([not a regex", keys, "broken"),
                new NormalizedGroup("^https?://x\\.com/other$", List.of("^never-seen$"), "hallucinated"));

        Map<String, CandidatePattern> result = coordinator(normalizer).normalize(input);

        assertThat(result.keySet()).containsExactlyElementsOf(keys);
    }

    @Test
    void disabledCoordinatorReturnsInputUnchanged() {
        PatternNormalizationCoordinator disabled = new PatternNormalizationCoordinator(Optional.empty(), properties);
        Map<String, CandidatePattern> input = candidates(50);

        assertThat(disabled.isEnabled()).isFalse();
        assertThat(disabled.normalize(input)).isSameAs(input);
    }
}
