package com.newsintel.curator.input;

import com.newsintel.curator.config.CurationProperties;
import com.newsintel.curator.model.LabeledUrl;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Loads discovery input from the source selected by {@code curation.discovery.input.mode}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class HistoricalUrlRouter {

    private final LabeledUrlRepository repository;
    private final CsvLabeledUrlReader csvReader;
    private final CurationProperties properties;

    /**
     * @param sources sources to load, empty for all
     * @return labeled URLs grouped by source, in first-seen order
     */
    public Map<String, List<LabeledUrl>> loadBySource(Collection<String> sources) {
        List<LabeledUrl> urls = switch (properties.getDiscovery().getInput().getMode()) {
            case JDBC -> repository.findLabeled(sources);
            case CSV -> csvReader.read().stream()
                    .filter(u -> sources.isEmpty() || sources.contains(u.source()))
                    .toList();
        };

        Map<String, List<LabeledUrl>> bySource = urls.stream()
                .collect(Collectors.groupingBy(LabeledUrl::source, LinkedHashMap::new, Collectors.toList()));
        log.info("Discovery input: {} URLs across {} sources", urls.size(), bySource.size());
        return bySource;
    }
}
