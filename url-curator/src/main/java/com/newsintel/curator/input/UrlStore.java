package com.newsintel.curator.input;

import com.newsintel.curator.model.CandidateLink;
import com.newsintel.curator.model.ClassifiedLink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Candidate links for a run date, and the rule-tier classifications written back to them.
 *
 * Rows without a content_type are unclassified. Rule-tier misses stay that way so the
 * fallback classifier picks them up.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class UrlStore {

    private static final int BATCH_SIZE = 500;

    private static final RowMapper<CandidateLink> ROW_MAPPER = (rs, rowNum) -> CandidateLink.builder()
            .id(rs.getLong("id"))
            .source(rs.getString("source"))
            .url(rs.getString("url"))
            .title(rs.getString("title"))
            .build();

    private final JdbcTemplate jdbcTemplate;

    public void ensureSchema() {
        log.info("Ensuring urls schema exists...");
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS urls
            (
                id                      BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                source                  VARCHAR(255)  NOT NULL,
                url                     VARCHAR(2048) NOT NULL,
                title                   VARCHAR(1024),
                extracted_at            TIMESTAMP     NOT NULL,
                content_type            VARCHAR(20),
                classification_method   VARCHAR(50),
                rule_name               VARCHAR(255),
                content_subtype         VARCHAR(100),
                classified_at           TIMESTAMP
            )
        """);
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_urls_extracted_at ON urls (extracted_at)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_urls_source ON urls (source)");
        log.info("urls schema ready.");
    }

    public List<CandidateLink> findUnclassified(LocalDate runDate) {
        return jdbcTemplate.query("""
                SELECT id, source, url, title
                FROM urls
                WHERE extracted_at >= ? AND extracted_at < ?
                  AND content_type IS NULL
                ORDER BY id
                """, ROW_MAPPER,
                Timestamp.valueOf(runDate.atStartOfDay()),
                Timestamp.valueOf(runDate.plusDays(1).atStartOfDay()));
    }

    /**
     * Writes classifications in batches. Only rows still unclassified are updated, so
     * re-running a stage never overwrites a label assigned since.
     *
     * @return rows updated
     */
    public int saveClassifications(List<ClassifiedLink> links) throws InterruptedException {
        Timestamp now = Timestamp.valueOf(LocalDateTime.now());
        int updated = 0;

        for (int i = 0; i < links.size(); i += BATCH_SIZE) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Interrupted after saving " + updated + " classifications");
            }
            List<ClassifiedLink> batch = links.subList(i, Math.min(i + BATCH_SIZE, links.size()));
            int[] counts = jdbcTemplate.batchUpdate("""
                    UPDATE urls
                    SET content_type = ?, classification_method = ?, rule_name = ?,
                        content_subtype = ?, classified_at = ?
                    WHERE id = ? AND content_type IS NULL
                    """,
                    batch.stream().map(l -> new Object[]{
                            l.getContentType().value(),
                            l.getClassificationMethod(),
                            l.getRuleName(),
                            l.getContentSubtype(),
                            now,
                            l.getLink().getId()
                    }).toList());
            for (int c : counts) {
                updated += Math.max(c, 0);
            }
            log.debug("Saved classification batch {}/{}", Math.min(i + BATCH_SIZE, links.size()), links.size());
        }
        return updated;
    }
}
