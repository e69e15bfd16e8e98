package com.newsintel.curator.input;

import com.newsintel.curator.model.ContentType;
import com.newsintel.curator.model.LabeledUrl;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Historical URLs with their final labels, read from the urls table.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class LabeledUrlRepository {

    private static final RowMapper<LabeledUrl> ROW_MAPPER = (rs, rowNum) -> new LabeledUrl(
            rs.getString("source"),
            rs.getString("url"),
            ContentType.fromValue(rs.getString("content_type")));

    private final NamedParameterJdbcTemplate jdbc;

    public List<LabeledUrl> findLabeled(Collection<String> sources) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        String sql = """
                SELECT source, url, content_type
                FROM urls
                WHERE content_type IN ('content', 'noise')
                """;
        if (sources != null && !sources.isEmpty()) {
            sql += " AND source IN (:sources)";
            params.addValue("sources", sources);
        }
        sql += " ORDER BY source, id";

        List<LabeledUrl> urls = jdbc.query(sql, params, ROW_MAPPER);
        log.info("Loaded {} labeled URLs from the URL store", urls.size());
        return urls;
    }
}
