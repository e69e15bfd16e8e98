package com.newsintel.curator.input;

import com.newsintel.curator.config.CurationProperties;
import com.newsintel.curator.model.ContentType;
import com.newsintel.curator.model.LabeledUrl;
import com.newsintel.curator.rules.SourceKeys;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads labeled URLs from a CSV export with a header row.
 *
 * Required columns: url, content_type. Optional: source (derived from the URL's
 * domain when absent or blank). Column order does not matter.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CsvLabeledUrlReader {

    private final CurationProperties properties;

    public List<LabeledUrl> read() {
        return read(Path.of(properties.getDiscovery().getInput().getCsvFile()));
    }

    public List<LabeledUrl> read(Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            List<LabeledUrl> urls = read(reader);
            log.info("Read {} labeled URLs from {}", urls.size(), file);
            return urls;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read labeled URLs from " + file, e);
        }
    }

    List<LabeledUrl> read(Reader input) throws IOException {
        try (CSVReader csv = new CSVReader(input)) {
            String[] header = csv.readNext();
            if (header == null) {
                return List.of();
            }
            int sourceCol = indexOf(header, "source");
            int urlCol = indexOf(header, "url");
            int typeCol = indexOf(header, "content_type");
            if (urlCol < 0 || typeCol < 0) {
                throw new IllegalArgumentException("CSV header must contain url and content_type columns");
            }

            List<LabeledUrl> urls = new ArrayList<>();
            int malformed = 0;
            String[] row;
            while ((row = csv.readNext()) != null) {
                String url = safeGet(row, urlCol);
                String type = safeGet(row, typeCol);
                if (url.isBlank() || type.isBlank()) {
                    malformed++;
                    continue;
                }
                ContentType contentType;
                try {
                    contentType = ContentType.fromValue(type);
                } catch (IllegalArgumentException e) {
                    malformed++;
                    continue;
                }
                String source = safeGet(row, sourceCol);
                urls.add(new LabeledUrl(source.isBlank() ? SourceKeys.domain(url) : source,
                        url, contentType));
            }

            if (malformed > 0) {
                log.warn("Skipped {} malformed CSV rows", malformed);
            }
            return urls;
        } catch (CsvValidationException e) {
            throw new IOException("Invalid CSV at line " + e.getLineNumber() + ": " + e.getMessage(), e);
        }
    }

    private static int indexOf(String[] header, String column) {
        for (int i = 0; i < header.length; i++) {
            if (header[i] != null && header[i].trim().toLowerCase(Locale.ROOT).equals(column)) {
                return i;
            }
        }
        return -1;
    }

    private static String safeGet(String[] row, int idx) {
        return idx >= 0 && idx < row.length && row[idx] != null ? row[idx].trim() : "";
    }
}
