package com.newsintel.curator.catalogue;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.newsintel.curator.config.CurationProperties;
import com.newsintel.curator.model.ContentType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Reads and writes the rule catalogue and noise cache YAML documents.
 *
 * Writes go to a temporary file in the same directory and are then moved over
 * the target, so a reader sees either the previous or the new document.
 * Read-modify-write cycles run under {@link #withWriteLock(Supplier)}: a JVM-local
 * lock plus a file lock beside the catalogue for other processes.
 *
 * An unknown content_type reads as null, so only that rule is skipped when the
 * snapshot is built.
 */
@Component
@Slf4j
public class CatalogueStore {

    private final Path catalogueFile;
    private final Path noiseCacheFile;
    private final ObjectMapper yaml;
    private final ReentrantLock writeLock = new ReentrantLock();

    @Autowired
    public CatalogueStore(CurationProperties properties) {
        this(Paths.get(properties.getRules().getCatalogueFile()),
                Paths.get(properties.getRules().getNoiseCacheFile()));
    }

    public CatalogueStore(Path catalogueFile, Path noiseCacheFile) {
        this.catalogueFile = catalogueFile;
        this.noiseCacheFile = noiseCacheFile;
        this.yaml = new ObjectMapper(new YAMLFactory()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES))
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .registerModule(new SimpleModule().addDeserializer(ContentType.class, new LenientContentType()));
    }

    public RuleCatalogue loadCatalogue() {
        if (!Files.exists(catalogueFile)) {
            log.warn("Rules file not found: {}", catalogueFile);
            return new RuleCatalogue();
        }
        RuleCatalogue catalogue = read(catalogueFile, RuleCatalogue.class);
        return catalogue == null ? new RuleCatalogue() : catalogue;
    }

    public NoiseUrlCache loadNoiseCache() {
        if (!Files.exists(noiseCacheFile)) {
            log.info("Cached URLs file not found: {} (will be created on first update)", noiseCacheFile);
            return new NoiseUrlCache();
        }
        NoiseUrlCache cache = read(noiseCacheFile, NoiseUrlCache.class);
        return cache == null ? new NoiseUrlCache() : cache;
    }

    public void saveCatalogue(RuleCatalogue catalogue) {
        write(catalogueFile, catalogue);
    }

    public void saveNoiseCache(NoiseUrlCache cache) {
        write(noiseCacheFile, cache);
    }

    public <T> T withWriteLock(Supplier<T> action) {
        writeLock.lock();
        try {
            Path lockFile = siblingOf(catalogueFile, ".lock");
            ensureParent(lockFile);
            try (FileChannel channel = FileChannel.open(lockFile,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {
                return action.get();
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot lock rule catalogue " + lockFile, e);
            }
        } finally {
            writeLock.unlock();
        }
    }

    public Path getCatalogueFile() {
        return catalogueFile;
    }

    public Path getNoiseCacheFile() {
        return noiseCacheFile;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private <T> T read(Path file, Class<T> type) {
        try {
            return yaml.readValue(file.toFile(), type);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file + ": " + e.getMessage(), e);
        }
    }

    private void write(Path target, Object document) {
        ensureParent(target);
        Path tmp = siblingOf(target, ".tmp");
        try {
            yaml.writeValue(tmp.toFile(), document);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("Atomic move not supported for {}, falling back to replace", target);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + target + ": " + e.getMessage(), e);
        }
    }

    private void ensureParent(Path file) {
        Path parent = file.toAbsolutePath().getParent();
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create directory: " + parent, e);
        }
    }

    private Path siblingOf(Path file, String suffix) {
        return file.toAbsolutePath().resolveSibling(file.getFileName() + suffix);
    }

    private static final class LenientContentType extends StdDeserializer<ContentType> {

        LenientContentType() {
            super(ContentType.class);
        }

        @Override
        public ContentType deserialize(JsonParser parser, DeserializationContext context) throws IOException {
            String raw = parser.getValueAsString();
            try {
                return ContentType.fromValue(raw);
            } catch (IllegalArgumentException e) {
                log.warn("Unknown content_type '{}' in rule catalogue, rule will be skipped", raw);
                return null;
            }
        }
    }
}
