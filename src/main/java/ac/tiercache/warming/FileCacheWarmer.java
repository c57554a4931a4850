package ac.tiercache.warming;

import ac.tiercache.CacheSettings;
import ac.tiercache.TieredCacheEngine;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads file contents into the cache. Each entry names a file, the key to store it under and
 * how to parse it. Missing or unreadable files are skipped.
 */
public class FileCacheWarmer implements CacheWarmer {
    private static final Logger logger = LoggerFactory.getLogger(FileCacheWarmer.class);

    public enum Parser {
        /** File text as a single string. */
        RAW,
        /** JSON document as maps, lists and scalars. */
        JSON,
        /** One string per line. */
        LINES
    }

    private final String name;
    private final List<Entry> entries;
    private final long defaultTtlSeconds;
    private final ObjectMapper objectMapper;

    public FileCacheWarmer(String name, List<Entry> entries) {
        this(name, entries, CacheSettings.DEFAULT_TTL_SECONDS, new ObjectMapper());
    }

    public FileCacheWarmer(String name, List<Entry> entries, long defaultTtlSeconds, ObjectMapper objectMapper) {
        this.name = name;
        this.entries = List.copyOf(entries);
        this.defaultTtlSeconds = defaultTtlSeconds;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean isApplicable() {
        return !entries.isEmpty();
    }

    @Override
    public int warm(TieredCacheEngine engine) {
        int warmed = 0;
        for (Entry entry : entries) {
            Path file = entry.getFile();
            if (!Files.isRegularFile(file) || !Files.isReadable(file)) {
                logger.debug("Skipping warm-up file {}: not readable", file);
                continue;
            }
            try {
                Object value = parse(file, entry.getParser());
                long ttl = entry.getTtlSeconds() > 0 ? entry.getTtlSeconds() : defaultTtlSeconds;
                if (engine.set(entry.getCacheKey(), value, ttl)) {
                    warmed++;
                }
            } catch (IOException e) {
                logger.warn("Cache warming from {} failed: {}", file, e.getMessage());
            }
        }
        return warmed;
    }

    private Object parse(Path file, Parser parser) throws IOException {
        switch (parser) {
            case JSON:
                return objectMapper.readValue(file.toFile(), Object.class);
            case LINES:
                return new ArrayList<>(Files.readAllLines(file, StandardCharsets.UTF_8));
            case RAW:
            default:
                return Files.readString(file, StandardCharsets.UTF_8);
        }
    }

    /**
     * One file to load. A ttl of zero means the warmer's default.
     */
    public static class Entry {
        private final Path file;
        private final String cacheKey;
        private final long ttlSeconds;
        private final Parser parser;

        public Entry(Path file, String cacheKey, long ttlSeconds, Parser parser) {
            this.file = file;
            this.cacheKey = cacheKey;
            this.ttlSeconds = ttlSeconds;
            this.parser = parser != null ? parser : Parser.RAW;
        }

        public static Entry raw(Path file, String cacheKey) {
            return new Entry(file, cacheKey, 0, Parser.RAW);
        }

        public Path getFile() { return file; }
        public String getCacheKey() { return cacheKey; }
        public long getTtlSeconds() { return ttlSeconds; }
        public Parser getParser() { return parser; }
    }
}
