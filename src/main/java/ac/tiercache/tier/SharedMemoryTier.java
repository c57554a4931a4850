package ac.tiercache.tier;

import ac.tiercache.CacheEntry;
import ac.tiercache.Tier;
import ac.tiercache.TierSettings;
import ac.tiercache.envelope.EnvelopeCodec;
import ac.tiercache.envelope.KeyHasher;
import ac.tiercache.envelope.MappedSegments;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named shared-memory segments, one per key slot, visible to every process on the host.
 * Segments live under {@code /dev/shm} unless a base path is configured. The segment id is a
 * base key plus a narrow hash of the prefixed key, so two keys can land on the same segment;
 * the key tag in the envelope tells them apart and a reader of the wrong key sees a miss.
 * Probe canaries go to the reserved segment {@code base_key + SEGMENT_SPACE}, outside the key space.
 */
public class SharedMemoryTier extends AbstractCacheTier {
    static final Path SHM_ROOT = Paths.get("/dev/shm");
    static final int SEGMENT_SPACE = 100_000;

    private final Path directory;
    private final MappedSegments segments;
    private final Map<String, Path> tracked = new ConcurrentHashMap<>();

    public SharedMemoryTier(TierSettings settings, TierContext context) {
        super(Tier.SHARED_MEMORY, settings, context);
        this.directory = settings.getBasePath() != null
                ? Paths.get(settings.getBasePath())
                : SHM_ROOT.resolve("tiercache");
        this.segments = new MappedSegments(context.getFileLocks());
    }

    public Path getDirectory() {
        return directory;
    }

    String segmentName(String key) {
        long slot = isProbeKey(key) ? SEGMENT_SPACE : Math.floorMod(KeyHasher.narrowHash(prefixed(key)), SEGMENT_SPACE);
        long id = settings.getBaseKey() + slot;
        return String.format("%08x", id);
    }

    Path segmentFor(String key) {
        return directory.resolve(segmentName(key));
    }

    int trackedSegments() {
        return tracked.size();
    }

    @Override
    protected boolean prepare() throws IOException {
        if (settings.getBasePath() == null && !Files.isDirectory(SHM_ROOT)) {
            return false;
        }
        Files.createDirectories(directory);
        return Files.isWritable(directory);
    }

    /**
     * Checks the segment directory without writing, so other processes' segments are never touched.
     */
    @Override
    public boolean isHealthy() {
        return Files.isDirectory(directory) && Files.isWritable(directory);
    }

    @Override
    protected Optional<CacheEntry> read(String key) throws IOException {
        Path segment = segmentFor(key);
        if (!Files.exists(segment)) {
            tracked.remove(key);
            return Optional.empty();
        }
        long tag = KeyHasher.keyTag(prefixed(key));
        try {
            Optional<CacheEntry> entry = segments.read(segment, buffer -> context.getCodec().decodeBinary(buffer, tag));
            if (entry == null || entry.isEmpty()) {
                return Optional.empty();
            }
            tracked.put(key, segment);
            return entry;
        } catch (NoSuchFileException e) {
            tracked.remove(key);
            return Optional.empty();
        }
    }

    @Override
    protected boolean write(String key, CacheEntry entry) throws IOException {
        byte[] envelope = context.getCodec().encodeBinary(entry, KeyHasher.keyTag(prefixed(key)));
        Path segment = segmentFor(key);
        Files.createDirectories(directory);
        segments.write(segment, envelope, settings.getSegmentSize());
        tracked.put(key, segment);
        return true;
    }

    /**
     * Deletes the key's segment unless it currently holds a colliding key's entry.
     */
    @Override
    protected void remove(String key) throws IOException {
        Path segment = segmentFor(key);
        tracked.remove(key);
        if (!Files.exists(segment)) {
            return;
        }
        long tag = KeyHasher.keyTag(prefixed(key));
        Boolean owned;
        try {
            owned = segments.read(segment, buffer -> ownsSegment(buffer, tag));
        } catch (NoSuchFileException e) {
            return;
        }
        if (owned == null || owned) {
            Files.deleteIfExists(segment);
        } else {
            logger.debug("Segment {} holds another key, leaving it in place", segment.getFileName());
        }
    }

    @Override
    protected void removeAll() throws IOException {
        tracked.clear();
        if (!Files.isDirectory(directory)) {
            return;
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory,
                path -> path.getFileName().toString().matches("[0-9a-f]{8}"))) {
            for (Path file : files) {
                Files.deleteIfExists(file);
            }
        }
    }

    /**
     * Sweeps only the segments this instance has touched. Segments that vanished or cannot be
     * read are dropped from tracking.
     */
    @Override
    protected int sweepExpired() {
        long now = context.now();
        int removed = 0;
        for (Map.Entry<String, Path> slot : tracked.entrySet()) {
            Path segment = slot.getValue();
            try {
                if (!Files.exists(segment)) {
                    tracked.remove(slot.getKey());
                    continue;
                }
                Long expiresAt;
                try {
                    expiresAt = segments.read(segment, EnvelopeCodec::readBinaryExpiry);
                } catch (CorruptEntryException e) {
                    expiresAt = null;
                }
                if (expiresAt == null || expiresAt <= now) {
                    if (Files.deleteIfExists(segment)) {
                        removed++;
                    }
                    tracked.remove(slot.getKey());
                }
            } catch (IOException e) {
                logger.warn("Dropping segment {} from tracking: {}", segment.getFileName(), describe(e));
                tracked.remove(slot.getKey());
            }
        }
        return removed;
    }

    @Override
    public void close() {
        tracked.clear();
    }

    private static boolean ownsSegment(ByteBuffer buffer, long tag) {
        if (buffer.remaining() < EnvelopeCodec.HEADER_SIZE) {
            return true;
        }
        return buffer.getLong(Long.BYTES) == tag;
    }
}
