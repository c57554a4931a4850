package ac.tiercache.tier;

import ac.tiercache.CacheEntry;
import ac.tiercache.Tier;
import ac.tiercache.TierSettings;
import ac.tiercache.envelope.EnvelopeCodec;
import ac.tiercache.envelope.KeyHasher;
import ac.tiercache.envelope.MappedSegments;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * One memory-mapped file per key, named after the hashed key. Files are sized to the configured
 * minimum so rewrites usually happen in place.
 */
public class MappedFileTier extends AbstractCacheTier {
    static final String SUFFIX = ".mmap";

    private final Path directory;
    private final MappedSegments segments;

    public MappedFileTier(TierSettings settings, TierContext context, Path directory) {
        super(Tier.MEMORY_MAPPED_FILE, settings, context);
        this.directory = directory;
        this.segments = new MappedSegments(context.getFileLocks());
    }

    public Path getDirectory() {
        return directory;
    }

    Path fileFor(String key) {
        return directory.resolve(KeyHasher.fileName(prefixed(key)) + SUFFIX);
    }

    @Override
    protected boolean prepare() throws IOException {
        Files.createDirectories(directory);
        return Files.isWritable(directory);
    }

    @Override
    protected Optional<CacheEntry> read(String key) throws IOException {
        Path file = fileFor(key);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        long tag = KeyHasher.keyTag(prefixed(key));
        try {
            Optional<CacheEntry> entry = segments.read(file, segment -> context.getCodec().decodeBinary(segment, tag));
            return entry != null ? entry : Optional.empty();
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }
    }

    @Override
    protected boolean write(String key, CacheEntry entry) throws IOException {
        byte[] envelope = context.getCodec().encodeBinary(entry, KeyHasher.keyTag(prefixed(key)));
        Files.createDirectories(directory);
        segments.write(fileFor(key), envelope, settings.getFileSize());
        return true;
    }

    @Override
    protected void remove(String key) throws IOException {
        Files.deleteIfExists(fileFor(key));
    }

    @Override
    protected void removeAll() throws IOException {
        if (!Files.isDirectory(directory)) {
            return;
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path file : files) {
                Files.deleteIfExists(file);
            }
        }
    }

    @Override
    protected int sweepExpired() throws IOException {
        if (!Files.isDirectory(directory)) {
            return 0;
        }
        long now = context.now();
        int removed = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path file : files) {
                if (isExpiredOrCorrupt(file, now) && Files.deleteIfExists(file)) {
                    removed++;
                }
            }
        }
        return removed;
    }

    private boolean isExpiredOrCorrupt(Path file, long now) throws IOException {
        try {
            Long expiresAt = segments.read(file, EnvelopeCodec::readBinaryExpiry);
            return expiresAt == null || expiresAt <= now;
        } catch (CorruptEntryException e) {
            return true;
        } catch (NoSuchFileException e) {
            return false;
        }
    }
}
