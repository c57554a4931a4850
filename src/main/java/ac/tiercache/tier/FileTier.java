package ac.tiercache.tier;

import ac.tiercache.CacheEntry;
import ac.tiercache.Tier;
import ac.tiercache.TierSettings;
import ac.tiercache.envelope.ChannelIO;
import ac.tiercache.envelope.EnvelopeCodec;
import ac.tiercache.envelope.KeyHasher;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * One file per key in the cache directory. The file name is the hashed key and the content is
 * the ten-digit expiry followed by the payload. The directory itself is provisioned by the
 * registry and may be relocated at runtime.
 */
public class FileTier extends AbstractCacheTier {
    static final Pattern ENTRY_NAME = Pattern.compile("^[0-9a-f]{32}$");

    private volatile Path directory;

    public FileTier(TierSettings settings, TierContext context, Path directory) {
        super(Tier.FILESYSTEM, settings, context);
        this.directory = directory;
    }

    public Path getDirectory() {
        return directory;
    }

    public void relocate(Path newDirectory) {
        logger.info("Filesystem tier relocated from {} to {}", directory, newDirectory);
        this.directory = newDirectory;
    }

    Path fileFor(String key) {
        return directory.resolve(KeyHasher.fileName(prefixed(key)));
    }

    @Override
    protected boolean prepare() {
        return Files.isDirectory(directory) && Files.isWritable(directory);
    }

    @Override
    protected Optional<CacheEntry> read(String key) throws IOException {
        Path file = fileFor(key);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        byte[] content;
        try {
            content = context.getFileLocks().read(file, ChannelIO::readFully);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }
        return Optional.of(context.getCodec().decodeFile(content));
    }

    @Override
    protected boolean write(String key, CacheEntry entry) throws IOException {
        byte[] content = context.getCodec().encodeFile(entry);
        context.getFileLocks().write(fileFor(key), channel -> {
            ChannelIO.overwrite(channel, content);
            return null;
        });
        return true;
    }

    @Override
    protected void remove(String key) throws IOException {
        Files.deleteIfExists(fileFor(key));
    }

    @Override
    protected void removeAll() throws IOException {
        Path dir = directory;
        if (!Files.isDirectory(dir)) {
            return;
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, this::isEntryFile)) {
            for (Path file : files) {
                Files.deleteIfExists(file);
            }
        }
    }

    @Override
    protected int sweepExpired() throws IOException {
        Path dir = directory;
        if (!Files.isDirectory(dir)) {
            return 0;
        }
        long now = context.now();
        int removed = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, this::isEntryFile)) {
            for (Path file : files) {
                if (isExpiredOrCorrupt(file, now) && Files.deleteIfExists(file)) {
                    removed++;
                }
            }
        }
        if (removed > 0) {
            logger.debug("Removed {} expired files from {}", removed, dir);
        }
        return removed;
    }

    private boolean isExpiredOrCorrupt(Path file, long now) throws IOException {
        try {
            byte[] header = context.getFileLocks().read(file,
                    channel -> ChannelIO.readPrefix(channel, EnvelopeCodec.FILE_EXPIRY_WIDTH));
            return EnvelopeCodec.readFileExpiry(header, header.length) <= now;
        } catch (CorruptEntryException e) {
            return true;
        } catch (NoSuchFileException e) {
            return false;
        }
    }

    private boolean isEntryFile(Path path) {
        return Files.isRegularFile(path) && ENTRY_NAME.matcher(path.getFileName().toString()).matches();
    }
}
