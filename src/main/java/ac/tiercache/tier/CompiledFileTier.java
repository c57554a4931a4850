package ac.tiercache.tier;

import ac.tiercache.CacheEntry;
import ac.tiercache.Tier;
import ac.tiercache.TierSettings;
import ac.tiercache.envelope.ChannelIO;
import ac.tiercache.envelope.EnvelopeCodec;
import ac.tiercache.envelope.KeyHasher;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entries persisted as files and kept decoded on the heap once loaded. A decoded entry is
 * served as long as its file still has the size and modification time it was loaded with;
 * any change on disk forces a fresh decode.
 */
public class CompiledFileTier extends AbstractCacheTier {
    static final String SUFFIX = ".entry";

    private final Path directory;
    private final Map<String, Compiled> compiled = new ConcurrentHashMap<>();

    public CompiledFileTier(TierSettings settings, TierContext context, Path directory) {
        super(Tier.OPCODE_CACHE, settings, context);
        this.directory = directory;
    }

    public Path getDirectory() {
        return directory;
    }

    int compiledEntries() {
        return compiled.size();
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
        String name = file.getFileName().toString();
        BasicFileAttributes attributes;
        try {
            attributes = Files.readAttributes(file, BasicFileAttributes.class);
        } catch (NoSuchFileException e) {
            compiled.remove(name);
            return Optional.empty();
        }

        Compiled cached = compiled.get(name);
        if (cached != null && cached.matches(attributes)) {
            return Optional.of(detached(cached.entry));
        }

        byte[] content;
        try {
            content = context.getFileLocks().read(file, ChannelIO::readFully);
        } catch (NoSuchFileException e) {
            compiled.remove(name);
            return Optional.empty();
        }
        Optional<CacheEntry> entry = context.getCodec().decodeBinary(ByteBuffer.wrap(content), KeyHasher.keyTag(prefixed(key)));
        if (entry.isEmpty()) {
            return entry;
        }
        compiled.put(name, new Compiled(entry.get(), attributes.lastModifiedTime(), attributes.size()));
        return Optional.of(detached(entry.get()));
    }

    @Override
    protected boolean write(String key, CacheEntry entry) throws IOException {
        byte[] envelope = context.getCodec().encodeBinary(entry, KeyHasher.keyTag(prefixed(key)));
        Path file = fileFor(key);
        Files.createDirectories(directory);
        compiled.remove(file.getFileName().toString());
        context.getFileLocks().write(file, channel -> {
            ChannelIO.overwrite(channel, envelope);
            return null;
        });
        return true;
    }

    @Override
    protected void remove(String key) throws IOException {
        Path file = fileFor(key);
        compiled.remove(file.getFileName().toString());
        Files.deleteIfExists(file);
    }

    @Override
    protected void removeAll() throws IOException {
        compiled.clear();
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
                if (isExpiredOrCorrupt(file, now)) {
                    compiled.remove(file.getFileName().toString());
                    if (Files.deleteIfExists(file)) {
                        removed++;
                    }
                }
            }
        }
        return removed;
    }

    private boolean isExpiredOrCorrupt(Path file, long now) throws IOException {
        try {
            byte[] header = context.getFileLocks().read(file, channel -> ChannelIO.readPrefix(channel, Long.BYTES));
            return EnvelopeCodec.readBinaryExpiry(ByteBuffer.wrap(header)) <= now;
        } catch (CorruptEntryException e) {
            return true;
        } catch (NoSuchFileException e) {
            return false;
        }
    }

    @Override
    public void close() {
        compiled.clear();
    }

    private static final class Compiled {
        private final CacheEntry entry;
        private final FileTime modified;
        private final long size;

        Compiled(CacheEntry entry, FileTime modified, long size) {
            this.entry = entry;
            this.modified = modified;
            this.size = size;
        }

        boolean matches(BasicFileAttributes attributes) {
            return attributes.size() == size && attributes.lastModifiedTime().equals(modified);
        }
    }
}
