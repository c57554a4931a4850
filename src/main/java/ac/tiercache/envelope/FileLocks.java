package ac.tiercache.envelope;

import com.google.common.util.concurrent.Striped;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.locks.Lock;

/**
 * Advisory file locking for the file-backed tiers. OS locks are held per JVM, so threads of
 * this process first serialize on a striped lock for the path before taking the OS lock:
 * shared for reads, exclusive for writes.
 */
public final class FileLocks {
    private final Striped<Lock> stripes = Striped.lock(64);

    @FunctionalInterface
    public interface ChannelAction<T> {
        T apply(FileChannel channel) throws IOException;
    }

    public <T> T read(Path path, ChannelAction<T> action) throws IOException {
        Lock lock = stripes.get(path.toAbsolutePath().normalize());
        lock.lock();
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ);
             FileLock ignored = channel.lock(0L, Long.MAX_VALUE, true)) {
            return action.apply(channel);
        } finally {
            lock.unlock();
        }
    }

    public <T> T write(Path path, ChannelAction<T> action) throws IOException {
        Lock lock = stripes.get(path.toAbsolutePath().normalize());
        lock.lock();
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ,
                StandardOpenOption.WRITE, StandardOpenOption.CREATE);
             FileLock ignored = channel.lock()) {
            return action.apply(channel);
        } finally {
            lock.unlock();
        }
    }
}
