package ac.tiercache.envelope;

import java.io.IOException;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;

/**
 * Reads and writes binary envelopes through memory-mapped files. A segment is sized by
 * {@link EnvelopeCodec#extent(int, long)}; a segment too small for the new envelope is
 * truncated and mapped again at the larger size, otherwise it is overwritten in place from
 * offset zero with the tail of the previous envelope zeroed.
 */
public final class MappedSegments {

    @FunctionalInterface
    public interface SegmentReader<T> {
        T read(MappedByteBuffer segment) throws IOException;
    }

    private final FileLocks locks;

    public MappedSegments(FileLocks locks) {
        this.locks = locks;
    }

    public void write(Path path, byte[] envelope, long minimumSize) throws IOException {
        locks.write(path, channel -> {
            long extent = EnvelopeCodec.extent(envelope.length, minimumSize);
            long current = channel.size();
            int previousLength = 0;
            if (current < extent) {
                channel.truncate(0);
                current = extent;
            } else {
                previousLength = storedLength(channel.map(FileChannel.MapMode.READ_ONLY, 0, current), current);
            }
            MappedByteBuffer segment = channel.map(FileChannel.MapMode.READ_WRITE, 0, current);
            segment.put(envelope);
            for (int i = envelope.length; i < previousLength; i++) {
                segment.put(i, (byte) 0);
            }
            return null;
        });
    }

    /**
     * Runs the reader over the mapped segment, or returns {@code null} when the segment holds
     * no envelope yet.
     */
    public <T> T read(Path path, SegmentReader<T> reader) throws IOException {
        return locks.read(path, channel -> {
            long size = channel.size();
            if (size < EnvelopeCodec.HEADER_SIZE) {
                return null;
            }
            return reader.read(channel.map(FileChannel.MapMode.READ_ONLY, 0, size));
        });
    }

    private static int storedLength(MappedByteBuffer segment, long size) {
        if (size < EnvelopeCodec.HEADER_SIZE) {
            return 0;
        }
        int payloadLength = segment.getInt(Long.BYTES + Long.BYTES);
        long total = (long) EnvelopeCodec.HEADER_SIZE + Math.max(0, payloadLength);
        return (int) Math.min(total, size);
    }
}
