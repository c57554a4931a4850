package ac.tiercache.envelope;

import ac.tiercache.CacheEntry;
import ac.tiercache.tier.CorruptEntryException;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;

/**
 * Storage envelopes for the byte-oriented tiers.
 *
 * <p>Binary layout, used by segments, mapped files and compiled entries:
 * {@code [expiresAt:int64][keyTag:int64][length:int32][payload][zero padding]}.
 *
 * <p>File layout: the expiry as exactly ten ASCII digits followed by the payload bytes.
 */
public final class EnvelopeCodec {
    public static final int HEADER_SIZE = Long.BYTES + Long.BYTES + Integer.BYTES;
    public static final int EXTENT_RESERVE = 100;
    public static final int FILE_EXPIRY_WIDTH = 10;

    private static final long FILE_EXPIRY_MAX = 9_999_999_999L;

    private final PayloadCodec payloadCodec;

    public EnvelopeCodec(PayloadCodec payloadCodec) {
        this.payloadCodec = payloadCodec;
    }

    public PayloadCodec payloadCodec() {
        return payloadCodec;
    }

    /**
     * Size to allocate for an encoded envelope: the encoding plus a fixed reserve, never
     * below the configured minimum.
     */
    public static long extent(int encodedLength, long configuredSize) {
        return Math.max((long) encodedLength + EXTENT_RESERVE, configuredSize);
    }

    // ==================== BINARY ====================

    public byte[] encodeBinary(CacheEntry entry, long keyTag) {
        byte[] payload = payloadCodec.encode(entry.getPayload());
        ByteBuffer buffer = ByteBuffer.allocate(HEADER_SIZE + payload.length);
        buffer.putLong(entry.getExpiresAt());
        buffer.putLong(keyTag);
        buffer.putInt(payload.length);
        buffer.put(payload);
        return buffer.array();
    }

    /**
     * Decodes an envelope starting at the buffer's position. Returns empty when the stored
     * key tag belongs to another key.
     */
    public Optional<CacheEntry> decodeBinary(ByteBuffer buffer, long expectedKeyTag) throws CorruptEntryException {
        try {
            long expiresAt = buffer.getLong();
            long keyTag = buffer.getLong();
            if (keyTag != expectedKeyTag) {
                return Optional.empty();
            }
            int length = buffer.getInt();
            if (length <= 0 || length > buffer.remaining()) {
                throw new CorruptEntryException("Invalid payload length " + length);
            }
            byte[] payload = new byte[length];
            buffer.get(payload);
            return Optional.of(new CacheEntry(payloadCodec.decode(payload), expiresAt));
        } catch (BufferUnderflowException e) {
            throw new CorruptEntryException("Truncated envelope", e);
        }
    }

    public static long readBinaryExpiry(ByteBuffer buffer) throws CorruptEntryException {
        if (buffer.remaining() < Long.BYTES) {
            throw new CorruptEntryException("Truncated envelope header");
        }
        return buffer.getLong();
    }

    // ==================== FILE ====================

    public byte[] encodeFile(CacheEntry entry) {
        byte[] payload = payloadCodec.encode(entry.getPayload());
        long expiresAt = Math.min(entry.getExpiresAt(), FILE_EXPIRY_MAX);
        byte[] header = String.format("%010d", expiresAt).getBytes(StandardCharsets.US_ASCII);
        byte[] out = Arrays.copyOf(header, FILE_EXPIRY_WIDTH + payload.length);
        System.arraycopy(payload, 0, out, FILE_EXPIRY_WIDTH, payload.length);
        return out;
    }

    public CacheEntry decodeFile(byte[] content) throws CorruptEntryException {
        long expiresAt = readFileExpiry(content, content.length);
        byte[] payload = Arrays.copyOfRange(content, FILE_EXPIRY_WIDTH, content.length);
        return new CacheEntry(payloadCodec.decode(payload), expiresAt);
    }

    /**
     * Parses the ten-digit expiry header. The maximum header value means the entry never expires.
     */
    public static long readFileExpiry(byte[] header, int length) throws CorruptEntryException {
        if (length < FILE_EXPIRY_WIDTH) {
            throw new CorruptEntryException("Truncated expiry header");
        }
        long value = 0;
        for (int i = 0; i < FILE_EXPIRY_WIDTH; i++) {
            int digit = header[i] - '0';
            if (digit < 0 || digit > 9) {
                throw new CorruptEntryException("Non-numeric expiry header");
            }
            value = value * 10 + digit;
        }
        return value == FILE_EXPIRY_MAX ? CacheEntry.NEVER : value;
    }
}
