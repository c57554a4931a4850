package ac.tiercache;

import java.time.Clock;
import java.util.Objects;

/**
 * A cached payload together with its absolute expiry, in epoch seconds.
 * An entry is expired once the clock reaches {@code expiresAt}.
 */
public final class CacheEntry {
    public static final long NEVER = Long.MAX_VALUE;

    private final Object payload;
    private final long expiresAt;

    public CacheEntry(Object payload, long expiresAt) {
        this.payload = Objects.requireNonNull(payload, "payload");
        this.expiresAt = expiresAt;
    }

    public static CacheEntry of(Object payload, long ttlSeconds, Clock clock) {
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("TTL must be positive: " + ttlSeconds);
        }
        long now = clock.instant().getEpochSecond();
        long expiresAt = ttlSeconds > NEVER - now ? NEVER : now + ttlSeconds;
        return new CacheEntry(payload, expiresAt);
    }

    public Object getPayload() { return payload; }
    public long getExpiresAt() { return expiresAt; }

    public boolean isExpired(Clock clock) {
        return isExpiredAt(clock.instant().getEpochSecond());
    }

    public boolean isExpiredAt(long epochSecond) {
        return expiresAt <= epochSecond;
    }

    public boolean hasExpiry() {
        return expiresAt != NEVER;
    }

    /**
     * Seconds left before expiry, never less than zero.
     */
    public long remainingSeconds(Clock clock) {
        if (!hasExpiry()) {
            return Long.MAX_VALUE;
        }
        return Math.max(0L, expiresAt - clock.instant().getEpochSecond());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CacheEntry that = (CacheEntry) o;
        return expiresAt == that.expiresAt && payload.equals(that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(payload, expiresAt);
    }

    @Override
    public String toString() {
        return "CacheEntry{expiresAt=" + expiresAt + ", payloadType=" + payload.getClass().getName() + "}";
    }
}
