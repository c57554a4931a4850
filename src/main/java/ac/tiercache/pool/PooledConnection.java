package ac.tiercache.pool;

import java.time.Instant;

/**
 * A backend handle plus the bookkeeping its provider needs.
 */
public final class PooledConnection<C> {
    private final C handle;
    private final Instant createdAt;
    private volatile Instant lastHealthCheck;
    private volatile Instant lastReleasedAt;

    PooledConnection(C handle, Instant now) {
        this.handle = handle;
        this.createdAt = now;
        this.lastHealthCheck = now;
        this.lastReleasedAt = now;
    }

    public C handle() { return handle; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getLastHealthCheck() { return lastHealthCheck; }
    public Instant getLastReleasedAt() { return lastReleasedAt; }

    void markHealthy(Instant now) {
        this.lastHealthCheck = now;
    }

    void markReleased(Instant now) {
        this.lastReleasedAt = now;
    }
}
