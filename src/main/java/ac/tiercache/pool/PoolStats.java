package ac.tiercache.pool;

/**
 * Point-in-time view of a connection provider.
 */
public final class PoolStats {
    private final String backend;
    private final int active;
    private final int idle;
    private final int maxConnections;
    private final long created;
    private final long reused;
    private final long discarded;

    public PoolStats(String backend, int active, int idle, int maxConnections,
                     long created, long reused, long discarded) {
        this.backend = backend;
        this.active = active;
        this.idle = idle;
        this.maxConnections = maxConnections;
        this.created = created;
        this.reused = reused;
        this.discarded = discarded;
    }

    public String getBackend() { return backend; }
    public int getActive() { return active; }
    public int getIdle() { return idle; }
    public int getTotal() { return active + idle; }
    public int getMaxConnections() { return maxConnections; }
    public long getCreated() { return created; }
    public long getReused() { return reused; }
    public long getDiscarded() { return discarded; }

    @Override
    public String toString() {
        return String.format("PoolStats{backend=%s, active=%d, idle=%d, max=%d, created=%d, reused=%d, discarded=%d}",
                backend, active, idle, maxConnections, created, reused, discarded);
    }
}
