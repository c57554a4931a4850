package ac.tiercache.pool;

import ac.tiercache.TierSettings;

import java.time.Duration;

public class PoolSettings {
    private final int minConnections;
    private final int maxConnections;
    private final Duration idleTimeout;
    private final int retryAttempts;
    private final Duration retryDelay;
    private final boolean persistent;

    public PoolSettings(int minConnections, int maxConnections, Duration idleTimeout,
                        int retryAttempts, Duration retryDelay) {
        this(minConnections, maxConnections, idleTimeout, retryAttempts, retryDelay, true);
    }

    public PoolSettings(int minConnections, int maxConnections, Duration idleTimeout,
                        int retryAttempts, Duration retryDelay, boolean persistent) {
        if (maxConnections < 1) {
            throw new IllegalArgumentException("maxConnections must be at least 1: " + maxConnections);
        }
        this.minConnections = Math.max(0, Math.min(minConnections, maxConnections));
        this.maxConnections = maxConnections;
        this.idleTimeout = idleTimeout;
        this.retryAttempts = Math.max(1, retryAttempts);
        this.retryDelay = retryDelay;
        this.persistent = persistent;
    }

    public static PoolSettings from(TierSettings settings) {
        return new PoolSettings(
                settings.getMinConnections(),
                Math.max(1, settings.getMaxConnections()),
                Duration.ofSeconds(settings.getIdleTimeout()),
                settings.getRetryAttempts(),
                Duration.ofMillis(settings.getRetryDelay()),
                settings.isPersistent());
    }

    public int getMinConnections() { return minConnections; }
    public int getMaxConnections() { return maxConnections; }
    public Duration getIdleTimeout() { return idleTimeout; }
    public int getRetryAttempts() { return retryAttempts; }
    public Duration getRetryDelay() { return retryDelay; }

    /**
     * Whether a non-pooled handle outlives the operation that opened it.
     */
    public boolean isPersistent() { return persistent; }
}
