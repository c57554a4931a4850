package ac.tiercache.pool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded pool of backend handles. Handles are created lazily, with the configured minimum
 * opened on first use. Idle handles are health-checked before reuse, and a released handle is
 * kept idle only while fewer than half of the maximum are idle.
 */
public class ConnectionPool<C> implements ConnectionProvider<C> {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionPool.class);

    private final ConnectionFactory<C> factory;
    private final PoolSettings settings;
    private final RetryingConnector<C> connector;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<PooledConnection<C>> idle = new ArrayDeque<>();
    private final Set<PooledConnection<C>> active = Collections.newSetFromMap(new IdentityHashMap<>());
    private int pending;
    private boolean warmedUp;
    private boolean closed;

    private final AtomicLong created = new AtomicLong();
    private final AtomicLong reused = new AtomicLong();
    private final AtomicLong discarded = new AtomicLong();

    public ConnectionPool(ConnectionFactory<C> factory, PoolSettings settings, Clock clock) {
        this.factory = factory;
        this.settings = settings;
        this.clock = clock;
        this.connector = new RetryingConnector<>(factory, settings.getRetryAttempts(), settings.getRetryDelay());
    }

    @Override
    public PooledConnection<C> acquire() throws ConnectionUnavailableException {
        warmUp();
        while (true) {
            PooledConnection<C> candidate;
            lock.lock();
            try {
                ensureOpen();
                candidate = idle.pollFirst();
                if (candidate == null) {
                    if (active.size() + pending >= settings.getMaxConnections()) {
                        throw new ConnectionUnavailableException("Connection pool for " + factory.describe()
                                + " exhausted (" + settings.getMaxConnections() + " in use)");
                    }
                    pending++;
                }
            } finally {
                lock.unlock();
            }

            if (candidate == null) {
                return openNew();
            }
            if (factory.validate(candidate.handle())) {
                candidate.markHealthy(clock.instant());
                lock.lock();
                try {
                    active.add(candidate);
                } finally {
                    lock.unlock();
                }
                reused.incrementAndGet();
                return candidate;
            }
            logger.debug("Discarding unhealthy idle connection to {}", factory.describe());
            closeQuietly(candidate);
        }
    }

    @Override
    public void release(PooledConnection<C> connection) {
        boolean keep;
        lock.lock();
        try {
            if (!active.remove(connection)) {
                return;
            }
            keep = !closed && idle.size() < Math.max(1, settings.getMaxConnections() / 2);
            if (keep) {
                connection.markReleased(clock.instant());
                idle.addFirst(connection);
            }
        } finally {
            lock.unlock();
        }
        if (!keep) {
            closeQuietly(connection);
        }
    }

    @Override
    public void discard(PooledConnection<C> connection) {
        lock.lock();
        try {
            active.remove(connection);
            idle.remove(connection);
        } finally {
            lock.unlock();
        }
        closeQuietly(connection);
    }

    @Override
    public void cleanup() {
        Instant cutoff = clock.instant().minus(settings.getIdleTimeout());
        List<PooledConnection<C>> expired = new ArrayList<>();
        lock.lock();
        try {
            Iterator<PooledConnection<C>> it = idle.iterator();
            while (it.hasNext()) {
                PooledConnection<C> connection = it.next();
                if (connection.getLastReleasedAt().isBefore(cutoff)) {
                    it.remove();
                    expired.add(connection);
                }
            }
        } finally {
            lock.unlock();
        }
        expired.forEach(this::closeQuietly);
        if (!expired.isEmpty()) {
            logger.debug("Closed {} idle connections to {}", expired.size(), factory.describe());
        }
    }

    @Override
    public PoolStats stats() {
        lock.lock();
        try {
            return new PoolStats(factory.describe(), active.size(), idle.size(), settings.getMaxConnections(),
                    created.get(), reused.get(), discarded.get());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        List<PooledConnection<C>> all = new ArrayList<>();
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            all.addAll(idle);
            all.addAll(active);
            idle.clear();
            active.clear();
        } finally {
            lock.unlock();
        }
        all.forEach(this::closeQuietly);
        logger.debug("Closed connection pool for {}", factory.describe());
    }

    private PooledConnection<C> openNew() throws ConnectionUnavailableException {
        C handle = null;
        try {
            handle = connector.connect();
        } finally {
            lock.lock();
            try {
                pending--;
                if (handle != null) {
                    if (closed) {
                        factory.close(handle);
                        handle = null;
                    }
                }
            } finally {
                lock.unlock();
            }
        }
        if (handle == null) {
            throw new ConnectionUnavailableException("Connection pool for " + factory.describe() + " is closed");
        }
        PooledConnection<C> connection = new PooledConnection<>(handle, clock.instant());
        created.incrementAndGet();
        lock.lock();
        try {
            active.add(connection);
        } finally {
            lock.unlock();
        }
        return connection;
    }

    private void warmUp() {
        int toOpen;
        lock.lock();
        try {
            if (warmedUp || closed) {
                return;
            }
            warmedUp = true;
            toOpen = Math.min(settings.getMinConnections(), Math.max(1, settings.getMaxConnections() / 2));
            pending += toOpen;
        } finally {
            lock.unlock();
        }
        for (int i = 0; i < toOpen; i++) {
            C handle = null;
            try {
                handle = connector.connect();
            } catch (ConnectionUnavailableException e) {
                logger.debug("Pre-opening connection to {} failed: {}", factory.describe(), e.getMessage());
            }
            lock.lock();
            try {
                pending--;
                if (handle != null && !closed) {
                    idle.addFirst(new PooledConnection<>(handle, clock.instant()));
                    created.incrementAndGet();
                    handle = null;
                }
            } finally {
                lock.unlock();
            }
            if (handle != null) {
                factory.close(handle);
            }
        }
    }

    private void ensureOpen() throws ConnectionUnavailableException {
        if (closed) {
            throw new ConnectionUnavailableException("Connection pool for " + factory.describe() + " is closed");
        }
    }

    private void closeQuietly(PooledConnection<C> connection) {
        discarded.incrementAndGet();
        factory.close(connection.handle());
    }
}
