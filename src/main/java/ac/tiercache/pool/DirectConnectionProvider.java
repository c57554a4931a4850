package ac.tiercache.pool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Non-pooled mode: one handle shared by all callers, re-established when it fails its health
 * check. A non-persistent provider closes the handle again once the operation is done.
 */
public class DirectConnectionProvider<C> implements ConnectionProvider<C> {
    private static final Logger logger = LoggerFactory.getLogger(DirectConnectionProvider.class);

    private final ConnectionFactory<C> factory;
    private final RetryingConnector<C> connector;
    private final Clock clock;
    private final boolean persistent;

    private PooledConnection<C> current;
    private boolean closed;

    private final AtomicLong created = new AtomicLong();
    private final AtomicLong reused = new AtomicLong();
    private final AtomicLong discarded = new AtomicLong();

    public DirectConnectionProvider(ConnectionFactory<C> factory, PoolSettings settings, Clock clock) {
        this.factory = factory;
        this.clock = clock;
        this.persistent = settings.isPersistent();
        this.connector = new RetryingConnector<>(factory, settings.getRetryAttempts(), settings.getRetryDelay());
    }

    @Override
    public synchronized PooledConnection<C> acquire() throws ConnectionUnavailableException {
        if (closed) {
            throw new ConnectionUnavailableException("Connection to " + factory.describe() + " is closed");
        }
        if (!persistent) {
            PooledConnection<C> oneShot = new PooledConnection<>(connector.connect(), clock.instant());
            created.incrementAndGet();
            return oneShot;
        }
        if (current != null) {
            if (factory.validate(current.handle())) {
                current.markHealthy(clock.instant());
                reused.incrementAndGet();
                return current;
            }
            logger.info("Connection to {} failed health check, reconnecting", factory.describe());
            dispose(current);
            current = null;
        }
        current = new PooledConnection<>(connector.connect(), clock.instant());
        created.incrementAndGet();
        return current;
    }

    @Override
    public void release(PooledConnection<C> connection) {
        connection.markReleased(clock.instant());
        if (!persistent) {
            dispose(connection);
        }
    }

    @Override
    public synchronized void discard(PooledConnection<C> connection) {
        if (connection == current) {
            current = null;
        }
        dispose(connection);
    }

    @Override
    public void cleanup() {
    }

    @Override
    public synchronized PoolStats stats() {
        return new PoolStats(factory.describe(), current != null ? 1 : 0, 0, 1,
                created.get(), reused.get(), discarded.get());
    }

    @Override
    public synchronized void close() {
        closed = true;
        if (current != null) {
            dispose(current);
            current = null;
        }
    }

    private void dispose(PooledConnection<C> connection) {
        discarded.incrementAndGet();
        factory.close(connection.handle());
    }
}
