package ac.tiercache.pool;

import java.time.Clock;

public final class ConnectionProviders {

    private ConnectionProviders() {
    }

    public static <C> ConnectionProvider<C> create(ConnectionFactory<C> factory, PoolSettings settings,
                                                   boolean pooling, Clock clock) {
        return pooling
                ? new ConnectionPool<>(factory, settings, clock)
                : new DirectConnectionProvider<>(factory, settings, clock);
    }
}
