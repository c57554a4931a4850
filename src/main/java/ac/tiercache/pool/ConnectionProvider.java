package ac.tiercache.pool;

/**
 * Hands out backend handles. Callers must give every acquired handle back with
 * {@link #release(PooledConnection)} or {@link #discard(PooledConnection)};
 * {@link #execute(ConnectionCallback)} does that for them.
 */
public interface ConnectionProvider<C> extends AutoCloseable {

    PooledConnection<C> acquire() throws ConnectionUnavailableException;

    void release(PooledConnection<C> connection);

    /**
     * Returns a handle known to be broken; it is closed instead of reused.
     */
    void discard(PooledConnection<C> connection);

    /**
     * Closes idle handles that outlived the idle timeout.
     */
    void cleanup();

    PoolStats stats();

    @Override
    void close();

    default <T> T execute(ConnectionCallback<C, T> callback) throws Exception {
        PooledConnection<C> connection = acquire();
        try {
            return callback.doWith(connection.handle());
        } finally {
            release(connection);
        }
    }
}
