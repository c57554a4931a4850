package ac.tiercache.pool;

/**
 * Creates, checks and disposes of backend handles for one network tier.
 */
public interface ConnectionFactory<C> {

    C create() throws Exception;

    /**
     * Health check, e.g. a ping. Must not throw.
     */
    boolean validate(C connection);

    void close(C connection);

    /**
     * Short label used in log messages.
     */
    String describe();
}
