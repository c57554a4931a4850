package ac.tiercache.pool;

/**
 * No handle could be obtained for a backend: the pool is exhausted or connecting failed.
 */
public class ConnectionUnavailableException extends Exception {

    public ConnectionUnavailableException(String message) {
        super(message);
    }

    public ConnectionUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
