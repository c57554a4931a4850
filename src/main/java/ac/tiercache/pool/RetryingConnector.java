package ac.tiercache.pool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Opens a handle with a bounded number of attempts and a fixed delay between them. A handle
 * only counts once it passes the factory's health check.
 */
final class RetryingConnector<C> {
    private static final Logger logger = LoggerFactory.getLogger(RetryingConnector.class);

    private final ConnectionFactory<C> factory;
    private final int attempts;
    private final Duration delay;

    RetryingConnector(ConnectionFactory<C> factory, int attempts, Duration delay) {
        this.factory = factory;
        this.attempts = Math.max(1, attempts);
        this.delay = delay;
    }

    C connect() throws ConnectionUnavailableException {
        Exception lastFailure = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            C handle = null;
            try {
                handle = factory.create();
                if (factory.validate(handle)) {
                    return handle;
                }
                logger.debug("Connection to {} failed health check (attempt {}/{})", factory.describe(), attempt, attempts);
                factory.close(handle);
            } catch (Exception e) {
                lastFailure = e;
                logger.debug("Connection to {} failed (attempt {}/{}): {}", factory.describe(), attempt, attempts, e.getMessage());
                if (handle != null) {
                    factory.close(handle);
                }
            }
            if (attempt < attempts && !delay.isZero()) {
                try {
                    Thread.sleep(delay.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new ConnectionUnavailableException("Interrupted while connecting to " + factory.describe(), e);
                }
            }
        }
        String message = "Unable to connect to " + factory.describe() + " after " + attempts + " attempts";
        throw lastFailure != null
                ? new ConnectionUnavailableException(message + ": " + lastFailure.getMessage(), lastFailure)
                : new ConnectionUnavailableException(message);
    }
}
