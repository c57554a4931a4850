package ac.tiercache;

/**
 * Raised when cache or tier settings cannot be applied.
 */
public class CacheConfigurationException extends IllegalArgumentException {

    public CacheConfigurationException(String message) {
        super(message);
    }

    public CacheConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
