package ac.tiercache.tier;

import java.io.IOException;

/**
 * Stored bytes that cannot be decoded. The owning tier treats the key as a miss and removes
 * the object.
 */
public class CorruptEntryException extends IOException {

    public CorruptEntryException(String message) {
        super(message);
    }

    public CorruptEntryException(String message, Throwable cause) {
        super(message, cause);
    }
}
