package ac.tiercache;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holder for the most recent failure message reported by any tier.
 * Shared between the engine and the tiers it owns.
 */
public final class LastError {
    private final AtomicReference<String> message = new AtomicReference<>();

    public void record(String error) {
        if (error != null && !error.isEmpty()) {
            message.set(error);
        }
    }

    public Optional<String> get() {
        return Optional.ofNullable(message.get());
    }

    public void clear() {
        message.set(null);
    }
}
