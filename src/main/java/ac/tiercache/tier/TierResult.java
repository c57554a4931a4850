package ac.tiercache.tier;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a single tier operation. A miss and a failure are different things: a miss is a
 * successful lookup that found nothing, a failure carries the reason the backend could not answer.
 */
public final class TierResult<T> {

    public enum Status {
        HIT,
        ABSENT,
        OK,
        FAILED
    }

    private static final TierResult<?> ABSENT = new TierResult<>(Status.ABSENT, null, null);
    private static final TierResult<?> OK = new TierResult<>(Status.OK, null, null);

    private final Status status;
    private final T value;
    private final String error;

    private TierResult(Status status, T value, String error) {
        this.status = status;
        this.value = value;
        this.error = error;
    }

    public static <T> TierResult<T> hit(T value) {
        return new TierResult<>(Status.HIT, Objects.requireNonNull(value, "value"), null);
    }

    @SuppressWarnings("unchecked")
    public static <T> TierResult<T> absent() {
        return (TierResult<T>) ABSENT;
    }

    @SuppressWarnings("unchecked")
    public static <T> TierResult<T> ok() {
        return (TierResult<T>) OK;
    }

    public static <T> TierResult<T> failed(String error) {
        return new TierResult<>(Status.FAILED, null, error != null ? error : "unknown error");
    }

    public Status status() { return status; }
    public boolean isHit() { return status == Status.HIT; }
    public boolean isFailure() { return status == Status.FAILED; }
    public boolean isSuccess() { return status != Status.FAILED; }

    public T value() {
        if (status != Status.HIT) {
            throw new IllegalStateException("No value for result " + status);
        }
        return value;
    }

    public Optional<T> toOptional() {
        return Optional.ofNullable(value);
    }

    public Optional<String> error() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return error != null ? "TierResult{" + status + ", error=" + error + "}" : "TierResult{" + status + "}";
    }
}
