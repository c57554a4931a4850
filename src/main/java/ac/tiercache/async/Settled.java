package ac.tiercache.async;

import java.util.Optional;

/**
 * Outcome of one future in {@link CacheFutures#allSettled(java.util.List)}.
 */
public final class Settled<T> {

    public enum Status {
        FULFILLED,
        REJECTED
    }

    private final Status status;
    private final T value;
    private final Throwable error;

    private Settled(Status status, T value, Throwable error) {
        this.status = status;
        this.value = value;
        this.error = error;
    }

    static <T> Settled<T> fulfilled(T value) {
        return new Settled<>(Status.FULFILLED, value, null);
    }

    static <T> Settled<T> rejected(Throwable error) {
        return new Settled<>(Status.REJECTED, null, error);
    }

    public Status getStatus() { return status; }
    public boolean isFulfilled() { return status == Status.FULFILLED; }
    public T getValue() { return value; }
    public Optional<Throwable> getError() { return Optional.ofNullable(error); }
}
