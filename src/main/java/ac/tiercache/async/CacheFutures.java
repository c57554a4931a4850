package ac.tiercache.async;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Combinators over {@link CompletableFuture}s.
 */
public final class CacheFutures {

    private CacheFutures() {
    }

    /**
     * Completes with every value in input order, or fails with the first failure observed.
     */
    public static <T> CompletableFuture<List<T>> all(List<? extends CompletableFuture<? extends T>> futures) {
        CompletableFuture<List<T>> result = new CompletableFuture<>();
        if (futures.isEmpty()) {
            result.complete(Collections.emptyList());
            return result;
        }
        Object[] values = new Object[futures.size()];
        AtomicInteger remaining = new AtomicInteger(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            int index = i;
            futures.get(i).whenComplete((value, error) -> {
                if (error != null) {
                    result.completeExceptionally(unwrap(error));
                    return;
                }
                values[index] = value;
                if (remaining.decrementAndGet() == 0) {
                    result.complete(toList(values));
                }
            });
        }
        return result;
    }

    /**
     * Waits for every future and reports each outcome in input order. Never fails.
     */
    public static <T> CompletableFuture<List<Settled<T>>> allSettled(List<? extends CompletableFuture<? extends T>> futures) {
        List<CompletableFuture<Settled<T>>> settled = new ArrayList<>(futures.size());
        for (CompletableFuture<? extends T> future : futures) {
            settled.add(future.handle((value, error) -> error == null
                    ? Settled.<T>fulfilled(value)
                    : Settled.<T>rejected(unwrap(error))));
        }
        return all(settled);
    }

    /**
     * Settles like whichever future settles first.
     */
    public static <T> CompletableFuture<T> race(List<? extends CompletableFuture<? extends T>> futures) {
        CompletableFuture<T> result = new CompletableFuture<>();
        if (futures.isEmpty()) {
            result.completeExceptionally(new IllegalArgumentException("No futures to race"));
            return result;
        }
        for (CompletableFuture<? extends T> future : futures) {
            future.whenComplete((value, error) -> {
                if (error != null) {
                    result.completeExceptionally(unwrap(error));
                } else {
                    result.complete(value);
                }
            });
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    private static <T> List<T> toList(Object[] values) {
        List<T> list = new ArrayList<>(values.length);
        for (Object value : values) {
            list.add((T) value);
        }
        return Collections.unmodifiableList(list);
    }

    static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
