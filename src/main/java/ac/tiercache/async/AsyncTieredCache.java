package ac.tiercache.async;

import ac.tiercache.Tier;
import ac.tiercache.TieredCacheEngine;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Future-returning view of a {@link TieredCacheEngine}. With a scheduler the work is deferred
 * to it; without one every future is already complete when returned. An exception thrown by
 * the engine fails the future instead of reaching the caller.
 */
public class AsyncTieredCache {
    private final TieredCacheEngine engine;
    private volatile CacheScheduler scheduler;

    public AsyncTieredCache(TieredCacheEngine engine) {
        this.engine = engine;
    }

    public void enable(CacheScheduler scheduler) {
        this.scheduler = scheduler;
    }

    public void disable() {
        this.scheduler = null;
    }

    public boolean isDeferred() {
        return scheduler != null;
    }

    // ==================== SINGLE KEY ====================

    public CompletableFuture<Optional<Object>> getAsync(String key) {
        return submit(() -> engine.get(key));
    }

    public CompletableFuture<Boolean> setAsync(String key, Object value, long ttlSeconds) {
        return submit(() -> engine.set(key, value, ttlSeconds));
    }

    public CompletableFuture<Boolean> setAsync(String key, Object value) {
        return submit(() -> engine.set(key, value));
    }

    public CompletableFuture<Boolean> deleteAsync(String key) {
        return submit(() -> engine.delete(key));
    }

    // ==================== BATCH ====================

    /**
     * Looks up several keys. The map follows the order of {@code keys} and holds only hits.
     */
    public CompletableFuture<Map<String, Object>> getBatchAsync(List<String> keys) {
        List<CompletableFuture<Optional<Object>>> lookups = new ArrayList<>(keys.size());
        for (String key : keys) {
            lookups.add(getAsync(key));
        }
        return CacheFutures.all(lookups).thenApply(values -> {
            Map<String, Object> found = new LinkedHashMap<>();
            for (int i = 0; i < keys.size(); i++) {
                Optional<Object> value = values.get(i);
                if (value.isPresent()) {
                    found.put(keys.get(i), value.get());
                }
            }
            return found;
        });
    }

    public CompletableFuture<Map<String, Boolean>> setBatchAsync(Map<String, ?> values, long ttlSeconds) {
        List<String> keys = new ArrayList<>(values.keySet());
        List<CompletableFuture<Boolean>> writes = new ArrayList<>(keys.size());
        for (String key : keys) {
            writes.add(setAsync(key, values.get(key), ttlSeconds));
        }
        return CacheFutures.all(writes).thenApply(results -> zip(keys, results));
    }

    public CompletableFuture<Map<String, Boolean>> deleteBatchAsync(List<String> keys) {
        List<CompletableFuture<Boolean>> deletes = new ArrayList<>(keys.size());
        for (String key : keys) {
            deletes.add(deleteAsync(key));
        }
        return CacheFutures.all(deletes).thenApply(results -> zip(keys, results));
    }

    // ==================== TIER-SPECIFIC ====================

    public CompletableFuture<Optional<Object>> getFromTierAsync(String key, Tier tier) {
        return submit(() -> engine.getFromTier(key, tier));
    }

    public CompletableFuture<Boolean> setToTierAsync(String key, Object value, long ttlSeconds, Tier tier) {
        return submit(() -> engine.setToTier(key, value, ttlSeconds, tier));
    }

    public CompletableFuture<Boolean> deleteFromTierAsync(String key, Tier tier) {
        return submit(() -> engine.deleteFromTier(key, tier));
    }

    public CompletableFuture<Map<Tier, Boolean>> deleteFromTiersAsync(String key, Collection<Tier> tiers) {
        return submit(() -> engine.deleteFromTiers(key, tiers));
    }

    public CompletableFuture<Optional<Object>> getWithTierPreferenceAsync(String key, Tier preferred) {
        return submit(() -> engine.getWithTierPreference(key, preferred));
    }

    /**
     * Runs any engine operation through this wrapper's scheduling.
     */
    public <T> CompletableFuture<T> submit(Supplier<T> operation) {
        CompletableFuture<T> future = new CompletableFuture<>();
        Runnable task = () -> {
            try {
                future.complete(operation.get());
            } catch (Throwable e) {
                future.completeExceptionally(e);
            }
        };
        CacheScheduler current = scheduler;
        if (current == null) {
            task.run();
        } else {
            current.defer(task);
        }
        return future;
    }

    private static Map<String, Boolean> zip(List<String> keys, List<Boolean> results) {
        Map<String, Boolean> outcome = new LinkedHashMap<>();
        for (int i = 0; i < keys.size(); i++) {
            outcome.put(keys.get(i), results.get(i));
        }
        return outcome;
    }
}
