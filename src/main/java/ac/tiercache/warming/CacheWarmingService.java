package ac.tiercache.warming;

import ac.tiercache.TieredCacheEngine;
import ac.tiercache.async.CacheFutures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps the registered warmers of an engine, runs them and tracks how much each has loaded.
 */
public class CacheWarmingService {
    private static final Logger logger = LoggerFactory.getLogger(CacheWarmingService.class);

    private final TieredCacheEngine engine;
    private final Map<String, CacheWarmer> warmers = Collections.synchronizedMap(new LinkedHashMap<>());
    private final Map<String, WarmerStats> stats = new ConcurrentHashMap<>();

    public CacheWarmingService(TieredCacheEngine engine) {
        this.engine = engine;
    }

    // ==================== REGISTRATION ====================

    /**
     * Adds a warmer, replacing any warmer of the same name.
     */
    public CacheWarmingService register(CacheWarmer warmer) {
        warmers.put(warmer.name(), warmer);
        return this;
    }

    public CacheWarmingService remove(String name) {
        warmers.remove(name);
        return this;
    }

    public List<String> warmerNames() {
        synchronized (warmers) {
            return new ArrayList<>(warmers.keySet());
        }
    }

    // ==================== WARMING ====================

    /**
     * Runs every applicable warmer in registration order.
     */
    public Map<String, WarmingResult> warmAll() {
        Map<String, WarmingResult> results = new LinkedHashMap<>();
        for (CacheWarmer warmer : applicableWarmers()) {
            results.put(warmer.name(), run(warmer));
        }
        return results;
    }

    /**
     * Runs one warmer.
     *
     * @return empty if no warmer has that name or it has nothing to load
     */
    public Optional<WarmingResult> warmWith(String name) {
        CacheWarmer warmer = warmers.get(name);
        if (warmer == null) {
            logger.warn("Warmer '{}' not found", name);
            return Optional.empty();
        }
        if (!warmer.isApplicable()) {
            logger.debug("Warmer '{}' is not applicable", name);
            return Optional.empty();
        }
        return Optional.of(run(warmer));
    }

    /**
     * Runs every applicable warmer through the engine's async wrapper. The future fails with
     * the first warmer that throws.
     */
    public CompletableFuture<Map<String, WarmingResult>> warmAllAsync() {
        List<CacheWarmer> applicable = applicableWarmers();
        List<CompletableFuture<WarmingResult>> runs = new ArrayList<>(applicable.size());
        for (CacheWarmer warmer : applicable) {
            runs.add(engine.async().submit(() -> run(warmer)));
        }
        return CacheFutures.all(runs).thenApply(results -> {
            Map<String, WarmingResult> byName = new LinkedHashMap<>();
            for (WarmingResult result : results) {
                byName.put(result.getWarmer(), result);
            }
            return byName;
        });
    }

    private List<CacheWarmer> applicableWarmers() {
        List<CacheWarmer> applicable = new ArrayList<>();
        synchronized (warmers) {
            for (CacheWarmer warmer : warmers.values()) {
                if (warmer.isApplicable()) {
                    applicable.add(warmer);
                }
            }
        }
        return applicable;
    }

    private WarmingResult run(CacheWarmer warmer) {
        long start = System.nanoTime();
        int count = warmer.warm(engine);
        WarmingResult result = new WarmingResult(warmer.name(), count, Duration.ofNanos(System.nanoTime() - start));
        stats.merge(warmer.name(), WarmerStats.first(result, engine.settings().getClock().instant()),
                (previous, ignored) -> previous.plus(result, engine.settings().getClock().instant()));
        logger.info("Warmer '{}' loaded {} entries in {} ms", warmer.name(), count, result.getDuration().toMillis());
        return result;
    }

    // ==================== STATISTICS ====================

    public Optional<WarmerStats> stats(String name) {
        return Optional.ofNullable(stats.get(name));
    }

    public Map<String, WarmerStats> stats() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(stats));
    }

    public void resetStats() {
        stats.clear();
    }
}
