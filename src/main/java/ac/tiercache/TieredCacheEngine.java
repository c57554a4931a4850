package ac.tiercache;

import ac.tiercache.async.AsyncTieredCache;
import ac.tiercache.envelope.EnvelopeCodec;
import ac.tiercache.envelope.FileLocks;
import ac.tiercache.envelope.PayloadCodec;
import ac.tiercache.pool.PoolStats;
import ac.tiercache.registry.CacheDirectoryProvisioner;
import ac.tiercache.registry.DefaultTierFactory;
import ac.tiercache.registry.TierAvailability;
import ac.tiercache.registry.TierFactory;
import ac.tiercache.registry.TierRegistry;
import ac.tiercache.stats.CacheStatistics;
import ac.tiercache.tier.CacheTier;
import ac.tiercache.tier.PooledTier;
import ac.tiercache.tier.TierContext;
import ac.tiercache.tier.TierResult;
import ac.tiercache.warming.CacheWarmingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Single logical cache over every available tier.
 *
 * <p>Reads walk the tiers fastest first and copy a hit into every faster tier. Writes go to
 * all tiers and succeed when at least one tier accepted them; deletes and clears succeed only
 * when every tier did. Tier failures never surface as exceptions: they are visible through
 * {@link #lastError()} and the return values.
 *
 * <p>Tiers are discovered lazily on the first operation and stay fixed for the lifetime of
 * the engine.
 */
public class TieredCacheEngine implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(TieredCacheEngine.class);

    private final CacheSettings settings;
    private final LastError lastError = new LastError();
    private final TierRegistry registry;
    private final CacheStatistics statistics = new CacheStatistics();
    private final AtomicReference<Tier> lastUsedTier = new AtomicReference<>();
    private final AsyncTieredCache async;
    private final CacheWarmingService warmer;

    public TieredCacheEngine(CacheSettings settings) {
        this(settings, new DefaultTierFactory());
    }

    public TieredCacheEngine(CacheSettings settings, TierFactory tierFactory) {
        this.settings = settings;
        TierContext context = new TierContext(
                settings.getClock(),
                lastError,
                settings.getPrefix(),
                new EnvelopeCodec(new PayloadCodec()),
                new FileLocks(),
                settings.isConnectionPooling());
        List<Path> fallbacks = settings.getFallbackCachePaths() != null
                ? settings.getFallbackCachePaths()
                : CacheDirectoryProvisioner.defaultFallbacks();
        this.registry = new TierRegistry(settings, tierFactory, context, new CacheDirectoryProvisioner(fallbacks));
        this.async = new AsyncTieredCache(this);
        this.warmer = new CacheWarmingService(this);
    }

    // ==================== READ PATH ====================

    public Optional<Object> get(String key) {
        validateKey(key);
        statistics.incrementRequests();
        List<CacheTier> tiers = registry.tiers();
        for (int rank = 0; rank < tiers.size(); rank++) {
            CacheTier tier = tiers.get(rank);
            TierResult<CacheEntry> result = tier.get(key);
            if (result.isHit()) {
                CacheEntry entry = result.value();
                statistics.recordTierHit(tier.tier());
                statistics.incrementHits();
                lastUsedTier.set(tier.tier());
                logger.debug("Hit for {} in tier {}", key, tier.tier());
                promote(key, entry, tiers.subList(0, rank));
                return Optional.of(entry.getPayload());
            }
            if (result.isFailure()) {
                statistics.recordTierError(tier.tier());
            } else {
                statistics.recordTierMiss(tier.tier());
            }
        }
        statistics.incrementMisses();
        logger.debug("Miss for {}", key);
        return Optional.empty();
    }

    /**
     * Typed lookup. A cached value of another type counts as a miss.
     */
    public <T> Optional<T> get(String key, Class<T> type) {
        Optional<Object> value = get(key);
        if (value.isPresent() && !type.isInstance(value.get())) {
            logger.debug("Cached value for {} is {}, not {}", key, value.get().getClass().getName(), type.getName());
            return Optional.empty();
        }
        return value.map(type::cast);
    }

    /**
     * Returns the cached value, or computes, caches and returns it on a miss.
     */
    public <T> T getOrCompute(String key, Class<T> type, Supplier<T> loader, long ttlSeconds) {
        Optional<T> cached = get(key, type);
        if (cached.isPresent()) {
            return cached.get();
        }
        T value = loader.get();
        if (!isEmptyValue(value)) {
            set(key, value, ttlSeconds);
        }
        return value;
    }

    private void promote(String key, CacheEntry entry, List<CacheTier> fasterTiers) {
        if (fasterTiers.isEmpty()) {
            return;
        }
        CacheEntry promoted = entry.hasExpiry()
                ? entry
                : CacheEntry.of(entry.getPayload(), settings.getPromotionTtlSeconds(), settings.getClock());
        for (CacheTier tier : fasterTiers) {
            TierResult<Void> result = tier.put(key, promoted);
            if (result.isSuccess()) {
                statistics.recordTierWrite(tier.tier());
            } else {
                statistics.recordTierError(tier.tier());
            }
        }
        statistics.incrementPromotions();
        logger.debug("Promoted {} into {} faster tiers", key, fasterTiers.size());
    }

    // ==================== WRITE PATH ====================

    public boolean set(String key, Object value) {
        return set(key, value, settings.getDefaultTtlSeconds());
    }

    public boolean set(String key, Object value, Duration ttl) {
        return set(key, value, ttl.getSeconds());
    }

    /**
     * Writes through to every available tier.
     *
     * @return true if at least one tier stored the value; false for empty values
     * @throws IllegalArgumentException if {@code ttlSeconds} is not positive
     */
    public boolean set(String key, Object value, long ttlSeconds) {
        validateKey(key);
        validateTtl(ttlSeconds);
        if (isEmptyValue(value)) {
            statistics.incrementRejectedSets();
            logger.debug("Rejected empty value for {}", key);
            return false;
        }
        CacheEntry entry = CacheEntry.of(value, ttlSeconds, settings.getClock());
        boolean stored = false;
        for (CacheTier tier : registry.tiers()) {
            TierResult<Void> result = tier.put(key, entry);
            if (result.isSuccess()) {
                statistics.recordTierWrite(tier.tier());
                if (!stored) {
                    lastUsedTier.set(tier.tier());
                    stored = true;
                }
            } else {
                statistics.recordTierError(tier.tier());
            }
        }
        if (stored) {
            statistics.incrementSets();
        }
        return stored;
    }

    /**
     * Removes a key from every tier. Absent keys count as removed.
     */
    public boolean delete(String key) {
        validateKey(key);
        boolean allRemoved = true;
        for (CacheTier tier : registry.tiers()) {
            if (!tier.delete(key).isSuccess()) {
                statistics.recordTierError(tier.tier());
                allRemoved = false;
            }
        }
        statistics.incrementDeletes();
        return allRemoved;
    }

    public boolean clear() {
        boolean allCleared = true;
        for (CacheTier tier : registry.tiers()) {
            if (!tier.clear().isSuccess()) {
                statistics.recordTierError(tier.tier());
                allCleared = false;
            }
        }
        logger.info("Cleared {} tiers{}", registry.tiers().size(), allCleared ? "" : " with failures");
        return allCleared;
    }

    /**
     * Removes expired entries from the tiers that keep them on disk or in shared memory, and
     * closes idle network connections.
     *
     * @return number of physical objects removed
     */
    public int cleanup() {
        int removed = 0;
        for (CacheTier tier : registry.tiers()) {
            removed += tier.cleanup();
        }
        if (removed > 0) {
            logger.debug("Cleanup removed {} expired entries", removed);
        }
        return removed;
    }

    // ==================== TIER-SPECIFIC OPERATIONS ====================

    public Optional<Object> getFromTier(String key, Tier tier) {
        validateKey(key);
        Optional<CacheTier> target = availableTier(tier);
        if (target.isEmpty()) {
            return Optional.empty();
        }
        TierResult<CacheEntry> result = target.get().get(key);
        if (result.isHit()) {
            statistics.recordTierHit(tier);
            lastUsedTier.set(tier);
            return Optional.of(result.value().getPayload());
        }
        if (result.isFailure()) {
            statistics.recordTierError(tier);
        } else {
            statistics.recordTierMiss(tier);
        }
        return Optional.empty();
    }

    public boolean setToTier(String key, Object value, long ttlSeconds, Tier tier) {
        validateKey(key);
        validateTtl(ttlSeconds);
        if (isEmptyValue(value)) {
            statistics.incrementRejectedSets();
            return false;
        }
        Optional<CacheTier> target = availableTier(tier);
        if (target.isEmpty()) {
            return false;
        }
        boolean stored = target.get().put(key, CacheEntry.of(value, ttlSeconds, settings.getClock())).isSuccess();
        if (stored) {
            statistics.recordTierWrite(tier);
            lastUsedTier.set(tier);
        } else {
            statistics.recordTierError(tier);
        }
        return stored;
    }

    public boolean deleteFromTier(String key, Tier tier) {
        validateKey(key);
        return availableTier(tier).map(t -> t.delete(key).isSuccess()).orElse(false);
    }

    /**
     * Writes to the given tiers only, reporting the outcome per tier.
     */
    public Map<Tier, Boolean> setToTiers(String key, Object value, long ttlSeconds, Collection<Tier> tiers) {
        Map<Tier, Boolean> results = new EnumMap<>(Tier.class);
        for (Tier tier : tiers) {
            results.put(tier, setToTier(key, value, ttlSeconds, tier));
        }
        return results;
    }

    public Map<Tier, Boolean> deleteFromTiers(String key, Collection<Tier> tiers) {
        Map<Tier, Boolean> results = new EnumMap<>(Tier.class);
        for (Tier tier : tiers) {
            results.put(tier, deleteFromTier(key, tier));
        }
        return results;
    }

    public Optional<Object> getWithTierPreference(String key, Tier preferred) {
        return getWithTierPreference(key, preferred, true);
    }

    /**
     * Reads from {@code preferred} first. On a miss there, or when it is unavailable, the normal
     * tier walk runs if {@code fallback} is set.
     */
    public Optional<Object> getWithTierPreference(String key, Tier preferred, boolean fallback) {
        validateKey(key);
        if (registry.find(preferred).isPresent()) {
            Optional<Object> value = getFromTier(key, preferred);
            if (value.isPresent()) {
                return value;
            }
        }
        return fallback ? get(key) : Optional.empty();
    }

    public boolean clearTier(Tier tier) {
        return availableTier(tier).map(t -> t.clear().isSuccess()).orElse(false);
    }

    private Optional<CacheTier> availableTier(Tier tier) {
        Optional<CacheTier> target = registry.find(tier);
        if (target.isEmpty()) {
            lastError.record("Tier not available: " + tier.id());
        }
        return target;
    }

    // ==================== INTROSPECTION ====================

    public List<Tier> availableTiers() {
        return registry.tiers().stream().map(CacheTier::tier).collect(Collectors.toList());
    }

    public Optional<Tier> lastUsedTier() {
        return Optional.ofNullable(lastUsedTier.get());
    }

    /**
     * Live health of every tier. Tiers that were never available report false.
     */
    public Map<Tier, Boolean> health() {
        Map<Tier, Boolean> health = new EnumMap<>(Tier.class);
        for (Tier tier : Tier.values()) {
            health.put(tier, false);
        }
        for (CacheTier tier : registry.tiers()) {
            health.put(tier.tier(), tier.isHealthy());
        }
        return health;
    }

    public Map<Tier, TierAvailability> availability() {
        registry.tiers();
        return registry.availability();
    }

    public Optional<String> lastError() {
        return lastError.get();
    }

    public CacheStatistics statistics() {
        return statistics;
    }

    public CacheStatistics.CacheStatisticsSnapshot stats() {
        return statistics.getSnapshot();
    }

    /**
     * Connection usage of the available network tiers.
     */
    public Map<Tier, PoolStats> poolStats() {
        Map<Tier, PoolStats> pools = new EnumMap<>(Tier.class);
        for (CacheTier tier : registry.tiers()) {
            if (tier instanceof PooledTier) {
                pools.put(tier.tier(), ((PooledTier) tier).poolStats());
            }
        }
        return pools;
    }

    // ==================== CONFIGURATION ====================

    public Path getCachePath() {
        return registry.getCachePath();
    }

    public boolean setCachePath(String path) {
        return setCachePath(Paths.get(path));
    }

    /**
     * Moves the filesystem tier to another directory. The directory is created if needed and
     * must end up writable.
     */
    public boolean setCachePath(Path path) {
        boolean moved = registry.relocateCachePath(path);
        if (moved) {
            logger.info("Cache path set to {}", path);
        }
        return moved;
    }

    /**
     * Applies options to a tier before first use.
     *
     * @return false once tiers have been discovered
     * @throws CacheConfigurationException if an option value has the wrong type
     */
    public boolean configureTier(Tier tier, Map<String, ?> options) {
        return registry.configure(tier, options);
    }

    public TierSettings tierSettings(Tier tier) {
        return registry.settingsFor(tier);
    }

    public CacheSettings settings() {
        return settings;
    }

    public AsyncTieredCache async() {
        return async;
    }

    public CacheWarmingService warmer() {
        return warmer;
    }

    @Override
    public void close() {
        registry.close();
        logger.debug("Cache engine closed: {}", statistics);
    }

    // ==================== VALIDATION ====================

    private static void validateKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Cache key must not be empty");
        }
    }

    private static void validateTtl(long ttlSeconds) {
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("TTL must be positive: " + ttlSeconds);
        }
    }

    /**
     * Values the cache refuses to store: null, empty text, empty collections, maps and arrays,
     * {@code false} and numeric zero.
     */
    static boolean isEmptyValue(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof CharSequence) {
            return ((CharSequence) value).length() == 0;
        }
        if (value instanceof Collection) {
            return ((Collection<?>) value).isEmpty();
        }
        if (value instanceof Map) {
            return ((Map<?, ?>) value).isEmpty();
        }
        if (value instanceof Optional) {
            return ((Optional<?>) value).isEmpty();
        }
        if (value.getClass().isArray()) {
            return Array.getLength(value) == 0;
        }
        if (value instanceof Boolean) {
            return !((Boolean) value);
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).signum() == 0;
        }
        if (value instanceof BigInteger) {
            return ((BigInteger) value).signum() == 0;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() == 0.0;
        }
        return false;
    }
}
