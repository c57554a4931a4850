package ac.tiercache.tier;

import ac.tiercache.CacheEntry;
import ac.tiercache.Tier;
import ac.tiercache.TierSettings;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * In-process cache backed by Caffeine. Each entry carries its own lifetime into Caffeine's
 * variable expiry; the read path still checks the entry against the engine clock. Payloads are
 * copied on write and on read, so mutating a value after {@code set} or after {@code get}
 * does not change what the cache holds.
 */
public class LocalCacheTier extends AbstractCacheTier {
    private final Cache<String, CacheEntry> cache;

    public LocalCacheTier(TierSettings settings, TierContext context) {
        super(Tier.LOCAL_PROCESS_CACHE, settings, context);
        this.cache = Caffeine.newBuilder()
                .maximumSize(settings.getMaxEntries())
                .expireAfter(new EntryExpiry())
                .recordStats()
                .build();
    }

    long estimatedSize() {
        return cache.estimatedSize();
    }

    @Override
    protected Optional<CacheEntry> read(String key) throws CorruptEntryException {
        CacheEntry entry = cache.getIfPresent(key);
        return entry == null ? Optional.empty() : Optional.of(detached(entry));
    }

    @Override
    protected boolean write(String key, CacheEntry entry) throws CorruptEntryException {
        cache.put(key, detached(entry));
        return true;
    }

    @Override
    protected void remove(String key) {
        cache.invalidate(key);
    }

    @Override
    protected void removeAll() {
        cache.invalidateAll();
    }

    /**
     * A canary write could push a live entry out of a full cache, so health is not probed.
     */
    @Override
    public boolean isHealthy() {
        return true;
    }

    @Override
    protected int sweepExpired() {
        cache.cleanUp();
        return 0;
    }

    @Override
    public void close() {
        logger.debug("Local cache stats at close: {}", cache.stats());
        cache.invalidateAll();
    }

    private final class EntryExpiry implements Expiry<String, CacheEntry> {
        @Override
        public long expireAfterCreate(String key, CacheEntry value, long currentTime) {
            return lifetime(value);
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry value, long currentTime, long currentDuration) {
            return lifetime(value);
        }

        @Override
        public long expireAfterRead(String key, CacheEntry value, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private long lifetime(CacheEntry value) {
            long seconds = value.remainingSeconds(context.getClock());
            if (seconds >= TimeUnit.NANOSECONDS.toSeconds(Long.MAX_VALUE)) {
                return Long.MAX_VALUE;
            }
            return TimeUnit.SECONDS.toNanos(seconds);
        }
    }
}
