package ac.tiercache.tier;

import ac.tiercache.CacheEntry;
import ac.tiercache.Tier;
import ac.tiercache.TierSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Base class for tiers. Subclasses implement the raw storage primitives and may throw freely;
 * this class applies the expiry rule, turns exceptions into failed results and records them
 * in the shared {@link ac.tiercache.LastError}.
 */
public abstract class AbstractCacheTier implements CacheTier {
    protected final Logger logger = LoggerFactory.getLogger(getClass());

    static final String PROBE_KEY_PREFIX = "__tiercache_probe_";
    private static final long PROBE_TTL_SECONDS = 60L;

    private final Tier tier;
    protected final TierSettings settings;
    protected final TierContext context;
    private final AtomicInteger expiredOnRead = new AtomicInteger();

    protected AbstractCacheTier(Tier tier, TierSettings settings, TierContext context) {
        this.tier = tier;
        this.settings = settings;
        this.context = context;
    }

    // ==================== STORAGE PRIMITIVES ====================

    /**
     * Reads the stored entry, expired or not. Returns empty when nothing is stored under the key.
     */
    protected abstract Optional<CacheEntry> read(String key) throws Exception;

    /**
     * Stores an entry, returning {@code false} when the backend refused it.
     */
    protected abstract boolean write(String key, CacheEntry entry) throws Exception;

    protected abstract void remove(String key) throws Exception;

    protected abstract void removeAll() throws Exception;

    /**
     * Scans stored objects and removes the expired ones. Tiers whose backend expires entries
     * on its own keep the default.
     */
    protected int sweepExpired() throws Exception {
        return 0;
    }

    /**
     * Prepares the backend before the first probe, e.g. creating a directory or schema.
     */
    protected boolean prepare() throws Exception {
        return true;
    }

    // ==================== CONTRACT ====================

    @Override
    public Tier tier() {
        return tier;
    }

    @Override
    public boolean probe() {
        String key = PROBE_KEY_PREFIX + UUID.randomUUID();
        String token = "probe_" + System.nanoTime();
        try {
            if (!prepare()) {
                logger.info("Tier {} unavailable: backend not ready", tier);
                return false;
            }
            if (!write(key, new CacheEntry(token, context.now() + PROBE_TTL_SECONDS))) {
                logger.info("Tier {} unavailable: probe write rejected", tier);
                return false;
            }
            Optional<CacheEntry> readBack = read(key);
            remove(key);
            boolean matches = readBack.isPresent() && token.equals(readBack.get().getPayload());
            if (!matches) {
                logger.info("Tier {} unavailable: probe value did not round-trip", tier);
            }
            return matches;
        } catch (Exception e) {
            restoreInterrupt(e);
            logger.info("Tier {} unavailable: {}", tier, describe(e));
            return false;
        }
    }

    @Override
    public final TierResult<CacheEntry> get(String key) {
        try {
            Optional<CacheEntry> stored = read(key);
            if (stored.isEmpty()) {
                return TierResult.absent();
            }
            if (stored.get().isExpired(context.getClock())) {
                discardExpired(key);
                return TierResult.absent();
            }
            return TierResult.hit(stored.get());
        } catch (CorruptEntryException e) {
            logger.warn("Discarding unreadable {} entry for key {}: {}", tier, key, e.getMessage());
            discardQuietly(key);
            return TierResult.absent();
        } catch (Exception e) {
            return failure("get", key, e);
        }
    }

    @Override
    public final TierResult<Void> put(String key, CacheEntry entry) {
        try {
            if (write(key, entry)) {
                return TierResult.ok();
            }
            return recordFailure(tier.id() + " rejected write for key '" + key + "'");
        } catch (Exception e) {
            return failure("put", key, e);
        }
    }

    @Override
    public final TierResult<Void> delete(String key) {
        try {
            remove(key);
            return TierResult.ok();
        } catch (Exception e) {
            return failure("delete", key, e);
        }
    }

    @Override
    public final TierResult<Void> clear() {
        try {
            removeAll();
            return TierResult.ok();
        } catch (Exception e) {
            return failure("clear", null, e);
        }
    }

    @Override
    public final int cleanup() {
        int removed = 0;
        try {
            removed = sweepExpired();
        } catch (Exception e) {
            failure("cleanup", null, e);
        }
        return removed + expiredOnRead.getAndSet(0);
    }

    @Override
    public boolean isHealthy() {
        return probe();
    }

    @Override
    public void close() {
    }

    // ==================== HELPERS ====================

    /**
     * Key as stored in shared namespaces: the tier's own prefix if it has one, else the engine prefix.
     */
    protected String prefixed(String key) {
        String prefix = settings.getPrefix() != null ? settings.getPrefix() : context.getKeyPrefix();
        return prefix + key;
    }

    /**
     * Entry holding a private copy of the payload, for tiers that keep objects on the heap.
     */
    protected CacheEntry detached(CacheEntry entry) throws CorruptEntryException {
        Object copy = context.getCodec().payloadCodec().copy(entry.getPayload());
        return copy == entry.getPayload() ? entry : new CacheEntry(copy, entry.getExpiresAt());
    }

    protected <T> TierResult<T> failure(String operation, String key, Exception e) {
        restoreInterrupt(e);
        String target = key != null ? " for key '" + key + "'" : "";
        logger.debug("{} {} failed{}", tier, operation, target, e);
        return recordFailure(tier.id() + " " + operation + " failed" + target + ": " + describe(e));
    }

    protected <T> TierResult<T> recordFailure(String message) {
        logger.warn(message);
        context.getLastError().record(message);
        return TierResult.failed(message);
    }

    /**
     * True for the canary keys written by {@link #probe()}.
     */
    protected static boolean isProbeKey(String key) {
        return key.startsWith(PROBE_KEY_PREFIX);
    }

    /**
     * Only tiers whose sweep would have found the entry count an expiry removed on read, so one
     * expired object is counted once whether a read or the sweep removes it. Memory and network
     * tiers expire entries on their own and never contribute to the count.
     */
    private boolean countsExpiredReads() {
        return tier.kind() == Tier.Kind.BYTES || tier.kind() == Tier.Kind.RELATIONAL;
    }

    private void discardExpired(String key) {
        try {
            remove(key);
            if (countsExpiredReads()) {
                expiredOnRead.incrementAndGet();
            }
        } catch (Exception e) {
            restoreInterrupt(e);
            logger.warn("Failed to remove expired {} entry for key {}: {}", tier, key, describe(e));
        }
    }

    private void discardQuietly(String key) {
        try {
            remove(key);
        } catch (Exception e) {
            restoreInterrupt(e);
            logger.warn("Failed to remove unreadable {} entry for key {}: {}", tier, key, describe(e));
        }
    }

    protected static String describe(Throwable e) {
        String message = e.getMessage();
        return message != null ? message : e.getClass().getSimpleName();
    }

    private static void restoreInterrupt(Exception e) {
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
    }
}
