package ac.tiercache.tier;

import ac.tiercache.CacheEntry;
import ac.tiercache.Tier;

/**
 * Uniform contract every storage backend implements. Implementations never throw from these
 * methods; backend errors come back as {@link TierResult#failed(String)}.
 */
public interface CacheTier extends AutoCloseable {

    Tier tier();

    /**
     * Checks whether the backend is usable right now, normally with a canary round trip.
     */
    boolean probe();

    TierResult<CacheEntry> get(String key);

    TierResult<Void> put(String key, CacheEntry entry);

    /**
     * Removes a key. Deleting a key that does not exist is a success.
     */
    TierResult<Void> delete(String key);

    TierResult<Void> clear();

    /**
     * Removes expired entries and returns how many physical objects were removed.
     */
    int cleanup();

    boolean isHealthy();

    @Override
    void close();
}
