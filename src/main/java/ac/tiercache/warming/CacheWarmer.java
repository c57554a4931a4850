package ac.tiercache.warming;

import ac.tiercache.TieredCacheEngine;

/**
 * Source of values loaded into the cache ahead of demand.
 */
public interface CacheWarmer {

    String name();

    /**
     * False when the warmer has nothing to load, for example an empty entry list.
     */
    boolean isApplicable();

    /**
     * Loads this warmer's entries into the engine.
     *
     * @return number of entries stored
     */
    int warm(TieredCacheEngine engine);
}
