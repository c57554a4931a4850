package ac.tiercache.tier;

import ac.tiercache.pool.PoolStats;

/**
 * A tier that talks to its backend through a connection provider.
 */
public interface PooledTier {

    PoolStats poolStats();
}
