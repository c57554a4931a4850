package ac.tiercache.tier;

import ac.tiercache.CacheEntry;
import ac.tiercache.Tier;
import ac.tiercache.TierSettings;
import ac.tiercache.pool.ConnectionProvider;
import ac.tiercache.pool.ConnectionProviders;
import ac.tiercache.pool.PoolSettings;
import ac.tiercache.pool.PoolStats;
import org.redisson.api.BatchOptions;
import org.redisson.api.RBatch;
import org.redisson.api.RBucket;
import org.redisson.api.RBucketAsync;
import org.redisson.api.RedissonClient;
import org.redisson.api.redisnode.RedisNodes;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Redis-backed tier. Keys are namespaced with the prefix; entries carry their own expiry and
 * Redis is also told the remaining lifetime so it can evict them itself.
 */
public class RedisTier extends AbstractCacheTier implements PooledTier {
    private final ConnectionProvider<RedissonClient> connections;

    public RedisTier(TierSettings settings, TierContext context) {
        this(settings, context, ConnectionProviders.create(new RedisConnectionFactory(settings),
                PoolSettings.from(settings), context.isConnectionPooling(), context.getClock()));
    }

    RedisTier(TierSettings settings, TierContext context, ConnectionProvider<RedissonClient> connections) {
        super(Tier.NETWORK_KV_STORE, settings, context);
        this.connections = connections;
    }

    @Override
    public PoolStats poolStats() {
        return connections.stats();
    }

    // ==================== SINGLE KEY OPERATIONS ====================

    @Override
    protected Optional<CacheEntry> read(String key) throws Exception {
        return connections.execute(client -> {
            RBucket<CacheEntry> bucket = client.getBucket(prefixed(key));
            return Optional.ofNullable(bucket.get());
        });
    }

    @Override
    protected boolean write(String key, CacheEntry entry) throws Exception {
        return connections.execute(client -> {
            RBucket<CacheEntry> bucket = client.getBucket(prefixed(key));
            if (entry.hasExpiry()) {
                bucket.set(entry, ttlSeconds(entry), TimeUnit.SECONDS);
            } else {
                bucket.set(entry);
            }
            return true;
        });
    }

    @Override
    protected void remove(String key) throws Exception {
        connections.execute(client -> client.getBucket(prefixed(key)).delete());
    }

    /**
     * Removes this cache's keys. With an empty prefix the whole logical database is flushed.
     */
    @Override
    protected void removeAll() throws Exception {
        String prefix = prefixed("");
        connections.execute(client -> {
            if (prefix.isEmpty()) {
                client.getKeys().flushdb();
            } else {
                long deleted = client.getKeys().deleteByPattern(prefix + "*");
                logger.debug("Deleted {} Redis keys matching {}*", deleted, prefix);
            }
            return null;
        });
    }

    @Override
    protected int sweepExpired() {
        connections.cleanup();
        return 0;
    }

    @Override
    public boolean isHealthy() {
        try {
            return connections.execute(client -> client.getRedisNodes(RedisNodes.SINGLE).pingAll());
        } catch (Exception e) {
            logger.debug("Redis health check failed: {}", describe(e));
            return false;
        }
    }

    // ==================== MULTI KEY OPERATIONS ====================

    /**
     * Fetches several keys in one round trip. The result follows the order of {@code keys} and
     * only holds live entries.
     */
    public Map<String, CacheEntry> getMany(List<String> keys) throws Exception {
        Map<String, CacheEntry> result = new LinkedHashMap<>();
        if (keys.isEmpty()) {
            return result;
        }
        String[] names = keys.stream().map(this::prefixed).toArray(String[]::new);
        Map<String, CacheEntry> found = connections.execute(client -> client.getBuckets().get(names));
        for (String key : keys) {
            CacheEntry entry = found.get(prefixed(key));
            if (entry != null && !entry.isExpired(context.getClock())) {
                result.put(key, entry);
            }
        }
        return result;
    }

    /**
     * Writes several entries in a single pipelined batch.
     */
    public void putMany(Map<String, CacheEntry> entries) throws Exception {
        if (entries.isEmpty()) {
            return;
        }
        connections.execute(client -> {
            RBatch batch = client.createBatch(BatchOptions.defaults());
            for (Map.Entry<String, CacheEntry> e : entries.entrySet()) {
                RBucketAsync<CacheEntry> bucket = batch.getBucket(prefixed(e.getKey()));
                if (e.getValue().hasExpiry()) {
                    bucket.setAsync(e.getValue(), ttlSeconds(e.getValue()), TimeUnit.SECONDS);
                } else {
                    bucket.setAsync(e.getValue());
                }
            }
            batch.execute();
            return null;
        });
    }

    public long deleteMany(List<String> keys) throws Exception {
        if (keys.isEmpty()) {
            return 0;
        }
        String[] names = keys.stream().map(this::prefixed).toArray(String[]::new);
        return connections.execute(client -> client.getKeys().delete(names));
    }

    @Override
    public void close() {
        connections.close();
    }

    private long ttlSeconds(CacheEntry entry) {
        return Math.max(1L, entry.remainingSeconds(context.getClock()));
    }
}
