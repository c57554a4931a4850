package ac.tiercache.tier;

import ac.tiercache.CacheEntry;
import ac.tiercache.Tier;
import ac.tiercache.TierSettings;
import ac.tiercache.envelope.KeyHasher;
import ac.tiercache.pool.ConnectionProvider;
import ac.tiercache.pool.ConnectionProviders;
import ac.tiercache.pool.PoolSettings;
import ac.tiercache.pool.PoolStats;
import net.spy.memcached.MemcachedClient;
import net.spy.memcached.internal.OperationFuture;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Memcached-backed tier. Values are stored as binary envelopes; memcached's own expiry is set
 * from the entry so the server evicts them too.
 */
public class MemcachedTier extends AbstractCacheTier implements PooledTier {
    static final int MAX_KEY_LENGTH = 250;
    static final long RELATIVE_EXPIRY_LIMIT = 60L * 60 * 24 * 30;

    private final ConnectionProvider<MemcachedClient> connections;

    public MemcachedTier(TierSettings settings, TierContext context) {
        this(settings, context, ConnectionProviders.create(new MemcachedConnectionFactory(settings),
                PoolSettings.from(settings), context.isConnectionPooling(), context.getClock()));
    }

    MemcachedTier(TierSettings settings, TierContext context, ConnectionProvider<MemcachedClient> connections) {
        super(Tier.NETWORK_CACHE_CLUSTER, settings, context);
        this.connections = connections;
    }

    @Override
    public PoolStats poolStats() {
        return connections.stats();
    }

    /**
     * Memcached keys cannot exceed 250 bytes or contain whitespace; such keys are hashed.
     */
    String storageKey(String key) {
        String candidate = prefixed(key);
        if (candidate.length() <= MAX_KEY_LENGTH && candidate.chars().noneMatch(c -> c <= ' ' || c == 0x7f)) {
            return candidate;
        }
        return prefixed(KeyHasher.fileName(key));
    }

    int expiration(CacheEntry entry) {
        if (!entry.hasExpiry()) {
            return 0;
        }
        long remaining = Math.max(1L, entry.remainingSeconds(context.getClock()));
        return (int) (remaining <= RELATIVE_EXPIRY_LIMIT ? remaining : Math.min(Integer.MAX_VALUE, entry.getExpiresAt()));
    }

    @Override
    protected Optional<CacheEntry> read(String key) throws Exception {
        Object stored = connections.execute(client -> client.get(storageKey(key)));
        if (stored == null) {
            return Optional.empty();
        }
        if (!(stored instanceof byte[])) {
            throw new CorruptEntryException("Unexpected memcached value type " + stored.getClass().getName());
        }
        return context.getCodec().decodeBinary(ByteBuffer.wrap((byte[]) stored), KeyHasher.keyTag(prefixed(key)));
    }

    @Override
    protected boolean write(String key, CacheEntry entry) throws Exception {
        byte[] envelope = context.getCodec().encodeBinary(entry, KeyHasher.keyTag(prefixed(key)));
        Boolean stored = connections.execute(client -> client.set(storageKey(key), expiration(entry), envelope)
                .get(operationTimeout(), TimeUnit.MILLISECONDS));
        return Boolean.TRUE.equals(stored);
    }

    @Override
    protected void remove(String key) throws Exception {
        connections.execute(client -> client.delete(storageKey(key)).get(operationTimeout(), TimeUnit.MILLISECONDS));
    }

    /**
     * Memcached has no prefix scan, so clearing flushes the whole server.
     */
    @Override
    protected void removeAll() throws Exception {
        Boolean flushed = connections.execute(client -> client.flush().get(operationTimeout(), TimeUnit.MILLISECONDS));
        if (!Boolean.TRUE.equals(flushed)) {
            throw new IllegalStateException("memcached flush was not acknowledged");
        }
    }

    @Override
    protected int sweepExpired() {
        connections.cleanup();
        return 0;
    }

    @Override
    public boolean isHealthy() {
        try {
            return connections.execute(client -> client.getStats().values().stream().anyMatch(s -> !s.isEmpty()));
        } catch (Exception e) {
            logger.debug("Memcached health check failed: {}", describe(e));
            return false;
        }
    }

    // ==================== MULTI KEY OPERATIONS ====================

    /**
     * Fetches several keys with one bulk get. The result follows the order of {@code keys} and
     * only holds live entries whose key tag matches.
     */
    public Map<String, CacheEntry> getMany(List<String> keys) throws Exception {
        Map<String, CacheEntry> result = new LinkedHashMap<>();
        if (keys.isEmpty()) {
            return result;
        }
        List<String> names = storageKeys(keys);
        Map<String, Object> found = connections.execute(client -> client.getBulk(names));
        for (String key : keys) {
            Object stored = found.get(storageKey(key));
            if (!(stored instanceof byte[])) {
                continue;
            }
            try {
                Optional<CacheEntry> entry = context.getCodec()
                        .decodeBinary(ByteBuffer.wrap((byte[]) stored), KeyHasher.keyTag(prefixed(key)));
                if (entry.isPresent() && !entry.get().isExpired(context.getClock())) {
                    result.put(key, entry.get());
                }
            } catch (CorruptEntryException e) {
                logger.debug("Skipping unreadable memcached entry for key {}: {}", key, e.getMessage());
            }
        }
        return result;
    }

    /**
     * Issues every write before waiting on any of them. Fails if the server refused one.
     */
    public void putMany(Map<String, CacheEntry> entries) throws Exception {
        if (entries.isEmpty()) {
            return;
        }
        List<String> refused = new ArrayList<>();
        connections.execute(client -> {
            Map<String, OperationFuture<Boolean>> pending = new LinkedHashMap<>();
            for (Map.Entry<String, CacheEntry> e : entries.entrySet()) {
                byte[] envelope = context.getCodec().encodeBinary(e.getValue(), KeyHasher.keyTag(prefixed(e.getKey())));
                pending.put(e.getKey(), client.set(storageKey(e.getKey()), expiration(e.getValue()), envelope));
            }
            for (Map.Entry<String, OperationFuture<Boolean>> e : pending.entrySet()) {
                if (!Boolean.TRUE.equals(e.getValue().get(operationTimeout(), TimeUnit.MILLISECONDS))) {
                    refused.add(e.getKey());
                }
            }
            return null;
        });
        if (!refused.isEmpty()) {
            throw new IllegalStateException("memcached refused writes for keys " + refused);
        }
    }

    /**
     * @return number of keys the server reported as deleted
     */
    public long deleteMany(List<String> keys) throws Exception {
        if (keys.isEmpty()) {
            return 0;
        }
        return connections.execute(client -> {
            List<OperationFuture<Boolean>> pending = new ArrayList<>();
            for (String name : storageKeys(keys)) {
                pending.add(client.delete(name));
            }
            long deleted = 0;
            for (OperationFuture<Boolean> future : pending) {
                if (Boolean.TRUE.equals(future.get(operationTimeout(), TimeUnit.MILLISECONDS))) {
                    deleted++;
                }
            }
            return deleted;
        });
    }

    @Override
    public void close() {
        connections.close();
    }

    private List<String> storageKeys(List<String> keys) {
        Set<String> names = new LinkedHashSet<>();
        for (String key : keys) {
            names.add(storageKey(key));
        }
        return new ArrayList<>(names);
    }

    private long operationTimeout() {
        return settings.getConnectTimeoutMillis() * 2;
    }
}
