package ac.tiercache.tier;

import ac.tiercache.CacheEntry;
import ac.tiercache.LastError;
import ac.tiercache.MutableClock;
import ac.tiercache.Tier;
import ac.tiercache.TierSettings;
import ac.tiercache.pool.ConnectionFactory;
import ac.tiercache.pool.DirectConnectionProvider;
import ac.tiercache.pool.PoolSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.redisson.api.RBucket;
import org.redisson.api.RBuckets;
import org.redisson.api.RKeys;
import org.redisson.api.RedissonClient;

import java.time.Duration;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class RedisTierTest {

    @Mock
    private RedissonClient client;

    @Mock
    private RBucket<CacheEntry> bucket;

    @Mock
    private RKeys keys;

    @Mock
    private ConnectionFactory<RedissonClient> factory;

    private MutableClock clock;
    private LastError lastError;
    private RedisTier tier;

    @BeforeEach
    void setUp() throws Exception {
        clock = new MutableClock();
        lastError = new LastError();
        when(factory.create()).thenReturn(client);
        when(factory.validate(client)).thenReturn(true);
        when(factory.describe()).thenReturn("redis-mock");
        when(client.getKeys()).thenReturn(keys);
        doReturn(bucket).when(client).getBucket(anyString());

        PoolSettings pool = new PoolSettings(0, 1, Duration.ofMinutes(5), 1, Duration.ZERO);
        tier = new RedisTier(TierSettings.defaultsFor(Tier.NETWORK_KV_STORE), TierContexts.create(clock, lastError),
                new DirectConnectionProvider<>(factory, pool, clock));
    }

    @Test
    void testGetUsesPrefixedKey() {
        // Arrange
        when(bucket.get()).thenReturn(CacheEntry.of("Ada", 60, clock));

        // Act
        TierResult<CacheEntry> result = tier.get("user:42");

        // Assert
        assertThat(result.value().getPayload()).isEqualTo("Ada");
        verify(client).getBucket("TIERCACHE:user:42");
    }

    @Test
    void testPutPassesRemainingLifetime() {
        CacheEntry entry = CacheEntry.of("Ada", 90, clock);

        TierResult<Void> result = tier.put("user:42", entry);

        assertThat(result.isSuccess()).isTrue();
        verify(bucket).set(entry, 90L, TimeUnit.SECONDS);
    }

    @Test
    void testEntryWithoutExpiryIsStoredWithoutTtl() {
        CacheEntry entry = new CacheEntry("forever", CacheEntry.NEVER);

        tier.put("k", entry);

        verify(bucket).set(entry);
    }

    @Test
    void testExpiredEntryIsDeleted() {
        when(bucket.get()).thenReturn(new CacheEntry("stale", clock.epochSecond() - 1));

        TierResult<CacheEntry> result = tier.get("k");

        assertThat(result.isHit()).isFalse();
        verify(bucket).delete();
    }

    @Test
    void testBackendErrorIsRecorded() {
        when(bucket.get()).thenThrow(new IllegalStateException("connection reset"));

        TierResult<CacheEntry> result = tier.get("k");

        assertThat(result.isFailure()).isTrue();
        assertThat(lastError.get()).hasValueSatisfying(message ->
                assertThat(message).contains("redis get failed").contains("connection reset"));
    }

    @Test
    void testClearDeletesOnlyPrefixedKeys() {
        tier.clear();

        verify(keys).deleteByPattern("TIERCACHE:*");
        verify(keys, never()).flushdb();
    }

    @Test
    void testGetManyKeepsRequestOrderAndSkipsMisses() throws Exception {
        // Arrange
        RBuckets buckets = org.mockito.Mockito.mock(RBuckets.class);
        when(client.getBuckets()).thenReturn(buckets);
        Map<String, Object> found = new HashMap<>();
        found.put("TIERCACHE:b", CacheEntry.of("B", 60, clock));
        found.put("TIERCACHE:a", CacheEntry.of("A", 60, clock));
        found.put("TIERCACHE:old", new CacheEntry("stale", clock.epochSecond() - 5));
        doReturn(found).when(buckets).get("TIERCACHE:b", "TIERCACHE:missing", "TIERCACHE:a", "TIERCACHE:old");

        // Act
        Map<String, CacheEntry> result = tier.getMany(Arrays.asList("b", "missing", "a", "old"));

        // Assert
        assertThat(result.keySet()).containsExactly("b", "a");
        assertThat(result.get("a").getPayload()).isEqualTo("A");
    }

    @Test
    void testDeleteManyAppliesPrefix() throws Exception {
        when(keys.delete("TIERCACHE:a", "TIERCACHE:b")).thenReturn(2L);

        assertThat(tier.deleteMany(Arrays.asList("a", "b"))).isEqualTo(2L);
    }

    @Test
    void testConnectionIsReusedAcrossOperations() throws Exception {
        tier.get("a");
        tier.get("b");

        verify(factory, org.mockito.Mockito.times(1)).create();
        assertThat(tier.poolStats().getCreated()).isEqualTo(1);
        assertThat(tier.poolStats().getReused()).isEqualTo(1);
    }
}
