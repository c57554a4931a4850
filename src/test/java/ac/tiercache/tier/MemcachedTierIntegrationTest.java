package ac.tiercache.tier;

import ac.tiercache.CacheEntry;
import ac.tiercache.MutableClock;
import ac.tiercache.Tier;
import ac.tiercache.TierSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Instant;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@Testcontainers(disabledWithoutDocker = true)
class MemcachedTierIntegrationTest {

    @Container
    static GenericContainer<?> memcached = new GenericContainer<>(DockerImageName.parse("memcached:1.6-alpine"))
            .withExposedPorts(11211);

    private MutableClock clock;
    private MemcachedTier tier;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.now());
        Map<String, Object> options = new HashMap<>();
        options.put("host", memcached.getHost());
        options.put("port", memcached.getMappedPort(11211));
        TierSettings settings = TierSettings.defaultsFor(Tier.NETWORK_CACHE_CLUSTER).merge(options);
        tier = new MemcachedTier(settings, TierContexts.create(clock));
    }

    @AfterEach
    void tearDown() {
        tier.close();
    }

    @Test
    void testProbeAndRoundTrip() {
        assertThat(tier.probe()).isTrue();

        tier.put("user:42", CacheEntry.of("Ada", 60, clock));

        assertThat(tier.get("user:42").value().getPayload()).isEqualTo("Ada");
    }

    @Test
    void testDeleteAndClear() {
        tier.put("a", CacheEntry.of("1", 60, clock));
        tier.put("b", CacheEntry.of("2", 60, clock));

        assertThat(tier.delete("a").isSuccess()).isTrue();
        assertThat(tier.get("a").isHit()).isFalse();

        assertThat(tier.clear().isSuccess()).isTrue();
        assertThat(tier.get("b").isHit()).isFalse();
    }

    @Test
    void testBatchOperations() throws Exception {
        // Arrange
        Map<String, CacheEntry> entries = new LinkedHashMap<>();
        entries.put("c", CacheEntry.of("C", 60, clock));
        entries.put("a", CacheEntry.of("A", 60, clock));
        entries.put("with space", CacheEntry.of("W", 60, clock));

        // Act
        tier.putMany(entries);
        Map<String, CacheEntry> found = tier.getMany(Arrays.asList("a", "missing", "with space", "c"));

        // Assert
        assertThat(found.keySet()).containsExactly("a", "with space", "c");
        assertThat(found.get("with space").getPayload()).isEqualTo("W");
        assertThat(tier.deleteMany(Arrays.asList("a", "c", "missing"))).isEqualTo(2L);
        assertThat(tier.get("a").isHit()).isFalse();
        assertThat(tier.get("with space").isHit()).isTrue();
    }
}
