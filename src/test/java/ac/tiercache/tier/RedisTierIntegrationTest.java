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
class RedisTierIntegrationTest {

    @Container
    static GenericContainer<?> redis = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    private MutableClock clock;
    private RedisTier tier;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.now());
        Map<String, Object> options = new HashMap<>();
        options.put("host", redis.getHost());
        options.put("port", redis.getMappedPort(6379));
        options.put("prefix", "it:");
        TierSettings settings = TierSettings.defaultsFor(Tier.NETWORK_KV_STORE).merge(options);
        tier = new RedisTier(settings, TierContexts.create(clock));
    }

    @AfterEach
    void tearDown() {
        tier.clear();
        tier.close();
    }

    @Test
    void testProbeAndRoundTrip() {
        assertThat(tier.probe()).isTrue();

        tier.put("user:42", CacheEntry.of("Ada", 60, clock));

        assertThat(tier.get("user:42").value().getPayload()).isEqualTo("Ada");
        assertThat(tier.isHealthy()).isTrue();
    }

    @Test
    void testBatchOperationsPreserveOrder() throws Exception {
        // Arrange
        Map<String, CacheEntry> entries = new LinkedHashMap<>();
        entries.put("c", CacheEntry.of("C", 60, clock));
        entries.put("a", CacheEntry.of("A", 60, clock));

        // Act
        tier.putMany(entries);
        Map<String, CacheEntry> found = tier.getMany(Arrays.asList("a", "missing", "c"));

        // Assert
        assertThat(found.keySet()).containsExactly("a", "c");
        assertThat(tier.deleteMany(Arrays.asList("a", "c"))).isEqualTo(2L);
        assertThat(tier.get("a").isHit()).isFalse();
    }

    @Test
    void testPoolReleasesConnections() {
        for (int i = 0; i < 20; i++) {
            tier.put("k" + i, CacheEntry.of("v" + i, 60, clock));
        }

        assertThat(tier.poolStats().getActive()).isZero();
        assertThat(tier.poolStats().getTotal()).isLessThanOrEqualTo(10);
    }
}
