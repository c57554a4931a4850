package ac.tiercache.tier;

import ac.tiercache.CacheEntry;
import ac.tiercache.MutableClock;
import ac.tiercache.TierSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LocalCacheTierTest {

    private MutableClock clock;
    private LocalCacheTier tier;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        tier = new LocalCacheTier(new TierSettings().merge(Map.of("max_entries", 100)), TierContexts.create(clock));
    }

    @Test
    void testRoundTrip() {
        tier.put("k", CacheEntry.of("v", 60, clock));

        assertThat(tier.get("k").value().getPayload()).isEqualTo("v");
        assertThat(tier.probe()).isTrue();
    }

    @Test
    void testExpiryFollowsEngineClock() {
        // Arrange
        tier.put("k", CacheEntry.of("v", 5, clock));

        // Act
        clock.advanceSeconds(6);

        // Assert
        assertThat(tier.get("k").isHit()).isFalse();
        assertThat(tier.estimatedSize()).isZero();
    }

    @Test
    void testDeleteAndClear() {
        tier.put("a", CacheEntry.of("1", 60, clock));
        tier.put("b", CacheEntry.of("2", 60, clock));

        tier.delete("a");
        assertThat(tier.get("a").isHit()).isFalse();
        assertThat(tier.get("b").isHit()).isTrue();

        tier.clear();
        assertThat(tier.get("b").isHit()).isFalse();
    }

    @Test
    void testMutatingValueAfterSetDoesNotChangeStoredValue() {
        // Given
        List<String> tags = new ArrayList<>();
        tags.add("a");
        tier.put("tags", CacheEntry.of(tags, 60, clock));

        // When
        tags.add("mutated-after-set");
        @SuppressWarnings("unchecked")
        List<String> read = (List<String>) tier.get("tags").value().getPayload();
        read.add("mutated-after-get");

        // Then
        assertThat(tier.get("tags").value().getPayload()).isEqualTo(List.of("a"));
    }

    @Test
    void testImmutablePayloadIsStoredAsIs() {
        String value = "shared";
        tier.put("k", CacheEntry.of(value, 60, clock));

        assertThat(tier.get("k").value().getPayload()).isSameAs(value);
    }

    @Test
    void testHealthCheckDoesNotWrite() {
        tier.put("a", CacheEntry.of("1", 60, clock));

        assertThat(tier.isHealthy()).isTrue();

        assertThat(tier.estimatedSize()).isEqualTo(1);
    }
}
