package ac.tiercache.tier;

import ac.tiercache.CacheEntry;
import ac.tiercache.MutableClock;
import ac.tiercache.TierSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SlotCacheTierTest {

    private MutableClock clock;
    private SlotCacheTier tier;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        tier = new SlotCacheTier(new TierSettings().merge(Map.of("slots", 100)), TierContexts.create(clock));
    }

    @Test
    void testCapacityIsRoundedToPowerOfTwo() {
        assertThat(tier.capacity()).isEqualTo(64);
    }

    @Test
    void testRoundTripAndExpiry() {
        tier.put("k", CacheEntry.of("v", 2, clock));
        assertThat(tier.get("k").value().getPayload()).isEqualTo("v");

        clock.advanceSeconds(2);

        assertThat(tier.get("k").isHit()).isFalse();
    }

    @Test
    void testNewerKeyEvictsSlotOccupant() {
        // Arrange: 64 slots, so 65 keys guarantee at least one shared slot
        for (int i = 0; i < 65; i++) {
            tier.put("key-" + i, CacheEntry.of("v" + i, 60, clock));
        }

        // Act
        int hits = 0;
        for (int i = 0; i < 65; i++) {
            if (tier.get("key-" + i).isHit()) {
                hits++;
            }
        }

        // Assert
        assertThat(hits).isLessThanOrEqualTo(64);
        assertThat(tier.get("key-64").isHit()).isTrue();
    }

    @Test
    void testDeleteLeavesOtherOccupantAlone() {
        tier.put("a", CacheEntry.of("1", 60, clock));

        tier.delete("not-a");

        assertThat(tier.get("a").isHit()).isTrue();
    }

    @Test
    void testHealthChecksLeaveLiveEntriesInPlace() {
        // Arrange: more keys than slots
        for (int i = 0; i < 200; i++) {
            tier.put("key-" + i, CacheEntry.of("v" + i, 60, clock));
        }
        Map<String, Object> before = liveEntries(200);
        int occupied = tier.occupied();

        // Act
        for (int i = 0; i < 40; i++) {
            assertThat(tier.isHealthy()).isTrue();
            assertThat(tier.probe()).isTrue();
        }

        // Assert
        assertThat(tier.occupied()).isEqualTo(occupied);
        assertThat(liveEntries(200)).isEqualTo(before);
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

    private Map<String, Object> liveEntries(int keys) {
        Map<String, Object> live = new HashMap<>();
        for (int i = 0; i < keys; i++) {
            TierResult<CacheEntry> result = tier.get("key-" + i);
            if (result.isHit()) {
                live.put("key-" + i, result.value().getPayload());
            }
        }
        return live;
    }
}
