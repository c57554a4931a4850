package ac.tiercache.warming;

import ac.tiercache.CacheSettings;
import ac.tiercache.MutableClock;
import ac.tiercache.Tier;
import ac.tiercache.TieredCacheEngine;
import ac.tiercache.async.CooperativeScheduler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

class CacheWarmingServiceTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private TieredCacheEngine engine;
    private CacheWarmingService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        engine = new TieredCacheEngine(CacheSettings.builder()
                .cachePath(tempDir)
                .fallbackCachePaths(List.of())
                .enabledTiers(Tier.LOCAL_PROCESS_CACHE)
                .clock(clock)
                .build());
        service = engine.warmer();
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private static CacheWarmer warmer(String name, boolean applicable, String... keys) {
        return new CacheWarmer() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public boolean isApplicable() {
                return applicable;
            }

            @Override
            public int warm(TieredCacheEngine target) {
                int warmed = 0;
                for (String key : keys) {
                    if (target.set(key, "warm:" + key, 60)) {
                        warmed++;
                    }
                }
                return warmed;
            }
        };
    }

    @Test
    void testWarmAllRunsApplicableWarmersInRegistrationOrder() {
        // Given
        service.register(warmer("users", true, "user:1", "user:2"))
                .register(warmer("disabled", false, "never"))
                .register(warmer("settings", true, "settings"));

        // When
        Map<String, WarmingResult> results = service.warmAll();

        // Then
        assertThat(results.keySet()).containsExactly("users", "settings");
        assertThat(results.get("users").getWarmedCount()).isEqualTo(2);
        assertThat(results.get("users").isSuccess()).isTrue();
        assertThat(engine.get("user:1")).contains("warm:user:1");
        assertThat(engine.get("never")).isEmpty();
    }

    @Test
    void testWarmWithUnknownOrInapplicableWarmer() {
        service.register(warmer("disabled", false, "never"));

        assertThat(service.warmWith("missing")).isEmpty();
        assertThat(service.warmWith("disabled")).isEmpty();
    }

    @Test
    void testStatsAccumulateAcrossRuns() {
        service.register(warmer("users", true, "user:1"));

        service.warmWith("users");
        clock.advanceSeconds(30);
        service.warmWith("users");

        WarmerStats stats = service.stats("users").orElseThrow();
        assertThat(stats.getRuns()).isEqualTo(2);
        assertThat(stats.getTotalWarmed()).isEqualTo(2);
        assertThat(stats.getLastRun()).isEqualTo(clock.instant());
        assertThat(stats.getAverageDuration()).isGreaterThanOrEqualTo(Duration.ZERO);

        service.resetStats();
        assertThat(service.stats()).isEmpty();
    }

    @Test
    void testRegisterReplacesWarmerWithSameName() {
        service.register(warmer("users", true, "old"));
        service.register(warmer("users", true, "new"));

        service.warmAll();

        assertThat(service.warmerNames()).containsExactly("users");
        assertThat(engine.get("new")).isPresent();
        assertThat(engine.get("old")).isEmpty();
    }

    @Test
    void testWarmAllAsyncUsesEngineScheduler() throws Exception {
        CooperativeScheduler scheduler = new CooperativeScheduler();
        engine.async().enable(scheduler);
        service.register(warmer("users", true, "user:1"));

        CompletableFuture<Map<String, WarmingResult>> future = service.warmAllAsync();

        assertThat(future).isNotDone();
        scheduler.runUntilIdle();
        assertThat(future.get().get("users").getWarmedCount()).isEqualTo(1);
    }

    @Test
    void testRemovedWarmerNoLongerRuns() {
        service.register(warmer("users", true, "user:1")).remove("users");

        assertThat(service.warmAll()).isEmpty();
        assertThat(service.warmerNames()).isEmpty();
    }
}
