package ac.tiercache.spring;

import ac.tiercache.CacheConfigurationException;
import ac.tiercache.CacheSettings;
import ac.tiercache.Tier;
import ac.tiercache.TieredCacheEngine;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;

import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TieredCacheAutoConfigurationTest {

    @TempDir
    Path tempDir;

    private ApplicationContextRunner runner() {
        return new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(TieredCacheAutoConfiguration.class))
                .withPropertyValues(
                        "tiercache.cache-path=" + tempDir,
                        "tiercache.enabled-tiers=local");
    }

    @Test
    void testPropertiesAreBoundIntoSettings() {
        runner()
                .withPropertyValues(
                        "tiercache.prefix=app:",
                        "tiercache.default-ttl=120",
                        "tiercache.promotion-ttl=30m",
                        "tiercache.tiers.local.max-entries=50")
                .run(context -> {
                    assertThat(context).hasSingleBean(CacheSettings.class);
                    assertThat(context).hasSingleBean(TieredCacheEngine.class);
                    CacheSettings settings = context.getBean(CacheSettings.class);
                    assertThat(settings.getPrefix()).isEqualTo("app:");
                    assertThat(settings.getDefaultTtlSeconds()).isEqualTo(120);
                    assertThat(settings.getPromotionTtlSeconds()).isEqualTo(1800);
                    assertThat(settings.getEnabledTiers()).containsExactly(Tier.LOCAL_PROCESS_CACHE);
                    assertThat(settings.getTierSettings(Tier.LOCAL_PROCESS_CACHE).getMaxEntries()).isEqualTo(50);
                });
    }

    @Test
    void testCacheManagerStoresValuesInEngine() {
        runner().run(context -> {
            CacheManager cacheManager = context.getBean(CacheManager.class);
            assertThat(cacheManager).isInstanceOf(TieredCacheManager.class);

            Cache users = cacheManager.getCache("users");
            users.put(42, "alice");

            assertThat(users.get(42).get()).isEqualTo("alice");
            assertThat(users.get(42, String.class)).isEqualTo("alice");
            assertThat(context.getBean(TieredCacheEngine.class).get("users:42")).contains("alice");
            assertThat(cacheManager.getCacheNames()).containsExactly("users");
        });
    }

    @Test
    void testValueLoaderRunsOnceAndFailuresAreWrapped() {
        runner().run(context -> {
            Cache cache = context.getBean(CacheManager.class).getCache("products");
            AtomicInteger calls = new AtomicInteger();

            Object first = cache.get("p1", () -> "product-" + calls.incrementAndGet());
            Object second = cache.get("p1", () -> "product-" + calls.incrementAndGet());

            assertThat(first).isEqualTo("product-1");
            assertThat(second).isEqualTo("product-1");
            assertThatThrownBy(() -> cache.get("p2", () -> {
                throw new IllegalStateException("db down");
            })).isInstanceOf(Cache.ValueRetrievalException.class)
                    .hasCauseInstanceOf(IllegalStateException.class);
        });
    }

    @Test
    void testEvictAndTypeMismatch() {
        runner().run(context -> {
            Cache cache = context.getBean(CacheManager.class).getCache("orders");
            cache.put("o1", "pending");

            assertThatThrownBy(() -> cache.get("o1", Integer.class)).isInstanceOf(IllegalStateException.class);
            assertThat(cache.putIfAbsent("o1", "shipped").get()).isEqualTo("pending");
            assertThat(cache.evictIfPresent("o1")).isTrue();
            assertThat(cache.get("o1")).isNull();
            assertThat(cache.evictIfPresent("o1")).isFalse();
        });
    }

    @Test
    void testEmptyValuesAreNotCached() {
        runner().run(context -> {
            Cache cache = context.getBean(CacheManager.class).getCache("flags");

            cache.put("enabled", false);
            cache.put("name", "");

            assertThat(cache.get("enabled")).isNull();
            assertThat(cache.get("name")).isNull();
        });
    }

    @Test
    void testUnknownTierFailsStartup() {
        runner()
                .withPropertyValues("tiercache.tiers.nosuchtier.host=example")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure()).hasRootCauseInstanceOf(CacheConfigurationException.class);
                });
    }

    @Test
    void testUserDefinedCacheManagerWins() {
        runner()
                .withBean(CacheManager.class, ConcurrentMapCacheManager::new)
                .run(context -> {
                    assertThat(context).hasSingleBean(CacheManager.class);
                    assertThat(context).doesNotHaveBean(TieredCacheManager.class);
                    assertThat(context).hasSingleBean(TieredCacheEngine.class);
                });
    }
}
