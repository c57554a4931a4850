package ac.tiercache.spring;

import ac.tiercache.TieredCacheEngine;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.lang.Nullable;

import java.util.Collection;
import java.util.Collections;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Spring {@link CacheManager} whose caches all live in one {@link TieredCacheEngine}. Each
 * named cache prefixes its keys with its name.
 */
public class TieredCacheManager implements CacheManager {

    private final TieredCacheEngine engine;
    private final ConcurrentMap<String, Cache> caches = new ConcurrentHashMap<>();

    public TieredCacheManager(TieredCacheEngine engine) {
        this.engine = engine;
    }

    @Override
    @Nullable
    public Cache getCache(String name) {
        return caches.computeIfAbsent(name, cacheName -> new TieredSpringCache(cacheName, engine));
    }

    @Override
    public Collection<String> getCacheNames() {
        return Collections.unmodifiableSet(caches.keySet());
    }

    public TieredCacheEngine getEngine() {
        return engine;
    }
}
