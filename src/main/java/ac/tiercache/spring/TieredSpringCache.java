package ac.tiercache.spring;

import ac.tiercache.TieredCacheEngine;
import org.springframework.cache.Cache;
import org.springframework.cache.support.SimpleValueWrapper;
import org.springframework.lang.Nullable;

import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * One named Spring cache. Values the engine refuses to store (null, empty, false, zero) are
 * silently not cached.
 */
public class TieredSpringCache implements Cache {

    private final String name;
    private final TieredCacheEngine engine;

    public TieredSpringCache(String name, TieredCacheEngine engine) {
        this.name = name;
        this.engine = engine;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Object getNativeCache() {
        return engine;
    }

    @Override
    @Nullable
    public ValueWrapper get(Object key) {
        return engine.get(cacheKey(key))
                .map(SimpleValueWrapper::new)
                .orElse(null);
    }

    @Override
    @Nullable
    @SuppressWarnings("unchecked")
    public <T> T get(Object key, @Nullable Class<T> type) {
        Class<T> targetType = type != null ? type : (Class<T>) Object.class;
        Optional<Object> value = engine.get(cacheKey(key));
        if (value.isPresent() && !targetType.isInstance(value.get())) {
            throw new IllegalStateException("Cached value is not of required type [" + targetType.getName() + "]: "
                    + value.get());
        }
        return value.map(targetType::cast).orElse(null);
    }

    @Override
    @Nullable
    @SuppressWarnings("unchecked")
    public <T> T get(Object key, Callable<T> valueLoader) {
        return (T) engine.getOrCompute(cacheKey(key), Object.class, () -> {
            try {
                return valueLoader.call();
            } catch (Exception e) {
                throw new ValueRetrievalException(key, valueLoader, e);
            }
        }, engine.settings().getDefaultTtlSeconds());
    }

    @Override
    public void put(Object key, @Nullable Object value) {
        engine.set(cacheKey(key), value);
    }

    @Override
    @Nullable
    public ValueWrapper putIfAbsent(Object key, @Nullable Object value) {
        ValueWrapper existing = get(key);
        if (existing == null) {
            put(key, value);
        }
        return existing;
    }

    @Override
    public void evict(Object key) {
        engine.delete(cacheKey(key));
    }

    @Override
    public boolean evictIfPresent(Object key) {
        boolean existed = get(key) != null;
        evict(key);
        return existed;
    }

    /**
     * Clears the whole engine; tiers have no per-name namespace to clear selectively.
     */
    @Override
    public void clear() {
        engine.clear();
    }

    private String cacheKey(Object key) {
        if (key == null) {
            throw new IllegalArgumentException("Cache key must not be null");
        }
        return name + ":" + key;
    }
}
