package net.revivatech.support.content;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Expiry;
import java.time.Duration;
import java.util.Optional;
import net.revivatech.config.CacheFactory;
import net.revivatech.config.PageEngineProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Locale-aware content cache where every entry carries its own lifetime.
 * Expired entries are never returned; Caffeine evicts them lazily.
 */
@Component
public class ContentCache {

    private static final int MAX_ENTRIES = 50_000;

    private final Cache<CacheKey, CachedValue> cache;
    private final Duration defaultTtl;

    @Autowired
    public ContentCache(CacheFactory cacheFactory, PageEngineProperties properties) {
        this(cacheFactory, properties.getContentTtl());
    }

    public ContentCache(CacheFactory cacheFactory, Duration defaultTtl) {
        this.defaultTtl = defaultTtl;
        this.cache = cacheFactory.createCacheWithExpiry("content", MAX_ENTRIES, new PerEntryExpiry());
    }

    public void set(String key, Object value, String locale) {
        set(key, value, locale, defaultTtl);
    }

    public void set(String key, Object value, String locale, Duration ttl) {
        cache.put(new CacheKey(key, locale), new CachedValue(value, ttl));
    }

    public Optional<Object> get(String key, String locale) {
        return Optional.ofNullable(cache.getIfPresent(new CacheKey(key, locale))).map(CachedValue::value);
    }

    public void invalidate(String key, String locale) {
        cache.invalidate(new CacheKey(key, locale));
    }

    /**
     * Removes the key in every locale.
     */
    public void invalidate(String key) {
        cache.asMap().keySet().removeIf(cached -> cached.key().equals(key));
    }

    public void clear(String locale) {
        cache.asMap().keySet().removeIf(cached -> cached.locale().equals(locale));
    }

    public void clear() {
        cache.invalidateAll();
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private record CacheKey(String key, String locale) {
    }

    private record CachedValue(Object value, Duration ttl) {
    }

    private static final class PerEntryExpiry implements Expiry<CacheKey, CachedValue> {

        @Override
        public long expireAfterCreate(CacheKey key, CachedValue value, long currentTime) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterUpdate(CacheKey key, CachedValue value, long currentTime, long currentDuration) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterRead(CacheKey key, CachedValue value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
