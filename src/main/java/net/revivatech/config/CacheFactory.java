package net.revivatech.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Builds the engine's Caffeine caches (page configs, resolved pages, content, lazy
 * components). All of them read time from one {@link Ticker}, which tests replace.
 */
@Component
public class CacheFactory {

    private static final Logger log = LoggerFactory.getLogger(CacheFactory.class);

    private final Ticker ticker;

    public CacheFactory() {
        this(Ticker.systemTicker());
    }

    public CacheFactory(Ticker ticker) {
        this.ticker = ticker;
    }

    /**
     * Size-bounded cache whose entries expire a fixed time after they are written.
     */
    public <K, V> Cache<K, V> createCache(String name, int maxSize, Duration ttl) {
        log.debug("Creating cache {} (max {}, ttl {})", name, maxSize, ttl);
        return Caffeine.newBuilder()
            .ticker(ticker)
            .maximumSize(maxSize)
            .expireAfterWrite(ttl)
            .recordStats()
            .build();
    }

    /**
     * Create a cache whose entries each carry their own lifetime.
     */
    public <K, V> Cache<K, V> createCacheWithExpiry(String name, int maxSize, Expiry<K, V> expiry) {
        log.debug("Creating cache {} (max {}, per-entry expiry)", name, maxSize);
        return Caffeine.newBuilder()
            .ticker(ticker)
            .maximumSize(maxSize)
            .expireAfter(expiry)
            .recordStats()
            .build();
    }
}
