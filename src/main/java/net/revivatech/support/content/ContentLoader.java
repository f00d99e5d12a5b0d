package net.revivatech.support.content;

import jakarta.annotation.Nullable;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import net.revivatech.config.PageEngineProperties;
import net.revivatech.domain.content.ContentEntry;
import net.revivatech.exception.ContentLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Resolves localized content from the configured sources with caching and locale fallback.
 *
 * <p>Sources are tried in priority order and the first one that reports the key and
 * returns a value wins. A source failure counts as a miss for that source; only when
 * every source fails is a {@link ContentLoadException} raised. A total miss in the
 * requested locale is retried once in the fallback locale.
 */
@Component
public class ContentLoader {

    private static final Logger log = LoggerFactory.getLogger(ContentLoader.class);
    private static final String NAMESPACE_PREFIX = "namespace:";

    private final List<ContentSource> sources;
    private final ContentCache cache;
    private final String fallbackLocale;
    private final AtomicReference<String> currentLocale;

    @Autowired
    public ContentLoader(List<ContentSource> sources, ContentCache cache, PageEngineProperties properties) {
        this(sources, cache, properties.getDefaultLocale(), properties.getFallbackLocale());
    }

    public ContentLoader(List<ContentSource> sources, ContentCache cache, String defaultLocale, String fallbackLocale) {
        this.sources = List.copyOf(sources);
        this.cache = cache;
        this.fallbackLocale = fallbackLocale;
        this.currentLocale = new AtomicReference<>(defaultLocale);
        log.info("Content loader using sources {}", this.sources.stream().map(ContentSource::name).toList());
    }

    /**
     * Loads the processed value of {@code key}.
     *
     * @param locale requested locale, the loader's current locale when {@code null}
     * @return processed content, empty when no source has the key in either locale
     * @throws ContentLoadException (as an error signal) when every source failed for the
     *     requested locale and the fallback locale does not have the key either
     */
    public Mono<String> load(String key, @Nullable String locale) {
        String effectiveLocale = effective(locale);
        Optional<Object> cached = cache.get(key, effectiveLocale);
        if (cached.isPresent() && cached.get() instanceof ContentEntry entry) {
            return Mono.just(entry.processed());
        }
        return loadFromSources(key, effectiveLocale)
            .doOnNext(entry -> cache.set(key, entry, effectiveLocale))
            .map(ContentEntry::processed)
            .onErrorResume(ContentLoadException.class, failure -> retryWithFallback(key, effectiveLocale, failure))
            .switchIfEmpty(Mono.defer(() -> {
                if (effectiveLocale.equals(fallbackLocale)) {
                    return Mono.empty();
                }
                log.debug("Content {} missing for locale {}, retrying with {}", key, effectiveLocale, fallbackLocale);
                return load(key, fallbackLocale);
            }));
    }

    public Mono<String> load(String key) {
        return load(key, null);
    }

    /**
     * Cache-only lookup with the same locale fallback as {@link #load(String, String)}.
     */
    public Optional<String> peek(String key, @Nullable String locale) {
        String effectiveLocale = effective(locale);
        Optional<String> value = cache.get(key, effectiveLocale)
            .filter(ContentEntry.class::isInstance)
            .map(cached -> ((ContentEntry) cached).processed());
        if (value.isPresent() || effectiveLocale.equals(fallbackLocale)) {
            return value;
        }
        return peek(key, fallbackLocale);
    }

    /**
     * Loads every raw value below {@code namespace} from the first source that has any.
     *
     * @return namespace contents, an empty map when nothing matched
     */
    @SuppressWarnings("unchecked")
    public Mono<Map<String, Object>> loadNamespace(String namespace, @Nullable String locale) {
        String effectiveLocale = effective(locale);
        String cacheKey = NAMESPACE_PREFIX + namespace;
        Optional<Object> cached = cache.get(cacheKey, effectiveLocale);
        if (cached.isPresent() && cached.get() instanceof Map<?, ?> map) {
            return Mono.just((Map<String, Object>) map);
        }
        return Flux.fromIterable(sources)
            .concatMap(source -> source.loadNamespace(namespace, effectiveLocale)
                .onErrorResume(sourceFailure -> {
                    log.warn("Content source {} failed for namespace {} ({}): {}",
                        source.name(), namespace, effectiveLocale, sourceFailure.getMessage());
                    return Mono.empty();
                }))
            .filter(values -> !values.isEmpty())
            .next()
            .doOnNext(values -> cache.set(cacheKey, values, effectiveLocale))
            .switchIfEmpty(Mono.defer(() -> {
                if (effectiveLocale.equals(fallbackLocale)) {
                    return Mono.just(Map.<String, Object>of());
                }
                return loadNamespace(namespace, fallbackLocale);
            }));
    }

    /**
     * Merges the complete contents of every source; earlier sources win on key clashes.
     */
    public Mono<Map<String, Object>> loadAll(@Nullable String locale) {
        String effectiveLocale = effective(locale);
        return Flux.fromIterable(sources)
            .concatMap(source -> source.loadNamespace("", effectiveLocale)
                .onErrorResume(sourceFailure -> {
                    log.warn("Content source {} failed to load all content ({}): {}",
                        source.name(), effectiveLocale, sourceFailure.getMessage());
                    return Mono.empty();
                }))
            .reduceWith(LinkedHashMap<String, Object>::new, (merged, values) -> {
                values.forEach(merged::putIfAbsent);
                return merged;
            })
            .map(merged -> (Map<String, Object>) merged);
    }

    /**
     * Drops the cached value and loads it again.
     */
    public Mono<String> reload(String key, @Nullable String locale) {
        cache.invalidate(key, effective(locale));
        return load(key, locale);
    }

    /**
     * Loads every key into the cache. Failures are logged and skipped.
     *
     * @return number of keys that resolved
     */
    public Mono<Integer> preload(Collection<String> keys, @Nullable String locale) {
        AtomicInteger loaded = new AtomicInteger();
        return Flux.fromIterable(keys)
            .flatMap(key -> load(key, locale)
                .doOnNext(ignored -> loaded.incrementAndGet())
                .onErrorResume(preloadFailure -> {
                    log.warn("Preloading content {} failed: {}", key, preloadFailure.getMessage());
                    return Mono.empty();
                }))
            .then(Mono.fromSupplier(loaded::get));
    }

    public void setLocale(String locale) {
        currentLocale.set(locale);
    }

    public String getLocale() {
        return currentLocale.get();
    }

    private String effective(@Nullable String locale) {
        return locale == null || locale.isBlank() ? currentLocale.get() : locale;
    }

    private Mono<String> retryWithFallback(String key, String locale, ContentLoadException failure) {
        if (locale.equals(fallbackLocale)) {
            return Mono.error(failure);
        }
        log.debug("Content sources failed for {} ({}), retrying with {}", key, locale, fallbackLocale);
        return load(key, fallbackLocale)
            .onErrorResume(fallbackFailure -> {
                failure.addSuppressed(fallbackFailure);
                return Mono.error(failure);
            })
            .switchIfEmpty(Mono.error(failure));
    }

    private Mono<ContentEntry> loadFromSources(String key, String locale) {
        return Mono.defer(() -> {
            AtomicInteger failures = new AtomicInteger();
            AtomicReference<Throwable> lastFailure = new AtomicReference<>();
            return Flux.fromIterable(sources)
                .concatMap(source -> source.exists(key, locale)
                    .filter(Boolean::booleanValue)
                    .flatMap(present -> source.load(key, locale))
                    .onErrorResume(sourceFailure -> {
                        failures.incrementAndGet();
                        lastFailure.set(sourceFailure);
                        log.warn("Content source {} failed for {} ({}): {}",
                            source.name(), key, locale, sourceFailure.getMessage());
                        return Mono.empty();
                    }))
                .next()
                .switchIfEmpty(Mono.defer(() -> {
                    if (!sources.isEmpty() && failures.get() == sources.size()) {
                        return Mono.<ContentEntry>error(new ContentLoadException(key, locale, lastFailure.get()));
                    }
                    return Mono.<ContentEntry>empty();
                }));
        });
    }
}
