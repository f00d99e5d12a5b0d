package net.revivatech.support.config;

import com.github.benmanes.caffeine.cache.Cache;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import net.revivatech.config.CacheFactory;
import net.revivatech.config.PageEngineProperties;
import net.revivatech.domain.page.PageConfiguration;
import net.revivatech.domain.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Loads, validates and caches page configurations.
 *
 * <p>Sources are consulted in priority order and the first one holding the path wins.
 * A configuration that cannot be read or fails validation is logged and treated as
 * absent. Unknown components are reported as warnings here regardless of
 * {@code pages.strict-components}. Validated configurations are cached for {@code pages.config-cache-ttl}, or
 * {@code pages.config-cache-dev-ttl} when the {@code dev} profile is active.
 */
@Component
public class PageConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(PageConfigLoader.class);

    private final List<PageConfigSource> sources;
    private final PageConfigValidator validator;
    private final Cache<String, PageConfiguration> cache;
    private final List<Consumer<PageConfigChange>> watchers = new CopyOnWriteArrayList<>();

    @Autowired
    public PageConfigLoader(List<PageConfigSource> sources,
                            PageConfigValidator validator,
                            CacheFactory cacheFactory,
                            PageEngineProperties properties,
                            Environment environment) {
        this(sources, validator, cacheFactory, environment.acceptsProfiles(Profiles.of("dev"))
            ? properties.getConfigCacheDevTtl()
            : properties.getConfigCacheTtl());
    }

    public PageConfigLoader(List<PageConfigSource> sources,
                            PageConfigValidator validator,
                            CacheFactory cacheFactory,
                            Duration cacheTtl) {
        this.sources = List.copyOf(sources);
        this.validator = validator;
        this.cache = cacheFactory.createCache("pageConfigs", 1_000, cacheTtl);
        log.info("Page configuration cache ttl is {}", cacheTtl);
    }

    /**
     * Loads the validated configuration stored at {@code path}.
     *
     * @return the configuration, empty when missing, unreadable or invalid
     */
    public Mono<PageConfiguration> load(String path) {
        PageConfiguration cached = cache.getIfPresent(path);
        if (cached != null) {
            return Mono.just(cached);
        }
        return readRaw(path)
            .flatMap(raw -> {
                ValidationResult result = validator.validate(raw, false);
                if (!result.valid()) {
                    log.warn("Page configuration {} is invalid: {}", path, result.errorSummary());
                    return Mono.empty();
                }
                if (!result.warnings().isEmpty()) {
                    log.info("Page configuration {} has {} warnings: {}", path, result.warnings().size(),
                        result.warnings().stream().map(issue -> issue.code()).toList());
                }
                return Mono.justOrEmpty(result.validatedConfig());
            })
            .doOnNext(config -> cache.put(path, config))
            .onErrorResume(loadFailure -> {
                log.error("Failed to load page configuration {}: {}", path, loadFailure.getMessage());
                return Mono.empty();
            });
    }

    /**
     * Reads the raw document without validating it.
     */
    public Mono<Map<String, Object>> readRaw(String path) {
        return Flux.fromIterable(sources)
            .concatMap(source -> source.read(path))
            .next();
    }

    /**
     * Loads every valid configuration, keyed by path in path order.
     */
    public Mono<Map<String, PageConfiguration>> loadAll() {
        return listPaths()
            .concatMap(path -> load(path).map(config -> Map.entry(path, config)))
            .collect(LinkedHashMap<String, PageConfiguration>::new, (all, entry) -> all.put(entry.getKey(), entry.getValue()))
            .map(all -> (Map<String, PageConfiguration>) all);
    }

    /**
     * Distinct configuration paths across all sources, sorted.
     */
    public Flux<String> listPaths() {
        return Flux.fromIterable(sources)
            .concatMap(source -> source.listPaths()
                .onErrorResume(listFailure -> {
                    log.warn("Page configuration source {} could not be listed: {}", source.name(), listFailure.getMessage());
                    return Flux.empty();
                }))
            .distinct()
            .sort();
    }

    /**
     * Validates a raw document the way {@link #load(String)} does. Unknown components are
     * warnings here; strict component checks belong to page creation.
     */
    public ValidationResult validate(Map<String, Object> raw) {
        return validator.validate(raw, false);
    }

    /**
     * Registers a callback invoked after every successful {@link #reload(String)}.
     *
     * @return action that removes the callback again
     */
    public Runnable watch(Consumer<PageConfigChange> callback) {
        watchers.add(callback);
        return () -> watchers.remove(callback);
    }

    /**
     * Drops the cached configuration, loads it again and notifies watchers.
     */
    public Mono<PageConfiguration> reload(String path) {
        cache.invalidate(path);
        return load(path).doOnNext(config -> notifyWatchers(new PageConfigChange(path, config)));
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    private void notifyWatchers(PageConfigChange change) {
        for (Consumer<PageConfigChange> watcher : watchers) {
            try {
                watcher.accept(change);
            } catch (RuntimeException watcherFailure) {
                log.error("Page configuration watcher failed for {}", change.path(), watcherFailure);
            }
        }
    }

    /**
     * Notification that the configuration at {@code path} was reloaded.
     */
    public record PageConfigChange(String path, PageConfiguration config) {
    }
}
