package net.revivatech.support.component;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import net.revivatech.domain.page.PageComponent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Resolves component names through the registry first and the lazy loader second.
 * Lazily loaded components are registered so later lookups stay synchronous.
 */
@Component
public class ComponentResolver {

    private static final Logger log = LoggerFactory.getLogger(ComponentResolver.class);

    private final ComponentRegistry registry;
    private final List<ComponentSource> sources;

    public ComponentResolver(ComponentRegistry registry, LazyComponentSource lazySource) {
        this.registry = registry;
        this.sources = List.of(registry, lazySource);
    }

    public Mono<PageComponent> resolve(String name) {
        return Flux.fromIterable(sources)
            .concatMap(source -> source.resolve(name))
            .next()
            .doOnNext(component -> {
                if (!registry.has(name)) {
                    registry.register(name, component);
                }
            });
    }

    /**
     * Registry-only lookup for synchronous rendering.
     */
    public Optional<PageComponent> resolveLoaded(String name) {
        return registry.get(name);
    }

    public boolean canRender(String name) {
        return sources.stream().anyMatch(source -> source.knows(name));
    }

    /**
     * Every name any source can produce, sorted.
     */
    public Set<String> knownComponents() {
        Set<String> names = new TreeSet<>();
        sources.forEach(source -> names.addAll(source.names()));
        return names;
    }

    /**
     * Resolves all names, tolerating individual failures.
     *
     * @return outcome listing which names loaded and which did not
     */
    public Mono<PreloadReport> preload(Collection<String> names) {
        return Flux.fromIterable(Set.copyOf(names))
            .flatMap(name -> resolve(name)
                .map(component -> new PreloadOutcome(name, true))
                .defaultIfEmpty(new PreloadOutcome(name, false))
                .onErrorResume(preloadFailure -> {
                    log.warn("Preloading component {} failed: {}", name, preloadFailure.getMessage());
                    return Mono.just(new PreloadOutcome(name, false));
                }))
            .collectList()
            .map(PreloadReport::from);
    }

    private record PreloadOutcome(String name, boolean loaded) {
    }

    /**
     * @param loaded names that resolved, sorted
     * @param missing names no source could produce, sorted
     */
    public record PreloadReport(List<String> loaded, List<String> missing) {

        private static PreloadReport from(List<PreloadOutcome> outcomes) {
            List<String> loaded = outcomes.stream().filter(PreloadOutcome::loaded)
                .map(PreloadOutcome::name).sorted().toList();
            List<String> missing = outcomes.stream().filter(outcome -> !outcome.loaded())
                .map(PreloadOutcome::name).sorted().toList();
            return new PreloadReport(loaded, missing);
        }
    }
}
