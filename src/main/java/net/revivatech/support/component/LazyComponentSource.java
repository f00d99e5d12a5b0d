package net.revivatech.support.component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import net.revivatech.config.PageEngineProperties;
import net.revivatech.domain.page.PageComponent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.BeanUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.ClassUtils;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Loads heavyweight components on first use from a configured class name.
 *
 * <p>Concurrent requests for the same name share one load. A failed load is logged,
 * completes empty and is retried on the next request.
 */
@Component
public class LazyComponentSource implements ComponentSource {

    private static final Logger log = LoggerFactory.getLogger(LazyComponentSource.class);

    private final Map<String, String> classNames;
    private final ClassLoader classLoader;
    private final Map<String, Mono<PageComponent>> inflight = new ConcurrentHashMap<>();

    @Autowired
    public LazyComponentSource(PageEngineProperties properties) {
        this(properties.getLazyComponents(), ClassUtils.getDefaultClassLoader());
    }

    public LazyComponentSource(Map<String, String> classNames, ClassLoader classLoader) {
        this.classNames = new LinkedHashMap<>(classNames);
        this.classLoader = classLoader;
    }

    @Override
    public Mono<PageComponent> resolve(String name) {
        String className = classNames.get(name);
        if (className == null) {
            return Mono.empty();
        }
        return inflight.computeIfAbsent(name, key -> load(key, className).cache())
            .onErrorResume(loadFailure -> {
                inflight.remove(name);
                log.warn("Failed to load component {} from {}: {}", name, className, loadFailure.getMessage());
                return Mono.empty();
            });
    }

    @Override
    public boolean knows(String name) {
        return classNames.containsKey(name);
    }

    @Override
    public Set<String> names() {
        return Set.copyOf(classNames.keySet());
    }

    private Mono<PageComponent> load(String name, String className) {
        return Mono.fromCallable(() -> {
                Class<?> componentClass = ClassUtils.forName(className, classLoader);
                PageComponent component = BeanUtils.instantiateClass(componentClass, PageComponent.class);
                log.info("Lazily loaded component {} ({})", name, className);
                return component;
            })
            .subscribeOn(Schedulers.boundedElastic());
    }
}
