package net.revivatech.support.component;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import net.revivatech.domain.page.PageComponent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;
import reactor.core.publisher.Mono;

/**
 * Name to component mapping consulted first during section rendering.
 *
 * <p>Every {@link PageComponent} bean is registered at startup under its own name.
 * Aliases resolve through {@link #get(String)} and {@link #has(String)} but are not
 * listed by {@link #list()}.
 */
@Component
public class ComponentRegistry implements ComponentSource {

    private static final Logger log = LoggerFactory.getLogger(ComponentRegistry.class);

    private final Clock clock;
    private final Map<String, Registration> components = new ConcurrentHashMap<>();
    private final Map<String, String> aliases = new ConcurrentHashMap<>();

    @Autowired
    public ComponentRegistry(Clock clock, List<PageComponent> builtInComponents) {
        this.clock = clock;
        builtInComponents.forEach(component -> register(component.name(), component));
        log.info("Component registry initialized with {} components", components.size());
    }

    public ComponentRegistry(Clock clock) {
        this(clock, List.of());
    }

    /**
     * Registers or replaces a component.
     */
    public void register(String name, PageComponent component) {
        Assert.hasText(name, "component name must not be blank");
        Assert.notNull(component, "component must not be null");
        ComponentCategory category = ComponentCategory.infer(name);
        Registration previous = components.put(name, new Registration(component,
            new ComponentInfo(name, category, category.describe(name), clock.instant())));
        if (previous != null) {
            log.warn("Component {} was already registered and has been overwritten", name);
        }
    }

    public void registerBatch(Map<String, PageComponent> batch) {
        batch.forEach(this::register);
    }

    /**
     * Registers {@code alias} as another name for an already registered component.
     *
     * @throws IllegalArgumentException when {@code target} is not registered
     */
    public void registerAlias(String alias, String target) {
        Assert.hasText(alias, "alias must not be blank");
        if (!components.containsKey(target)) {
            throw new IllegalArgumentException("Cannot alias " + alias + " to unregistered component " + target);
        }
        aliases.put(alias, target);
    }

    public Optional<PageComponent> get(String name) {
        return Optional.ofNullable(components.get(canonicalName(name))).map(Registration::component);
    }

    public boolean has(String name) {
        return name != null && components.containsKey(canonicalName(name));
    }

    public boolean unregister(String name) {
        aliases.values().removeIf(target -> target.equals(name));
        return components.remove(name) != null;
    }

    /**
     * Registered names in alphabetical order.
     */
    public List<String> list() {
        return List.copyOf(new TreeSet<>(components.keySet()));
    }

    public Optional<ComponentInfo> getInfo(String name) {
        return Optional.ofNullable(components.get(canonicalName(name))).map(Registration::info);
    }

    @Override
    public Mono<PageComponent> resolve(String name) {
        return Mono.justOrEmpty(get(name));
    }

    @Override
    public boolean knows(String name) {
        return has(name);
    }

    @Override
    public Set<String> names() {
        return Set.copyOf(components.keySet());
    }

    private String canonicalName(String name) {
        if (name == null) {
            return "";
        }
        return aliases.getOrDefault(name, name);
    }

    private record Registration(PageComponent component, ComponentInfo info) {
    }
}
