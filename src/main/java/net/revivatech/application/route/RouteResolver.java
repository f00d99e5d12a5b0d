package net.revivatech.application.route;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import net.revivatech.config.PageEngineProperties;
import net.revivatech.domain.page.RouteResolution;
import net.revivatech.support.config.PageConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Resolves request paths to page configurations, redirects or not-found outcomes.
 *
 * <p>The route table is built from the configured dynamic routes and the paths the
 * configuration sources list, on first use and again after {@link #refresh()}.</p>
 */
@Service
public class RouteResolver {

    private static final Logger log = LoggerFactory.getLogger(RouteResolver.class);

    private final PageConfigLoader configLoader;
    private final Map<String, String> configuredRoutes;
    private final Map<String, String> redirects;
    private final AtomicReference<RouteTable> table = new AtomicReference<>();

    public RouteResolver(PageConfigLoader configLoader, PageEngineProperties properties) {
        this.configLoader = configLoader;
        this.configuredRoutes = new LinkedHashMap<>();
        properties.getRoutes().forEach(route -> configuredRoutes.put(route.getPattern(), route.getConfig()));
        this.redirects = new LinkedHashMap<>();
        properties.getRedirects().forEach(redirect -> redirects.put(redirect.getFrom(), redirect.getTo()));
    }

    /**
     * Exact route, then dynamic routes, then the redirect table.
     */
    public Mono<RouteResolution> resolve(String path) {
        String normalized = RouteTable.normalize(path);
        return routeTable().flatMap(routes -> routes.match(normalized)
            .map(match -> configLoader.load(match.configPath())
                .<RouteResolution>map(config -> new RouteResolution.Found(config, match.params(), match.configPath()))
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    log.warn("Route {} maps to {} but no valid configuration was loaded", normalized, match.configPath());
                    return redirectOrNotFound(routes, normalized);
                })))
            .orElseGet(() -> Mono.just(redirectOrNotFound(routes, normalized))));
    }

    public Mono<List<String>> getStaticPaths() {
        return routeTable().map(RouteTable::staticPaths);
    }

    public Mono<Boolean> isValidPath(String path) {
        return routeTable().map(routes -> routes.isValidPath(path));
    }

    /**
     * Rebuilds the route table from the configuration sources.
     */
    public Mono<RouteTable> refresh() {
        return configLoader.listPaths()
            .collectList()
            .map(paths -> RouteTable.of(configuredRoutes, paths, redirects))
            .doOnNext(built -> {
                table.set(built);
                log.info("Route table built with {} static routes and dynamic patterns {}",
                    built.staticPaths().size(), built.dynamicPatterns());
            });
    }

    private Mono<RouteTable> routeTable() {
        RouteTable current = table.get();
        return current != null ? Mono.just(current) : refresh();
    }

    private static RouteResolution redirectOrNotFound(RouteTable routes, String normalized) {
        return routes.redirectFor(normalized)
            .<RouteResolution>map(RouteResolution.Redirect::new)
            .orElseGet(() -> new RouteResolution.NotFound(normalized));
    }
}
