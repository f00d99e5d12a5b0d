package net.revivatech.config;

import java.time.Duration;
import java.util.concurrent.TimeoutException;
import net.revivatech.application.route.RouteResolver;
import net.revivatech.support.component.ComponentResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.health.contributor.Health;
import org.springframework.boot.health.contributor.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Reports whether the page catalog can be listed and how many pages and components it offers.
 */
@Component("pageCatalogHealthIndicator")
public class PageCatalogHealthIndicator implements ReactiveHealthIndicator {

    private static final Logger logger = LoggerFactory.getLogger(PageCatalogHealthIndicator.class);
    private static final Duration CHECK_TIMEOUT = Duration.ofSeconds(5);

    private final RouteResolver routeResolver;
    private final ComponentResolver componentResolver;

    public PageCatalogHealthIndicator(RouteResolver routeResolver, ComponentResolver componentResolver) {
        this.routeResolver = routeResolver;
        this.componentResolver = componentResolver;
    }

    @Override
    public Mono<Health> health() {
        return routeResolver.getStaticPaths()
            .map(paths -> {
                Health.Builder builder = paths.isEmpty() ? Health.down() : Health.up();
                return builder
                    .withDetail("page_catalog_status", paths.isEmpty() ? "empty" : "available")
                    .withDetail("static_pages", paths.size())
                    .withDetail("components", componentResolver.knownComponents().size())
                    .build();
            })
            .timeout(CHECK_TIMEOUT)
            .onErrorResume(TimeoutException.class, ex -> Mono.just(Health.down()
                .withDetail("page_catalog_status", "timeout")
                .withDetail("message", String.valueOf(ex.getMessage()))
                .build()))
            .onErrorResume(ex -> {
                logger.warn("Page catalog health check failed: {}", ex.getMessage());
                return Mono.just(Health.down()
                    .withDetail("page_catalog_status", "unavailable")
                    .withDetail("error", ex.getClass().getName())
                    .withDetail("message", String.valueOf(ex.getMessage()))
                    .build());
            });
    }
}
