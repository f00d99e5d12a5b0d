package net.revivatech.application.route;

import com.github.benmanes.caffeine.cache.Cache;
import java.net.URI;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import net.revivatech.application.page.PageFactory;
import net.revivatech.application.seo.PageMetadataUseCase;
import net.revivatech.config.CacheFactory;
import net.revivatech.config.PageEngineProperties;
import net.revivatech.domain.page.PageConfiguration;
import net.revivatech.domain.page.RenderContext;
import net.revivatech.domain.page.RouteResolution;
import net.revivatech.domain.page.UserDescriptor;
import net.revivatech.domain.seo.SeoMetadata;
import net.revivatech.domain.validation.ValidationResult;
import net.revivatech.support.config.PageConfigLoader;
import net.revivatech.support.html.PageDocumentRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Turns a request path into an HTML response.
 *
 * <p>Resolved routes are cached for {@code pages.resolved-page-cache-ttl}. Redirects
 * answer 307, unknown paths 404, pages requiring sign-in redirect anonymous visitors
 * and refuse users without an allowed role with 403, and any unexpected failure
 * answers 500.</p>
 */
@Service
public class DynamicRouteHandler {

    private static final Logger log = LoggerFactory.getLogger(DynamicRouteHandler.class);

    public static final String PAGE_TYPE_HEADER = "X-Page-Type";
    public static final String CONFIG_PATH_HEADER = "X-Config-Path";
    static final String DYNAMIC_PAGE_TYPE = "dynamic";

    static final String CACHE_CONTROL_PRIVATE = "no-cache, no-store, must-revalidate";
    static final String CACHE_CONTROL_REALTIME = "no-cache, must-revalidate";
    static final String CACHE_CONTROL_PUBLIC = "public, max-age=3600, s-maxage=7200";

    private final RouteResolver routeResolver;
    private final PageFactory pageFactory;
    private final PageMetadataUseCase metadataUseCase;
    private final PageDocumentRenderer documentRenderer;
    private final PageConfigLoader configLoader;
    private final Cache<String, RouteResolution> resolvedPages;

    public DynamicRouteHandler(RouteResolver routeResolver,
                               PageFactory pageFactory,
                               PageMetadataUseCase metadataUseCase,
                               PageDocumentRenderer documentRenderer,
                               PageConfigLoader configLoader,
                               CacheFactory cacheFactory,
                               PageEngineProperties properties) {
        this.routeResolver = routeResolver;
        this.pageFactory = pageFactory;
        this.metadataUseCase = metadataUseCase;
        this.documentRenderer = documentRenderer;
        this.configLoader = configLoader;
        this.resolvedPages = cacheFactory.createCache("resolvedPages", 500, properties.getResolvedPageCacheTtl());
        configLoader.watch(change -> {
            log.debug("Configuration {} changed, dropping resolved pages", change.path());
            resolvedPages.invalidateAll();
        });
    }

    public Mono<ResponseEntity<String>> handle(String path, RenderContext context) {
        String normalized = RouteTable.normalize(path);
        return resolvePageConfig(normalized)
            .flatMap(resolution -> respond(resolution, normalized, context))
            .onErrorResume(failure -> {
                log.error("Failed to render page {}", normalized, failure);
                return Mono.just(statusPage(HttpStatus.INTERNAL_SERVER_ERROR, "Something went wrong",
                    "The page could not be rendered. Please try again later."));
            });
    }

    /**
     * Resolves the route, keeping configurations that pass page validation in the cache.
     */
    public Mono<RouteResolution> resolvePageConfig(String path) {
        String normalized = RouteTable.normalize(path);
        RouteResolution cached = resolvedPages.getIfPresent(normalized);
        if (cached != null) {
            return Mono.just(cached);
        }
        return routeResolver.resolve(normalized)
            .map(resolution -> {
                if (!(resolution instanceof RouteResolution.Found found)) {
                    return resolution;
                }
                ValidationResult validation = pageFactory.validateConfig(found.config());
                if (!validation.valid()) {
                    log.warn("Configuration {} for {} failed page validation: {}", found.configPath(), normalized,
                        validation.errorSummary());
                    return new RouteResolution.NotFound(normalized);
                }
                resolvedPages.put(normalized, found);
                return found;
            });
    }

    public Mono<List<String>> generateStaticParams() {
        return routeResolver.getStaticPaths()
            .onErrorResume(failure -> {
                log.error("Failed to list static paths", failure);
                return Mono.just(List.of());
            });
    }

    /**
     * Drops cached state for {@code path} and reloads its configuration.
     *
     * @return {@code true} when a valid configuration was reloaded
     */
    public Mono<Boolean> revalidate(String path) {
        String normalized = RouteTable.normalize(path);
        resolvedPages.invalidate(normalized);
        return routeResolver.refresh()
            .flatMap(routes -> routes.match(normalized)
                .map(match -> configLoader.reload(match.configPath()).hasElement())
                .orElseGet(() -> Mono.just(false)))
            .doOnNext(reloaded -> log.info("Revalidated {}: {}", normalized, reloaded ? "reloaded" : "no valid configuration"))
            .onErrorResume(failure -> {
                log.error("Failed to revalidate {}", normalized, failure);
                return Mono.just(false);
            });
    }

    static String cacheControl(PageConfiguration config) {
        if (config.requiresAuth()) {
            return CACHE_CONTROL_PRIVATE;
        }
        if (config.hasFeature("realtime")) {
            return CACHE_CONTROL_REALTIME;
        }
        return CACHE_CONTROL_PUBLIC;
    }

    private Mono<ResponseEntity<String>> respond(RouteResolution resolution, String path, RenderContext context) {
        if (resolution instanceof RouteResolution.Redirect redirect) {
            return Mono.just(redirect(redirect.target(), null));
        }
        if (resolution instanceof RouteResolution.NotFound) {
            log.debug("No page for {}", path);
            return Mono.just(statusPage(HttpStatus.NOT_FOUND, "Page not found",
                "The page you requested could not be found."));
        }
        RouteResolution.Found found = (RouteResolution.Found) resolution;
        PageConfiguration config = found.config();
        if (config.requiresAuth()) {
            UserDescriptor user = context.user();
            if (user == null) {
                return Mono.just(redirect(config.auth().redirectTo(), CACHE_CONTROL_PRIVATE));
            }
            if (!config.auth().allowsRole(user.role())) {
                log.info("User {} with role {} refused access to {}", user.id(), user.role(), path);
                return Mono.just(statusPage(HttpStatus.FORBIDDEN, "Access denied",
                    "You do not have permission to view this page."));
            }
        }
        SeoMetadata metadata = metadataUseCase.generateMetadata(config, found.params(), path);
        Set<String> features = new LinkedHashSet<>(config.features());
        features.addAll(context.features());
        return pageFactory.createPage(config, context.withParams(found.params()).withFeatures(features))
            .map(page -> ResponseEntity.ok()
                .contentType(MediaType.TEXT_HTML)
                .header(HttpHeaders.CACHE_CONTROL, cacheControl(config))
                .header(PAGE_TYPE_HEADER, DYNAMIC_PAGE_TYPE)
                .header(CONFIG_PATH_HEADER, found.configPath())
                .body(documentRenderer.render(page, metadata, context.locale(), context.theme())));
    }

    private static ResponseEntity<String> redirect(String target, String cacheControl) {
        String location = target.startsWith("/") || target.startsWith("http") ? target : "/" + target;
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(HttpStatus.TEMPORARY_REDIRECT)
            .location(URI.create(location));
        if (cacheControl != null) {
            builder.header(HttpHeaders.CACHE_CONTROL, cacheControl);
        }
        return builder.build();
    }

    private ResponseEntity<String> statusPage(HttpStatus status, String title, String message) {
        return ResponseEntity.status(status)
            .contentType(MediaType.TEXT_HTML)
            .header(HttpHeaders.CACHE_CONTROL, CACHE_CONTROL_PRIVATE)
            .body(documentRenderer.renderStatusPage(status.value(), title, message));
    }
}
