package net.revivatech.controller;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import net.revivatech.application.route.DynamicRouteHandler;
import net.revivatech.controller.dto.ComponentCatalogResponse;
import net.revivatech.controller.dto.RevalidationResponse;
import net.revivatech.controller.dto.StaticPathsResponse;
import net.revivatech.domain.validation.ValidationResult;
import net.revivatech.support.component.ComponentInfo;
import net.revivatech.support.component.ComponentRegistry;
import net.revivatech.support.component.ComponentResolver;
import net.revivatech.support.config.PageConfigValidator;
import net.revivatech.util.ReactiveControllerUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Operational endpoints for the page catalog: static paths, revalidation, config
 * validation and the component catalog.
 */
@RestController
@RequestMapping("/api/pages")
public class PageAdminController {

    private static final Logger log = LoggerFactory.getLogger(PageAdminController.class);

    private final DynamicRouteHandler routeHandler;
    private final PageConfigValidator configValidator;
    private final ComponentRegistry componentRegistry;
    private final ComponentResolver componentResolver;

    public PageAdminController(DynamicRouteHandler routeHandler,
                               PageConfigValidator configValidator,
                               ComponentRegistry componentRegistry,
                               ComponentResolver componentResolver) {
        this.routeHandler = routeHandler;
        this.configValidator = configValidator;
        this.componentRegistry = componentRegistry;
        this.componentResolver = componentResolver;
    }

    @GetMapping("/static-paths")
    public Mono<StaticPathsResponse> staticPaths() {
        return routeHandler.generateStaticParams().map(StaticPathsResponse::of);
    }

    /**
     * Drops cached state for a path and reloads its configuration.
     */
    @PostMapping("/revalidate")
    public Mono<RevalidationResponse> revalidate(@RequestParam("path") String path) {
        if (!StringUtils.hasText(path)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "path must not be blank");
        }
        log.info("Revalidation requested for {}", path);
        return routeHandler.revalidate(path).map(revalidated -> new RevalidationResponse(path, revalidated));
    }

    /**
     * Validates a raw configuration document. Problems are reported in the body, never as a 4xx.
     */
    @PostMapping("/validate")
    public ValidationResult validate(@RequestBody Map<String, Object> rawConfig) {
        return configValidator.validate(rawConfig);
    }

    @GetMapping("/components")
    public ComponentCatalogResponse components() {
        List<ComponentInfo> registered = componentRegistry.list().stream()
            .map(componentRegistry::getInfo)
            .flatMap(Optional::stream)
            .toList();
        List<String> lazy = componentResolver.knownComponents().stream()
            .filter(name -> !componentRegistry.has(name))
            .toList();
        return new ComponentCatalogResponse(registered, lazy, registered.size() + lazy.size());
    }

    @GetMapping("/components/{name}")
    public Mono<ResponseEntity<ComponentInfo>> component(@PathVariable String name) {
        return ReactiveControllerUtils.okOrNotFound(Mono.justOrEmpty(componentRegistry.getInfo(name)));
    }
}
