package net.revivatech.application.route;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.util.StringUtils;

/**
 * Immutable mapping from request paths to page configuration paths.
 *
 * <p>Static routes come from configuration paths ({@code services/index} serves
 * {@code services}; the root configuration is {@code index}). Dynamic routes use
 * {@code [name]} segments that bind one segment each and a {@code *} segment that
 * binds the rest of the path as {@code catchAll}. Dynamic routes are tried in
 * registration order and the first match wins.</p>
 */
public final class RouteTable {

    public static final String INDEX = "index";
    public static final String CATCH_ALL_PARAM = "catchAll";

    private static final String INDEX_SUFFIX = "/" + INDEX;
    private static final String WILDCARD = "*";

    private final Map<String, String> staticRoutes;
    private final List<DynamicRoute> dynamicRoutes;
    private final Map<String, String> redirects;

    private RouteTable(Map<String, String> staticRoutes, List<DynamicRoute> dynamicRoutes, Map<String, String> redirects) {
        this.staticRoutes = staticRoutes;
        this.dynamicRoutes = dynamicRoutes;
        this.redirects = redirects;
    }

    /**
     * @param configuredRoutes dynamic pattern to config path, in priority order
     * @param configPaths every known configuration path; bracketed ones become dynamic routes after the configured ones
     * @param redirects source path to target path
     */
    public static RouteTable of(Map<String, String> configuredRoutes,
                                Collection<String> configPaths,
                                Map<String, String> redirects) {
        Map<String, String> staticRoutes = new LinkedHashMap<>();
        List<DynamicRoute> dynamicRoutes = new ArrayList<>();
        configuredRoutes.forEach((pattern, configPath) -> dynamicRoutes.add(DynamicRoute.of(normalize(pattern), configPath)));
        configPaths.stream().sorted().forEach(configPath -> {
            String route = configPathToRoute(configPath);
            if (isDynamic(route)) {
                dynamicRoutes.add(DynamicRoute.of(route, configPath));
            } else {
                staticRoutes.putIfAbsent(route, configPath);
            }
        });
        Map<String, String> normalizedRedirects = new LinkedHashMap<>();
        redirects.forEach((from, to) -> normalizedRedirects.put(normalize(from), to));
        return new RouteTable(Map.copyOf(staticRoutes), List.copyOf(dynamicRoutes), Map.copyOf(normalizedRedirects));
    }

    /**
     * Strips leading and trailing slashes; the empty path becomes {@code index}.
     */
    public static String normalize(String path) {
        if (path == null) {
            return INDEX;
        }
        String trimmed = path.trim();
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed.isEmpty() ? INDEX : trimmed;
    }

    static String configPathToRoute(String configPath) {
        String route = normalize(configPath);
        if (route.endsWith(INDEX_SUFFIX)) {
            route = route.substring(0, route.length() - INDEX_SUFFIX.length());
        }
        return route;
    }

    private static boolean isDynamic(String route) {
        return route.contains("[") || route.contains(WILDCARD);
    }

    /**
     * Exact route first, then the first dynamic route that matches.
     */
    public Optional<RouteMatch> match(String path) {
        String normalized = normalize(path);
        String exact = staticRoutes.get(normalized);
        if (exact != null) {
            return Optional.of(new RouteMatch(normalized, exact, Map.of()));
        }
        for (DynamicRoute route : dynamicRoutes) {
            Optional<Map<String, String>> params = route.bind(normalized);
            if (params.isPresent()) {
                return Optional.of(new RouteMatch(route.pattern(), route.configPath(), params.get()));
            }
        }
        return Optional.empty();
    }

    public Optional<String> redirectFor(String path) {
        return Optional.ofNullable(redirects.get(normalize(path)));
    }

    /**
     * Routes without parameters, sorted.
     */
    public List<String> staticPaths() {
        return staticRoutes.keySet().stream().sorted().toList();
    }

    public boolean isValidPath(String path) {
        return match(path).isPresent();
    }

    public List<String> dynamicPatterns() {
        return dynamicRoutes.stream().map(DynamicRoute::pattern).toList();
    }

    /**
     * @param route matched route, the pattern for dynamic routes
     * @param configPath configuration serving the route
     * @param params bound parameters
     */
    public record RouteMatch(String route, String configPath, Map<String, String> params) {

        public RouteMatch {
            params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
        }
    }

    private record DynamicRoute(String pattern, String configPath, List<String> segments) {

        static DynamicRoute of(String pattern, String configPath) {
            return new DynamicRoute(pattern, configPath, Arrays.asList(pattern.split("/")));
        }

        Optional<Map<String, String>> bind(String path) {
            String[] parts = path.split("/");
            int wildcard = segments.indexOf(WILDCARD);
            if (wildcard < 0 && parts.length != segments.size()) {
                return Optional.empty();
            }
            if (wildcard >= 0 && parts.length <= wildcard) {
                return Optional.empty();
            }
            Map<String, String> params = new LinkedHashMap<>();
            for (int index = 0; index < segments.size(); index++) {
                String segment = segments.get(index);
                if (WILDCARD.equals(segment)) {
                    params.put(CATCH_ALL_PARAM, String.join("/", Arrays.copyOfRange(parts, index, parts.length)));
                    break;
                }
                if (segment.startsWith("[") && segment.endsWith("]") && segment.length() > 2) {
                    if (!StringUtils.hasText(parts[index])) {
                        return Optional.empty();
                    }
                    params.put(segment.substring(1, segment.length() - 1), parts[index]);
                } else if (!segment.equals(parts[index])) {
                    return Optional.empty();
                }
            }
            return Optional.of(params);
        }
    }
}
