package net.revivatech.domain.page;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of resolving a request path to a page.
 */
public sealed interface RouteResolution
    permits RouteResolution.Found, RouteResolution.Redirect, RouteResolution.NotFound {

    /**
     * A page configuration matched the path.
     *
     * @param config loaded and validated configuration
     * @param params parameters bound from the route pattern
     * @param configPath path of the configuration, for example {@code services/mac-repair}
     */
    record Found(PageConfiguration config, Map<String, String> params, String configPath) implements RouteResolution {

        public Found {
            params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
        }
    }

    record Redirect(String target) implements RouteResolution {
    }

    record NotFound(String path) implements RouteResolution {
    }
}
