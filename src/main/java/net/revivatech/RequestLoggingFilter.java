package net.revivatech;

import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

/**
 * Logs page and API requests with their status and duration.
 *
 * <p>Static assets are skipped unless they are requested under {@code /api}.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestLoggingFilter implements WebFilter {

    private static final Logger logger = LoggerFactory.getLogger(RequestLoggingFilter.class);

    private static final Set<String> SKIPPED_EXTENSIONS =
        Set.of("png", "jpg", "jpeg", "gif", "webp", "svg", "css", "js", "map", "ico", "woff", "woff2");

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        ServerHttpRequest request = exchange.getRequest();
        String path = request.getPath().value();
        if (!shouldLog(path)) {
            return chain.filter(exchange);
        }
        long startTime = System.currentTimeMillis();
        logger.info("Incoming request: {} {} from {}", request.getMethod(), path,
            request.getRemoteAddress() == null ? "unknown" : request.getRemoteAddress().getHostString());
        return chain.filter(exchange)
            .doFinally(signal -> {
                HttpStatusCode status = exchange.getResponse().getStatusCode();
                logger.info("Completed request: {} {} with status {} in {} ms", request.getMethod(), path,
                    status == null ? 200 : status.value(), System.currentTimeMillis() - startTime);
            });
    }

    static boolean shouldLog(String path) {
        if (path.startsWith("/api")) {
            return true;
        }
        int dotIdx = path.lastIndexOf('.');
        if (dotIdx <= path.lastIndexOf('/') || dotIdx == path.length() - 1) {
            return true;
        }
        return !SKIPPED_EXTENSIONS.contains(path.substring(dotIdx + 1).toLowerCase(Locale.ROOT));
    }
}
