package net.revivatech.util;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import reactor.core.publisher.Mono;

/**
 * Maps single-value lookups (a preview, a component descriptor) onto API responses.
 */
@Slf4j
public final class ReactiveControllerUtils {

    private ReactiveControllerUtils() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * 200 with the value, 404 with no body when the lookup is empty.
     */
    public static <T> Mono<ResponseEntity<T>> okOrNotFound(Mono<T> lookup) {
        return lookup.map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    /**
     * Same as {@link #okOrNotFound(Mono)}, but a failed lookup is logged under {@code operation}
     * and answered with 500 so internal messages never reach the client.
     */
    public static <T> Mono<ResponseEntity<T>> okOrNotFound(Mono<T> lookup, String operation) {
        return okOrNotFound(lookup)
            .onErrorResume(failure -> {
                log.error("{} failed: {}", operation, failure.getMessage(), failure);
                return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build());
            });
    }
}
