package net.revivatech.support.config;

import java.util.Map;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * A store of raw page configuration documents addressed by path, for example
 * {@code services/mac-repair}.
 */
public interface PageConfigSource {

    String name();

    /**
     * Reads the raw document at {@code path}.
     *
     * @return the parsed JSON object, empty when the source has no such document
     */
    Mono<Map<String, Object>> read(String path);

    /**
     * Every document path this source holds.
     */
    Flux<String> listPaths();
}
