package net.revivatech.support.content;

import java.util.Map;
import net.revivatech.domain.content.ContentEntry;
import reactor.core.publisher.Mono;

/**
 * A store of localized content addressed by dotted keys such as {@code home.hero.title}.
 *
 * <p>Implementations complete empty for unknown keys and signal errors only for
 * failures of the store itself.
 */
public interface ContentSource {

    /**
     * Short identifier used in logs.
     */
    String name();

    Mono<Boolean> exists(String key, String locale);

    Mono<ContentEntry> load(String key, String locale);

    /**
     * All raw values below {@code namespace}; the empty namespace means everything.
     */
    Mono<Map<String, Object>> loadNamespace(String namespace, String locale);
}
