package net.revivatech.support.component;

import java.util.Set;
import net.revivatech.domain.page.PageComponent;
import reactor.core.publisher.Mono;

/**
 * Something that can produce a component by name.
 *
 * <p>Sources are consulted in order and the first one that emits wins. A source
 * that does not know a name completes empty.
 */
public interface ComponentSource {

    Mono<PageComponent> resolve(String name);

    /**
     * Whether this source could produce {@code name} without loading it.
     */
    boolean knows(String name);

    /**
     * Names this source can produce.
     */
    Set<String> names();
}
