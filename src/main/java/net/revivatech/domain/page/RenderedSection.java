package net.revivatech.domain.page;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A section after rendering.
 *
 * @param id section id
 * @param component configured component name
 * @param node render result
 * @param props props after transformation; empty for hidden sections
 * @param visibility resolved visibility
 */
public record RenderedSection(
    String id,
    String component,
    RenderNode node,
    Map<String, Object> props,
    ResolvedVisibility visibility
) {

    public RenderedSection {
        props = props == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(props));
    }

    public boolean visible() {
        return visibility.visible();
    }
}
