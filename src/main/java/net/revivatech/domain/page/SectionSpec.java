package net.revivatech.domain.page;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One section descriptor inside a page configuration.
 *
 * <p>Props keep declaration order and may contain {@code null} values, so they are
 * wrapped rather than copied through {@link Map#copyOf(Map)}.
 *
 * @param id identifier unique within the page
 * @param component registry name of the component that renders the section
 * @param props JSON-like property tree
 * @param visibility visibility rule, {@link VisibilitySpec#ALWAYS} when omitted
 * @param variants variant names forwarded to the component
 */
public record SectionSpec(
    String id,
    String component,
    Map<String, Object> props,
    VisibilitySpec visibility,
    List<String> variants
) {

    public SectionSpec {
        props = props == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(props));
        visibility = visibility == null ? VisibilitySpec.ALWAYS : visibility;
        variants = variants == null ? List.of() : List.copyOf(variants);
    }

    public SectionSpec(String id, String component, Map<String, Object> props) {
        this(id, component, props, VisibilitySpec.ALWAYS, List.of());
    }
}
