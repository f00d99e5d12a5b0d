package net.revivatech.domain.page;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * A page produced from a validated configuration.
 *
 * <p>{@link #sections()} holds exactly one entry per configured section, in
 * configuration order; hidden sections carry a {@link RenderNode.HiddenNode}.
 *
 * @param config source configuration
 * @param sections rendered sections
 * @param createdAt creation time
 */
public record PageInstance(PageConfiguration config, List<RenderedSection> sections, Instant createdAt) {

    public PageInstance {
        sections = sections == null ? List.of() : List.copyOf(sections);
    }

    public PageMeta meta() {
        return config.meta();
    }

    public String layout() {
        return config.layout();
    }

    public Set<String> features() {
        return config.features();
    }
}
