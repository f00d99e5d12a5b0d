package net.revivatech.domain.page;

import java.util.Map;

/**
 * A renderable section component.
 *
 * <p>Implementations turn fully resolved props into an HTML fragment. They may throw;
 * the caller isolates failures to the section being rendered.
 */
public interface PageComponent {

    /**
     * Registry name, for example {@code HeroSection}.
     */
    String name();

    /**
     * Renders the component.
     *
     * @param props resolved props, including {@code sectionId}
     * @return HTML fragment
     */
    String render(Map<String, Object> props);
}
