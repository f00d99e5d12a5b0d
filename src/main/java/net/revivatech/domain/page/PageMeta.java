package net.revivatech.domain.page;

import java.util.List;

/**
 * Page-level metadata declared by a page configuration.
 *
 * @param title page title used for the document head
 * @param description meta description
 * @param keywords ordered keyword list
 * @param ogImage Open Graph image path or URL, may be {@code null}
 * @param robots robots directive, {@code index,follow} when omitted
 */
public record PageMeta(
    String title,
    String description,
    List<String> keywords,
    String ogImage,
    String robots
) {

    public static final String DEFAULT_ROBOTS = "index,follow";

    public PageMeta {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        robots = robots == null || robots.isBlank() ? DEFAULT_ROBOTS : robots;
    }

    public PageMeta(String title, String description) {
        this(title, description, List.of(), null, DEFAULT_ROBOTS);
    }

    public PageMeta withTitle(String newTitle) {
        return new PageMeta(newTitle, description, keywords, ogImage, robots);
    }

    public PageMeta withDescription(String newDescription) {
        return new PageMeta(title, newDescription, keywords, ogImage, robots);
    }
}
