package net.revivatech.domain.page;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Analytics classification of a page.
 *
 * @param pageType page type such as {@code landing}, {@code service} or {@code blog}
 * @param category business category
 * @param customDimensions extra dimensions forwarded to the analytics configuration
 */
public record AnalyticsSpec(String pageType, String category, Map<String, String> customDimensions) {

    public AnalyticsSpec {
        customDimensions = customDimensions == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(customDimensions));
    }
}
