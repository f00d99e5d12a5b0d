package net.revivatech.domain.seo;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Client analytics wiring derived from a page configuration.
 */
public record AnalyticsConfig(
    String pageId,
    String pageType,
    String category,
    Map<String, String> customDimensions,
    List<Event> events,
    List<Goal> goals
) {

    public AnalyticsConfig {
        customDimensions = customDimensions == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(customDimensions));
        events = events == null ? List.of() : List.copyOf(events);
        goals = goals == null ? List.of() : List.copyOf(goals);
    }

    /**
     * @param name event name
     * @param trigger DOM trigger, {@code load} or {@code visible}
     * @param selector CSS selector for visibility triggers, may be {@code null}
     */
    public record Event(String name, String trigger, String selector) {
    }

    /**
     * @param name goal name
     * @param type goal type, {@code duration} or {@code event}
     * @param threshold seconds for duration goals, {@code 0} otherwise
     * @param eventName triggering event for event goals, may be {@code null}
     */
    public record Goal(String name, String type, int threshold, String eventName) {
    }
}
