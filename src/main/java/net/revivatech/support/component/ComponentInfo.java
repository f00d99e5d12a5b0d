package net.revivatech.support.component;

import java.time.Instant;

/**
 * Registry introspection entry.
 */
public record ComponentInfo(String name, ComponentCategory category, String description, Instant registeredAt) {
}
