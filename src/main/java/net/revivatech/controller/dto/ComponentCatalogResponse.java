package net.revivatech.controller.dto;

import java.util.List;
import net.revivatech.support.component.ComponentInfo;

/**
 * Registered components plus the lazily loaded names that have not been loaded yet.
 */
public record ComponentCatalogResponse(List<ComponentInfo> components, List<String> lazy, int count) {
}
