package net.revivatech.domain.page;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Outcome of evaluating a section's visibility rule against a render context.
 *
 * @param conditionsMet whether every condition held
 * @param devices per-device visibility after defaults are applied
 * @param visible final decision for the context's device
 */
public record ResolvedVisibility(boolean conditionsMet, Map<DeviceType, Boolean> devices, boolean visible) {

    public ResolvedVisibility {
        devices = devices == null || devices.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(devices));
    }
}
