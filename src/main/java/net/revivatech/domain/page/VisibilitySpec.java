package net.revivatech.domain.page;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Visibility rule of a section: every condition must hold and the device entry, when
 * present, must not be {@code false}.
 *
 * @param conditions conditions combined with logical AND
 * @param responsive per-device visibility; a missing device means visible
 */
public record VisibilitySpec(List<VisibilityCondition> conditions, Map<DeviceType, Boolean> responsive) {

    public static final VisibilitySpec ALWAYS = new VisibilitySpec(List.of(), Map.of());

    public VisibilitySpec {
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        if (responsive == null || responsive.isEmpty()) {
            responsive = Map.of();
        } else {
            responsive = Collections.unmodifiableMap(new EnumMap<>(responsive));
        }
    }

    public boolean isVisibleOn(DeviceType device) {
        return !Boolean.FALSE.equals(responsive.get(device));
    }
}
