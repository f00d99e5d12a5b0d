package net.revivatech.domain.page;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of visibility condition kinds.
 */
public enum ConditionType {
    FEATURE,
    USER,
    TIME,
    CUSTOM;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ConditionType> fromValue(String candidate) {
        if (candidate == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(type -> type.value().equals(candidate.trim().toLowerCase(Locale.ROOT)))
            .findFirst();
    }
}
