package net.revivatech.domain.page;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Device classes a section can be shown or hidden on.
 */
public enum DeviceType {
    MOBILE,
    TABLET,
    DESKTOP;

    /**
     * Lowercase name as it appears in page configurations and prop suffixes.
     */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<DeviceType> fromValue(String candidate) {
        if (candidate == null) {
            return Optional.empty();
        }
        String normalized = candidate.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(type -> type.value().equals(normalized))
            .findFirst();
    }
}
