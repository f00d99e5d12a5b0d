package net.revivatech.domain.page;

import jakarta.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Per-request inputs to rendering.
 *
 * @param locale content locale, for example {@code en}
 * @param user signed-in visitor, {@code null} when anonymous
 * @param features active feature flags
 * @param device target device
 * @param theme active theme name
 * @param preview whether the page is rendered for an authoring preview
 * @param params route parameters bound during resolution
 */
public record RenderContext(
    String locale,
    @Nullable UserDescriptor user,
    Set<String> features,
    DeviceContext device,
    String theme,
    boolean preview,
    Map<String, String> params
) {

    public static final String DEFAULT_LOCALE = "en";
    public static final String DEFAULT_THEME = "light";

    public RenderContext {
        locale = locale == null || locale.isBlank() ? DEFAULT_LOCALE : locale;
        features = features == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(features));
        device = device == null ? DeviceContext.DESKTOP : device;
        theme = theme == null || theme.isBlank() ? DEFAULT_THEME : theme;
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public static RenderContext defaults() {
        return new RenderContext(DEFAULT_LOCALE, null, Set.of(), DeviceContext.DESKTOP, DEFAULT_THEME, false, Map.of());
    }

    public Optional<UserDescriptor> currentUser() {
        return Optional.ofNullable(user);
    }

    public DeviceType deviceType() {
        return device.type();
    }

    public RenderContext withUser(@Nullable UserDescriptor newUser) {
        return new RenderContext(locale, newUser, features, device, theme, preview, params);
    }

    public RenderContext withFeatures(Set<String> newFeatures) {
        return new RenderContext(locale, user, newFeatures, device, theme, preview, params);
    }

    public RenderContext withParams(Map<String, String> newParams) {
        return new RenderContext(locale, user, features, device, theme, preview, newParams);
    }

    public RenderContext withDevice(DeviceContext newDevice) {
        return new RenderContext(locale, user, features, newDevice, theme, preview, params);
    }
}
