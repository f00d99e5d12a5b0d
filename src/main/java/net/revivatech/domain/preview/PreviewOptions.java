package net.revivatech.domain.preview;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import net.revivatech.domain.page.DeviceType;
import net.revivatech.domain.page.RenderContext;

/**
 * Rendering options for an authoring preview.
 *
 * @param locale content locale
 * @param device simulated device
 * @param theme theme name
 * @param viewport simulated viewport
 * @param features feature flags added on top of the configuration's own
 * @param mockData sample data made available to authors
 * @param debug whether debug output is requested
 */
public record PreviewOptions(
    String locale,
    DeviceType device,
    String theme,
    Viewport viewport,
    Set<String> features,
    Map<String, Object> mockData,
    boolean debug
) {

    public PreviewOptions {
        locale = locale == null || locale.isBlank() ? RenderContext.DEFAULT_LOCALE : locale;
        device = device == null ? DeviceType.DESKTOP : device;
        theme = theme == null || theme.isBlank() ? RenderContext.DEFAULT_THEME : theme;
        viewport = viewport == null ? Viewport.DEFAULT : viewport;
        features = features == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(features));
        mockData = mockData == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(mockData));
    }

    public static PreviewOptions defaults() {
        return new PreviewOptions(null, null, null, null, null, null, false);
    }

    public record Viewport(int width, int height) {
        public static final Viewport DEFAULT = new Viewport(1200, 800);
    }
}
