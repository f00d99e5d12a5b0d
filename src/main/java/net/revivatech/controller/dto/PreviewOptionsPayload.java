package net.revivatech.controller.dto;

import jakarta.annotation.Nullable;
import java.util.Map;
import java.util.Set;
import net.revivatech.domain.page.DeviceType;
import net.revivatech.domain.preview.PreviewOptions;

/**
 * Preview options as posted by the authoring UI. Device names are lowercase.
 */
public record PreviewOptionsPayload(
    @Nullable String locale,
    @Nullable String device,
    @Nullable String theme,
    @Nullable PreviewOptions.Viewport viewport,
    @Nullable Set<String> features,
    @Nullable Map<String, Object> mockData,
    @Nullable Boolean debug
) {
    public PreviewOptions toOptions() {
        return new PreviewOptions(
            locale,
            DeviceType.fromValue(device).orElse(DeviceType.DESKTOP),
            theme,
            viewport,
            features,
            mockData,
            Boolean.TRUE.equals(debug));
    }

    public static PreviewOptions toOptions(@Nullable PreviewOptionsPayload payload) {
        return payload == null ? PreviewOptions.defaults() : payload.toOptions();
    }
}
