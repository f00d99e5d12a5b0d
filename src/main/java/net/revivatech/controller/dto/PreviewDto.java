package net.revivatech.controller.dto;

import jakarta.annotation.Nullable;
import java.time.Instant;
import java.util.Locale;
import net.revivatech.domain.preview.Preview;
import net.revivatech.domain.preview.PreviewMetadata;

/**
 * API projection of a preview. The previewed configuration itself is not echoed back.
 */
public record PreviewDto(
    String id,
    String status,
    String url,
    @Nullable String thumbnailUrl,
    @Nullable PreviewMetadata metadata,
    @Nullable String error,
    Instant createdAt,
    Instant updatedAt,
    Instant expiresAt
) {
    public static PreviewDto fromPreview(Preview preview) {
        return new PreviewDto(
            preview.id(),
            preview.status().name().toLowerCase(Locale.ROOT),
            preview.url(),
            preview.thumbnailUrl(),
            preview.metadata(),
            preview.error(),
            preview.createdAt(),
            preview.updatedAt(),
            preview.expiresAt()
        );
    }
}
