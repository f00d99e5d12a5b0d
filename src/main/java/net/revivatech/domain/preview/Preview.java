package net.revivatech.domain.preview;

import jakarta.annotation.Nullable;
import java.time.Instant;
import net.revivatech.domain.page.PageConfiguration;

/**
 * An authoring preview of a page configuration.
 *
 * @param id preview id, {@code preview-<epochMillis>-<random>}
 * @param config previewed configuration
 * @param options rendering options
 * @param status generation status
 * @param url public preview URL
 * @param thumbnailUrl thumbnail endpoint, set once the preview is ready
 * @param metadata summary and scores, set once the preview is ready
 * @param error failure message when {@code status} is {@link PreviewStatus#ERROR}
 * @param createdAt creation time
 * @param updatedAt last update time
 * @param expiresAt expiry time
 */
public record Preview(
    String id,
    PageConfiguration config,
    PreviewOptions options,
    PreviewStatus status,
    String url,
    @Nullable String thumbnailUrl,
    @Nullable PreviewMetadata metadata,
    @Nullable String error,
    Instant createdAt,
    Instant updatedAt,
    Instant expiresAt
) {

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public Preview ready(String newThumbnailUrl, PreviewMetadata newMetadata, Instant now) {
        return new Preview(id, config, options, PreviewStatus.READY, url, newThumbnailUrl, newMetadata, null,
            createdAt, now, expiresAt);
    }

    public Preview failed(String message, Instant now) {
        return new Preview(id, config, options, PreviewStatus.ERROR, url, thumbnailUrl, metadata, message,
            createdAt, now, expiresAt);
    }

    public Preview regenerating(PageConfiguration newConfig, Instant now) {
        return new Preview(id, newConfig, options, PreviewStatus.GENERATING, url, thumbnailUrl, metadata, null,
            createdAt, now, expiresAt);
    }
}
