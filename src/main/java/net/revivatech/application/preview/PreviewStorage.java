package net.revivatech.application.preview;

import net.revivatech.domain.preview.Preview;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Persistence port for previews and their rendered documents.
 */
public interface PreviewStorage {

    Mono<Void> save(Preview preview);

    Mono<Preview> load(String previewId);

    Flux<Preview> loadAll();

    /**
     * Removes the preview and its content.
     *
     * @return whether a preview was removed
     */
    Mono<Boolean> delete(String previewId);

    Mono<Void> saveContent(String previewId, String html);

    Mono<String> loadContent(String previewId);
}
