package net.revivatech.support.preview;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import net.revivatech.application.preview.PreviewStorage;
import net.revivatech.domain.preview.Preview;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Process-local preview storage. Contents are lost on restart.
 */
@Component
public class InMemoryPreviewStorage implements PreviewStorage {

    private final Map<String, Preview> previews = new ConcurrentHashMap<>();
    private final Map<String, String> contents = new ConcurrentHashMap<>();

    @Override
    public Mono<Void> save(Preview preview) {
        return Mono.fromRunnable(() -> previews.put(preview.id(), preview));
    }

    @Override
    public Mono<Preview> load(String previewId) {
        return Mono.fromSupplier(() -> previews.get(previewId));
    }

    @Override
    public Flux<Preview> loadAll() {
        return Flux.defer(() -> Flux.fromIterable(previews.values()));
    }

    @Override
    public Mono<Boolean> delete(String previewId) {
        return Mono.fromSupplier(() -> {
            contents.remove(previewId);
            return previews.remove(previewId) != null;
        });
    }

    @Override
    public Mono<Void> saveContent(String previewId, String html) {
        return Mono.fromRunnable(() -> contents.put(previewId, html));
    }

    @Override
    public Mono<String> loadContent(String previewId) {
        return Mono.fromSupplier(() -> contents.get(previewId));
    }
}
