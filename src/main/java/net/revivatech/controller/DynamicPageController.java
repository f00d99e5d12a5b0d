package net.revivatech.controller;

import net.revivatech.application.preview.PreviewManager;
import net.revivatech.application.route.DynamicRouteHandler;
import net.revivatech.controller.support.RenderContextFactory;
import net.revivatech.support.html.PageDocumentRenderer;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Serves every configured page. API and actuator paths are mapped more specifically and
 * never reach the catch-all.
 */
@RestController
public class DynamicPageController {

    private final DynamicRouteHandler routeHandler;
    private final RenderContextFactory renderContextFactory;
    private final PreviewManager previewManager;
    private final PageDocumentRenderer documentRenderer;

    public DynamicPageController(DynamicRouteHandler routeHandler,
                                 RenderContextFactory renderContextFactory,
                                 PreviewManager previewManager,
                                 PageDocumentRenderer documentRenderer) {
        this.routeHandler = routeHandler;
        this.renderContextFactory = renderContextFactory;
        this.previewManager = previewManager;
        this.documentRenderer = documentRenderer;
    }

    @GetMapping(value = "/**", produces = MediaType.TEXT_HTML_VALUE)
    public Mono<ResponseEntity<String>> page(ServerHttpRequest request) {
        String path = request.getPath().pathWithinApplication().value();
        return routeHandler.handle(path, renderContextFactory.fromRequest(request));
    }

    /**
     * Public URL of a stored preview document. Previews are never cached.
     */
    @GetMapping(value = "/preview/{previewId}", produces = MediaType.TEXT_HTML_VALUE)
    public Mono<ResponseEntity<String>> preview(@PathVariable String previewId) {
        return previewManager.getPreviewContent(previewId)
            .map(html -> ResponseEntity.ok()
                .contentType(MediaType.TEXT_HTML)
                .cacheControl(CacheControl.noStore())
                .body(html))
            .defaultIfEmpty(ResponseEntity.status(HttpStatus.NOT_FOUND)
                .contentType(MediaType.TEXT_HTML)
                .body(documentRenderer.renderStatusPage(404, "Preview not found",
                    "This preview does not exist or has expired.")));
    }
}
