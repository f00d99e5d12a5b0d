package net.revivatech.controller;

import java.util.List;
import java.util.Map;
import net.revivatech.application.preview.PreviewManager;
import net.revivatech.controller.dto.PreviewDto;
import net.revivatech.controller.dto.PreviewOptionsPayload;
import net.revivatech.controller.dto.PreviewRequest;
import net.revivatech.controller.support.ErrorResponseUtils;
import net.revivatech.domain.page.PageConfiguration;
import net.revivatech.domain.preview.PreviewValidation;
import net.revivatech.domain.validation.ValidationResult;
import net.revivatech.exception.PreviewNotFoundException;
import net.revivatech.support.config.PageConfigValidator;
import net.revivatech.util.ReactiveControllerUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Authoring previews: create, regenerate, inspect and delete.
 *
 * <p>A configuration that cannot be parsed at all is rejected with 400 and the structural
 * errors. A configuration that parses but breaks a semantic rule is accepted and the
 * preview is stored with status {@code error}.</p>
 */
@RestController
@RequestMapping("/api/previews")
public class PreviewController {

    private static final Logger log = LoggerFactory.getLogger(PreviewController.class);

    private final PreviewManager previewManager;
    private final PageConfigValidator configValidator;

    public PreviewController(PreviewManager previewManager, PageConfigValidator configValidator) {
        this.previewManager = previewManager;
        this.configValidator = configValidator;
    }

    @PostMapping
    public Mono<ResponseEntity<?>> createPreview(@RequestBody PreviewRequest request) {
        ValidationResult parsed = configValidator.parse(request.config());
        if (!parsed.valid()) {
            return Mono.just(invalidConfiguration(parsed));
        }
        return previewManager.createPreview(parsed.config(), PreviewOptionsPayload.toOptions(request.options()))
            .doOnNext(preview -> log.info("Created preview {} with status {}", preview.id(), preview.status()))
            .<ResponseEntity<?>>map(preview -> ResponseEntity.status(HttpStatus.CREATED).body(PreviewDto.fromPreview(preview)));
    }

    @GetMapping
    public Mono<List<PreviewDto>> listPreviews() {
        return previewManager.listPreviews().map(PreviewDto::fromPreview).collectList();
    }

    @GetMapping("/{previewId}")
    public Mono<ResponseEntity<PreviewDto>> getPreview(@PathVariable String previewId) {
        return ReactiveControllerUtils.okOrNotFound(
            previewManager.getPreview(previewId).map(PreviewDto::fromPreview),
            "Loading preview " + previewId);
    }

    @PutMapping("/{previewId}")
    public Mono<ResponseEntity<?>> updatePreview(@PathVariable String previewId,
                                                 @RequestBody Map<String, Object> rawConfig) {
        ValidationResult parsed = configValidator.parse(rawConfig);
        if (!parsed.valid()) {
            return Mono.just(invalidConfiguration(parsed));
        }
        return previewManager.updatePreview(previewId, parsed.config())
            .<ResponseEntity<?>>map(preview -> ResponseEntity.ok(PreviewDto.fromPreview(preview)))
            .onErrorMap(PreviewNotFoundException.class, missing -> notFound(previewId));
    }

    @DeleteMapping("/{previewId}")
    public Mono<ResponseEntity<Void>> deletePreview(@PathVariable String previewId) {
        return previewManager.deletePreview(previewId)
            .map(deleted -> deleted
                ? ResponseEntity.noContent().<Void>build()
                : ResponseEntity.notFound().<Void>build());
    }

    @GetMapping(value = "/{previewId}/content", produces = MediaType.TEXT_HTML_VALUE)
    public Mono<String> getPreviewContent(@PathVariable String previewId) {
        return previewManager.getPreviewContent(previewId)
            .switchIfEmpty(Mono.error(() -> notFound(previewId)));
    }

    /**
     * Scores a configuration without storing a preview.
     */
    @PostMapping("/validate")
    public Mono<ResponseEntity<?>> validatePreview(@RequestBody Map<String, Object> rawConfig) {
        ValidationResult parsed = configValidator.parse(rawConfig);
        if (!parsed.valid()) {
            return Mono.just(invalidConfiguration(parsed));
        }
        PageConfiguration config = parsed.config();
        PreviewValidation validation = previewManager.validatePreview(config);
        return Mono.just(ResponseEntity.ok(validation));
    }

    private static ResponseEntity<?> invalidConfiguration(ValidationResult parsed) {
        return ErrorResponseUtils.invalidConfiguration(parsed.errors());
    }

    private static ResponseStatusException notFound(String previewId) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, new PreviewNotFoundException(previewId).getMessage());
    }
}
