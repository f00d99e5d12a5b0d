package net.revivatech.application.preview;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.revivatech.application.page.PageFactory;
import net.revivatech.application.seo.PageMetadataUseCase;
import net.revivatech.config.PageEngineProperties;
import net.revivatech.domain.page.DeviceContext;
import net.revivatech.domain.page.PageConfiguration;
import net.revivatech.domain.page.RenderContext;
import net.revivatech.domain.page.SectionSpec;
import net.revivatech.domain.preview.Preview;
import net.revivatech.domain.preview.PreviewMetadata;
import net.revivatech.domain.preview.PreviewOptions;
import net.revivatech.domain.preview.PreviewStatus;
import net.revivatech.domain.preview.PreviewValidation;
import net.revivatech.domain.preview.ScoreReport;
import net.revivatech.domain.seo.SeoMetadata;
import net.revivatech.domain.validation.ValidationResult;
import net.revivatech.exception.PreviewNotFoundException;
import net.revivatech.support.html.PageDocumentRenderer;
import net.revivatech.util.IdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Creates, regenerates and expires authoring previews.
 *
 * <p>A preview whose configuration is invalid, whose performance score is below
 * {@value #MIN_PERFORMANCE_SCORE} or whose page fails to render is still stored, with status {@link PreviewStatus#ERROR} and the failure message. Expired
 * previews are invisible to readers and removed on read or by {@link #purgeExpired()}.</p>
 */
@Service
public class PreviewManager {

    private static final Logger log = LoggerFactory.getLogger(PreviewManager.class);

    static final int MIN_PERFORMANCE_SCORE = 80;

    private final PageFactory pageFactory;
    private final PageMetadataUseCase metadataUseCase;
    private final PageDocumentRenderer documentRenderer;
    private final PreviewScoringPolicy scoringPolicy;
    private final PreviewStorage storage;
    private final Clock clock;
    private final Duration ttl;

    private final Counter readyCounter;
    private final Counter errorCounter;

    @Autowired
    public PreviewManager(PageFactory pageFactory,
                          PageMetadataUseCase metadataUseCase,
                          PageDocumentRenderer documentRenderer,
                          PreviewScoringPolicy scoringPolicy,
                          PreviewStorage storage,
                          Clock clock,
                          PageEngineProperties properties,
                          MeterRegistry meterRegistry) {
        this(pageFactory, metadataUseCase, documentRenderer, scoringPolicy, storage, clock,
            properties.getPreview().getTtl(), meterRegistry);
    }

    public PreviewManager(PageFactory pageFactory,
                          PageMetadataUseCase metadataUseCase,
                          PageDocumentRenderer documentRenderer,
                          PreviewScoringPolicy scoringPolicy,
                          PreviewStorage storage,
                          Clock clock,
                          Duration ttl,
                          MeterRegistry meterRegistry) {
        this.pageFactory = pageFactory;
        this.metadataUseCase = metadataUseCase;
        this.documentRenderer = documentRenderer;
        this.scoringPolicy = scoringPolicy;
        this.storage = storage;
        this.clock = clock;
        this.ttl = ttl;
        this.readyCounter = meterRegistry.counter("pages.preview.ready");
        this.errorCounter = meterRegistry.counter("pages.preview.error");
    }

    public Mono<Preview> createPreview(PageConfiguration config, PreviewOptions options) {
        Instant now = clock.instant();
        String previewId = IdGenerator.previewId(now);
        Preview preview = new Preview(previewId, config, options == null ? PreviewOptions.defaults() : options,
            PreviewStatus.GENERATING, "/preview/" + previewId, null, null, null, now, now, now.plus(ttl));
        return storage.save(preview).then(generate(preview));
    }

    /**
     * Replaces the configuration of an existing preview and regenerates it.
     *
     * @throws PreviewNotFoundException (as an error signal) when the preview is missing or expired
     */
    public Mono<Preview> updatePreview(String previewId, PageConfiguration config) {
        return getPreview(previewId)
            .switchIfEmpty(Mono.error(() -> new PreviewNotFoundException(previewId)))
            .map(existing -> existing.regenerating(config, clock.instant()))
            .flatMap(regenerating -> storage.save(regenerating).then(generate(regenerating)));
    }

    public Mono<Boolean> deletePreview(String previewId) {
        return storage.delete(previewId)
            .doOnNext(deleted -> {
                if (deleted) {
                    log.info("Deleted preview {}", previewId);
                }
            });
    }

    /**
     * @return the preview, empty when missing or expired
     */
    public Mono<Preview> getPreview(String previewId) {
        return storage.load(previewId)
            .flatMap(preview -> {
                if (preview.isExpired(clock.instant())) {
                    log.debug("Preview {} expired at {}", previewId, preview.expiresAt());
                    return storage.delete(previewId).then(Mono.<Preview>empty());
                }
                return Mono.just(preview);
            });
    }

    /**
     * Rendered HTML of a ready preview.
     */
    public Mono<String> getPreviewContent(String previewId) {
        return getPreview(previewId).flatMap(preview -> storage.loadContent(previewId));
    }

    /**
     * Unexpired previews, newest first.
     */
    public Flux<Preview> listPreviews() {
        Instant now = clock.instant();
        return storage.loadAll()
            .filter(preview -> !preview.isExpired(now))
            .sort(Comparator.comparing(Preview::createdAt).reversed());
    }

    public PreviewValidation validatePreview(PageConfiguration config) {
        ValidationResult validation = pageFactory.validateConfig(config);
        ScoreReport performance = scoringPolicy.performance(config);
        return new PreviewValidation(
            validation.valid() && performance.score() >= MIN_PERFORMANCE_SCORE,
            validation,
            performance,
            scoringPolicy.accessibility(config),
            scoringPolicy.seo(config));
    }

    /**
     * Removes every expired preview.
     *
     * @return number of previews removed
     */
    public Mono<Integer> purgeExpired() {
        Instant now = clock.instant();
        return storage.loadAll()
            .filter(preview -> preview.isExpired(now))
            .flatMap(preview -> storage.delete(preview.id()))
            .filter(Boolean::booleanValue)
            .count()
            .map(Long::intValue);
    }

    private Mono<Preview> generate(Preview preview) {
        PageConfiguration config = preview.config();
        PreviewValidation validation = validatePreview(config);
        if (!validation.valid()) {
            return fail(preview, rejectionMessage(validation));
        }
        RenderContext context = previewContext(config, preview.options());
        SeoMetadata seo = metadataUseCase.generateMetadata(config, Map.of(), preview.url());
        return pageFactory.createPage(config, context)
            .map(page -> documentRenderer.render(page, seo, context.locale(), context.theme()))
            .flatMap(html -> storage.saveContent(preview.id(), html))
            .then(Mono.fromSupplier(() -> preview.ready("/api/previews/" + preview.id() + "/thumbnail",
                metadata(config), clock.instant())))
            .flatMap(ready -> storage.save(ready).thenReturn(ready))
            .doOnNext(ready -> {
                readyCounter.increment();
                log.info("Preview {} ready with {} sections", ready.id(), config.sections().size());
            })
            .onErrorResume(failure -> fail(preview, String.valueOf(failure.getMessage())));
    }

    private static String rejectionMessage(PreviewValidation validation) {
        if (!validation.configValidation().valid()) {
            return "Invalid configuration: " + validation.configValidation().errorSummary();
        }
        return "Performance score " + validation.performance().score()
            + " is below the minimum of " + MIN_PERFORMANCE_SCORE;
    }

    private Mono<Preview> fail(Preview preview, String message) {
        errorCounter.increment();
        log.warn("Preview {} failed: {}", preview.id(), message);
        Preview failed = preview.failed(message, clock.instant());
        return storage.save(failed).thenReturn(failed);
    }

    private PreviewMetadata metadata(PageConfiguration config) {
        List<String> componentsUsed = config.sections().stream().map(SectionSpec::component).distinct().toList();
        return new PreviewMetadata(
            config.meta().title(),
            config.meta().description(),
            config.sections().size(),
            componentsUsed,
            config.features(),
            scoringPolicy.performance(config),
            scoringPolicy.accessibility(config),
            scoringPolicy.seo(config));
    }

    private static RenderContext previewContext(PageConfiguration config, PreviewOptions options) {
        Set<String> features = new LinkedHashSet<>(config.features());
        features.addAll(options.features());
        DeviceContext device = new DeviceContext(options.device(), options.viewport().width(),
            options.viewport().height(), "preview");
        return new RenderContext(options.locale(), null, features, device, options.theme(), true, Map.of());
    }
}
