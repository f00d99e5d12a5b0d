package net.revivatech.application.page;

import java.time.Clock;
import net.revivatech.application.render.SectionRenderer;
import net.revivatech.domain.page.PageConfiguration;
import net.revivatech.domain.page.PageInstance;
import net.revivatech.domain.page.PageMeta;
import net.revivatech.domain.page.RenderContext;
import net.revivatech.domain.page.RenderedSection;
import net.revivatech.domain.page.SectionSpec;
import net.revivatech.domain.validation.ValidationResult;
import net.revivatech.exception.FatalConfigException;
import net.revivatech.exception.PageCreationException;
import net.revivatech.support.config.PageConfigValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Builds {@link PageInstance}s from page configurations.
 *
 * <p>Sections are rendered concurrently but assembled in configuration order. A
 * configuration with validation errors is refused with {@link FatalConfigException};
 * a failure that escapes a section's boundary fails the whole page with
 * {@link PageCreationException}.</p>
 */
@Service
public class PageFactory {

    private static final Logger log = LoggerFactory.getLogger(PageFactory.class);

    private final PageConfigValidator validator;
    private final SectionRenderer sectionRenderer;
    private final Clock clock;

    public PageFactory(PageConfigValidator validator, SectionRenderer sectionRenderer, Clock clock) {
        this.validator = validator;
        this.sectionRenderer = sectionRenderer;
        this.clock = clock;
    }

    public Mono<PageInstance> createPage(PageConfiguration config) {
        return createPage(config, RenderContext.defaults());
    }

    public Mono<PageInstance> createPage(PageConfiguration config, RenderContext context) {
        ValidationResult validation = validateConfig(config);
        if (!validation.valid()) {
            log.warn("Refusing to create page \"{}\": {}", config.meta().title(), validation.errorSummary());
            return Mono.error(new FatalConfigException(validation));
        }
        if (!validation.warnings().isEmpty()) {
            log.debug("Creating page \"{}\" with warnings {}", config.meta().title(),
                validation.warnings().stream().map(issue -> issue.code()).toList());
        }
        return Flux.fromIterable(config.sections())
            .flatMapSequential(section -> sectionRenderer.renderSection(section, context))
            .collectList()
            .map(sections -> new PageInstance(config, sections, clock.instant()))
            .doOnNext(page -> log.debug("Created page \"{}\" with {} sections ({} visible)", config.meta().title(),
                page.sections().size(), page.sections().stream().filter(RenderedSection::visible).count()))
            .onErrorMap(failure -> !(failure instanceof PageCreationException),
                failure -> new PageCreationException(config.meta().title(), failure));
    }

    public ValidationResult validateConfig(PageConfiguration config) {
        return validator.validate(config);
    }

    public PageMeta getPageMeta(PageConfiguration config) {
        return config.meta();
    }

    public Mono<RenderedSection> renderSection(SectionSpec section) {
        return renderSection(section, RenderContext.defaults());
    }

    public Mono<RenderedSection> renderSection(SectionSpec section, RenderContext context) {
        return sectionRenderer.renderSection(section, context);
    }
}
