package net.revivatech.application.render;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import net.revivatech.config.PageEngineProperties;
import net.revivatech.domain.page.PageComponent;
import net.revivatech.domain.page.RenderContext;
import net.revivatech.domain.page.RenderNode;
import net.revivatech.domain.page.RenderedSection;
import net.revivatech.domain.page.ResolvedVisibility;
import net.revivatech.domain.page.SectionSpec;
import net.revivatech.exception.ContentLoadException;
import net.revivatech.support.component.ComponentResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Renders one section: visibility gate, component resolution, props pipeline and
 * node construction.
 *
 * <p>Failures stay inside the section: an unresolvable component becomes a
 * {@link RenderNode.FallbackNode}, a slow one a {@link RenderNode.LoadingNode} and any
 * other exception a {@link RenderNode.ErrorNode}. {@link ContentLoadException} is the
 * exception and propagates to the caller.
 */
@Service
public class SectionRenderer {

    private static final Logger log = LoggerFactory.getLogger(SectionRenderer.class);

    static final String SECTION_ID_PROP = "sectionId";
    static final String SECTION_COMPONENT_PROP = "sectionComponent";
    static final String VARIANTS_PROP = "variants";

    private final VisibilityEvaluator visibilityEvaluator;
    private final ComponentResolver componentResolver;
    private final PropsTransformer propsTransformer;
    private final Duration renderTimeout;

    private final Counter fallbackCounter;
    private final Counter errorCounter;
    private final Counter timeoutCounter;

    @Autowired
    public SectionRenderer(VisibilityEvaluator visibilityEvaluator,
                           ComponentResolver componentResolver,
                           PropsTransformer propsTransformer,
                           PageEngineProperties properties,
                           MeterRegistry meterRegistry) {
        this(visibilityEvaluator, componentResolver, propsTransformer, properties.getRenderTimeout(), meterRegistry);
    }

    public SectionRenderer(VisibilityEvaluator visibilityEvaluator,
                           ComponentResolver componentResolver,
                           PropsTransformer propsTransformer,
                           Duration renderTimeout,
                           MeterRegistry meterRegistry) {
        this.visibilityEvaluator = visibilityEvaluator;
        this.componentResolver = componentResolver;
        this.propsTransformer = propsTransformer;
        this.renderTimeout = renderTimeout;
        this.fallbackCounter = meterRegistry.counter("pages.section.fallback");
        this.errorCounter = meterRegistry.counter("pages.section.error");
        this.timeoutCounter = meterRegistry.counter("pages.section.timeout");
    }

    /**
     * Renders the section's node.
     *
     * @return the node, empty when the section is hidden in this context
     */
    public Mono<RenderNode> render(SectionSpec section, RenderContext context) {
        return renderSection(section, context)
            .filter(RenderedSection::visible)
            .map(RenderedSection::node);
    }

    /**
     * Renders the section together with its resolved props and visibility. Hidden
     * sections produce a {@link RenderNode.HiddenNode}.
     */
    public Mono<RenderedSection> renderSection(SectionSpec section, RenderContext context) {
        ResolvedVisibility visibility = visibilityEvaluator.evaluate(section.visibility(), context);
        if (!visibility.visible()) {
            log.debug("Section {} hidden for device {}", section.id(), context.deviceType().value());
            return Mono.just(new RenderedSection(section.id(), section.component(),
                new RenderNode.HiddenNode(section.id()), Map.of(), visibility));
        }
        return Mono.defer(() -> resolveNode(section, context))
            .timeout(renderTimeout, Mono.fromSupplier(() -> loading(section)))
            .onErrorResume(failure -> !(failure instanceof ContentLoadException),
                failure -> Mono.just(failed(section, failure)))
            .map(resolved -> new RenderedSection(section.id(), section.component(),
                resolved.node(), resolved.props(), visibility));
    }

    /**
     * Renders from the registry and the content cache only, never suspending.
     *
     * @return the node, empty when the section is hidden in this context
     */
    public Optional<RenderNode> renderSync(SectionSpec section, RenderContext context) {
        if (!visibilityEvaluator.evaluate(section.visibility(), context).visible()) {
            return Optional.empty();
        }
        Optional<PageComponent> component = componentResolver.resolveLoaded(section.component());
        if (component.isEmpty()) {
            return Optional.of(fallback(section).node());
        }
        try {
            Map<String, Object> props = withSectionProps(propsTransformer.transformSync(section.props(), context), section);
            return Optional.of(new RenderNode.ComponentNode(section.id(), section.component(), component.get(), props));
        } catch (ContentLoadException contentFailure) {
            throw contentFailure;
        } catch (RuntimeException renderFailure) {
            return Optional.of(failed(section, renderFailure).node());
        }
    }

    public boolean canRender(String componentName) {
        return componentResolver.canRender(componentName);
    }

    /**
     * Props as the component receives them: pipeline output plus section metadata.
     */
    public Mono<Map<String, Object>> getComponentProps(SectionSpec section, RenderContext context) {
        return propsTransformer.transform(section.props(), context)
            .map(props -> withSectionProps(props, section));
    }

    /**
     * Resolves the components of all sections ahead of rendering.
     */
    public Mono<ComponentResolver.PreloadReport> preload(Collection<SectionSpec> sections) {
        return componentResolver.preload(sections.stream().map(SectionSpec::component).distinct().toList());
    }

    private Mono<ResolvedNode> resolveNode(SectionSpec section, RenderContext context) {
        return componentResolver.resolve(section.component())
            .flatMap(component -> getComponentProps(section, context)
                .map(props -> new ResolvedNode(
                    new RenderNode.ComponentNode(section.id(), section.component(), component, props), props)))
            .switchIfEmpty(Mono.fromSupplier(() -> fallback(section)));
    }

    private ResolvedNode fallback(SectionSpec section) {
        log.warn("Component {} for section {} is not registered, rendering fallback", section.component(), section.id());
        fallbackCounter.increment();
        return new ResolvedNode(new RenderNode.FallbackNode(section.id(), section.component()),
            withSectionProps(section.props(), section));
    }

    private ResolvedNode loading(SectionSpec section) {
        log.warn("Section {} did not resolve within {}, rendering loading placeholder", section.id(), renderTimeout);
        timeoutCounter.increment();
        return new ResolvedNode(new RenderNode.LoadingNode(section.id()), withSectionProps(section.props(), section));
    }

    private ResolvedNode failed(SectionSpec section, Throwable failure) {
        log.error("Section {} ({}) failed to render", section.id(), section.component(), failure);
        errorCounter.increment();
        return new ResolvedNode(new RenderNode.ErrorNode(section.id(), String.valueOf(failure.getMessage())),
            withSectionProps(section.props(), section));
    }

    private static Map<String, Object> withSectionProps(Map<String, Object> props, SectionSpec section) {
        Map<String, Object> result = new LinkedHashMap<>(props);
        result.put(SECTION_ID_PROP, section.id());
        result.put(SECTION_COMPONENT_PROP, section.component());
        result.put(VARIANTS_PROP, section.variants());
        return result;
    }

    private record ResolvedNode(RenderNode node, Map<String, Object> props) {
    }
}
