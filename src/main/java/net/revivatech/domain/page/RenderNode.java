package net.revivatech.domain.page;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.util.HtmlUtils;

/**
 * Result of rendering one section.
 *
 * <p>Every node knows its section and renders itself to an HTML fragment. Only
 * {@link ComponentNode} runs component code; failures there stay inside the node.
 */
public sealed interface RenderNode
    permits RenderNode.ComponentNode, RenderNode.FallbackNode, RenderNode.ErrorNode,
            RenderNode.LoadingNode, RenderNode.HiddenNode {

    String sectionId();

    String html();

    /**
     * A resolved component with its final props.
     */
    record ComponentNode(String sectionId, String componentName, PageComponent component,
                         Map<String, Object> props) implements RenderNode {

        private static final Logger log = LoggerFactory.getLogger(ComponentNode.class);

        public ComponentNode {
            props = props == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(props));
        }

        @Override
        public String html() {
            String body;
            try {
                body = component.render(props);
            } catch (RuntimeException renderFailure) {
                log.warn("Component {} failed while rendering section {}: {}",
                    componentName, sectionId, renderFailure.getMessage());
                return new ErrorNode(sectionId, String.valueOf(renderFailure.getMessage())).html();
            }
            return "<section id=\"%s\" class=\"page-section\" data-component=\"%s\">%s</section>".formatted(
                HtmlUtils.htmlEscape(sectionId), HtmlUtils.htmlEscape(componentName), body == null ? "" : body);
        }
    }

    /**
     * Placeholder for a component name that no source could resolve.
     */
    record FallbackNode(String sectionId, String componentName) implements RenderNode {

        public String message() {
            return "Component \"" + componentName + "\" not found";
        }

        @Override
        public String html() {
            return "<div class=\"section-fallback\" data-section-id=\"%s\">%s</div>".formatted(
                HtmlUtils.htmlEscape(sectionId), HtmlUtils.htmlEscape(message()));
        }
    }

    /**
     * Inline error scoped to one section.
     */
    record ErrorNode(String sectionId, String detail) implements RenderNode {

        public String message() {
            return "Error rendering section \"" + sectionId + "\": " + detail;
        }

        @Override
        public String html() {
            return "<div class=\"section-error\" role=\"alert\" data-section-id=\"%s\">%s</div>".formatted(
                HtmlUtils.htmlEscape(sectionId), HtmlUtils.htmlEscape(message()));
        }
    }

    /**
     * Emitted when a section could not be resolved within the render timeout.
     */
    record LoadingNode(String sectionId) implements RenderNode {

        @Override
        public String html() {
            return "<div class=\"section-loading\" aria-busy=\"true\" data-section-id=\"%s\"></div>".formatted(
                HtmlUtils.htmlEscape(sectionId));
        }
    }

    /**
     * Section whose visibility rule evaluated to hidden.
     */
    record HiddenNode(String sectionId) implements RenderNode {

        @Override
        public String html() {
            return "";
        }
    }
}
