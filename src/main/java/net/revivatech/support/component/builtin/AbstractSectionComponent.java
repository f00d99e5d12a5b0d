package net.revivatech.support.component.builtin;

import java.util.List;
import java.util.Map;
import net.revivatech.domain.page.PageComponent;
import net.revivatech.support.html.HtmlMarkupFormatter;

/**
 * Prop access helpers shared by the bundled components.
 */
abstract class AbstractSectionComponent implements PageComponent {

    protected final HtmlMarkupFormatter markup;

    protected AbstractSectionComponent(HtmlMarkupFormatter markup) {
        this.markup = markup;
    }

    protected String text(Map<String, Object> props, String key) {
        Object value = props.get(key);
        return value == null ? "" : String.valueOf(value);
    }

    protected String escaped(Map<String, Object> props, String key) {
        return markup.escapeHtml(props.get(key));
    }

    @SuppressWarnings("unchecked")
    protected Map<String, Object> child(Map<String, Object> props, String key) {
        Object value = props.get(key);
        return value instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
    }

    @SuppressWarnings("unchecked")
    protected List<Map<String, Object>> items(Map<String, Object> props, String key) {
        Object value = props.get(key);
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        return list.stream()
            .filter(Map.class::isInstance)
            .map(item -> (Map<String, Object>) item)
            .toList();
    }

    protected String variantClasses(Map<String, Object> props) {
        Object variants = props.get("variants");
        if (!(variants instanceof List<?> list) || list.isEmpty()) {
            return "";
        }
        StringBuilder classes = new StringBuilder();
        for (Object variant : list) {
            classes.append(' ').append(markup.escapeHtml(variant));
        }
        return classes.toString();
    }

    protected String link(Map<String, Object> action, String cssClass) {
        if (action.isEmpty()) {
            return "";
        }
        return "<a class=\"%s\" href=\"%s\">%s</a>".formatted(
            cssClass, markup.escapeHtml(action.get("href")), markup.escapeHtml(action.get("label")));
    }
}
