package net.revivatech.support.component.builtin;

import java.util.Map;
import java.util.Set;
import net.revivatech.support.html.HtmlMarkupFormatter;

/**
 * Booking and contact forms described by a {@code fields} list. Loaded on first use.
 */
public class DynamicForm extends AbstractSectionComponent {

    private static final Set<String> INPUT_TYPES = Set.of("text", "email", "tel", "date", "number");

    public DynamicForm() {
        super(new HtmlMarkupFormatter());
    }

    @Override
    public String name() {
        return "DynamicForm";
    }

    @Override
    public String render(Map<String, Object> props) {
        StringBuilder fields = new StringBuilder();
        for (Map<String, Object> field : items(props, "fields")) {
            String name = markup.escapeHtml(field.get("name"));
            String label = markup.escapeHtml(field.getOrDefault("label", field.get("name")));
            String required = Boolean.TRUE.equals(field.get("required")) ? " required" : "";
            String type = String.valueOf(field.getOrDefault("type", "text"));
            String control = "textarea".equals(type)
                ? "<textarea id=\"%s\" name=\"%s\"%s></textarea>".formatted(name, name, required)
                : "<input id=\"%s\" name=\"%s\" type=\"%s\"%s>".formatted(
                    name, name, INPUT_TYPES.contains(type) ? type : "text", required);
            fields.append("<label for=\"%s\">%s</label>%s".formatted(name, label, control));
        }
        return "<form class=\"dynamic-form%s\" method=\"post\" action=\"%s\">%s<button type=\"submit\">%s</button></form>"
            .formatted(
                variantClasses(props),
                markup.escapeHtml(props.getOrDefault("action", "/api/forms")),
                fields,
                markup.escapeHtml(props.getOrDefault("submitLabel", "Submit")));
    }
}
