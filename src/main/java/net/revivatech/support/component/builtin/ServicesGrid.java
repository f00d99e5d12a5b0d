package net.revivatech.support.component.builtin;

import java.util.Map;
import net.revivatech.support.html.HtmlMarkupFormatter;
import org.springframework.stereotype.Component;

/**
 * Grid of repair service cards; each entry of {@code services} carries
 * {@code title}, {@code description}, {@code href} and an optional {@code price}.
 */
@Component
public class ServicesGrid extends AbstractSectionComponent {

    public ServicesGrid(HtmlMarkupFormatter markup) {
        super(markup);
    }

    @Override
    public String name() {
        return "ServicesGrid";
    }

    @Override
    public String render(Map<String, Object> props) {
        StringBuilder cards = new StringBuilder();
        for (Map<String, Object> service : items(props, "services")) {
            String price = service.containsKey("price")
                ? "<span class=\"card__price\">" + markup.escapeHtml(service.get("price")) + "</span>"
                : "";
            cards.append("<a class=\"card\" href=\"%s\"><h3>%s</h3><p>%s</p>%s</a>".formatted(
                markup.escapeHtml(service.get("href")),
                markup.escapeHtml(service.get("title")),
                markup.escapeHtml(service.get("description")),
                price));
        }
        return "<div class=\"services-grid%s\"><h2>%s</h2><div class=\"services-grid__cards\">%s</div></div>".formatted(
            variantClasses(props), escaped(props, "title"), cards);
    }
}
