package net.revivatech.support.component.builtin;

import java.util.Map;
import net.revivatech.support.html.HtmlMarkupFormatter;
import org.springframework.stereotype.Component;

@Component
public class HeroSection extends AbstractSectionComponent {

    public HeroSection(HtmlMarkupFormatter markup) {
        super(markup);
    }

    @Override
    public String name() {
        return "HeroSection";
    }

    @Override
    public String render(Map<String, Object> props) {
        Map<String, Object> media = child(props, "media");
        String image = media.isEmpty() ? "" : "<img class=\"hero__media\" src=\"%s\" alt=\"%s\">".formatted(
            markup.escapeHtml(media.get("src")), markup.escapeHtml(media.get("alt")));
        return """
            <div class="hero%s"><div class="hero__text"><h1>%s</h1><p class="hero__subtitle">%s</p>%s</div>%s</div>"""
            .formatted(
                variantClasses(props),
                escaped(props, "title"),
                escaped(props, "subtitle"),
                link(child(props, "primaryAction"), "button button--primary"),
                image);
    }
}
