package net.revivatech.support.component.builtin;

import java.util.Map;
import net.revivatech.support.html.HtmlMarkupFormatter;
import org.springframework.stereotype.Component;

@Component
public class CallToAction extends AbstractSectionComponent {

    public CallToAction(HtmlMarkupFormatter markup) {
        super(markup);
    }

    @Override
    public String name() {
        return "CallToAction";
    }

    @Override
    public String render(Map<String, Object> props) {
        return "<div class=\"cta%s\"><h2>%s</h2><p>%s</p>%s%s</div>".formatted(
            variantClasses(props),
            escaped(props, "title"),
            escaped(props, "description"),
            link(child(props, "primaryAction"), "button button--primary"),
            link(child(props, "secondaryAction"), "button button--secondary"));
    }
}
