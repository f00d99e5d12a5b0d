package net.revivatech.support.component.builtin;

import java.util.Map;
import net.revivatech.support.html.HtmlMarkupFormatter;
import org.springframework.stereotype.Component;

@Component
public class ContentHeader extends AbstractSectionComponent {

    public ContentHeader(HtmlMarkupFormatter markup) {
        super(markup);
    }

    @Override
    public String name() {
        return "ContentHeader";
    }

    @Override
    public String render(Map<String, Object> props) {
        return "<header class=\"content-header%s\"><h1>%s</h1><p>%s</p></header>".formatted(
            variantClasses(props), escaped(props, "title"), escaped(props, "subtitle"));
    }
}
