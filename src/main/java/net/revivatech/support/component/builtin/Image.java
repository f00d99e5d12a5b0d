package net.revivatech.support.component.builtin;

import java.util.Map;
import net.revivatech.support.html.HtmlMarkupFormatter;
import org.springframework.stereotype.Component;

@Component
public class Image extends AbstractSectionComponent {

    public Image(HtmlMarkupFormatter markup) {
        super(markup);
    }

    @Override
    public String name() {
        return "Image";
    }

    @Override
    public String render(Map<String, Object> props) {
        if (!props.containsKey("src")) {
            throw new IllegalArgumentException("Image requires a src prop");
        }
        String caption = props.containsKey("caption")
            ? "<figcaption>" + escaped(props, "caption") + "</figcaption>"
            : "";
        return "<figure class=\"image%s\"><img src=\"%s\" alt=\"%s\" loading=\"lazy\">%s</figure>".formatted(
            variantClasses(props), escaped(props, "src"), escaped(props, "alt"), caption);
    }
}
