package net.revivatech.support.component.builtin;

import java.util.Map;
import net.revivatech.support.html.HtmlMarkupFormatter;

/**
 * Customer testimonials slider. Loaded on first use through the lazy component source,
 * so it is not a Spring bean.
 */
public class TestimonialsCarousel extends AbstractSectionComponent {

    public TestimonialsCarousel() {
        super(new HtmlMarkupFormatter());
    }

    @Override
    public String name() {
        return "TestimonialsCarousel";
    }

    @Override
    public String render(Map<String, Object> props) {
        StringBuilder slides = new StringBuilder();
        for (Map<String, Object> testimonial : items(props, "testimonials")) {
            slides.append("<blockquote class=\"testimonial\" data-rating=\"%s\"><p>%s</p><cite>%s</cite></blockquote>"
                .formatted(
                    markup.escapeHtml(testimonial.getOrDefault("rating", 5)),
                    markup.escapeHtml(testimonial.get("quote")),
                    markup.escapeHtml(testimonial.get("author"))));
        }
        return "<div class=\"testimonials%s\" data-autoplay=\"%s\"><h2>%s</h2>%s</div>".formatted(
            variantClasses(props),
            markup.escapeHtml(props.getOrDefault("autoplay", Boolean.TRUE)),
            escaped(props, "title"),
            slides);
    }
}
