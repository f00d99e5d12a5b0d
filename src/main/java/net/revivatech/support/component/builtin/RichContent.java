package net.revivatech.support.component.builtin;

import com.vladsch.flexmark.ext.autolink.AutolinkExtension;
import com.vladsch.flexmark.ext.gfm.strikethrough.StrikethroughExtension;
import com.vladsch.flexmark.ext.tables.TablesExtension;
import com.vladsch.flexmark.html.HtmlRenderer;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.ast.Node;
import com.vladsch.flexmark.util.data.MutableDataSet;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import net.revivatech.support.html.HtmlMarkupFormatter;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.safety.Cleaner;
import org.jsoup.safety.Safelist;
import org.springframework.stereotype.Component;

/**
 * Renders a {@code content} prop as sanitized HTML.
 *
 * <p>{@code format} selects the input: {@code markdown} (default) is converted with
 * flexmark, {@code html} is taken as is. Both paths end in the same jsoup safelist.
 */
@Component
public class RichContent extends AbstractSectionComponent {

    private static final Parser MARKDOWN_PARSER = buildMarkdownParser();
    private static final HtmlRenderer MARKDOWN_RENDERER = buildMarkdownRenderer();
    private static final Cleaner CONTENT_HTML_CLEANER = new Cleaner(buildContentSafelist());

    public RichContent(HtmlMarkupFormatter markup) {
        super(markup);
    }

    @Override
    public String name() {
        return "RichContent";
    }

    @Override
    public String render(Map<String, Object> props) {
        String format = text(props, "format").toLowerCase(Locale.ROOT);
        String source = text(props, "content");
        String html = "html".equals(format) ? source : renderMarkdown(source);
        return "<article class=\"rich-content%s\">%s</article>".formatted(variantClasses(props), sanitize(html));
    }

    private static String renderMarkdown(String markdown) {
        Node document = MARKDOWN_PARSER.parse(markdown);
        return MARKDOWN_RENDERER.render(document);
    }

    private static String sanitize(String candidateHtml) {
        Document dirtyDocument = Jsoup.parseBodyFragment(candidateHtml);
        Document cleanDocument = CONTENT_HTML_CLEANER.clean(dirtyDocument);
        cleanDocument.outputSettings().prettyPrint(false);
        return cleanDocument.body().html().trim();
    }

    private static Parser buildMarkdownParser() {
        MutableDataSet parserOptions = new MutableDataSet()
            .set(Parser.EXTENSIONS, Arrays.asList(
                TablesExtension.create(),
                StrikethroughExtension.create(),
                AutolinkExtension.create()
            ));
        return Parser.builder(parserOptions).build();
    }

    private static HtmlRenderer buildMarkdownRenderer() {
        MutableDataSet rendererOptions = new MutableDataSet()
            .set(Parser.EXTENSIONS, Arrays.asList(
                TablesExtension.create(),
                StrikethroughExtension.create(),
                AutolinkExtension.create()
            ))
            .set(HtmlRenderer.ESCAPE_HTML, true)
            .set(HtmlRenderer.SOFT_BREAK, "<br />\n");
        return HtmlRenderer.builder(rendererOptions).build();
    }

    private static Safelist buildContentSafelist() {
        return Safelist.none()
            .addTags(
                "p", "br", "strong", "b", "em", "i", "u", "del",
                "ul", "ol", "li", "blockquote", "code", "pre",
                "h2", "h3", "h4", "a", "table", "thead", "tbody", "tr", "th", "td"
            )
            .addAttributes("a", "href")
            .addProtocols("a", "href", "http", "https", "mailto", "tel");
    }
}
