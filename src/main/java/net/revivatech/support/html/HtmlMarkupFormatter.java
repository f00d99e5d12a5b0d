package net.revivatech.support.html;

import java.util.Objects;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Escaping shared by page documents, status pages and section components. Every value
 * that reaches generated markup goes through one of these methods.
 */
@Component
public class HtmlMarkupFormatter {

    /**
     * Document title for a page: the page title, or the site name when the page has none,
     * followed by the site suffix exactly once.
     */
    public String pageTitle(String title, String titleSuffix, String siteName) {
        String base = StringUtils.hasText(title) ? title.trim() : siteName;
        return base.endsWith(titleSuffix) ? base : base + titleSuffix;
    }

    /**
     * Escapes text for element content and quoted attributes. {@code null} renders as nothing.
     */
    public String escapeHtml(Object value) {
        if (value == null) {
            return "";
        }
        String text = String.valueOf(value);
        StringBuilder escaped = new StringBuilder(text.length() + 16);
        for (int index = 0; index < text.length(); index++) {
            char character = text.charAt(index);
            switch (character) {
                case '&' -> escaped.append("&amp;");
                case '<' -> escaped.append("&lt;");
                case '>' -> escaped.append("&gt;");
                case '"' -> escaped.append("&quot;");
                case '\'' -> escaped.append("&#39;");
                default -> escaped.append(character);
            }
        }
        return escaped.toString();
    }

    /**
     * Makes serialized JSON-LD safe inside {@code <script type="application/ld+json">}.
     */
    public String escapeInlineScriptJson(String json) {
        Objects.requireNonNull(json, "structured data JSON must not be null");
        return json
            .replace("<", "\\u003c")
            .replace(">", "\\u003e")
            .replace("&", "\\u0026")
            .replace("\u2028", "\\u2028")
            .replace("\u2029", "\\u2029");
    }
}
