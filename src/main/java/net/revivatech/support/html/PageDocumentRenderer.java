package net.revivatech.support.html;

import java.util.stream.Collectors;
import net.revivatech.config.SiteProperties;
import net.revivatech.domain.page.PageInstance;
import net.revivatech.domain.page.RenderedSection;
import net.revivatech.domain.seo.SeoMetadata;
import org.springframework.stereotype.Component;

/**
 * Renders complete HTML documents: page instances with their head metadata, and the
 * plain status pages used for not-found, forbidden and error responses.
 */
@Component
public class PageDocumentRenderer {

    private static final String OPEN_GRAPH_IMAGE_TYPE = "image/png";
    private static final String OPEN_GRAPH_IMAGE_WIDTH = "1200";
    private static final String OPEN_GRAPH_IMAGE_HEIGHT = "630";

    private final HtmlMarkupFormatter markupFormatter;
    private final CanonicalUrlResolver canonicalUrlResolver;
    private final SiteProperties siteProperties;

    public PageDocumentRenderer(HtmlMarkupFormatter markupFormatter,
                                CanonicalUrlResolver canonicalUrlResolver,
                                SiteProperties siteProperties) {
        this.markupFormatter = markupFormatter;
        this.canonicalUrlResolver = canonicalUrlResolver;
        this.siteProperties = siteProperties;
    }

    /**
     * Renders the page document. Hidden sections contribute no markup.
     *
     * @param locale document language
     * @param theme active theme, exposed as {@code data-theme}
     */
    public String render(PageInstance page, SeoMetadata metadata, String locale, String theme) {
        String fullTitle = markupFormatter.pageTitle(metadata.title(), siteProperties.getTitleSuffix(), siteProperties.getName());
        String escapedTitle = markupFormatter.escapeHtml(fullTitle);
        String escapedDescription = markupFormatter.escapeHtml(metadata.description());
        String escapedCanonicalUrl = markupFormatter.escapeHtml(canonicalUrlResolver.normalizePublicUrl(metadata.canonicalUrl()));
        String escapedOgImage = markupFormatter.escapeHtml(canonicalUrlResolver.normalizePublicUrl(metadata.ogImage()));
        String escapedSiteName = markupFormatter.escapeHtml(siteProperties.getName());
        String escapedStructuredData = markupFormatter.escapeInlineScriptJson(metadata.structuredDataJson());
        String body = page.sections().stream()
            .filter(RenderedSection::visible)
            .map(section -> section.node().html())
            .collect(Collectors.joining("\n    "));

        return """
            <!doctype html>
            <html lang="%s" data-theme="%s">
            <head>
              <meta charset="UTF-8">
              <meta name="viewport" content="width=device-width, initial-scale=1.0">
              <meta name="theme-color" content="%s">
              <title>%s</title>
              <meta name="description" content="%s">
              <meta name="keywords" content="%s">
              <meta name="robots" content="%s">
              <link rel="canonical" href="%s">
              <meta property="og:type" content="%s">
              <meta property="og:site_name" content="%s">
              <meta property="og:url" content="%s">
              <meta property="og:title" content="%s">
              <meta property="og:description" content="%s">
              <meta property="og:image" content="%s">
              <meta property="og:image:type" content="%s">
              <meta property="og:image:width" content="%s">
              <meta property="og:image:height" content="%s">
              <meta name="twitter:card" content="%s">
              <meta name="twitter:title" content="%s">
              <meta name="twitter:description" content="%s">
              <meta name="twitter:image" content="%s">
              <script type="application/ld+json">%s</script>
              <link rel="icon" href="/favicon.ico">
              <link rel="stylesheet" href="/css/site.css">
            </head>
            <body>
              <main class="layout-%s" data-features="%s">
                %s
              </main>
            </body>
            </html>
            """.formatted(
            markupFormatter.escapeHtml(locale),
            markupFormatter.escapeHtml(theme),
            markupFormatter.escapeHtml(siteProperties.getThemeColor()),
            escapedTitle,
            escapedDescription,
            markupFormatter.escapeHtml(metadata.keywordsText()),
            markupFormatter.escapeHtml(metadata.robots()),
            escapedCanonicalUrl,
            markupFormatter.escapeHtml(metadata.openGraphType()),
            escapedSiteName,
            escapedCanonicalUrl,
            escapedTitle,
            escapedDescription,
            escapedOgImage,
            OPEN_GRAPH_IMAGE_TYPE,
            OPEN_GRAPH_IMAGE_WIDTH,
            OPEN_GRAPH_IMAGE_HEIGHT,
            markupFormatter.escapeHtml(metadata.twitterCard()),
            escapedTitle,
            escapedDescription,
            escapedOgImage,
            escapedStructuredData,
            markupFormatter.escapeHtml(page.layout()),
            markupFormatter.escapeHtml(String.join(" ", page.features())),
            body
        );
    }

    /**
     * Renders a minimal non-indexable status document.
     */
    public String renderStatusPage(int status, String title, String message) {
        String fullTitle = markupFormatter.pageTitle(title, siteProperties.getTitleSuffix(), siteProperties.getName());
        return """
            <!doctype html>
            <html lang="en">
            <head>
              <meta charset="UTF-8">
              <meta name="viewport" content="width=device-width, initial-scale=1.0">
              <meta name="robots" content="noindex,nofollow">
              <title>%s</title>
            </head>
            <body>
              <main class="status-page" data-status="%d">
                <h1>%s</h1>
                <p>%s</p>
                <a href="/">Back to %s</a>
              </main>
            </body>
            </html>
            """.formatted(
            markupFormatter.escapeHtml(fullTitle),
            status,
            markupFormatter.escapeHtml(title),
            markupFormatter.escapeHtml(message),
            markupFormatter.escapeHtml(siteProperties.getName())
        );
    }
}
