package net.revivatech.domain.seo;

import java.util.List;

/**
 * Head metadata for a rendered page.
 *
 * <p>Captures the full crawler-facing surface (title, canonical, robots, Open Graph,
 * Twitter card and JSON-LD) as a single immutable value object.
 *
 * @param title title after route parameter substitution
 * @param description description after route parameter substitution
 * @param canonicalUrl absolute canonical URL
 * @param keywords keyword list
 * @param ogImage absolute Open Graph image URL
 * @param robots robots directive
 * @param openGraphType Open Graph object type
 * @param twitterCard Twitter card type
 * @param structuredDataJson JSON-LD array rendered in the document head
 */
public record SeoMetadata(
    String title,
    String description,
    String canonicalUrl,
    List<String> keywords,
    String ogImage,
    String robots,
    String openGraphType,
    String twitterCard,
    String structuredDataJson
) {

    private static final String DEFAULT_OPEN_GRAPH_TYPE = "website";
    private static final String DEFAULT_TWITTER_CARD = "summary";

    /**
     * Normalizes nullable optional fields into explicit immutable defaults.
     */
    public SeoMetadata {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        openGraphType = hasText(openGraphType) ? openGraphType : DEFAULT_OPEN_GRAPH_TYPE;
        twitterCard = hasText(twitterCard) ? twitterCard : DEFAULT_TWITTER_CARD;
        structuredDataJson = structuredDataJson == null ? "[]" : structuredDataJson;
    }

    public String keywordsText() {
        return String.join(", ", keywords);
    }

    private static boolean hasText(String candidate) {
        return candidate != null && !candidate.trim().isEmpty();
    }
}
