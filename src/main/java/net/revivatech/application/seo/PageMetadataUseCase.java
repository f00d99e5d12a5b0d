package net.revivatech.application.seo;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import net.revivatech.application.route.RouteTable;
import net.revivatech.config.SiteProperties;
import net.revivatech.domain.page.PageConfiguration;
import net.revivatech.domain.page.PageMeta;
import net.revivatech.domain.page.SectionSpec;
import net.revivatech.domain.seo.AnalyticsConfig;
import net.revivatech.domain.seo.MetadataValidation;
import net.revivatech.domain.seo.SeoMetadata;
import net.revivatech.support.html.CanonicalUrlResolver;
import net.revivatech.support.seo.MetadataValidator;
import net.revivatech.support.seo.PageStructuredDataRenderer;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Composes head metadata, structured data and analytics wiring for configured pages.
 */
@Service
public class PageMetadataUseCase {

    private static final String TWITTER_CARD_LARGE = "summary_large_image";
    private static final String TWITTER_CARD_SUMMARY = "summary";
    private static final String DEFAULT_PAGE_TYPE = "page";
    private static final String DEFAULT_CATEGORY = "general";
    private static final int ENGAGEMENT_SECONDS = 30;

    private final SiteProperties siteProperties;
    private final CanonicalUrlResolver canonicalUrlResolver;
    private final PageStructuredDataRenderer structuredDataRenderer;
    private final MetadataValidator metadataValidator;

    public PageMetadataUseCase(SiteProperties siteProperties,
                               CanonicalUrlResolver canonicalUrlResolver,
                               PageStructuredDataRenderer structuredDataRenderer,
                               MetadataValidator metadataValidator) {
        this.siteProperties = siteProperties;
        this.canonicalUrlResolver = canonicalUrlResolver;
        this.structuredDataRenderer = structuredDataRenderer;
        this.metadataValidator = metadataValidator;
    }

    /**
     * Builds head metadata for a page served at {@code path}.
     *
     * @param params route parameters substituted for {@code {name}} placeholders in title and description
     */
    public SeoMetadata generateMetadata(PageConfiguration config, Map<String, String> params, String path) {
        PageMeta meta = substituteParams(config.meta(), params);
        boolean hasImage = StringUtils.hasText(meta.ogImage());
        String ogImage = canonicalUrlResolver.normalizePublicUrl(
            hasImage ? meta.ogImage() : siteProperties.getDefaultOgImage());
        return new SeoMetadata(
            meta.title(),
            meta.description(),
            canonicalUrl(path),
            meta.keywords(),
            ogImage,
            meta.robots(),
            openGraphType(config.pageType()),
            hasImage ? TWITTER_CARD_LARGE : TWITTER_CARD_SUMMARY,
            structuredDataRenderer.render(structuredDataRenderer.structuredData(config.withMeta(meta)))
        );
    }

    public List<Map<String, Object>> generateStructuredData(PageConfiguration config) {
        return structuredDataRenderer.structuredData(config);
    }

    public AnalyticsConfig generateAnalyticsConfig(PageConfiguration config) {
        String pageId = pageId(config.meta().title());
        String pageType = config.analytics() != null ? config.analytics().pageType() : DEFAULT_PAGE_TYPE;
        String category = config.analytics() != null ? config.analytics().category() : DEFAULT_CATEGORY;

        Map<String, String> dimensions = new LinkedHashMap<>();
        if (config.analytics() != null) {
            dimensions.putAll(config.analytics().customDimensions());
        }
        dimensions.put("pageId", pageId);
        dimensions.put("layout", config.layout());
        dimensions.put("features", String.join(",", config.features()));
        dimensions.put("sectionsCount", Integer.toString(config.sections().size()));
        dimensions.put("hasAuth", Boolean.toString(config.requiresAuth()));

        List<AnalyticsConfig.Event> events = new ArrayList<>();
        events.add(new AnalyticsConfig.Event("page_view", "load", null));
        for (SectionSpec section : config.sections()) {
            events.add(new AnalyticsConfig.Event("section_view", "visible", "#" + section.id()));
        }

        List<AnalyticsConfig.Goal> goals = new ArrayList<>();
        goals.add(new AnalyticsConfig.Goal("page_engagement", "duration", ENGAGEMENT_SECONDS, null));
        if ("landing".equals(pageType)) {
            goals.add(new AnalyticsConfig.Goal("landing_conversion", "event", 0, "cta_click"));
        }
        return new AnalyticsConfig(pageId, pageType, category, dimensions, events, goals);
    }

    public MetadataValidation validateMetadata(SeoMetadata metadata) {
        return metadataValidator.validate(metadata);
    }

    static String openGraphType(String pageType) {
        if (pageType == null) {
            return "website";
        }
        return switch (pageType) {
            case "article", "blog" -> "article";
            case "product", "service" -> "product";
            case "profile" -> "profile";
            default -> "website";
        };
    }

    static String pageId(String title) {
        return "page-" + title.toLowerCase(Locale.ROOT).trim().replaceAll("\\s+", "-");
    }

    private String canonicalUrl(String path) {
        String normalized = RouteTable.normalize(path);
        return canonicalUrlResolver.normalizePublicUrl(RouteTable.INDEX.equals(normalized) ? "/" : "/" + normalized);
    }

    private static PageMeta substituteParams(PageMeta meta, Map<String, String> params) {
        if (params == null || params.isEmpty()) {
            return meta;
        }
        String title = meta.title();
        String description = meta.description();
        for (Map.Entry<String, String> param : params.entrySet()) {
            String placeholder = "{" + param.getKey() + "}";
            title = title.replace(placeholder, param.getValue());
            description = description.replace(placeholder, param.getValue());
        }
        return meta.withTitle(title).withDescription(description);
    }
}
