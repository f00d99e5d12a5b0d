package net.revivatech.support.seo;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.revivatech.config.SiteProperties;
import net.revivatech.domain.page.PageConfiguration;
import net.revivatech.support.html.CanonicalUrlResolver;
import org.springframework.stereotype.Component;
import tools.jackson.databind.ObjectMapper;

/**
 * Builds schema.org JSON-LD nodes for configured pages.
 *
 * <p>Every page carries WebSite and Organization nodes; {@code service},
 * {@code article} and {@code product} page types add a node of their own.
 */
@Component
public class PageStructuredDataRenderer {

    private static final String SCHEMA_CONTEXT = "https://schema.org";
    private static final String SERVICE_TYPE = "Computer Repair";
    private static final String AREA_SERVED = "London, UK";
    private static final String PRICE_CURRENCY = "GBP";

    private final ObjectMapper objectMapper;
    private final SiteProperties siteProperties;
    private final CanonicalUrlResolver canonicalUrlResolver;
    private final Clock clock;

    public PageStructuredDataRenderer(ObjectMapper objectMapper,
                                      SiteProperties siteProperties,
                                      CanonicalUrlResolver canonicalUrlResolver,
                                      Clock clock) {
        this.objectMapper = objectMapper;
        this.siteProperties = siteProperties;
        this.canonicalUrlResolver = canonicalUrlResolver;
        this.clock = clock;
    }

    public List<Map<String, Object>> structuredData(PageConfiguration config) {
        List<Map<String, Object>> nodes = new ArrayList<>();
        nodes.add(webSite());
        nodes.add(organization());
        String pageType = config.pageType();
        if ("service".equals(pageType)) {
            nodes.add(service(config));
        } else if ("article".equals(pageType)) {
            nodes.add(article(config));
        } else if ("product".equals(pageType)) {
            nodes.add(product(config));
        }
        return nodes;
    }

    /**
     * Serializes nodes as a JSON array for an {@code application/ld+json} script.
     */
    public String render(List<Map<String, Object>> nodes) {
        return objectMapper.writeValueAsString(nodes);
    }

    private Map<String, Object> webSite() {
        String baseUrl = canonicalUrlResolver.baseUrl();
        Map<String, Object> searchAction = typed("SearchAction");
        searchAction.put("target", baseUrl + "/search?q={search_term_string}");
        searchAction.put("query-input", "required name=search_term_string");

        Map<String, Object> node = schemaNode("WebSite");
        node.put("name", siteProperties.getName());
        node.put("url", baseUrl);
        node.put("potentialAction", searchAction);
        return node;
    }

    private Map<String, Object> organization() {
        Map<String, Object> contactPoint = typed("ContactPoint");
        contactPoint.put("telephone", siteProperties.getTelephone());
        contactPoint.put("email", siteProperties.getEmail());
        contactPoint.put("contactType", "customer service");

        Map<String, Object> node = schemaNode("Organization");
        node.put("name", siteProperties.getName());
        node.put("url", canonicalUrlResolver.baseUrl());
        node.put("logo", canonicalUrlResolver.normalizePublicUrl(siteProperties.getLogo()));
        node.put("contactPoint", contactPoint);
        return node;
    }

    private Map<String, Object> service(PageConfiguration config) {
        Map<String, Object> node = schemaNode("Service");
        node.put("name", config.meta().title());
        node.put("description", config.meta().description());
        node.put("provider", organizationReference());
        node.put("serviceType", SERVICE_TYPE);
        node.put("areaServed", AREA_SERVED);
        return node;
    }

    private Map<String, Object> article(PageConfiguration config) {
        Map<String, Object> logo = typed("ImageObject");
        logo.put("url", canonicalUrlResolver.normalizePublicUrl(siteProperties.getLogo()));
        Map<String, Object> publisher = organizationReference();
        publisher.put("logo", logo);
        String now = Instant.now(clock).toString();

        Map<String, Object> node = schemaNode("Article");
        node.put("headline", config.meta().title());
        node.put("description", config.meta().description());
        node.put("author", organizationReference());
        node.put("publisher", publisher);
        node.put("datePublished", now);
        node.put("dateModified", now);
        return node;
    }

    private Map<String, Object> product(PageConfiguration config) {
        Map<String, Object> brand = typed("Brand");
        brand.put("name", siteProperties.getName());
        Map<String, Object> offers = typed("Offer");
        offers.put("availability", "https://schema.org/InStock");
        offers.put("priceCurrency", PRICE_CURRENCY);

        Map<String, Object> node = schemaNode("Product");
        node.put("name", config.meta().title());
        node.put("description", config.meta().description());
        node.put("brand", brand);
        node.put("offers", offers);
        return node;
    }

    private Map<String, Object> organizationReference() {
        Map<String, Object> reference = typed("Organization");
        reference.put("name", siteProperties.getName());
        return reference;
    }

    private static Map<String, Object> schemaNode(String type) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("@context", SCHEMA_CONTEXT);
        node.put("@type", type);
        return node;
    }

    private static Map<String, Object> typed(String type) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("@type", type);
        return node;
    }
}
