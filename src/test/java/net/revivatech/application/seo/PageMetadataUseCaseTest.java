package net.revivatech.application.seo;

import java.util.List;
import java.util.Map;
import net.revivatech.domain.page.PageConfiguration;
import net.revivatech.domain.seo.AnalyticsConfig;
import net.revivatech.domain.seo.MetadataValidation;
import net.revivatech.domain.seo.SeoMetadata;
import net.revivatech.testutil.PageEngineFixture;
import net.revivatech.testutil.PageTestData;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class PageMetadataUseCaseTest {

    private final PageEngineFixture fixture = new PageEngineFixture();
    private final PageMetadataUseCase metadataUseCase = fixture.metadataUseCase;

    @Test
    void should_UseSiteDefaults_When_PageHasNoImage() {
        SeoMetadata metadata = metadataUseCase.generateMetadata(PageTestData.aPage().section("hero", "HeroSection").build(),
            Map.of(), "/");

        assertThat(metadata.canonicalUrl()).isEqualTo("https://revivatech.co.uk/");
        assertThat(metadata.ogImage()).isEqualTo("https://revivatech.co.uk/images/default-og.png");
        assertThat(metadata.twitterCard()).isEqualTo("summary");
        assertThat(metadata.openGraphType()).isEqualTo("website");
        assertThat(metadata.keywordsText()).isEqualTo("computer repair, london");
    }

    @Test
    void should_SubstituteParamsAndUseLargeCard_When_DynamicServicePage() {
        PageConfiguration config = PageTestData.aPage()
            .title("{slug} Repair Service")
            .description("Expert {slug} repairs in London")
            .ogImage("/images/services/{slug}.jpg")
            .analytics("service", "repairs")
            .section("hero", "HeroSection")
            .build();

        SeoMetadata metadata = metadataUseCase.generateMetadata(config, Map.of("slug", "iphone"), "/services/iphone/");

        assertThat(metadata.title()).isEqualTo("iphone Repair Service");
        assertThat(metadata.description()).isEqualTo("Expert iphone repairs in London");
        assertThat(metadata.canonicalUrl()).isEqualTo("https://revivatech.co.uk/services/iphone");
        assertThat(metadata.twitterCard()).isEqualTo("summary_large_image");
        assertThat(metadata.openGraphType()).isEqualTo("product");
        assertThat(metadata.structuredDataJson()).contains("\"@type\":\"Service\"").contains("iphone Repair Service");
    }

    @Test
    void should_AddArticleNode_When_PageTypeIsArticle() {
        PageConfiguration config = PageTestData.aPage().analytics("article", "blog").section("body", "RichContent").build();

        List<Map<String, Object>> nodes = metadataUseCase.generateStructuredData(config);

        assertThat(nodes).extracting(node -> node.get("@type")).containsExactly("WebSite", "Organization", "Article");
        assertThat(nodes.get(2)).containsEntry("datePublished", PageEngineFixture.NOW.toString());
        assertThat(PageMetadataUseCase.openGraphType("article")).isEqualTo("article");
        assertThat(PageMetadataUseCase.openGraphType(null)).isEqualTo("website");
    }

    @Test
    void should_DescribeSectionsAndGoals_When_GeneratingAnalytics() {
        PageConfiguration config = PageTestData.aPage()
            .title("Mac Repair London")
            .analytics("landing", "repairs")
            .feature("analytics")
            .section("hero", "HeroSection")
            .section("cta", "CallToAction")
            .build();

        AnalyticsConfig analytics = metadataUseCase.generateAnalyticsConfig(config);

        assertThat(analytics.pageId()).isEqualTo("page-mac-repair-london");
        assertThat(analytics.customDimensions())
            .containsEntry("layout", "landing")
            .containsEntry("sectionsCount", "2")
            .containsEntry("hasAuth", "false")
            .containsEntry("features", "analytics");
        assertThat(analytics.events()).extracting(AnalyticsConfig.Event::name, AnalyticsConfig.Event::selector)
            .containsExactly(tuple("page_view", null), tuple("section_view", "#hero"), tuple("section_view", "#cta"));
        assertThat(analytics.goals()).extracting(AnalyticsConfig.Goal::name)
            .containsExactly("page_engagement", "landing_conversion");
    }

    @Test
    void should_FallBackToGeneralCategory_When_AnalyticsAreMissing() {
        AnalyticsConfig analytics = metadataUseCase.generateAnalyticsConfig(
            PageTestData.aPage().section("hero", "HeroSection").build());

        assertThat(analytics.pageType()).isEqualTo("page");
        assertThat(analytics.category()).isEqualTo("general");
        assertThat(analytics.goals()).hasSize(1);
    }

    @Test
    void should_ValidateGeneratedMetadata_When_PageHasNoKeywords() {
        PageConfiguration config = PageTestData.aPage().keywords(List.of()).section("hero", "HeroSection").build();

        MetadataValidation validation = metadataUseCase.validateMetadata(metadataUseCase.generateMetadata(config, Map.of(), "/"));

        assertThat(validation.valid()).isTrue();
        assertThat(validation.errors()).isEmpty();
        assertThat(validation.suggestions()).isNotEmpty();
    }
}
