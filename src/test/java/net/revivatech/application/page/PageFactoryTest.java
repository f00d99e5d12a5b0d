package net.revivatech.application.page;

import java.util.List;
import java.util.Map;
import net.revivatech.domain.page.ConditionOperator;
import net.revivatech.domain.page.ConditionType;
import net.revivatech.domain.page.PageConfiguration;
import net.revivatech.domain.page.RenderContext;
import net.revivatech.domain.page.RenderNode;
import net.revivatech.domain.page.RenderedSection;
import net.revivatech.domain.page.UserDescriptor;
import net.revivatech.domain.page.VisibilityCondition;
import net.revivatech.domain.page.VisibilitySpec;
import net.revivatech.exception.FatalConfigException;
import net.revivatech.support.config.PageConfigValidator;
import net.revivatech.testutil.PageEngineFixture;
import net.revivatech.testutil.PageTestData;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class PageFactoryTest {

    private final PageEngineFixture fixture = new PageEngineFixture();
    private final PageFactory pageFactory = fixture.pageFactory;

    @Test
    void should_KeepConfigurationOrder_When_SectionsRenderConcurrently() {
        PageConfiguration config = PageTestData.aPage()
            .section("hero", "HeroSection")
            .section("reviews", "TestimonialsCarousel")
            .section("services", "ServicesGrid")
            .section("cta", "CallToAction")
            .build();

        StepVerifier.create(pageFactory.createPage(config))
            .assertNext(page -> {
                assertThat(page.sections()).extracting(RenderedSection::id)
                    .containsExactly("hero", "reviews", "services", "cta");
                assertThat(page.createdAt()).isEqualTo(PageEngineFixture.NOW);
                assertThat(page.meta().title()).isEqualTo(PageTestData.DEFAULT_TITLE);
            })
            .verifyComplete();
    }

    @Test
    void should_CreatePageWithWarning_When_TitleIsLongerThanRecommended() {
        PageConfiguration config = PageTestData.aPage()
            .title("Professional Apple Mac and Windows PC Repair Services in Central London")
            .section("hero", "HeroSection")
            .build();

        assertThat(pageFactory.validateConfig(config).hasWarning(PageConfigValidator.LONG_TITLE)).isTrue();
        StepVerifier.create(pageFactory.createPage(config))
            .assertNext(page -> assertThat(page.sections()).hasSize(1))
            .verifyComplete();
    }

    @Test
    void should_FailWithFatalConfigException_When_SectionIdsRepeat() {
        PageConfiguration config = PageTestData.aPage()
            .section("hero", "HeroSection")
            .section("hero", "CallToAction")
            .build();

        StepVerifier.create(pageFactory.createPage(config))
            .expectErrorSatisfies(failure -> {
                assertThat(failure).isInstanceOf(FatalConfigException.class);
                assertThat(((FatalConfigException) failure).getValidation()
                    .hasError(PageConfigValidator.DUPLICATE_SECTION_ID)).isTrue();
            })
            .verify();
    }

    @Test
    void should_RenderFallbackSection_When_ComponentIsUnknown() {
        PageConfiguration config = PageTestData.aPage()
            .section("hero", "HeroSection")
            .section("mystery", "Nonexistent")
            .build();

        StepVerifier.create(pageFactory.createPage(config))
            .assertNext(page -> assertThat(page.sections().get(1).node())
                .isInstanceOf(RenderNode.FallbackNode.class))
            .verifyComplete();
    }

    @Test
    void should_KeepHiddenSectionsInPlace_When_UserLacksRole() {
        VisibilitySpec adminOnly = new VisibilitySpec(
            List.of(new VisibilityCondition(ConditionType.USER, ConditionOperator.EQUALS, "admin")), Map.of());
        PageConfiguration config = PageTestData.aPage()
            .section("hero", "HeroSection")
            .section(PageTestData.section("tools", "RichContent", adminOnly))
            .section("cta", "CallToAction")
            .build();

        StepVerifier.create(pageFactory.createPage(config, RenderContext.defaults()
                .withUser(new UserDescriptor("u-1", "customer"))))
            .assertNext(page -> {
                assertThat(page.sections()).hasSize(3);
                assertThat(page.sections().get(1).visible()).isFalse();
                assertThat(page.sections().get(1).node()).isInstanceOf(RenderNode.HiddenNode.class);
            })
            .verifyComplete();

        StepVerifier.create(pageFactory.createPage(config, RenderContext.defaults()
                .withUser(new UserDescriptor("u-2", "admin"))))
            .assertNext(page -> assertThat(page.sections().get(1).visible()).isTrue())
            .verifyComplete();
    }

    @Test
    void should_RenderSingleSection_When_CalledOutsidePageCreation() {
        PageConfiguration config = PageTestData.aPage().title("Contact RevivaTech").section("cta", "CallToAction").build();

        assertThat(pageFactory.getPageMeta(config).title()).isEqualTo("Contact RevivaTech");
        StepVerifier.create(pageFactory.renderSection(config.sections().get(0)))
            .assertNext(section -> {
                assertThat(section.id()).isEqualTo("cta");
                assertThat(section.node()).isInstanceOf(RenderNode.ComponentNode.class);
            })
            .verifyComplete();
    }
}
