package net.revivatech.application.preview;

import java.time.Duration;
import net.revivatech.application.page.PageFactory;
import net.revivatech.domain.page.PageConfiguration;
import net.revivatech.domain.preview.Preview;
import net.revivatech.domain.preview.PreviewStatus;
import net.revivatech.exception.PreviewNotFoundException;
import net.revivatech.support.preview.InMemoryPreviewStorage;
import net.revivatech.testutil.MutableClock;
import net.revivatech.testutil.PageEngineFixture;
import net.revivatech.testutil.PageTestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class PreviewManagerTest {

    private static final Duration TTL = Duration.ofHours(24);

    private final PageEngineFixture fixture = new PageEngineFixture();
    private final MutableClock clock = new MutableClock(PageEngineFixture.NOW);
    private final InMemoryPreviewStorage storage = new InMemoryPreviewStorage();
    private PreviewManager previewManager;

    @BeforeEach
    void setUp() {
        PageFactory pageFactory = new PageFactory(fixture.validator, fixture.sectionRenderer, clock);
        previewManager = new PreviewManager(pageFactory, fixture.metadataUseCase, fixture.documentRenderer,
            new PreviewScoringPolicy(), storage, clock, TTL, fixture.meterRegistry);
    }

    @Test
    void should_StoreReadyPreviewWithContent_When_ConfigurationIsValid() {
        PageConfiguration config = PageTestData.aPage().section("hero", "HeroSection").section("cta", "CallToAction").build();

        Preview preview = previewManager.createPreview(config, null).block();

        assertThat(preview).isNotNull();
        assertThat(preview.id()).matches("preview-" + PageEngineFixture.NOW.toEpochMilli() + "-[0-9a-z]{9}");
        assertThat(preview.status()).isEqualTo(PreviewStatus.READY);
        assertThat(preview.url()).isEqualTo("/preview/" + preview.id());
        assertThat(preview.thumbnailUrl()).isEqualTo("/api/previews/" + preview.id() + "/thumbnail");
        assertThat(preview.expiresAt()).isEqualTo(PageEngineFixture.NOW.plus(TTL));
        assertThat(preview.metadata().sectionCount()).isEqualTo(2);
        assertThat(preview.metadata().componentsUsed()).containsExactly("HeroSection", "CallToAction");
        StepVerifier.create(previewManager.getPreviewContent(preview.id()))
            .assertNext(html -> assertThat(html).contains("data-component=\"HeroSection\""))
            .verifyComplete();
    }

    @Test
    void should_StoreErrorPreview_When_ConfigurationIsInvalid() {
        PageConfiguration config = PageTestData.aPage().section("hero", "HeroSection").section("hero", "CallToAction").build();

        Preview preview = previewManager.createPreview(config, null).block();

        assertThat(preview.status()).isEqualTo(PreviewStatus.ERROR);
        assertThat(preview.error()).startsWith("Invalid configuration").contains("Duplicate section ID: hero");
        StepVerifier.create(previewManager.getPreview(preview.id()))
            .assertNext(stored -> assertThat(stored.status()).isEqualTo(PreviewStatus.ERROR))
            .verifyComplete();
        assertThat(fixture.meterRegistry.counter("pages.preview.error").count()).isEqualTo(1.0);
    }

    @Test
    void should_HidePreview_When_TtlHasElapsed() {
        Preview preview = previewManager.createPreview(
            PageTestData.aPage().section("hero", "HeroSection").build(), null).block();

        clock.advance(TTL);

        StepVerifier.create(previewManager.getPreview(preview.id())).verifyComplete();
        StepVerifier.create(previewManager.listPreviews()).verifyComplete();
        StepVerifier.create(storage.load(preview.id())).verifyComplete();
    }

    @Test
    void should_PurgeOnlyExpiredPreviews_When_Purging() {
        previewManager.createPreview(PageTestData.aPage().section("old", "HeroSection").build(), null).block();
        clock.advance(Duration.ofHours(23));
        Preview fresh = previewManager.createPreview(PageTestData.aPage().section("new", "HeroSection").build(), null).block();
        clock.advance(Duration.ofHours(2));

        StepVerifier.create(previewManager.purgeExpired()).expectNext(1).verifyComplete();
        StepVerifier.create(previewManager.listPreviews().map(Preview::id)).expectNext(fresh.id()).verifyComplete();
    }

    @Test
    void should_ListNewestFirst_When_SeveralPreviewsExist() {
        Preview first = previewManager.createPreview(PageTestData.aPage().section("a", "HeroSection").build(), null).block();
        clock.advance(Duration.ofMinutes(5));
        Preview second = previewManager.createPreview(PageTestData.aPage().section("b", "HeroSection").build(), null).block();

        StepVerifier.create(previewManager.listPreviews().map(Preview::id))
            .expectNext(second.id(), first.id())
            .verifyComplete();
    }

    @Test
    void should_RegenerateWithNewConfiguration_When_Updated() {
        Preview preview = previewManager.createPreview(PageTestData.aPage().section("hero", "HeroSection").build(), null).block();
        clock.advance(Duration.ofMinutes(10));
        PageConfiguration updated = PageTestData.aPage().title("Updated title").section("hero", "HeroSection").build();

        StepVerifier.create(previewManager.updatePreview(preview.id(), updated))
            .assertNext(regenerated -> {
                assertThat(regenerated.id()).isEqualTo(preview.id());
                assertThat(regenerated.status()).isEqualTo(PreviewStatus.READY);
                assertThat(regenerated.metadata().title()).isEqualTo("Updated title");
                assertThat(regenerated.createdAt()).isEqualTo(preview.createdAt());
                assertThat(regenerated.updatedAt()).isEqualTo(PageEngineFixture.NOW.plus(Duration.ofMinutes(10)));
            })
            .verifyComplete();
    }

    @Test
    void should_SignalPreviewNotFound_When_UpdatingMissingPreview() {
        StepVerifier.create(previewManager.updatePreview("preview-1-missing", PageTestData.aPage().section("hero", "HeroSection").build()))
            .expectError(PreviewNotFoundException.class)
            .verify();
    }

    @Test
    void should_DeletePreviewAndContent_When_Deleted() {
        Preview preview = previewManager.createPreview(PageTestData.aPage().section("hero", "HeroSection").build(), null).block();

        StepVerifier.create(previewManager.deletePreview(preview.id())).expectNext(true).verifyComplete();
        StepVerifier.create(previewManager.deletePreview(preview.id())).expectNext(false).verifyComplete();
        StepVerifier.create(storage.loadContent(preview.id())).verifyComplete();
    }

    @Test
    void should_FailValidation_When_PerformanceScoreDropsBelowThreshold() {
        PageConfiguration crowded = PageTestData.aPage().sections(12, "HeroSection")
            .section("reviews", "TestimonialsCarousel")
            .section("form", "DynamicForm")
            .build();

        var validation = previewManager.validatePreview(crowded);

        assertThat(validation.configValidation().valid()).isTrue();
        assertThat(validation.performance().score()).isEqualTo(70);
        assertThat(validation.valid()).isFalse();
        assertThat(previewManager.validatePreview(PageTestData.aPage().sections(12, "HeroSection").build()).valid()).isTrue();
    }

    @Test
    void should_StoreErrorPreview_When_PerformanceScoreIsBelowMinimum() {
        PageConfiguration heavy = PageTestData.aPage().sections(11, "HeroSection")
            .section("contact", "DynamicForm")
            .section("quote", "DynamicForm")
            .build();

        StepVerifier.create(previewManager.createPreview(heavy, null))
            .assertNext(preview -> {
                assertThat(preview.status()).isEqualTo(PreviewStatus.ERROR);
                assertThat(preview.error()).contains("Performance score").contains("80");
            })
            .verifyComplete();
    }
}
