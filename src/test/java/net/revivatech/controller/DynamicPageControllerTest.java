package net.revivatech.controller;

import java.time.Duration;
import net.revivatech.application.preview.PreviewManager;
import net.revivatech.application.preview.PreviewScoringPolicy;
import net.revivatech.application.route.DynamicRouteHandler;
import net.revivatech.config.PageEngineProperties;
import net.revivatech.controller.support.RenderContextFactory;
import net.revivatech.domain.page.DeviceType;
import net.revivatech.domain.page.RenderContext;
import net.revivatech.domain.preview.Preview;
import net.revivatech.support.preview.InMemoryPreviewStorage;
import net.revivatech.testutil.PageEngineFixture;
import net.revivatech.testutil.PageTestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DynamicPageControllerTest {

    @Mock
    private DynamicRouteHandler routeHandler;

    private final PageEngineFixture fixture = new PageEngineFixture();
    private PreviewManager previewManager;
    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        previewManager = new PreviewManager(fixture.pageFactory, fixture.metadataUseCase, fixture.documentRenderer,
            new PreviewScoringPolicy(), new InMemoryPreviewStorage(), fixture.clock, Duration.ofHours(24),
            fixture.meterRegistry);
        webTestClient = WebTestClient.bindToController(new DynamicPageController(routeHandler,
            new RenderContextFactory(new PageEngineProperties()), previewManager, fixture.documentRenderer)).build();
    }

    @Test
    void should_PassPathAndRequestContext_When_PageIsRequested() {
        when(routeHandler.handle(eq("/services/mac-repair"), any(RenderContext.class)))
            .thenReturn(Mono.just(ResponseEntity.ok().contentType(MediaType.TEXT_HTML).body("<html>mac</html>")));

        webTestClient.get().uri("/services/mac-repair")
            .header(HttpHeaders.ACCEPT_LANGUAGE, "fr-FR,fr;q=0.9,en;q=0.8")
            .header(HttpHeaders.USER_AGENT, "Mozilla/5.0 (iPhone; CPU iPhone OS 17_0 like Mac OS X) Mobile/15E148")
            .header(RenderContextFactory.USER_ID_HEADER, "u-42")
            .cookie(RenderContextFactory.THEME_COOKIE, "dark")
            .exchange()
            .expectStatus().isOk()
            .expectBody(String.class).isEqualTo("<html>mac</html>");

        ArgumentCaptor<RenderContext> context = ArgumentCaptor.forClass(RenderContext.class);
        verify(routeHandler).handle(eq("/services/mac-repair"), context.capture());
        assertThat(context.getValue().locale()).isEqualTo("fr");
        assertThat(context.getValue().deviceType()).isEqualTo(DeviceType.MOBILE);
        assertThat(context.getValue().theme()).isEqualTo("dark");
        assertThat(context.getValue().user().role()).isEqualTo("customer");
    }

    @Test
    void should_ServePreviewWithoutCaching_When_PreviewExists() {
        Preview preview = previewManager.createPreview(PageTestData.aPage().section("hero", "HeroSection").build(), null).block();

        webTestClient.get().uri("/preview/{id}", preview.id())
            .exchange()
            .expectStatus().isOk()
            .expectHeader().cacheControl(CacheControl.noStore())
            .expectBody(String.class)
            .value(html -> assertThat(html).contains("data-component=\"HeroSection\""));
    }

    @Test
    void should_RenderNotFoundPage_When_PreviewIsMissing() {
        webTestClient.get().uri("/preview/preview-0-gone")
            .exchange()
            .expectStatus().isNotFound()
            .expectBody(String.class)
            .value(html -> assertThat(html).contains("Preview not found"));
    }
}
