package net.revivatech.controller;

import java.util.List;
import java.util.Map;
import net.revivatech.application.route.DynamicRouteHandler;
import net.revivatech.testutil.PageEngineFixture;
import net.revivatech.testutil.PageTestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PageAdminControllerTest {

    @Mock
    private DynamicRouteHandler routeHandler;

    private final PageEngineFixture fixture = new PageEngineFixture();
    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        webTestClient = WebTestClient.bindToController(new PageAdminController(routeHandler, fixture.validator,
            fixture.componentRegistry, fixture.componentResolver)).build();
    }

    @Test
    void should_ListStaticPathsWithCount_When_Requested() {
        when(routeHandler.generateStaticParams()).thenReturn(Mono.just(List.of("index", "services/mac-repair")));

        webTestClient.get().uri("/api/pages/static-paths")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.paths[1]").isEqualTo("services/mac-repair")
            .jsonPath("$.count").isEqualTo(2);
    }

    @Test
    void should_ReportRevalidation_When_PathIsGiven() {
        when(routeHandler.revalidate("/services/mac-repair")).thenReturn(Mono.just(true));

        webTestClient.post().uri(uri -> uri.path("/api/pages/revalidate").queryParam("path", "/services/mac-repair").build())
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.path").isEqualTo("/services/mac-repair")
            .jsonPath("$.revalidated").isEqualTo(true);
    }

    @Test
    void should_RejectRevalidation_When_PathIsBlank() {
        webTestClient.post().uri(uri -> uri.path("/api/pages/revalidate").queryParam("path", " ").build())
            .exchange()
            .expectStatus().isBadRequest();
        verifyNoInteractions(routeHandler);
    }

    @Test
    void should_ReportIssuesInBody_When_ConfigurationIsInvalid() {
        Map<String, Object> raw = PageTestData.rawPage("hero", "hero");

        webTestClient.post().uri("/api/pages/validate")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(raw)
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.valid").isEqualTo(false)
            .jsonPath("$.errors[0].field").isEqualTo("sections[1].id")
            .jsonPath("$.errors[0].code").isEqualTo("DUPLICATE_SECTION_ID");
    }

    @Test
    void should_ListRegisteredAndLazyComponents_When_CatalogRequested() {
        webTestClient.get().uri("/api/pages/components")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.components.length()").isEqualTo(6)
            .jsonPath("$.components[0].name").isEqualTo("CallToAction")
            .jsonPath("$.lazy[0]").isEqualTo("DynamicForm")
            .jsonPath("$.lazy[1]").isEqualTo("TestimonialsCarousel")
            .jsonPath("$.count").isEqualTo(8);
    }

    @Test
    void should_DescribeComponentOrAnswerNotFound_When_LookingUpByName() {
        webTestClient.get().uri("/api/pages/components/HeroSection")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.category").isEqualTo("SECTION")
            .jsonPath("$.description").isEqualTo("HeroSection page section");
        webTestClient.get().uri("/api/pages/components/Nonexistent")
            .exchange()
            .expectStatus().isNotFound();
    }
}
