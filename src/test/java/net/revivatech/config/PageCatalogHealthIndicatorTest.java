package net.revivatech.config;

import java.util.List;
import java.util.Set;
import net.revivatech.application.route.RouteResolver;
import net.revivatech.support.component.ComponentResolver;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.health.contributor.Status;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PageCatalogHealthIndicatorTest {

    @Mock
    private RouteResolver routeResolver;

    @Mock
    private ComponentResolver componentResolver;

    @InjectMocks
    private PageCatalogHealthIndicator healthIndicator;

    @Test
    void should_ReportUpWithCounts_When_CatalogHasPages() {
        when(routeResolver.getStaticPaths()).thenReturn(Mono.just(List.of("index", "services/mac-repair")));
        when(componentResolver.knownComponents()).thenReturn(Set.of("HeroSection", "CallToAction", "DynamicForm"));

        StepVerifier.create(healthIndicator.health())
            .assertNext(health -> {
                assertThat(health.getStatus()).isEqualTo(Status.UP);
                assertThat(health.getDetails())
                    .containsEntry("page_catalog_status", "available")
                    .containsEntry("static_pages", 2)
                    .containsEntry("components", 3);
            })
            .verifyComplete();
    }

    @Test
    void should_ReportDown_When_CatalogIsEmpty() {
        when(routeResolver.getStaticPaths()).thenReturn(Mono.just(List.of()));
        when(componentResolver.knownComponents()).thenReturn(Set.of());

        StepVerifier.create(healthIndicator.health())
            .assertNext(health -> {
                assertThat(health.getStatus()).isEqualTo(Status.DOWN);
                assertThat(health.getDetails()).containsEntry("page_catalog_status", "empty");
            })
            .verifyComplete();
    }

    @Test
    void should_ReportUnavailable_When_CatalogCannotBeListed() {
        when(routeResolver.getStaticPaths()).thenReturn(Mono.error(new IllegalStateException("config folder missing")));

        StepVerifier.create(healthIndicator.health())
            .assertNext(health -> {
                assertThat(health.getStatus()).isEqualTo(Status.DOWN);
                assertThat(health.getDetails())
                    .containsEntry("page_catalog_status", "unavailable")
                    .containsEntry("message", "config folder missing");
            })
            .verifyComplete();
    }
}
