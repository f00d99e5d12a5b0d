package net.revivatech;

import org.junit.jupiter.api.Test;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

class RequestLoggingFilterTest {

    @Test
    void should_SkipStaticAssets_When_OutsideApi() {
        assertThat(RequestLoggingFilter.shouldLog("/images/hero.webp")).isFalse();
        assertThat(RequestLoggingFilter.shouldLog("/assets/app.CSS")).isFalse();
        assertThat(RequestLoggingFilter.shouldLog("/api/pages/static-paths")).isTrue();
        assertThat(RequestLoggingFilter.shouldLog("/api/exports/report.png")).isTrue();
        assertThat(RequestLoggingFilter.shouldLog("/services/mac-repair")).isTrue();
        assertThat(RequestLoggingFilter.shouldLog("/blog/v1.2/notes")).isTrue();
        assertThat(RequestLoggingFilter.shouldLog("/downloads/guide.pdf")).isTrue();
    }

    @Test
    void should_ContinueChain_When_FilteringRequest() {
        AtomicBoolean chained = new AtomicBoolean();
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/services/mac-repair"));

        StepVerifier.create(new RequestLoggingFilter().filter(exchange, filtered -> {
                chained.set(true);
                return Mono.empty();
            }))
            .verifyComplete();

        assertThat(chained).isTrue();
    }
}
