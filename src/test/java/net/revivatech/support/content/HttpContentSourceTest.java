package net.revivatech.support.content;

import static org.assertj.core.api.Assertions.assertThat;

import java.net.URI;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import net.revivatech.domain.content.ContentEntry;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

class HttpContentSourceTest {

    private final List<URI> requested = new CopyOnWriteArrayList<>();

    @Test
    void should_ReportPresence_When_ExistsEndpointAnswersOk() {
        HttpContentSource source = sourceAnswering(HttpStatus.OK, null);

        StepVerifier.create(source.exists("services.mac.title", "fr"))
            .expectNext(true)
            .verifyComplete();
        assertThat(requested).singleElement().satisfies(uri -> {
            assertThat(uri.getPath()).isEqualTo("/content/services.mac.title/exists");
            assertThat(uri.getQuery()).isEqualTo("locale=fr");
        });
    }

    @Test
    void should_TreatNotFoundAsMiss_When_CheckingExistence() {
        StepVerifier.create(sourceAnswering(HttpStatus.NOT_FOUND, null).exists("missing", "en"))
            .expectNext(false)
            .verifyComplete();
    }

    @Test
    void should_PropagateFailure_When_ServerErrors() {
        StepVerifier.create(sourceAnswering(HttpStatus.INTERNAL_SERVER_ERROR, null).exists("home.title", "en"))
            .expectError(WebClientResponseException.InternalServerError.class)
            .verify();
    }

    @Test
    void should_ReturnPlainText_When_BodyIsJsonString() {
        StepVerifier.create(sourceAnswering(HttpStatus.OK, "\"Expert Mac repair\"").load("services.mac.title", "en"))
            .assertNext(entry -> assertThat(entry).isEqualTo(new ContentEntry.Text("Expert Mac repair")))
            .verifyComplete();
    }

    @Test
    void should_ReturnRichText_When_BodyDeclaresType() {
        String body = "{\"type\":\"richtext\",\"format\":\"markdown\",\"content\":\"**Same day** repairs\"}";

        StepVerifier.create(sourceAnswering(HttpStatus.OK, body).load("home.intro", "en"))
            .assertNext(entry -> {
                assertThat(entry).isInstanceOf(ContentEntry.RichText.class);
                assertThat(entry.processed()).isEqualTo("**Same day** repairs");
            })
            .verifyComplete();
    }

    @Test
    void should_ReturnEmpty_When_EntryNotFound() {
        StepVerifier.create(sourceAnswering(HttpStatus.NOT_FOUND, null).load("missing", "en"))
            .verifyComplete();
    }

    @Test
    void should_ReturnNamespaceTree_When_NamespaceExists() {
        String body = "{\"mac\":{\"title\":\"Mac Repair\"},\"pc\":{\"title\":\"PC Repair\"}}";

        StepVerifier.create(sourceAnswering(HttpStatus.OK, body).loadNamespace("services", "en"))
            .assertNext(tree -> assertThat(tree).containsOnlyKeys("mac", "pc"))
            .verifyComplete();
        assertThat(requested).singleElement()
            .satisfies(uri -> assertThat(uri.getPath()).isEqualTo("/content/namespace/services"));
    }

    @Test
    void should_ReturnEmptyTree_When_NamespaceMissing() {
        StepVerifier.create(sourceAnswering(HttpStatus.NOT_FOUND, null).loadNamespace("unknown", "en"))
            .assertNext(tree -> assertThat(tree).isEmpty())
            .verifyComplete();
    }

    private HttpContentSource sourceAnswering(HttpStatus status, String jsonBody) {
        WebClient webClient = WebClient.builder()
            .baseUrl("https://content.example.test")
            .exchangeFunction(request -> {
                requested.add(request.url());
                ClientResponse.Builder response = ClientResponse.create(status);
                if (jsonBody != null && request.method() != HttpMethod.HEAD) {
                    response.header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE).body(jsonBody);
                }
                return Mono.just(response.build());
            })
            .build();
        return new HttpContentSource(webClient);
    }
}
