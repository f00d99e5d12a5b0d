package net.revivatech.support.content;

import java.util.Map;
import net.revivatech.config.PageEngineProperties;
import net.revivatech.domain.content.ContentEntry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * Remote content API, consulted after in-memory and bundled content.
 *
 * <p>Endpoints: {@code HEAD /content/{key}/exists}, {@code GET /content/{key}} and
 * {@code GET /content/namespace/{namespace}}, each with a {@code locale} query
 * parameter. A 404 is a miss; any other failure propagates to the content loader.
 */
@Component
@Order(30)
@ConditionalOnProperty(prefix = "pages.remote-content", name = "enabled", havingValue = "true")
public class HttpContentSource implements ContentSource {

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT =
        new ParameterizedTypeReference<>() {
        };

    private final WebClient webClient;

    @Autowired
    public HttpContentSource(WebClient.Builder webClientBuilder, PageEngineProperties properties) {
        this(buildClient(webClientBuilder, properties.getRemoteContent()));
    }

    HttpContentSource(WebClient webClient) {
        this.webClient = webClient;
    }

    private static WebClient buildClient(WebClient.Builder builder, PageEngineProperties.RemoteContent remote) {
        WebClient.Builder configured = builder.clone().baseUrl(remote.getBaseUrl());
        if (StringUtils.hasText(remote.getApiKey())) {
            configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + remote.getApiKey());
        }
        return configured.build();
    }

    @Override
    public String name() {
        return "http";
    }

    @Override
    public Mono<Boolean> exists(String key, String locale) {
        return webClient.head()
            .uri(uri -> uri.path("/content/{key}/exists").queryParam("locale", locale).build(key))
            .retrieve()
            .toBodilessEntity()
            .map(response -> response.getStatusCode().is2xxSuccessful())
            .onErrorResume(WebClientResponseException.class, this::missOrFailure);
    }

    @Override
    public Mono<ContentEntry> load(String key, String locale) {
        return webClient.get()
            .uri(uri -> uri.path("/content/{key}").queryParam("locale", locale).build(key))
            .retrieve()
            .bodyToMono(Object.class)
            .map(ContentEntry::fromRaw)
            .onErrorResume(WebClientResponseException.NotFound.class, notFound -> Mono.empty());
    }

    @Override
    public Mono<Map<String, Object>> loadNamespace(String namespace, String locale) {
        return webClient.get()
            .uri(uri -> uri.path("/content/namespace/{namespace}").queryParam("locale", locale).build(namespace))
            .retrieve()
            .bodyToMono(JSON_OBJECT)
            .onErrorResume(WebClientResponseException.NotFound.class, notFound -> Mono.just(Map.of()));
    }

    private Mono<Boolean> missOrFailure(WebClientResponseException failure) {
        if (failure.getStatusCode().isSameCodeAs(HttpStatus.NOT_FOUND)) {
            return Mono.just(false);
        }
        return Mono.error(failure);
    }
}
