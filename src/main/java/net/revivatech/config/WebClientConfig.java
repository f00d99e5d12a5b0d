package net.revivatech.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * Outbound HTTP for the remote content API. Content payloads are small JSON documents,
 * so the in-memory buffer is capped well below Spring's default.
 */
@Configuration
public class WebClientConfig {

    private static final String USER_AGENT = "RevivaTech-PageEngine/1.0";
    private static final int MAX_CONTENT_BYTES = 512 * 1024;

    @Bean
    public WebClient.Builder webClientBuilder(PageEngineProperties properties) {
        Duration timeout = properties.getRemoteContent().getTimeout();
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(timeout.toMillis(), Integer.MAX_VALUE))
            .responseTimeout(timeout)
            .doOnConnected(connection ->
                connection.addHandlerLast(new ReadTimeoutHandler(timeout.toMillis(), TimeUnit.MILLISECONDS)));

        return WebClient.builder()
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .defaultHeader(HttpHeaders.USER_AGENT, USER_AGENT)
            .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
            .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_CONTENT_BYTES));
    }
}
