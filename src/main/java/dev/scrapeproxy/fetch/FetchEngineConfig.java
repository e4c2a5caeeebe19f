package dev.scrapeproxy.fetch;

import java.time.Duration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Configures the {@link RestClient} used to talk to the fetch engine.
 *
 * <p>Base URL and timeouts come from {@code scrapeproxy.fetch-engine.*}. The client defaults to
 * JSON content type and is qualified as {@code "fetchEngineRestClient"}.
 */
@Configuration
public class FetchEngineConfig {

    /**
     * Creates a pre-configured {@link RestClient} targeting the fetch engine.
     *
     * @param builder    Spring-provided builder with common defaults
     * @param properties engine base URL and timeouts
     * @return a named REST client bean for injection into {@link FetchEngineClient}
     */
    @Bean
    public RestClient fetchEngineRestClient(RestClient.Builder builder, FetchEngineProperties properties) {
        var requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofMillis(properties.connectTimeoutMs()));
        requestFactory.setReadTimeout(Duration.ofMillis(properties.readTimeoutMs()));

        return builder
                .baseUrl(properties.baseUrl())
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
}
