package dev.scrapeproxy.fetch;

import java.net.SocketTimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * {@link PageFetcher} backed by the fetch engine sidecar. The engine does the browsing (stealth
 * mode, DOM rendering, proxies); this client only forwards options and maps failures.
 */
@Service
public class FetchEngineClient implements PageFetcher {

    private static final Logger log = LoggerFactory.getLogger(FetchEngineClient.class);

    private final RestClient restClient;
    private final FetchEngineProperties.Defaults defaults;

    public FetchEngineClient(@Qualifier("fetchEngineRestClient") RestClient restClient,
                             FetchEngineProperties properties) {
        this.restClient = restClient;
        this.defaults = properties.defaults();
    }

    /**
     * Fetch a single URL via the engine. Not retried: any failure is reported to the caller as a
     * {@link FetchException}.
     */
    @Override
    public FetchedPage fetch(String url, FetchOptions options) {
        FetchOptions effective = options.withDefaults(defaults);
        FetchEngineRequest request = FetchEngineRequest.of(url, effective);
        log.debug("Fetch engine request for {} (renderJs={}, proxy={}, stealth={})",
                url, effective.renderJs(), effective.proxyUrl() != null, request.stealth());

        FetchEngineResponse response;
        try {
            response = restClient.post()
                    .uri("/fetch")
                    .body(request)
                    .retrieve()
                    .body(FetchEngineResponse.class);
        } catch (ResourceAccessException e) {
            FetchErrorType type = isTimeout(e) ? FetchErrorType.TIMEOUT : FetchErrorType.NETWORK;
            throw new FetchException(type, url, e.getMessage(), e);
        } catch (RestClientResponseException e) {
            throw new FetchException(FetchErrorType.ENGINE, url,
                    "Fetch engine responded with " + e.getStatusCode().value() + " for " + url, e);
        } catch (RestClientException e) {
            throw new FetchException(FetchErrorType.ENGINE, url, e.getMessage(), e);
        }

        if (response == null) {
            throw new FetchException(FetchErrorType.ENGINE, url,
                    "Fetch engine returned no result for " + url);
        }

        return new FetchedPage(response.body(), response.status(), response.headers(),
                resolveFinalUrl(url, response.final_url()));
    }

    /**
     * Engines that do not report a final URL did not follow a redirect we can see.
     */
    private String resolveFinalUrl(String url, String finalUrl) {
        if (finalUrl == null || finalUrl.isBlank()) {
            return url;
        }
        return finalUrl;
    }

    private boolean isTimeout(ResourceAccessException e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof SocketTimeoutException) {
                return true;
            }
        }
        return false;
    }
}
