package dev.scrapeproxy.fetch;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jspecify.annotations.Nullable;

/**
 * JSON request body for the fetch engine {@code /fetch} endpoint. Unspecified options are left out
 * so the engine applies its own defaults.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FetchEngineRequest(
    String url,
    boolean stealth,
    @Nullable Boolean load_dom,
    @Nullable String proxy,
    @Nullable Integer timeout_ms) {

  static FetchEngineRequest of(String url, FetchOptions options) {
    return new FetchEngineRequest(
        url,
        options.stealth() == null || options.stealth(),
        options.renderJs(),
        options.proxyUrl(),
        options.timeoutMs());
  }
}
