package dev.scrapeproxy.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import dev.scrapeproxy.fetch.FetchOptions;
import org.jspecify.annotations.Nullable;

/**
 * JSON body of {@code POST /scrape} and {@code POST /sitemap}.
 *
 * @param url the URL to fetch (required)
 * @param renderJs whether the engine should wait for the DOM to load
 * @param proxyUrl proxy the engine should route through
 * @param stealth whether the engine should use its stealth browser (default true)
 * @param timeoutMs engine-side timeout in milliseconds
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ScrapeRequest(
    @Nullable String url,
    @Nullable Boolean renderJs,
    @Nullable String proxyUrl,
    @Nullable Boolean stealth,
    @Nullable Integer timeoutMs) {

  /**
   * The requested URL, validated.
   *
   * @throws IllegalArgumentException if the URL is missing or blank
   */
  String requireUrl() {
    if (url == null || url.isBlank()) {
      throw new IllegalArgumentException("url must not be blank");
    }
    return url;
  }

  FetchOptions toOptions() {
    if (timeoutMs != null && timeoutMs < 1) {
      throw new IllegalArgumentException("timeout_ms must be at least 1");
    }
    return new FetchOptions(renderJs, proxyUrl, stealth, timeoutMs);
  }
}
