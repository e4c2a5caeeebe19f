package dev.scrapeproxy.fetch;

import java.util.Map;

/**
 * A page returned by the fetch engine.
 *
 * @param body the response body, empty when the engine sent none
 * @param status the HTTP status the engine saw
 * @param headers response headers
 * @param finalUrl the URL the content was served from after redirects
 */
public record FetchedPage(String body, int status, Map<String, String> headers, String finalUrl) {
  public FetchedPage {
    body = body == null ? "" : body;
    headers = headers == null ? Map.of() : Map.copyOf(headers);
  }
}
