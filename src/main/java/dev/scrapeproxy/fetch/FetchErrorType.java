package dev.scrapeproxy.fetch;

import com.fasterxml.jackson.annotation.JsonValue;

/** Category of a failed fetch, reported to API callers as {@code error_type}. */
public enum FetchErrorType {
  /** Engine unreachable or connection dropped */
  NETWORK("network"),
  /** Engine did not answer within the read timeout */
  TIMEOUT("timeout"),
  /** Engine answered with an error status or an unusable body */
  ENGINE("engine"),
  /** Fetched document is not a sitemap */
  SITEMAP_PARSE("sitemap_parse"),
  /** Fetched sitemap exceeds the configured size limit */
  SITEMAP_TOO_LARGE("sitemap_too_large");

  private final String label;

  FetchErrorType(String label) {
    this.label = label;
  }

  @JsonValue
  public String label() {
    return label;
  }
}
