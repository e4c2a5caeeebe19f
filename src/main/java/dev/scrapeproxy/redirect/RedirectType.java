package dev.scrapeproxy.redirect;

import com.fasterxml.jackson.annotation.JsonValue;

/** Why the content of a requested URL was served from a different final URL. */
public enum RedirectType {
  /** Final URL is the same page as the requested one */
  NONE("none"),
  /** Final URL is on another host */
  DOMAIN("domain"),
  /** Product page collapsed into a broader category page */
  CATEGORY("category"),
  /** Product page moved to another product page */
  PRODUCT("product"),
  /** Redirect detected but no rule explains it */
  UNKNOWN("unknown");

  private final String label;

  RedirectType(String label) {
    this.label = label;
  }

  /** Wire label, e.g. {@code "category"}. */
  @JsonValue
  public String label() {
    return label;
  }
}
