package dev.scrapeproxy.fetch;

import org.jspecify.annotations.Nullable;

/**
 * Per-request options forwarded to the fetch engine. A {@code null} field means "not specified"
 * and falls back to the configured default, or is left out of the engine request.
 *
 * @param renderJs whether the engine should wait for the DOM to load
 * @param proxyUrl proxy the engine should route through
 * @param stealth whether the engine should use its stealth browser
 * @param timeoutMs engine-side timeout in milliseconds
 */
public record FetchOptions(
    @Nullable Boolean renderJs,
    @Nullable String proxyUrl,
    @Nullable Boolean stealth,
    @Nullable Integer timeoutMs) {

  /** Options with nothing specified. */
  public static FetchOptions defaults() {
    return new FetchOptions(null, null, null, null);
  }

  /**
   * Fill unspecified fields from configured defaults. Blank proxy URLs count as unspecified.
   *
   * @param defaults configured engine defaults
   * @return options with defaults applied
   */
  public FetchOptions withDefaults(FetchEngineProperties.Defaults defaults) {
    String proxy = proxyUrl != null && !proxyUrl.isBlank() ? proxyUrl : null;
    return new FetchOptions(
        renderJs != null ? renderJs : defaults.renderJs(),
        proxy != null ? proxy : blankToNull(defaults.proxyUrl()),
        stealth != null ? stealth : defaults.stealth(),
        timeoutMs);
  }

  private static @Nullable String blankToNull(@Nullable String value) {
    return value == null || value.isBlank() ? null : value;
  }
}
