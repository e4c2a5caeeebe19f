package dev.scrapeproxy.redirect;

import org.jspecify.annotations.Nullable;

/**
 * Outcome of comparing a requested URL with the URL the content was finally served from.
 *
 * @param detected whether the final URL is a different page
 * @param type the redirect classification, {@link RedirectType#NONE} when not detected
 * @param finalUrl the URL the content was served from
 * @param originalUrl the requested URL, only set when a redirect was detected
 */
public record RedirectResult(
    boolean detected, RedirectType type, String finalUrl, @Nullable String originalUrl) {

  public static RedirectResult notDetected(String finalUrl) {
    return new RedirectResult(false, RedirectType.NONE, finalUrl, null);
  }

  public static RedirectResult detected(RedirectType type, String originalUrl, String finalUrl) {
    return new RedirectResult(true, type, finalUrl, originalUrl);
  }
}
