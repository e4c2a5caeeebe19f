package dev.scrapeproxy.redirect;

import org.springframework.stereotype.Component;

/** Turns a {@link RedirectResult} into a suggested follow-up for the catalogue owner. */
@Component
public class RedirectAnalyzer {

  /**
   * Analyze a classified redirect.
   *
   * @param originalUrl the requested URL
   * @param result the classification of the fetch
   * @return the analysis, with {@link SuggestedAction#NONE} when no redirect was detected
   */
  public RedirectAnalysis analyze(String originalUrl, RedirectResult result) {
    String finalUrl = result.finalUrl();
    if (!result.detected() || result.type() == RedirectType.NONE) {
      return new RedirectAnalysis(
          false, RedirectType.NONE, originalUrl, finalUrl, false, SuggestedAction.NONE, "");
    }

    return switch (result.type()) {
      case CATEGORY ->
          detected(
              result,
              originalUrl,
              true,
              SuggestedAction.MARK_DISCONTINUED,
              "This product URL has been redirected to a category page ("
                  + finalUrl
                  + "), suggesting the product is no longer available from the supplier.");
      case PRODUCT ->
          detected(
              result,
              originalUrl,
              false,
              SuggestedAction.UPDATE_URL,
              "This product URL has been redirected to a different product page ("
                  + finalUrl
                  + "). The URL may have changed or the product may have been replaced.");
      case DOMAIN ->
          detected(
              result,
              originalUrl,
              false,
              SuggestedAction.UPDATE_URL,
              "This product URL has been redirected to a different domain ("
                  + finalUrl
                  + "). Please verify if this is the correct product.");
      default ->
          detected(
              result,
              originalUrl,
              false,
              SuggestedAction.UPDATE_URL,
              "This product URL has been redirected to "
                  + finalUrl
                  + ". Please review and update if needed.");
    };
  }

  private static RedirectAnalysis detected(
      RedirectResult result,
      String originalUrl,
      boolean likelyDiscontinued,
      SuggestedAction action,
      String message) {
    return new RedirectAnalysis(
        true, result.type(), originalUrl, result.finalUrl(), likelyDiscontinued, action, message);
  }
}
