package dev.scrapeproxy.redirect;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * A classified redirect together with what it probably means for the scraped product.
 *
 * @param detected whether a redirect was detected
 * @param redirectType the classification
 * @param originalUrl the requested URL
 * @param finalUrl the URL the content was served from
 * @param likelyDiscontinued whether the product is probably no longer sold
 * @param suggestedAction the suggested follow-up
 * @param message human-readable explanation, empty when nothing was detected
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RedirectAnalysis(
    boolean detected,
    RedirectType redirectType,
    String originalUrl,
    String finalUrl,
    boolean likelyDiscontinued,
    SuggestedAction suggestedAction,
    String message) {}
