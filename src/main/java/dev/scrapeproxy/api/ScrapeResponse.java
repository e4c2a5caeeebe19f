package dev.scrapeproxy.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import dev.scrapeproxy.fetch.FetchedPage;
import dev.scrapeproxy.redirect.RedirectAnalysis;
import dev.scrapeproxy.redirect.RedirectType;
import dev.scrapeproxy.scrape.ScrapeOutcome;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** Successful response of {@code POST /scrape}. */
public record ScrapeResponse(boolean success, Data data) {

  static ScrapeResponse from(ScrapeOutcome outcome) {
    FetchedPage page = outcome.page();
    RedirectAnalysis analysis = outcome.analysis();
    return new ScrapeResponse(
        true,
        new Data(
            page.body(),
            page.status(),
            page.headers(),
            page.finalUrl(),
            outcome.redirect().detected(),
            outcome.redirect().type(),
            analysis.detected() ? analysis : null));
  }

  /**
   * Fetched page plus redirect fields. {@code redirect} is only present when a redirect was
   * detected.
   */
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record Data(
      String html,
      int status,
      Map<String, String> headers,
      String finalUrl,
      boolean redirectDetected,
      RedirectType redirectType,
      @Nullable RedirectAnalysis redirect) {}
}
