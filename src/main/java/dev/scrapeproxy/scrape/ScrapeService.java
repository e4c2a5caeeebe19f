package dev.scrapeproxy.scrape;

import dev.scrapeproxy.fetch.FetchException;
import dev.scrapeproxy.fetch.FetchOptions;
import dev.scrapeproxy.fetch.FetchedPage;
import dev.scrapeproxy.fetch.PageFetcher;
import dev.scrapeproxy.redirect.RedirectAnalysis;
import dev.scrapeproxy.redirect.RedirectAnalyzer;
import dev.scrapeproxy.redirect.RedirectClassifier;
import dev.scrapeproxy.redirect.RedirectResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Fetches a page through the engine and classifies any redirect the fetch went through. */
@Service
public class ScrapeService {

  private static final Logger log = LoggerFactory.getLogger(ScrapeService.class);

  private final PageFetcher pageFetcher;
  private final RedirectClassifier redirectClassifier;
  private final RedirectAnalyzer redirectAnalyzer;

  public ScrapeService(
      PageFetcher pageFetcher,
      RedirectClassifier redirectClassifier,
      RedirectAnalyzer redirectAnalyzer) {
    this.pageFetcher = pageFetcher;
    this.redirectClassifier = redirectClassifier;
    this.redirectAnalyzer = redirectAnalyzer;
  }

  /**
   * Scrape a single URL.
   *
   * @param url the URL to scrape
   * @param options engine options for this request
   * @return the page and its redirect classification
   * @throws FetchException when the fetch fails; not retried
   */
  public ScrapeOutcome scrape(String url, FetchOptions options) {
    log.info("Received scrape request for URL: {}", url);

    FetchedPage page;
    try {
      page = pageFetcher.fetch(url, options);
    } catch (FetchException e) {
      log.warn("Error scraping URL {} ({}): {}", url, e.getErrorType().label(), e.getMessage());
      throw e;
    }

    RedirectResult redirect = redirectClassifier.classify(url, page.finalUrl());
    RedirectAnalysis analysis = redirectAnalyzer.analyze(url, redirect);

    if (redirect.detected()) {
      log.info(
          "Fetched URL {} with status {}, redirected ({}) to {}",
          url,
          page.status(),
          redirect.type().label(),
          redirect.finalUrl());
    } else {
      log.info("Successfully fetched URL: {} with status: {}", url, page.status());
    }
    return new ScrapeOutcome(page, redirect, analysis);
  }
}
