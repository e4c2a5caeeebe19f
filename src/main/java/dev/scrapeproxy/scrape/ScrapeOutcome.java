package dev.scrapeproxy.scrape;

import dev.scrapeproxy.fetch.FetchedPage;
import dev.scrapeproxy.redirect.RedirectAnalysis;
import dev.scrapeproxy.redirect.RedirectResult;

/**
 * A fetched page with the redirect found between the requested and the final URL.
 *
 * @param page the page returned by the fetch engine
 * @param redirect the redirect classification
 * @param analysis what the redirect suggests for the scraped product
 */
public record ScrapeOutcome(FetchedPage page, RedirectResult redirect, RedirectAnalysis analysis) {}
