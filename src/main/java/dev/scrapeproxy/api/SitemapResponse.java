package dev.scrapeproxy.api;

import dev.scrapeproxy.sitemap.SitemapResult;
import java.util.List;

/** Successful response of {@code POST /sitemap}. */
public record SitemapResponse(boolean success, Data data) {

  static SitemapResponse from(SitemapResult result) {
    return new SitemapResponse(true, new Data(result.sitemapUrl(), result.count(), result.urls()));
  }

  public record Data(String url, int count, List<String> urls) {}
}
