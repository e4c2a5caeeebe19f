package dev.scrapeproxy.sitemap;

import java.util.List;

/** URLs listed by a sitemap, in document order. */
public record SitemapResult(String sitemapUrl, List<String> urls) {
  public SitemapResult {
    urls = urls == null ? List.of() : List.copyOf(urls);
  }

  public int count() {
    return urls.size();
  }
}
