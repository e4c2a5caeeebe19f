package dev.scrapeproxy.sitemap;

import java.util.List;

/**
 * Content of one sitemap document: page URLs for a {@code <urlset>}, nested sitemap URLs for a
 * {@code <sitemapindex>}. Both lists keep document order.
 */
public record ParsedSitemap(List<String> urls, List<String> nestedSitemaps) {
  public ParsedSitemap {
    urls = urls == null ? List.of() : List.copyOf(urls);
    nestedSitemaps = nestedSitemaps == null ? List.of() : List.copyOf(nestedSitemaps);
  }

  public boolean isIndex() {
    return !nestedSitemaps.isEmpty();
  }
}
