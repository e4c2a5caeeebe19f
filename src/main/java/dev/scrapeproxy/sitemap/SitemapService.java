package dev.scrapeproxy.sitemap;

import dev.scrapeproxy.fetch.FetchException;
import dev.scrapeproxy.fetch.FetchOptions;
import dev.scrapeproxy.fetch.FetchedPage;
import dev.scrapeproxy.fetch.PageFetcher;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Retrieves a sitemap through the fetch engine and flattens it into a list of page URLs. For a
 * sitemap index, nested sitemaps are fetched in index order, up to {@code
 * scrapeproxy.sitemap.max-nested-sitemaps}.
 */
@Service
public class SitemapService {

  private static final Logger log = LoggerFactory.getLogger(SitemapService.class);

  private final PageFetcher pageFetcher;
  private final SitemapParser sitemapParser;
  private final int maxNestedSitemaps;

  public SitemapService(
      PageFetcher pageFetcher, SitemapParser sitemapParser, SitemapProperties properties) {
    this.pageFetcher = pageFetcher;
    this.sitemapParser = sitemapParser;
    this.maxNestedSitemaps = properties.maxNestedSitemaps();
  }

  /**
   * Fetch and parse a sitemap.
   *
   * @param sitemapUrl URL of a sitemap or sitemap index
   * @param options engine options, also used for nested sitemaps
   * @return all page URLs in document order
   * @throws FetchException when the top-level sitemap cannot be fetched or parsed
   */
  public SitemapResult fetchSitemap(String sitemapUrl, FetchOptions options) {
    log.info("Fetching sitemap {}", sitemapUrl);
    ParsedSitemap root = fetchAndParse(sitemapUrl, options);

    if (!root.isIndex()) {
      log.info("Sitemap {} lists {} URLs", sitemapUrl, root.urls().size());
      return new SitemapResult(sitemapUrl, root.urls());
    }

    List<String> nested = root.nestedSitemaps();
    if (nested.size() > maxNestedSitemaps) {
      log.warn(
          "Sitemap index {} lists {} sitemaps, following the first {}",
          sitemapUrl,
          nested.size(),
          maxNestedSitemaps);
      nested = nested.subList(0, maxNestedSitemaps);
    }

    List<String> urls = new ArrayList<>();
    for (String nestedUrl : nested) {
      try {
        urls.addAll(fetchAndParse(nestedUrl, options).urls());
      } catch (FetchException e) {
        log.warn(
            "Skipping nested sitemap {} ({}): {}",
            nestedUrl,
            e.getErrorType().label(),
            e.getMessage());
      }
    }
    log.info(
        "Sitemap index {} lists {} URLs across {} sitemaps", sitemapUrl, urls.size(), nested.size());
    return new SitemapResult(sitemapUrl, urls);
  }

  private ParsedSitemap fetchAndParse(String sitemapUrl, FetchOptions options) {
    FetchedPage page = pageFetcher.fetch(sitemapUrl, options);
    return sitemapParser.parse(sitemapUrl, page.body());
  }
}
