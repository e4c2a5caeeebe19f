package dev.scrapeproxy.api;

import dev.scrapeproxy.scrape.ScrapeService;
import dev.scrapeproxy.sitemap.SitemapService;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * HTTP entry points of the scrape proxy. Fetch failures are turned into structured failure bodies
 * by {@code GlobalExceptionHandler}.
 */
@RestController
public class ScrapeController {

  private final ScrapeService scrapeService;
  private final SitemapService sitemapService;

  public ScrapeController(ScrapeService scrapeService, SitemapService sitemapService) {
    this.scrapeService = scrapeService;
    this.sitemapService = sitemapService;
  }

  @GetMapping("/health")
  public Map<String, String> health() {
    return Map.of("status", "ok");
  }

  /** Fetch a page and report whether, and how, it was redirected. */
  @PostMapping("/scrape")
  public ScrapeResponse scrape(@RequestBody ScrapeRequest request) {
    String url = request.requireUrl();
    return ScrapeResponse.from(scrapeService.scrape(url, request.toOptions()));
  }

  /** Fetch a sitemap and list its page URLs in document order. */
  @PostMapping("/sitemap")
  public SitemapResponse sitemap(@RequestBody ScrapeRequest request) {
    String url = request.requireUrl();
    return SitemapResponse.from(sitemapService.fetchSitemap(url, request.toOptions()));
  }
}
