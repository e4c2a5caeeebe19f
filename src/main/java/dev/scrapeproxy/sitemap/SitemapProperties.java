package dev.scrapeproxy.sitemap;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Limits for sitemap retrieval, bound from {@code scrapeproxy.sitemap.*}.
 *
 * @param maxSizeBytes largest sitemap body that is parsed
 * @param maxNestedSitemaps how many sitemaps of a sitemap index are followed
 */
@ConfigurationProperties(prefix = "scrapeproxy.sitemap")
public record SitemapProperties(long maxSizeBytes, int maxNestedSitemaps) {}
