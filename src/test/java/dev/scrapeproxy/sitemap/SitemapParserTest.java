package dev.scrapeproxy.sitemap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.scrapeproxy.fetch.FetchErrorType;
import dev.scrapeproxy.fetch.FetchException;
import org.junit.jupiter.api.Test;

class SitemapParserTest {

  private static final String SITEMAP_URL = "https://shop.example.com/sitemap.xml";

  private final SitemapParser sitemapParser =
      new SitemapParser(new SitemapProperties(1024 * 1024, 10));

  @Test
  void parseUrlsetReturnsLocsInDocumentOrder() {
    String sitemapXml =
        """
                <?xml version="1.0" encoding="UTF-8"?>
                <urlset xmlns="http://www.sitemaps.org/schemas/sitemap/0.9">
                    <url><loc>https://shop.example.com/mowers/hrx217</loc></url>
                    <url><loc>https://shop.example.com/generators/eu70is</loc></url>
                    <url><loc>https://shop.example.com/about</loc></url>
                </urlset>
                """;

    ParsedSitemap parsed = sitemapParser.parse(SITEMAP_URL, sitemapXml);

    assertThat(parsed.isIndex()).isFalse();
    assertThat(parsed.urls())
        .containsExactly(
            "https://shop.example.com/mowers/hrx217",
            "https://shop.example.com/generators/eu70is",
            "https://shop.example.com/about");
  }

  @Test
  void parseSitemapIndexReturnsNestedSitemaps() {
    String sitemapIndex =
        """
                <?xml version="1.0" encoding="UTF-8"?>
                <sitemapindex xmlns="http://www.sitemaps.org/schemas/sitemap/0.9">
                    <sitemap><loc>https://shop.example.com/sitemap-products.xml</loc></sitemap>
                    <sitemap><loc>https://shop.example.com/sitemap-pages.xml</loc></sitemap>
                </sitemapindex>
                """;

    ParsedSitemap parsed = sitemapParser.parse(SITEMAP_URL, sitemapIndex);

    assertThat(parsed.isIndex()).isTrue();
    assertThat(parsed.urls()).isEmpty();
    assertThat(parsed.nestedSitemaps())
        .containsExactly(
            "https://shop.example.com/sitemap-products.xml",
            "https://shop.example.com/sitemap-pages.xml");
  }

  @Test
  void parseTreatsBodyAsXmlWhateverTheUrl() {
    String sitemapXml =
        """
                <?xml version="1.0" encoding="UTF-8"?>
                <urlset xmlns="http://www.sitemaps.org/schemas/sitemap/0.9">
                    <url><loc>https://shop.example.com/page</loc></url>
                </urlset>
                """;

    ParsedSitemap parsed = sitemapParser.parse("https://shop.example.com/sitemap", sitemapXml);

    assertThat(parsed.urls()).containsExactly("https://shop.example.com/page");
  }

  @Test
  void parseMalformedXmlThrowsParseError() {
    assertThatThrownBy(() -> sitemapParser.parse(SITEMAP_URL, "<not valid xml at all"))
        .isInstanceOfSatisfying(
            FetchException.class,
            e -> {
              assertThat(e.getErrorType()).isEqualTo(FetchErrorType.SITEMAP_PARSE);
              assertThat(e.getUrl()).isEqualTo(SITEMAP_URL);
            });
  }

  @Test
  void parseEmptyBodyThrowsParseError() {
    assertThatThrownBy(() -> sitemapParser.parse(SITEMAP_URL, ""))
        .isInstanceOfSatisfying(
            FetchException.class,
            e -> assertThat(e.getErrorType()).isEqualTo(FetchErrorType.SITEMAP_PARSE));
  }

  @Test
  void parseOversizedBodyThrowsTooLarge() {
    var smallParser = new SitemapParser(new SitemapProperties(16, 10));
    String sitemapXml =
        """
                <urlset xmlns="http://www.sitemaps.org/schemas/sitemap/0.9">
                    <url><loc>https://shop.example.com/page</loc></url>
                </urlset>
                """;

    assertThatThrownBy(() -> smallParser.parse(SITEMAP_URL, sitemapXml))
        .isInstanceOfSatisfying(
            FetchException.class,
            e -> {
              assertThat(e.getErrorType()).isEqualTo(FetchErrorType.SITEMAP_TOO_LARGE);
              assertThat(e.getMessage()).contains("exceeds size limit");
            });
  }
}
