package dev.scrapeproxy.sitemap;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URI;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.springframework.stereotype.Component;

import crawlercommons.sitemaps.AbstractSiteMap;
import crawlercommons.sitemaps.SiteMap;
import crawlercommons.sitemaps.SiteMapIndex;
import crawlercommons.sitemaps.SiteMapURL;
import crawlercommons.sitemaps.UnknownFormatException;
import dev.scrapeproxy.fetch.FetchErrorType;
import dev.scrapeproxy.fetch.FetchException;

/**
 * Parses sitemaps.org XML documents using crawler-commons.
 * Handles both single sitemaps and sitemap index files.
 */
@Component
public class SitemapParser {

    private static final String XML_CONTENT_TYPE = "text/xml";

    private final long maxSizeBytes;

    public SitemapParser(SitemapProperties properties) {
        this.maxSizeBytes = properties.maxSizeBytes();
    }

    /**
     * Parse a fetched sitemap body. The body is always treated as XML, whatever its URL looks like.
     *
     * @param sitemapUrl the URL the body was fetched from, used to resolve the document
     * @param body       the fetched document
     * @return page URLs, or nested sitemap URLs for an index
     * @throws FetchException with {@link FetchErrorType#SITEMAP_TOO_LARGE} above the size limit,
     *                        or {@link FetchErrorType#SITEMAP_PARSE} when the body is not a sitemap
     */
    public ParsedSitemap parse(String sitemapUrl, String body) {
        byte[] content = body == null ? new byte[0] : body.getBytes(StandardCharsets.UTF_8);
        if (content.length == 0) {
            throw new FetchException(FetchErrorType.SITEMAP_PARSE, sitemapUrl,
                    "Sitemap at " + sitemapUrl + " is empty");
        }
        // Prevent OOM on giant sitemaps
        if (content.length > maxSizeBytes) {
            throw new FetchException(FetchErrorType.SITEMAP_TOO_LARGE, sitemapUrl,
                    "Sitemap at " + sitemapUrl + " exceeds size limit ("
                            + content.length + " bytes > " + maxSizeBytes + " bytes)");
        }

        AbstractSiteMap result;
        try {
            crawlercommons.sitemaps.SiteMapParser parser =
                    new crawlercommons.sitemaps.SiteMapParser(false);
            result = parser.parseSiteMap(XML_CONTENT_TYPE, content, toUrl(sitemapUrl));
        } catch (UnknownFormatException | IOException e) {
            throw new FetchException(FetchErrorType.SITEMAP_PARSE, sitemapUrl,
                    "Could not parse sitemap at " + sitemapUrl + ": " + e.getMessage(), e);
        }

        if (result instanceof SiteMapIndex index) {
            List<String> nested = index.getSitemaps().stream()
                    .map(AbstractSiteMap::getUrl)
                    .map(URL::toString)
                    .toList();
            return new ParsedSitemap(List.of(), nested);
        } else if (result instanceof SiteMap siteMap) {
            return new ParsedSitemap(extractUrls(siteMap), List.of());
        }
        throw new FetchException(FetchErrorType.SITEMAP_PARSE, sitemapUrl,
                "Unsupported sitemap format at " + sitemapUrl);
    }

    private URL toUrl(String sitemapUrl) {
        try {
            return URI.create(sitemapUrl).toURL();
        } catch (MalformedURLException | IllegalArgumentException e) {
            throw new FetchException(FetchErrorType.SITEMAP_PARSE, sitemapUrl,
                    "Invalid sitemap URL: " + sitemapUrl, e);
        }
    }

    private List<String> extractUrls(SiteMap siteMap) {
        return siteMap.getSiteMapUrls().stream()
                .map(SiteMapURL::getUrl)
                .map(URL::toString)
                .toList();
    }
}
