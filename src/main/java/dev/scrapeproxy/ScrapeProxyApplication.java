package dev.scrapeproxy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the scrape proxy.
 *
 * <p>Serves {@code /health}, {@code /scrape} and {@code /sitemap} on port 8002 by default and
 * delegates page fetching to the engine at {@code scrapeproxy.fetch-engine.base-url}.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ScrapeProxyApplication {
    public static void main(String[] args) {
        SpringApplication.run(ScrapeProxyApplication.class, args);
    }
}
