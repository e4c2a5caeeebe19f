package dev.scrapeproxy.fetch;

import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "scrapeproxy.fetch-engine")
public record FetchEngineProperties(
        String baseUrl,
        int connectTimeoutMs,
        int readTimeoutMs,
        Defaults defaults
) {
    public FetchEngineProperties {
        defaults = defaults == null ? new Defaults(null, null, null) : defaults;
    }

    /** Engine options applied when a request leaves them unspecified. Stealth defaults to on. */
    public record Defaults(@Nullable Boolean renderJs, Boolean stealth, @Nullable String proxyUrl) {
        public Defaults {
            stealth = stealth == null ? Boolean.TRUE : stealth;
        }
    }
}
