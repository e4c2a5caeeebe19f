package dev.scrapeproxy.fetch;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** JSON response from the fetch engine {@code /fetch} endpoint. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FetchEngineResponse(
    @Nullable String body,
    int status,
    @Nullable Map<String, String> headers,
    @Nullable String final_url) {}
