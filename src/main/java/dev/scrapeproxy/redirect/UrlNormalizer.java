package dev.scrapeproxy.redirect;

import java.util.Locale;

/**
 * Utility class that reduces a URL to a key used to decide whether two URLs point at the same page.
 * The key is for equality only: it is lower-cased, so it must never feed path classification.
 */
public final class UrlNormalizer {

    private UrlNormalizer() {
        // utility class
    }

    /**
     * Normalize a URL for redirect detection:
     * - Lowercase the whole URL, path included
     * - Remove a leading "www." from the host
     * - Remove one trailing slash from the path
     * - Drop query and fragment
     *
     * <p>Never fails. Malformed input produces whatever {@link UrlParts#parse(String)} extracts.
     *
     * @param url the URL to normalize, {@code null} is treated as empty
     * @return the comparison key {@code scheme://host/path}
     */
    public static String normalize(String url) {
        String lowered = url == null ? "" : url.toLowerCase(Locale.ROOT);
        UrlParts parts = UrlParts.parse(lowered);

        String path = parts.path();
        if (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }

        return parts.scheme() + "://" + UrlParts.stripWww(parts.host()) + path;
    }

    /**
     * Check whether two URLs normalize to the same key.
     *
     * @param first one URL
     * @param second the other URL
     * @return true if both normalize to the same key
     */
    public static boolean isSamePage(String first, String second) {
        return normalize(first).equals(normalize(second));
    }
}
