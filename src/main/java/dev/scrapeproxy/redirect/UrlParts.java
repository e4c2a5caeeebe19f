package dev.scrapeproxy.redirect;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scheme, authority and path of a URL, split without validation.
 *
 * <p>Uses the generic splitting expression from RFC 3986 appendix B, which matches every string, so
 * malformed input still yields a best-effort result instead of an exception. The host is the
 * authority exactly as written (case, user info and port included).
 *
 * @param scheme the scheme, or empty when absent
 * @param host the authority, or empty when absent
 * @param path the path, possibly empty
 */
public record UrlParts(String scheme, String host, String path) {

  private static final Pattern URI_SPLIT =
      Pattern.compile("^(([^:/?#]+):)?(//([^/?#]*))?([^?#]*)(\\?([^#]*))?(#(.*))?");

  private static final String WWW_PREFIX = "www.";

  /**
   * Split a URL into its parts. {@code null} is treated as the empty string.
   *
   * @param url the URL to split
   * @return the parts, never {@code null}
   */
  public static UrlParts parse(String url) {
    String input = url == null ? "" : url;
    Matcher matcher = URI_SPLIT.matcher(input);
    if (!matcher.find()) {
      return new UrlParts("", "", input);
    }
    return new UrlParts(group(matcher, 2), group(matcher, 4), group(matcher, 5));
  }

  /** Non-empty path segments in left-to-right order. */
  public List<String> segments() {
    return Arrays.stream(path.split("/")).filter(segment -> !segment.isEmpty()).toList();
  }

  /** The host with one leading {@code "www."} removed, compared case-sensitively. */
  public String hostWithoutWww() {
    return stripWww(host);
  }

  static String stripWww(String host) {
    return host.startsWith(WWW_PREFIX) ? host.substring(WWW_PREFIX.length()) : host;
  }

  private static String group(Matcher matcher, int index) {
    String value = matcher.group(index);
    return value == null ? "" : value;
  }
}
