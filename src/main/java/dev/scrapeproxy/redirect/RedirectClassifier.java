package dev.scrapeproxy.redirect;

import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Decides whether a fetch was redirected and what kind of redirect it was, from the requested URL
 * and the final URL alone. Stateless and safe to share between request threads.
 *
 * <p>Rules, evaluated in order once the normalized URLs differ:
 *
 * <ol>
 *   <li>different host (ignoring a leading {@code www.}) - {@link RedirectType#DOMAIN}
 *   <li>shorter final path - {@link RedirectType#CATEGORY}
 *   <li>same depth, different path - compare the last segments: a product code replaced by a
 *       category or by a non-product segment is {@link RedirectType#CATEGORY}, anything else is
 *       {@link RedirectType#PRODUCT}
 *   <li>otherwise {@link RedirectType#UNKNOWN}
 * </ol>
 */
@Component
public class RedirectClassifier {

  /**
   * Classify the redirect between two URLs. Never throws; {@code null} is treated as empty.
   *
   * @param originalUrl the URL that was requested
   * @param finalUrl the URL the content was served from
   * @return the classification
   */
  public RedirectResult classify(String originalUrl, String finalUrl) {
    String original = originalUrl == null ? "" : originalUrl;
    String fin = finalUrl == null ? "" : finalUrl;

    if (UrlNormalizer.isSamePage(original, fin)) {
      return RedirectResult.notDetected(fin);
    }

    return RedirectResult.detected(redirectType(original, fin), original, fin);
  }

  private RedirectType redirectType(String originalUrl, String finalUrl) {
    UrlParts original = UrlParts.parse(originalUrl);
    UrlParts fin = UrlParts.parse(finalUrl);

    if (!original.hostWithoutWww().equals(fin.hostWithoutWww())) {
      return RedirectType.DOMAIN;
    }

    List<String> originalSegments = original.segments();
    List<String> finalSegments = fin.segments();

    if (finalSegments.size() < originalSegments.size()) {
      return RedirectType.CATEGORY;
    }
    if (finalSegments.size() == originalSegments.size()
        && !finalSegments.equals(originalSegments)) {
      return compareLastSegments(lastOf(originalSegments), lastOf(finalSegments));
    }
    // Deeper final path, or identical segments where only the scheme or separators differ.
    return RedirectType.UNKNOWN;
  }

  private RedirectType compareLastSegments(String originalLast, String finalLast) {
    boolean wasProduct = PathSegmentClassifier.isProductIdentifier(originalLast);
    if (wasProduct && PathSegmentClassifier.isCategory(finalLast)) {
      return RedirectType.CATEGORY;
    }
    if (wasProduct && !PathSegmentClassifier.isProductIdentifier(finalLast)) {
      return RedirectType.CATEGORY;
    }
    return RedirectType.PRODUCT;
  }

  private static String lastOf(List<String> segments) {
    return segments.isEmpty() ? "" : segments.get(segments.size() - 1);
  }
}
