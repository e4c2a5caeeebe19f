package dev.scrapeproxy.redirect;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Heuristics that label a single URL path segment. The two predicates are independent: a segment
 * may match neither or both, so callers evaluate each one.
 */
public final class PathSegmentClassifier {

  private static final Pattern DIGIT = Pattern.compile("\\d");

  /** Letters followed by a number at the start of the segment, e.g. {@code hrx217}. */
  private static final Pattern MODEL_CODE =
      Pattern.compile("^[a-z]{2,}\\d+", Pattern.CASE_INSENSITIVE);

  private static final List<String> CATEGORY_KEYWORDS =
      List.of(
          "lawn-mower",
          "mower",
          "generator",
          "pump",
          "engine",
          "tiller",
          "blower",
          "trimmer",
          "chainsaw",
          "sprayer",
          "washer",
          "marine",
          "outboard",
          "portable",
          "industrial",
          "domestic",
          "commercial",
          "accessories",
          "parts",
          "products",
          "category",
          "range",
          "series");

  private PathSegmentClassifier() {
    // utility class
  }

  /**
   * Whether the segment looks like a manufacturer model code or SKU.
   *
   * @param segment a path segment, may be empty
   * @return true if the segment contains a digit or starts with a letters-then-digits code
   */
  public static boolean isProductIdentifier(String segment) {
    if (hasDigit(segment)) {
      return true;
    }
    // Subsumed by the digit rule for now; kept as a separate rule for model codes.
    return MODEL_CODE.matcher(segment).find();
  }

  /**
   * Whether the segment looks like a descriptive product grouping.
   *
   * @param segment a path segment, may be empty
   * @return true if the segment contains a category keyword, or is hyphenated without digits
   */
  public static boolean isCategory(String segment) {
    String lowered = segment.toLowerCase(Locale.ROOT);
    for (String keyword : CATEGORY_KEYWORDS) {
      if (lowered.contains(keyword)) {
        return true;
      }
    }
    return segment.contains("-") && !hasDigit(segment);
  }

  private static boolean hasDigit(String segment) {
    return DIGIT.matcher(segment).find();
  }
}
