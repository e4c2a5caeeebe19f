package dev.scrapeproxy.redirect;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class RedirectClassifierTest {

  private final RedirectClassifier classifier = new RedirectClassifier();

  @ParameterizedTest
  @ValueSource(
      strings = {
        "http://a.com/foo",
        "https://www.shop.com/mowers/hrx217",
        "https://shop.com/",
        "https://shop.com/search?q=mower"
      })
  void classifySameUrlIsNotDetected(String url) {
    RedirectResult result = classifier.classify(url, url);

    assertThat(result.detected()).isFalse();
    assertThat(result.type()).isEqualTo(RedirectType.NONE);
    assertThat(result.finalUrl()).isEqualTo(url);
    assertThat(result.originalUrl()).isNull();
  }

  @Test
  void classifyWwwAndTrailingSlashDifferenceIsNotDetected() {
    RedirectResult result = classifier.classify("http://a.com/foo", "http://www.a.com/foo/");

    assertThat(result.detected()).isFalse();
    assertThat(result.type()).isEqualTo(RedirectType.NONE);
    assertThat(result.finalUrl()).isEqualTo("http://www.a.com/foo/");
  }

  @Test
  void classifyCaseOnlyDifferenceIsNotDetected() {
    RedirectResult result =
        classifier.classify("http://a.com/Products/HRX217", "http://a.com/products/hrx217");

    assertThat(result.detected()).isFalse();
  }

  @Test
  void classifyQueryOnlyDifferenceIsNotDetected() {
    RedirectResult result =
        classifier.classify("http://a.com/mowers?page=1", "http://a.com/mowers?page=2");

    assertThat(result.detected()).isFalse();
  }

  @Test
  void classifyOtherHostIsDomainRedirect() {
    RedirectResult result = classifier.classify("http://a.com/x", "http://b.com/x");

    assertThat(result.detected()).isTrue();
    assertThat(result.type()).isEqualTo(RedirectType.DOMAIN);
    assertThat(result.originalUrl()).isEqualTo("http://a.com/x");
    assertThat(result.finalUrl()).isEqualTo("http://b.com/x");
  }

  @Test
  void classifyComparesHostsCaseSensitivelyOnceKeysDiffer() {
    RedirectResult result = classifier.classify("http://A.com/x", "http://a.com/y");

    assertThat(result.type()).isEqualTo(RedirectType.DOMAIN);
  }

  @Test
  void classifyIgnoresWwwWhenComparingHosts() {
    RedirectResult result =
        classifier.classify("http://www.a.com/products/hrx217", "http://a.com/products/hrx220");

    assertThat(result.type()).isEqualTo(RedirectType.PRODUCT);
  }

  @Test
  void classifyShorterFinalPathIsCategoryRedirect() {
    RedirectResult result =
        classifier.classify("http://a.com/mowers/hrx217", "http://a.com/mowers");

    assertThat(result.detected()).isTrue();
    assertThat(result.type()).isEqualTo(RedirectType.CATEGORY);
  }

  @Test
  void classifyRedirectToHomePageIsCategoryRedirect() {
    RedirectResult result = classifier.classify("http://a.com/mowers/hrx217", "http://a.com/");

    assertThat(result.type()).isEqualTo(RedirectType.CATEGORY);
  }

  @Test
  void classifyProductReplacedByCategoryIsCategoryRedirect() {
    RedirectResult result =
        classifier.classify(
            "http://a.com/products/hrx217", "http://a.com/products/lawn-mowers");

    assertThat(result.detected()).isTrue();
    assertThat(result.type()).isEqualTo(RedirectType.CATEGORY);
  }

  @Test
  void classifyProductReplacedByNonProductSegmentIsCategoryRedirect() {
    RedirectResult result =
        classifier.classify("http://a.com/products/hrx217", "http://a.com/products/about");

    assertThat(result.type()).isEqualTo(RedirectType.CATEGORY);
  }

  @Test
  void classifyProductReplacedByProductIsProductRedirect() {
    RedirectResult result =
        classifier.classify("http://a.com/products/hrx217", "http://a.com/products/hrx220");

    assertThat(result.detected()).isTrue();
    assertThat(result.type()).isEqualTo(RedirectType.PRODUCT);
  }

  @Test
  void classifyNonProductOriginalWithSameDepthIsProductRedirect() {
    RedirectResult result =
        classifier.classify("http://a.com/mowers/lawn-mowers", "http://a.com/mowers/ride-on");

    assertThat(result.type()).isEqualTo(RedirectType.PRODUCT);
  }

  @Test
  void classifyDifferentEarlierSegmentIsComparedOnLastSegments() {
    RedirectResult result =
        classifier.classify("http://a.com/old/hrx217", "http://a.com/new/hrx217");

    assertThat(result.type()).isEqualTo(RedirectType.PRODUCT);
  }

  @Test
  void classifyLongerFinalPathIsUnknown() {
    RedirectResult result = classifier.classify("http://a.com/x", "http://a.com/x/y");

    assertThat(result.detected()).isTrue();
    assertThat(result.type()).isEqualTo(RedirectType.UNKNOWN);
  }

  @Test
  void classifySchemeOnlyDifferenceIsUnknown() {
    RedirectResult result = classifier.classify("http://a.com/x", "https://a.com/x");

    assertThat(result.detected()).isTrue();
    assertThat(result.type()).isEqualTo(RedirectType.UNKNOWN);
    assertThat(result.originalUrl()).isEqualTo("http://a.com/x");
  }

  @Test
  void classifyExtraTrailingSeparatorIsUnknown() {
    RedirectResult result = classifier.classify("http://a.com/x//", "http://a.com/x");

    assertThat(result.type()).isEqualTo(RedirectType.UNKNOWN);
  }

  @Test
  void classifyEmptyInputsIsNotDetected() {
    RedirectResult result = classifier.classify("", "");

    assertThat(result.detected()).isFalse();
  }

  @Test
  void classifyNullOriginalDegradesToDomainRedirect() {
    RedirectResult result = classifier.classify(null, "http://a.com/x");

    assertThat(result.detected()).isTrue();
    assertThat(result.type()).isEqualTo(RedirectType.DOMAIN);
    assertThat(result.originalUrl()).isEmpty();
  }

  @Test
  void classifyMalformedUrlsDegradesToSegmentComparison() {
    RedirectResult result = classifier.classify("not a url", "also not");

    assertThat(result.detected()).isTrue();
    assertThat(result.type()).isEqualTo(RedirectType.PRODUCT);
  }
}
