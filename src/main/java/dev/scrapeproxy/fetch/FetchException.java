package dev.scrapeproxy.fetch;

/**
 * Raised when a page cannot be fetched or its content cannot be used. Terminal for the request:
 * nothing retries it.
 */
public class FetchException extends RuntimeException {

  private final FetchErrorType errorType;
  private final String url;

  public FetchException(FetchErrorType errorType, String url, String message) {
    super(message);
    this.errorType = errorType;
    this.url = url;
  }

  public FetchException(FetchErrorType errorType, String url, String message, Throwable cause) {
    super(message, cause);
    this.errorType = errorType;
    this.url = url;
  }

  public FetchErrorType getErrorType() {
    return errorType;
  }

  public String getUrl() {
    return url;
  }
}
