package dev.scrapeproxy.config;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import dev.scrapeproxy.fetch.FetchErrorType;
import dev.scrapeproxy.fetch.FetchException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global REST error handler.
 *
 * <p>Maps {@link FetchException} to HTTP 500 with a structured failure body ({@code success:
 * false} plus message, URL and error type), and {@link IllegalArgumentException} to an RFC 9457
 * Problem Detail with HTTP 400.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  /**
   * Maps a failed fetch or an unusable fetch result to a 500 failure body.
   *
   * @param ex the failure raised by the fetch or sitemap layer
   * @return HTTP 500 with the failure details
   */
  @ExceptionHandler(FetchException.class)
  ResponseEntity<FailureResponse> handleFetchFailure(FetchException ex) {
    var detail = new FailureDetail(ex.getMessage(), ex.getUrl(), ex.getErrorType());
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new FailureResponse(false, detail));
  }

  /**
   * Maps {@link IllegalArgumentException} to a 400 Bad Request Problem Detail.
   *
   * @param ex the exception thrown by validation logic
   * @return a Problem Detail with HTTP 400 status and the exception message
   */
  @ExceptionHandler(IllegalArgumentException.class)
  ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
  }

  /** Body of a failed request. */
  public record FailureResponse(boolean success, FailureDetail detail) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record FailureDetail(String message, String url, FetchErrorType errorType) {}
}
