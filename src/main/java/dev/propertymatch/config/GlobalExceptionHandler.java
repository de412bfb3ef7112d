package dev.propertymatch.config;

import dev.propertymatch.search.CollaboratorFailureException;
import dev.propertymatch.search.InvalidWeightException;
import dev.propertymatch.search.QueryListingNotFoundException;
import dev.propertymatch.search.UnknownSearchModeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global REST error handler that maps application exceptions to RFC 9457 Problem Detail responses.
 *
 * <p>Caller mistakes (bad arguments, unknown search modes, invalid weights) map to 400, a query
 * listing that is not fully indexed to 404, and vector-store or record-store failures to 503.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

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

  @ExceptionHandler(UnknownSearchModeException.class)
  ProblemDetail handleUnknownSearchMode(UnknownSearchModeException ex) {
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
    problem.setProperty("mode", ex.getMode());
    return problem;
  }

  @ExceptionHandler(InvalidWeightException.class)
  ProblemDetail handleInvalidWeight(InvalidWeightException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
  }

  @ExceptionHandler(QueryListingNotFoundException.class)
  ProblemDetail handleQueryListingNotFound(QueryListingNotFoundException ex) {
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, ex.getMessage());
    problem.setProperty("listingId", ex.getListingId());
    problem.setProperty("facet", ex.getFacet().value());
    return problem;
  }

  /** Logged here because the cause is otherwise lost to the client. */
  @ExceptionHandler(CollaboratorFailureException.class)
  ProblemDetail handleCollaboratorFailure(CollaboratorFailureException ex) {
    log.error("Similar-listing search failed in stage {}", ex.getStage(), ex);
    ProblemDetail problem =
        ProblemDetail.forStatusAndDetail(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
    problem.setProperty("stage", ex.getStage());
    return problem;
  }
}
