package io.shiftmate.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when a shift cannot be billed because its input is malformed (unparseable clock times, a
 * zero-length shift). Results in HTTP 400 with the offending field exposed as a problem property.
 */
public class ValidationException extends ErrorResponseException {

  private final String field;

  public ValidationException(String field, String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(field, detail), null);
    this.field = field;
  }

  public String getField() {
    return field;
  }

  @Override
  public String getMessage() {
    return field + ": " + getBody().getDetail();
  }

  private static ProblemDetail createProblem(String field, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid shift");
    problem.setDetail(detail);
    problem.setProperty("field", field);
    return problem;
  }
}
