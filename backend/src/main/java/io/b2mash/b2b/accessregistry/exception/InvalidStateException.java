package io.b2mash.b2b.accessregistry.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Rejected access list input: a business-rule violation raised before any event is queued, or a
 * duplicate owner/identifier pair. Results in HTTP 400; field-level failures also carry the
 * offending {@code field} in the problem body.
 */
public class InvalidStateException extends ErrorResponseException {

  public InvalidStateException(String title, String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(title, detail, null), null);
  }

  private InvalidStateException(String title, String detail, String field) {
    super(HttpStatus.BAD_REQUEST, createProblem(title, detail, field), null);
  }

  public static InvalidStateException invalidField(String title, String field, String reason) {
    return new InvalidStateException(title, field + " " + reason, field);
  }

  private static ProblemDetail createProblem(String title, String detail, String field) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle(title);
    problem.setDetail(detail);
    if (field != null) {
      problem.setProperty("field", field);
    }
    return problem;
  }
}
