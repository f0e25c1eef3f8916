package io.b2mash.b2b.accessregistry.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * The state the caller based its request on is stale: a concurrent writer won the version check,
 * an If-Match version did not match, or a listing was mutated between page fetches.
 */
public class PreconditionFailedException extends ErrorResponseException {

  public PreconditionFailedException(String title, String detail) {
    super(HttpStatus.PRECONDITION_FAILED, createProblem(title, detail), null);
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.PRECONDITION_FAILED);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
