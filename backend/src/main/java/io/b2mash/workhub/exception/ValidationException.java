package io.b2mash.workhub.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Malformed input: wrong custom field payload type, out-of-range pagination, cross-project or
 * cross-workspace references, or a mutation the model does not allow.
 */
public class ValidationException extends ErrorResponseException {

  public ValidationException(String title, String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(title, detail), null);
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
