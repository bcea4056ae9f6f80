package io.b2mash.imagehost.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A foreign key or uniqueness constraint of a store table rejected the write. The enclosing store
 * transaction has been rolled back by the time this is thrown.
 */
public class IntegrityViolationException extends ErrorResponseException {

  public IntegrityViolationException(String title, String detail) {
    this(title, detail, null);
  }

  public IntegrityViolationException(String title, String detail, Throwable cause) {
    super(HttpStatus.CONFLICT, createProblem(title, detail), cause);
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
