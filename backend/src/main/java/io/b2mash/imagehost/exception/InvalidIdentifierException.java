package io.b2mash.imagehost.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** A store identifier failed validation and cannot be turned into table names. Never retried. */
public class InvalidIdentifierException extends ErrorResponseException {

  public InvalidIdentifierException(String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(detail), null);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid store identifier");
    problem.setDetail(detail);
    return problem;
  }
}
