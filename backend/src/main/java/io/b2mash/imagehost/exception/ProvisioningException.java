package io.b2mash.imagehost.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class ProvisioningException extends ErrorResponseException {

  public ProvisioningException(String detail) {
    this(detail, null);
  }

  public ProvisioningException(String detail, Throwable cause) {
    super(HttpStatus.INTERNAL_SERVER_ERROR, createProblem(detail), cause);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Store provisioning failed");
    problem.setDetail(detail);
    return problem;
  }
}
