package io.b2mash.imagehost.exception;

import io.b2mash.imagehost.multitenancy.StoreId;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class ResourceNotFoundException extends ErrorResponseException {

  private final String resourceType;

  public ResourceNotFoundException(String resourceType, Object id) {
    super(
        HttpStatus.NOT_FOUND,
        createProblem(
            resourceType + " not found",
            "No " + resourceType.toLowerCase() + " found with id " + id),
        null);
    this.resourceType = resourceType;
  }

  public ResourceNotFoundException(StoreId storeId, String resourceType, Object id) {
    super(
        HttpStatus.NOT_FOUND,
        createProblem(
            resourceType + " not found",
            "No "
                + resourceType.toLowerCase()
                + " found with id "
                + id
                + " in store "
                + storeId.value()),
        null);
    this.resourceType = resourceType;
  }

  public String getResourceType() {
    return resourceType;
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
