package io.b2mash.b2b.accessregistry.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A live access list, or a resource connection of one, does not exist. Results in HTTP 404 whose
 * problem body names the missing {@code resourceType} and the {@code key} it was looked up by.
 */
public class ResourceNotFoundException extends ErrorResponseException {

  private final String resourceType;

  public ResourceNotFoundException(String resourceType, Object key) {
    this(
        resourceType,
        String.valueOf(key),
        "No " + resourceType.toLowerCase() + " found for " + key);
  }

  private ResourceNotFoundException(String resourceType, String key, String detail) {
    super(HttpStatus.NOT_FOUND, createProblem(resourceType, key, detail), null);
    this.resourceType = resourceType;
  }

  /** The list exists but is not connected to {@code resourceIdentifier}. */
  public static ResourceNotFoundException resourceConnection(
      UUID accessListId, String resourceIdentifier) {
    return new ResourceNotFoundException(
        "Resource connection",
        resourceIdentifier,
        "Access list " + accessListId + " has no connection to resource " + resourceIdentifier);
  }

  public String getResourceType() {
    return resourceType;
  }

  private static ProblemDetail createProblem(String resourceType, String key, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    problem.setTitle(resourceType + " not found");
    problem.setDetail(detail);
    problem.setProperty("resourceType", resourceType);
    problem.setProperty("key", key);
    return problem;
  }
}
