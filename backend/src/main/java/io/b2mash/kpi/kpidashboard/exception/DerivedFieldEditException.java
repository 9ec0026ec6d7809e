package io.b2mash.kpi.kpidashboard.exception;

import java.util.Collection;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when a write targets fields that a parent task derives from its children. The rejected
 * field names are exposed as the {@code fields} problem property.
 */
public class DerivedFieldEditException extends ErrorResponseException {

  public DerivedFieldEditException(UUID taskId, Collection<String> fields) {
    super(HttpStatus.CONFLICT, createProblem(taskId, fields), null);
  }

  private static ProblemDetail createProblem(UUID taskId, Collection<String> fields) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Derived field edit rejected");
    problem.setDetail(
        "Task " + taskId + " has subtasks; " + String.join(", ", fields) + " derive from them");
    problem.setProperty("fields", fields);
    return problem;
  }
}
