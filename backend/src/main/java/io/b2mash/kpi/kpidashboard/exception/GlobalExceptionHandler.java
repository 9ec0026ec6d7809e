package io.b2mash.kpi.kpidashboard.exception;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler({
    InvalidStateException.class,
    DerivedFieldEditException.class,
    ResourceConflictException.class
  })
  public ResponseEntity<ProblemDetail> handleRejectedWrite(
      ErrorResponseException ex, HttpServletRequest request) {
    log.warn(
        "Rejected request: path={}, method={}, title={}, detail={}",
        request.getRequestURI(),
        request.getMethod(),
        ex.getBody().getTitle(),
        ex.getBody().getDetail());
    return ResponseEntity.status(ex.getStatusCode()).body(ex.getBody());
  }

  @ExceptionHandler(ResourceNotFoundException.class)
  public ResponseEntity<ProblemDetail> handleNotFound(
      ResourceNotFoundException ex, HttpServletRequest request) {
    log.debug("Not found: path={}, detail={}", request.getRequestURI(), ex.getBody().getDetail());
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ex.getBody());
  }

  @ExceptionHandler(TaskHierarchyCorruptedException.class)
  public ResponseEntity<ProblemDetail> handleCorruptedHierarchy(
      TaskHierarchyCorruptedException ex) {
    log.error("Task hierarchy invariant violation: {}", ex.getMessage());
    var problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Task hierarchy corrupted");
    problem.setDetail("Unable to aggregate the task hierarchy");
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
  }
}
