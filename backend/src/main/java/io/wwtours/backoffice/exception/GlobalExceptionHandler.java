package io.wwtours.backoffice.exception;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  /**
   * A concurrent request changed the proposal between our read and our write. The loser of the
   * race sees the same error kind as any other rejected transition.
   */
  @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
  public ResponseEntity<ProblemDetail> handleOptimisticLock(
      ObjectOptimisticLockingFailureException ex, HttpServletRequest request) {
    log.warn(
        "Concurrent modification: path={}, method={}, entity={}",
        request.getRequestURI(),
        request.getMethod(),
        ex.getPersistentClassName());
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Invalid state transition");
    problem.setDetail("Proposal was modified concurrently. Reload and retry.");
    problem.setProperty("kind", "InvalidStateTransition");
    return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
  }
}
