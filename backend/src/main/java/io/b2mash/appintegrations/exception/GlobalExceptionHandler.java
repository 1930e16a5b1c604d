package io.b2mash.appintegrations.exception;

import io.b2mash.appintegrations.crypto.SecretEncryptionException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  // Unique (tenant_id, name) on app_integrations, see V1__create_app_integrations.sql.
  static final String TENANT_NAME_CONSTRAINT = "uq_app_integrations_tenant_name";

  @ExceptionHandler(SecretEncryptionException.class)
  public ResponseEntity<ProblemDetail> handleEncryptionFailure(
      SecretEncryptionException ex, HttpServletRequest request) {
    log.error(
        "Secret encryption failed: path={}, method={}",
        request.getRequestURI(),
        request.getMethod(),
        ex);
    var problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Secret encryption failed");
    problem.setDetail("Integration secrets could not be stored. No changes were saved.");
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
  }

  @ExceptionHandler(DataIntegrityViolationException.class)
  public ResponseEntity<ProblemDetail> handleDataIntegrityViolation(
      DataIntegrityViolationException ex) {
    String cause = ex.getMostSpecificCause().getMessage();
    log.warn("Data integrity violation: {}", cause);
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    if (violates(ex, TENANT_NAME_CONSTRAINT)) {
      problem.setTitle("Duplicate integration name");
      problem.setDetail("An integration with the same name already exists for this tenant");
    } else {
      problem.setTitle("Data integrity violation");
      problem.setDetail("The request conflicts with existing data");
    }
    return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
  }

  private static boolean violates(DataIntegrityViolationException ex, String constraint) {
    return String.valueOf(ex.getMessage()).contains(constraint)
        || String.valueOf(ex.getMostSpecificCause().getMessage()).contains(constraint);
  }
}
