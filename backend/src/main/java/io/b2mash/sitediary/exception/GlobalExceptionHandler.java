package io.b2mash.sitediary.exception;

import io.b2mash.sitediary.storage.StorageException;
import io.b2mash.sitediary.storage.StoredFileNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(StoredFileNotFoundException.class)
  public ResponseEntity<ProblemDetail> handleStoredFileNotFound(StoredFileNotFoundException ex) {
    log.warn("Stored file missing: key={}", ex.getKey());
    var problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    problem.setTitle("File not found");
    problem.setDetail("The stored file for this photo is missing");
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(problem);
  }

  @ExceptionHandler(StorageException.class)
  public ResponseEntity<ProblemDetail> handleStorage(
      StorageException ex, HttpServletRequest request) {
    log.error(
        "Storage failure: path={}, method={}, reason={}",
        request.getRequestURI(),
        request.getMethod(),
        ex.getMessage(),
        ex);
    var problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Storage failure");
    problem.setDetail(ex.getMessage());
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
  }

  @Override
  protected ResponseEntity<Object> handleMaxUploadSizeExceededException(
      MaxUploadSizeExceededException ex,
      HttpHeaders headers,
      HttpStatusCode status,
      WebRequest request) {
    log.warn("Upload rejected: {}", ex.getMessage());
    var problem = ProblemDetail.forStatus(HttpStatus.PAYLOAD_TOO_LARGE);
    problem.setTitle("File too large");
    problem.setDetail("Uploaded file exceeds the maximum allowed size");
    return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE).body(problem);
  }
}
