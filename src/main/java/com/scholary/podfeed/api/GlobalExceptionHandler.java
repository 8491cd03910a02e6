package com.scholary.podfeed.api;

import com.scholary.podfeed.job.JobRejectedException;
import com.scholary.podfeed.source.InvalidSourceException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

/**
 * Maps submission-time failures to HTTP responses.
 *
 * <p>Only errors raised before a job exists end up here; pipeline failures are reported through
 * the job status instead.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(InvalidSourceException.class)
  @ResponseStatus(HttpStatus.BAD_REQUEST)
  public ErrorResponse handleInvalidSource(InvalidSourceException e) {
    LOGGER.info("Rejected source: {}", e.getMessage());
    return new ErrorResponse(e.getMessage(), e.category().name());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  @ResponseStatus(HttpStatus.BAD_REQUEST)
  public ErrorResponse handleValidation(MethodArgumentNotValidException e) {
    String message =
        e.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
    return new ErrorResponse(message, "INVALID_REQUEST");
  }

  @ExceptionHandler(JobRejectedException.class)
  @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
  public ErrorResponse handleRejected(JobRejectedException e) {
    return new ErrorResponse(e.getMessage(), "QUEUE_FULL");
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  @ResponseStatus(HttpStatus.PAYLOAD_TOO_LARGE)
  public ErrorResponse handleTooLarge(MaxUploadSizeExceededException e) {
    return new ErrorResponse("Uploaded file is too large", "INVALID_SOURCE");
  }
}
