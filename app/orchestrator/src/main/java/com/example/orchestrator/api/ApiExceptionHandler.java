/*
 * どこで: Orchestrator API
 * 何を: サービス層の例外を HTTP ステータスと ApiErrorResponse に変換する
 * なぜ: コントローラごとにエラー応答を組み立てず、形式を統一するため
 */
package com.example.orchestrator.api;

import com.example.orchestrator.notification.service.InvalidEndpointConfigException;
import com.example.orchestrator.notification.service.NotificationEndpointNotFoundException;
import com.example.orchestrator.scheduler.service.InvalidScheduleException;
import com.example.orchestrator.scheduler.service.JobNotFoundException;
import jakarta.validation.ConstraintViolationException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(InvalidScheduleException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidSchedule(InvalidScheduleException ex) {
    return error(HttpStatus.BAD_REQUEST, ApiErrorCode.INVALID_SCHEDULE, ex.getMessage());
  }

  @ExceptionHandler(InvalidEndpointConfigException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidEndpointConfig(
      InvalidEndpointConfigException ex) {
    return error(
        HttpStatus.BAD_REQUEST,
        ApiErrorCode.INVALID_ENDPOINT_CONFIG,
        String.join("; ", ex.violations()));
  }

  @ExceptionHandler(JobNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleJobNotFound(JobNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, ApiErrorCode.JOB_NOT_FOUND, ex.getMessage());
  }

  @ExceptionHandler(NotificationEndpointNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleEndpointNotFound(
      NotificationEndpointNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, ApiErrorCode.ENDPOINT_NOT_FOUND, ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    final String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .collect(Collectors.joining("; "));
    return error(
        HttpStatus.BAD_REQUEST,
        ApiErrorCode.BAD_REQUEST,
        message.isEmpty() ? "request validation failed" : message);
  }

  @ExceptionHandler({
    ConstraintViolationException.class,
    IllegalArgumentException.class,
    MissingServletRequestParameterException.class,
    MethodArgumentTypeMismatchException.class
  })
  public ResponseEntity<ApiErrorResponse> handleBadRequest(Exception ex) {
    return error(HttpStatus.BAD_REQUEST, ApiErrorCode.BAD_REQUEST, ex.getMessage());
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
    return error(HttpStatus.BAD_REQUEST, ApiErrorCode.BAD_REQUEST, "request body is not readable");
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unhandled api error", ex);
    return error(
        HttpStatus.INTERNAL_SERVER_ERROR, ApiErrorCode.INTERNAL_ERROR, "internal server error");
  }

  private static ResponseEntity<ApiErrorResponse> error(
      HttpStatus status, ApiErrorCode code, String message) {
    return ResponseEntity.status(status).body(new ApiErrorResponse(code, message));
  }
}
