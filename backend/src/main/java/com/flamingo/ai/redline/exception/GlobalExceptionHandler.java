package com.flamingo.ai.redline.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.unit.DataSize;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(InvalidUploadException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidUpload(InvalidUploadException ex) {
    incrementErrorCounter("invalid_upload");
    String errorId = generateErrorId();
    log.warn("Upload rejected [{}]: {} {}", errorId, ex.getCode(), ex.getMessage());
    return respond(HttpStatus.BAD_REQUEST, ex.getCode(), ex.getMessage(), List.of(), errorId);
  }

  @ExceptionHandler(InvalidEditsException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidEdits(InvalidEditsException ex) {
    incrementErrorCounter("invalid_edits");
    String errorId = generateErrorId();
    log.warn("Edits rejected [{}]: {} {}", errorId, ex.getCode(), ex.getMessage());
    return respond(HttpStatus.BAD_REQUEST, ex.getCode(), ex.getMessage(), ex.getDetails(), errorId);
  }

  @ExceptionHandler(AdmissionTimeoutException.class)
  public ResponseEntity<ApiErrorResponse> handleAdmissionTimeout(AdmissionTimeoutException ex) {
    incrementErrorCounter("server_busy");
    String errorId = generateErrorId();
    log.warn("Admission timed out [{}]: {}", errorId, ex.getMessage());
    return respond(
        HttpStatus.SERVICE_UNAVAILABLE,
        ApiError.SERVER_BUSY,
        ex.getUserMessage(),
        List.of(),
        errorId);
  }

  @ExceptionHandler(DocumentLoadException.class)
  public ResponseEntity<ApiErrorResponse> handleDocumentLoad(DocumentLoadException ex) {
    incrementErrorCounter("document_load");
    String errorId = generateErrorId();
    log.error("Document load failed [{}]: {}", errorId, ex.getMessage(), ex);
    return respond(
        HttpStatus.UNPROCESSABLE_ENTITY, ex.getCode(), ex.getUserMessage(), List.of(), errorId);
  }

  @ExceptionHandler(DocumentProcessingException.class)
  public ResponseEntity<ApiErrorResponse> handleDocumentProcessing(
      DocumentProcessingException ex) {
    incrementErrorCounter("document_processing");
    String errorId = generateErrorId();
    log.error("Document processing error [{}]: {}", errorId, ex.getMessage(), ex);
    return respond(
        HttpStatus.UNPROCESSABLE_ENTITY,
        ApiError.APPLY_FAILED,
        ex.getUserMessage(),
        List.of(),
        errorId);
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ApiErrorResponse> handleMaxUploadSize(MaxUploadSizeExceededException ex) {
    incrementErrorCounter("file_too_large");
    String errorId = generateErrorId();
    log.warn("Upload too large [{}]: {}", errorId, ex.getMessage());
    String message = "File exceeds the maximum allowed size";
    if (ex.getMaxUploadSize() > 0) {
      message += " of " + DataSize.ofBytes(ex.getMaxUploadSize()).toMegabytes() + "MB";
    }
    return respond(HttpStatus.PAYLOAD_TOO_LARGE, ApiError.FILE_TOO_LARGE, message, List.of(), errorId);
  }

  @ExceptionHandler({HttpMediaTypeNotSupportedException.class, MultipartException.class})
  public ResponseEntity<ApiErrorResponse> handleContentType(Exception ex) {
    incrementErrorCounter("invalid_content_type");
    String errorId = generateErrorId();
    log.warn("Invalid content type [{}]: {}", errorId, ex.getMessage());
    return respond(
        HttpStatus.BAD_REQUEST,
        ApiError.INVALID_CONTENT_TYPE,
        "Content-Type must be multipart/form-data",
        List.of(),
        errorId);
  }

  @ExceptionHandler({
    MissingServletRequestPartException.class,
    MissingServletRequestParameterException.class,
    MethodArgumentTypeMismatchException.class
  })
  public ResponseEntity<ApiErrorResponse> handleBadRequest(Exception ex) {
    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Validation error [{}]: {}", errorId, ex.getMessage());
    String message =
        ex instanceof MethodArgumentTypeMismatchException mismatch
            ? "Invalid value for parameter '" + mismatch.getName() + "'"
            : "Malformed request";
    return respond(HttpStatus.BAD_REQUEST, ApiError.VALIDATION_ERROR, message, List.of(), errorId);
  }

  @ExceptionHandler({
    NoHandlerFoundException.class,
    NoResourceFoundException.class,
    HttpRequestMethodNotSupportedException.class
  })
  public ResponseEntity<ApiErrorResponse> handleNotFound(
      Exception ex, HttpServletRequest request) {
    incrementErrorCounter("not_found");
    String message = "Route " + request.getMethod() + " " + request.getRequestURI() + " not found";
    log.debug(message);
    return respond(HttpStatus.NOT_FOUND, ApiError.NOT_FOUND, message, List.of(), null);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiErrorResponse> handleGeneric(Exception ex) {
    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);
    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        List.of(),
        errorId);
  }

  private static ResponseEntity<ApiErrorResponse> respond(
      HttpStatus status, String code, String message, List<Object> details, String errorId) {
    return ResponseEntity.status(status)
        .body(
            new ApiErrorResponse(
                ApiError.builder()
                    .errorId(errorId)
                    .code(code)
                    .message(message)
                    .details(details)
                    .build()));
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
