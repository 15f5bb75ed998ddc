package com.alertintake.ingest.common.web;

import com.alertintake.ingest.config.IntegrationsProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MultipartException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class ApiExceptionHandler {

  private final IntegrationsProperties properties;

  @ExceptionHandler(IngestionException.class)
  public ResponseEntity<ErrorResponse> handleIngestion(IngestionException e) {
    if (e.status().is5xxServerError()) {
      log.error("Ingestion failed: {}", e.getMessage(), e);
    } else {
      log.warn("Ingestion rejected [{}]: {}", e.code(), e.getMessage());
    }
    return json(e.status())
        .body(ErrorResponse.of(e.code(), e.getMessage(), debugDetail(e.getDetail())));
  }

  // only reachable when multipart parsing is switched back on
  @ExceptionHandler(MultipartException.class)
  public ResponseEntity<ErrorResponse> handleMultipart(MultipartException e) {
    log.warn("Multipart request rejected: {}", e.getMessage());
    return json(HttpStatus.BAD_REQUEST)
        .body(
            ErrorResponse.of(
                "UNSUPPORTED_CONTENT_TYPE",
                "File uploads are not accepted",
                debugDetail(e.getMessage())));
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<ErrorResponse> handle405(HttpRequestMethodNotSupportedException e) {
    return json(HttpStatus.METHOD_NOT_ALLOWED)
        .body(ErrorResponse.of("METHOD_NOT_ALLOWED", e.getMessage(), null));
  }

  @ExceptionHandler(NoResourceFoundException.class)
  public ResponseEntity<ErrorResponse> handle404(NoResourceFoundException e) {
    return json(HttpStatus.NOT_FOUND)
        .body(ErrorResponse.of("NOT_FOUND", "No such endpoint", null));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handle500(Exception e) {
    log.error("Unhandled exception", e);
    return json(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(ErrorResponse.of("INTERNAL_ERROR", "Unexpected error", debugDetail(e.toString())));
  }

  // error bodies are always JSON, whatever the sender put in Accept
  private static ResponseEntity.BodyBuilder json(HttpStatus status) {
    return ResponseEntity.status(status).contentType(MediaType.APPLICATION_JSON);
  }

  private String debugDetail(String detail) {
    return properties.debug() ? detail : null;
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record ErrorResponse(String code, String message, String detail, Instant timestamp) {
    public static ErrorResponse of(String code, String message, String detail) {
      return new ErrorResponse(code, message, detail, Instant.now());
    }
  }
}
