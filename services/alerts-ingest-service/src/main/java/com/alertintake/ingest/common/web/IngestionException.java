package com.alertintake.ingest.common.web;

import org.springframework.http.HttpStatus;

/**
 * Base for every rejection on the ingestion path. Rendered by {@link ApiExceptionHandler} with a
 * stable code; {@link #getDetail()} is only echoed to clients in debug mode.
 */
public abstract class IngestionException extends RuntimeException {

  private final String detail;

  protected IngestionException(String message) {
    this(message, null, null);
  }

  protected IngestionException(String message, String detail) {
    this(message, detail, null);
  }

  protected IngestionException(String message, String detail, Throwable cause) {
    super(message, cause);
    this.detail = detail;
  }

  public abstract HttpStatus status();

  public abstract String code();

  public String getDetail() {
    return detail;
  }
}
