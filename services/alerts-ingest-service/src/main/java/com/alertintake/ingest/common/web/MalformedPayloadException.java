package com.alertintake.ingest.common.web;

import org.springframework.http.HttpStatus;

/** Body does not have the structure the selected integration expects. */
public class MalformedPayloadException extends IngestionException {

  public MalformedPayloadException(String message) {
    super(message);
  }

  public MalformedPayloadException(String message, String detail, Throwable cause) {
    super(message, detail, cause);
  }

  @Override
  public HttpStatus status() {
    return HttpStatus.BAD_REQUEST;
  }

  @Override
  public String code() {
    return "MALFORMED_PAYLOAD";
  }
}
