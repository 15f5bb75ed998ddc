package com.alertintake.ingest.common.web;

import org.springframework.http.HttpStatus;

/** Request body exceeds integrations.max-payload-size. */
public class PayloadTooLargeException extends IngestionException {

  public PayloadTooLargeException(long limitBytes, String detail) {
    super("Request body exceeds the limit of " + limitBytes + " bytes", detail);
  }

  @Override
  public HttpStatus status() {
    return HttpStatus.BAD_REQUEST;
  }

  @Override
  public String code() {
    return "PAYLOAD_TOO_LARGE";
  }
}
