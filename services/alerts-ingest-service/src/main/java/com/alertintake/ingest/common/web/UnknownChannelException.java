package com.alertintake.ingest.common.web;

import org.springframework.http.HttpStatus;

/** 404 with a stable JSON payload via ApiExceptionHandler. */
public class UnknownChannelException extends IngestionException {

  public UnknownChannelException() {
    super("Integration key is not found");
  }

  @Override
  public HttpStatus status() {
    return HttpStatus.NOT_FOUND;
  }

  @Override
  public String code() {
    return "UNKNOWN_CHANNEL";
  }
}
