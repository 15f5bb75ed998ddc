package com.alertintake.ingest.common.web;

import org.springframework.http.HttpStatus;

public class RateLimitExceededException extends IngestionException {

  public RateLimitExceededException(String message) {
    super(message);
  }

  @Override
  public HttpStatus status() {
    return HttpStatus.TOO_MANY_REQUESTS;
  }

  @Override
  public String code() {
    return "TOO_MANY_REQUESTS";
  }
}
