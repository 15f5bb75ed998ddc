package com.alertintake.ingest.common.web;

import org.springframework.http.HttpStatus;

/** The channel behind the token belongs to another integration than the called URL. */
public class WrongEndpointException extends IngestionException {

  public WrongEndpointException(String message) {
    super(message);
  }

  @Override
  public HttpStatus status() {
    return HttpStatus.BAD_REQUEST;
  }

  @Override
  public String code() {
    return "WRONG_ENDPOINT";
  }
}
