package com.alertintake.ingest.common.web;

import org.springframework.http.HttpStatus;

public class UnsupportedContentTypeException extends IngestionException {

  public UnsupportedContentTypeException(String message, String detail) {
    super(message, detail);
  }

  @Override
  public HttpStatus status() {
    return HttpStatus.BAD_REQUEST;
  }

  @Override
  public String code() {
    return "UNSUPPORTED_CONTENT_TYPE";
  }
}
