package com.scholary.spatialaudio.api;

import org.springframework.http.HttpStatus;

/** Thrown when a submitted upload is rejected before processing. */
public class InvalidUploadException extends RuntimeException {

  private final HttpStatus status;

  public InvalidUploadException(HttpStatus status, String message) {
    super(message);
    this.status = status;
  }

  public HttpStatus getStatus() {
    return status;
  }
}
