package com.scholary.spatialaudio.separation;

/** Exception thrown when a separation service call fails. */
public class SeparationException extends RuntimeException {

  public SeparationException(String message) {
    super(message);
  }

  public SeparationException(String message, Throwable cause) {
    super(message, cause);
  }
}
