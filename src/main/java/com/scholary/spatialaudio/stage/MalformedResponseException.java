package com.scholary.spatialaudio.stage;

/**
 * Thrown when an external service answers successfully but with content we cannot use.
 *
 * <p>Examples: invalid JSON, a missing required field, a stem archive without the expected member.
 */
public class MalformedResponseException extends RuntimeException {

  public MalformedResponseException(String message) {
    super(message);
  }

  public MalformedResponseException(String message, Throwable cause) {
    super(message, cause);
  }
}
