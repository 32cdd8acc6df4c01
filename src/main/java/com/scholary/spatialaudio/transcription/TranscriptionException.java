package com.scholary.spatialaudio.transcription;

/**
 * Exception thrown when transcription service calls fail.
 *
 * <p>This could be due to network issues, service unavailability, or a non-success status.
 */
public class TranscriptionException extends RuntimeException {

  public TranscriptionException(String message) {
    super(message);
  }

  public TranscriptionException(String message, Throwable cause) {
    super(message, cause);
  }
}
