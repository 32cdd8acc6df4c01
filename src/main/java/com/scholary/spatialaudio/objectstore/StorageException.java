package com.scholary.spatialaudio.objectstore;

/**
 * Thrown when reading or writing persisted state fails.
 *
 * <p>Covers the local filesystem (job directories, cache envelopes) as well as the object store.
 * A storage failure is fatal to the stage that hit it.
 */
public class StorageException extends RuntimeException {

  public StorageException(String message) {
    super(message);
  }

  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
