package com.scholary.spatialaudio.objectstore;

import java.util.Optional;

/**
 * Storage for large binary cache values.
 *
 * <p>Two implementations exist: the local filesystem (default) and S3/MinIO. Object names are
 * relative paths such as {@code cache/blobs/<key>/stems.zip}.
 */
public interface BlobStore {

  /**
   * Read an object.
   *
   * @param name the object name
   * @return the bytes, or empty if the object does not exist
   * @throws StorageException if the read fails for any other reason
   */
  Optional<byte[]> get(String name);

  /**
   * Write an object, replacing any existing one.
   *
   * @param name the object name
   * @param content the bytes
   * @param contentType MIME type of the content
   * @throws StorageException if the write fails
   */
  void put(String name, byte[] content, String contentType);
}
