package com.scholary.spatialaudio.objectstore;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Blob store rooted at a local directory. */
public class FileSystemBlobStore implements BlobStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(FileSystemBlobStore.class);

  private final Path root;

  public FileSystemBlobStore(Path root) {
    this.root = root.toAbsolutePath().normalize();
    try {
      Files.createDirectories(this.root);
    } catch (IOException e) {
      throw new StorageException("Failed to create blob directory: " + this.root, e);
    }
    LOGGER.info("Initialized filesystem blob store: root={}", this.root);
  }

  @Override
  public Optional<byte[]> get(String name) {
    Path path = resolve(name);
    try {
      return Optional.of(Files.readAllBytes(path));
    } catch (NoSuchFileException e) {
      return Optional.empty();
    } catch (IOException e) {
      throw new StorageException("Failed to read blob: " + name, e);
    }
  }

  @Override
  public void put(String name, byte[] content, String contentType) {
    Path path = resolve(name);
    try {
      Files.createDirectories(path.getParent());
      Path tmp = path.resolveSibling(path.getFileName() + "." + UUID.randomUUID() + ".tmp");
      Files.write(tmp, content);
      Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      LOGGER.debug("Stored blob: name={}, bytes={}", name, content.length);
    } catch (IOException e) {
      throw new StorageException("Failed to write blob: " + name, e);
    }
  }

  private Path resolve(String name) {
    Path path = root.resolve(name).normalize();
    if (!path.startsWith(root)) {
      throw new StorageException("Blob name escapes the blob root: " + name);
    }
    return path;
  }
}
