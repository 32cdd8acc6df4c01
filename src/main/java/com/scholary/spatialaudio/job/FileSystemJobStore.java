package com.scholary.spatialaudio.job;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.spatialaudio.objectstore.StorageException;
import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JobStore backed by one directory per job under {@code <root>/<jobId>}.
 *
 * <p>Loaded job records are kept in a bounded Caffeine cache. Records are immutable once saved, so
 * a cached record is always current.
 */
public class FileSystemJobStore implements JobStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(FileSystemJobStore.class);

  private static final String DEFAULT_UPLOAD_NAME = "upload.bin";

  private final Path root;
  private final ObjectMapper objectMapper;
  private final Cache<String, Job> records;

  public FileSystemJobStore(Path root, ObjectMapper objectMapper, long maxCachedRecords) {
    this.root = root.toAbsolutePath().normalize();
    this.objectMapper = objectMapper;
    this.records = Caffeine.newBuilder().maximumSize(maxCachedRecords).build();

    try {
      Files.createDirectories(this.root);
    } catch (IOException e) {
      throw new StorageException("Failed to create jobs directory: " + this.root, e);
    }
    LOGGER.info("Initialized job store: root={}", this.root);
  }

  @Override
  public String createJob() {
    String jobId = UUID.randomUUID().toString();
    try {
      Files.createDirectory(root.resolve(jobId));
    } catch (FileAlreadyExistsException e) {
      throw new StorageException("Job directory already exists: " + jobId, e);
    } catch (IOException e) {
      throw new StorageException("Failed to create job directory: " + jobId, e);
    }
    LOGGER.debug("Created job directory: jobId={}", jobId);
    return jobId;
  }

  @Override
  public Path saveUpload(String jobId, String filename, byte[] content) {
    String safeName = JobStore.sanitizeName(filename);
    if (safeName.isEmpty() || safeName.equals(JOB_RECORD)) {
      safeName = DEFAULT_UPLOAD_NAME;
    }
    return write(jobId, safeName, content);
  }

  @Override
  public Path saveArtifact(String jobId, String name, JsonNode payload) {
    try {
      return write(
          jobId, name, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(payload));
    } catch (IOException e) {
      throw new StorageException("Failed to serialize artifact: " + name, e);
    }
  }

  @Override
  public Path saveArtifact(String jobId, String name, byte[] content) {
    return write(jobId, name, content);
  }

  @Override
  public Path copyArtifact(String jobId, Path source, String destName) {
    String name = destName != null ? destName : source.getFileName().toString();
    Path target = artifactPath(jobId, name);
    try {
      Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException e) {
      throw new StorageException("Failed to copy artifact: " + source + " -> " + name, e);
    }
    LOGGER.debug("Copied artifact: jobId={}, name={}", jobId, target.getFileName());
    return target;
  }

  @Override
  public List<String> listArtifacts(String jobId) {
    Path dir = jobDir(jobId);
    try (Stream<Path> files = Files.list(dir)) {
      return files
          .filter(Files::isRegularFile)
          .map(path -> path.getFileName().toString())
          .filter(name -> !name.equals(JOB_RECORD))
          .sorted()
          .toList();
    } catch (IOException e) {
      throw new StorageException("Failed to list artifacts: " + jobId, e);
    }
  }

  @Override
  public byte[] readArtifact(String jobId, String name) {
    Path path = artifactPath(jobId, name);
    if (!Files.isRegularFile(path)) {
      throw new JobNotFoundException("Artifact not found: " + JobStore.sanitizeName(name));
    }
    try {
      return Files.readAllBytes(path);
    } catch (IOException e) {
      throw new StorageException("Failed to read artifact: " + path.getFileName(), e);
    }
  }

  @Override
  public Path artifactPath(String jobId, String name) {
    String safeName = JobStore.sanitizeName(name);
    if (safeName.isEmpty()) {
      throw new JobNotFoundException("Artifact not found: " + name);
    }
    return jobDir(jobId).resolve(safeName);
  }

  @Override
  public void saveJob(Job job) {
    Path path = jobDir(job.jobId()).resolve(JOB_RECORD);
    try {
      Files.write(path, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(job));
    } catch (IOException e) {
      throw new StorageException("Failed to save job record: " + job.jobId(), e);
    }
    records.put(job.jobId(), job);
    LOGGER.info("Saved job record: jobId={}, status={}", job.jobId(), job.status().id());
  }

  @Override
  public Job loadJob(String jobId) {
    Job cached = records.getIfPresent(jobId);
    if (cached != null) {
      return cached;
    }

    Path path = jobDir(jobId).resolve(JOB_RECORD);
    try {
      Job job = objectMapper.readValue(Files.readAllBytes(path), Job.class);
      records.put(jobId, job);
      return job;
    } catch (NoSuchFileException e) {
      throw new JobNotFoundException("Job not found: " + jobId);
    } catch (IOException e) {
      throw new StorageException("Failed to load job record: " + jobId, e);
    }
  }

  private Path write(String jobId, String name, byte[] content) {
    Path path = artifactPath(jobId, name);
    try {
      Files.write(path, content);
    } catch (IOException e) {
      throw new StorageException("Failed to write artifact: " + path.getFileName(), e);
    }
    LOGGER.debug("Wrote artifact: jobId={}, name={}, bytes={}", jobId, path.getFileName(), content.length);
    return path;
  }

  private Path jobDir(String jobId) {
    try {
      UUID.fromString(jobId);
    } catch (IllegalArgumentException | NullPointerException e) {
      throw new JobNotFoundException("Job not found: " + jobId);
    }
    Path dir = root.resolve(jobId);
    if (!Files.isDirectory(dir)) {
      throw new JobNotFoundException("Job not found: " + jobId);
    }
    return dir;
  }
}
