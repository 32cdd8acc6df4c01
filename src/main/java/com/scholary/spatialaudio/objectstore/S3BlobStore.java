package com.scholary.spatialaudio.objectstore;

import java.net.URI;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * S3/MinIO blob store.
 *
 * <p>Uses AWS SDK v2, which works with real S3 and with S3-compatible services. MinIO needs an
 * endpoint override and path-style access. The SDK retries transient failures on its own; a
 * missing key is reported as an empty result rather than an error.
 */
public class S3BlobStore implements BlobStore, AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(S3BlobStore.class);

  private final S3Client s3Client;
  private final String bucket;

  public S3BlobStore(ObjectStoreProperties properties) {
    this(buildClient(properties), properties.bucket());
  }

  S3BlobStore(S3Client s3Client, String bucket) {
    this.s3Client = s3Client;
    this.bucket = bucket;
  }

  private static S3Client buildClient(ObjectStoreProperties properties) {
    LOGGER.info(
        "Initializing S3 blob store: endpoint={}, bucket={}, pathStyleAccess={}",
        properties.endpoint(),
        properties.bucket(),
        properties.pathStyleAccess());

    AwsBasicCredentials credentials =
        AwsBasicCredentials.create(properties.accessKey(), properties.secretKey());

    Region region =
        properties.region() != null && !properties.region().isEmpty()
            ? Region.of(properties.region())
            : Region.US_EAST_1;

    return S3Client.builder()
        .region(region)
        .credentialsProvider(StaticCredentialsProvider.create(credentials))
        .endpointOverride(URI.create(properties.endpoint()))
        .forcePathStyle(properties.pathStyleAccess())
        .build();
  }

  @Override
  public Optional<byte[]> get(String name) {
    LOGGER.debug("Fetching blob: bucket={}, key={}", bucket, name);

    try {
      GetObjectRequest request = GetObjectRequest.builder().bucket(bucket).key(name).build();
      byte[] content = s3Client.getObjectAsBytes(request).asByteArray();
      LOGGER.debug("Retrieved blob: bucket={}, key={}, bytes={}", bucket, name, content.length);
      return Optional.of(content);

    } catch (NoSuchKeyException e) {
      return Optional.empty();

    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to retrieve blob: bucket=%s, key=%s, statusCode=%s",
              bucket, name, e.statusCode());
      LOGGER.error(message, e);
      throw new StorageException(message, e);
    }
  }

  @Override
  public void put(String name, byte[] content, String contentType) {
    LOGGER.debug(
        "Uploading blob: bucket={}, key={}, bytes={}, contentType={}",
        bucket,
        name,
        content.length,
        contentType);

    try {
      PutObjectRequest request =
          PutObjectRequest.builder()
              .bucket(bucket)
              .key(name)
              .contentType(contentType)
              .contentLength((long) content.length)
              .build();
      s3Client.putObject(request, RequestBody.fromBytes(content));
      LOGGER.info("Uploaded blob: bucket={}, key={}", bucket, name);

    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to upload blob: bucket=%s, key=%s, statusCode=%s",
              bucket, name, e.statusCode());
      LOGGER.error(message, e);
      throw new StorageException(message, e);
    }
  }

  @Override
  public void close() {
    LOGGER.info("Closing S3 client");
    s3Client.close();
  }
}
