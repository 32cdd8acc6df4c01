package com.scholary.spatialaudio.config;

import com.scholary.spatialaudio.objectstore.BlobStore;
import com.scholary.spatialaudio.objectstore.ObjectStoreProperties;
import com.scholary.spatialaudio.objectstore.S3BlobStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the S3 blob backend.
 *
 * <p>Active only with {@code pipeline.cache.blob-backend=s3}; cache blobs then go to the
 * configured bucket while response envelopes stay on local disk.
 */
@Configuration
@ConditionalOnProperty(name = "pipeline.cache.blob-backend", havingValue = "s3")
@EnableConfigurationProperties(ObjectStoreProperties.class)
public class ObjectStoreConfig {

  @Bean(destroyMethod = "close")
  public BlobStore s3BlobStore(ObjectStoreProperties properties) {
    return new S3BlobStore(properties);
  }
}
