package com.scholary.spatialaudio.api;

import com.scholary.spatialaudio.config.PipelineProperties;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.multipart.MultipartFile;

/**
 * Rejects uploads the pipeline should never see.
 *
 * <p>An absent or empty file is a 400. A file over {@code pipeline.max-upload-mb} is a 413.
 */
@Component
public class UploadValidator {

  private final long maxUploadBytes;

  public UploadValidator(PipelineProperties properties) {
    this.maxUploadBytes = properties.maxUploadBytes();
  }

  public void validate(MultipartFile file) {
    if (file == null || file.isEmpty()) {
      throw new InvalidUploadException(HttpStatus.BAD_REQUEST, "Uploaded file is empty");
    }
    if (file.getSize() > maxUploadBytes) {
      throw new InvalidUploadException(
          HttpStatus.PAYLOAD_TOO_LARGE,
          String.format(
              "Uploaded file is %d bytes, limit is %d bytes", file.getSize(), maxUploadBytes));
    }
  }
}
