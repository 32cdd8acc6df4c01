package com.scholary.spatialaudio.http;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Minimal multipart/form-data encoder for {@link java.net.http.HttpClient}, which has no
 * built-in multipart support.
 *
 * <pre>
 * --boundary
 * Content-Disposition: form-data; name="file"; filename="song.mp3"
 * Content-Type: application/octet-stream
 *
 * [binary data]
 * --boundary
 * Content-Disposition: form-data; name="language"
 *
 * en
 * --boundary--
 * </pre>
 */
public class MultipartBody {

  private final String boundary = UUID.randomUUID().toString();
  private final ByteArrayOutputStream body = new ByteArrayOutputStream();

  public MultipartBody addFile(String name, String filename, String contentType, byte[] content) {
    StringBuilder sb = new StringBuilder();
    sb.append("--").append(boundary).append("\r\n");
    sb.append("Content-Disposition: form-data; name=\"")
        .append(name)
        .append("\"; filename=\"")
        .append(filename.replace("\"", ""))
        .append("\"\r\n");
    sb.append("Content-Type: ").append(contentType).append("\r\n\r\n");

    body.writeBytes(sb.toString().getBytes(StandardCharsets.UTF_8));
    body.writeBytes(content);
    body.writeBytes("\r\n".getBytes(StandardCharsets.UTF_8));
    return this;
  }

  public MultipartBody addField(String name, String value) {
    StringBuilder sb = new StringBuilder();
    sb.append("--").append(boundary).append("\r\n");
    sb.append("Content-Disposition: form-data; name=\"").append(name).append("\"\r\n\r\n");
    sb.append(value).append("\r\n");
    body.writeBytes(sb.toString().getBytes(StandardCharsets.UTF_8));
    return this;
  }

  public String contentType() {
    return "multipart/form-data; boundary=" + boundary;
  }

  /** Encoded body including the closing boundary. */
  public byte[] toByteArray() {
    ByteArrayOutputStream out = new ByteArrayOutputStream(body.size() + boundary.length() + 8);
    out.writeBytes(body.toByteArray());
    out.writeBytes(("--" + boundary + "--\r\n").getBytes(StandardCharsets.UTF_8));
    return out.toByteArray();
  }
}
