package com.example.s3verify.httpclient;

import io.vertx.core.MultiMap;
import lombok.Builder;
import lombok.Value;

import java.nio.charset.StandardCharsets;

/**
 * A drained response: status line, case-insensitive headers and the complete body.
 */
@Value
@Builder
public class S3Response {
  int statusCode;
  String statusMessage;
  MultiMap headers;
  byte[] body;

  /**
   * Status line in the {@code "200 OK"} form.
   */
  public String getStatus() {
    return statusCode + " " + statusMessage;
  }

  public String getHeader(String name) {
    return headers == null ? null : headers.get(name);
  }

  public String bodyAsString() {
    return body == null ? "" : new String(body, StandardCharsets.UTF_8);
  }
}
