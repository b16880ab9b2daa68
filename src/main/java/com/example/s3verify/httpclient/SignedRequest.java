package com.example.s3verify.httpclient;

import io.vertx.core.http.HttpMethod;
import lombok.Builder;
import lombok.Value;

import java.net.URI;
import java.util.Map;

/**
 * A fully signed request, sent exactly as built.
 */
@Value
@Builder
public class SignedRequest {
  HttpMethod method;
  URI url;
  Map<String, String> headers;
  byte[] body;

  public boolean hasBody() {
    return body != null && body.length > 0;
  }
}
