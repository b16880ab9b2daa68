package com.example.s3verify.httpclient;

import com.example.s3verify.S3VerifyException;
import com.example.s3verify.config.ServerConfig;
import io.vertx.core.http.HttpMethod;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.net.URI;
import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
public class S3RequestBuilder {
  public static final String SERVICE = "s3";
  public static final String AUTHORIZATION = "Authorization";
  public static final String CONTENT_LENGTH = "Content-Length";

  private final Clock clock;

  public S3RequestBuilder() {
    this(Clock.systemUTC());
  }

  public S3RequestBuilder(Clock clock) {
    this.clock = clock;
  }

  /**
   * Request without a body, as every listing call is.
   */
  public SignedRequest newRequest(ServerConfig config, HttpMethod method, String bucketName, String objectName,
                                  Map<String, String> parameters) throws S3VerifyException {
    return newRequest(config, method, bucketName, objectName, parameters, Collections.emptyMap(),
      new ByteArrayInputStream(new byte[0]));
  }

  public SignedRequest newRequest(ServerConfig config, HttpMethod method, String bucketName, String objectName,
                                  Map<String, String> parameters, Map<String, String> extraHeaders, InputStream body)
    throws S3VerifyException {
    URI targetUrl = TargetUrlBuilder.makeTargetUrl(config.getEndpoint(), bucketName, objectName,
      config.getRegion(), parameters);
    HashedPayload payload = ContentHasher.computeHash(body);

    Map<String, String> headers = new LinkedHashMap<>(extraHeaders);
    headers.put(AwsV4Signer.X_AMZ_CONTENT_SHA256, payload.sha256Hex());
    if (payload.getLength() > 0) {
      headers.put(CONTENT_LENGTH, String.valueOf(payload.getLength()));
    }

    AwsSigner awsSigner = new AwsV4Signer(config.getAccessKey(), config.getSecretKey(), config.getRegion(),
      SERVICE, clock);
    String authorization = awsSigner.calculateAuthorization(method.name(), targetUrl, headers, payload.sha256Hex());
    headers.put(AUTHORIZATION, authorization);
    log.debug("Signed {} {} at {}", method, targetUrl, awsSigner.getAmzDate());

    return SignedRequest.builder()
      .method(method)
      .url(targetUrl)
      .headers(Collections.unmodifiableMap(headers))
      .body(payload.toByteArray())
      .build();
  }
}
