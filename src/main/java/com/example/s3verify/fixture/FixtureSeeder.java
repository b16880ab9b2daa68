package com.example.s3verify.fixture;

import com.example.s3verify.S3VerifyException;
import com.example.s3verify.config.RegionResolver;
import com.example.s3verify.config.ServerConfig;
import com.example.s3verify.enums.ErrorKind;
import com.example.s3verify.httpclient.ContentHasher;
import com.example.s3verify.httpclient.HashedPayload;
import com.example.s3verify.httpclient.S3HttpClient;
import com.example.s3verify.httpclient.S3RequestBuilder;
import com.example.s3verify.httpclient.S3Response;
import com.example.s3verify.httpclient.SignedRequest;
import com.example.s3verify.model.CreateBucketConfiguration;
import com.example.s3verify.model.ErrorResponse;
import com.example.s3verify.model.InitiateMultipartUploadResult;
import com.example.s3verify.model.ObjectInfo;
import com.example.s3verify.model.ObjectMultipartInfo;
import com.example.s3verify.utils.XmlCodec;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.vertx.core.http.HttpMethod;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Random;

/**
 * Creates the bucket, objects and in-flight multipart uploads the list tests are checked against,
 * and removes them again afterwards. Only status codes are checked here.
 */
@Slf4j
public class FixtureSeeder {
  public static final String BUCKET_PREFIX = "s3verify-";
  public static final String OBJECT_PREFIX = "s3verify/object/";
  public static final String UPLOAD_PREFIX = "s3verify/multipart/";
  public static final int MAX_OBJECT_SIZE = 1024;

  private static final String LETTERS = "abcdefghijklmnopqrstuvwxyz0123456789";

  private final ServerConfig config;
  private final S3RequestBuilder requestBuilder;
  private final S3HttpClient httpClient;
  private final Random random;

  public FixtureSeeder(ServerConfig config, S3RequestBuilder requestBuilder, S3HttpClient httpClient, Random random) {
    this.config = config;
    this.requestBuilder = requestBuilder;
    this.httpClient = httpClient;
    this.random = random;
  }

  public FixtureContext seed(int objectCount, int uploadCount) throws S3VerifyException {
    String bucketName = BUCKET_PREFIX + randomString(20);
    makeBucket(bucketName);
    log.info("Created bucket {}", bucketName);

    FixtureContext.FixtureContextBuilder fixtures = FixtureContext.builder().bucketName(bucketName);
    try {
      for (int i = 0; i < objectCount; i++) {
        fixtures.object(putObject(bucketName, String.format("%s%03d", OBJECT_PREFIX, i)));
      }
      for (int i = 0; i < uploadCount; i++) {
        fixtures.upload(initiateMultipartUpload(bucketName, String.format("%s%02d", UPLOAD_PREFIX, i)));
      }
    } catch (S3VerifyException e) {
      // undo the partial seed before reporting the setup failure
      try {
        cleanup(fixtures.build());
      } catch (S3VerifyException cleanupError) {
        log.warn("Cleanup of partially seeded bucket {} incomplete: {}", bucketName, cleanupError.getMessage());
      }
      throw e;
    }
    log.info("Seeded {} objects and {} multipart uploads", objectCount, uploadCount);
    return fixtures.build();
  }

  /**
   * Removes everything {@link #seed(int, int)} created. Keeps going after a failed call and rethrows the first failure.
   */
  public void cleanup(FixtureContext fixtures) throws S3VerifyException {
    String bucketName = fixtures.getBucketName();
    S3VerifyException firstFailure = null;
    for (ObjectMultipartInfo upload : fixtures.getUploads()) {
      try {
        send(HttpMethod.DELETE, bucketName, upload.getKey(),
          Collections.singletonMap("uploadId", upload.getUploadId()), new byte[0], 204);
      } catch (S3VerifyException e) {
        log.warn("Failed to abort upload {} of {}", upload.getUploadId(), upload.getKey(), e);
        firstFailure = firstFailure == null ? e : firstFailure;
      }
    }
    for (ObjectInfo object : fixtures.getObjects()) {
      try {
        send(HttpMethod.DELETE, bucketName, object.getKey(), Collections.emptyMap(), new byte[0], 204);
      } catch (S3VerifyException e) {
        log.warn("Failed to delete object {}", object.getKey(), e);
        firstFailure = firstFailure == null ? e : firstFailure;
      }
    }
    try {
      send(HttpMethod.DELETE, bucketName, "", Collections.emptyMap(), new byte[0], 204);
      log.info("Removed bucket {}", bucketName);
    } catch (S3VerifyException e) {
      log.warn("Failed to delete bucket {}", bucketName, e);
      firstFailure = firstFailure == null ? e : firstFailure;
    }
    if (firstFailure != null) {
      throw firstFailure;
    }
  }

  void makeBucket(String bucketName) throws S3VerifyException {
    byte[] body = new byte[0];
    if (!RegionResolver.GLOBAL_DEFAULT_REGION.equals(config.getRegion())) {
      try {
        body = XmlCodec.encode(new CreateBucketConfiguration(config.getRegion())).getBytes(StandardCharsets.UTF_8);
      } catch (JsonProcessingException e) {
        throw new S3VerifyException(ErrorKind.FIXTURE_ERROR, "Cannot encode bucket configuration", e);
      }
    }
    send(HttpMethod.PUT, bucketName, "", Collections.emptyMap(), body, 200);
  }

  ObjectInfo putObject(String bucketName, String key) throws S3VerifyException {
    byte[] content = randomString(1 + random.nextInt(MAX_OBJECT_SIZE)).getBytes(StandardCharsets.UTF_8);
    HashedPayload payload = ContentHasher.computeHash(content);
    Map<String, String> headers = new HashMap<>();
    headers.put("Content-MD5", payload.md5Base64());
    send(HttpMethod.PUT, bucketName, key, Collections.emptyMap(), headers, content, 200);
    return ObjectInfo.builder()
      .key(key)
      .size(payload.getLength())
      .etag(payload.md5Hex())
      .lastModified(Instant.now())
      .build();
  }

  ObjectMultipartInfo initiateMultipartUpload(String bucketName, String key) throws S3VerifyException {
    S3Response response = send(HttpMethod.POST, bucketName, key, Collections.singletonMap("uploads", ""),
      new byte[0], 200);
    InitiateMultipartUploadResult result;
    try {
      result = XmlCodec.decode(response.getBody(), InitiateMultipartUploadResult.class);
    } catch (IOException e) {
      throw new S3VerifyException(ErrorKind.FIXTURE_ERROR, "Cannot decode InitiateMultipartUploadResult for " + key, e);
    }
    if (result == null || result.getUploadId() == null || result.getUploadId().isEmpty()) {
      throw new S3VerifyException(ErrorKind.FIXTURE_ERROR, "No upload id returned for " + key);
    }
    log.debug("Multipart upload initiated for {}: {}", key, result.getUploadId());
    return ObjectMultipartInfo.builder()
      .key(key)
      .uploadId(result.getUploadId())
      .initiated(Instant.now())
      .build();
  }

  private S3Response send(HttpMethod method, String bucketName, String key, Map<String, String> parameters,
                          byte[] body, int expectedStatus) throws S3VerifyException {
    return send(method, bucketName, key, parameters, Collections.emptyMap(), body, expectedStatus);
  }

  private S3Response send(HttpMethod method, String bucketName, String key, Map<String, String> parameters,
                          Map<String, String> headers, byte[] body, int expectedStatus) throws S3VerifyException {
    SignedRequest request = requestBuilder.newRequest(config, method, bucketName, key, parameters, headers,
      new ByteArrayInputStream(body));
    S3Response response = httpClient.execute(request);
    if (response.getStatusCode() != expectedStatus) {
      throw new S3VerifyException(ErrorKind.FIXTURE_ERROR,
        String.format("%s %s: wanted %d, got %s%s", method, request.getUrl(), expectedStatus,
          response.getStatus(), describeError(response)),
        expectedStatus, response.getStatus(), null);
    }
    return response;
  }

  private static String describeError(S3Response response) {
    try {
      ErrorResponse error = XmlCodec.decode(response.getBody(), ErrorResponse.class);
      return error == null || error.getCode() == null ? "" : " (" + error.getCode() + ": " + error.getMessage() + ")";
    } catch (IOException e) {
      log.debug("Error body is not an S3 error document", e);
      return "";
    }
  }

  private String randomString(int length) {
    StringBuilder sb = new StringBuilder(length);
    for (int i = 0; i < length; i++) {
      sb.append(LETTERS.charAt(random.nextInt(LETTERS.length())));
    }
    return sb.toString();
  }
}
