package com.example.s3verify.operation;

import com.example.s3verify.S3VerifyException;
import com.example.s3verify.config.ServerConfig;
import com.example.s3verify.fixture.FixtureContext;
import com.example.s3verify.httpclient.S3RequestBuilder;
import com.example.s3verify.httpclient.SignedRequest;
import com.example.s3verify.verify.ResponseVerifier;
import io.vertx.core.http.HttpMethod;
import lombok.Getter;

/**
 * Bucket-level GET operation: the request is fully described by the test case's query parameters.
 */
@Getter
public abstract class AbstractS3Operation<T> implements S3Operation<T> {
  private final String name;
  private final ResponseVerifier<T> verifier;
  private final S3RequestBuilder requestBuilder;

  protected AbstractS3Operation(String name, ResponseVerifier<T> verifier, S3RequestBuilder requestBuilder) {
    this.name = name;
    this.verifier = verifier;
    this.requestBuilder = requestBuilder;
  }

  @Override
  public SignedRequest newRequest(ServerConfig config, FixtureContext fixtures, TestCase<T> testCase)
    throws S3VerifyException {
    return requestBuilder.newRequest(config, HttpMethod.GET, fixtures.getBucketName(), "",
      testCase.getParameters());
  }
}
