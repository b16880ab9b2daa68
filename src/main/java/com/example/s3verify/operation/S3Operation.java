package com.example.s3verify.operation;

import com.example.s3verify.S3VerifyException;
import com.example.s3verify.config.ServerConfig;
import com.example.s3verify.fixture.FixtureContext;
import com.example.s3verify.httpclient.SignedRequest;
import com.example.s3verify.verify.ResponseVerifier;

import java.util.List;

/**
 * An API operation under test: how to derive expectations from fixtures, how to build its request
 * and how to verify its response.
 */
public interface S3Operation<T> {
  String getName();

  List<TestCase<T>> buildExpected(FixtureContext fixtures);

  SignedRequest newRequest(ServerConfig config, FixtureContext fixtures, TestCase<T> testCase)
    throws S3VerifyException;

  ResponseVerifier<T> getVerifier();
}
