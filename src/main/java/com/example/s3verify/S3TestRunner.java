package com.example.s3verify;

import com.example.s3verify.config.ServerConfig;
import com.example.s3verify.fixture.FixtureContext;
import com.example.s3verify.httpclient.S3HttpClient;
import com.example.s3verify.httpclient.S3RequestBuilder;
import com.example.s3verify.httpclient.S3Response;
import com.example.s3verify.httpclient.SignedRequest;
import com.example.s3verify.operation.ListMultipartUploadsOperation;
import com.example.s3verify.operation.ListObjectsV1Operation;
import com.example.s3verify.operation.S3Operation;
import com.example.s3verify.operation.TestCase;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Runs operations strictly one after another. A test passes only when every one of its test cases passes;
 * it stops at the first failing case, and the run carries on with the next test.
 */
@Slf4j
public class S3TestRunner {
  private final ServerConfig config;
  private final S3HttpClient httpClient;
  private final TestReporter reporter;

  public S3TestRunner(ServerConfig config, S3HttpClient httpClient, TestReporter reporter) {
    this.config = config;
    this.httpClient = httpClient;
    this.reporter = reporter;
  }

  public static List<S3Operation<?>> defaultOperations(S3RequestBuilder requestBuilder) {
    return Arrays.asList(
      new ListObjectsV1Operation(requestBuilder),
      new ListMultipartUploadsOperation(requestBuilder));
  }

  public List<TestResult> runAll(List<S3Operation<?>> operations, FixtureContext fixtures) {
    List<TestResult> results = new ArrayList<>();
    for (int i = 0; i < operations.size(); i++) {
      results.add(runTest(operations.get(i), i + 1, operations.size(), fixtures));
    }
    reporter.summary(results);
    return results;
  }

  public <T> TestResult runTest(S3Operation<T> operation, int index, int total, FixtureContext fixtures) {
    TestResult result;
    try {
      for (TestCase<T> testCase : operation.buildExpected(fixtures)) {
        runTestCase(operation, fixtures, testCase);
      }
      result = TestResult.passed(operation.getName(), index, total);
    } catch (S3VerifyException e) {
      result = TestResult.failed(operation.getName(), index, total, e);
    }
    reporter.report(result);
    return result;
  }

  private <T> void runTestCase(S3Operation<T> operation, FixtureContext fixtures, TestCase<T> testCase)
    throws S3VerifyException {
    log.debug("{} ({})", operation.getName(), testCase.getDescription());
    SignedRequest request = operation.newRequest(config, fixtures, testCase);
    S3Response response = httpClient.execute(request);
    log.debug("Received {}:\n{}", response.getStatus(), response.bodyAsString());
    operation.getVerifier().verify(response, testCase.getExpectedStatus(), testCase.getExpected());
  }
}
