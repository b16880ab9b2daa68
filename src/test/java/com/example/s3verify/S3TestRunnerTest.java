package com.example.s3verify;

import com.example.s3verify.config.ServerConfig;
import com.example.s3verify.enums.ErrorKind;
import com.example.s3verify.fixture.FixtureContext;
import com.example.s3verify.fixture.FixtureSeeder;
import com.example.s3verify.httpclient.S3HttpClient;
import com.example.s3verify.httpclient.S3RequestBuilder;
import io.vertx.reactivex.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class S3TestRunnerTest {
  private FakeS3Server server;
  private final ByteArrayOutputStream output = new ByteArrayOutputStream();
  private final S3RequestBuilder requestBuilder = new S3RequestBuilder();
  private S3TestRunner runner;
  private FixtureContext fixtures;

  @BeforeEach
  void setUp() throws Exception {
    server = new FakeS3Server();
    ServerConfig config = ServerConfig.builder()
      .endpoint(server.endpoint())
      .region("us-east-1")
      .accessKey("access")
      .secretKey("secret")
      .build();
    S3HttpClient httpClient = new S3HttpClient(
      S3HttpClient.createHttpClient(Vertx.newInstance(server.vertx()), false));
    fixtures = new FixtureSeeder(config, requestBuilder, httpClient, new Random(3)).seed(45, 3);
    runner = new S3TestRunner(config, httpClient,
      new TestReporter(new PrintStream(output, true, StandardCharsets.UTF_8)));
  }

  @AfterEach
  void tearDown() throws Exception {
    server.close();
  }

  @Test
  void conformingServerPassesEveryTest() {
    List<TestResult> results = runner.runAll(S3TestRunner.defaultOperations(requestBuilder), fixtures);

    assertThat(results).allMatch(TestResult::isPassed);
    assertThat(output.toString(StandardCharsets.UTF_8)).containsSubsequence(
      "[01/2] ListObjects V1: PASSED",
      "[02/2] Multipart (List-Uploads): PASSED",
      "2/2 tests passed");
  }

  @Test
  void failedTestDoesNotStopTheRun() {
    server.listStrayKey("stray");

    List<TestResult> results = runner.runAll(S3TestRunner.defaultOperations(requestBuilder), fixtures);

    assertThat(results).extracting(TestResult::isPassed).containsExactly(false, true);
    assertThat(results.get(0).getError().getKind()).isEqualTo(ErrorKind.UNEXPECTED_COUNT);
    assertThat(output.toString(StandardCharsets.UTF_8)).containsSubsequence(
      "[01/2] ListObjects V1: FAILED (Unexpected Count: Unexpected Number of Objects Listed: wanted 45, got 46)",
      "[02/2] Multipart (List-Uploads): PASSED",
      "1/2 tests passed");
  }

  @Test
  void errorStatusFailsEveryListing() {
    server.failListings(500);

    List<TestResult> results = runner.runAll(S3TestRunner.defaultOperations(requestBuilder), fixtures);

    assertThat(results).noneMatch(TestResult::isPassed);
    assertThat(results).extracting(result -> result.getError().getKind())
      .containsOnly(ErrorKind.UNEXPECTED_STATUS);
    assertThat(results.get(0).getError().getReceived()).isEqualTo("500 Internal Server Error");
  }

  @Test
  void testStopsAtFirstFailingCase() {
    server.failListings(503);

    runner.runTest(S3TestRunner.defaultOperations(requestBuilder).get(0), 1, 1, fixtures);

    assertThat(server.requestLog()).filteredOn(line -> line.startsWith("GET ")).hasSize(1);
  }
}
