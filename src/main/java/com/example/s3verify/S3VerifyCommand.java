package com.example.s3verify;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.example.s3verify.config.RegionResolver;
import com.example.s3verify.config.ServerConfig;
import com.example.s3verify.enums.ErrorKind;
import com.example.s3verify.fixture.FixtureContext;
import com.example.s3verify.fixture.FixtureSeeder;
import com.example.s3verify.httpclient.S3HttpClient;
import com.example.s3verify.httpclient.S3RequestBuilder;
import com.example.s3verify.httpclient.TargetUrlBuilder;
import io.vertx.reactivex.core.Vertx;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.security.SecureRandom;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;

@Slf4j
@Command(name = "s3verify",
  description = "Checks an S3-compatible server's listing APIs against fixtures it creates itself.",
  mixinStandardHelpOptions = true,
  version = "s3verify 1.0.0")
public class S3VerifyCommand implements Callable<Integer> {
  public static final int EXIT_PASSED = 0;
  public static final int EXIT_FAILED = 1;
  public static final int EXIT_FATAL = 2;

  @Option(names = {"-u", "--url"}, defaultValue = "${env:S3_URL}",
    description = "Endpoint of the server under test, e.g. http://localhost:9000 (env S3_URL)")
  String endpoint;

  @Option(names = {"-a", "--access"}, defaultValue = "${env:S3_ACCESS}",
    description = "Access key (env S3_ACCESS)")
  String accessKey;

  @Option(names = {"-s", "--secret"}, defaultValue = "${env:S3_SECRET}",
    description = "Secret key (env S3_SECRET)")
  String secretKey;

  @Option(names = {"-r", "--region"}, defaultValue = "${env:S3_REGION}",
    description = "Signing region; defaults to us-west-1 for Amazon, us-east-1 elsewhere (env S3_REGION)")
  String region;

  @Option(names = {"-v", "--verbose"}, description = "Log requests, signing steps and wire activity")
  boolean verbose;

  @Option(names = "--objects", defaultValue = "45", description = "Objects to seed (default: ${DEFAULT-VALUE})")
  int objectCount;

  @Option(names = "--uploads", defaultValue = "3",
    description = "Multipart uploads to seed (default: ${DEFAULT-VALUE})")
  int uploadCount;

  @Option(names = "--keep-fixtures", description = "Leave the seeded bucket in place after the run")
  boolean keepFixtures;

  private final TestReporter reporter;

  public S3VerifyCommand() {
    this(new TestReporter());
  }

  S3VerifyCommand(TestReporter reporter) {
    this.reporter = reporter;
  }

  @Override
  public Integer call() {
    if (verbose) {
      ((Logger) LoggerFactory.getLogger("com.example.s3verify")).setLevel(Level.DEBUG);
      ((Logger) LoggerFactory.getLogger("io.netty.handler.logging")).setLevel(Level.DEBUG);
    }
    ServerConfig config;
    try {
      config = buildConfig();
    } catch (S3VerifyException e) {
      reporter.fatal(e);
      return EXIT_FATAL;
    }
    log.info("Testing {} in region {}", config.getEndpoint(), config.getRegion());

    Vertx vertx = Vertx.vertx();
    try {
      return run(config, new S3HttpClient(S3HttpClient.createHttpClient(vertx, verbose)));
    } finally {
      vertx.rxClose().blockingAwait();
    }
  }

  int run(ServerConfig config, S3HttpClient httpClient) {
    S3RequestBuilder requestBuilder = new S3RequestBuilder();
    FixtureSeeder seeder = new FixtureSeeder(config, requestBuilder, httpClient, new SecureRandom());

    FixtureContext fixtures;
    try {
      fixtures = seeder.seed(objectCount, uploadCount);
    } catch (S3VerifyException e) {
      reporter.fatal(e);
      return EXIT_FATAL;
    }

    List<TestResult> results = new S3TestRunner(config, httpClient, reporter)
      .runAll(S3TestRunner.defaultOperations(requestBuilder), fixtures);

    if (keepFixtures) {
      log.info("Keeping bucket {}", fixtures.getBucketName());
    } else {
      try {
        seeder.cleanup(fixtures);
      } catch (S3VerifyException e) {
        log.warn("Cleanup of bucket {} incomplete: {}", fixtures.getBucketName(), e.getMessage());
      }
    }
    return results.stream().allMatch(TestResult::isPassed) ? EXIT_PASSED : EXIT_FAILED;
  }

  ServerConfig buildConfig() throws S3VerifyException {
    if (endpoint == null || endpoint.isEmpty()) {
      throw new S3VerifyException(ErrorKind.CONFIG_ERROR, "No endpoint given (--url or S3_URL)");
    }
    if (accessKey == null || accessKey.isEmpty() || secretKey == null || secretKey.isEmpty()) {
      throw new S3VerifyException(ErrorKind.CONFIG_ERROR,
        "Credentials missing (--access/--secret or S3_ACCESS/S3_SECRET)");
    }
    if (objectCount < 0 || uploadCount < 0) {
      throw new S3VerifyException(ErrorKind.CONFIG_ERROR, "Fixture counts must not be negative");
    }
    String resolvedRegion = RegionResolver.resolve(endpoint, region);
    // fail on a bad endpoint before anything is sent
    TargetUrlBuilder.makeTargetUrl(endpoint, "", "", resolvedRegion, Collections.emptyMap());
    return ServerConfig.builder()
      .endpoint(endpoint)
      .region(resolvedRegion)
      .accessKey(accessKey)
      .secretKey(secretKey)
      .verbose(verbose)
      .build();
  }
}
