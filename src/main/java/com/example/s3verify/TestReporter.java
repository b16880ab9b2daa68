package com.example.s3verify;

import lombok.extern.slf4j.Slf4j;

import java.io.PrintStream;
import java.util.List;

/**
 * Prints one human-readable line per test and a summary at the end of the run.
 */
@Slf4j
public class TestReporter {
  private final PrintStream out;

  public TestReporter() {
    this(System.out);
  }

  public TestReporter(PrintStream out) {
    this.out = out;
  }

  public void report(TestResult result) {
    if (result.isPassed()) {
      out.println(result.getLabel() + " PASSED");
      return;
    }
    S3VerifyException error = result.getError();
    out.println(result.getLabel() + " FAILED (" + error.getKind().getDesc() + ": " + error.getMessage() + ")");
    log.debug("{} failed", result.getOperationName(), error);
  }

  public void summary(List<TestResult> results) {
    long passed = results.stream().filter(TestResult::isPassed).count();
    out.printf("%d/%d tests passed%n", passed, results.size());
  }

  public void fatal(S3VerifyException error) {
    out.println("s3verify: " + error.getKind().getDesc() + ": " + error.getMessage());
  }
}
