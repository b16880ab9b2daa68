package com.example.s3verify;

import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor
public class TestResult {
  String operationName;
  int index;
  int total;
  boolean passed;
  S3VerifyException error;

  public static TestResult passed(String operationName, int index, int total) {
    return new TestResult(operationName, index, total, true, null);
  }

  public static TestResult failed(String operationName, int index, int total, S3VerifyException error) {
    return new TestResult(operationName, index, total, false, error);
  }

  /**
   * Prefix shared by every line reported for this test, e.g. {@code [01/02] ListObjects V1:}.
   */
  public String getLabel() {
    return String.format("[%02d/%d] %s:", index, total, operationName);
  }
}
