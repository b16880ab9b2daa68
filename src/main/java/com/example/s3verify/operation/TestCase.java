package com.example.s3verify.operation;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * One request/verify round of a test: the query parameters to send and the response they should produce.
 */
@Value
@Builder
public class TestCase<T> {
  String description;
  @Singular
  Map<String, String> parameters;
  @Builder.Default
  String expectedStatus = "200 OK";
  T expected;
}
