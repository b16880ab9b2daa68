package com.example.s3verify.config;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/**
 * Everything a request needs to reach and authenticate against the server under test.
 * Built once at startup and shared read-only by every test of the run.
 */
@Value
@Builder(toBuilder = true)
public class ServerConfig {
  String endpoint;
  String region;
  String accessKey;
  @ToString.Exclude
  String secretKey;
  boolean verbose;
}
