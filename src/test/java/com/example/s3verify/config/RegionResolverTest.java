package com.example.s3verify.config;

import com.example.s3verify.S3VerifyException;
import com.example.s3verify.enums.ErrorKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RegionResolverTest {

  @ParameterizedTest
  @ValueSource(strings = {
    "https://s3.amazonaws.com",
    "https://s3.eu-west-1.amazonaws.com",
    "https://s3-us-west-2.amazonaws.com",
    "https://s3.cn-north-1.amazonaws.com.cn"})
  void recognisesAmazonEndpoints(String endpoint) {
    assertThat(RegionResolver.isAmazonEndpoint(URI.create(endpoint))).isTrue();
  }

  @ParameterizedTest
  @ValueSource(strings = {"http://localhost:9000", "https://play.min.io", "https://mys3.amazonaws.com.evil.org"})
  void otherEndpointsAreNotAmazon(String endpoint) {
    assertThat(RegionResolver.isAmazonEndpoint(URI.create(endpoint))).isFalse();
  }

  @Test
  void defaultsDependOnEndpoint() throws Exception {
    assertThat(RegionResolver.resolve("https://s3.amazonaws.com", null)).isEqualTo("us-west-1");
    assertThat(RegionResolver.resolve("http://localhost:9000", "")).isEqualTo("us-east-1");
  }

  @Test
  void explicitRegionWins() throws Exception {
    assertThat(RegionResolver.resolve("https://s3.amazonaws.com", "ap-south-1")).isEqualTo("ap-south-1");
    assertThat(RegionResolver.resolve("http://localhost:9000", "eu-central-1")).isEqualTo("eu-central-1");
  }

  @Test
  void malformedEndpointIsAConfigError() {
    assertThatThrownBy(() -> RegionResolver.resolve("http://bad host", null))
      .isInstanceOf(S3VerifyException.class)
      .extracting(e -> ((S3VerifyException) e).getKind())
      .isEqualTo(ErrorKind.CONFIG_ERROR);
  }

  @Test
  void regionalHosts() {
    assertThat(RegionResolver.getS3Host("us-east-1")).isEqualTo("s3.amazonaws.com");
    assertThat(RegionResolver.getS3Host(null)).isEqualTo("s3.amazonaws.com");
    assertThat(RegionResolver.getS3Host("eu-west-1")).isEqualTo("s3.eu-west-1.amazonaws.com");
    assertThat(RegionResolver.getS3Host("cn-north-1")).isEqualTo("s3.cn-north-1.amazonaws.com.cn");
  }
}
