package com.example.s3verify.utils;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class S3UtilsTest {

  @Test
  void urlEncodeFollowsRfc3986() {
    assertThat(S3Utils.urlEncode("a b*c~d/e")).isEqualTo("a%20b%2Ac~d%2Fe");
    assertThat(S3Utils.urlEncode("-_.")).isEqualTo("-_.");
    assertThat(S3Utils.urlEncode(null)).isEmpty();
  }

  @Test
  void encodePathKeepsSeparators() {
    assertThat(S3Utils.encodePath("s3verify/object/001 copy")).isEqualTo("s3verify/object/001%20copy");
  }

  @Test
  void trimQuotesStripsOnePair() {
    assertThat(S3Utils.trimQuotes("\"abc\"")).isEqualTo("abc");
    assertThat(S3Utils.trimQuotes("abc")).isEqualTo("abc");
    assertThat(S3Utils.trimQuotes("\"")).isEqualTo("\"");
    assertThat(S3Utils.trimQuotes(null)).isNull();
  }
}
