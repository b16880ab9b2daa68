package com.example.s3verify.utils;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

public class S3Utils {
  private S3Utils() {
  }

  /**
   * RFC 3986 percent-encoding as SigV4 expects it: space is {@code %20}, {@code ~} stays literal.
   */
  public static String urlEncode(String value) {
    if (value == null) {
      return "";
    }
    return URLEncoder.encode(value, StandardCharsets.UTF_8)
      .replace("+", "%20")
      .replace("*", "%2A")
      .replace("%7E", "~");
  }

  /**
   * Same as {@link #urlEncode(String)} but keeps {@code /} so object keys map onto path segments.
   */
  public static String encodePath(String path) {
    return urlEncode(path).replace("%2F", "/");
  }

  /**
   * Strips one pair of surrounding double quotes, as servers wrap ETags in them.
   */
  public static String trimQuotes(String value) {
    if (value == null) {
      return null;
    }
    if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
      return value.substring(1, value.length() - 1);
    }
    return value;
  }
}
