package com.example.s3verify.enums;

import java.util.HashMap;
import java.util.Map;

public enum ErrorKind {
  CONFIG_ERROR(1, "Configuration Error"),
  INVALID_ENDPOINT(2, "Invalid Endpoint"),
  FIXTURE_ERROR(3, "Fixture Setup Error"),
  SIGNING_ERROR(10, "Signing Error"),
  TRANSPORT_ERROR(11, "Transport Error"),
  UNEXPECTED_STATUS(20, "Unexpected Status"),
  UNEXPECTED_HEADER(21, "Unexpected Header"),
  MALFORMED_BODY(22, "Malformed Body"),
  UNEXPECTED_BUCKET(23, "Unexpected Bucket"),
  UNEXPECTED_CONTENTS(24, "Unexpected Contents"),
  UNEXPECTED_COUNT(25, "Unexpected Count");

  private int code;
  private String desc;

  ErrorKind(int code, String desc) {
    this.code = code;
    this.desc = desc;
  }

  public int getCode() {
    return code;
  }

  public String getDesc() {
    return desc;
  }

  /**
   * Fatal kinds abort the whole run instead of failing a single test.
   */
  public boolean isFatal() {
    return code < 10;
  }

  private static final Map<Integer, ErrorKind> map = new HashMap<>();

  static {
    for (ErrorKind errorKind : ErrorKind.values()) {
      map.put(errorKind.code, errorKind);
    }
  }

  public static ErrorKind fromCode(int code) {
    ErrorKind errorKind = map.get(code);
    if (errorKind == null) {
      throw new IllegalArgumentException("Unknown code: " + code);
    }
    return errorKind;
  }

  @Override
  public String toString() {
    return name() + "(" + code + ")" + desc;
  }
}
