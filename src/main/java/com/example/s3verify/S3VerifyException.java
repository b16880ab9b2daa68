package com.example.s3verify;

import com.example.s3verify.enums.ErrorKind;
import lombok.Getter;

/**
 * Single checked failure type of the verification core. Callers branch on {@link #getKind()};
 * mismatch kinds also carry the expected and received values.
 */
@Getter
public class S3VerifyException extends Exception {
  private final ErrorKind kind;
  private final Object expected;
  private final Object received;

  public S3VerifyException(ErrorKind kind, String message) {
    this(kind, message, null, null, null);
  }

  public S3VerifyException(ErrorKind kind, String message, Throwable cause) {
    this(kind, message, null, null, cause);
  }

  public S3VerifyException(ErrorKind kind, String message, Object expected, Object received, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.expected = expected;
    this.received = received;
  }

  public static S3VerifyException mismatch(ErrorKind kind, String what, Object expected, Object received) {
    String message = String.format("%s: wanted %s, got %s", what, expected, received);
    return new S3VerifyException(kind, message, expected, received, null);
  }

  @Override
  public String toString() {
    return kind.getDesc() + ": " + getMessage();
  }
}
