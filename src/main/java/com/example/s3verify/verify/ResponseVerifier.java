package com.example.s3verify.verify;

import com.example.s3verify.S3VerifyException;
import com.example.s3verify.enums.ErrorKind;
import com.example.s3verify.httpclient.S3Response;
import com.example.s3verify.utils.XmlCodec;

import java.io.IOException;

/**
 * Checks a response in three steps, each a precondition for the next: status line, standard headers, body.
 * The first failure is thrown and nothing after it runs.
 *
 * @param <T> decoded body type; the expected value is an instance of the same type
 */
public abstract class ResponseVerifier<T> {
  private final Class<T> bodyType;

  protected ResponseVerifier(Class<T> bodyType) {
    this.bodyType = bodyType;
  }

  public void verify(S3Response response, String expectedStatus, T expected) throws S3VerifyException {
    verifyStatus(response, expectedStatus);
    verifyHeaders(response);
    verifyBody(response, expected);
  }

  public void verifyStatus(S3Response response, String expectedStatus) throws S3VerifyException {
    if (!expectedStatus.equals(response.getStatus())) {
      throw S3VerifyException.mismatch(ErrorKind.UNEXPECTED_STATUS, "Unexpected Status Received",
        expectedStatus, response.getStatus());
    }
  }

  public void verifyHeaders(S3Response response) throws S3VerifyException {
    StandardHeaders.verify(response);
  }

  public void verifyBody(S3Response response, T expected) throws S3VerifyException {
    compare(expected, decode(response));
  }

  protected T decode(S3Response response) throws S3VerifyException {
    try {
      return XmlCodec.decode(response.getBody() == null ? new byte[0] : response.getBody(), bodyType);
    } catch (IOException e) {
      throw new S3VerifyException(ErrorKind.MALFORMED_BODY,
        "Cannot decode " + bodyType.getSimpleName() + ": " + e.getMessage(), e);
    }
  }

  protected abstract void compare(T expected, T received) throws S3VerifyException;
}
