package com.example.s3verify.verify;

import com.example.s3verify.S3VerifyException;
import com.example.s3verify.enums.ErrorKind;
import com.example.s3verify.httpclient.S3Response;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Headers every S3 response carries regardless of the operation.
 */
public class StandardHeaders {
  public static final String DATE = "Date";
  public static final String X_AMZ_REQUEST_ID = "x-amz-request-id";

  private StandardHeaders() {
  }

  public static void verify(S3Response response) throws S3VerifyException {
    String date = response.getHeader(DATE);
    if (date == null || date.isEmpty()) {
      throw new S3VerifyException(ErrorKind.UNEXPECTED_HEADER, "Missing " + DATE + " header");
    }
    try {
      ZonedDateTime.parse(date, DateTimeFormatter.RFC_1123_DATE_TIME);
    } catch (DateTimeParseException e) {
      throw new S3VerifyException(ErrorKind.UNEXPECTED_HEADER, "Malformed " + DATE + " header: " + date,
        "RFC 1123 date", date, e);
    }
    String requestId = response.getHeader(X_AMZ_REQUEST_ID);
    if (requestId == null || requestId.isEmpty()) {
      throw new S3VerifyException(ErrorKind.UNEXPECTED_HEADER, "Missing " + X_AMZ_REQUEST_ID + " header");
    }
  }
}
