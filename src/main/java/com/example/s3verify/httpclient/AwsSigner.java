package com.example.s3verify.httpclient;

import com.example.s3verify.S3VerifyException;

import java.net.URI;
import java.util.Map;

public interface AwsSigner {
  /**
   * Signs the request and returns the {@code Authorization} header value. The signer adds the headers
   * it signs but the caller did not supply ({@code Host}, {@code X-Amz-Date}) to {@code headers}.
   */
  String calculateAuthorization(String httpVerb, URI resourceUrl, Map<String, String> headers, String payloadHash)
    throws S3VerifyException;

  String getAmzDate();
}
