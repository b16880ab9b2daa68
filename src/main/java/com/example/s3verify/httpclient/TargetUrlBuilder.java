package com.example.s3verify.httpclient;

import com.example.s3verify.S3VerifyException;
import com.example.s3verify.config.RegionResolver;
import com.example.s3verify.enums.ErrorKind;
import com.example.s3verify.utils.S3Utils;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

public class TargetUrlBuilder {
  private TargetUrlBuilder() {
  }

  /**
   * Builds a path-style URL: {@code /bucket/} for an empty object key, {@code /bucket/key} otherwise.
   * Query parameters are percent-encoded and emitted sorted by name.
   */
  public static URI makeTargetUrl(String endpoint, String bucketName, String objectName, String region,
                                  Map<String, String> queryValues) throws S3VerifyException {
    URI endpointUrl;
    try {
      endpointUrl = new URI(endpoint);
    } catch (URISyntaxException | NullPointerException e) {
      throw new S3VerifyException(ErrorKind.INVALID_ENDPOINT, "Malformed endpoint: " + endpoint, e);
    }
    String scheme = endpointUrl.getScheme();
    if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
      throw new S3VerifyException(ErrorKind.INVALID_ENDPOINT, "Endpoint must be an http(s) URL: " + endpoint);
    }
    String host = endpointUrl.getHost();
    if (host == null || host.isEmpty()) {
      throw new S3VerifyException(ErrorKind.INVALID_ENDPOINT, "Endpoint has no host: " + endpoint);
    }
    if (RegionResolver.isAmazonEndpoint(endpointUrl)) {
      host = RegionResolver.getS3Host(region);
    }

    StringBuilder target = new StringBuilder()
      .append(scheme.toLowerCase())
      .append("://")
      .append(host);
    if (endpointUrl.getPort() != -1) {
      target.append(':').append(endpointUrl.getPort());
    }
    target.append('/');
    if (bucketName != null && !bucketName.isEmpty()) {
      target.append(S3Utils.urlEncode(bucketName)).append('/');
      if (objectName != null && !objectName.isEmpty()) {
        target.append(S3Utils.encodePath(objectName));
      }
    }
    if (queryValues != null && !queryValues.isEmpty()) {
      target.append('?').append(new TreeMap<>(queryValues).entrySet().stream()
        .map(e -> S3Utils.urlEncode(e.getKey()) + "=" + S3Utils.urlEncode(e.getValue()))
        .collect(Collectors.joining("&")));
    }

    try {
      return new URI(target.toString());
    } catch (URISyntaxException e) {
      throw new S3VerifyException(ErrorKind.INVALID_ENDPOINT, "Cannot build target URL " + target, e);
    }
  }
}
