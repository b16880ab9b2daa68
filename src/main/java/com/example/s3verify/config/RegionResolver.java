package com.example.s3verify.config;

import com.example.s3verify.S3VerifyException;
import com.example.s3verify.enums.ErrorKind;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.regex.Pattern;

public final class RegionResolver {
  public static final String GLOBAL_DEFAULT_REGION = "us-east-1";
  public static final String AMAZON_DEFAULT_REGION = "us-west-1";

  // s3.amazonaws.com, s3.<region>.amazonaws.com, s3-<region>.amazonaws.com and the .com.cn variants
  private static final Pattern AMAZON_HOST = Pattern.compile("^s3([.-][a-z0-9-]+)?\\.amazonaws\\.com(\\.cn)?$");

  private RegionResolver() {
  }

  public static boolean isAmazonEndpoint(URI endpoint) {
    String host = endpoint.getHost();
    return host != null && AMAZON_HOST.matcher(host.toLowerCase()).matches();
  }

  /**
   * Returns the explicit region when one was given, otherwise the default for the kind of endpoint.
   */
  public static String resolve(String endpoint, String region) throws S3VerifyException {
    URI endpointUri;
    try {
      endpointUri = new URI(endpoint);
    } catch (URISyntaxException e) {
      throw new S3VerifyException(ErrorKind.CONFIG_ERROR, "Malformed endpoint: " + endpoint, e);
    }
    if (region != null && !region.isEmpty()) {
      return region;
    }
    return isAmazonEndpoint(endpointUri) ? AMAZON_DEFAULT_REGION : GLOBAL_DEFAULT_REGION;
  }

  /**
   * Regional host for an Amazon endpoint, e.g. {@code s3.eu-west-1.amazonaws.com}.
   */
  public static String getS3Host(String region) {
    if (region == null || region.isEmpty() || GLOBAL_DEFAULT_REGION.equals(region)) {
      return "s3.amazonaws.com";
    }
    if (region.startsWith("cn-")) {
      return "s3." + region + ".amazonaws.com.cn";
    }
    return "s3." + region + ".amazonaws.com";
  }
}
