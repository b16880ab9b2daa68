package com.example.s3verify.httpclient;

import com.example.s3verify.S3VerifyException;
import com.example.s3verify.enums.ErrorKind;
import com.example.s3verify.utils.S3Utils;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.binary.Hex;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.codec.digest.HmacAlgorithms;
import org.apache.commons.codec.digest.HmacUtils;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * AWS Signature Version 4 for a payload sent in a single chunk.
 *
 * @see <a href="https://docs.aws.amazon.com/AmazonS3/latest/API/sig-v4-header-based-auth.html">AWS docs</a>
 */
@Slf4j
public class AwsV4Signer implements AwsSigner {
  public static final String ALGORITHM = "AWS4-HMAC-SHA256";
  public static final String TERMINATOR = "aws4_request";
  public static final String HOST = "Host";
  public static final String X_AMZ_DATE = "X-Amz-Date";
  public static final String X_AMZ_CONTENT_SHA256 = "X-Amz-Content-Sha256";

  private static final DateTimeFormatter AMZ_DATE_FORMAT =
    DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);
  private static final DateTimeFormatter DATE_STAMP_FORMAT =
    DateTimeFormatter.ofPattern("yyyyMMdd").withZone(ZoneOffset.UTC);

  private final String accessKeyId;
  private final String secretAccessKey;
  private final String region;
  private final String service;
  private final Clock clock;

  private String amzDate;

  public AwsV4Signer(String accessKeyId, String secretAccessKey, String region, String service, Clock clock) {
    this.accessKeyId = accessKeyId;
    this.secretAccessKey = secretAccessKey;
    this.region = region;
    this.service = service;
    this.clock = clock;
  }

  @Override
  public String calculateAuthorization(String httpVerb, URI resourceUrl, Map<String, String> headers, String payloadHash)
    throws S3VerifyException {
    if (accessKeyId == null || secretAccessKey == null) {
      throw new S3VerifyException(ErrorKind.SIGNING_ERROR, "Missing credentials");
    }
    Instant now = clock.instant();
    amzDate = AMZ_DATE_FORMAT.format(now);
    String dateStamp = DATE_STAMP_FORMAT.format(now);

    putIfAbsent(headers, HOST, hostHeader(resourceUrl));
    putIfAbsent(headers, X_AMZ_CONTENT_SHA256, payloadHash);
    headers.put(X_AMZ_DATE, amzDate);

    try {
      TreeMap<String, String> canonicalHeaders = canonicalHeaders(headers);
      String signedHeaders = String.join(";", canonicalHeaders.keySet());
      String canonicalRequest = String.join("\n",
        httpVerb,
        canonicalUri(resourceUrl),
        canonicalQuery(resourceUrl),
        canonicalHeaders.entrySet().stream()
          .map(e -> e.getKey() + ":" + e.getValue() + "\n")
          .collect(Collectors.joining()),
        signedHeaders,
        payloadHash);
      log.debug("Canonical request:\n{}", canonicalRequest);

      String scope = dateStamp + "/" + region + "/" + service + "/" + TERMINATOR;
      String stringToSign = String.join("\n",
        ALGORITHM,
        amzDate,
        scope,
        DigestUtils.sha256Hex(canonicalRequest));
      log.debug("String to sign:\n{}", stringToSign);

      String signature = Hex.encodeHexString(hmac(signingKey(dateStamp), stringToSign));
      return ALGORITHM + " Credential=" + accessKeyId + "/" + scope
        + ",SignedHeaders=" + signedHeaders
        + ",Signature=" + signature;
    } catch (IllegalArgumentException | IllegalStateException e) {
      throw new S3VerifyException(ErrorKind.SIGNING_ERROR, "Failed to sign " + httpVerb + " " + resourceUrl, e);
    }
  }

  @Override
  public String getAmzDate() {
    return amzDate;
  }

  /**
   * Derives the signing key for one day: HMAC chain over date, region, service and the terminator.
   */
  public byte[] signingKey(String dateStamp) {
    byte[] dateKey = hmac(("AWS4" + secretAccessKey).getBytes(StandardCharsets.UTF_8), dateStamp);
    byte[] regionKey = hmac(dateKey, region);
    byte[] serviceKey = hmac(regionKey, service);
    return hmac(serviceKey, TERMINATOR);
  }

  private static byte[] hmac(byte[] key, String data) {
    return new HmacUtils(HmacAlgorithms.HMAC_SHA_256, key).hmac(data);
  }

  /**
   * Host as an HTTP client sends it: the port is left out when it is the scheme's default.
   */
  static String hostHeader(URI url) {
    int port = url.getPort();
    boolean defaultPort = port == -1
      || ("http".equalsIgnoreCase(url.getScheme()) && port == 80)
      || ("https".equalsIgnoreCase(url.getScheme()) && port == 443);
    return defaultPort ? url.getHost() : url.getHost() + ":" + port;
  }

  private static void putIfAbsent(Map<String, String> headers, String name, String value) {
    if (value == null) {
      return;
    }
    boolean present = headers.keySet().stream().anyMatch(name::equalsIgnoreCase);
    if (!present) {
      headers.put(name, value);
    }
  }

  private static TreeMap<String, String> canonicalHeaders(Map<String, String> headers) {
    TreeMap<String, String> canonical = new TreeMap<>();
    for (Map.Entry<String, String> header : headers.entrySet()) {
      String value = header.getValue() == null ? "" : header.getValue().trim().replaceAll("\\s+", " ");
      canonical.put(header.getKey().toLowerCase(Locale.ROOT), value);
    }
    return canonical;
  }

  private static String canonicalUri(URI url) {
    String path = url.getRawPath();
    return (path == null || path.isEmpty()) ? "/" : path;
  }

  private static String canonicalQuery(URI url) {
    String rawQuery = url.getRawQuery();
    if (rawQuery == null || rawQuery.isEmpty()) {
      return "";
    }
    List<String[]> pairs = new ArrayList<>();
    for (String param : rawQuery.split("&")) {
      if (param.isEmpty()) {
        continue;
      }
      int eq = param.indexOf('=');
      String name = eq < 0 ? param : param.substring(0, eq);
      String value = eq < 0 ? "" : param.substring(eq + 1);
      pairs.add(new String[]{reencode(name), reencode(value)});
    }
    pairs.sort((a, b) -> a[0].equals(b[0]) ? a[1].compareTo(b[1]) : a[0].compareTo(b[0]));
    return pairs.stream().map(p -> p[0] + "=" + p[1]).collect(Collectors.joining("&"));
  }

  private static String reencode(String raw) {
    return S3Utils.urlEncode(URLDecoder.decode(raw, StandardCharsets.UTF_8));
  }
}
