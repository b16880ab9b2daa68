package com.example.s3verify.httpclient;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.apache.commons.codec.binary.Base64;
import org.apache.commons.codec.binary.Hex;

import java.io.ByteArrayInputStream;
import java.io.InputStream;

/**
 * A payload read once and kept in memory so it can be replayed: first for signing, then as the request body.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PACKAGE)
public class HashedPayload {
  @Getter(AccessLevel.NONE)
  private final byte[] sha256;
  @Getter(AccessLevel.NONE)
  private final byte[] md5;
  private final long length;
  @Getter(AccessLevel.NONE)
  private final byte[] content;

  public String sha256Hex() {
    return Hex.encodeHexString(sha256);
  }

  public String md5Hex() {
    return Hex.encodeHexString(md5);
  }

  public String md5Base64() {
    return Base64.encodeBase64String(md5);
  }

  public InputStream newStream() {
    return new ByteArrayInputStream(content);
  }

  public byte[] toByteArray() {
    return content.clone();
  }
}
