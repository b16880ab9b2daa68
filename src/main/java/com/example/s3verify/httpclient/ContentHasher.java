package com.example.s3verify.httpclient;

import com.example.s3verify.S3VerifyException;
import com.example.s3verify.enums.ErrorKind;
import org.apache.commons.codec.digest.DigestUtils;

import java.io.IOException;
import java.io.InputStream;

public class ContentHasher {
  public static final String EMPTY_SHA256 = "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855";

  private ContentHasher() {
  }

  public static HashedPayload computeHash(InputStream reader) throws S3VerifyException {
    byte[] content;
    try {
      content = reader.readAllBytes();
    } catch (IOException e) {
      throw new S3VerifyException(ErrorKind.SIGNING_ERROR, "Failed to read payload for hashing", e);
    }
    return new HashedPayload(DigestUtils.sha256(content), DigestUtils.md5(content), content.length, content);
  }

  public static HashedPayload computeHash(byte[] content) {
    return new HashedPayload(DigestUtils.sha256(content), DigestUtils.md5(content), content.length, content.clone());
  }
}
