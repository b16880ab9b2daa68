package com.example.s3verify.httpclient;

import com.example.s3verify.S3VerifyException;
import com.example.s3verify.enums.ErrorKind;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ContentHasherTest {
  private static final byte[] HELLO = "hello".getBytes(StandardCharsets.UTF_8);

  @Test
  void emptyPayload() throws Exception {
    HashedPayload payload = ContentHasher.computeHash(InputStream.nullInputStream());

    assertThat(payload.sha256Hex()).isEqualTo(ContentHasher.EMPTY_SHA256);
    assertThat(payload.md5Hex()).isEqualTo("d41d8cd98f00b204e9800998ecf8427e");
    assertThat(payload.getLength()).isZero();
  }

  @Test
  void emptyDigestIsStableAcrossStreams() throws Exception {
    HashedPayload first = ContentHasher.computeHash(InputStream.nullInputStream());
    HashedPayload second = ContentHasher.computeHash(new ByteArrayInputStream(new byte[0]));

    assertThat(first.sha256Hex()).isEqualTo(ContentHasher.EMPTY_SHA256);
    assertThat(second.sha256Hex()).isEqualTo(ContentHasher.EMPTY_SHA256);
  }

  @Test
  void changingReturnedContentLeavesPayloadIntact() throws Exception {
    HashedPayload payload = ContentHasher.computeHash(HELLO);
    payload.toByteArray()[0] = 'j';

    assertThat(payload.sha256Hex()).isEqualTo("2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824");
    assertThat(payload.newStream().readAllBytes()).isEqualTo(HELLO);
  }

  @Test
  void knownDigests() throws Exception {
    HashedPayload payload = ContentHasher.computeHash(new ByteArrayInputStream(HELLO));

    assertThat(payload.sha256Hex()).isEqualTo("2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824");
    assertThat(payload.md5Hex()).isEqualTo("5d41402abc4b2a76b9719d911017c592");
    assertThat(payload.md5Base64()).isEqualTo("XUFAKrxLKna5cZ2REBfFkg==");
    assertThat(payload.getLength()).isEqualTo(5);
  }

  @Test
  void streamAndArrayGiveSameHash() throws Exception {
    HashedPayload fromStream = ContentHasher.computeHash(new ByteArrayInputStream(HELLO));
    HashedPayload fromArray = ContentHasher.computeHash(HELLO);

    assertThat(fromArray.sha256Hex()).isEqualTo(fromStream.sha256Hex());
    assertThat(fromArray.md5Hex()).isEqualTo(fromStream.md5Hex());
  }

  @Test
  void payloadCanBeReplayedAfterHashing() throws Exception {
    HashedPayload payload = ContentHasher.computeHash(new ByteArrayInputStream(HELLO));

    assertThat(payload.newStream().readAllBytes()).isEqualTo(HELLO);
    assertThat(payload.newStream().readAllBytes()).isEqualTo(HELLO);
    assertThat(payload.toByteArray()).isEqualTo(HELLO);
  }

  @Test
  void readFailureIsASigningError() throws Exception {
    InputStream broken = mock(InputStream.class);
    when(broken.readAllBytes()).thenThrow(new IOException("disk gone"));

    assertThatThrownBy(() -> ContentHasher.computeHash(broken))
      .isInstanceOf(S3VerifyException.class)
      .hasCauseInstanceOf(IOException.class)
      .extracting(e -> ((S3VerifyException) e).getKind())
      .isEqualTo(ErrorKind.SIGNING_ERROR);
  }
}
