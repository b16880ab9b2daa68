package com.example.s3verify.verify;

import com.example.s3verify.S3VerifyException;
import com.example.s3verify.enums.ErrorKind;
import com.example.s3verify.model.ListMultipartUploadsResult;
import com.example.s3verify.model.ObjectMultipartInfo;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.example.s3verify.verify.ResponseFixtures.listUploadsXml;
import static com.example.s3verify.verify.ResponseFixtures.ok;
import static com.example.s3verify.verify.ResponseFixtures.uploads;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ListMultipartUploadsVerifierTest {
  private static final String BUCKET = "s3verify-bucket";

  private final ListMultipartUploadsVerifier verifier = new ListMultipartUploadsVerifier();
  private final List<ObjectMultipartInfo> inFlight = uploads(3);
  private final ListMultipartUploadsResult expected = ListMultipartUploadsResult.builder()
    .bucket(BUCKET)
    .uploads(inFlight)
    .build();

  @Test
  void allUploadsInAnyOrderPass() {
    List<ObjectMultipartInfo> listed = new ArrayList<>(inFlight);
    Collections.reverse(listed);

    assertThatCode(() -> verifier.verify(ok(listUploadsXml(BUCKET, listed)), "200 OK", expected))
      .doesNotThrowAnyException();
  }

  @Test
  void decodesUploadElements() throws Exception {
    ListMultipartUploadsResult decoded = verifier.decode(ok(listUploadsXml(BUCKET, inFlight)));

    assertThat(decoded.getBucket()).isEqualTo(BUCKET);
    assertThat(decoded.getMaxUploads()).isEqualTo(1000);
    assertThat(decoded.getUploads()).extracting(ObjectMultipartInfo::getUploadId)
      .containsExactly("upload-0", "upload-1", "upload-2");
    assertThat(decoded.getUploads().get(0).getInitiated()).isNotNull();
  }

  @Test
  void missingUploadFailsWithCount() {
    assertThatThrownBy(() -> verifier.verify(ok(listUploadsXml(BUCKET, inFlight.subList(0, 2))), "200 OK",
      expected))
      .isInstanceOf(S3VerifyException.class)
      .hasMessage("Unexpected Number of Uploads Listed: wanted 3, got 2");
  }

  @Test
  void wrongUploadIdFailsWithContents() {
    List<ObjectMultipartInfo> listed = new ArrayList<>(inFlight.subList(0, 2));
    listed.add(ObjectMultipartInfo.builder().key(inFlight.get(2).getKey()).uploadId("someone-else").build());

    assertThatThrownBy(() -> verifier.verify(ok(listUploadsXml(BUCKET, listed)), "200 OK", expected))
      .isInstanceOf(S3VerifyException.class)
      .extracting(e -> ((S3VerifyException) e).getKind())
      .isEqualTo(ErrorKind.UNEXPECTED_CONTENTS);
  }

  @Test
  void otherBucketFails() {
    assertThatThrownBy(() -> verifier.verify(ok(listUploadsXml("other", inFlight)), "200 OK", expected))
      .isInstanceOf(S3VerifyException.class)
      .extracting(e -> ((S3VerifyException) e).getKind())
      .isEqualTo(ErrorKind.UNEXPECTED_BUCKET);
  }

  @Test
  void emptyListingMatchesNoUploads() {
    ListMultipartUploadsResult none = ListMultipartUploadsResult.builder().bucket(BUCKET).build();

    assertThatCode(() -> verifier.verify(ok(listUploadsXml(BUCKET, List.of())), "200 OK", none))
      .doesNotThrowAnyException();
  }

  @Test
  void sizeIsNotCompared() {
    ObjectMultipartInfo fixture = ObjectMultipartInfo.builder().key("k").uploadId("u").size(5).build();
    ObjectMultipartInfo listed = ObjectMultipartInfo.builder().key("k").uploadId("u").build();

    assertThat(ListMultipartUploadsVerifier.sameUpload(fixture, listed)).isTrue();
  }
}
