package com.example.s3verify.verify;

import com.example.s3verify.S3VerifyException;
import com.example.s3verify.enums.ErrorKind;
import com.example.s3verify.model.ListMultipartUploadsResult;
import com.example.s3verify.model.ObjectMultipartInfo;

import java.util.Objects;

public class ListMultipartUploadsVerifier extends ResponseVerifier<ListMultipartUploadsResult> {

  public ListMultipartUploadsVerifier() {
    super(ListMultipartUploadsResult.class);
  }

  @Override
  protected void compare(ListMultipartUploadsResult expected, ListMultipartUploadsResult received)
    throws S3VerifyException {
    if (!Objects.equals(expected.getBucket(), received.getBucket())) {
      throw S3VerifyException.mismatch(ErrorKind.UNEXPECTED_BUCKET, "Unexpected Bucket Listed",
        expected.getBucket(), received.getBucket());
    }
    int expectedCount = expected.getUploads().size();
    if (received.getUploads().size() != expectedCount) {
      throw S3VerifyException.mismatch(ErrorKind.UNEXPECTED_COUNT, "Unexpected Number of Uploads Listed",
        expectedCount, received.getUploads().size());
    }
    int totalUploads = EntryMatcher.countMatches(expected.getUploads(), received.getUploads(),
      ListMultipartUploadsVerifier::sameUpload);
    if (totalUploads != expectedCount) {
      throw S3VerifyException.mismatch(ErrorKind.UNEXPECTED_CONTENTS, "Wrong Metadata in Listed Uploads",
        expectedCount, totalUploads);
    }
  }

  // Size is not part of the Upload element, so only the identity fields can be compared.
  static boolean sameUpload(ObjectMultipartInfo expected, ObjectMultipartInfo received) {
    return Objects.equals(expected.getKey(), received.getKey())
      && Objects.equals(expected.getUploadId(), received.getUploadId());
  }
}
