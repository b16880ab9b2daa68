package com.example.s3verify.verify;

import com.example.s3verify.S3VerifyException;
import com.example.s3verify.enums.ErrorKind;
import com.example.s3verify.model.ListBucketResult;
import com.example.s3verify.model.ObjectInfo;
import com.example.s3verify.utils.S3Utils;

import java.util.Objects;

/**
 * With a max-keys limit only the page size is checked, since the server may return any page of that size.
 * Without one every expected object must be listed with matching key, size and ETag, and nothing else.
 */
public class ListObjectsV1Verifier extends ResponseVerifier<ListBucketResult> {

  public ListObjectsV1Verifier() {
    super(ListBucketResult.class);
  }

  @Override
  protected void compare(ListBucketResult expected, ListBucketResult received) throws S3VerifyException {
    if (!Objects.equals(expected.getName(), received.getName())) {
      throw S3VerifyException.mismatch(ErrorKind.UNEXPECTED_BUCKET, "Unexpected Bucket Listed",
        expected.getName(), received.getName());
    }
    int expectedCount = expected.getContents().size();
    if (expected.getMaxKeys() != 0) {
      if (received.entryCount() != expectedCount) {
        throw S3VerifyException.mismatch(ErrorKind.UNEXPECTED_COUNT, "Unexpected Number of Objects Listed",
          expectedCount, received.entryCount());
      }
      return;
    }
    int listedObjects = EntryMatcher.countMatches(expected.getContents(), received.getContents(),
      ListObjectsV1Verifier::sameObject);
    if (listedObjects != expectedCount) {
      throw S3VerifyException.mismatch(ErrorKind.UNEXPECTED_CONTENTS, "Unexpected Objects Listed",
        expectedCount, listedObjects);
    }
    if (received.entryCount() != expectedCount) {
      throw S3VerifyException.mismatch(ErrorKind.UNEXPECTED_COUNT, "Unexpected Number of Objects Listed",
        expectedCount, received.entryCount());
    }
  }

  static boolean sameObject(ObjectInfo expected, ObjectInfo received) {
    return Objects.equals(expected.getKey(), received.getKey())
      && expected.getSize() == received.getSize()
      && Objects.equals(S3Utils.trimQuotes(expected.getEtag()), S3Utils.trimQuotes(received.getEtag()));
  }
}
