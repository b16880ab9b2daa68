package com.example.s3verify.operation;

import com.example.s3verify.fixture.FixtureContext;
import com.example.s3verify.httpclient.S3RequestBuilder;
import com.example.s3verify.model.ListMultipartUploadsResult;
import com.example.s3verify.model.ObjectMultipartInfo;
import com.example.s3verify.verify.ListMultipartUploadsVerifier;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

public class ListMultipartUploadsOperation extends AbstractS3Operation<ListMultipartUploadsResult> {

  public ListMultipartUploadsOperation(S3RequestBuilder requestBuilder) {
    super("Multipart (List-Uploads)", new ListMultipartUploadsVerifier(), requestBuilder);
  }

  @Override
  public List<TestCase<ListMultipartUploadsResult>> buildExpected(FixtureContext fixtures) {
    List<ObjectMultipartInfo> uploads = fixtures.getUploads().stream()
      .map(upload -> ObjectMultipartInfo.builder()
        .key(upload.getKey())
        .uploadId(upload.getUploadId())
        .build())
      .collect(Collectors.toList());

    return Collections.singletonList(TestCase.<ListMultipartUploadsResult>builder()
      .description("all uploads")
      .parameter("uploads", "")
      .expected(ListMultipartUploadsResult.builder()
        .bucket(fixtures.getBucketName())
        .uploads(uploads)
        .build())
      .build());
  }
}
