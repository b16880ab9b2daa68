package com.example.s3verify.operation;

import com.example.s3verify.fixture.FixtureContext;
import com.example.s3verify.httpclient.S3RequestBuilder;
import com.example.s3verify.model.ListBucketResult;
import com.example.s3verify.model.ObjectInfo;
import com.example.s3verify.verify.ListObjectsV1Verifier;

import java.util.Arrays;
import java.util.List;

public class ListObjectsV1Operation extends AbstractS3Operation<ListBucketResult> {
  public static final int MAX_KEYS = 30;

  public ListObjectsV1Operation(S3RequestBuilder requestBuilder) {
    super("ListObjects V1", new ListObjectsV1Verifier(), requestBuilder);
  }

  @Override
  public List<TestCase<ListBucketResult>> buildExpected(FixtureContext fixtures) {
    List<ObjectInfo> objects = fixtures.sortedObjects();

    TestCase<ListBucketResult> noParameters = TestCase.<ListBucketResult>builder()
      .description("no parameters")
      .expected(ListBucketResult.builder()
        .name(fixtures.getBucketName())
        .contents(objects)
        .build())
      .build();

    TestCase<ListBucketResult> maxKeys = TestCase.<ListBucketResult>builder()
      .description("max-keys=" + MAX_KEYS)
      .parameter("max-keys", String.valueOf(MAX_KEYS))
      .expected(ListBucketResult.builder()
        .name(fixtures.getBucketName())
        .contents(objects.subList(0, Math.min(MAX_KEYS, objects.size())))
        .maxKeys(MAX_KEYS)
        .build())
      .build();

    return Arrays.asList(noParameters, maxKeys);
  }
}
