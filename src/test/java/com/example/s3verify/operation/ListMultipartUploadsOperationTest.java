package com.example.s3verify.operation;

import com.example.s3verify.config.ServerConfig;
import com.example.s3verify.fixture.FixtureContext;
import com.example.s3verify.httpclient.S3RequestBuilder;
import com.example.s3verify.model.ListMultipartUploadsResult;
import com.example.s3verify.model.ObjectMultipartInfo;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ListMultipartUploadsOperationTest {
  private final ListMultipartUploadsOperation operation = new ListMultipartUploadsOperation(new S3RequestBuilder());

  private final FixtureContext fixtures = FixtureContext.builder()
    .bucketName("bucket")
    .upload(ObjectMultipartInfo.builder().key("s3verify/multipart/00").uploadId("u0").size(10).build())
    .upload(ObjectMultipartInfo.builder().key("s3verify/multipart/01").uploadId("u1").size(20).build())
    .build();

  @Test
  void expectsEveryFixtureUpload() {
    List<TestCase<ListMultipartUploadsResult>> testCases = operation.buildExpected(fixtures);

    assertThat(testCases).hasSize(1);
    ListMultipartUploadsResult expected = testCases.get(0).getExpected();
    assertThat(expected.getBucket()).isEqualTo("bucket");
    assertThat(expected.getUploads()).extracting(ObjectMultipartInfo::getUploadId).containsExactly("u0", "u1");
    assertThat(testCases.get(0).getParameters()).containsEntry("uploads", "");
  }

  @Test
  void requestsUploadsSubresource() throws Exception {
    ServerConfig config = ServerConfig.builder()
      .endpoint("https://storage.example.com")
      .region("us-east-1")
      .accessKey("access")
      .secretKey("secret")
      .build();

    assertThat(operation.newRequest(config, fixtures, operation.buildExpected(fixtures).get(0)).getUrl())
      .hasToString("https://storage.example.com/bucket/?uploads=");
  }
}
