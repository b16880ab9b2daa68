package com.example.s3verify.httpclient;

import com.example.s3verify.S3VerifyException;
import com.example.s3verify.enums.ErrorKind;
import io.reactivex.Single;
import io.vertx.core.MultiMap;
import io.vertx.core.http.HttpClientOptions;
import io.vertx.core.http.RequestOptions;
import io.vertx.reactivex.core.Vertx;
import io.vertx.reactivex.core.buffer.Buffer;
import io.vertx.reactivex.core.http.HttpClient;
import io.vertx.reactivex.core.http.HttpClientResponse;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Executes signed requests one at a time on the caller's thread. Every response body is read
 * to the end before returning so the pooled connection can be reused.
 */
@Slf4j
public class S3HttpClient {
  public static final int CONNECT_TIMEOUT_MILLIS = 5000;
  public static final long TLS_HANDSHAKE_TIMEOUT_SECONDS = 5;

  private final HttpClient client;

  public S3HttpClient(HttpClient client) {
    this.client = client;
  }

  /**
   * Shared client for a run. With {@code verbose} the client logs all wire activity.
   */
  public static HttpClient createHttpClient(Vertx vertx, boolean verbose) {
    HttpClientOptions options = new HttpClientOptions()
      .setConnectTimeout(CONNECT_TIMEOUT_MILLIS)
      .setSslHandshakeTimeout(TLS_HANDSHAKE_TIMEOUT_SECONDS)
      .setSslHandshakeTimeoutUnit(TimeUnit.SECONDS)
      .setLogActivity(verbose);
    return vertx.createHttpClient(options);
  }

  public S3Response execute(SignedRequest request) throws S3VerifyException {
    RequestOptions requestOptions = new RequestOptions()
      .setMethod(request.getMethod())
      .setAbsoluteURI(request.getUrl().toString());
    for (Map.Entry<String, String> header : request.getHeaders().entrySet()) {
      requestOptions.putHeader(header.getKey(), header.getValue());
    }

    Single<S3Response> responseSingle = client.rxRequest(requestOptions)
      .flatMap(httpClientRequest -> request.hasBody()
        ? httpClientRequest.rxSend(Buffer.buffer(request.getBody()))
        : httpClientRequest.rxSend())
      .flatMap(httpClientResponse -> httpClientResponse.rxBody()
        .map(body -> toResponse(httpClientResponse, body)));

    try {
      S3Response response = responseSingle.blockingGet();
      log.debug("{} {} -> {}", request.getMethod(), request.getUrl(), response.getStatus());
      return response;
    } catch (RuntimeException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      throw new S3VerifyException(ErrorKind.TRANSPORT_ERROR,
        request.getMethod() + " " + request.getUrl() + " failed: " + cause.getMessage(), cause);
    }
  }

  private static S3Response toResponse(HttpClientResponse httpClientResponse, Buffer body) {
    MultiMap headers = MultiMap.caseInsensitiveMultiMap().addAll(httpClientResponse.headers().getDelegate());
    return S3Response.builder()
      .statusCode(httpClientResponse.statusCode())
      .statusMessage(httpClientResponse.statusMessage())
      .headers(headers)
      .body(body.getBytes())
      .build();
  }
}
