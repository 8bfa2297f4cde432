/*
 * Copyright (c) 2024 Moataz Abdelnasser
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package com.github.mizosoft.tether;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

import com.github.mizosoft.tether.internal.RawCodec;
import com.github.mizosoft.tether.testing.FakeResponse;
import com.github.mizosoft.tether.testing.RecordingSleeper;
import com.github.mizosoft.tether.testing.RecordingTransport;
import com.github.mizosoft.tether.testing.StringCodec;
import com.github.mizosoft.tether.testing.StringCodec.Point;
import java.net.ConnectException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

@Timeout(5)
class TetherTest {
  private RecordingTransport transport;
  private RecordingSleeper sleeper;

  @BeforeEach
  void setUp() {
    transport = new RecordingTransport();
    sleeper = new RecordingSleeper();
  }

  private Tether.Builder tetherBuilder() {
    return Tether.newBuilder().transport(transport).codec(new StringCodec()).sleeper(sleeper);
  }

  @Test
  void decodesSuccessfulResponse() throws Exception {
    transport.enqueue(200, "3,4");
    var tether = tetherBuilder().build();
    var response = tether.send(RequestSpec.GET("https://example.com/point"), Point.class);
    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(response.body()).isEqualTo(new Point(3, 4));
    assertThat(response.bodyAsString()).isEqualTo("3,4");
    assertThat(response.retryCount()).isZero();
    assertThat(tether.requestCount()).isOne();
  }

  @Test
  void responseWithoutModel() throws Exception {
    transport.enqueue(204);
    var response = tetherBuilder().build().send(RequestSpec.DELETE("https://example.com/a"));
    assertThat(response.statusCode()).isEqualTo(204);
    assertThat(response.bodyIfPresent()).isEmpty();
  }

  @Test
  void genericResponseModel() throws Exception {
    transport.enqueue(200, "hello");
    var tether = tetherBuilder().build();
    var response = tether.send(RequestSpec.GET("https://example.com"), new TypeRef<String>() {});
    assertThat(response.body()).isEqualTo("hello");
  }

  @Test
  void retriesUntilSuccess() throws Exception {
    transport.enqueue(503).enqueue(500).enqueue(200, "1,1");
    var tether = tetherBuilder().backoff(BackoffStrategy.fixed(Duration.ofMillis(100))).build();
    var response = tether.send(RequestSpec.GET("https://example.com"), Point.class);
    assertThat(response.retryCount()).isEqualTo(2);
    assertThat(transport.sendCount()).isEqualTo(3);
    assertThat(sleeper.delays()).containsExactly(Duration.ofMillis(100), Duration.ofMillis(100));
    assertThat(tether.requestCount()).isOne();
  }

  @Test
  void exhaustedRetriesThrowStatusException() {
    for (int i = 0; i < 6; i++) {
      transport.enqueue(503, "busy");
    }
    var tether = tetherBuilder().build();
    assertThatExceptionOfType(StatusException.class)
        .isThrownBy(() -> tether.send(RequestSpec.GET("https://example.com/busy")))
        .satisfies(
            e -> {
              assertThat(e.statusCode()).isEqualTo(503);
              assertThat(e.bodyAsString()).isEqualTo("busy");
              assertThat(e).hasMessage("Server returned statuscode 503");
              assertThat(e.response()).isPresent();
              assertThat(e.request()).isPresent();
              assertThat(e.context().extra("http_url")).hasValue("https://example.com/busy");
            });
    assertThat(transport.sendCount()).isEqualTo(6);
    assertThat(sleeper.delays()).hasSize(5);
  }

  @Test
  void perCallRetryOverride() {
    transport.enqueue(500).enqueue(500);
    var tether = tetherBuilder().maxRetries(5).build();
    var spec = RequestSpec.newBuilder().GET("https://example.com").maxRetries(1).build();
    assertThatExceptionOfType(StatusException.class).isThrownBy(() -> tether.send(spec));
    assertThat(transport.sendCount()).isEqualTo(2);
  }

  @Test
  void customRetryPredicateExtendsDefaults() throws Exception {
    transport.enqueue(429).enqueue(503).enqueue(200);
    var tether = tetherBuilder().retryPredicate(RetryPredicate.onStatus(429)).build();
    assertThat(tether.send(RequestSpec.GET("https://example.com")).retryCount()).isEqualTo(2);
  }

  @Test
  void decodesErrorModel() {
    transport.enqueue(400, "7,8");
    var tether = tetherBuilder().build();
    var spec = RequestSpec.newBuilder().GET("https://example.com").errorType(Point.class).build();
    assertThatExceptionOfType(StatusException.class)
        .isThrownBy(() -> tether.send(spec))
        .satisfies(
            e -> {
              assertThat(e.errorModel(Point.class)).hasValue(new Point(7, 8));
              assertThat(e.context().extra(ResponseDecoder.RESPONSE_MESSAGE_EXTRA)).isEmpty();
            });
    assertThat(transport.sendCount()).isOne();
  }

  @Test
  void undecodableErrorModelKeepsRawBody() {
    transport.enqueue(422, "not a point");
    var tether = tetherBuilder().build();
    var spec = RequestSpec.newBuilder().GET("https://example.com").errorType(Point.class).build();
    assertThatExceptionOfType(StatusException.class)
        .isThrownBy(() -> tether.send(spec))
        .satisfies(
            e -> {
              assertThat(e.errorModel()).isEmpty();
              assertThat(e.context().extra("response_message")).hasValue("not a point");
              assertThat(e).hasMessage("Server returned statuscode 422");
            });
  }

  @Test
  void undecodableResponseThrowsDecodeException() {
    transport.enqueue(200, "garbage");
    var tether = tetherBuilder().build();
    assertThatExceptionOfType(DecodeException.class)
        .isThrownBy(() -> tether.send(RequestSpec.GET("https://example.com"), Point.class))
        .satisfies(
            e -> {
              assertThat(e.bodyText()).isEqualTo("garbage");
              assertThat(e.response()).isPresent();
              assertThat(e.getCause()).isInstanceOf(CodecException.class);
            });
  }

  @Test
  void transportFailure() {
    var error = new ConnectException("Connection refused");
    transport.enqueueFailure(error);
    var tether = tetherBuilder().build();
    assertThatExceptionOfType(TransportException.class)
        .isThrownBy(() -> tether.send(RequestSpec.GET("https://example.com")))
        .satisfies(
            e -> {
              assertThat(e.getCause()).isSameAs(error);
              assertThat(e).hasMessage("Connection refused");
              assertThat(e.response()).isEmpty();
              assertThat(e.request()).isPresent();
            });
    assertThat(tether.requestCount()).isOne();
  }

  @Test
  void buildFailureDoesNotCount() {
    var tether = tetherBuilder().build();
    assertThatExceptionOfType(BuildException.class)
        .isThrownBy(() -> tether.send(RequestSpec.newBuilder().relativeUrl("a").build()));
    assertThat(tether.requestCount()).isZero();
    assertThat(transport.sendCount()).isZero();
  }

  @Test
  void requestCountAndReset() throws Exception {
    transport.enqueue(200).enqueue(404).enqueue(200);
    var tether = tetherBuilder().build();
    tether.send(RequestSpec.GET("https://example.com"));
    assertThatExceptionOfType(StatusException.class)
        .isThrownBy(() -> tether.send(RequestSpec.GET("https://example.com")));
    assertThat(tether.requestCount()).isEqualTo(2);
    tether.resetRequestCount();
    assertThat(tether.requestCount()).isZero();
    tether.send(RequestSpec.GET("https://example.com"));
    assertThat(tether.requestCount()).isOne();
  }

  @Test
  void baseUriAndDefaultHeaders() throws Exception {
    transport.enqueue(200);
    var tether =
        tetherBuilder()
            .baseUri("https://api.example.com/v2/")
            .defaultHeader("Authorization", "Bearer token")
            .build();
    tether.send(RequestSpec.newBuilder().relativeUrl("users").parameter("page", "1").build());
    var request = transport.requests().get(0);
    assertThat(request.uri()).hasToString("https://api.example.com/v2/users?page=1");
    assertThat(request.headers().firstValue("Authorization")).hasValue("Bearer token");
  }

  @Test
  void rawModeWrapsStructuredCodec() throws Exception {
    transport.enqueue(200, "1,2").enqueue(200, "text");
    var tether = tetherBuilder().contentMode(ContentMode.RAW).build();
    assertThat(tether.codec()).isInstanceOf(RawCodec.class);
    assertThat(tether.send(RequestSpec.GET("https://example.com"), Point.class).body())
        .isEqualTo(new Point(1, 2));
    assertThat(tether.send(RequestSpec.GET("https://example.com"), byte[].class).body())
        .isEqualTo("text".getBytes(UTF_8));
    assertThat(transport.requests().get(0).headers().map()).isEmpty();
  }

  @Test
  void codecMustSupportContentMode() {
    assertThatIllegalArgumentException()
        .isThrownBy(() -> tetherBuilder().contentMode(ContentMode.XML).build());
  }

  @Test
  void invalidConfiguration() {
    assertThatIllegalArgumentException().isThrownBy(() -> Tether.newBuilder().maxRetries(-1));
    assertThatIllegalArgumentException()
        .isThrownBy(() -> Tether.newBuilder().requestTimeout(Duration.ofSeconds(-1)));
  }

  @Test
  void requestCountUnderConcurrentCalls() throws Exception {
    var tether =
        Tether.newBuilder()
            .transport(request -> new FakeResponse(request, 200, ""))
            .codec(new StringCodec())
            .sleeper(sleeper)
            .build();
    int threadCount = 8;
    int callsPerThread = 250;
    var executor = Executors.newFixedThreadPool(threadCount);
    try {
      var futures = new ArrayList<Future<?>>();
      for (int i = 0; i < threadCount; i++) {
        futures.add(
            executor.submit(
                () -> {
                  for (int j = 0; j < callsPerThread; j++) {
                    tether.send(RequestSpec.GET("https://example.com"));
                  }
                  return null;
                }));
      }
      for (var future : futures) {
        future.get();
      }
    } finally {
      executor.shutdown();
    }
    assertThat(tether.requestCount()).isEqualTo(threadCount * callsPerThread);
  }

  @Test
  void diagnosticsDoNotChangeOutcome() throws Exception {
    transport.enqueue(500).enqueue(200, "5,5");
    var tether = tetherBuilder().diagnostics(true).build();
    var spec = RequestSpec.newBuilder().POST("https://example.com", new Point(0, 0)).build();
    assertThat(tether.send(spec, Point.class).body()).isEqualTo(new Point(5, 5));
  }
}
