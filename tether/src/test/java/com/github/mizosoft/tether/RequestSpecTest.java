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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

import com.github.mizosoft.tether.RequestSpec.ModelBody;
import com.github.mizosoft.tether.RequestSpec.NoBody;
import com.github.mizosoft.tether.RequestSpec.RawBody;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RequestSpecTest {
  @Test
  void defaults() {
    var spec = RequestSpec.GET("https://example.com/items");
    assertThat(spec.method()).isEqualTo("GET");
    assertThat(spec.url()).isEqualTo("https://example.com/items");
    assertThat(spec.isRelative()).isFalse();
    assertThat(spec.body()).isInstanceOf(NoBody.class);
    assertThat(spec.headers()).isEmpty();
    assertThat(spec.isFormEncoded()).isFalse();
    assertThat(spec.maxRetries()).isEmpty();
    assertThat(spec.timeout()).isEmpty();
    assertThat(spec.errorType()).isEmpty();
  }

  @Test
  void methodIsUpperCased() {
    var spec = RequestSpec.newBuilder().method("patch").url("https://example.com").build();
    assertThat(spec.method()).isEqualTo("PATCH");
  }

  @Test
  void blankMethod() {
    assertThatIllegalArgumentException().isThrownBy(() -> RequestSpec.newBuilder().method(" "));
  }

  @Test
  void missingUrl() {
    assertThatExceptionOfType(NullPointerException.class)
        .isThrownBy(() -> RequestSpec.newBuilder().build());
  }

  @Test
  void parametersAreSortedAndEncoded() {
    var spec =
        RequestSpec.newBuilder()
            .GET("https://example.com/search")
            .parameter("q", "a b&c")
            .parameter("page", "2")
            .build();
    assertThat(spec.fullUrl()).isEqualTo("https://example.com/search?page=2&q=a+b%26c");
  }

  @Test
  void lastParameterValueWins() {
    var spec =
        RequestSpec.newBuilder()
            .GET("https://example.com")
            .parameter("k", "1")
            .parameters(Map.of("k", "2"))
            .build();
    assertThat(spec.parameters()).containsExactly(Map.entry("k", "2"));
  }

  @Test
  void parametersAppendToExistingQuery() {
    assertThat(QueryString.append("https://example.com/a?x=1", Map.of("y", "2")))
        .isEqualTo("https://example.com/a?x=1&y=2");
    assertThat(QueryString.append("https://example.com/a?", Map.of("y", "2")))
        .isEqualTo("https://example.com/a?y=2");
    assertThat(QueryString.append("https://example.com/a#top", Map.of("y", "2")))
        .isEqualTo("https://example.com/a?y=2#top");
    assertThat(QueryString.append("https://example.com/a", Map.of()))
        .isEqualTo("https://example.com/a");
  }

  @Test
  void rawBodyWinsOverModel() {
    var spec =
        RequestSpec.newBuilder()
            .POST("https://example.com", "model")
            .rawBody(new byte[] {1, 2, 3})
            .build();
    assertThat(spec.body()).isInstanceOf(RawBody.class);
    assertThat(((RawBody) spec.body()).bytes()).containsExactly(1, 2, 3);
    assertThat(spec.hasBodyModel()).isTrue();
  }

  @Test
  void modelBody() {
    var spec = RequestSpec.PUT("https://example.com", List.of(1, 2));
    assertThat(spec.method()).isEqualTo("PUT");
    assertThat(spec.body()).isInstanceOf(ModelBody.class);
    assertThat(((ModelBody) spec.body()).model()).isEqualTo(List.of(1, 2));
  }

  @Test
  void noBodyClearsBoth() {
    var spec =
        RequestSpec.newBuilder()
            .POST("https://example.com", "model")
            .rawBody(new byte[] {1})
            .noBody()
            .build();
    assertThat(spec.body()).isInstanceOf(NoBody.class);
    assertThat(spec.hasBodyModel()).isFalse();
  }

  @Test
  void headerOverlayReplacesPreviousValues() {
    var spec =
        RequestSpec.newBuilder()
            .GET("https://example.com")
            .header("X-Trace", "a", "b")
            .header("X-Trace", "c")
            .header("Accept")
            .build();
    assertThat(spec.headers())
        .containsExactly(Map.entry("X-Trace", List.of("c")), Map.entry("Accept", List.of()));
  }

  @Test
  void invalidHeaderName() {
    assertThatIllegalArgumentException()
        .isThrownBy(() -> RequestSpec.newBuilder().header("Bad Header", "v"));
  }

  @Test
  void overrides() {
    var spec =
        RequestSpec.newBuilder()
            .relativeUrl("items/1")
            .maxRetries(0)
            .timeout(Duration.ofSeconds(3))
            .errorType(String.class)
            .build();
    assertThat(spec.isRelative()).isTrue();
    assertThat(spec.maxRetries()).hasValue(0);
    assertThat(spec.timeout()).hasValue(Duration.ofSeconds(3));
    assertThat(spec.errorType()).hasValue(String.class);
  }

  @Test
  void negativeRetries() {
    assertThatIllegalArgumentException().isThrownBy(() -> RequestSpec.newBuilder().maxRetries(-1));
  }

  @Test
  void nonPositiveTimeout() {
    assertThatIllegalArgumentException()
        .isThrownBy(() -> RequestSpec.newBuilder().timeout(Duration.ZERO));
  }
}
