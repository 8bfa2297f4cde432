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

package com.github.mizosoft.tether.internal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class HeadersBuilderTest {
  @Test
  void namesAreCaseInsensitive() {
    var builder = new HeadersBuilder();
    builder.set("Accept", "text/plain");
    builder.set("accept", "application/json");
    assertThat(builder.toMap()).containsExactly(Map.entry("accept", List.of("application/json")));
  }

  @Test
  void setDeletesThenReplaces() {
    var builder = new HeadersBuilder();
    builder.set("X-Id", List.of("1", "2"));
    builder.set("x-id", List.of("3", "4"));
    assertThat(builder.toMap()).containsExactly(Map.entry("x-id", List.of("3", "4")));
  }

  @Test
  void setWithNoValuesRemoves() {
    var builder = new HeadersBuilder();
    builder.set("Accept", "application/json");
    builder.set("accept", List.of());
    assertThat(builder.toMap()).isEmpty();
  }

  @Test
  void setAllOverlaysEachHeader() {
    var defaults = new HeadersBuilder();
    defaults.set("Accept", "application/json");
    defaults.set("User-Agent", "tether");
    var overlay = new HeadersBuilder();
    overlay.set("accept", "application/xml");
    defaults.setAll(overlay);
    defaults.setAll(Map.of("User-Agent", List.of()));
    assertThat(defaults.toMap()).containsExactly(Map.entry("accept", List.of("application/xml")));
  }

  @Test
  void copyIsIndependent() {
    var builder = new HeadersBuilder();
    builder.set("A", "1");
    var copy = builder.copy();
    copy.set("A", "2");
    assertThat(builder.toMap()).containsEntry("A", List.of("1"));
    assertThat(copy.toMap()).containsEntry("A", List.of("2"));
  }

  @Test
  void snapshotIsDetached() {
    var builder = new HeadersBuilder();
    builder.set("A", "1");
    var snapshot = builder.toMap();
    builder.set("B", "2");
    assertThat(snapshot).containsOnlyKeys("A");
  }

  @Test
  void invalidHeaders() {
    var builder = new HeadersBuilder();
    assertThatIllegalArgumentException().isThrownBy(() -> builder.set("Bad Name", "v"));
    assertThatIllegalArgumentException().isThrownBy(() -> builder.set("Name", "bad\nvalue"));
  }
}
