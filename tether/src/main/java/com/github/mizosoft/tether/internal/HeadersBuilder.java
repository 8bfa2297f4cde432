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

import static com.github.mizosoft.tether.internal.Utils.requireValidHeaderName;
import static com.github.mizosoft.tether.internal.Utils.requireValidHeaderValue;
import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * A case-insensitive header map where {@link #set(String, List) setting} a header replaces all of
 * its previous values.
 */
public final class HeadersBuilder {
  private final Map<String, List<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

  public HeadersBuilder() {}

  public void set(String name, String value) {
    set(name, List.of(value));
  }

  /**
   * Deletes the given header then adds each of the given values. An empty list of values leaves
   * the header absent.
   */
  public void set(String name, List<String> values) {
    requireValidHeaderName(name);
    headers.remove(name);
    if (!values.isEmpty()) {
      var myValues = new ArrayList<String>(values.size());
      values.forEach(value -> myValues.add(requireValidHeaderValue(requireNonNull(value))));
      headers.put(name, myValues);
    }
  }

  public void setAll(Map<String, List<String>> headers) {
    headers.forEach(this::set);
  }

  public void setAll(HeadersBuilder builder) {
    builder.headers.forEach(this::set);
  }

  /** Returns an immutable snapshot of the current headers, preserving name order. */
  public Map<String, List<String>> toMap() {
    var snapshot = new LinkedHashMap<String, List<String>>();
    headers.forEach((name, values) -> snapshot.put(name, List.copyOf(values)));
    return Collections.unmodifiableMap(snapshot);
  }

  public HeadersBuilder copy() {
    var copy = new HeadersBuilder();
    copy.setAll(this);
    return copy;
  }
}
