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

import static java.nio.charset.StandardCharsets.US_ASCII;
import static java.nio.charset.StandardCharsets.UTF_8;

import java.net.URLEncoder;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/** An {@code application/x-www-form-urlencoded} body made of flattened model fields. */
final class FormBody {
  static final String MEDIA_TYPE = "application/x-www-form-urlencoded";

  private final String encodedString;

  private FormBody(String encodedString) {
    this.encodedString = encodedString;
  }

  /**
   * Returns a {@code FormBody} of the given fields, in iteration order. A field with several values
   * is repeated once per value.
   */
  static FormBody of(Map<String, List<String>> fields) {
    var joiner = new StringJoiner("&");
    fields.forEach(
        (name, values) -> {
          var encodedName = URLEncoder.encode(name, UTF_8);
          values.forEach(value -> joiner.add(encodedName + "=" + URLEncoder.encode(value, UTF_8)));
        });
    return new FormBody(joiner.toString());
  }

  String encodedString() {
    return encodedString;
  }

  /** Returns the encoded body. Characters are ASCII after url-encoding, so 1 byte each. */
  byte[] toByteArray() {
    return encodedString.getBytes(US_ASCII);
  }
}
