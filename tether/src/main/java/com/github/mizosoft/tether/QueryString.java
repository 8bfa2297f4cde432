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

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;

/** Encodes query parameters onto URLs. */
final class QueryString {
  private QueryString() {}

  /**
   * Returns the given parameters in {@code application/x-www-form-urlencoded} form, sorted by name.
   */
  static String encode(Map<String, String> parameters) {
    var joiner = new StringJoiner("&");
    new TreeMap<>(parameters)
        .forEach(
            (name, value) ->
                joiner.add(
                    URLEncoder.encode(name, StandardCharsets.UTF_8)
                        + "="
                        + URLEncoder.encode(value, StandardCharsets.UTF_8)));
    return joiner.toString();
  }

  /** Appends the given parameters to the given URL, which may already have a query. */
  static String append(String url, Map<String, String> parameters) {
    if (parameters.isEmpty()) {
      return url;
    }
    int fragmentStart = url.indexOf('#');
    var base = fragmentStart >= 0 ? url.substring(0, fragmentStart) : url;
    var fragment = fragmentStart >= 0 ? url.substring(fragmentStart) : "";
    String separator;
    if (base.indexOf('?') < 0) {
      separator = "?";
    } else if (base.endsWith("?") || base.endsWith("&")) {
      separator = "";
    } else {
      separator = "&";
    }
    return base + separator + encode(parameters) + fragment;
  }
}
