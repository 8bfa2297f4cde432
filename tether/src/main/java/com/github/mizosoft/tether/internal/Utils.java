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

import static com.github.mizosoft.tether.internal.Validate.requireArgument;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

/** Miscellaneous utilities. */
public class Utils {
  private static final String TOKEN_SPECIALS = "!#$%&'*+-.^_`|~";

  private Utils() {}

  /** Returns {@code true} if the given string is a non-empty RFC 7230 token. */
  public static boolean isValidToken(CharSequence token) {
    if (token.length() == 0) {
      return false;
    }
    for (int i = 0; i < token.length(); i++) {
      if (!isTokenChar(token.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  private static boolean isTokenChar(char c) {
    return (c >= 'a' && c <= 'z')
        || (c >= 'A' && c <= 'Z')
        || (c >= '0' && c <= '9')
        || TOKEN_SPECIALS.indexOf(c) >= 0;
  }

  // VCHAR, SP, HTAB or obs-text.
  private static boolean isFieldValueChar(char c) {
    return (c >= 0x21 && c <= 0x7e) || c == ' ' || c == '\t' || (c >= 0x80 && c <= 0xff);
  }

  private static boolean isValidFieldValue(String value) {
    for (int i = 0; i < value.length(); i++) {
      if (!isFieldValueChar(value.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  public static String requireValidHeaderName(String name) {
    requireArgument(isValidToken(name), "illegal header name: '%s'", name);
    return name;
  }

  public static String requireValidHeaderValue(String value) {
    requireArgument(isValidFieldValue(value), "illegal header value: '%s'", value);
    return value;
  }

  public static Duration requirePositiveDuration(Duration duration) {
    requireArgument(
        !(duration.isNegative() || duration.isZero()), "non-positive duration: %s", duration);
    return duration;
  }

  public static Duration requireNonNegativeDuration(Duration duration) {
    requireArgument(!duration.isNegative(), "negative duration: %s", duration);
    return duration;
  }

  public static int requireNonNegativeRetries(int maxRetries) {
    requireArgument(maxRetries >= 0, "negative maxRetries: %d", maxRetries);
    return maxRetries;
  }

  /** Decodes the given bytes as UTF-8, replacing malformed input. */
  public static String utf8(byte[] bytes) {
    return new String(bytes, StandardCharsets.UTF_8);
  }
}
