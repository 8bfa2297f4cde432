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

import static java.util.Objects.requireNonNull;

import java.util.Arrays;
import java.util.Set;

/** Decides whether a response with a given status code is worth retrying. */
@FunctionalInterface
public interface RetryPredicate {

  boolean shouldRetry(int statusCode);

  /** Returns a predicate that retries if either this or the given predicate does. */
  default RetryPredicate or(RetryPredicate other) {
    requireNonNull(other);
    return statusCode -> shouldRetry(statusCode) || other.shouldRetry(statusCode);
  }

  /**
   * Returns the default predicate, which retries {@code 500 Internal Server Error} and {@code 503
   * Service Unavailable}, the responses a recovering server is expected to give.
   */
  static RetryPredicate serverErrors() {
    return onStatus(500, 503);
  }

  /** Returns a predicate that retries any of the given status codes. */
  static RetryPredicate onStatus(Integer... statusCodes) {
    var codes = Set.copyOf(Arrays.asList(statusCodes));
    return codes::contains;
  }

  /** Returns a predicate that never retries. */
  static RetryPredicate never() {
    return __ -> false;
  }
}
