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

import static com.github.mizosoft.tether.internal.Validate.requireArgument;
import static java.util.Objects.requireNonNull;

import com.github.mizosoft.tether.ResponseClassifier.Classification;
import java.io.IOException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The outcome of one send attempt: the request sent, and either the response obtained or the
 * transport error that prevented one. The response body is read exactly once by the transport
 * and can be decoded any number of times from {@link #body()}.
 */
public final class Attempt {
  private final HttpRequest request;
  private final @Nullable HttpResponse<byte[]> response;
  private final @Nullable IOException exception;
  private final int retryCount;
  private final Classification classification;

  Attempt(
      HttpRequest request,
      @Nullable HttpResponse<byte[]> response,
      @Nullable IOException exception,
      int retryCount,
      Classification classification) {
    requireArgument(
        response != null ^ exception != null,
        "Exactly one of response or exception must be non-null");
    requireArgument(retryCount >= 0, "Expected retryCount to be non-negative");
    this.request = requireNonNull(request);
    this.response = response;
    this.exception = exception;
    this.retryCount = retryCount;
    this.classification = requireNonNull(classification);
  }

  /** Returns the request sent by this attempt. */
  public HttpRequest request() {
    return request;
  }

  public Optional<HttpResponse<byte[]>> response() {
    return Optional.ofNullable(response);
  }

  public Optional<IOException> exception() {
    return Optional.ofNullable(exception);
  }

  /** Returns the response's status code, or {@link ResponseClassifier#NO_STATUS} if none. */
  public int statusCode() {
    return response != null ? response.statusCode() : ResponseClassifier.NO_STATUS;
  }

  /** Returns the buffered response body, or an empty array if there's no response. */
  public byte[] body() {
    if (response == null) {
      return new byte[0];
    }
    var body = response.body();
    return body != null ? body : new byte[0];
  }

  /** Returns the number of retries that preceded this attempt. */
  public int retryCount() {
    return retryCount;
  }

  public Classification classification() {
    return classification;
  }

  @Override
  public String toString() {
    return "Attempt[request="
        + request
        + ", statusCode="
        + statusCode()
        + ", exception="
        + exception
        + ", retryCount="
        + retryCount
        + ", classification="
        + classification
        + "]";
  }
}
