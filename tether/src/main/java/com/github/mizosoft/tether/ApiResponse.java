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

import com.github.mizosoft.tether.internal.Utils;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The successful result of a call: the last request sent, the response received for it and, if a
 * response type was requested, the decoded response model.
 *
 * @param <T> the response model's type
 */
public final class ApiResponse<T> {
  private final HttpRequest request;
  private final HttpResponse<byte[]> response;
  private final @Nullable T body;
  private final int retryCount;

  ApiResponse(
      HttpRequest request, HttpResponse<byte[]> response, @Nullable T body, int retryCount) {
    this.request = requireNonNull(request);
    this.response = requireNonNull(response);
    this.body = body;
    this.retryCount = retryCount;
  }

  /** Returns the last request sent. */
  public HttpRequest request() {
    return request;
  }

  /** Returns the raw response, with its body buffered in memory. */
  public HttpResponse<byte[]> rawResponse() {
    return response;
  }

  public int statusCode() {
    return response.statusCode();
  }

  public HttpHeaders headers() {
    return response.headers();
  }

  /**
   * Returns the decoded response model, or {@code null} if the call didn't ask for one.
   */
  public @Nullable T body() {
    return body;
  }

  /** Returns the decoded response model, if the call asked for one. */
  public Optional<T> bodyIfPresent() {
    return Optional.ofNullable(body);
  }

  /** Returns a copy of the response body's bytes. */
  public byte[] bytes() {
    var bytes = response.body();
    return bytes != null ? bytes.clone() : new byte[0];
  }

  /** Returns the response body as a UTF-8 string. */
  public String bodyAsString() {
    var bytes = response.body();
    return bytes != null ? Utils.utf8(bytes) : "";
  }

  /** Returns the number of retries it took to get this response. */
  public int retryCount() {
    return retryCount;
  }

  @Override
  public String toString() {
    return "ApiResponse[" + request.method() + " " + request.uri() + ", " + statusCode() + "]";
  }
}
