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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Diagnostic context carried by a {@link CallException}: the last request sent, the response
 * received for it (if any), a human-readable message, and free-form key/value extras.
 *
 * <p>A context is populated by the engine on the calling thread before the exception is thrown, and
 * is not safe for concurrent modification.
 */
public final class ErrorContext {
  private @Nullable HttpRequest request;
  private @Nullable HttpResponse<byte[]> response;
  private @Nullable String message;
  private final Map<String, String> extras = new LinkedHashMap<>();

  public ErrorContext() {}

  @CanIgnoreReturnValue
  public ErrorContext setRequest(@Nullable HttpRequest request) {
    this.request = request;
    return this;
  }

  @CanIgnoreReturnValue
  public ErrorContext setResponse(@Nullable HttpResponse<byte[]> response) {
    this.response = response;
    return this;
  }

  @CanIgnoreReturnValue
  public ErrorContext setMessage(String message) {
    this.message = requireNonNull(message);
    return this;
  }

  /** Sets the message to that of the given exception, or to its class name if it has none. */
  @CanIgnoreReturnValue
  public ErrorContext setMessage(Throwable exception) {
    var exceptionMessage = exception.getMessage();
    this.message = exceptionMessage != null ? exceptionMessage : exception.getClass().getName();
    return this;
  }

  @CanIgnoreReturnValue
  public ErrorContext setExtra(String key, String value) {
    extras.put(requireNonNull(key), requireNonNull(value));
    return this;
  }

  public Optional<HttpRequest> request() {
    return Optional.ofNullable(request);
  }

  public Optional<HttpResponse<byte[]>> response() {
    return Optional.ofNullable(response);
  }

  public Optional<String> message() {
    return Optional.ofNullable(message);
  }

  public Optional<String> extra(String key) {
    return Optional.ofNullable(extras.get(key));
  }

  /** Returns an unmodifiable view of the extras, in insertion order. */
  public Map<String, String> extras() {
    return Collections.unmodifiableMap(extras);
  }

  @Override
  public String toString() {
    return "ErrorContext[request="
        + request
        + ", response="
        + response
        + ", message="
        + message
        + ", extras="
        + extras
        + "]";
  }
}
