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

import com.github.mizosoft.tether.internal.Utils;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Thrown when a response with a status code outside {@code 2xx} is received and isn't retried
 * further. If the request specified an {@link RequestSpec#errorType() error type}, the response
 * body is decoded into an {@link #errorModel() error model}. If that decoding fails, the raw body
 * text is kept in the context's {@code response_message} extra.
 */
public final class StatusException extends CallException {
  private final int statusCode;
  private final byte[] body;
  private final @Nullable Object errorModel;

  StatusException(
      ErrorContext context, int statusCode, byte[] body, @Nullable Object errorModel) {
    super(context, null);
    this.statusCode = statusCode;
    this.body = body;
    this.errorModel = errorModel;
  }

  public int statusCode() {
    return statusCode;
  }

  /** Returns a copy of the response body. */
  public byte[] body() {
    return body.clone();
  }

  /** Returns the response body as a UTF-8 string. */
  public String bodyAsString() {
    return Utils.utf8(body);
  }

  /** Returns the decoded error model, or empty if none was requested or decoding failed. */
  public Optional<Object> errorModel() {
    return Optional.ofNullable(errorModel);
  }

  /** Returns the decoded error model if it is an instance of the given type. */
  public <E> Optional<E> errorModel(Class<E> type) {
    return type.isInstance(errorModel) ? Optional.of(type.cast(errorModel)) : Optional.empty();
  }
}
