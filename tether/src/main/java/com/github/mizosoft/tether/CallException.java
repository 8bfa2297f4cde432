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

import java.io.IOException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Thrown when a call made through {@link Tether} doesn't produce a successful, decodable response.
 * The exception's {@link #context() context} carries the last request sent and, if one was
 * received, its response.
 *
 * <p>The concrete subtypes tell where the call failed:
 *
 * <ul>
 *   <li>{@link BuildException} - the request couldn't be built; nothing was sent
 *   <li>{@link TransportException} - no response was obtained
 *   <li>{@link StatusException} - a response with a non-2xx status was obtained
 *   <li>{@link DecodeException} - a 2xx response body couldn't be decoded into the response model
 * </ul>
 */
public abstract class CallException extends IOException {
  private final ErrorContext context;

  CallException(ErrorContext context, @Nullable Throwable cause) {
    super(context.message().orElse(null), cause);
    this.context = requireNonNull(context);
  }

  /** Returns this exception's diagnostic context. */
  public ErrorContext context() {
    return context;
  }

  /** Returns the last request sent, or empty if the request couldn't be built. */
  public Optional<HttpRequest> request() {
    return context.request();
  }

  /** Returns the response of the last request, or empty if none was received. */
  public Optional<HttpResponse<byte[]>> response() {
    return context.response();
  }
}
