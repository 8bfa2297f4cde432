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
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;

/**
 * Sends a single request and returns its response with the body fully read into memory. A
 * transport is shared by all calls of a {@link Tether} instance and must be safe for concurrent
 * use. Connection pooling, TLS, redirects and compression are the transport's business.
 */
@FunctionalInterface
public interface Transport {

  /**
   * Sends the given request, blocking until the response body is read.
   *
   * @throws IOException if no response could be obtained
   * @throws InterruptedException if interrupted while waiting
   */
  HttpResponse<byte[]> send(HttpRequest request) throws IOException, InterruptedException;

  /** Returns a {@code Transport} that sends requests with the given {@code HttpClient}. */
  static Transport of(HttpClient client) {
    requireNonNull(client);
    return request -> client.send(request, BodyHandlers.ofByteArray());
  }
}
