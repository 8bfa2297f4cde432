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

import java.net.URI;
import java.net.http.HttpRequest;
import java.util.List;
import java.util.Map;

/**
 * A request ready to be sent any number of times. Each call to {@link #nextAttempt()} produces a
 * new {@link HttpRequest} whose body publisher is re-armed from the captured {@link
 * ReplayableBody}.
 */
public final class PreparedRequest {
  private final String method;
  private final URI uri;
  private final HttpRequest.Builder template;
  private final Map<String, List<String>> headers;
  private final ReplayableBody body;

  PreparedRequest(
      String method,
      URI uri,
      HttpRequest.Builder template,
      Map<String, List<String>> headers,
      ReplayableBody body) {
    this.method = requireNonNull(method);
    this.uri = requireNonNull(uri);
    this.template = requireNonNull(template);
    this.headers = requireNonNull(headers);
    this.body = requireNonNull(body);
  }

  public String method() {
    return method;
  }

  public URI uri() {
    return uri;
  }

  /** Returns the headers every attempt is sent with. */
  public Map<String, List<String>> headers() {
    return headers;
  }

  public ReplayableBody body() {
    return body;
  }

  /** Returns a fresh request for the next send attempt. */
  public HttpRequest nextAttempt() {
    return template.copy().method(method, body.rearm()).build();
  }

  @Override
  public String toString() {
    return method + " " + uri();
  }
}
