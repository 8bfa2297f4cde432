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

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A request body captured once when the request is built and re-exposed as a fresh {@link
 * BodyPublisher} on every send attempt, so that retries transmit exactly the bytes of the first
 * attempt. The publisher handed to the transport is never the caller's original source.
 */
public final class ReplayableBody {
  private final byte @Nullable [] bytes;
  private final AtomicInteger attempts = new AtomicInteger();

  private ReplayableBody(byte @Nullable [] bytes) {
    this.bytes = bytes;
  }

  /** Returns a {@code ReplayableBody} owning a copy of the given bytes. */
  public static ReplayableBody of(byte[] bytes) {
    return new ReplayableBody(bytes.clone());
  }

  /**
   * Returns a {@code ReplayableBody} owning everything read from the given stream, which is read
   * once and closed.
   */
  public static ReplayableBody of(InputStream source) throws IOException {
    try (source) {
      return new ReplayableBody(source.readAllBytes());
    }
  }

  /** Returns a {@code ReplayableBody} for a request without a body. */
  public static ReplayableBody empty() {
    return new ReplayableBody(null);
  }

  /**
   * Returns a new publisher over the captured bytes for the next attempt, and counts the attempt.
   */
  public BodyPublisher rearm() {
    attempts.incrementAndGet();
    return bytes != null ? BodyPublishers.ofByteArray(bytes) : BodyPublishers.noBody();
  }

  /** Returns the number of times this body has been {@link #rearm() re-armed}. */
  public int attempts() {
    return attempts.get();
  }

  /** Returns {@code true} if the request has a body. */
  public boolean isPresent() {
    return bytes != null;
  }

  /** Returns a copy of the captured bytes, or empty if the request has no body. */
  public Optional<byte[]> bytes() {
    return bytes != null ? Optional.of(bytes.clone()) : Optional.empty();
  }

  /** Returns the length of the captured bytes, or {@code 0} if the request has no body. */
  public int length() {
    return bytes != null ? bytes.length : 0;
  }

  @Override
  public String toString() {
    return "ReplayableBody[length=" + length() + ", attempts=" + attempts() + "]";
  }
}
