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

import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The serialization format a {@link Tether} instance negotiates once and applies to both request
 * encoding and response decoding.
 */
public enum ContentMode {
  /** Bodies are JSON. Requests default to {@code Accept: application/json}. */
  JSON("application/json"),

  /** Bodies are XML. No default headers are added. */
  XML("application/xml"),

  /**
   * Bodies are passed through as-is. {@code String} and {@code byte[]} models are sent and received
   * verbatim, while structured models still go through the installed JSON codec, if any. No default
   * headers are added.
   */
  RAW(null);

  private final @Nullable String mediaType;

  ContentMode(@Nullable String mediaType) {
    this.mediaType = mediaType;
  }

  /** Returns the media type of bodies written in this mode, or empty for {@link #RAW}. */
  public Optional<String> mediaType() {
    return Optional.ofNullable(mediaType);
  }
}
