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

import com.github.mizosoft.tether.internal.spi.ContentCodecProviders;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An object that encodes models into request bodies and decodes response bodies into models using
 * the format of a {@link ContentMode}.
 *
 * <p>Codecs are either passed explicitly to {@link Tether.Builder#codec(ContentCodec)} or
 * discovered from the classpath as {@link java.util.ServiceLoader service providers}. A codec
 * registered as a service provider must have a public no-arg constructor.
 *
 * <p>Implementations must be safe for concurrent use.
 */
public interface ContentCodec {

  /** Returns {@code true} if this codec reads and writes the format of the given mode. */
  boolean supports(ContentMode mode);

  /**
   * Encodes the given model into bytes.
   *
   * @throws CodecException if the model can't be encoded
   */
  byte[] encode(Object value);

  /**
   * Decodes the given body into an object of the given type.
   *
   * @throws CodecException if the body can't be decoded into the given type
   */
  <T> T decode(byte[] body, TypeRef<T> typeRef);

  /**
   * Flattens the given model into form fields, using the names the model's properties have in this
   * codec's format. Multivalued properties produce more than one value for the same name.
   *
   * @implSpec The default implementation throws {@code UnsupportedOperationException}.
   * @throws UnsupportedOperationException if this codec can't flatten models
   * @throws CodecException if the model can't be flattened
   */
  default Map<String, List<String>> toFormFields(Object value) {
    throw new UnsupportedOperationException(getClass().getName() + " can't flatten models");
  }

  /** Returns an immutable list containing the installed codecs. */
  static List<ContentCodec> installed() {
    return ContentCodecProviders.get();
  }

  /** Returns the first installed codec that supports the given mode. */
  static Optional<ContentCodec> installed(ContentMode mode) {
    return installed().stream().filter(codec -> codec.supports(mode)).findFirst();
  }
}
