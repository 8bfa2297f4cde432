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

package com.github.mizosoft.tether.internal;

import com.github.mizosoft.tether.CodecException;
import com.github.mizosoft.tether.ContentCodec;
import com.github.mizosoft.tether.ContentMode;
import com.github.mizosoft.tether.TypeRef;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The codec of {@link ContentMode#RAW}. {@code byte[]} and {@code String} models pass through
 * untouched (strings as UTF-8). Anything else is forwarded to a structured codec, if one is
 * available.
 */
public final class RawCodec implements ContentCodec {
  private final @Nullable ContentCodec structuredCodec;

  public RawCodec(@Nullable ContentCodec structuredCodec) {
    this.structuredCodec = structuredCodec;
  }

  @Override
  public boolean supports(ContentMode mode) {
    return mode == ContentMode.RAW;
  }

  @Override
  public byte[] encode(Object value) {
    if (value instanceof byte[]) {
      return ((byte[]) value).clone();
    } else if (value instanceof CharSequence) {
      return value.toString().getBytes(StandardCharsets.UTF_8);
    }
    return requireStructuredCodec(value.getClass()).encode(value);
  }

  @Override
  public <T> T decode(byte[] body, TypeRef<T> typeRef) {
    var rawType = typeRef.rawType();
    if (rawType == byte[].class) {
      return typeRef.uncheckedCast(body.clone());
    } else if (rawType == String.class || rawType == CharSequence.class) {
      return typeRef.uncheckedCast(Utils.utf8(body));
    }
    return requireStructuredCodec(rawType).decode(body, typeRef);
  }

  @Override
  public Map<String, List<String>> toFormFields(Object value) {
    if (structuredCodec == null) {
      throw new UnsupportedOperationException("no structured codec to flatten models");
    }
    return structuredCodec.toFormFields(value);
  }

  private ContentCodec requireStructuredCodec(Class<?> type) {
    if (structuredCodec == null) {
      throw new CodecException(
          "no installed codec can handle " + type.getName() + " as raw content");
    }
    return structuredCodec;
  }
}
