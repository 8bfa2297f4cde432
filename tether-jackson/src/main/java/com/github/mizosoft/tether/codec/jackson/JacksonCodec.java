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

package com.github.mizosoft.tether.codec.jackson;

import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.github.mizosoft.tether.CodecException;
import com.github.mizosoft.tether.ContentCodec;
import com.github.mizosoft.tether.ContentMode;
import com.github.mizosoft.tether.TypeRef;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A {@link ContentCodec} for JSON using Jackson. The codec created by the public constructor, which
 * is the one discovered from the classpath, ignores unknown properties when decoding.
 */
public final class JacksonCodec implements ContentCodec {
  private final ObjectMapper mapper;

  /** Creates a {@code JacksonCodec} with a default {@code ObjectMapper}. */
  public JacksonCodec() {
    this(
        JsonMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build());
  }

  private JacksonCodec(ObjectMapper mapper) {
    this.mapper = requireNonNull(mapper);
  }

  /** Returns a {@code JacksonCodec} that uses the given mapper. */
  public static JacksonCodec create(ObjectMapper mapper) {
    return new JacksonCodec(mapper);
  }

  @Override
  public boolean supports(ContentMode mode) {
    return mode == ContentMode.JSON;
  }

  @Override
  public byte[] encode(Object value) {
    try {
      return mapper.writeValueAsBytes(value);
    } catch (IOException e) {
      throw new CodecException("couldn't encode " + value.getClass().getName() + " as JSON", e);
    }
  }

  @Override
  public <T> T decode(byte[] body, TypeRef<T> typeRef) {
    try {
      return typeRef.uncheckedCast(mapper.readValue(body, mapper.constructType(typeRef.type())));
    } catch (IOException e) {
      throw new CodecException("couldn't decode JSON into " + typeRef, e);
    }
  }

  /**
   * {@inheritDoc}
   *
   * <p>The model is converted to a JSON tree whose top-level properties become fields. Array
   * elements become repeated values, nested objects are written as JSON text and nulls are left
   * out.
   */
  @Override
  public Map<String, List<String>> toFormFields(Object value) {
    JsonNode tree;
    try {
      tree = mapper.valueToTree(value);
    } catch (IllegalArgumentException e) {
      throw new CodecException("couldn't flatten " + value.getClass().getName(), e);
    }
    if (!tree.isObject()) {
      throw new CodecException(
          "expected " + value.getClass().getName() + " to be an object, found "
              + tree.getNodeType());
    }

    var fields = new LinkedHashMap<String, List<String>>();
    tree.fields()
        .forEachRemaining(
            entry -> {
              var values = toFieldValues(entry.getValue());
              if (!values.isEmpty()) {
                fields.put(entry.getKey(), values);
              }
            });
    return Collections.unmodifiableMap(fields);
  }

  private static List<String> toFieldValues(JsonNode node) {
    if (node.isNull() || node.isMissingNode()) {
      return List.of();
    } else if (node.isArray()) {
      var values = new ArrayList<String>();
      node.forEach(
          element -> {
            if (!element.isNull()) {
              values.add(toFieldValue(element));
            }
          });
      return Collections.unmodifiableList(values);
    } else {
      return List.of(toFieldValue(node));
    }
  }

  private static String toFieldValue(JsonNode node) {
    return node.isContainerNode() ? node.toString() : node.asText();
  }

  @Override
  public String toString() {
    return "JacksonCodec[" + mapper.getClass().getSimpleName() + "]";
  }
}
