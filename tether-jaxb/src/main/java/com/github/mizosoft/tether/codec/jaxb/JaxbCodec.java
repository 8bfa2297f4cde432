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

package com.github.mizosoft.tether.codec.jaxb;

import com.github.mizosoft.tether.CodecException;
import com.github.mizosoft.tether.ContentCodec;
import com.github.mizosoft.tether.ContentMode;
import com.github.mizosoft.tether.TypeRef;
import jakarta.xml.bind.JAXBContext;
import jakarta.xml.bind.JAXBException;
import jakarta.xml.bind.Marshaller;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import javax.xml.transform.stream.StreamSource;

/**
 * A {@link ContentCodec} for XML using JAXB. Bodies are written in UTF-8. Decoding targets the
 * requested class whether or not it's annotated with {@code @XmlRootElement}.
 *
 * <p>A {@code JAXBContext} is created once per bound class and shared across calls. Marshallers
 * and unmarshallers aren't thread-safe, so a fresh one is made for each encode or decode.
 */
public final class JaxbCodec implements ContentCodec {
  private final ConcurrentMap<Class<?>, JAXBContext> contexts = new ConcurrentHashMap<>();

  public JaxbCodec() {}

  @Override
  public boolean supports(ContentMode mode) {
    return mode == ContentMode.XML;
  }

  @Override
  public byte[] encode(Object value) {
    var buffer = new ByteArrayOutputStream();
    try {
      var marshaller = contextFor(value.getClass()).createMarshaller();
      marshaller.setProperty(Marshaller.JAXB_ENCODING, StandardCharsets.UTF_8.name());
      marshaller.marshal(value, buffer);
    } catch (JAXBException e) {
      throw new CodecException("couldn't encode " + value.getClass().getName() + " as XML", e);
    }
    return buffer.toByteArray();
  }

  @Override
  public <T> T decode(byte[] body, TypeRef<T> typeRef) {
    var rawType = typeRef.rawType();
    try {
      var unmarshaller = contextFor(rawType).createUnmarshaller();
      var source = new StreamSource(new ByteArrayInputStream(body));
      return typeRef.uncheckedCast(unmarshaller.unmarshal(source, rawType).getValue());
    } catch (JAXBException e) {
      throw new CodecException("couldn't decode XML into " + typeRef, e);
    }
  }

  /** Returns the cached context bound to {@code type}, creating it on first use. */
  JAXBContext contextFor(Class<?> type) {
    var context = contexts.get(type);
    if (context != null) {
      return context;
    }
    try {
      context = JAXBContext.newInstance(type);
    } catch (JAXBException e) {
      throw new CodecException("couldn't bind " + type.getName() + " to XML", e);
    }
    var existing = contexts.putIfAbsent(type, context);
    return existing != null ? existing : context;
  }

  @Override
  public String toString() {
    return "JaxbCodec[boundTypes=" + contexts.keySet() + "]";
  }
}
