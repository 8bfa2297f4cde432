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

import com.github.mizosoft.tether.RequestSpec.ModelBody;
import com.github.mizosoft.tether.RequestSpec.NoBody;
import com.github.mizosoft.tether.RequestSpec.RawBody;
import com.github.mizosoft.tether.internal.HeadersBuilder;
import com.github.mizosoft.tether.internal.Utils;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Assembles a {@link PreparedRequest} from a {@link RequestSpec}: resolves the URL and its query,
 * encodes the body and applies the default headers followed by the caller's header overlay.
 */
final class RequestBuilder {
  private static final Logger logger = System.getLogger(RequestBuilder.class.getName());

  private final ContentMode contentMode;
  private final ContentCodec codec;
  private final @Nullable ContentCodec formCodec;
  private final @Nullable URI baseUri;
  private final HeadersBuilder defaultHeaders;
  private final @Nullable Duration defaultTimeout;
  private final BooleanSupplier diagnostics;

  RequestBuilder(
      ContentMode contentMode,
      ContentCodec codec,
      @Nullable ContentCodec formCodec,
      @Nullable URI baseUri,
      HeadersBuilder defaultHeaders,
      @Nullable Duration defaultTimeout,
      BooleanSupplier diagnostics) {
    this.contentMode = requireNonNull(contentMode);
    this.codec = requireNonNull(codec);
    this.formCodec = formCodec;
    this.baseUri = baseUri;
    this.defaultHeaders = defaultHeaders.copy();
    this.defaultTimeout = defaultTimeout;
    this.diagnostics = requireNonNull(diagnostics);
  }

  PreparedRequest build(RequestSpec spec) throws BuildException {
    var fullUrl = spec.fullUrl();
    var context = new ErrorContext().setExtra("http_url", fullUrl);
    try {
      var uri = resolve(spec);
      var body = encodeBody(spec);
      var headers = headersFor(spec);
      var template = HttpRequest.newBuilder(uri);
      headers.toMap().forEach((name, values) -> values.forEach(v -> template.header(name, v)));
      spec.timeout().or(() -> Optional.ofNullable(defaultTimeout)).ifPresent(template::timeout);

      // Make sure the method and headers are accepted before anything is sent.
      template.copy().method(spec.method(), BodyPublishers.noBody()).build();

      if (diagnostics.getAsBoolean()) {
        logger.log(Level.INFO, "FullURL: {0}", uri);
        logger.log(Level.INFO, "Headers: {0}", headers.toMap());
        traceBody(spec, body);
      }
      return new PreparedRequest(spec.method(), uri, template, headers.toMap(), body);
    } catch (URISyntaxException | IllegalArgumentException e) {
      throw new BuildException(context.setMessage(e), e);
    } catch (CodecException | UnsupportedOperationException e) {
      throw new BuildException(
          context.setMessage("couldn't encode request body: " + e.getMessage()), e);
    }
  }

  private URI resolve(RequestSpec spec) throws URISyntaxException {
    var uri = new URI(spec.fullUrl());
    if (spec.isRelative()) {
      if (baseUri == null) {
        throw new IllegalArgumentException(
            "relative URL <" + spec.url() + "> requires a base URI");
      }
      return baseUri.resolve(uri);
    }
    if (!uri.isAbsolute()) {
      throw new IllegalArgumentException("URL <" + spec.url() + "> is not absolute");
    }
    return uri;
  }

  private ReplayableBody encodeBody(RequestSpec spec) {
    var body = spec.body();
    if (body instanceof RawBody) {
      return ReplayableBody.of(((RawBody) body).bytes());
    } else if (body instanceof ModelBody) {
      var model = ((ModelBody) body).model();
      return ReplayableBody.of(
          spec.isFormEncoded()
              ? FormBody.of(toFormFields(model)).toByteArray()
              : codec.encode(model));
    } else if (body instanceof NoBody) {
      return ReplayableBody.empty();
    } else {
      throw new AssertionError("unexpected body: " + body);
    }
  }

  private Map<String, List<String>> toFormFields(Object model) {
    if (model instanceof Map<?, ?>) {
      var fields = new LinkedHashMap<String, List<String>>();
      ((Map<?, ?>) model)
          .forEach(
              (name, value) -> {
                if (name != null && value != null) {
                  fields.put(name.toString(), toFieldValues(value));
                }
              });
      return fields;
    }
    if (formCodec == null) {
      throw new UnsupportedOperationException(
          "no JSON codec is available to flatten " + model.getClass().getName());
    }
    return formCodec.toFormFields(model);
  }

  private static List<String> toFieldValues(Object value) {
    if (value instanceof Iterable<?>) {
      var values = new ArrayList<String>();
      for (var element : (Iterable<?>) value) {
        if (element != null) {
          values.add(element.toString());
        }
      }
      return values;
    }
    return List.of(value.toString());
  }

  private HeadersBuilder headersFor(RequestSpec spec) {
    var headers = new HeadersBuilder();
    if (contentMode == ContentMode.JSON) {
      var mediaType = contentMode.mediaType().orElseThrow();
      headers.set("Accept", mediaType);
      if (spec.hasBodyModel()) {
        headers.set("Content-Type", mediaType);
      }
    }
    if (spec.isFormEncoded() && spec.body() instanceof ModelBody) {
      headers.set("Content-Type", FormBody.MEDIA_TYPE);
    }
    headers.setAll(defaultHeaders);
    headers.setAll(spec.headers());
    return headers;
  }

  private void traceBody(RequestSpec spec, ReplayableBody body) {
    var specBody = spec.body();
    if (specBody instanceof RawBody) {
      logger.log(Level.INFO, "BodyRaw: length = {0}", ((RawBody) specBody).length());
    } else if (specBody instanceof ModelBody) {
      logger.log(Level.INFO, "BodyModel: {0}", body.bytes().map(Utils::utf8).orElse(""));
    }
  }
}
