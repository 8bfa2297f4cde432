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

import static com.github.mizosoft.tether.internal.Utils.requireNonNegativeRetries;
import static com.github.mizosoft.tether.internal.Utils.requirePositiveDuration;
import static com.github.mizosoft.tether.internal.Utils.requireValidHeaderName;
import static com.github.mizosoft.tether.internal.Validate.requireArgument;
import static java.util.Objects.requireNonNull;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An immutable description of one logical call to a remote endpoint. A {@code RequestSpec} says
 * what to send; the {@link Tether} instance it is handed to decides how it is encoded, sent,
 * retried and decoded.
 *
 * <pre>{@code
 * var spec = RequestSpec.newBuilder()
 *     .POST("https://api.example.com/orders", new Order("socks", 2))
 *     .parameter("dryRun", "true")
 *     .header("Authorization", "Bearer " + token)
 *     .errorType(ApiError.class)
 *     .build();
 * }</pre>
 */
public final class RequestSpec {
  private final String method;
  private final String url;
  private final boolean relative;
  private final Map<String, String> parameters;
  private final Body body;
  private final boolean hasBodyModel;
  private final Map<String, List<String>> headers;
  private final boolean formEncoded;
  private final @Nullable Integer maxRetries;
  private final @Nullable Duration timeout;
  private final @Nullable Class<?> errorType;

  private RequestSpec(Builder builder) {
    this.method = builder.method;
    this.url = requireNonNull(builder.url, "url");
    this.relative = builder.relative;
    this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.parameters));
    this.body =
        builder.rawBody != null
            ? new RawBody(builder.rawBody)
            : builder.bodyModel != null ? new ModelBody(builder.bodyModel) : NoBody.INSTANCE;
    this.hasBodyModel = builder.bodyModel != null;
    var headersCopy = new LinkedHashMap<String, List<String>>();
    builder.headers.forEach((name, values) -> headersCopy.put(name, List.copyOf(values)));
    this.headers = Collections.unmodifiableMap(headersCopy);
    this.formEncoded = builder.formEncoded;
    this.maxRetries = builder.maxRetries;
    this.timeout = builder.timeout;
    this.errorType = builder.errorType;
  }

  public String method() {
    return method;
  }

  /** Returns the URL as given, without query parameters. */
  public String url() {
    return url;
  }

  /**
   * Returns {@code true} if {@link #url()} is to be resolved against the engine's base URI.
   *
   * @see Tether.Builder#baseUri(String)
   */
  public boolean isRelative() {
    return relative;
  }

  /** Returns the query parameters. Each name maps to the last value set for it. */
  public Map<String, String> parameters() {
    return parameters;
  }

  /** Returns the URL with the query parameters encoded and appended. */
  public String fullUrl() {
    return QueryString.append(url, parameters);
  }

  public Body body() {
    return body;
  }

  /**
   * Returns {@code true} if a body model was set, even if it's shadowed by raw bytes. The content
   * mode's {@code Content-Type} is sent whenever a model was given.
   */
  public boolean hasBodyModel() {
    return hasBodyModel;
  }

  /**
   * Returns the header overlay. Each header here replaces all values of a same-named default
   * header. A header mapped to an empty list removes the default.
   */
  public Map<String, List<String>> headers() {
    return headers;
  }

  /** Returns {@code true} if a body model is to be sent as {@code x-www-form-urlencoded}. */
  public boolean isFormEncoded() {
    return formEncoded;
  }

  /** Returns this call's max-retries override, if any. */
  public OptionalInt maxRetries() {
    return maxRetries != null ? OptionalInt.of(maxRetries) : OptionalInt.empty();
  }

  /** Returns the per-attempt timeout applied to the transport, if any. */
  public Optional<Duration> timeout() {
    return Optional.ofNullable(timeout);
  }

  /** Returns the type error bodies are decoded into, if any. */
  public Optional<Class<?>> errorType() {
    return Optional.ofNullable(errorType);
  }

  @Override
  public String toString() {
    return method + " " + fullUrl();
  }

  public static RequestSpec GET(String url) {
    return newBuilder().GET(url).build();
  }

  public static RequestSpec DELETE(String url) {
    return newBuilder().DELETE(url).build();
  }

  public static RequestSpec POST(String url, Object bodyModel) {
    return newBuilder().POST(url, bodyModel).build();
  }

  public static RequestSpec PUT(String url, Object bodyModel) {
    return newBuilder().PUT(url, bodyModel).build();
  }

  public static RequestSpec PATCH(String url, Object bodyModel) {
    return newBuilder().PATCH(url, bodyModel).build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * The body of a request: exactly one of {@link NoBody}, {@link ModelBody} or {@link RawBody}.
   */
  public abstract static class Body {
    private Body() {}
  }

  /** No request body. */
  public static final class NoBody extends Body {
    static final NoBody INSTANCE = new NoBody();

    private NoBody() {}

    @Override
    public String toString() {
      return "NoBody";
    }
  }

  /** A body model to be encoded by the engine's codec, or flattened into form fields. */
  public static final class ModelBody extends Body {
    private final Object model;

    ModelBody(Object model) {
      this.model = requireNonNull(model);
    }

    public Object model() {
      return model;
    }

    @Override
    public String toString() {
      return "ModelBody[" + model.getClass().getName() + "]";
    }
  }

  /** Pre-encoded bytes sent verbatim. */
  public static final class RawBody extends Body {
    private final byte[] bytes;

    RawBody(byte[] bytes) {
      this.bytes = bytes.clone();
    }

    /** Returns a copy of the raw bytes. */
    public byte[] bytes() {
      return bytes.clone();
    }

    public int length() {
      return bytes.length;
    }

    @Override
    public String toString() {
      return "RawBody[length=" + bytes.length + "]";
    }
  }

  /** A builder of {@code RequestSpec} instances. */
  public static final class Builder {
    private String method = "GET";
    private @Nullable String url;
    private boolean relative;
    private final Map<String, String> parameters = new LinkedHashMap<>();
    private @Nullable Object bodyModel;
    private byte @Nullable [] rawBody;
    private final Map<String, List<String>> headers = new LinkedHashMap<>();
    private boolean formEncoded;
    private @Nullable Integer maxRetries;
    private @Nullable Duration timeout;
    private @Nullable Class<?> errorType;

    Builder() {}

    /** Sets the HTTP method, which is upper-cased. */
    @CanIgnoreReturnValue
    public Builder method(String method) {
      requireNonNull(method);
      requireArgument(!method.isBlank(), "blank method");
      this.method = method.toUpperCase(Locale.ROOT);
      return this;
    }

    /** Sets the absolute URL, without query parameters. */
    @CanIgnoreReturnValue
    public Builder url(String url) {
      this.url = requireNonNull(url);
      this.relative = false;
      return this;
    }

    /** Sets a URL relative to the engine's {@link Tether.Builder#baseUri(String) base URI}. */
    @CanIgnoreReturnValue
    public Builder relativeUrl(String relativeUrl) {
      this.url = requireNonNull(relativeUrl);
      this.relative = true;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder GET(String url) {
      return method("GET").url(url);
    }

    @CanIgnoreReturnValue
    public Builder DELETE(String url) {
      return method("DELETE").url(url);
    }

    @CanIgnoreReturnValue
    public Builder POST(String url, Object bodyModel) {
      return method("POST").url(url).body(bodyModel);
    }

    @CanIgnoreReturnValue
    public Builder PUT(String url, Object bodyModel) {
      return method("PUT").url(url).body(bodyModel);
    }

    @CanIgnoreReturnValue
    public Builder PATCH(String url, Object bodyModel) {
      return method("PATCH").url(url).body(bodyModel);
    }

    /** Sets a query parameter, replacing any value previously set for the same name. */
    @CanIgnoreReturnValue
    public Builder parameter(String name, String value) {
      parameters.put(requireNonNull(name), requireNonNull(value));
      return this;
    }

    /** Sets each of the given query parameters. */
    @CanIgnoreReturnValue
    public Builder parameters(Map<String, String> parameters) {
      parameters.forEach(this::parameter);
      return this;
    }

    /**
     * Sets the body model. The model is encoded with the engine's codec, unless {@link
     * #rawBody(byte[]) raw bytes} are also set, in which case the raw bytes win.
     */
    @CanIgnoreReturnValue
    public Builder body(Object bodyModel) {
      this.bodyModel = requireNonNull(bodyModel);
      return this;
    }

    /**
     * Sets pre-encoded bytes to send as-is. Takes precedence over any {@link #body(Object)}, though
     * a model set alongside still gets the content mode's {@code Content-Type}.
     */
    @CanIgnoreReturnValue
    public Builder rawBody(byte[] rawBody) {
      this.rawBody = rawBody.clone();
      return this;
    }

    /** Clears both the body model and raw bytes. */
    @CanIgnoreReturnValue
    public Builder noBody() {
      this.bodyModel = null;
      this.rawBody = null;
      return this;
    }

    /**
     * Sets the given header to the given values, replacing any value previously set here or by the
     * engine's defaults. Passing no values removes a default header.
     */
    @CanIgnoreReturnValue
    public Builder header(String name, String... values) {
      requireValidHeaderName(name);
      var valuesList = new ArrayList<String>(values.length);
      for (var value : values) {
        valuesList.add(requireNonNull(value));
      }
      headers.put(name, valuesList);
      return this;
    }

    /** Sets each of the given headers as if by {@link #header(String, String...)}. */
    @CanIgnoreReturnValue
    public Builder headers(Map<String, List<String>> headers) {
      headers.forEach((name, values) -> header(name, values.toArray(String[]::new)));
      return this;
    }

    /** Specifies whether the body model is sent as {@code x-www-form-urlencoded}. */
    @CanIgnoreReturnValue
    public Builder formEncoded(boolean formEncoded) {
      this.formEncoded = formEncoded;
      return this;
    }

    /** Overrides the engine's max retries for this call. Zero means a single attempt. */
    @CanIgnoreReturnValue
    public Builder maxRetries(int maxRetries) {
      this.maxRetries = requireNonNegativeRetries(maxRetries);
      return this;
    }

    /** Sets the timeout the transport applies to each attempt. */
    @CanIgnoreReturnValue
    public Builder timeout(Duration timeout) {
      this.timeout = requirePositiveDuration(timeout);
      return this;
    }

    /** Sets the type that bodies of non-2xx responses are decoded into. */
    @CanIgnoreReturnValue
    public Builder errorType(Class<?> errorType) {
      this.errorType = requireNonNull(errorType);
      return this;
    }

    /**
     * Returns a new {@code RequestSpec}.
     *
     * @throws NullPointerException if no URL is set
     */
    public RequestSpec build() {
      return new RequestSpec(this);
    }
  }
}
