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
import static com.github.mizosoft.tether.internal.Validate.requireArgument;
import static java.util.Objects.requireNonNull;

import com.github.mizosoft.tether.ResponseClassifier.Classification;
import com.github.mizosoft.tether.internal.HeadersBuilder;
import com.github.mizosoft.tether.internal.RawCodec;
import com.github.mizosoft.tether.internal.concurrent.Sleeper;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;
import org.checkerframework.checker.nullness.qual.MonotonicNonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A request-execution engine shared by API clients. A {@code Tether} turns a {@link RequestSpec}
 * into a wire request, sends it, retries transient failures with backoff, and turns the final
 * response into either a typed {@link ApiResponse} or a typed {@link CallException}.
 *
 * <pre>{@code
 * var tether = Tether.newBuilder()
 *     .contentMode(ContentMode.JSON)
 *     .baseUri("https://api.example.com/v1/")
 *     .build();
 *
 * try {
 *   Order order = tether.send(
 *       RequestSpec.newBuilder().relativeUrl("orders/42").errorType(ApiError.class).build(),
 *       Order.class).body();
 * } catch (StatusException e) {
 *   e.errorModel(ApiError.class).ifPresent(error -> ...);
 * }
 * }</pre>
 *
 * <p>Each call runs synchronously on the calling thread; there is no background retry thread and
 * no cancellation beyond the transport's own timeouts. A {@code Tether} is immutable apart from its
 * request counter and can be shared among threads.
 */
public final class Tether {
  private static final Logger logger = System.getLogger(Tether.class.getName());

  /** The system property read by {@link Builder#diagnosticsFromSystemProperty()}. */
  public static final String DIAGNOSTICS_PROPERTY = "com.github.mizosoft.tether.diagnostics";

  private static final int DEFAULT_MAX_RETRIES = 5;

  private final ContentMode contentMode;
  private final Transport transport;
  private final ContentCodec codec;
  private final int maxRetries;
  private final BooleanSupplier diagnostics;
  private final RequestBuilder requestBuilder;
  private final RetryExecutor retryExecutor;
  private final ResponseDecoder responseDecoder;
  private final AtomicLong requestCount = new AtomicLong();

  private Tether(Builder builder) {
    this.contentMode = builder.contentMode;
    this.transport =
        builder.transport != null ? builder.transport : Transport.of(HttpClient.newHttpClient());
    this.codec = resolveCodec(contentMode, builder.codec);
    this.maxRetries = builder.maxRetries;
    this.diagnostics = builder.diagnostics;
    this.requestBuilder =
        new RequestBuilder(
            contentMode,
            codec,
            codec.supports(ContentMode.JSON) || contentMode == ContentMode.RAW
                ? codec
                : ContentCodec.installed(ContentMode.JSON).orElse(null),
            builder.baseUri,
            builder.defaultHeaders,
            builder.requestTimeout,
            diagnostics);
    this.retryExecutor =
        new RetryExecutor(
            new ResponseClassifier(
                builder.retryPredicate != null
                    ? RetryPredicate.serverErrors().or(builder.retryPredicate)
                    : RetryPredicate.serverErrors()),
            builder.backoffStrategy,
            builder.sleeper,
            diagnostics);
    this.responseDecoder = new ResponseDecoder(codec);
  }

  private static ContentCodec resolveCodec(ContentMode contentMode, @Nullable ContentCodec codec) {
    if (codec != null && codec.supports(contentMode)) {
      return codec;
    }
    if (contentMode == ContentMode.RAW) {
      // Non-raw values still need a structured codec.
      return new RawCodec(
          codec != null ? codec : ContentCodec.installed(ContentMode.JSON).orElse(null));
    }
    requireArgument(codec == null, "codec %s doesn't support %s", codec, contentMode);
    return ContentCodec.installed(contentMode)
        .orElseThrow(
            () ->
                new IllegalStateException(
                    "no installed codec supports "
                        + contentMode
                        + "; add one to the classpath or pass one to Builder::codec"));
  }

  /** Returns this engine's negotiated content mode. */
  public ContentMode contentMode() {
    return contentMode;
  }

  /** Returns the codec used to encode request bodies and decode response bodies. */
  public ContentCodec codec() {
    return codec;
  }

  /** Returns the transport requests are sent with. */
  public Transport transport() {
    return transport;
  }

  /** Returns the max retries applied to calls that don't override it. */
  public int maxRetries() {
    return maxRetries;
  }

  /**
   * Sends the given request without decoding the response body.
   *
   * @throws CallException if the call fails
   * @throws InterruptedException if interrupted while sending or backing off
   */
  public ApiResponse<Void> send(RequestSpec spec) throws CallException, InterruptedException {
    return call(spec, null);
  }

  /**
   * Sends the given request and decodes a successful response's body into the given type.
   *
   * @throws CallException if the call fails, including when the body can't be decoded
   * @throws InterruptedException if interrupted while sending or backing off
   */
  public <T> ApiResponse<T> send(RequestSpec spec, Class<T> responseType)
      throws CallException, InterruptedException {
    return call(spec, TypeRef.of(responseType));
  }

  /**
   * Sends the given request and decodes a successful response's body into the given type.
   *
   * @throws CallException if the call fails, including when the body can't be decoded
   * @throws InterruptedException if interrupted while sending or backing off
   */
  public <T> ApiResponse<T> send(RequestSpec spec, TypeRef<T> responseType)
      throws CallException, InterruptedException {
    return call(spec, requireNonNull(responseType));
  }

  private <T> ApiResponse<T> call(RequestSpec spec, @Nullable TypeRef<T> responseType)
      throws CallException, InterruptedException {
    requireNonNull(spec);
    if (diagnostics.getAsBoolean()) {
      if (responseType != null) {
        logger.log(Level.INFO, "ResponseModel: {0}", responseType);
      }
      spec.errorType().ifPresent(type -> logger.log(Level.INFO, "ErrorModel: {0}", type.getName()));
    }

    var request = requestBuilder.build(spec);
    requestCount.incrementAndGet();
    var attempt =
        retryExecutor
            .execute(request, transport, spec.maxRetries().orElse(maxRetries))
            .orElseThrow(() -> new AssertionError("executor returned no attempt for " + request));

    var context =
        new ErrorContext()
            .setRequest(attempt.request())
            .setExtra("http_url", attempt.request().uri().toString());
    if (isSuccess(attempt)) {
      return responseDecoder.decodeSuccess(attempt, responseType, context);
    }
    throw responseDecoder.decodeFailure(attempt, spec.errorType().orElse(null), context);
  }

  private static boolean isSuccess(Attempt attempt) {
    return attempt.classification() == Classification.SUCCESS
        || (attempt.exception().isEmpty()
            && ResponseClassifier.isSuccessful(attempt.statusCode()));
  }

  /** Returns the number of calls that reached the transport since creation or the last reset. */
  public long requestCount() {
    return requestCount.get();
  }

  /** Resets the {@link #requestCount() request count} to zero. */
  public void resetRequestCount() {
    requestCount.set(0);
  }

  /** Returns a new {@code Tether.Builder}. */
  public static Builder newBuilder() {
    return new Builder();
  }

  /** A builder of {@code Tether} instances. */
  public static final class Builder {
    private ContentMode contentMode = ContentMode.JSON;
    private @MonotonicNonNull Transport transport;
    private @MonotonicNonNull ContentCodec codec;
    private @MonotonicNonNull URI baseUri;
    private final HeadersBuilder defaultHeaders = new HeadersBuilder();
    private int maxRetries = DEFAULT_MAX_RETRIES;
    private @MonotonicNonNull RetryPredicate retryPredicate;
    private BackoffStrategy backoffStrategy = BackoffStrategy.defaultStrategy();
    private @MonotonicNonNull Duration requestTimeout;
    private BooleanSupplier diagnostics = () -> false;
    private Sleeper sleeper = Sleeper.systemSleeper();

    Builder() {}

    /** Sets the content mode. The default is {@link ContentMode#JSON}. */
    @CanIgnoreReturnValue
    public Builder contentMode(ContentMode contentMode) {
      this.contentMode = requireNonNull(contentMode);
      return this;
    }

    /** Sends requests with the given {@code HttpClient}. */
    @CanIgnoreReturnValue
    public Builder httpClient(HttpClient httpClient) {
      return transport(Transport.of(httpClient));
    }

    /**
     * Sends requests with the given transport. The default is a transport over {@link
     * HttpClient#newHttpClient()}.
     */
    @CanIgnoreReturnValue
    public Builder transport(Transport transport) {
      this.transport = requireNonNull(transport);
      return this;
    }

    /**
     * Sets the codec bodies are encoded and decoded with. If unset, the first installed codec
     * supporting the content mode is used. In {@link ContentMode#RAW raw mode}, a structured codec
     * handles values that aren't strings or byte arrays.
     */
    @CanIgnoreReturnValue
    public Builder codec(ContentCodec codec) {
      this.codec = requireNonNull(codec);
      return this;
    }

    /**
     * Sets the base URI that {@link RequestSpec.Builder#relativeUrl(String) relative URLs} resolve
     * against.
     */
    @CanIgnoreReturnValue
    public Builder baseUri(String uri) {
      return baseUri(URI.create(uri));
    }

    /** Same as {@link #baseUri(String)}. */
    @CanIgnoreReturnValue
    public Builder baseUri(URI uri) {
      this.baseUri = requireNonNull(uri);
      return this;
    }

    /**
     * Sets a header sent with every request, replacing any value set before. Applied after the
     * content mode's defaults and before each request's own headers.
     */
    @CanIgnoreReturnValue
    public Builder defaultHeader(String name, String value) {
      defaultHeaders.set(name, value);
      return this;
    }

    /** Sets how many times a call is retried, unless it overrides it. The default is 5. */
    @CanIgnoreReturnValue
    public Builder maxRetries(int maxRetries) {
      this.maxRetries = requireNonNegativeRetries(maxRetries);
      return this;
    }

    /**
     * Sets a predicate for retrying status codes other than the always retried {@code 500} and
     * {@code 503}.
     */
    @CanIgnoreReturnValue
    public Builder retryPredicate(RetryPredicate retryPredicate) {
      this.retryPredicate = requireNonNull(retryPredicate);
      return this;
    }

    /**
     * Sets the backoff strategy. The default is {@link BackoffStrategy#defaultStrategy()}.
     */
    @CanIgnoreReturnValue
    public Builder backoff(BackoffStrategy backoffStrategy) {
      this.backoffStrategy = requireNonNull(backoffStrategy);
      return this;
    }

    /** Sets the default timeout the transport applies to each attempt. */
    @CanIgnoreReturnValue
    public Builder requestTimeout(Duration requestTimeout) {
      this.requestTimeout = requirePositiveDuration(requestTimeout);
      return this;
    }

    /** Turns diagnostic tracing of requests and responses on or off. */
    @CanIgnoreReturnValue
    public Builder diagnostics(boolean enabled) {
      return diagnostics(() -> enabled);
    }

    /**
     * Consults the given flag before tracing requests and responses. Tracing is purely
     * observational.
     */
    @CanIgnoreReturnValue
    public Builder diagnostics(BooleanSupplier flag) {
      this.diagnostics = requireNonNull(flag);
      return this;
    }

    /** Turns tracing on if the {@value #DIAGNOSTICS_PROPERTY} system property is {@code true}. */
    @CanIgnoreReturnValue
    public Builder diagnosticsFromSystemProperty() {
      return diagnostics(() -> Boolean.getBoolean(DIAGNOSTICS_PROPERTY));
    }

    @CanIgnoreReturnValue
    Builder sleeper(Sleeper sleeper) {
      this.sleeper = requireNonNull(sleeper);
      return this;
    }

    /**
     * Returns a new {@code Tether}.
     *
     * @throws IllegalStateException if no codec is set and none is installed for the content mode
     * @throws IllegalArgumentException if the set codec doesn't support the content mode
     */
    public Tether build() {
      return new Tether(this);
    }
  }

  @Override
  public String toString() {
    return "Tether[contentMode=" + contentMode + ", maxRetries=" + maxRetries + "]";
  }
}
