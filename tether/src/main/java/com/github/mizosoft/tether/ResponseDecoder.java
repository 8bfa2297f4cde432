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

import com.github.mizosoft.tether.internal.Utils;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Turns a terminal {@link Attempt} into either an {@link ApiResponse} carrying the decoded response
 * model, or the {@link CallException} describing the failure.
 */
final class ResponseDecoder {
  private static final Logger logger = System.getLogger(ResponseDecoder.class.getName());

  static final String RESPONSE_MESSAGE_EXTRA = "response_message";

  private final ContentCodec codec;

  ResponseDecoder(ContentCodec codec) {
    this.codec = requireNonNull(codec);
  }

  /**
   * Decodes a successful attempt's body into the given type, if any.
   *
   * @throws DecodeException if the body can't be decoded
   */
  <T> ApiResponse<T> decodeSuccess(
      Attempt attempt, @Nullable TypeRef<T> responseType, ErrorContext context)
      throws DecodeException {
    var response =
        attempt
            .response()
            .orElseThrow(() -> new IllegalArgumentException("successful attempt without response"));
    T body = null;
    if (responseType != null) {
      var bytes = attempt.body();
      try {
        body = codec.decode(bytes, responseType);
      } catch (CodecException e) {
        context.setResponse(response).setMessage(e);
        throw new DecodeException(context, Utils.utf8(bytes), e);
      }
    }
    return new ApiResponse<>(attempt.request(), response, body, attempt.retryCount());
  }

  /**
   * Returns the exception describing a failed attempt. If the attempt obtained a response and an
   * error type is given, the body is decoded into an error model; if that fails the raw body text
   * is kept in the {@code response_message} extra instead.
   */
  CallException decodeFailure(
      Attempt attempt, @Nullable Class<?> errorType, ErrorContext context) {
    var exception = attempt.exception().orElse(null);
    var response = attempt.response().orElse(null);
    if (response == null) {
      context.setMessage(requireNonNull(exception));
      return new TransportException(context, exception);
    }

    context.setResponse(response);
    if (exception != null) {
      context.setMessage(exception);
    } else {
      context.setMessage(ResponseClassifier.statusMessage(response.statusCode()));
    }

    var bytes = attempt.body();
    Object errorModel = null;
    if (errorType != null) {
      try {
        errorModel = codec.decode(bytes, TypeRef.of(errorType));
      } catch (CodecException e) {
        logger.log(
            Level.DEBUG, "couldn't decode error body into " + errorType.getName(), e);
        context.setExtra(RESPONSE_MESSAGE_EXTRA, Utils.utf8(bytes));
      }
    }
    return new StatusException(context, response.statusCode(), bytes, errorModel);
  }
}
