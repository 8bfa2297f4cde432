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

import java.net.SocketTimeoutException;
import java.net.http.HttpConnectTimeoutException;
import javax.net.ssl.SSLHandshakeException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Maps the outcome of a send attempt, its status code and transport error, to a {@link
 * Classification}.
 *
 * <ul>
 *   <li>No error and a {@code 2xx} status is a {@link Classification#SUCCESS success}.
 *   <li>A status the {@link RetryPredicate} accepts ({@code 500} and {@code 503} by default) is
 *       {@link Classification#RETRYABLE retryable}, whatever the error.
 *   <li>A connect or TLS handshake timeout is retryable even though no status was obtained.
 *   <li>Anything else is a {@link Classification#TERMINAL terminal} failure.
 * </ul>
 *
 * <p>Client errors ({@code 4xx}) are deterministic and aren't retried unless the predicate says so.
 */
public final class ResponseClassifier {
  /** The status code of an attempt that obtained no response. */
  public static final int NO_STATUS = 0;

  private final RetryPredicate retryPredicate;

  public ResponseClassifier(RetryPredicate retryPredicate) {
    this.retryPredicate = requireNonNull(retryPredicate);
  }

  /** Returns a classifier that only retries {@code 500} and {@code 503}. */
  public static ResponseClassifier defaultClassifier() {
    return new ResponseClassifier(RetryPredicate.serverErrors());
  }

  public Classification classify(int statusCode, @Nullable Throwable error) {
    if (statusCode != NO_STATUS && retryPredicate.shouldRetry(statusCode)) {
      return Classification.RETRYABLE;
    }
    if (error != null) {
      return isTransient(error) ? Classification.RETRYABLE : Classification.TERMINAL;
    }
    return isSuccessful(statusCode) ? Classification.SUCCESS : Classification.TERMINAL;
  }

  /**
   * Returns {@code true} if the given transport error is a timeout while establishing the
   * connection, either at the TCP or the TLS level.
   */
  public static boolean isTransient(Throwable error) {
    if (error instanceof HttpConnectTimeoutException) {
      return true;
    }
    if (error instanceof SSLHandshakeException) {
      for (var cause = error.getCause(); cause != null; cause = cause.getCause()) {
        if (cause instanceof SocketTimeoutException) {
          return true;
        }
      }
    }
    return false;
  }

  public static boolean isSuccessful(int statusCode) {
    return statusCode >= 200 && statusCode <= 299;
  }

  /** Returns the message describing a response whose status isn't successful. */
  public static String statusMessage(int statusCode) {
    return "Server returned statuscode " + statusCode;
  }

  /** What to do with the outcome of an attempt. */
  public enum Classification {
    /** A successful response. */
    SUCCESS,

    /** A transient failure that may go away if the request is sent again. */
    RETRYABLE,

    /** A failure that sending the request again won't fix. */
    TERMINAL
  }
}
