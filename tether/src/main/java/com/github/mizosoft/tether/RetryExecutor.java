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
import static java.util.Objects.requireNonNull;

import com.github.mizosoft.tether.ResponseClassifier.Classification;
import com.github.mizosoft.tether.internal.Utils;
import com.github.mizosoft.tether.internal.concurrent.Sleeper;
import java.io.IOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.net.http.HttpResponse;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Sends a {@link PreparedRequest} up to {@code 1 + maxRetries} times, backing off before each
 * retry, and returns the first attempt that is either not {@link Classification#RETRYABLE
 * retryable} or the last one allowed. The loop blocks the calling thread, including while backing
 * off.
 */
public final class RetryExecutor {
  private static final Logger logger = System.getLogger(RetryExecutor.class.getName());

  private final ResponseClassifier classifier;
  private final BackoffStrategy backoffStrategy;
  private final Sleeper sleeper;
  private final BooleanSupplier diagnostics;

  public RetryExecutor(ResponseClassifier classifier, BackoffStrategy backoffStrategy) {
    this(classifier, backoffStrategy, Sleeper.systemSleeper(), () -> false);
  }

  RetryExecutor(
      ResponseClassifier classifier,
      BackoffStrategy backoffStrategy,
      Sleeper sleeper,
      BooleanSupplier diagnostics) {
    this.classifier = requireNonNull(classifier);
    this.backoffStrategy = requireNonNull(backoffStrategy);
    this.sleeper = requireNonNull(sleeper);
    this.diagnostics = requireNonNull(diagnostics);
  }

  /**
   * Executes the given request with the given transport, returning the terminal attempt. Returns
   * an empty {@code Optional} without sending anything if either the request or the transport is
   * {@code null}.
   *
   * @throws InterruptedException if interrupted while sending or backing off
   */
  public Optional<Attempt> execute(
      @Nullable PreparedRequest request, @Nullable Transport transport, int maxRetries)
      throws InterruptedException {
    requireNonNegativeRetries(maxRetries);
    if (request == null || transport == null) {
      if (diagnostics.getAsBoolean()) {
        logger.log(
            Level.INFO,
            "Nothing to execute: request is {0}, transport is {1}",
            request != null ? "present" : "null",
            transport != null ? "present" : "null");
      }
      return Optional.empty();
    }

    for (int retry = 0; ; retry++) {
      if (retry > 0) {
        var delay = backoffStrategy.backoff(retry);
        logger.log(
            Level.INFO,
            "Starting retry {0} for {1} {2} after {3} ms",
            retry,
            request.method(),
            request.uri(),
            delay.toMillis());
        sleeper.sleep(delay);
      }

      var httpRequest = request.nextAttempt();
      HttpResponse<byte[]> response = null;
      IOException exception = null;
      try {
        response = transport.send(httpRequest);
      } catch (IOException e) {
        exception = e;
      }

      int statusCode = response != null ? response.statusCode() : ResponseClassifier.NO_STATUS;
      var attempt =
          new Attempt(
              httpRequest,
              response,
              exception,
              retry,
              classifier.classify(statusCode, exception));
      trace(attempt);
      if (attempt.classification() != Classification.RETRYABLE || retry >= maxRetries) {
        return Optional.of(attempt);
      }
    }
  }

  private void trace(Attempt attempt) {
    if (!diagnostics.getAsBoolean()) {
      return;
    }
    attempt
        .exception()
        .ifPresent(e -> logger.log(Level.INFO, "Transport error: " + e.getMessage(), e));
    attempt
        .response()
        .ifPresent(
            response -> {
              logger.log(Level.INFO, "StatusCode: {0}", response.statusCode());
              logger.log(Level.INFO, "ResponseBody: {0}", Utils.utf8(attempt.body()));
            });
  }
}
