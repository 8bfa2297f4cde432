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

import static com.github.mizosoft.tether.internal.Utils.requireNonNegativeDuration;
import static com.github.mizosoft.tether.internal.Utils.requirePositiveDuration;
import static com.github.mizosoft.tether.internal.Validate.requireArgument;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/** A strategy for backing off (delaying) before a retry. */
@FunctionalInterface
public interface BackoffStrategy {

  /**
   * Returns the {@link Duration} to wait for before the given retry, where the first retry
   * (second attempt) has number {@code 1}.
   */
  Duration backoff(int retryNumber);

  /**
   * Returns a {@code BackoffStrategy} that adds a uniformly random delay in {@code [0, maxJitter)}
   * to this strategy's delays, so that clients retrying against the same server spread out.
   */
  default BackoffStrategy withJitter(Duration maxJitter) {
    requireNonNegativeDuration(maxJitter);
    long maxJitterMillis = maxJitter.toMillis();
    return retryNumber -> {
      var delay = backoff(retryNumber);
      return maxJitterMillis > 0
          ? delay.plusMillis(ThreadLocalRandom.current().nextLong(maxJitterMillis))
          : delay;
    };
  }

  /** Returns a {@code BackoffStrategy} that applies no delays. */
  static BackoffStrategy none() {
    return __ -> Duration.ZERO;
  }

  /** Returns a {@code BackoffStrategy} that applies a fixed delay every retry. */
  static BackoffStrategy fixed(Duration delay) {
    requirePositiveDuration(delay);
    return __ -> delay;
  }

  /**
   * Returns a {@code BackoffStrategy} that doubles the delay every retry, starting from {@code
   * base} for the first retry.
   */
  static BackoffStrategy exponential(Duration base) {
    requirePositiveDuration(base);
    return retryNumber -> {
      requireArgument(retryNumber > 0, "non-positive retry number: %d", retryNumber);
      // Cap the exponent so the multiplication can't overflow.
      return base.multipliedBy(1L << Math.min(retryNumber - 1, 30));
    };
  }

  /**
   * Returns the default {@code BackoffStrategy}: {@code 2^(n-1)} seconds before retry {@code n},
   * plus up to one second of random jitter.
   */
  static BackoffStrategy defaultStrategy() {
    return exponential(Duration.ofSeconds(1)).withJitter(Duration.ofSeconds(1));
  }
}
