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

package com.github.mizosoft.tether.internal.spi;

import com.github.mizosoft.tether.ContentCodec;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import org.checkerframework.checker.nullness.qual.MonotonicNonNull;

/**
 * Loads {@link ContentCodec} service providers on first use. Providers that fail to instantiate
 * are logged and skipped.
 */
public final class ContentCodecProviders {
  private static final Logger logger = System.getLogger(ContentCodecProviders.class.getName());

  private static final Object lock = new Object();

  private static volatile @MonotonicNonNull List<ContentCodec> providers;

  private ContentCodecProviders() {}

  public static List<ContentCodec> get() {
    var result = providers;
    if (result == null) {
      synchronized (lock) {
        result = providers;
        if (result == null) {
          result = load();
          providers = result;
        }
      }
    }
    return result;
  }

  private static List<ContentCodec> load() {
    var codecs = new ArrayList<ContentCodec>();
    ServiceLoader.load(ContentCodec.class, ContentCodec.class.getClassLoader()).stream()
        .forEach(
            provider -> {
              try {
                codecs.add(provider.get());
              } catch (ServiceConfigurationError error) {
                logger.log(
                    Level.WARNING,
                    "codec <" + provider.type() + "> ignored as it couldn't be instantiated",
                    error);
              }
            });
    if (codecs.isEmpty()) {
      logger.log(Level.DEBUG, "no ContentCodec providers found");
    }
    return Collections.unmodifiableList(codecs);
  }
}
