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

package com.github.mizosoft.tether.tests;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.api.extension.ExtensionContext.Namespace;
import org.junit.jupiter.api.extension.ParameterContext;
import org.junit.jupiter.api.extension.ParameterResolutionException;
import org.junit.jupiter.api.extension.ParameterResolver;

/** Provides started {@code MockWebServers} to tests and shuts them down after each test. */
public final class MockWebServerExtension implements AfterEachCallback, ParameterResolver {
  private static final Namespace EXTENSION_NAMESPACE =
      Namespace.create(MockWebServerExtension.class);

  public MockWebServerExtension() {}

  @Override
  public void afterEach(ExtensionContext context) throws Exception {
    var servers =
        context.getStore(EXTENSION_NAMESPACE).remove(ManagedServers.class, ManagedServers.class);
    if (servers != null) {
      servers.shutdownAll();
    }
  }

  @Override
  public boolean supportsParameter(
      ParameterContext parameterContext, ExtensionContext extensionContext)
      throws ParameterResolutionException {
    return parameterContext.getParameter().getType() == MockWebServer.class;
  }

  @Override
  public Object resolveParameter(
      ParameterContext parameterContext, ExtensionContext extensionContext)
      throws ParameterResolutionException {
    var servers =
        extensionContext
            .getStore(EXTENSION_NAMESPACE)
            .getOrComputeIfAbsent(
                ManagedServers.class, __ -> new ManagedServers(), ManagedServers.class);
    try {
      return servers.newServer();
    } catch (IOException e) {
      throw new ParameterResolutionException("couldn't start server", e);
    }
  }

  private static final class ManagedServers {
    private final List<MockWebServer> servers = new ArrayList<>();

    ManagedServers() {}

    MockWebServer newServer() throws IOException {
      var server = new MockWebServer();
      server.start();
      servers.add(server);
      return server;
    }

    void shutdownAll() throws IOException {
      for (var server : servers) {
        server.shutdown();
      }
      servers.clear();
    }
  }
}
