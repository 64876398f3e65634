package io.aitk.jetty.testserver;


/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.api.extension.ParameterContext;
import org.junit.jupiter.api.extension.ParameterResolutionException;
import org.junit.jupiter.api.extension.ParameterResolver;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * JUnit 5 extension that gives each test method its own {@link HubServerFixture}.
 * <p>
 * Declare a {@code HubServerFixture} parameter on the test method. The server is already
 * started when the test runs, so files registered inside the test are served immediately,
 * and it is stopped after the test.
 * <pre>{@code
 * @ExtendWith(HubServerExtension.class)
 * class FetchTest {
 *     @Test
 *     void fetches(HubServerFixture hub) { ... }
 * }
 * }</pre>
 */
public class HubServerExtension implements ParameterResolver, AfterEachCallback {

    private static final ExtensionContext.Namespace NAMESPACE =
        ExtensionContext.Namespace.create(HubServerExtension.class);
    private static final String KEY = "hub";

    @Override
    public boolean supportsParameter(ParameterContext parameterContext, ExtensionContext extensionContext) {
        return parameterContext.getParameter().getType() == HubServerFixture.class;
    }

    @Override
    public Object resolveParameter(ParameterContext parameterContext, ExtensionContext extensionContext) {
        ExtensionContext.Store store = extensionContext.getStore(NAMESPACE);
        HubServerFixture existing = store.get(KEY, HubServerFixture.class);
        if (existing != null) {
            return existing;
        }
        HubServerFixture hub = new HubServerFixture();
        try {
            hub.start();
        } catch (IOException e) {
            throw new ParameterResolutionException("Hub test server did not start", new UncheckedIOException(e));
        }
        store.put(KEY, hub);
        return hub;
    }

    @Override
    public void afterEach(ExtensionContext context) {
        HubServerFixture hub = context.getStore(NAMESPACE).remove(KEY, HubServerFixture.class);
        if (hub != null) {
            hub.close();
        }
    }
}
