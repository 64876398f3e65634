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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;

import java.io.IOException;
import java.net.ServerSocket;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A test fixture that starts a Jetty web server answering the hub's file resolve URLs.
 * <p>
 * Files are registered in memory per repository and revision. Dataset repositories answer
 * under {@code /datasets/{org}/{name}/resolve/{revision}/{path}} and model repositories under
 * {@code /{org}/{name}/resolve/{revision}/{path}}. Anything else answers 404 with an
 * {@code X-Error-Message} header, as the hub does. Every request is recorded so tests can
 * check which URLs were tried and with which credentials.
 * <p>
 * Example usage:
 * <pre>{@code
 * try (HubServerFixture hub = new HubServerFixture()) {
 *     hub.hostDataset("acme/cats", "main", "data/train.parquet", bytes);
 *     hub.start();
 *     String host = hub.getHost();
 * }
 * }</pre>
 */
public class HubServerFixture implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(HubServerFixture.class);

    private final Map<String, HostedFile> files = new ConcurrentHashMap<>();
    private final List<HostedFile> cdn = new ArrayList<>();
    private final List<RecordedRequest> requests = new CopyOnWriteArrayList<>();
    private Server server;
    private int port;

    /**
     * Serve a file from a dataset repository.
     *
     * @param repoId the {@code org/name} repository id
     * @param revision the branch, tag or commit
     * @param path the file path inside the repository
     * @param content the file contents
     * @return the hosted file, for further configuration
     */
    public HostedFile hostDataset(String repoId, String revision, String path, byte[] content) {
        return host("/datasets/" + repoId + "/resolve/" + revision + "/" + path, content);
    }

    /**
     * Serve a file from a model repository.
     *
     * @param repoId the {@code org/name} repository id
     * @param revision the branch, tag or commit
     * @param path the file path inside the repository
     * @param content the file contents
     * @return the hosted file, for further configuration
     */
    public HostedFile hostModel(String repoId, String revision, String path, byte[] content) {
        return host("/" + repoId + "/resolve/" + revision + "/" + path, content);
    }

    /**
     * Serve a file at an arbitrary decoded path.
     *
     * @param route the path, starting with a slash
     * @param content the file contents
     * @return the hosted file, for further configuration
     */
    public HostedFile host(String route, byte[] content) {
        HostedFile file = new HostedFile(content);
        files.put(route, file);
        return file;
    }

    /**
     * Starts the web server on a random available port.
     *
     * @throws IOException If the server cannot be started
     */
    public void start() throws IOException {
        this.port = findAvailablePort();

        server = new Server();
        ServerConnector connector = new ServerConnector(server);
        connector.setHost("127.0.0.1");
        connector.setPort(port);
        server.addConnector(connector);

        ServletContextHandler context = new ServletContextHandler(ServletContextHandler.NO_SESSIONS);
        context.setContextPath("/");
        context.addServlet(new ServletHolder("hub", new HubServlet(files, cdn, requests)), "/*");
        server.setHandler(context);

        try {
            server.start();
            logger.info("Hub test server started on port {} with {} files", port, files.size());
        } catch (Exception e) {
            throw new IOException("Failed to start Jetty server", e);
        }
    }

    /**
     * @return the server origin without a trailing slash, usable as a hub host setting
     */
    public String getHost() {
        return "http://127.0.0.1:" + port;
    }

    /**
     * @return every request answered so far, in arrival order
     */
    public List<RecordedRequest> getRequests() {
        return List.copyOf(requests);
    }

    @Override
    public void close() {
        if (server != null) {
            try {
                server.stop();
                logger.info("Hub test server stopped");
            } catch (Exception e) {
                logger.error("Error stopping Jetty server", e);
            }
        }
    }

    private int findAvailablePort() {
        try (ServerSocket socket = new ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        } catch (IOException e) {
            throw new RuntimeException("Failed to find available port", e);
        }
    }
}
