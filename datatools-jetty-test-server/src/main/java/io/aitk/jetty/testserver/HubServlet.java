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

import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Answers hub resolve URLs from the files registered with a {@link HubServerFixture}.
 */
class HubServlet extends HttpServlet {
    private static final Logger logger = LogManager.getLogger(HubServlet.class);

    static final String CDN_PREFIX = "/cdn/";

    private final Map<String, HostedFile> files;
    private final List<HostedFile> cdn;
    private final List<RecordedRequest> requests;

    HubServlet(Map<String, HostedFile> files, List<HostedFile> cdn, List<RecordedRequest> requests) {
        this.files = files;
        this.cdn = cdn;
        this.requests = requests;
    }

    @Override
    protected void doGet(HttpServletRequest request, HttpServletResponse response) throws IOException {
        String path = request.getPathInfo() == null ? request.getServletPath() : request.getPathInfo();
        String authorization = request.getHeader("Authorization");
        requests.add(new RecordedRequest(request.getMethod(), path, request.getQueryString(), authorization,
            request.getHeader("User-Agent")));
        logger.debug("GET {} query={} auth={}", path, request.getQueryString(), authorization != null);

        if (path.startsWith(CDN_PREFIX)) {
            serveCdn(path.substring(CDN_PREFIX.length()), response);
            return;
        }

        HostedFile file = files.get(path);
        if (file == null || (file.isRequireDownloadFlag() && !"true".equals(request.getParameter("download")))) {
            error(response, HttpServletResponse.SC_NOT_FOUND, "Entry not found");
            return;
        }
        if (file.isRejectTokens() && authorization != null) {
            error(response, HttpServletResponse.SC_UNAUTHORIZED, "Invalid credentials in Authorization header");
            return;
        }
        if (file.getRequiredToken() != null && !("Bearer " + file.getRequiredToken()).equals(authorization)) {
            error(response, HttpServletResponse.SC_UNAUTHORIZED,
                "Access to this repository is restricted. You must be authenticated to access it.");
            return;
        }
        if (file.getFailureStatus() > 0) {
            error(response, file.getFailureStatus(), file.getFailureMessage());
            return;
        }
        if (file.isRedirectThroughCdn()) {
            int id;
            synchronized (cdn) {
                cdn.add(file);
                id = cdn.size() - 1;
            }
            response.setStatus(HttpServletResponse.SC_FOUND);
            response.setHeader("Location", CDN_PREFIX + id);
            return;
        }
        serve(file, response);
    }

    private void serveCdn(String id, HttpServletResponse response) throws IOException {
        HostedFile file;
        try {
            synchronized (cdn) {
                file = cdn.get(Integer.parseInt(id));
            }
        } catch (NumberFormatException | IndexOutOfBoundsException e) {
            error(response, HttpServletResponse.SC_NOT_FOUND, "Unknown blob " + id);
            return;
        }
        serve(file, response);
    }

    private void serve(HostedFile file, HttpServletResponse response) throws IOException {
        byte[] body = file.body();
        response.setStatus(HttpServletResponse.SC_OK);
        response.setContentType(file.getContentType());
        if (file.isDeclareGzipEncoding()) {
            response.setHeader("Content-Encoding", "gzip");
        }
        response.setContentLength(body.length);
        response.getOutputStream().write(body);
    }

    private void error(HttpServletResponse response, int status, String message) throws IOException {
        byte[] body = message.getBytes(StandardCharsets.UTF_8);
        response.setStatus(status);
        response.setHeader("X-Error-Message", message);
        response.setContentType("text/plain");
        response.setContentLength(body.length);
        response.getOutputStream().write(body);
    }
}
