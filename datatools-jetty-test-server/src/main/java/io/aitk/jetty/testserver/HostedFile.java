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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.zip.GZIPOutputStream;

/**
 * One file served by a {@link HubServerFixture}, with the response behavior the hub shows
 * for it. Every setter returns this file so a test can configure it in one expression:
 * <pre>{@code
 * hub.hostDataset("acme/private", "main", "train.parquet", bytes)
 *     .requireToken("hf_secret")
 *     .gzipEncoded();
 * }</pre>
 */
public class HostedFile {

    private final byte[] content;
    private String contentType = "application/octet-stream";
    private boolean gzipBody;
    private boolean declareGzipEncoding;
    private String requiredToken;
    private boolean rejectTokens;
    private int failureStatus;
    private String failureMessage;
    private boolean redirectThroughCdn;
    private boolean requireDownloadFlag;

    HostedFile(byte[] content) {
        this.content = content.clone();
    }

    public HostedFile contentType(String contentType) {
        this.contentType = contentType;
        return this;
    }

    /**
     * Serve the content gzip compressed with {@code Content-Encoding: gzip}.
     */
    public HostedFile gzipEncoded() {
        this.gzipBody = true;
        this.declareGzipEncoding = true;
        return this;
    }

    /**
     * Serve the content gzip compressed with only {@code Content-Type: application/gzip}
     * to say so, the way some mirrors label compressed blobs.
     */
    public HostedFile gzipContentType() {
        this.gzipBody = true;
        this.contentType = "application/gzip";
        return this;
    }

    /**
     * Serve the content gzip compressed without any header saying so.
     */
    public HostedFile gzipUndeclared() {
        this.gzipBody = true;
        return this;
    }

    /**
     * Answer 401 unless the request carries {@code Authorization: Bearer <token>}.
     */
    public HostedFile requireToken(String token) {
        this.requiredToken = token;
        return this;
    }

    /**
     * Answer 401 to any request that carries an Authorization header, as the hub does for a
     * revoked token even on public repos.
     */
    public HostedFile rejectTokens() {
        this.rejectTokens = true;
        return this;
    }

    /**
     * Always answer with the given status, an {@code X-Error-Message} header and the message
     * as the body.
     */
    public HostedFile failWith(int status, String message) {
        this.failureStatus = status;
        this.failureMessage = message;
        return this;
    }

    /**
     * Answer with a 302 to a CDN path on the same server, which then serves the content.
     */
    public HostedFile redirectThroughCdn() {
        this.redirectThroughCdn = true;
        return this;
    }

    /**
     * Answer 404 unless the query carries {@code download=true}.
     */
    public HostedFile requireDownloadFlag() {
        this.requireDownloadFlag = true;
        return this;
    }

    String getContentType() {
        return contentType;
    }

    boolean isDeclareGzipEncoding() {
        return declareGzipEncoding;
    }

    String getRequiredToken() {
        return requiredToken;
    }

    boolean isRejectTokens() {
        return rejectTokens;
    }

    int getFailureStatus() {
        return failureStatus;
    }

    String getFailureMessage() {
        return failureMessage;
    }

    boolean isRedirectThroughCdn() {
        return redirectThroughCdn;
    }

    boolean isRequireDownloadFlag() {
        return requireDownloadFlag;
    }

    /**
     * @return the bytes put on the wire, compressed when a gzip option is set
     */
    byte[] body() {
        if (!gzipBody) {
            return content.clone();
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
            gzip.write(content);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }
}
