package io.aitk.hubingest.fetch;


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

import io.aitk.hubingest.config.HubImportConfig;
import io.aitk.ingest.api.FetchAttempt;
import io.aitk.ingest.api.FetchResult;
import io.aitk.ingest.api.RemoteReference;
import io.aitk.ingest.api.RepoKind;
import io.aitk.ingest.api.errors.RemoteFetchException;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.client5.http.protocol.HttpClientContext;
import org.apache.hc.client5.http.protocol.RedirectLocations;
import org.apache.hc.core5.http.ClassicHttpResponse;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.util.Timeout;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/// Downloads files from the hub, working around namespace and credential ambiguity.
///
/// For each namespace a reference may live in, the canonical resolve URL is tried, then the
/// same URL with `download=true`. With a token each URL is requested with it first and, on
/// any non-2xx answer, once more without it, since a stale token can hide a public file.
/// The first 2xx answer wins. Attempts are strictly sequential, without backoff.
///
/// Content decompression is turned off in the client so callers see the body and the
/// `Content-Encoding` exactly as served.
public class HubFileFetcher implements AutoCloseable {
  private static final Logger logger = LogManager.getLogger(HubFileFetcher.class);

  /// the hub's header for human readable error details
  public static final String ERROR_MESSAGE_HEADER = "X-Error-Message";

  private final HubImportConfig config;
  private final CloseableHttpClient client;

  public HubFileFetcher(HubImportConfig config) {
    this.config = config;
    this.client = HttpClients.custom()
        .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
            .setDefaultConnectionConfig(ConnectionConfig.custom()
                .setConnectTimeout(Timeout.of(config.connectTimeout()))
                .build())
            .build())
        .setDefaultRequestConfig(RequestConfig.custom()
            .setResponseTimeout(Timeout.of(config.responseTimeout()))
            .setRedirectsEnabled(true)
            .build())
        .setUserAgent(config.userAgent())
        .disableContentCompression()
        .build();
  }

  /// Fetch a file, trying every candidate URL until one answers 2xx.
  /// @param reference the file, possibly of kind [RepoKind#AUTO]
  /// @param rawToken the access token as configured, possibly null or blank
  /// @return the first successful response
  /// @throws RemoteFetchException listing every attempt when none succeeded
  public FetchResult fetch(RemoteReference reference, String rawToken) {
    Optional<String> token = HubTokens.sanitize(rawToken);
    List<FetchAttempt> attempts = new ArrayList<>();
    for (RepoKind kind : reference.repoKind().candidates()) {
      for (String url : HubUrls.candidates(config.host(), reference, kind)) {
        if (token.isPresent()) {
          Optional<FetchResult> authenticated = attempt(kind, url, token.get(), attempts);
          if (authenticated.isPresent()) {
            return authenticated.get();
          }
          FetchAttempt failed = attempts.get(attempts.size() - 1);
          logger.warn("authenticated request to {} failed with status {}, retrying without a token",
              url, failed.httpStatus());
        }
        Optional<FetchResult> anonymous = attempt(kind, url, null, attempts);
        if (anonymous.isPresent()) {
          if (token.isPresent()) {
            logger.warn("{} was only reachable without the configured token, check that it is still valid", url);
          }
          return anonymous.get();
        }
      }
    }
    throw new RemoteFetchException(failureMessage(reference, token.isPresent()), attempts);
  }

  /// Fetch a single URL once, with the token if one is given.
  /// @param url the absolute URL
  /// @param rawToken the access token as configured, possibly null or blank
  /// @return the response
  /// @throws RemoteFetchException carrying the single attempt when it did not answer 2xx
  public FetchResult fetchUrl(String url, String rawToken) {
    List<FetchAttempt> attempts = new ArrayList<>();
    Optional<FetchResult> result = attempt(RepoKind.AUTO, url, HubTokens.sanitize(rawToken).orElse(null), attempts);
    return result.orElseThrow(() -> new RemoteFetchException("Request to " + url + " failed.", attempts));
  }

  private Optional<FetchResult> attempt(RepoKind kind, String url, String token, List<FetchAttempt> attempts) {
    HttpGet get = new HttpGet(url);
    get.setHeader(HttpHeaders.ACCEPT, "*/*");
    if (token != null) {
      get.setHeader(HttpHeaders.AUTHORIZATION, "Bearer " + token);
    }
    HttpClientContext context = HttpClientContext.create();
    logger.debug("GET {} ({})", url, token != null ? "token " + HubTokens.redact(token) : "no token");
    try {
      return client.execute(get, context, response -> {
        int status = response.getCode();
        HttpEntity entity = response.getEntity();
        if (status >= 200 && status < 300) {
          byte[] data = entity == null ? new byte[0] : EntityUtils.toByteArray(entity);
          String finalUrl = finalUrl(context, url);
          logger.debug("{} -> {} ({} bytes from {})", url, status, data.length, finalUrl);
          return Optional.of(new FetchResult(data, status, url, finalUrl,
              header(response, HttpHeaders.CONTENT_TYPE), header(response, HttpHeaders.CONTENT_ENCODING),
              kind == RepoKind.AUTO ? null : kind));
        }
        FetchAttempt failed = new FetchAttempt(kind, url, token != null, status, response.getReasonPhrase(),
            nullToEmpty(header(response, ERROR_MESSAGE_HEADER)), preview(entity));
        logger.debug("{} -> {}", url, failed.describe());
        attempts.add(failed);
        return Optional.empty();
      });
    } catch (IOException e) {
      String reason = e.getClass().getSimpleName() + (e.getMessage() == null ? "" : ": " + e.getMessage());
      FetchAttempt failed = new FetchAttempt(kind, url, token != null, FetchAttempt.NO_RESPONSE, reason, "", "");
      logger.debug("{} -> {}", url, failed.describe());
      attempts.add(failed);
      return Optional.empty();
    }
  }

  private String preview(HttpEntity entity) throws IOException {
    if (entity == null || config.previewLength() == 0) {
      return "";
    }
    try (InputStream in = entity.getContent()) {
      if (in == null) {
        return "";
      }
      byte[] head = in.readNBytes(config.previewLength() * 4);
      String text = new String(head, StandardCharsets.UTF_8);
      return text.length() > config.previewLength() ? text.substring(0, config.previewLength()) : text;
    }
  }

  private static String finalUrl(HttpClientContext context, String requested) {
    RedirectLocations redirects = context.getRedirectLocations();
    if (redirects == null || redirects.size() == 0) {
      return requested;
    }
    List<URI> all = redirects.getAll();
    return all.get(all.size() - 1).toString();
  }

  private static String header(ClassicHttpResponse response, String name) {
    Header header = response.getFirstHeader(name);
    return header == null ? null : header.getValue();
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }

  private static String failureMessage(RemoteReference reference, boolean hadToken) {
    String base = "Failed to download '" + reference.filePath() + "' from " + reference.repoId()
                  + "@" + reference.revision() + ".";
    if (hadToken) {
      return base + " If the repository is private or gated, check that the configured token has access to it.";
    }
    return base + " If the repository is private or gated, configure a hub token "
           + "(HF_TOKEN or ~/.cache/huggingface/token).";
  }

  @Override
  public void close() throws IOException {
    client.close();
  }
}
