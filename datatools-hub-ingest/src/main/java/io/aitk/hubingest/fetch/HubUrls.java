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

import io.aitk.ingest.api.RemoteReference;
import io.aitk.ingest.api.RepoKind;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;

/// Builds hub resolve URLs.
public final class HubUrls {

  private HubUrls() {
  }

  /// The canonical resolve URL of a file.
  /// @param host the hub origin without a trailing slash
  /// @param reference the file
  /// @param kind a concrete namespace, never [RepoKind#AUTO]
  /// @return `{host}/datasets/{repo}/resolve/{revision}/{path}` or `{host}/{repo}/resolve/{revision}/{path}`
  public static String resolveUrl(String host, RemoteReference reference, RepoKind kind) {
    if (kind == RepoKind.AUTO) {
      throw new IllegalArgumentException("a concrete repo kind is required to build a URL");
    }
    StringBuilder sb = new StringBuilder(host);
    if (kind == RepoKind.DATASETS) {
      sb.append("/datasets");
    }
    sb.append('/').append(reference.repoId())
        .append("/resolve/").append(encodeSegment(reference.revision()))
        .append('/').append(encodePath(reference.filePath()));
    return sb.toString();
  }

  /// The URLs to try for a file in one namespace, in order.
  /// @param host the hub origin without a trailing slash
  /// @param reference the file
  /// @param kind a concrete namespace
  /// @return the canonical URL, then the same URL asking for a download
  public static List<String> candidates(String host, RemoteReference reference, RepoKind kind) {
    String canonical = resolveUrl(host, reference, kind);
    return List.of(canonical, withDownloadFlag(canonical));
  }

  static String withDownloadFlag(String url) {
    return url + (url.indexOf('?') >= 0 ? "&" : "?") + "download=true";
  }

  /// Percent-encode each segment of a slash separated path.
  static String encodePath(String path) {
    String[] segments = path.split("/", -1);
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < segments.length; i++) {
      if (i > 0) {
        sb.append('/');
      }
      sb.append(encodeSegment(segments[i]));
    }
    return sb.toString();
  }

  /// Percent-encode a single path segment, slashes included.
  static String encodeSegment(String segment) {
    return URLEncoder.encode(segment, StandardCharsets.UTF_8)
        .replace("+", "%20")
        .replace("%7E", "~")
        .replace("*", "%2A");
  }
}
