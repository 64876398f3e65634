package io.aitk.ingest.api;

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

/// One failed request made while resolving a hub file.
///
/// @param kind the namespace the URL was built for
/// @param url the requested URL
/// @param authenticated whether an `Authorization` header was sent
/// @param httpStatus the response status, or `-1` when no response was received
/// @param reasonPhrase the status reason phrase, or the transport error message
/// @param hostErrorMessage the hub's `X-Error-Message` header, or empty
/// @param bodyPreview the first characters of the response body, or empty
public record FetchAttempt(
    RepoKind kind,
    String url,
    boolean authenticated,
    int httpStatus,
    String reasonPhrase,
    String hostErrorMessage,
    String bodyPreview)
{
  /// status used when the request failed before a response arrived
  public static final int NO_RESPONSE = -1;

  /// @return a single line description, as listed in fetch failure messages
  public String describe() {
    StringBuilder sb = new StringBuilder();
    sb.append("- ").append(kind.label()).append(authenticated ? " (auth)" : " (no auth)")
        .append(": ").append(url).append(" -> ");
    if (httpStatus == NO_RESPONSE) {
      sb.append("no response");
    } else {
      sb.append(httpStatus);
    }
    if (reasonPhrase != null && !reasonPhrase.isEmpty()) {
      sb.append(' ').append(reasonPhrase);
    }
    String extra = extraDetail();
    if (!extra.isEmpty()) {
      sb.append(" (").append(extra).append(')');
    }
    return sb.toString();
  }

  private String extraDetail() {
    StringBuilder sb = new StringBuilder();
    if (hostErrorMessage != null && !hostErrorMessage.isEmpty()) {
      sb.append("x-error-message: ").append(hostErrorMessage);
    }
    if (bodyPreview != null && !bodyPreview.isEmpty()) {
      if (sb.length() > 0) {
        sb.append(" | ");
      }
      sb.append(bodyPreview.replaceAll("\\s+", " ").trim());
    }
    return sb.toString();
  }
}
