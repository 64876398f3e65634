package io.aitk.ingest.api.errors;

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

import java.util.List;

/// Thrown when a download completed but the body is not a parquet file.
public class InvalidContentException extends HubImportException {

  /// Known shapes of a wrong body.
  public enum Hint {
    /// a Git-LFS pointer record was served instead of the stored object
    LFS_POINTER("The downloaded file looks like a Git-LFS pointer (not the actual parquet)."),
    /// an HTML page was served, usually a login or not-found page
    HTML_DOCUMENT("The downloaded file looks like HTML (likely a login/404 page)."),
    /// the server declared an HTML content type
    HTML_CONTENT_TYPE("The server declared an HTML content type.");

    private final String description;

    Hint(String description) {
      this.description = description;
    }

    public String description() {
      return description;
    }
  }

  private final String requestedUrl;
  private final String finalUrl;
  private final String contentType;
  private final List<Hint> hints;
  private final String preview;

  /// @param requestedUrl the URL that was requested
  /// @param finalUrl the URL the body came from, after redirects
  /// @param contentType the declared content type, or null
  /// @param hints the detected body shapes, possibly empty
  /// @param preview the start of the body decoded as UTF-8
  public InvalidContentException(
      String requestedUrl,
      String finalUrl,
      String contentType,
      List<Hint> hints,
      String preview)
  {
    super(formatMessage(requestedUrl, finalUrl, contentType, hints, preview));
    this.requestedUrl = requestedUrl;
    this.finalUrl = finalUrl;
    this.contentType = contentType;
    this.hints = List.copyOf(hints);
    this.preview = preview;
  }

  public String getRequestedUrl() {
    return requestedUrl;
  }

  public String getFinalUrl() {
    return finalUrl;
  }

  public String getContentType() {
    return contentType;
  }

  /// @return the detected body shapes, in detection order
  public List<Hint> getHints() {
    return hints;
  }

  public String getPreview() {
    return preview;
  }

  private static String formatMessage(
      String requestedUrl,
      String finalUrl,
      String contentType,
      List<Hint> hints,
      String preview)
  {
    StringBuilder sb = new StringBuilder("Invalid parquet file received from the hub.\n");
    sb.append("Requested: ").append(requestedUrl).append('\n');
    sb.append("Final URL: ").append(finalUrl).append('\n');
    sb.append("content-type: ").append(contentType == null ? "unknown" : contentType).append('\n');
    if (!hints.isEmpty()) {
      sb.append("Hint:");
      for (Hint hint : hints) {
        sb.append(' ').append(hint == Hint.HTML_CONTENT_TYPE ? "content-type=" + contentType : hint.description());
      }
      sb.append('\n');
    }
    sb.append("First bytes preview: ").append(quote(preview));
    return sb.toString();
  }

  private static String quote(String text) {
    StringBuilder sb = new StringBuilder("\"");
    for (char c : text.toCharArray()) {
      switch (c) {
        case '"' -> sb.append("\\\"");
        case '\\' -> sb.append("\\\\");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        case '\t' -> sb.append("\\t");
        default -> sb.append(c);
      }
    }
    return sb.append('"').toString();
  }
}
