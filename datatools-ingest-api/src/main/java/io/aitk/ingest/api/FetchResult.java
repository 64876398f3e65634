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

/// The body and response metadata of a successful hub download.
///
/// Fetch results are transient. They are handed to the content validator or the row
/// extractor and dropped; nothing here is ever written to disk as-is.
public class FetchResult {

  private final byte[] data;
  private final int httpStatus;
  private final String requestedUrl;
  private final String finalUrl;
  private final String contentType;
  private final String contentEncoding;
  private final RepoKind servedFrom;

  /// Creates a new FetchResult.
  /// @param data the raw response body, not decompressed
  /// @param httpStatus the final HTTP status code
  /// @param requestedUrl the URL that was requested
  /// @param finalUrl the URL the body was served from, after redirects
  /// @param contentType the `Content-Type` header, or null
  /// @param contentEncoding the `Content-Encoding` header, or null
  public FetchResult(
      byte[] data,
      int httpStatus,
      String requestedUrl,
      String finalUrl,
      String contentType,
      String contentEncoding)
  {
    this(data, httpStatus, requestedUrl, finalUrl, contentType, contentEncoding, null);
  }

  /// Creates a new FetchResult that records which namespace answered.
  /// @param data the raw response body, not decompressed
  /// @param httpStatus the final HTTP status code
  /// @param requestedUrl the URL that was requested
  /// @param finalUrl the URL the body was served from, after redirects
  /// @param contentType the `Content-Type` header, or null
  /// @param contentEncoding the `Content-Encoding` header, or null
  /// @param servedFrom the concrete namespace the URL was built for, or null if unknown
  public FetchResult(
      byte[] data,
      int httpStatus,
      String requestedUrl,
      String finalUrl,
      String contentType,
      String contentEncoding,
      RepoKind servedFrom)
  {
    this.data = data;
    this.httpStatus = httpStatus;
    this.requestedUrl = requestedUrl;
    this.finalUrl = finalUrl != null ? finalUrl : requestedUrl;
    this.contentType = contentType;
    this.contentEncoding = contentEncoding;
    this.servedFrom = servedFrom;
  }

  public byte[] getData() {
    return data;
  }

  public int getHttpStatus() {
    return httpStatus;
  }

  public String getRequestedUrl() {
    return requestedUrl;
  }

  public String getFinalUrl() {
    return finalUrl;
  }

  /// @return the declared content type, or null if the server sent none
  public String getContentType() {
    return contentType;
  }

  /// @return the declared content encoding, or null if the server sent none
  public String getContentEncoding() {
    return contentEncoding;
  }

  /// @return the namespace that served the file, or null if unknown
  public RepoKind getServedFrom() {
    return servedFrom;
  }

  @Override
  public String toString() {
    return "FetchResult{" +
           "bytes=" + (data == null ? 0 : data.length) +
           ", httpStatus=" + httpStatus +
           ", finalUrl='" + finalUrl + '\'' +
           ", contentType='" + contentType + '\'' +
           ", contentEncoding='" + contentEncoding + '\'' +
           '}';
  }
}
