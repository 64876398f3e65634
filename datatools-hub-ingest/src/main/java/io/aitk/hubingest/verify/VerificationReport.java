package io.aitk.hubingest.verify;


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

/// What a single download of a hub URL returned.
///
/// @param requestedUrl the URL asked for
/// @param finalUrl the URL the body came from after redirects
/// @param httpStatus the status, or -1 when no response arrived
/// @param contentType the declared content type, or null
/// @param contentEncoding the declared content encoding, or null
/// @param byteCount the body size after decompression
/// @param parquet whether the body is a parquet file
/// @param html whether the body looks like an HTML page
/// @param lfsPointer whether the body is a Git-LFS pointer record
/// @param preview the start of the body, or the error details for a failed request
public record VerificationReport(
    String requestedUrl,
    String finalUrl,
    int httpStatus,
    String contentType,
    String contentEncoding,
    long byteCount,
    boolean parquet,
    boolean html,
    boolean lfsPointer,
    String preview)
{
  /// @return a multi line human readable rendering
  public String render() {
    StringBuilder sb = new StringBuilder();
    sb.append("Requested:        ").append(requestedUrl).append('\n');
    sb.append("Final URL:        ").append(finalUrl).append('\n');
    sb.append("Status:           ").append(httpStatus).append('\n');
    sb.append("Content-Type:     ").append(contentType).append('\n');
    sb.append("Content-Encoding: ").append(contentEncoding).append('\n');
    sb.append("Bytes:            ").append(byteCount).append('\n');
    sb.append("Parquet:          ").append(parquet ? "yes" : "no").append('\n');
    if (!parquet) {
      sb.append("Looks like HTML:  ").append(html ? "yes" : "no").append('\n');
      sb.append("Git-LFS pointer:  ").append(lfsPointer ? "yes" : "no").append('\n');
      sb.append("Preview:\n").append(preview).append('\n');
    }
    return sb.toString();
  }
}
