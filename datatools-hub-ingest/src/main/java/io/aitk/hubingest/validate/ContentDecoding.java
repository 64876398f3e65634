package io.aitk.hubingest.validate;


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

import io.aitk.ingest.api.FetchResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Optional;
import java.util.zip.GZIPInputStream;

/// Undoes gzip compression that the HTTP client was told to leave alone.
public final class ContentDecoding {
  private static final Logger logger = LogManager.getLogger(ContentDecoding.class);

  private ContentDecoding() {
  }

  /// @param result a response
  /// @return whether its encoding or content type mentions gzip
  public static boolean declaresGzip(FetchResult result) {
    return mentionsGzip(result.getContentEncoding()) || mentionsGzip(result.getContentType());
  }

  /// The body of a response, gunzipped when the response says it is gzip. A body that
  /// does not actually gunzip is returned unchanged.
  /// @param result a response
  /// @return the decoded body
  public static byte[] decode(FetchResult result) {
    byte[] data = result.getData();
    if (!declaresGzip(result)) {
      return data;
    }
    return gunzip(data).orElseGet(() -> {
      logger.debug("{} declared gzip but did not decompress, keeping the body as served", result.getFinalUrl());
      return data;
    });
  }

  /// @param data some bytes
  /// @return whether they start with the gzip member header
  public static boolean looksGzipped(byte[] data) {
    return data != null && data.length >= 2 && (data[0] & 0xff) == 0x1f && (data[1] & 0xff) == 0x8b;
  }

  /// @param data possibly compressed bytes
  /// @return the decompressed bytes, or empty when they are not valid gzip
  public static Optional<byte[]> gunzip(byte[] data) {
    try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(data))) {
      return Optional.of(in.readAllBytes());
    } catch (IOException e) {
      logger.debug("gunzip failed: {}", e.getMessage());
      return Optional.empty();
    }
  }

  private static boolean mentionsGzip(String header) {
    return header != null && header.toLowerCase(Locale.ROOT).contains("gzip");
  }
}
