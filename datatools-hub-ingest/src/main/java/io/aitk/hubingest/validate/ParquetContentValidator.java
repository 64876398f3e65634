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
import io.aitk.ingest.api.errors.InvalidContentException;
import io.aitk.ingest.api.errors.InvalidContentException.Hint;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/// Checks that a downloaded body is a parquet file before anything tries to decode it.
///
/// Hubs answer with Git-LFS pointer records or HTML pages often enough that a wrong body
/// is reported with a hint saying which of those it looks like.
public class ParquetContentValidator {
  private static final Logger logger = LogManager.getLogger(ParquetContentValidator.class);

  private static final byte[] MAGIC = "PAR1".getBytes(StandardCharsets.US_ASCII);
  private static final String LFS_POINTER_PREFIX = "version https://git-lfs.github.com/spec/v1";
  private static final int LFS_SNIFF_BYTES = 200;
  private static final int HTML_SNIFF_BYTES = 300;

  private final int previewLength;

  public ParquetContentValidator(int previewLength) {
    this.previewLength = previewLength;
  }

  /// @param result a successful download
  /// @return the parquet bytes, decompressed if the body was gzip
  /// @throws InvalidContentException if the body is not a parquet file
  public byte[] validate(FetchResult result) {
    byte[] data = ContentDecoding.decode(result);
    if (!isParquet(data) && ContentDecoding.looksGzipped(data)) {
      Optional<byte[]> inflated = ContentDecoding.gunzip(data);
      if (inflated.isPresent() && isParquet(inflated.get())) {
        logger.debug("{} was gzip without saying so", result.getFinalUrl());
        data = inflated.get();
      }
    }
    if (isParquet(data)) {
      return data;
    }
    List<Hint> hints = hints(data, result.getContentType());
    logger.debug("{} is not parquet ({} bytes, hints {})", result.getFinalUrl(), data.length, hints);
    throw new InvalidContentException(result.getRequestedUrl(), result.getFinalUrl(), result.getContentType(),
        hints, preview(data, previewLength));
  }

  /// @param data some bytes
  /// @return whether they start and end with the parquet magic
  public static boolean isParquet(byte[] data) {
    if (data == null || data.length < 2 * MAGIC.length) {
      return false;
    }
    return Arrays.equals(data, 0, MAGIC.length, MAGIC, 0, MAGIC.length)
           && Arrays.equals(data, data.length - MAGIC.length, data.length, MAGIC, 0, MAGIC.length);
  }

  /// @param data a body that is not parquet
  /// @param contentType the declared content type, or null
  /// @return what the body looks like instead
  public static List<Hint> hints(byte[] data, String contentType) {
    List<Hint> hints = new ArrayList<>();
    if (isLfsPointer(data)) {
      hints.add(Hint.LFS_POINTER);
    }
    if (isHtml(data)) {
      hints.add(Hint.HTML_DOCUMENT);
    }
    if (contentType != null && contentType.toLowerCase(Locale.ROOT).contains("text/html")) {
      hints.add(Hint.HTML_CONTENT_TYPE);
    }
    return hints;
  }

  /// @param data some bytes
  /// @return whether they are a Git-LFS pointer record
  public static boolean isLfsPointer(byte[] data) {
    return head(data, LFS_SNIFF_BYTES).startsWith(LFS_POINTER_PREFIX);
  }

  /// @param data some bytes
  /// @return whether they look like an HTML document
  public static boolean isHtml(byte[] data) {
    String head = head(data, HTML_SNIFF_BYTES).strip().toLowerCase(Locale.ROOT);
    return head.startsWith("<!doctype html") || head.startsWith("<html") || head.contains("<head");
  }

  /// @param data some bytes
  /// @param length the maximum number of characters
  /// @return the start of the bytes decoded leniently as UTF-8
  public static String preview(byte[] data, int length) {
    String text = head(data, length * 4);
    return text.length() > length ? text.substring(0, length) : text;
  }

  private static String head(byte[] data, int bytes) {
    if (data == null) {
      return "";
    }
    return new String(data, 0, Math.min(bytes, data.length), StandardCharsets.UTF_8);
  }
}
