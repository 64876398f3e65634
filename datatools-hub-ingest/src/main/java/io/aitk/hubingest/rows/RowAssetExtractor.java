package io.aitk.hubingest.rows;


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
import io.aitk.ingest.api.ExtractedAsset;
import io.aitk.ingest.api.TableRow;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.math.BigInteger;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;

/// Pulls the image and caption out of one decoded table row.
///
/// The image column holds either a struct with embedded `bytes` (or `data`) and an optional
/// `path`, plain binary, or a path string. A row that names a path but embeds nothing is
/// completed through [RemoteAssets]. A row with no image at all is skipped; shapes that
/// cannot be turned into bytes throw, and the caller records that row as failed.
public class RowAssetExtractor {
  private static final Logger logger = LogManager.getLogger(RowAssetExtractor.class);

  static final List<String> BYTE_FIELDS = List.of("bytes", "data");
  static final String PATH_FIELD = "path";
  static final String FALLBACK_EXTENSION = "jpg";

  private final List<String> captionColumns;
  private final String imageColumn;
  private final RemoteAssets remoteAssets;

  public RowAssetExtractor(HubImportConfig config, RemoteAssets remoteAssets) {
    this.captionColumns = config.captionColumns();
    this.imageColumn = config.imageColumn();
    this.remoteAssets = remoteAssets;
  }

  /// @param row a decoded row
  /// @return the asset, or the reason the row has none
  /// @throws RuntimeException when the image cell has an unsupported shape or a remote fetch fails
  public Extraction extract(TableRow row) {
    String caption = caption(row);
    Object cell = row.get(imageColumn);
    if (cell == null) {
      return Extraction.skipped("no " + imageColumn + " value");
    }

    byte[] bytes;
    String path;
    if (cell instanceof TableRow struct) {
      bytes = embeddedBytes(struct);
      Object pathValue = struct.get(PATH_FIELD);
      path = pathValue == null ? null : String.valueOf(pathValue);
    } else if (cell instanceof String text) {
      bytes = null;
      path = text;
    } else {
      bytes = ByteCoercion.toBytes(cell);
      path = null;
    }
    if (path != null && path.isBlank()) {
      path = null;
    }

    if ((bytes == null || bytes.length == 0) && path != null) {
      logger.debug("fetching image {} named by row", path);
      bytes = remoteAssets.fetch(path);
    }
    if (bytes == null || bytes.length == 0) {
      return Extraction.skipped(path == null ? "no image bytes or path" : "no image bytes for " + path);
    }

    return Extraction.found(name(bytes, caption, path));
  }

  private byte[] embeddedBytes(TableRow struct) {
    for (String field : BYTE_FIELDS) {
      byte[] bytes = ByteCoercion.toBytes(struct.get(field));
      if (bytes != null) {
        return bytes;
      }
    }
    return null;
  }

  private String caption(TableRow row) {
    for (String column : captionColumns) {
      Object value = row.get(column);
      if (value != null) {
        return String.valueOf(value);
      }
    }
    return "";
  }

  private static ExtractedAsset name(byte[] bytes, String caption, String path) {
    if (path == null) {
      return new ExtractedAsset(bytes, caption, md5Hex(bytes), sniffedExtension(bytes));
    }
    String fileName = path.substring(Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\')) + 1);
    int dot = fileName.lastIndexOf('.');
    // a leading dot starts the extension, so ".png" has no base name
    String base = dot >= 0 ? fileName.substring(0, dot) : fileName;
    String extension = dot >= 0 && dot < fileName.length() - 1 ? fileName.substring(dot + 1) : sniffedExtension(bytes);
    return new ExtractedAsset(bytes, caption, base.isEmpty() ? md5Hex(bytes) : base, extension);
  }

  private static String sniffedExtension(byte[] bytes) {
    return ImageSignatures.sniff(bytes).orElse(FALLBACK_EXTENSION);
  }

  static String md5Hex(byte[] bytes) {
    try {
      byte[] digest = MessageDigest.getInstance("MD5").digest(bytes);
      return String.format("%032x", new BigInteger(1, digest));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("MD5 is not available", e);
    }
  }
}
