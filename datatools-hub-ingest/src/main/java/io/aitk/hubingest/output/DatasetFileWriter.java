package io.aitk.hubingest.output;


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

import io.aitk.ingest.api.ExtractedAsset;
import io.aitk.ingest.api.errors.NoUniqueNameAvailableException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.regex.Pattern;

/// Writes an image and its caption sidecar into a dataset directory without overwriting.
///
/// The first free name among `{base}.{ext}`, `{base}_1.{ext}`, `{base}_2.{ext}` ... is taken,
/// where free means neither the image nor its `{name}.txt` caption exists. Images are
/// created with [StandardOpenOption#CREATE_NEW] so a concurrent writer loses the race
/// rather than clobbering a file.
public class DatasetFileWriter {
  private static final Logger logger = LogManager.getLogger(DatasetFileWriter.class);

  private static final Pattern UNSAFE = Pattern.compile("[^a-zA-Z0-9._-]");
  static final String CAPTION_EXTENSION = "txt";

  private final Path datasetDir;
  private final int maxAttempts;

  /// @param datasetDir the directory to write into, created on first write
  /// @param maxAttempts how many names to try, counting the unsuffixed one
  public DatasetFileWriter(Path datasetDir, int maxAttempts) {
    this.datasetDir = datasetDir;
    this.maxAttempts = maxAttempts;
  }

  /// @param asset the image and caption
  /// @return the absolute path of the written image
  /// @throws NoUniqueNameAvailableException when every candidate name is taken
  /// @throws UncheckedIOException when the files cannot be written
  public Path write(ExtractedAsset asset) {
    String base = sanitize(asset.suggestedBaseName(), "image");
    String extension = sanitize(asset.suggestedExtension(), "jpg");
    try {
      Files.createDirectories(datasetDir);
      for (int n = 0; n < maxAttempts; n++) {
        String name = n == 0 ? base : base + "_" + n;
        Path image = datasetDir.resolve(name + "." + extension);
        Path caption = datasetDir.resolve(name + "." + CAPTION_EXTENSION);
        if (Files.exists(image) || Files.exists(caption)) {
          continue;
        }
        try {
          Files.write(image, asset.imageBytes(), StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (FileAlreadyExistsException e) {
          logger.debug("{} appeared while writing, trying the next name", image);
          continue;
        }
        writeCaption(image, caption, asset.caption());
        logger.debug("wrote {} ({} bytes)", image.getFileName(), asset.imageBytes().length);
        return image.toAbsolutePath();
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write " + base + "." + extension + " to " + datasetDir, e);
    }
    throw new NoUniqueNameAvailableException(datasetDir, base, maxAttempts);
  }

  // the image is only kept once its caption is on disk
  private static void writeCaption(Path image, Path caption, String text) throws IOException {
    try {
      Files.writeString(caption, text == null ? "" : text, StandardCharsets.UTF_8);
    } catch (IOException e) {
      try {
        Files.deleteIfExists(image);
      } catch (IOException cleanup) {
        logger.warn("failed to remove {} after its caption could not be written", image, cleanup);
        e.addSuppressed(cleanup);
      }
      throw e;
    }
  }

  /// @param name a suggested name part
  /// @param fallback the value used when nothing is left
  /// @return the name with every character outside `[a-zA-Z0-9._-]` replaced by `_`
  static String sanitize(String name, String fallback) {
    if (name == null || name.isEmpty()) {
      return fallback;
    }
    return UNSAFE.matcher(name).replaceAll("_");
  }
}
