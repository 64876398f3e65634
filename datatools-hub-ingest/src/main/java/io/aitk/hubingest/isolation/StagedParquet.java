package io.aitk.hubingest.isolation;


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

import io.aitk.ingest.api.errors.DecodeException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/// A parquet buffer written to a private temp directory, removed again on close.
public class StagedParquet implements AutoCloseable {
  private static final Logger logger = LogManager.getLogger(StagedParquet.class);

  static final String DIRECTORY_PREFIX = "aitk-parquet-";
  static final String FILE_NAME = "input.parquet";

  private final Path directory;
  private final Path file;

  private StagedParquet(Path directory, Path file) {
    this.directory = directory;
    this.file = file;
  }

  /// @param parquet the bytes to stage
  /// @return the staged file
  /// @throws DecodeException when the temp file cannot be written
  public static StagedParquet write(byte[] parquet) {
    Path directory = null;
    try {
      directory = Files.createTempDirectory(DIRECTORY_PREFIX);
      Path file = Files.write(directory.resolve(FILE_NAME), parquet);
      return new StagedParquet(directory, file);
    } catch (IOException e) {
      if (directory != null) {
        deleteTree(directory);
      }
      throw new DecodeException("Failed to stage parquet data for decoding: " + e.getMessage(), e);
    }
  }

  public Path directory() {
    return directory;
  }

  public Path file() {
    return file;
  }

  @Override
  public void close() {
    deleteTree(directory);
  }

  private static void deleteTree(Path root) {
    if (!Files.exists(root)) {
      return;
    }
    try (Stream<Path> walk = Files.walk(root)) {
      List<Path> paths = walk.sorted(Comparator.reverseOrder()).toList();
      for (Path path : paths) {
        Files.deleteIfExists(path);
      }
    } catch (IOException e) {
      logger.warn("failed to remove temp directory {}: {}", root, e.getMessage());
    }
  }
}
