package io.aitk.datasource.parquet;

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
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.hadoop.metadata.BlockMetaData;
import org.apache.parquet.hadoop.metadata.ParquetMetadata;
import org.apache.parquet.io.InputFile;
import org.apache.parquet.io.LocalInputFile;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.Type;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/// Opens local parquet files for row-oriented reading.
///
/// Example:
/// ```java
/// try (TableRows rows = ParquetTableReader.open(path)) {
///   while (rows.hasNext()) {
///     TableRow row = rows.next();
///   }
/// }
/// ```
public final class ParquetTableReader {
  private static final Logger logger = LogManager.getLogger(ParquetTableReader.class);

  private ParquetTableReader() {
  }

  /// Open a file for a single pass over its rows.
  /// @param path a local parquet file
  /// @return the rows, which the caller must close
  /// @throws DecodeException if the footer cannot be read
  public static TableRows open(Path path) {
    ParquetFileReader fileReader = openReader(path);
    try {
      ParquetTableInfo info = describe(fileReader.getFooter());
      logger.debug("opened {}: {} rows in {} row groups, columns {}",
          path, info.rowCount(), info.rowGroups(), info.columns());
      return new TableRows(fileReader, info);
    } catch (RuntimeException e) {
      closeQuietly(fileReader, path);
      throw new DecodeException("Failed to read parquet schema of " + path, e);
    }
  }

  /// Read only the footer of a file.
  /// @param path a local parquet file
  /// @return the row count and top level columns
  /// @throws DecodeException if the footer cannot be read
  public static ParquetTableInfo inspect(Path path) {
    ParquetFileReader fileReader = openReader(path);
    try {
      return describe(fileReader.getFooter());
    } finally {
      closeQuietly(fileReader, path);
    }
  }

  private static ParquetFileReader openReader(Path path) {
    InputFile inputFile = new LocalInputFile(path);
    try {
      return ParquetFileReader.open(inputFile);
    } catch (IOException | RuntimeException e) {
      throw new DecodeException("Failed to open parquet file " + path + ": " + e.getMessage(), e);
    }
  }

  private static ParquetTableInfo describe(ParquetMetadata footer) {
    MessageType schema = footer.getFileMetaData().getSchema();
    List<String> columns = schema.getFields().stream().map(Type::getName).toList();
    long rows = footer.getBlocks().stream().mapToLong(BlockMetaData::getRowCount).sum();
    return new ParquetTableInfo(rows, footer.getBlocks().size(), columns);
  }

  private static void closeQuietly(ParquetFileReader fileReader, Path path) {
    try {
      fileReader.close();
    } catch (IOException e) {
      logger.warn("failed to close parquet reader for {}: {}", path, e.getMessage());
    }
  }
}
