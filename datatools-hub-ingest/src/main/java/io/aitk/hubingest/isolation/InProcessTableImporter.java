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

import io.aitk.datasource.parquet.ParquetTableReader;
import io.aitk.datasource.parquet.TableRows;
import io.aitk.hubingest.config.HubImportConfig;
import io.aitk.hubingest.fetch.HubFileFetcher;
import io.aitk.hubingest.output.DatasetFileWriter;
import io.aitk.hubingest.pipeline.ImportAggregator;
import io.aitk.hubingest.rows.RemoteAssets;
import io.aitk.hubingest.rows.RowAssetExtractor;
import io.aitk.hubingest.validate.ContentDecoding;
import io.aitk.ingest.api.ImportSummary;
import io.aitk.ingest.api.RemoteReference;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;

/// Decodes and imports in the calling JVM.
public class InProcessTableImporter implements TableImporter {
  private static final Logger logger = LogManager.getLogger(InProcessTableImporter.class);

  private final HubImportConfig config;
  private final HubFileFetcher fetcher;

  /// @param config the import settings
  /// @param fetcher the fetcher used for images that rows name by path
  public InProcessTableImporter(HubImportConfig config, HubFileFetcher fetcher) {
    this.config = config;
    this.fetcher = fetcher;
  }

  @Override
  public ImportSummary importTable(byte[] parquet, RemoteReference reference, String token, Path datasetDir) {
    try (StagedParquet staged = StagedParquet.write(parquet)) {
      return importFile(staged.file(), reference, token, datasetDir);
    }
  }

  /// Import rows from a parquet file that is already on disk.
  /// @param parquetFile the file
  /// @param reference where the file came from, or null when rows cannot name remote images
  /// @param token the access token for image fetches, possibly null
  /// @param datasetDir the directory to write into
  /// @return the summary of the run
  public ImportSummary importFile(Path parquetFile, RemoteReference reference, String token, Path datasetDir) {
    RowAssetExtractor extractor = new RowAssetExtractor(config, remoteAssets(reference, token));
    DatasetFileWriter writer = new DatasetFileWriter(datasetDir, config.maxNameAttempts());
    ImportAggregator aggregator = new ImportAggregator(extractor, writer);
    TableRows rows = ParquetTableReader.open(parquetFile);
    try {
      return aggregator.run(rows, rows.rowCount());
    } finally {
      try {
        rows.close();
      } catch (IOException e) {
        logger.warn("failed to close {}: {}", parquetFile, e.getMessage());
      }
    }
  }

  private RemoteAssets remoteAssets(RemoteReference reference, String token) {
    if (reference == null) {
      return RemoteAssets.NONE;
    }
    return path -> ContentDecoding.decode(fetcher.fetch(reference.forPath(path), token));
  }
}
