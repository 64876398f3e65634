package io.aitk.hubingest.pipeline;


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
import io.aitk.hubingest.config.ImportMode;
import io.aitk.hubingest.fetch.HubFileFetcher;
import io.aitk.hubingest.isolation.InProcessTableImporter;
import io.aitk.hubingest.isolation.IsolatedTableImporter;
import io.aitk.hubingest.isolation.TableImporter;
import io.aitk.hubingest.reference.HubReferenceParser;
import io.aitk.hubingest.settings.IngestSettings;
import io.aitk.hubingest.validate.ParquetContentValidator;
import io.aitk.ingest.api.FetchResult;
import io.aitk.ingest.api.ImportSummary;
import io.aitk.ingest.api.RemoteReference;
import io.aitk.ingest.api.errors.DecodeException;
import io.aitk.ingest.api.errors.InvalidContentException;
import io.aitk.ingest.api.errors.InvalidReferenceException;
import io.aitk.ingest.api.errors.RemoteFetchException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/// Imports the image and caption pairs of a hub parquet file into a dataset directory.
///
/// A run parses the reference, downloads the file, checks that it is parquet, and hands it
/// to a [TableImporter] that decodes it and writes one image plus caption file per usable
/// row. Faults in single rows are reported in the summary. Only
/// [InvalidReferenceException], [RemoteFetchException], [InvalidContentException] and
/// [DecodeException] end a run.
///
/// ```java
/// try (HubParquetImporter importer = new HubParquetImporter(config, settings)) {
///   ImportSummary summary = importer.importDataset("cats", "acme/cats/data/train.parquet");
/// }
/// ```
public class HubParquetImporter implements AutoCloseable {
  private static final Logger logger = LogManager.getLogger(HubParquetImporter.class);

  private final HubImportConfig config;
  private final IngestSettings settings;
  private final HubReferenceParser parser = new HubReferenceParser();
  private final HubFileFetcher fetcher;
  private final ParquetContentValidator validator;
  private final TableImporter tableImporter;

  public HubParquetImporter(HubImportConfig config, IngestSettings settings) {
    this.config = config;
    this.settings = settings;
    this.fetcher = new HubFileFetcher(config);
    this.validator = new ParquetContentValidator(config.previewLength());
    this.tableImporter = config.importMode() == ImportMode.FORKED
        ? new IsolatedTableImporter(config)
        : new InProcessTableImporter(config, fetcher);
  }

  /// Import into a dataset under the configured datasets root, with the configured token.
  /// @param datasetName the dataset directory name
  /// @param reference the parquet reference as the user typed it
  /// @return the run summary
  public ImportSummary importDataset(String datasetName, String reference) {
    if (datasetName == null || datasetName.isBlank()) {
      throw new IllegalArgumentException("datasetName is required");
    }
    if (reference == null || reference.isBlank()) {
      throw new IllegalArgumentException("reference is required");
    }
    Path datasetDir = settings.datasetsRoot().resolve(datasetName.trim());
    return importInto(datasetDir, reference, settings.hubToken().orElse(null));
  }

  /// Import into an explicit directory.
  /// @param datasetDir the directory to write into, created when missing
  /// @param reference the parquet reference as the user typed it
  /// @param token the access token, possibly null
  /// @return the run summary
  public ImportSummary importInto(Path datasetDir, String reference, String token) {
    if (reference == null || reference.isBlank()) {
      throw new IllegalArgumentException("reference is required");
    }
    RemoteReference parsed = parser.parse(reference);
    logger.info("importing {} into {} ({})", parsed, datasetDir, config.importMode());

    FetchResult fetched = fetcher.fetch(parsed, token);
    byte[] parquet = validator.validate(fetched);
    logger.info("downloaded {} bytes of parquet from {}", parquet.length, fetched.getFinalUrl());

    RemoteReference resolved = fetched.getServedFrom() == null ? parsed : parsed.withKind(fetched.getServedFrom());
    try {
      Files.createDirectories(datasetDir);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to create dataset directory " + datasetDir, e);
    }
    return tableImporter.importTable(parquet, resolved, token, datasetDir);
  }

  @Override
  public void close() throws IOException {
    fetcher.close();
  }
}
