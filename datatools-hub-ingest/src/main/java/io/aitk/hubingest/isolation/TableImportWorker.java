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

import io.aitk.hubingest.config.HubImportConfig;
import io.aitk.hubingest.fetch.HubFileFetcher;
import io.aitk.ingest.api.ImportSummary;
import io.aitk.ingest.api.RemoteReference;
import io.aitk.ingest.api.RepoKind;
import io.aitk.ingest.api.errors.DecodeException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/// Child process entry point for [IsolatedTableImporter].
///
/// Imports one staged parquet file and prints the summary as a single JSON line on stdout.
/// Logging goes to stderr. The access token is read from `HF_TOKEN`.
@CommandLine.Command(name = "table-import-worker", header = "Import the rows of a staged parquet file")
public class TableImportWorker implements Callable<Integer> {
  private static final Logger logger = LogManager.getLogger(TableImportWorker.class);

  /// environment variable carrying the access token
  public static final String TOKEN_ENV = "HF_TOKEN";

  static final int EXIT_DECODE = 3;
  static final int EXIT_ERROR = 1;

  @CommandLine.Option(names = "--dataset-dir", required = true, description = "Directory to write images into")
  private Path datasetDir;

  @CommandLine.Option(names = "--parquet-file", required = true, description = "The staged parquet file")
  private Path parquetFile;

  @CommandLine.Option(names = "--repo-id", description = "Repository the file came from")
  private String repoId;

  @CommandLine.Option(names = "--revision", defaultValue = RemoteReference.DEFAULT_REVISION,
      description = "Revision the file came from (default: ${DEFAULT-VALUE})")
  private String revision;

  @CommandLine.Option(names = "--repo-kind", defaultValue = "auto",
      description = "datasets, models or auto (default: ${DEFAULT-VALUE})")
  private String repoKind;

  @CommandLine.Option(names = "--host", defaultValue = HubImportConfig.DEFAULT_HOST,
      description = "Hub origin for images named by path (default: ${DEFAULT-VALUE})")
  private String host;

  @CommandLine.Option(names = "--image-column", defaultValue = HubImportConfig.DEFAULT_IMAGE_COLUMN,
      description = "Image column (default: ${DEFAULT-VALUE})")
  private String imageColumn;

  @CommandLine.Option(names = "--caption-column", description = "Caption columns in lookup order (default: text, caption)")
  private List<String> captionColumns;

  @CommandLine.Option(names = "--max-name-attempts", defaultValue = "10000",
      description = "File names to try per image (default: ${DEFAULT-VALUE})")
  private int maxNameAttempts;

  /// run the worker
  /// @param args command line args
  public static void main(String[] args) {
    int exitCode = new CommandLine(new TableImportWorker()).execute(args);
    System.exit(exitCode);
  }

  @Override
  public Integer call() {
    HubImportConfig.Builder builder = HubImportConfig.builder()
        .host(host)
        .imageColumn(imageColumn)
        .maxNameAttempts(maxNameAttempts);
    if (captionColumns != null && !captionColumns.isEmpty()) {
      builder.captionColumns(captionColumns);
    }
    HubImportConfig config = builder.build();
    RemoteReference reference = repoId == null ? null
        : new RemoteReference(repoId, revision, parquetFile.getFileName().toString(), RepoKind.fromLabel(repoKind));

    try (HubFileFetcher fetcher = new HubFileFetcher(config)) {
      ImportSummary summary = new InProcessTableImporter(config, fetcher)
          .importFile(parquetFile, reference, System.getenv(TOKEN_ENV), datasetDir);
      System.out.println(summary.toJson());
      System.out.flush();
      return 0;
    } catch (DecodeException e) {
      logger.error("decode failed: {}", e.getMessage(), e);
      return EXIT_DECODE;
    } catch (IOException | RuntimeException e) {
      logger.error("import failed: {}", e.getMessage(), e);
      return EXIT_ERROR;
    }
  }
}
