package io.aitk.command.importparquet;


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

import io.aitk.command.common.VerbosityOption;
import io.aitk.hubingest.config.HubImportConfig;
import io.aitk.hubingest.config.ImportMode;
import io.aitk.hubingest.pipeline.HubParquetImporter;
import io.aitk.hubingest.settings.EnvironmentIngestSettings;
import io.aitk.ingest.api.ImportSummary;
import io.aitk.ingest.api.errors.HubImportException;
import io.aitk.ingest.api.errors.InvalidReferenceException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/// Import the rows of one hub parquet file into a dataset directory.
///
/// On a completed run the summary is printed to stdout as one JSON line and the exit code is 0,
/// even when individual rows failed. A malformed reference exits with 2, any other fatal error
/// with 1; in both cases the message goes to stderr and nothing is printed to stdout.
@CommandLine.Command(name = "import-parquet",
    header = "Import image and caption rows from a hub parquet file",
    description = "The reference is a hub URL or a short form such as org/repo/path/file.parquet "
        + "or org/repo@revision/path/file.parquet.",
    mixinStandardHelpOptions = true)
public class CMD_import_parquet implements Callable<Integer> {

  private static final Logger logger = LogManager.getLogger(CMD_import_parquet.class);

  public static final int EXIT_OK = 0;
  public static final int EXIT_FAILED = 1;
  public static final int EXIT_INVALID_REFERENCE = 2;

  @CommandLine.Parameters(index = "0", paramLabel = "REFERENCE",
      description = "Hub URL or short reference of the parquet file")
  private String reference;

  @CommandLine.ArgGroup(exclusive = true, multiplicity = "1")
  private Target target;

  static class Target {
    @CommandLine.Option(names = {"--dataset-dir"}, description = "Directory to write into")
    Path datasetDir;

    @CommandLine.Option(names = {"--dataset"},
        description = "Dataset name, resolved under the datasets root")
    String dataset;
  }

  @CommandLine.Option(names = {"--datasets-root"},
      description = "Root folder for named datasets (default: $${env:"
          + EnvironmentIngestSettings.DATASETS_FOLDER_ENV + "} or ~/aitk/datasets)")
  private Path datasetsRoot;

  @CommandLine.Option(names = {"--token", "-t"}, description = "Hub access token")
  private String token;

  @CommandLine.Option(names = {"--envkey", "-k"},
      defaultValue = EnvironmentIngestSettings.DEFAULT_TOKEN_ENV,
      description = "Environment variable holding the token (default: ${DEFAULT-VALUE})")
  private String envKey;

  @CommandLine.Option(names = {"--host"}, defaultValue = HubImportConfig.DEFAULT_HOST,
      description = "Hub base URL (default: ${DEFAULT-VALUE})")
  private String host;

  @CommandLine.Option(names = {"--mode"}, defaultValue = "FORKED",
      description = "Where the table is decoded: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
  private ImportMode mode;

  @CommandLine.Mixin
  private VerbosityOption verbosity;

  @CommandLine.Spec
  private CommandLine.Model.CommandSpec spec;

  @Override
  public Integer call() {
    PrintWriter out = spec.commandLine().getOut();
    PrintWriter err = spec.commandLine().getErr();
    try {
      verbosity.apply();
      EnvironmentIngestSettings settings = new EnvironmentIngestSettings(token, envKey, datasetsRoot);
      HubImportConfig config = HubImportConfig.builder().host(host).importMode(mode).build();
      ImportSummary summary = run(config, settings);
      if (!summary.errors().isEmpty()) {
        logger.warn("{} row(s) failed during import", summary.errors().size());
      }
      out.println(summary.toJson());
      out.flush();
      return EXIT_OK;
    } catch (InvalidReferenceException e) {
      err.println("Invalid reference: " + e.getMessage());
      err.flush();
      return EXIT_INVALID_REFERENCE;
    } catch (HubImportException | IllegalArgumentException | IllegalStateException
             | UncheckedIOException e)
    {
      logger.debug("import failed", e);
      err.println("Import failed: " + e.getMessage());
      err.flush();
      return EXIT_FAILED;
    }
  }

  private ImportSummary run(HubImportConfig config, EnvironmentIngestSettings settings) {
    try (HubParquetImporter importer = new HubParquetImporter(config, settings)) {
      if (target.datasetDir != null) {
        return importer.importInto(target.datasetDir, reference, settings.hubToken().orElse(null));
      }
      return importer.importDataset(target.dataset, reference);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
