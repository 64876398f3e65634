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

import com.google.gson.JsonParseException;
import io.aitk.hubingest.config.HubImportConfig;
import io.aitk.ingest.api.ImportSummary;
import io.aitk.ingest.api.RemoteReference;
import io.aitk.ingest.api.errors.DecodeException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/// Decodes and imports in a child JVM running [TableImportWorker].
///
/// The buffer is staged to a private temp directory, the worker is started with the same
/// `java` binary and class path as this JVM, and its single stdout line is parsed as the
/// run summary. The access token is handed over in the worker's environment, never on its
/// command line. A worker that exits nonzero or prints no summary fails the run with
/// [DecodeException] carrying the tail of its stderr.
public class IsolatedTableImporter implements TableImporter {
  private static final Logger logger = LogManager.getLogger(IsolatedTableImporter.class);

  static final int STDERR_EXCERPT_CHARS = 4000;
  private static final String STDERR_FILE = "worker.stderr";

  private final HubImportConfig config;

  public IsolatedTableImporter(HubImportConfig config) {
    this.config = config;
  }

  @Override
  public ImportSummary importTable(byte[] parquet, RemoteReference reference, String token, Path datasetDir) {
    try (StagedParquet staged = StagedParquet.write(parquet)) {
      return runWorker(staged, reference, token, datasetDir);
    }
  }

  private ImportSummary runWorker(StagedParquet staged, RemoteReference reference, String token, Path datasetDir) {
    List<String> command = command(staged.file(), reference, datasetDir);
    ProcessBuilder builder = new ProcessBuilder(command);
    if (token != null && !token.isBlank()) {
      builder.environment().put(TableImportWorker.TOKEN_ENV, token);
    } else {
      builder.environment().remove(TableImportWorker.TOKEN_ENV);
    }
    Path stderrFile = staged.directory().resolve(STDERR_FILE);
    builder.redirectError(stderrFile.toFile());

    logger.debug("starting import worker: {}", String.join(" ", command));
    Process process;
    try {
      process = builder.start();
    } catch (IOException e) {
      throw new DecodeException("Failed to start parquet import worker: " + e.getMessage(), e);
    }

    String stdout;
    int exitCode;
    try {
      process.getOutputStream().close();
      try (InputStream in = process.getInputStream()) {
        stdout = new String(in.readAllBytes(), StandardCharsets.UTF_8);
      }
      exitCode = process.waitFor();
    } catch (IOException e) {
      process.destroyForcibly();
      throw new DecodeException("Lost contact with parquet import worker", stderrExcerpt(stderrFile));
    } catch (InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw new DecodeException("Interrupted while waiting for parquet import worker", stderrExcerpt(stderrFile));
    }

    if (exitCode != 0) {
      throw new DecodeException("Parquet import worker failed with exit code " + exitCode,
          stderrExcerpt(stderrFile));
    }
    String line = lastLine(stdout);
    try {
      ImportSummary summary = ImportSummary.fromJson(line);
      logger.debug("import worker finished: {}", line);
      return summary;
    } catch (JsonParseException e) {
      throw new DecodeException("Parquet import worker printed no summary (stdout: '" + abbreviate(stdout) + "')",
          stderrExcerpt(stderrFile));
    }
  }

  List<String> command(Path parquetFile, RemoteReference reference, Path datasetDir) {
    List<String> command = new ArrayList<>();
    command.add(Path.of(System.getProperty("java.home"), "bin", "java").toString());
    command.add("-cp");
    command.add(System.getProperty("java.class.path"));
    command.add(TableImportWorker.class.getName());
    command.add("--dataset-dir");
    command.add(datasetDir.toAbsolutePath().toString());
    command.add("--parquet-file");
    command.add(parquetFile.toAbsolutePath().toString());
    if (reference != null) {
      command.add("--repo-id");
      command.add(reference.repoId());
      command.add("--revision");
      command.add(reference.revision());
      command.add("--repo-kind");
      command.add(reference.repoKind().label());
    }
    command.add("--host");
    command.add(config.host());
    command.add("--image-column");
    command.add(config.imageColumn());
    for (String column : config.captionColumns()) {
      command.add("--caption-column");
      command.add(column);
    }
    command.add("--max-name-attempts");
    command.add(Integer.toString(config.maxNameAttempts()));
    return command;
  }

  private static String lastLine(String stdout) {
    String[] lines = stdout.strip().split("\\R");
    return lines.length == 0 ? "" : lines[lines.length - 1].strip();
  }

  private static String abbreviate(String text) {
    String stripped = text.strip();
    return stripped.length() > 200 ? stripped.substring(0, 200) + "..." : stripped;
  }

  static String stderrExcerpt(Path stderrFile) {
    try {
      if (!Files.exists(stderrFile)) {
        return "";
      }
      String text = Files.readString(stderrFile, StandardCharsets.UTF_8);
      return text.length() > STDERR_EXCERPT_CHARS ? text.substring(text.length() - STDERR_EXCERPT_CHARS) : text;
    } catch (IOException e) {
      logger.warn("failed to read worker stderr {}: {}", stderrFile, e.getMessage());
      return "";
    }
  }
}
