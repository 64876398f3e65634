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

import io.aitk.hubingest.output.DatasetFileWriter;
import io.aitk.hubingest.rows.Extraction;
import io.aitk.hubingest.rows.RowAssetExtractor;
import io.aitk.ingest.api.ImportOutcome;
import io.aitk.ingest.api.ImportSummary;
import io.aitk.ingest.api.RowOutcome;
import io.aitk.ingest.api.TableRow;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.Iterator;

/// Runs the row loop of an import and tallies the outcome.
///
/// Rows are handled one at a time; a row's fetch and write finish before the next row is
/// read. Anything that goes wrong inside a row becomes an error entry for that row and the
/// loop continues. Failures of the row source itself propagate and end the run.
public class ImportAggregator {
  private static final Logger logger = LogManager.getLogger(ImportAggregator.class);

  private static final int PROGRESS_INTERVAL = 500;

  private final RowAssetExtractor extractor;
  private final DatasetFileWriter writer;

  public ImportAggregator(RowAssetExtractor extractor, DatasetFileWriter writer) {
    this.extractor = extractor;
    this.writer = writer;
  }

  /// @param rows the decoded rows, consumed once
  /// @param expectedRows the row count, for progress messages only
  /// @return the finished summary
  public ImportSummary run(Iterator<TableRow> rows, long expectedRows) {
    ImportOutcome outcome = new ImportOutcome();
    long rowIndex = 0;
    logger.info("importing {} rows", expectedRows);
    while (rows.hasNext()) {
      TableRow row = rows.next();
      rowIndex++;
      RowOutcome result = processRow(rowIndex, row);
      outcome.record(result);
      if (rowIndex % PROGRESS_INTERVAL == 0) {
        logger.info("{}/{} rows: {} imported, {} skipped, {} errors",
            rowIndex, expectedRows, outcome.getImported(), outcome.getSkipped(), outcome.getErrorCount());
      }
    }
    ImportSummary summary = outcome.finish();
    logger.info("import finished: {} imported, {} skipped, {} errors",
        summary.imported(), summary.skipped(), summary.errors().size());
    return summary;
  }

  /// @param rowIndex the 1-based index of the row
  /// @param row the row
  /// @return what happened to the row, never throws for row level faults
  RowOutcome processRow(long rowIndex, TableRow row) {
    try {
      Extraction extraction = extractor.extract(row);
      if (extraction.isSkipped()) {
        logger.debug("row {} skipped: {}", rowIndex, extraction.skipReason());
        return new RowOutcome.Skipped(rowIndex, extraction.skipReason());
      }
      Path written = writer.write(extraction.asset());
      return new RowOutcome.Imported(rowIndex, written);
    } catch (RuntimeException e) {
      String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
      logger.debug("row {} failed: {}", rowIndex, message);
      return new RowOutcome.Failed(rowIndex, message);
    }
  }
}
