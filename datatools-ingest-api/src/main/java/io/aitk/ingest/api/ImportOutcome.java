package io.aitk.ingest.api;

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

import java.util.ArrayList;
import java.util.List;

/// Running tallies for one import run.
///
/// An outcome is created empty when a run starts, is updated once per row by the
/// aggregator that owns it, and is finalized exactly once into an [ImportSummary].
public class ImportOutcome {

  private int imported;
  private int skipped;
  private final List<RowError> errors = new ArrayList<>();
  private boolean finished;

  /// Count a row outcome.
  /// @param outcome the outcome of one row
  public void record(RowOutcome outcome) {
    ensureOpen();
    if (outcome instanceof RowOutcome.Imported) {
      imported++;
    } else if (outcome instanceof RowOutcome.Skipped) {
      skipped++;
    } else if (outcome instanceof RowOutcome.Failed failed) {
      errors.add(new RowError(failed.rowIndex(), failed.message()));
    }
  }

  public int getImported() {
    return imported;
  }

  public int getSkipped() {
    return skipped;
  }

  public int getErrorCount() {
    return errors.size();
  }

  /// Finalize the tallies.
  /// @return the immutable summary
  /// @throws IllegalStateException if the outcome was already finished
  public ImportSummary finish() {
    ensureOpen();
    finished = true;
    return new ImportSummary(imported, skipped, errors);
  }

  private void ensureOpen() {
    if (finished) {
      throw new IllegalStateException("import outcome already finished");
    }
  }
}
