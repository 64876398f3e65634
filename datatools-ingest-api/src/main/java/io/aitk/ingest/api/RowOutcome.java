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

import java.nio.file.Path;

/// What happened to a single table row during an import.
public sealed interface RowOutcome permits RowOutcome.Imported, RowOutcome.Skipped, RowOutcome.Failed {

  /// @return the 1-based index of the row
  long rowIndex();

  /// The row's image and caption were written.
  /// @param rowIndex the 1-based row index
  /// @param imagePath the absolute path of the written image
  record Imported(long rowIndex, Path imagePath) implements RowOutcome {}

  /// The row carried no image to import.
  /// @param rowIndex the 1-based row index
  /// @param reason why no image was available
  record Skipped(long rowIndex, String reason) implements RowOutcome {}

  /// The row could not be imported.
  /// @param rowIndex the 1-based row index
  /// @param message the failure message reported in the import summary
  record Failed(long rowIndex, String message) implements RowOutcome {}
}
