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

import java.util.List;

/// Footer level facts about a parquet table, known before any row is read.
///
/// @param rowCount the total number of rows over all row groups
/// @param rowGroups the number of row groups
/// @param columns the top level column names, in schema order
public record ParquetTableInfo(long rowCount, int rowGroups, List<String> columns) {

  public ParquetTableInfo {
    if (rowCount < 0) {
      throw new IllegalArgumentException("Total rows cannot be negative: " + rowCount);
    }
    columns = List.copyOf(columns);
  }

  /// Get the row count as an int, checking for overflow
  /// @return the row count
  /// @throws IllegalStateException if the row count exceeds Integer.MAX_VALUE
  public int rowCountAsInt() {
    if (rowCount > Integer.MAX_VALUE) {
      throw new IllegalStateException("int overflow on long size: " + rowCount);
    }
    return (int) rowCount;
  }
}
