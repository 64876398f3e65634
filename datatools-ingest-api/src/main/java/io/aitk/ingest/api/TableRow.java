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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/// One decoded record of a table, or one struct value nested inside a record.
///
/// Columns keep their schema order. Values are one of `String`, `byte[]`, a boxed
/// number or boolean, a nested [TableRow] for struct columns, a `List<Object>` for
/// repeated columns, or `null` when the column has no value in this record.
public class TableRow {

  private final Map<String, Object> values;

  /// Creates an empty row.
  public TableRow() {
    this.values = new LinkedHashMap<>();
  }

  /// Creates a row holding a copy of the given values, in iteration order.
  /// @param values column values
  public TableRow(Map<String, ?> values) {
    this.values = new LinkedHashMap<>(values);
  }

  /// Set a column value.
  /// @param column the column name
  /// @param value the value, possibly null
  /// @return this row, for chaining
  public TableRow put(String column, Object value) {
    values.put(column, value);
    return this;
  }

  /// @param column the column name
  /// @return the value, or null when the column is absent or null
  public Object get(String column) {
    return values.get(column);
  }

  /// @param column the column name
  /// @return the nested struct value, or null when absent, null, or not a struct
  public TableRow getStruct(String column) {
    Object value = values.get(column);
    return value instanceof TableRow row ? row : null;
  }

  /// @param column the column name
  /// @return true if the column is present in this row, even with a null value
  public boolean hasColumn(String column) {
    return values.containsKey(column);
  }

  /// @return the column names in schema order
  public Set<String> columns() {
    return Collections.unmodifiableSet(values.keySet());
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("TableRow{");
    boolean first = true;
    for (Map.Entry<String, Object> e : values.entrySet()) {
      if (!first) {
        sb.append(", ");
      }
      first = false;
      sb.append(e.getKey()).append('=');
      Object v = e.getValue();
      if (v instanceof byte[] bytes) {
        sb.append("byte[").append(bytes.length).append(']');
      } else {
        sb.append(v);
      }
    }
    return sb.append('}').toString();
  }
}
