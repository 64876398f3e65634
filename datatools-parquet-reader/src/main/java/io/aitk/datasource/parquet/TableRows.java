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

import io.aitk.ingest.api.TableRow;
import io.aitk.ingest.api.errors.DecodeException;
import org.apache.parquet.column.page.PageReadStore;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.example.data.simple.convert.GroupRecordConverter;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.io.ColumnIOFactory;
import org.apache.parquet.io.MessageColumnIO;
import org.apache.parquet.io.RecordReader;
import org.apache.parquet.schema.MessageType;

import java.io.IOException;
import java.util.Iterator;
import java.util.NoSuchElementException;

/// A single forward pass over the rows of a parquet file.
///
/// Row groups are read one at a time, so only the current row group's pages are held in
/// memory. The total count is known up front from the footer. The sequence cannot be
/// restarted; open the file again for a second pass.
public class TableRows implements Iterator<TableRow>, AutoCloseable {

  private final ParquetFileReader fileReader;
  private final MessageType schema;
  private final MessageColumnIO columnIO;
  private final ParquetTableInfo info;
  private final GroupRowConverter converter = new GroupRowConverter();

  private RecordReader<Group> recordReader;
  private long remainingInGroup;
  private long consumed;
  private boolean closed;

  TableRows(ParquetFileReader fileReader, ParquetTableInfo info) {
    this.fileReader = fileReader;
    this.schema = fileReader.getFooter().getFileMetaData().getSchema();
    this.columnIO = new ColumnIOFactory().getColumnIO(schema);
    this.info = info;
  }

  /// @return the number of rows in the table
  public long rowCount() {
    return info.rowCount();
  }

  /// @return footer facts about the table
  public ParquetTableInfo info() {
    return info;
  }

  @Override
  public boolean hasNext() {
    return !closed && consumed < info.rowCount();
  }

  /// @return the next row
  /// @throws DecodeException if the row's pages cannot be read or decoded
  @Override
  public TableRow next() {
    if (!hasNext()) {
      throw new NoSuchElementException("all " + consumed + " rows have been read");
    }
    try {
      if (remainingInGroup == 0) {
        advanceRowGroup();
      }
      Group group = recordReader.read();
      remainingInGroup--;
      consumed++;
      return converter.convert(group);
    } catch (IOException | RuntimeException e) {
      if (e instanceof DecodeException decodeException) {
        throw decodeException;
      }
      throw new DecodeException("Failed to decode parquet row " + (consumed + 1) + " of " + info.rowCount(), e);
    }
  }

  private void advanceRowGroup() throws IOException {
    PageReadStore pages = fileReader.readNextRowGroup();
    if (pages == null) {
      throw new DecodeException("Parquet file ended after " + consumed + " of " + info.rowCount() + " rows");
    }
    recordReader = columnIO.getRecordReader(pages, new GroupRecordConverter(schema));
    remainingInGroup = pages.getRowCount();
  }

  @Override
  public void close() throws IOException {
    if (!closed) {
      closed = true;
      fileReader.close();
    }
  }
}
