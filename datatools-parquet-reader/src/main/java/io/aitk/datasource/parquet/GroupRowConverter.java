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
import org.apache.parquet.example.data.Group;
import org.apache.parquet.schema.GroupType;
import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.PrimitiveType;
import org.apache.parquet.schema.Type;

import java.util.ArrayList;
import java.util.List;

/// Converts example-model parquet [Group] records into [TableRow]s.
///
/// - binary columns annotated as string, enum or json become `String`
/// - other binary, fixed length and int96 columns become `byte[]`
/// - numeric and boolean columns become their boxed Java values
/// - struct columns become nested [TableRow]s
/// - repeated fields and `LIST` annotated groups become `List<Object>`
/// - absent optional values become `null`
public class GroupRowConverter {

  /// Convert one record.
  /// @param group the record, as produced by a `GroupRecordConverter`
  /// @return the row, with columns in schema order
  public TableRow convert(Group group) {
    GroupType type = group.getType();
    TableRow row = new TableRow();
    for (int field = 0; field < type.getFieldCount(); field++) {
      Type fieldType = type.getType(field);
      int count = group.getFieldRepetitionCount(field);
      if (fieldType.isRepetition(Type.Repetition.REPEATED)) {
        List<Object> items = new ArrayList<>(count);
        for (int index = 0; index < count; index++) {
          items.add(value(group, field, index, fieldType));
        }
        row.put(fieldType.getName(), items);
      } else {
        row.put(fieldType.getName(), count == 0 ? null : value(group, field, 0, fieldType));
      }
    }
    return row;
  }

  private Object value(Group group, int field, int index, Type type) {
    if (!type.isPrimitive()) {
      Group nested = group.getGroup(field, index);
      if (type.getLogicalTypeAnnotation() instanceof LogicalTypeAnnotation.ListLogicalTypeAnnotation) {
        return listValues(nested);
      }
      return convert(nested);
    }
    PrimitiveType primitive = type.asPrimitiveType();
    return switch (primitive.getPrimitiveTypeName()) {
      case BINARY, FIXED_LEN_BYTE_ARRAY -> isText(primitive)
          ? group.getBinary(field, index).toStringUsingUTF8()
          : group.getBinary(field, index).getBytes();
      case INT96 -> group.getInt96(field, index).getBytes();
      case INT32 -> group.getInteger(field, index);
      case INT64 -> group.getLong(field, index);
      case BOOLEAN -> group.getBoolean(field, index);
      case FLOAT -> group.getFloat(field, index);
      case DOUBLE -> group.getDouble(field, index);
    };
  }

  // LIST groups wrap a single repeated field, either the element itself (2-level) or a
  // group holding one element field (3-level)
  private List<Object> listValues(Group listGroup) {
    Type repeated = listGroup.getType().getType(0);
    int count = listGroup.getFieldRepetitionCount(0);
    List<Object> items = new ArrayList<>(count);
    for (int index = 0; index < count; index++) {
      if (repeated.isPrimitive()) {
        items.add(value(listGroup, 0, index, repeated));
        continue;
      }
      Group entry = listGroup.getGroup(0, index);
      GroupType entryType = entry.getType();
      if (entryType.getFieldCount() == 1) {
        items.add(entry.getFieldRepetitionCount(0) == 0 ? null : value(entry, 0, 0, entryType.getType(0)));
      } else {
        items.add(convert(entry));
      }
    }
    return items;
  }

  private boolean isText(PrimitiveType primitive) {
    LogicalTypeAnnotation annotation = primitive.getLogicalTypeAnnotation();
    return annotation instanceof LogicalTypeAnnotation.StringLogicalTypeAnnotation
           || annotation instanceof LogicalTypeAnnotation.EnumLogicalTypeAnnotation
           || annotation instanceof LogicalTypeAnnotation.JsonLogicalTypeAnnotation;
  }
}
