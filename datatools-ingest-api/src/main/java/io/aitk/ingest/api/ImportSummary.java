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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

import java.util.List;

/// The final result of an import run.
///
/// The JSON form is a single line, `{"imported":n,"skipped":n,"errors":[{"row":i,"error":"..."}]}`,
/// which is what a forked import worker prints and what the command line reports.
///
/// @param imported the number of rows written to the dataset directory
/// @param skipped the number of rows without an image
/// @param errors the failed rows, in row order
public record ImportSummary(
    @SerializedName("imported") int imported,
    @SerializedName("skipped") int skipped,
    @SerializedName("errors") List<RowError> errors)
{
  private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

  public ImportSummary {
    errors = errors == null ? List.of() : List.copyOf(errors);
  }

  /// @return the summary as one line of JSON
  public String toJson() {
    return GSON.toJson(this);
  }

  /// Parse a summary line.
  /// @param json the JSON text
  /// @return the summary
  /// @throws JsonParseException if the text is not a summary object
  public static ImportSummary fromJson(String json) {
    ImportSummary summary = GSON.fromJson(json, ImportSummary.class);
    if (summary == null) {
      throw new JsonParseException("empty import summary");
    }
    return summary;
  }
}
