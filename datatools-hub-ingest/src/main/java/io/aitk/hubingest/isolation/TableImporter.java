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

import io.aitk.ingest.api.ImportSummary;
import io.aitk.ingest.api.RemoteReference;

import java.nio.file.Path;

/// Decodes a validated parquet buffer and imports its rows into a dataset directory.
public interface TableImporter {

  /// @param parquet a buffer that passed content validation
  /// @param reference where the buffer came from, used to fetch images rows name by path
  /// @param token the access token for those fetches, possibly null
  /// @param datasetDir the directory to write into
  /// @return the summary of the run
  /// @throws io.aitk.ingest.api.errors.DecodeException when the buffer cannot be decoded
  ImportSummary importTable(byte[] parquet, RemoteReference reference, String token, Path datasetDir);
}
