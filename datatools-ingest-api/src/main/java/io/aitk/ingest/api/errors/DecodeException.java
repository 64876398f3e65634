package io.aitk.ingest.api.errors;

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

/// Thrown when a validated parquet buffer cannot be decoded as a whole, either in process
/// or in a forked import worker. Rows are never partially recovered.
public class DecodeException extends HubImportException {

  private final String workerOutput;

  /// @param message what failed
  public DecodeException(String message) {
    super(message);
    this.workerOutput = "";
  }

  /// @param message what failed
  /// @param cause the underlying failure
  public DecodeException(String message, Throwable cause) {
    super(message, cause);
    this.workerOutput = "";
  }

  /// @param message what failed
  /// @param workerOutput the diagnostic output of a forked worker, possibly empty
  public DecodeException(String message, String workerOutput) {
    super(workerOutput == null || workerOutput.isBlank() ? message : message + ": " + workerOutput.strip());
    this.workerOutput = workerOutput == null ? "" : workerOutput;
  }

  /// @return the diagnostic output of a forked worker, empty for in-process failures
  public String getWorkerOutput() {
    return workerOutput;
  }
}
