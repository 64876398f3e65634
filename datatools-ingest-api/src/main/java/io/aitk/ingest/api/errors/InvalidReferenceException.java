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

/// Thrown when a hub reference string cannot be understood. The message is shown to the
/// user verbatim.
public class InvalidReferenceException extends HubImportException {

  private final String input;

  /// @param message what is wrong and which shape was expected
  /// @param input the reference string as given
  public InvalidReferenceException(String message, String input) {
    super(message);
    this.input = input;
  }

  /// @return the reference string as given
  public String getInput() {
    return input;
  }
}
