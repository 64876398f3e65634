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

/// Base type of the errors which end an import run.
///
/// Subtypes carry enough context (tried URLs, content previews, hints) for a user to
/// diagnose the problem from the message alone.
public abstract class HubImportException extends RuntimeException {

  /// @param message the user facing message
  protected HubImportException(String message) {
    super(message);
  }

  /// @param message the user facing message
  /// @param cause the underlying failure
  protected HubImportException(String message, Throwable cause) {
    super(message, cause);
  }
}
