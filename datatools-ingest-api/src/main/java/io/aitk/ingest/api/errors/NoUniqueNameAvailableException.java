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

import java.nio.file.Path;

/// Thrown when every numbered variant of a file name is already taken. This is a row
/// level fault and is recorded in the import summary rather than ending the run.
public class NoUniqueNameAvailableException extends RuntimeException {

  private final Path directory;
  private final String baseName;
  private final int attempts;

  /// @param directory the dataset directory
  /// @param baseName the sanitized base name
  /// @param attempts the number of names tried
  public NoUniqueNameAvailableException(Path directory, String baseName, int attempts) {
    super("Unable to find a unique filename for '" + baseName + "' in " + directory
          + " after " + attempts + " attempts");
    this.directory = directory;
    this.baseName = baseName;
    this.attempts = attempts;
  }

  public Path getDirectory() {
    return directory;
  }

  public String getBaseName() {
    return baseName;
  }

  public int getAttempts() {
    return attempts;
  }
}
