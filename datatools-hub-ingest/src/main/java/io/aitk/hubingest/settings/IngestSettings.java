package io.aitk.hubingest.settings;


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
import java.util.Optional;

/// The user settings an import reads. Implementations are consulted on every run, so a
/// changed token takes effect without a restart.
public interface IngestSettings {

  /// @return the directory that holds one subdirectory per dataset
  Path datasetsRoot();

  /// @return the hub access token, if one is configured
  Optional<String> hubToken();
}
