package io.aitk.hubingest.rows;


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

/// Source of image files that a table row names by path instead of embedding.
@FunctionalInterface
public interface RemoteAssets {

  /// A source that has nothing, for tables read without a hub reference.
  RemoteAssets NONE = path -> null;

  /// @param path the path stored in the row, relative to the repository root
  /// @return the file bytes, or null when this source cannot provide files
  /// @throws RuntimeException when a fetch was attempted and failed
  byte[] fetch(String path);
}
