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

import io.aitk.ingest.api.ExtractedAsset;

/// The result of looking for an asset in a row: either an asset, or the reason there is none.
///
/// @param asset the asset, or null when skipped
/// @param skipReason why the row has no asset, or null when found
public record Extraction(ExtractedAsset asset, String skipReason) {

  public static Extraction found(ExtractedAsset asset) {
    return new Extraction(asset, null);
  }

  public static Extraction skipped(String reason) {
    return new Extraction(null, reason);
  }

  public boolean isSkipped() {
    return asset == null;
  }
}
