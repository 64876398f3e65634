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

/// An image and its caption, taken from one table row and ready to be written.
///
/// @param imageBytes the encoded image
/// @param caption the caption text, empty when the row has none
/// @param suggestedBaseName the file name without extension, not yet sanitized
/// @param suggestedExtension the file extension without a leading dot, not yet sanitized
public record ExtractedAsset(
    byte[] imageBytes,
    String caption,
    String suggestedBaseName,
    String suggestedExtension)
{
  @Override
  public String toString() {
    return "ExtractedAsset{" +
           "bytes=" + imageBytes.length +
           ", baseName='" + suggestedBaseName + '\'' +
           ", extension='" + suggestedExtension + '\'' +
           '}';
  }
}
