/// Data model shared by the hub ingestion pipeline.
///
/// A run turns a [io.aitk.ingest.api.RemoteReference] into a
/// [io.aitk.ingest.api.FetchResult], decodes it into [io.aitk.ingest.api.TableRow]s,
/// derives one [io.aitk.ingest.api.ExtractedAsset] or [io.aitk.ingest.api.RowOutcome]
/// per row, and ends with an [io.aitk.ingest.api.ImportSummary].
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

