package io.aitk.hubingest.verify;


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

import io.aitk.hubingest.fetch.HubFileFetcher;
import io.aitk.hubingest.validate.ContentDecoding;
import io.aitk.hubingest.validate.ParquetContentValidator;
import io.aitk.ingest.api.FetchAttempt;
import io.aitk.ingest.api.FetchResult;
import io.aitk.ingest.api.errors.RemoteFetchException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/// Downloads one URL and reports whether a parquet file came back, for diagnosing hub
/// answers without running an import.
public class ParquetDownloadVerifier {
  private static final Logger logger = LogManager.getLogger(ParquetDownloadVerifier.class);

  private final HubFileFetcher fetcher;
  private final int previewLength;

  public ParquetDownloadVerifier(HubFileFetcher fetcher, int previewLength) {
    this.fetcher = fetcher;
    this.previewLength = previewLength;
  }

  /// @param url an absolute resolve URL
  /// @param token the access token, possibly null
  /// @return the report, also for failed requests
  public VerificationReport verify(String url, String token) {
    FetchResult result;
    try {
      result = fetcher.fetchUrl(url, token);
    } catch (RemoteFetchException e) {
      FetchAttempt attempt = e.getAttempts().get(e.getAttempts().size() - 1);
      logger.debug("verification request failed: {}", attempt.describe());
      return new VerificationReport(url, url, attempt.httpStatus(), null, null, 0, false, false, false,
          attempt.describe());
    }
    byte[] data = ContentDecoding.decode(result);
    boolean parquet = ParquetContentValidator.isParquet(data);
    return new VerificationReport(
        result.getRequestedUrl(),
        result.getFinalUrl(),
        result.getHttpStatus(),
        result.getContentType(),
        result.getContentEncoding(),
        data.length,
        parquet,
        !parquet && ParquetContentValidator.isHtml(data),
        !parquet && ParquetContentValidator.isLfsPointer(data),
        parquet ? "" : ParquetContentValidator.preview(data, previewLength));
  }
}
