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

import io.aitk.ingest.api.FetchAttempt;

import java.util.List;

/// Thrown when every URL tried for a hub file failed.
public class RemoteFetchException extends HubImportException {

  private final List<FetchAttempt> attempts;

  /// @param message the summary line
  /// @param attempts every attempt made, in order
  public RemoteFetchException(String message, List<FetchAttempt> attempts) {
    super(formatMessage(message, attempts));
    this.attempts = List.copyOf(attempts);
  }

  /// @return every attempt made, in order
  public List<FetchAttempt> getAttempts() {
    return attempts;
  }

  /// @return the status of the last attempt, or [FetchAttempt#NO_RESPONSE] if none was made
  public int getLastStatus() {
    return attempts.isEmpty() ? FetchAttempt.NO_RESPONSE : attempts.get(attempts.size() - 1).httpStatus();
  }

  private static String formatMessage(String message, List<FetchAttempt> attempts) {
    StringBuilder sb = new StringBuilder(message);
    if (!attempts.isEmpty()) {
      sb.append(" Tried:");
      for (FetchAttempt attempt : attempts) {
        sb.append('\n').append(attempt.describe());
      }
    }
    return sb.toString();
  }
}
