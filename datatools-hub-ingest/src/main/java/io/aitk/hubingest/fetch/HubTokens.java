package io.aitk.hubingest.fetch;


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

import java.util.Optional;
import java.util.regex.Pattern;

/// Normalizes access tokens pasted from settings pages, shell exports and token files.
public final class HubTokens {

  private static final Pattern BEARER = Pattern.compile("^bearer(\\s+|$)", Pattern.CASE_INSENSITIVE);

  private HubTokens() {
  }

  /// Clean up a raw token value.
  ///
  /// Surrounding whitespace, a leading `Bearer ` and one pair of surrounding quotes are
  /// removed, and only the first whitespace delimited word is kept.
  /// @param raw the raw value, possibly null
  /// @return the token, or empty if nothing usable remains
  public static Optional<String> sanitize(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    String token = raw.trim();
    token = BEARER.matcher(token).replaceFirst("");
    if (token.length() >= 2) {
      char first = token.charAt(0);
      char last = token.charAt(token.length() - 1);
      if ((first == '"' || first == '\'') && first == last) {
        token = token.substring(1, token.length() - 1).trim();
      }
    }
    String[] words = token.split("\\s+");
    token = words.length == 0 ? "" : words[0];
    return token.isEmpty() ? Optional.empty() : Optional.of(token);
  }

  /// @param token a token
  /// @return a form safe for logs, keeping only a short prefix
  public static String redact(String token) {
    if (token == null || token.isEmpty()) {
      return "<none>";
    }
    int keep = Math.min(4, token.length() / 4);
    return token.substring(0, keep) + "***";
  }
}
