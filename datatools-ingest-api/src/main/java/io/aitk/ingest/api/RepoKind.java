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

import java.util.List;

/// The namespace of a hub repository.
///
/// Dataset repositories live under a `datasets/` prefix on the hub, model repositories
/// live at the root. [#AUTO] means the namespace was not stated by the user and has to be
/// discovered by trying both.
public enum RepoKind {
  /// dataset repositories, served under `{host}/datasets/{repoId}`
  DATASETS("datasets"),
  /// model repositories, served under `{host}/{repoId}`
  MODELS("models"),
  /// unknown, try [#DATASETS] then [#MODELS]
  AUTO("auto");

  private final String label;

  RepoKind(String label) {
    this.label = label;
  }

  /// @return the lower-case label used in command lines and log messages
  public String label() {
    return label;
  }

  /// The concrete kinds to try, in order, when resolving a reference of this kind.
  /// @return a singleton list for concrete kinds, or datasets then models for [#AUTO]
  public List<RepoKind> candidates() {
    if (this == AUTO) {
      return List.of(DATASETS, MODELS);
    }
    return List.of(this);
  }

  /// Parse a label, ignoring case.
  /// @param label one of `datasets`, `models`, `auto`
  /// @return the matching kind
  public static RepoKind fromLabel(String label) {
    for (RepoKind kind : values()) {
      if (kind.label.equalsIgnoreCase(label.trim())) {
        return kind;
      }
    }
    throw new IllegalArgumentException("Unknown repo kind '" + label + "', expected one of datasets, models, auto");
  }
}
