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

import java.util.Objects;

/// A file inside a hub repository at a given revision.
///
/// @param repoId the repository id, always of the form `org/name`
/// @param revision the branch, tag or commit, `main` unless stated
/// @param filePath the path of the file inside the repository, without a leading slash
/// @param repoKind the repository namespace, possibly [RepoKind#AUTO]
public record RemoteReference(String repoId, String revision, String filePath, RepoKind repoKind) {

  /// the revision used when none is given
  public static final String DEFAULT_REVISION = "main";

  public RemoteReference {
    Objects.requireNonNull(repoId, "repoId");
    Objects.requireNonNull(filePath, "filePath");
    Objects.requireNonNull(repoKind, "repoKind");
    int slash = repoId.indexOf('/');
    if (slash <= 0 || slash != repoId.lastIndexOf('/') || slash == repoId.length() - 1) {
      throw new IllegalArgumentException("repoId must have the form org/name, got '" + repoId + "'");
    }
    if (revision == null || revision.isBlank()) {
      revision = DEFAULT_REVISION;
    }
    if (filePath.isBlank()) {
      throw new IllegalArgumentException("filePath must not be empty");
    }
  }

  /// A reference to another file in the same repository, revision and namespace.
  /// @param path the repository relative path of the other file
  /// @return the sibling reference
  public RemoteReference forPath(String path) {
    String relative = path.startsWith("/") ? path.substring(1) : path;
    return new RemoteReference(repoId, revision, relative, repoKind);
  }

  /// @param kind the namespace to pin
  /// @return this reference with the given namespace
  public RemoteReference withKind(RepoKind kind) {
    return new RemoteReference(repoId, revision, filePath, kind);
  }

  @Override
  public String toString() {
    return repoKind.label() + ":" + repoId + "@" + revision + "/" + filePath;
  }
}
