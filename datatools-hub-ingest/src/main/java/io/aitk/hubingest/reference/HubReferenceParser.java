package io.aitk.hubingest.reference;


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

import io.aitk.ingest.api.RemoteReference;
import io.aitk.ingest.api.RepoKind;
import io.aitk.ingest.api.errors.InvalidReferenceException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/// Parses the loose ways people paste a parquet location into a [RemoteReference].
///
/// Accepted shapes, all naming the same file:
/// ```
/// org/repo/data/train.parquet
/// org/repo@main/data/train.parquet
/// datasets/org/repo/data/train.parquet
/// https://huggingface.co/datasets/org/repo/resolve/main/data/train.parquet
/// ```
/// Bare and `@` shapes leave the namespace as [RepoKind#AUTO]. A `datasets/` prefix pins
/// [RepoKind#DATASETS]. A resolve or blob URL without that prefix is a model repository.
public class HubReferenceParser {

  private static final Pattern HOST_PREFIX =
      Pattern.compile("^https?://(www\\.)?huggingface\\.co/", Pattern.CASE_INSENSITIVE);
  private static final String DATASETS_PREFIX = "datasets";
  private static final String PARQUET_SUFFIX = ".parquet";

  /// @param input the user supplied reference
  /// @return the parsed reference
  /// @throws InvalidReferenceException with a message fit to show the user
  public RemoteReference parse(String input) {
    if (input == null || input.isBlank()) {
      throw new InvalidReferenceException("Reference is empty. Expected org/repo/path/to/file.parquet.", input);
    }
    String trimmed = input.trim();
    if (HOST_PREFIX.matcher(trimmed).find()) {
      trimmed = stripQuery(HOST_PREFIX.matcher(trimmed).replaceFirst(""));
    }
    List<String> segments = segments(trimmed);
    if (segments.size() < 3) {
      throw new InvalidReferenceException(
          "Invalid reference '" + input.trim() + "'. Expected org/repo/path/to/file.parquet, "
          + "org/repo@revision/path/to/file.parquet or a huggingface.co resolve URL.", input);
    }

    int i = 0;
    RepoKind pinned = null;
    if (DATASETS_PREFIX.equals(segments.get(0))) {
      pinned = RepoKind.DATASETS;
      i = 1;
    }

    String org;
    String repo;
    String revision;
    String filePath;
    RepoKind kind;
    if (segments.size() > i + 2 && isFileRoute(segments.get(i + 2))) {
      if (segments.size() < i + 5) {
        throw new InvalidReferenceException(
            "Invalid hub URL '" + input.trim() + "'. Expected .../org/repo/resolve/revision/path/to/file.parquet.",
            input);
      }
      org = segments.get(i);
      repo = segments.get(i + 1);
      revision = segments.get(i + 3);
      filePath = String.join("/", segments.subList(i + 4, segments.size()));
      kind = pinned != null ? pinned : RepoKind.MODELS;
    } else {
      if (segments.size() < i + 3) {
        throw new InvalidReferenceException(
            "Invalid reference '" + input.trim() + "'. Expected datasets/org/repo/path/to/file.parquet.", input);
      }
      org = segments.get(i);
      String repoAndRevision = segments.get(i + 1);
      String[] parts = repoAndRevision.split("@", -1);
      if (parts.length > 2) {
        throw new InvalidReferenceException(
            "Invalid revision syntax in '" + repoAndRevision + "'. Use org/repo@revision/path/to/file.parquet.",
            input);
      }
      repo = parts[0];
      revision = parts.length == 2 ? parts[1] : "";
      filePath = String.join("/", segments.subList(i + 2, segments.size()));
      kind = pinned != null ? pinned : RepoKind.AUTO;
    }

    if (org.isEmpty() || repo.isEmpty()) {
      throw new InvalidReferenceException("Invalid repository in '" + input.trim() + "'. Expected org/repo.", input);
    }
    if (!filePath.toLowerCase(Locale.ROOT).endsWith(PARQUET_SUFFIX)) {
      throw new InvalidReferenceException(
          "Reference must point to a .parquet file, got '" + filePath + "'.", input);
    }
    if (revision.isEmpty()) {
      revision = RemoteReference.DEFAULT_REVISION;
    }
    return new RemoteReference(org + "/" + repo, revision, filePath, kind);
  }

  private static String stripQuery(String url) {
    int end = url.length();
    int query = url.indexOf('?');
    int fragment = url.indexOf('#');
    if (query >= 0) {
      end = query;
    }
    if (fragment >= 0 && fragment < end) {
      end = fragment;
    }
    return url.substring(0, end);
  }

  private static boolean isFileRoute(String segment) {
    return "resolve".equals(segment) || "blob".equals(segment);
  }

  private static List<String> segments(String path) {
    List<String> segments = new ArrayList<>();
    for (String segment : path.split("/")) {
      if (!segment.isEmpty()) {
        segments.add(segment);
      }
    }
    return segments;
  }
}
