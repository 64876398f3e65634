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

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class RemoteReferenceTest {

  @Test
  public void testBlankRevisionDefaultsToMain() {
    RemoteReference ref = new RemoteReference("org/repo", " ", "data/train.parquet", RepoKind.AUTO);
    assertEquals("main", ref.revision());
  }

  @Test
  public void testRepoIdNeedsExactlyOneSlash() {
    assertThrows(IllegalArgumentException.class,
        () -> new RemoteReference("repo", "main", "a.parquet", RepoKind.AUTO));
    assertThrows(IllegalArgumentException.class,
        () -> new RemoteReference("org/repo/extra", "main", "a.parquet", RepoKind.AUTO));
    assertThrows(IllegalArgumentException.class,
        () -> new RemoteReference("org/", "main", "a.parquet", RepoKind.AUTO));
  }

  @Test
  public void testSiblingKeepsRepoRevisionAndKind() {
    RemoteReference ref = new RemoteReference("org/repo", "v2", "data/train.parquet", RepoKind.DATASETS);
    RemoteReference sibling = ref.forPath("/imgs/dog.png");
    assertEquals(new RemoteReference("org/repo", "v2", "imgs/dog.png", RepoKind.DATASETS), sibling);
  }

  @Test
  public void testAutoTriesDatasetsFirst() {
    assertEquals(List.of(RepoKind.DATASETS, RepoKind.MODELS), RepoKind.AUTO.candidates());
    assertEquals(List.of(RepoKind.MODELS), RepoKind.MODELS.candidates());
    assertEquals(RepoKind.DATASETS, RepoKind.fromLabel("Datasets"));
  }
}
