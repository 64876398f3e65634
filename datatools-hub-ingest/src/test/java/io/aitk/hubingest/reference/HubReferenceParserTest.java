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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class HubReferenceParserTest {

  private final HubReferenceParser parser = new HubReferenceParser();

  @Test
  public void testAllShapesNameTheSameFile() {
    RemoteReference bare = parser.parse("acme/cats/data/train.parquet");
    RemoteReference pinnedRevision = parser.parse("acme/cats@main/data/train.parquet");
    RemoteReference prefixed = parser.parse("datasets/acme/cats/data/train.parquet");
    RemoteReference url = parser.parse("https://huggingface.co/datasets/acme/cats/resolve/main/data/train.parquet");

    RemoteReference expected = new RemoteReference("acme/cats", "main", "data/train.parquet", RepoKind.AUTO);
    assertEquals(expected, bare);
    assertEquals(expected, pinnedRevision);
    assertEquals(expected.withKind(RepoKind.DATASETS), prefixed);
    assertEquals(expected.withKind(RepoKind.DATASETS), url);
    assertEquals(bare.withKind(RepoKind.DATASETS), prefixed);
  }

  @Test
  public void testModelUrlsAndRevisions() {
    RemoteReference model = parser.parse("http://www.huggingface.co/acme/vit/blob/v1.0/sample.parquet");
    assertEquals(new RemoteReference("acme/vit", "v1.0", "sample.parquet", RepoKind.MODELS), model);

    RemoteReference withQuery =
        parser.parse("  https://huggingface.co/datasets/acme/cats/resolve/dev/a/b/c.PARQUET?download=true ");
    assertEquals("dev", withQuery.revision());
    assertEquals("a/b/c.PARQUET", withQuery.filePath());
    assertEquals(RepoKind.DATASETS, withQuery.repoKind());
  }

  @Test
  public void testEmptyRevisionHalvesKeepDefaults() {
    RemoteReference reference = parser.parse("acme/cats@/train.parquet");
    assertEquals("cats", reference.repoId().split("/")[1]);
    assertEquals(RemoteReference.DEFAULT_REVISION, reference.revision());

    RemoteReference doubled = parser.parse("acme//cats@v2//train.parquet");
    assertEquals("acme/cats", doubled.repoId());
    assertEquals("v2", doubled.revision());
  }

  @ParameterizedTest
  @ValueSource(strings = {
      "",
      "   ",
      "acme/cats",
      "acme/cats/readme.md",
      "acme/cats@a@b/train.parquet",
      "datasets/acme/cats",
      "https://huggingface.co/datasets/acme/cats/resolve/main",
      "acme/@v1/train.parquet"
  })
  public void testRejectsMalformedReferences(String input) {
    InvalidReferenceException e = assertThrows(InvalidReferenceException.class, () -> parser.parse(input));
    assertThat(e.getMessage()).isNotBlank();
  }

  @Test
  public void testMessagesNameTheProblem() {
    InvalidReferenceException notParquet =
        assertThrows(InvalidReferenceException.class, () -> parser.parse("acme/cats/data/train.csv"));
    assertThat(notParquet.getMessage()).contains(".parquet").contains("data/train.csv");
    assertEquals("acme/cats/data/train.csv", notParquet.getInput());

    InvalidReferenceException revision =
        assertThrows(InvalidReferenceException.class, () -> parser.parse("acme/cats@a@b/train.parquet"));
    assertThat(revision.getMessage()).contains("revision");
  }
}
