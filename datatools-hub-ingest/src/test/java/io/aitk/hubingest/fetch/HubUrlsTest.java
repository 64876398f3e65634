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

import io.aitk.ingest.api.RemoteReference;
import io.aitk.ingest.api.RepoKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class HubUrlsTest {

  private static final String HOST = "https://huggingface.co";

  @Test
  public void testDatasetAndModelLayouts() {
    RemoteReference reference = new RemoteReference("acme/cats", "main", "data/train.parquet", RepoKind.AUTO);
    assertEquals("https://huggingface.co/datasets/acme/cats/resolve/main/data/train.parquet",
        HubUrls.resolveUrl(HOST, reference, RepoKind.DATASETS));
    assertEquals("https://huggingface.co/acme/cats/resolve/main/data/train.parquet",
        HubUrls.resolveUrl(HOST, reference, RepoKind.MODELS));
    assertThrows(IllegalArgumentException.class, () -> HubUrls.resolveUrl(HOST, reference, RepoKind.AUTO));
  }

  @Test
  public void testSegmentsAreEncodedIndividually() {
    RemoteReference reference =
        new RemoteReference("acme/cats", "refs/convert/parquet", "my data/part #1.parquet", RepoKind.DATASETS);
    assertEquals(
        "https://huggingface.co/datasets/acme/cats/resolve/refs%2Fconvert%2Fparquet/my%20data/part%20%231.parquet",
        HubUrls.resolveUrl(HOST, reference, RepoKind.DATASETS));
  }

  @Test
  public void testCandidatesAddDownloadFlag() {
    RemoteReference reference = new RemoteReference("acme/cats", "main", "train.parquet", RepoKind.DATASETS);
    List<String> candidates = HubUrls.candidates(HOST, reference, RepoKind.DATASETS);
    assertEquals(2, candidates.size());
    assertEquals(candidates.get(0) + "?download=true", candidates.get(1));
    assertEquals("https://x/a?b=1&download=true", HubUrls.withDownloadFlag("https://x/a?b=1"));
  }
}
