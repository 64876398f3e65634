package io.aitk.hubingest.pipeline;


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

import io.aitk.datasource.parquet.ParquetTableFixtures;
import io.aitk.datasource.parquet.ParquetTableFixtures.ImageRow;
import io.aitk.hubingest.config.HubImportConfig;
import io.aitk.hubingest.config.ImportMode;
import io.aitk.hubingest.settings.IngestSettings;
import io.aitk.ingest.api.ImportSummary;
import io.aitk.ingest.api.errors.InvalidContentException;
import io.aitk.ingest.api.errors.InvalidReferenceException;
import io.aitk.ingest.api.errors.RemoteFetchException;
import io.aitk.jetty.testserver.HubServerExtension;
import io.aitk.jetty.testserver.HubServerFixture;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ExtendWith(HubServerExtension.class)
public class HubParquetImporterTest {

  private static final byte[] JPEG = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, (byte) 0xE0, 0, 0x10, 'J', 'F', 'I', 'F'};
  private static final byte[] PNG = {(byte) 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A, 0, 0, 0, 0x0D};

  @TempDir
  Path tempDir;

  private static HubImportConfig config(HubServerFixture hub, ImportMode mode) {
    return HubImportConfig.builder().host(hub.getHost()).importMode(mode).build();
  }

  private static IngestSettings settings(Path root, String token) {
    return new IngestSettings() {
      @Override
      public Path datasetsRoot() {
        return root;
      }

      @Override
      public Optional<String> hubToken() {
        return Optional.ofNullable(token);
      }
    };
  }

  private byte[] catsTable() {
    Path file = ParquetTableFixtures.writeImageTable(tempDir.resolve("cats.parquet"),
        ParquetTableFixtures.IMAGE_CAPTION_SCHEMA, "caption", List.of(
            ImageRow.embedded(JPEG, "a cat"),
            ImageRow.pathOnly("imgs/dog.png", null)));
    return ParquetTableFixtures.bytesOf(file);
  }

  private static String md5Hex(byte[] data) throws NoSuchAlgorithmException {
    return String.format("%032x", new BigInteger(1, MessageDigest.getInstance("MD5").digest(data)));
  }

  @ParameterizedTest
  @EnumSource(ImportMode.class)
  public void testCatsExample(ImportMode mode, HubServerFixture hub) throws Exception {
    hub.hostDataset("acme/cats", "main", "data/train.parquet", catsTable());
    hub.hostDataset("acme/cats", "main", "imgs/dog.png", PNG);
    Path datasetDir = tempDir.resolve("data/cats");

    ImportSummary summary;
    try (HubParquetImporter importer = new HubParquetImporter(config(hub, mode), settings(tempDir, null))) {
      summary = importer.importInto(datasetDir, "acme/cats/data/train.parquet", null);
    }

    assertEquals(new ImportSummary(2, 0, List.of()), summary);
    String hash = md5Hex(JPEG);
    assertArrayEquals(JPEG, Files.readAllBytes(datasetDir.resolve(hash + ".jpg")));
    assertEquals("a cat", Files.readString(datasetDir.resolve(hash + ".txt")));
    assertArrayEquals(PNG, Files.readAllBytes(datasetDir.resolve("dog.png")));
    assertEquals("", Files.readString(datasetDir.resolve("dog.txt")));
    assertTrue(hub.getRequests().stream().noneMatch(r -> r.authenticated()));
    assertTrue(hub.getRequests().stream()
        .anyMatch(r -> r.path().equals("/datasets/acme/cats/resolve/main/imgs/dog.png")));
    assertTrue(hub.getRequests().stream().noneMatch(r -> r.path().startsWith("/acme/")),
        "images are fetched from the namespace that served the table");
  }

  @Test
  public void testGzipTableIsAccepted(HubServerFixture hub) throws IOException {
    hub.hostDataset("acme/cats", "main", "train.parquet", catsTable()).gzipEncoded();
    hub.hostDataset("acme/cats", "main", "imgs/dog.png", PNG);

    try (HubParquetImporter importer =
             new HubParquetImporter(config(hub, ImportMode.IN_PROCESS), settings(tempDir, null)))
    {
      ImportSummary summary = importer.importInto(tempDir.resolve("out"), "datasets/acme/cats/train.parquet", null);
      assertEquals(2, summary.imported());
    }
  }

  @Test
  public void testGzipLabelledOnlyByTypeOrNotAtAllIsAccepted(HubServerFixture hub) throws IOException {
    byte[] table = catsTable();
    hub.hostDataset("acme/typed", "main", "train.parquet", table).gzipContentType();
    hub.hostDataset("acme/typed", "main", "imgs/dog.png", PNG);
    hub.hostDataset("acme/bare", "main", "train.parquet", table).gzipUndeclared();
    hub.hostDataset("acme/bare", "main", "imgs/dog.png", PNG);

    try (HubParquetImporter importer =
             new HubParquetImporter(config(hub, ImportMode.IN_PROCESS), settings(tempDir, null)))
    {
      assertEquals(new ImportSummary(2, 0, List.of()),
          importer.importInto(tempDir.resolve("typed"), "acme/typed/train.parquet", null));
      assertEquals(new ImportSummary(2, 0, List.of()),
          importer.importInto(tempDir.resolve("bare"), "acme/bare/train.parquet", null));
    }
  }

  @Test
  public void testLfsPointerIsInvalidContent(HubServerFixture hub) throws IOException {
    hub.hostDataset("acme/cats", "main", "train.parquet",
        "version https://git-lfs.github.com/spec/v1\noid sha256:abc\nsize 10\n".getBytes(StandardCharsets.UTF_8));
    Path datasetDir = tempDir.resolve("out");

    try (HubParquetImporter importer =
             new HubParquetImporter(config(hub, ImportMode.IN_PROCESS), settings(tempDir, null)))
    {
      InvalidContentException e = assertThrows(InvalidContentException.class,
          () -> importer.importInto(datasetDir, "acme/cats/train.parquet", null));
      assertEquals(List.of(InvalidContentException.Hint.LFS_POINTER), e.getHints());
    }
    assertFalse(Files.exists(datasetDir));
  }

  @Test
  public void testFatalErrorsBeforeDownload(HubServerFixture hub) throws IOException {
    try (HubParquetImporter importer =
             new HubParquetImporter(config(hub, ImportMode.IN_PROCESS), settings(tempDir, null)))
    {
      assertThrows(InvalidReferenceException.class, () -> importer.importInto(tempDir, "acme/cats/readme.md", null));
      assertTrue(hub.getRequests().isEmpty());

      RemoteFetchException missing = assertThrows(RemoteFetchException.class,
          () -> importer.importInto(tempDir, "acme/cats/missing.parquet", null));
      assertEquals(4, missing.getAttempts().size());

      IllegalArgumentException noReference =
          assertThrows(IllegalArgumentException.class, () -> importer.importInto(tempDir, " ", null));
      assertEquals("reference is required", noReference.getMessage());
      IllegalArgumentException noName =
          assertThrows(IllegalArgumentException.class, () -> importer.importDataset("", "acme/cats/a.parquet"));
      assertEquals("datasetName is required", noName.getMessage());
    }
  }

  @Test
  public void testImportDatasetReadsSettingsEveryRun(HubServerFixture hub) throws IOException {
    hub.hostDataset("acme/private", "main", "train.parquet", catsTable()).requireToken("hf_secret");
    hub.hostDataset("acme/private", "main", "imgs/dog.png", PNG).requireToken("hf_secret");
    AtomicInteger tokenReads = new AtomicInteger();
    IngestSettings settings = new IngestSettings() {
      @Override
      public Path datasetsRoot() {
        return tempDir.resolve("datasets");
      }

      @Override
      public Optional<String> hubToken() {
        tokenReads.incrementAndGet();
        return Optional.of("hf_secret");
      }
    };

    try (HubParquetImporter importer = new HubParquetImporter(config(hub, ImportMode.IN_PROCESS), settings)) {
      assertEquals(2, importer.importDataset("pets", "acme/private/train.parquet").imported());
      ImportSummary again = importer.importDataset("pets", "acme/private/train.parquet");
      assertEquals(2, again.imported());
    }

    assertEquals(2, tokenReads.get());
    assertTrue(Files.exists(tempDir.resolve("datasets/pets/dog_1.png")));
    assertThat(hub.getRequests()).allMatch(r -> "Bearer hf_secret".equals(r.authorization()));
  }
}
