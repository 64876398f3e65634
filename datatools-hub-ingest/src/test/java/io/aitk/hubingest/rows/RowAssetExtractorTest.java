package io.aitk.hubingest.rows;


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

import io.aitk.hubingest.config.HubImportConfig;
import io.aitk.ingest.api.ExtractedAsset;
import io.aitk.ingest.api.TableRow;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RowAssetExtractorTest {

  private static final byte[] JPEG = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, (byte) 0xE0, 1, 2, 3};
  private static final byte[] PNG = {(byte) 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A, 7};

  private final HubImportConfig config = HubImportConfig.defaults();

  private static TableRow image(Object bytes, String path) {
    return new TableRow().put("bytes", bytes).put("path", path);
  }

  @Test
  public void testEmbeddedBytesAreNamedByHash() {
    RowAssetExtractor extractor = new RowAssetExtractor(config, RemoteAssets.NONE);
    Extraction extraction = extractor.extract(new TableRow().put("image", image(JPEG, null)).put("text", "a cat"));

    ExtractedAsset asset = extraction.asset();
    assertArrayEquals(JPEG, asset.imageBytes());
    assertEquals("a cat", asset.caption());
    assertEquals(RowAssetExtractor.md5Hex(JPEG), asset.suggestedBaseName());
    assertEquals(32, asset.suggestedBaseName().length());
    assertEquals("jpg", asset.suggestedExtension());
  }

  @Test
  public void testUnknownFormatFallsBackToJpg() {
    RowAssetExtractor extractor = new RowAssetExtractor(config, RemoteAssets.NONE);
    ExtractedAsset asset = extractor.extract(new TableRow().put("image", image(new byte[] {1, 2, 3, 4, 5}, null)))
        .asset();
    assertEquals("jpg", asset.suggestedExtension());
    assertEquals("", asset.caption());
  }

  @Test
  public void testCaptionLookupOrder() {
    RowAssetExtractor extractor = new RowAssetExtractor(config, RemoteAssets.NONE);
    TableRow bothColumns = new TableRow().put("image", image(PNG, null)).put("text", "from text").put("caption", "c");
    assertEquals("from text", extractor.extract(bothColumns).asset().caption());

    TableRow captionOnly = new TableRow().put("image", image(PNG, null)).put("text", null).put("caption", 12);
    assertEquals("12", extractor.extract(captionOnly).asset().caption());
  }

  @Test
  public void testEmptyTextColumnWinsOverCaption() {
    RowAssetExtractor extractor = new RowAssetExtractor(config, RemoteAssets.NONE);
    TableRow emptyText = new TableRow().put("image", image(PNG, null)).put("text", "").put("caption", "from caption");
    assertEquals("", extractor.extract(emptyText).asset().caption());
  }

  @Test
  public void testDataFieldAndTypedArrays() {
    RowAssetExtractor extractor = new RowAssetExtractor(config, RemoteAssets.NONE);
    TableRow dataField = new TableRow().put("image", new TableRow().put("data", ByteBuffer.wrap(PNG)));
    assertEquals("png", extractor.extract(dataField).asset().suggestedExtension());

    List<Integer> typed = new ArrayList<>();
    for (byte b : JPEG) {
      typed.add(b & 0xff);
    }
    TableRow typedArray = new TableRow().put("image", image(typed, null));
    assertArrayEquals(JPEG, extractor.extract(typedArray).asset().imageBytes());
  }

  @Test
  public void testPathHintNamesTheFile() {
    RowAssetExtractor extractor = new RowAssetExtractor(config, RemoteAssets.NONE);
    ExtractedAsset asset = extractor.extract(new TableRow().put("image", image(JPEG, "photos/tabby.cat.jpeg"))).asset();
    assertEquals("tabby.cat", asset.suggestedBaseName());
    assertEquals("jpeg", asset.suggestedExtension());
  }

  @Test
  public void testDotfilePathHintFallsBackToHash() {
    RowAssetExtractor extractor = new RowAssetExtractor(config, RemoteAssets.NONE);
    ExtractedAsset asset = extractor.extract(new TableRow().put("image", image(PNG, "imgs/.png"))).asset();
    assertEquals(RowAssetExtractor.md5Hex(PNG), asset.suggestedBaseName());
    assertEquals("png", asset.suggestedExtension());

    ExtractedAsset trailingDot = extractor.extract(new TableRow().put("image", image(PNG, "imgs/dog."))).asset();
    assertEquals("dog", trailingDot.suggestedBaseName());
    assertEquals("png", trailingDot.suggestedExtension());
  }

  @Test
  public void testPathOnlyRowsUseRemoteAssets() {
    List<String> fetched = new ArrayList<>();
    RowAssetExtractor extractor = new RowAssetExtractor(config, path -> {
      fetched.add(path);
      return PNG;
    });
    ExtractedAsset asset = extractor.extract(new TableRow().put("image", image(null, "imgs/dog.png"))).asset();

    assertEquals(List.of("imgs/dog.png"), fetched);
    assertArrayEquals(PNG, asset.imageBytes());
    assertEquals("dog", asset.suggestedBaseName());
    assertEquals("png", asset.suggestedExtension());

    ExtractedAsset fromString = extractor.extract(new TableRow().put("image", "imgs/noext")).asset();
    assertEquals("noext", fromString.suggestedBaseName());
    assertEquals("png", fromString.suggestedExtension());
  }

  @Test
  public void testRowsWithoutImagesAreSkipped() {
    RowAssetExtractor extractor = new RowAssetExtractor(config, RemoteAssets.NONE);
    assertTrue(extractor.extract(new TableRow().put("text", "no image column")).isSkipped());
    assertTrue(extractor.extract(new TableRow().put("image", null)).isSkipped());
    assertTrue(extractor.extract(new TableRow().put("image", image(null, null))).isSkipped());
    assertTrue(extractor.extract(new TableRow().put("image", image(new byte[0], null))).isSkipped());
    Extraction unfetchable = extractor.extract(new TableRow().put("image", image(null, "imgs/dog.png")));
    assertTrue(unfetchable.isSkipped());
    assertTrue(unfetchable.skipReason().contains("imgs/dog.png"));
  }

  @Test
  public void testUnsupportedShapesAndFetchFailuresThrow() {
    RowAssetExtractor extractor = new RowAssetExtractor(config, path -> {
      throw new IllegalStateException("fetch failed for " + path);
    });
    assertThrows(IllegalArgumentException.class,
        () -> extractor.extract(new TableRow().put("image", image(3.5d, null))));
    IllegalStateException e = assertThrows(IllegalStateException.class,
        () -> extractor.extract(new TableRow().put("image", image(null, "imgs/dog.png"))));
    assertEquals("fetch failed for imgs/dog.png", e.getMessage());
  }

  @Test
  public void testCustomColumns() {
    HubImportConfig custom = HubImportConfig.builder()
        .imageColumn("picture")
        .captionColumns(List.of("alt"))
        .build();
    RowAssetExtractor extractor = new RowAssetExtractor(custom, RemoteAssets.NONE);
    ExtractedAsset asset = extractor.extract(new TableRow().put("picture", PNG).put("alt", "a dog")).asset();
    assertEquals("a dog", asset.caption());
    assertArrayEquals(PNG, asset.imageBytes());
  }
}
