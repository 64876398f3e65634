package io.aitk.command.verify;


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

import io.aitk.command.CMD_datatools;
import io.aitk.datasource.parquet.ParquetTableFixtures;
import io.aitk.datasource.parquet.ParquetTableFixtures.ImageRow;
import io.aitk.jetty.testserver.HubServerExtension;
import io.aitk.jetty.testserver.HubServerFixture;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

@ExtendWith(HubServerExtension.class)
public class CMD_verify_parquetTest {

  @TempDir
  Path tempDir;

  private final StringWriter out = new StringWriter();

  private int run(String... args) {
    CommandLine commandLine = CMD_datatools.newCommandLine();
    commandLine.setOut(new PrintWriter(out));
    commandLine.setErr(new PrintWriter(new StringWriter()));
    return commandLine.execute(args);
  }

  @Test
  public void testParquetBodyPasses(HubServerFixture hub) {
    byte[] table = ParquetTableFixtures.bytesOf(ParquetTableFixtures.writeImageTable(
        tempDir.resolve("t.parquet"), List.of(ImageRow.pathOnly("a.png", "a"))));
    hub.hostDataset("acme/cats", "main", "train.parquet", table).redirectThroughCdn();

    int exitCode = run("verify-parquet", hub.getHost() + "/datasets/acme/cats/resolve/main/train.parquet",
        "--envkey", "AITK_UNSET_TOKEN_VARIABLE", "-v");

    assertEquals(0, exitCode);
    assertThat(out.toString())
        .contains("Parquet:          yes")
        .contains("Bytes:            " + table.length)
        .contains("/cdn/");
  }

  @Test
  public void testHtmlBodyFails(HubServerFixture hub) {
    hub.hostDataset("acme/cats", "main", "train.parquet",
        "<!DOCTYPE html><html><body>Sign in</body></html>".getBytes(StandardCharsets.UTF_8))
        .contentType("text/html");

    int exitCode = run("verify-parquet", hub.getHost() + "/datasets/acme/cats/resolve/main/train.parquet",
        "--envkey", "AITK_UNSET_TOKEN_VARIABLE");

    assertEquals(1, exitCode);
    assertThat(out.toString())
        .contains("Parquet:          no")
        .contains("Looks like HTML:  yes")
        .contains("Sign in");
  }
}
