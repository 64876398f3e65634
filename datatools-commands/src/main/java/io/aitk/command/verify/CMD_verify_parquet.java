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

import io.aitk.command.common.VerbosityOption;
import io.aitk.hubingest.config.HubImportConfig;
import io.aitk.hubingest.fetch.HubFileFetcher;
import io.aitk.hubingest.settings.EnvironmentIngestSettings;
import io.aitk.hubingest.verify.ParquetDownloadVerifier;
import io.aitk.hubingest.verify.VerificationReport;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.util.concurrent.Callable;

/// Download one URL and report whether the body is a parquet file.
@CommandLine.Command(name = "verify-parquet",
    header = "Check that a URL serves a parquet file",
    description = "Prints the final URL, status, headers, size and a verdict. Exits with 0 "
        + "when the body is parquet, 1 otherwise.",
    mixinStandardHelpOptions = true)
public class CMD_verify_parquet implements Callable<Integer> {

  @CommandLine.Parameters(index = "0", paramLabel = "URL", description = "URL to download")
  private String url;

  @CommandLine.Option(names = {"--token", "-t"}, description = "Hub access token")
  private String token;

  @CommandLine.Option(names = {"--envkey", "-k"},
      defaultValue = EnvironmentIngestSettings.DEFAULT_TOKEN_ENV,
      description = "Environment variable holding the token (default: ${DEFAULT-VALUE})")
  private String envKey;

  @CommandLine.Mixin
  private VerbosityOption verbosity;

  @CommandLine.Spec
  private CommandLine.Model.CommandSpec spec;

  @Override
  public Integer call() {
    verbosity.apply();
    PrintWriter out = spec.commandLine().getOut();
    HubImportConfig config = HubImportConfig.defaults();
    String resolvedToken = new EnvironmentIngestSettings(token, envKey, null).hubToken().orElse(null);
    VerificationReport report;
    try (HubFileFetcher fetcher = new HubFileFetcher(config)) {
      report = new ParquetDownloadVerifier(fetcher, config.previewLength()).verify(url, resolvedToken);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    out.print(report.render());
    out.flush();
    return report.parquet() ? 0 : 1;
  }
}
