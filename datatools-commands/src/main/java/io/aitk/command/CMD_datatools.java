package io.aitk.command;


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

import io.aitk.command.importparquet.CMD_import_parquet;
import io.aitk.command.logging.CustomConfigurationFactory;
import io.aitk.command.verify.CMD_verify_parquet;
import org.apache.logging.log4j.core.config.ConfigurationFactory;
import picocli.CommandLine;

/// The `aitk-datatools` command line entry point.
@CommandLine.Command(name = "aitk-datatools",
    header = "Import image and caption datasets from hub parquet files",
    description = "Fetches parquet tables from the hub and writes each row as an image file "
        + "with a caption sidecar.",
    mixinStandardHelpOptions = true,
    subcommands = {
        CMD_import_parquet.class,
        CMD_verify_parquet.class,
        CommandLine.HelpCommand.class
    })
public class CMD_datatools {

  /// Build a command line with the parsing options every invocation uses.
  /// Option names stay case sensitive: `-v` (verbose) and `-V` (version) are distinct.
  /// @return the configured command line
  public static CommandLine newCommandLine() {
    return new CommandLine(new CMD_datatools())
        .setCaseInsensitiveEnumValuesAllowed(true);
  }

  public static void main(String[] args) {
    System.setProperty(ConfigurationFactory.CONFIGURATION_FACTORY_PROPERTY,
        CustomConfigurationFactory.class.getCanonicalName());
    int exitCode = newCommandLine().execute(args);
    System.exit(exitCode);
  }
}
