package io.aitk.command.logging;


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

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.ConsoleAppender;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.ConfigurationFactory;
import org.apache.logging.log4j.core.config.ConfigurationSource;
import org.apache.logging.log4j.core.config.builder.api.AppenderComponentBuilder;
import org.apache.logging.log4j.core.config.builder.api.ConfigurationBuilder;
import org.apache.logging.log4j.core.config.builder.impl.BuiltConfiguration;

import java.net.URI;

/// Logging setup for the command line tools, selected by [io.aitk.command.CMD_datatools#main].
///
/// Everything goes to stderr: stdout carries only the command result, which callers parse.
/// The root level comes from the `aitk.log.level` system property and defaults to INFO; the
/// parquet and hadoop libraries are held at WARN and ERROR since their INFO output is noise.
public class CustomConfigurationFactory extends ConfigurationFactory {

  public static final String LEVEL_PROPERTY = "aitk.log.level";
  public static final String APPENDER_NAME = "STDERR";
  public static final String PATTERN = "%d{HH:mm:ss.SSS} %-5level [%t] %c{1} - %msg%n";

  private static final String[] SUFFIXES = new String[] {"*"};

  static Configuration createConfiguration(String name, ConfigurationBuilder<BuiltConfiguration> builder) {
    builder.setConfigurationName(name);
    builder.setStatusLevel(Level.ERROR);

    AppenderComponentBuilder console = builder.newAppender(APPENDER_NAME, "CONSOLE")
        .addAttribute("target", ConsoleAppender.Target.SYSTEM_ERR);
    console.add(builder.newLayout("PatternLayout").addAttribute("pattern", PATTERN));
    builder.add(console);

    builder.add(builder.newLogger("org.apache.parquet", Level.WARN)
        .add(builder.newAppenderRef(APPENDER_NAME)).addAttribute("additivity", false));
    builder.add(builder.newLogger("org.apache.hadoop", Level.ERROR)
        .add(builder.newAppenderRef(APPENDER_NAME)).addAttribute("additivity", false));
    builder.add(builder.newLogger("org.apache.hc", Level.WARN)
        .add(builder.newAppenderRef(APPENDER_NAME)).addAttribute("additivity", false));
    builder.add(builder.newRootLogger(rootLevel()).add(builder.newAppenderRef(APPENDER_NAME)));
    return builder.build();
  }

  static Level rootLevel() {
    return Level.toLevel(System.getProperty(LEVEL_PROPERTY), Level.INFO);
  }

  @Override
  public Configuration getConfiguration(LoggerContext loggerContext, ConfigurationSource source) {
    return getConfiguration(loggerContext, source.toString(), null);
  }

  @Override
  public Configuration getConfiguration(LoggerContext loggerContext, String name, URI configLocation) {
    return createConfiguration(name, newConfigurationBuilder());
  }

  @Override
  protected String[] getSupportedTypes() {
    return SUFFIXES;
  }
}
