package io.aitk.hubingest.settings;


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

import io.aitk.hubingest.fetch.HubTokens;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/// Settings resolved from explicit values, the environment and the hub CLI's token file.
///
/// Token lookup order: the explicit token, the environment variable (`HF_TOKEN` unless
/// told otherwise), then `~/.cache/huggingface/token`. Datasets root lookup order: the
/// explicit directory, `AITK_DATASETS_FOLDER`, then `~/aitk/datasets`. Nothing is cached;
/// every call looks again.
public class EnvironmentIngestSettings implements IngestSettings {
  private static final Logger logger = LogManager.getLogger(EnvironmentIngestSettings.class);

  public static final String DEFAULT_TOKEN_ENV = "HF_TOKEN";
  public static final String DATASETS_FOLDER_ENV = "AITK_DATASETS_FOLDER";

  private final String explicitToken;
  private final String tokenEnv;
  private final Path explicitDatasetsRoot;
  private final Map<String, String> environment;
  private final Path userHome;

  public EnvironmentIngestSettings(String explicitToken, String tokenEnv, Path explicitDatasetsRoot) {
    this(explicitToken, tokenEnv, explicitDatasetsRoot, System.getenv(), Path.of(System.getProperty("user.home")));
  }

  EnvironmentIngestSettings(
      String explicitToken,
      String tokenEnv,
      Path explicitDatasetsRoot,
      Map<String, String> environment,
      Path userHome)
  {
    this.explicitToken = explicitToken;
    this.tokenEnv = tokenEnv == null || tokenEnv.isBlank() ? DEFAULT_TOKEN_ENV : tokenEnv;
    this.explicitDatasetsRoot = explicitDatasetsRoot;
    this.environment = environment;
    this.userHome = userHome;
  }

  @Override
  public Path datasetsRoot() {
    if (explicitDatasetsRoot != null) {
      return expandHome(explicitDatasetsRoot.toString());
    }
    String fromEnv = environment.get(DATASETS_FOLDER_ENV);
    if (fromEnv != null && !fromEnv.isBlank()) {
      return expandHome(fromEnv.trim());
    }
    return userHome.resolve("aitk").resolve("datasets");
  }

  @Override
  public Optional<String> hubToken() {
    Optional<String> token = HubTokens.sanitize(explicitToken);
    if (token.isPresent()) {
      return token;
    }
    token = HubTokens.sanitize(environment.get(tokenEnv));
    if (token.isPresent()) {
      logger.debug("using hub token from environment variable {}", tokenEnv);
      return token;
    }
    Path tokenFile = tokenFile();
    if (Files.isRegularFile(tokenFile)) {
      try {
        token = HubTokens.sanitize(Files.readString(tokenFile));
      } catch (IOException e) {
        throw new UncheckedIOException("Failed to read token file " + tokenFile, e);
      }
      if (token.isPresent()) {
        logger.debug("using hub token from {}", tokenFile);
      }
    }
    return token;
  }

  /// @return the token file written by the hub's own CLI login
  public Path tokenFile() {
    return userHome.resolve(".cache").resolve("huggingface").resolve("token");
  }

  private Path expandHome(String path) {
    if (path.equals("~")) {
      return userHome;
    }
    if (path.startsWith("~/")) {
      return userHome.resolve(path.substring(2));
    }
    return Path.of(path);
  }
}
