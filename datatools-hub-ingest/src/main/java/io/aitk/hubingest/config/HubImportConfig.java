package io.aitk.hubingest.config;


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

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/// Settings for one hub import, immutable once built.
///
/// ```java
/// HubImportConfig config = HubImportConfig.builder()
///     .host("http://127.0.0.1:8080")
///     .importMode(ImportMode.IN_PROCESS)
///     .build();
/// ```
public final class HubImportConfig {

  public static final String DEFAULT_HOST = "https://huggingface.co";
  public static final String DEFAULT_USER_AGENT = "aitk-datatools";
  public static final int DEFAULT_PREVIEW_LENGTH = 300;
  public static final int DEFAULT_MAX_NAME_ATTEMPTS = 10_000;
  public static final List<String> DEFAULT_CAPTION_COLUMNS = List.of("text", "caption");
  public static final String DEFAULT_IMAGE_COLUMN = "image";

  private final String host;
  private final String userAgent;
  private final int previewLength;
  private final Duration connectTimeout;
  private final Duration responseTimeout;
  private final ImportMode importMode;
  private final int maxNameAttempts;
  private final List<String> captionColumns;
  private final String imageColumn;

  private HubImportConfig(Builder builder) {
    this.host = stripTrailingSlashes(builder.host);
    this.userAgent = builder.userAgent;
    this.previewLength = builder.previewLength;
    this.connectTimeout = builder.connectTimeout;
    this.responseTimeout = builder.responseTimeout;
    this.importMode = builder.importMode;
    this.maxNameAttempts = builder.maxNameAttempts;
    this.captionColumns = List.copyOf(builder.captionColumns);
    this.imageColumn = builder.imageColumn;
  }

  /// @return a config with every setting at its default
  public static HubImportConfig defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /// @return the hub origin without a trailing slash
  public String host() {
    return host;
  }

  public String userAgent() {
    return userAgent;
  }

  /// @return how many characters of an unexpected body are kept for diagnostics
  public int previewLength() {
    return previewLength;
  }

  public Duration connectTimeout() {
    return connectTimeout;
  }

  public Duration responseTimeout() {
    return responseTimeout;
  }

  public ImportMode importMode() {
    return importMode;
  }

  /// @return how many file names are tried per asset, counting the unsuffixed one
  public int maxNameAttempts() {
    return maxNameAttempts;
  }

  /// @return the caption columns, in lookup order
  public List<String> captionColumns() {
    return captionColumns;
  }

  public String imageColumn() {
    return imageColumn;
  }

  private static String stripTrailingSlashes(String host) {
    String stripped = host.strip();
    while (stripped.endsWith("/")) {
      stripped = stripped.substring(0, stripped.length() - 1);
    }
    return stripped;
  }

  @Override
  public String toString() {
    return "HubImportConfig{" +
           "host='" + host + '\'' +
           ", importMode=" + importMode +
           ", captionColumns=" + captionColumns +
           ", imageColumn='" + imageColumn + '\'' +
           '}';
  }

  /// Builder for [HubImportConfig].
  public static final class Builder {
    private String host = DEFAULT_HOST;
    private String userAgent = DEFAULT_USER_AGENT;
    private int previewLength = DEFAULT_PREVIEW_LENGTH;
    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration responseTimeout = Duration.ofSeconds(120);
    private ImportMode importMode = ImportMode.FORKED;
    private int maxNameAttempts = DEFAULT_MAX_NAME_ATTEMPTS;
    private List<String> captionColumns = DEFAULT_CAPTION_COLUMNS;
    private String imageColumn = DEFAULT_IMAGE_COLUMN;

    private Builder() {
    }

    public Builder host(String host) {
      Objects.requireNonNull(host, "host");
      if (!host.startsWith("http://") && !host.startsWith("https://")) {
        throw new IllegalArgumentException("host must be an http or https origin, got '" + host + "'");
      }
      this.host = host;
      return this;
    }

    public Builder userAgent(String userAgent) {
      this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
      return this;
    }

    public Builder previewLength(int previewLength) {
      if (previewLength < 0) {
        throw new IllegalArgumentException("previewLength must not be negative");
      }
      this.previewLength = previewLength;
      return this;
    }

    public Builder connectTimeout(Duration connectTimeout) {
      this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
      return this;
    }

    public Builder responseTimeout(Duration responseTimeout) {
      this.responseTimeout = Objects.requireNonNull(responseTimeout, "responseTimeout");
      return this;
    }

    public Builder importMode(ImportMode importMode) {
      this.importMode = Objects.requireNonNull(importMode, "importMode");
      return this;
    }

    public Builder maxNameAttempts(int maxNameAttempts) {
      if (maxNameAttempts < 1) {
        throw new IllegalArgumentException("maxNameAttempts must be at least 1");
      }
      this.maxNameAttempts = maxNameAttempts;
      return this;
    }

    public Builder captionColumns(List<String> captionColumns) {
      this.captionColumns = List.copyOf(captionColumns);
      return this;
    }

    public Builder imageColumn(String imageColumn) {
      this.imageColumn = Objects.requireNonNull(imageColumn, "imageColumn");
      return this;
    }

    public HubImportConfig build() {
      return new HubImportConfig(this);
    }
  }
}
