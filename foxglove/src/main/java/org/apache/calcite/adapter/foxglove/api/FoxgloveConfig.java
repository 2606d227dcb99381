/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.calcite.adapter.foxglove.api;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Connection settings for the Foxglove API.
 *
 * <p>Built from the schema operand of a Calcite model:
 * <pre>{@code
 * {
 *   "name": "foxglove",
 *   "type": "custom",
 *   "factory": "org.apache.calcite.adapter.foxglove.FoxgloveSchemaFactory",
 *   "operand": {
 *     "baseUrl": "https://api.foxglove.dev/v1",
 *     "apiKeyEnv": "FOXGLOVE_API_KEY",
 *     "requestTimeoutSeconds": 60,
 *     "tables": ["devices", "recordings", "messages"]
 *   }
 * }
 * }</pre>
 *
 * <p>{@code apiKey} may be given directly; otherwise it is read from the
 * environment variable named by {@code apiKeyEnv}.
 */
public class FoxgloveConfig {

  public static final String DEFAULT_BASE_URL = "https://api.foxglove.dev/v1";
  public static final String DEFAULT_API_KEY_ENV = "FOXGLOVE_API_KEY";

  private final String baseUrl;
  private final @Nullable String apiKey;
  private final Duration connectTimeout;
  private final Duration requestTimeout;
  private final Duration downloadTimeout;
  private final @Nullable ImmutableList<String> tables;

  private FoxgloveConfig(Builder builder) {
    String url = builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL;
    this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    this.apiKey = builder.apiKey;
    this.connectTimeout = builder.connectTimeout;
    this.requestTimeout = builder.requestTimeout;
    this.downloadTimeout = builder.downloadTimeout;
    this.tables = builder.tables == null ? null : ImmutableList.copyOf(builder.tables);
  }

  /** API root, without a trailing slash. */
  public String getBaseUrl() {
    return baseUrl;
  }

  public @Nullable String getApiKey() {
    return apiKey;
  }

  public Duration getConnectTimeout() {
    return connectTimeout;
  }

  public Duration getRequestTimeout() {
    return requestTimeout;
  }

  /** Timeout for fetching a message stream from its retrieval link. */
  public Duration getDownloadTimeout() {
    return downloadTimeout;
  }

  /** Tables to expose, or null for all of them. */
  public @Nullable List<String> getTables() {
    return tables;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static FoxgloveConfig fromMap(Map<String, Object> operand) {
    return fromMap(operand, System::getenv);
  }

  /**
   * Reads a configuration from a schema operand.
   *
   * @param operand schema operand
   * @param environment lookup for environment variables
   */
  public static FoxgloveConfig fromMap(Map<String, Object> operand,
      Function<String, @Nullable String> environment) {
    Builder builder = builder();
    Object baseUrl = operand.get("baseUrl");
    if (baseUrl != null) {
      builder.baseUrl(baseUrl.toString());
    }
    Object apiKey = operand.get("apiKey");
    if (apiKey == null) {
      Object env = operand.get("apiKeyEnv");
      apiKey = environment.apply(env != null ? env.toString() : DEFAULT_API_KEY_ENV);
    }
    if (apiKey != null && !apiKey.toString().isEmpty()) {
      builder.apiKey(apiKey.toString());
    }
    Integer connect = seconds(operand, "connectTimeoutSeconds");
    if (connect != null) {
      builder.connectTimeout(Duration.ofSeconds(connect));
    }
    Integer request = seconds(operand, "requestTimeoutSeconds");
    if (request != null) {
      builder.requestTimeout(Duration.ofSeconds(request));
    }
    Integer download = seconds(operand, "downloadTimeoutSeconds");
    if (download != null) {
      builder.downloadTimeout(Duration.ofSeconds(download));
    }
    Object tables = operand.get("tables");
    if (tables instanceof List) {
      ImmutableList.Builder<String> names = ImmutableList.builder();
      for (Object table : (List<?>) tables) {
        names.add(table.toString().toLowerCase(Locale.ROOT));
      }
      builder.tables(names.build());
    } else if (tables instanceof String) {
      ImmutableList.Builder<String> names = ImmutableList.builder();
      for (String table : ((String) tables).split(",")) {
        if (!table.trim().isEmpty()) {
          names.add(table.trim().toLowerCase(Locale.ROOT));
        }
      }
      builder.tables(names.build());
    }
    return builder.build();
  }

  private static @Nullable Integer seconds(Map<String, Object> operand,
      String key) {
    Object value = operand.get(key);
    if (value == null) {
      return null;
    }
    if (value instanceof Number) {
      return ((Number) value).intValue();
    }
    try {
      return Integer.parseInt(value.toString().trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Operand '" + key
          + "' must be a number of seconds, got '" + value + "'", e);
    }
  }

  /** Builder for {@link FoxgloveConfig}. */
  public static class Builder {
    private @Nullable String baseUrl;
    private @Nullable String apiKey;
    private Duration connectTimeout = Duration.ofSeconds(30);
    private Duration requestTimeout = Duration.ofSeconds(60);
    private Duration downloadTimeout = Duration.ofSeconds(300);
    private @Nullable List<String> tables;

    public Builder baseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
      return this;
    }

    public Builder apiKey(@Nullable String apiKey) {
      this.apiKey = apiKey;
      return this;
    }

    public Builder connectTimeout(Duration connectTimeout) {
      this.connectTimeout = connectTimeout;
      return this;
    }

    public Builder requestTimeout(Duration requestTimeout) {
      this.requestTimeout = requestTimeout;
      return this;
    }

    public Builder downloadTimeout(Duration downloadTimeout) {
      this.downloadTimeout = downloadTimeout;
      return this;
    }

    public Builder tables(@Nullable List<String> tables) {
      this.tables = tables;
      return this;
    }

    public FoxgloveConfig build() {
      return new FoxgloveConfig(this);
    }
  }
}
