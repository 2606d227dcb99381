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
import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link FoxgloveConfig}.
 */
@Tag("unit")
public class FoxgloveConfigTest {

  private static final Map<String, String> ENV =
      ImmutableMap.of("FOXGLOVE_API_KEY", "env-key", "OTHER_KEY", "other-key",
          "EMPTY_KEY", "");

  private static FoxgloveConfig config(Map<String, Object> operand) {
    return FoxgloveConfig.fromMap(operand, ENV::get);
  }

  @Test void testDefaults() {
    FoxgloveConfig config = config(Collections.emptyMap());
    assertEquals(FoxgloveConfig.DEFAULT_BASE_URL, config.getBaseUrl());
    assertEquals("env-key", config.getApiKey());
    assertEquals(Duration.ofSeconds(30), config.getConnectTimeout());
    assertEquals(Duration.ofSeconds(60), config.getRequestTimeout());
    assertEquals(Duration.ofSeconds(300), config.getDownloadTimeout());
    assertNull(config.getTables());
  }

  @Test void testExplicitKeyWinsOverEnvironment() {
    Map<String, Object> operand = new HashMap<>();
    operand.put("apiKey", "inline");
    operand.put("apiKeyEnv", "OTHER_KEY");
    assertEquals("inline", config(operand).getApiKey());
  }

  @Test void testKeyFromNamedVariable() {
    assertEquals("other-key",
        config(ImmutableMap.of("apiKeyEnv", "OTHER_KEY")).getApiKey());
    assertNull(config(ImmutableMap.of("apiKeyEnv", "EMPTY_KEY")).getApiKey());
    assertNull(config(ImmutableMap.of("apiKeyEnv", "UNSET")).getApiKey());
  }

  @Test void testBaseUrlTrailingSlash() {
    assertEquals("http://localhost:8080/v1",
        config(ImmutableMap.of("baseUrl", "http://localhost:8080/v1/")).getBaseUrl());
  }

  @Test void testTimeouts() {
    FoxgloveConfig config = config(ImmutableMap.of(
        "connectTimeoutSeconds", 5,
        "requestTimeoutSeconds", "7",
        "downloadTimeoutSeconds", 9L));
    assertEquals(Duration.ofSeconds(5), config.getConnectTimeout());
    assertEquals(Duration.ofSeconds(7), config.getRequestTimeout());
    assertEquals(Duration.ofSeconds(9), config.getDownloadTimeout());
    assertThrows(IllegalArgumentException.class,
        () -> config(ImmutableMap.of("requestTimeoutSeconds", "soon")));
  }

  @Test void testTables() {
    assertEquals(ImmutableList.of("devices", "events"),
        config(ImmutableMap.of("tables", ImmutableList.of("Devices", "EVENTS")))
            .getTables());
    assertEquals(ImmutableList.of("topics", "messages"),
        config(ImmutableMap.of("tables", " topics, Messages ,")).getTables());
  }
}
