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
package org.apache.calcite.adapter.foxglove;

import org.apache.calcite.adapter.foxglove.api.FoxgloveConfig;
import org.apache.calcite.adapter.foxglove.api.FoxgloveHttpTransport;
import org.apache.calcite.schema.Schema;
import org.apache.calcite.schema.SchemaFactory;
import org.apache.calcite.schema.SchemaPlus;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Factory for Foxglove schemas.
 *
 * <p>See {@link FoxgloveConfig} for the accepted operand.
 */
public class FoxgloveSchemaFactory implements SchemaFactory {
  private static final Logger LOGGER = LoggerFactory.getLogger(FoxgloveSchemaFactory.class);

  public static final FoxgloveSchemaFactory INSTANCE = new FoxgloveSchemaFactory();

  private static final ObjectMapper MAPPER = new ObjectMapper();

  @Override public Schema create(SchemaPlus parentSchema, String name,
      Map<String, Object> operand) {
    final FoxgloveConfig config = FoxgloveConfig.fromMap(operand);
    if (config.getApiKey() == null) {
      LOGGER.warn("Foxglove schema '{}' has no API key; set 'apiKey' or the "
          + "environment variable named by 'apiKeyEnv' (default {})", name,
          FoxgloveConfig.DEFAULT_API_KEY_ENV);
    }
    return new FoxgloveSchema(new FoxgloveHttpTransport(config, MAPPER), config);
  }
}
