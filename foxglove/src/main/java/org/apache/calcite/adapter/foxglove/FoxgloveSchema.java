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
import org.apache.calcite.adapter.foxglove.api.FoxgloveTransport;
import org.apache.calcite.adapter.foxglove.resource.FoxgloveResource;
import org.apache.calcite.adapter.foxglove.resource.FoxgloveResources;
import org.apache.calcite.schema.Function;
import org.apache.calcite.schema.Table;
import org.apache.calcite.schema.impl.AbstractSchema;
import org.apache.calcite.schema.impl.ScalarFunctionImpl;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableMultimap;
import com.google.common.collect.Multimap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Schema that exposes Foxglove API resources as tables.
 */
public class FoxgloveSchema extends AbstractSchema {
  private static final Logger LOGGER = LoggerFactory.getLogger(FoxgloveSchema.class);

  private final FoxgloveTransport transport;
  private final FoxgloveConfig config;
  private final Map<String, Table> tableMap;

  /**
   * Creates a FoxgloveSchema.
   *
   * @param transport Transport for API calls
   * @param config Configuration, including which tables to expose
   */
  public FoxgloveSchema(FoxgloveTransport transport, FoxgloveConfig config) {
    super();
    this.transport = requireNonNull(transport, "transport");
    this.config = requireNonNull(config, "config");
    this.tableMap = createTables();
  }

  @Override protected Map<String, Table> getTableMap() {
    return tableMap;
  }

  @Override protected Multimap<String, Function> getFunctionMultimap() {
    return ImmutableMultimap.of(FoxgloveFilterTranslator.METADATA_CONTAINS,
        ScalarFunctionImpl.create(FoxgloveFunctions.class, "metadataContains"));
  }

  private Map<String, Table> createTables() {
    final ImmutableMap.Builder<String, Table> builder = ImmutableMap.builder();
    final List<String> wanted = config.getTables();
    if (wanted == null) {
      for (FoxgloveResource resource : FoxgloveResources.all()) {
        builder.put(resource.name(), new FoxgloveTable(resource, transport));
      }
    } else {
      for (String name : wanted) {
        FoxgloveResource resource = FoxgloveResources.get(name);
        if (resource == null) {
          LOGGER.warn("Ignoring unknown Foxglove table '{}'; known tables are {}",
              name, FoxgloveResources.names());
          continue;
        }
        builder.put(resource.name(), new FoxgloveTable(resource, transport));
      }
    }
    final Map<String, Table> tables = builder.buildKeepingLast();
    LOGGER.debug("Foxglove schema at {} exposes {}", config.getBaseUrl(),
        tables.keySet());
    return tables;
  }
}
