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
package org.apache.calcite.adapter.foxglove.resource;

import org.apache.calcite.adapter.foxglove.FoxgloveException;
import org.apache.calcite.adapter.foxglove.api.FoxgloveTransport;
import org.apache.calcite.adapter.foxglove.mcap.McapReader;
import org.apache.calcite.adapter.foxglove.mcap.MessageDecoder;
import org.apache.calcite.adapter.foxglove.mcap.MessageRecord;
import org.apache.calcite.adapter.foxglove.query.CompiledRequest;
import org.apache.calcite.adapter.foxglove.query.LocalSorter;
import org.apache.calcite.adapter.foxglove.query.Qualifier;
import org.apache.calcite.adapter.foxglove.query.QualifierCompiler;
import org.apache.calcite.adapter.foxglove.query.ResultVerifier;
import org.apache.calcite.adapter.foxglove.query.SortDirective;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import com.google.common.collect.Iterators;
import com.google.common.collect.Lists;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a {@link ScanRequest} against one resource.
 *
 * <p>The request is compiled before any call is made, so a query the API
 * would reject fails without network traffic. Every row the API returns is
 * then checked against all qualifiers, ordered locally if the API could not
 * order it, and projected onto the requested columns.
 */
public class ResourceScanner {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(ResourceScanner.class);

  static final String MESSAGE_COLUMN = "message";

  private final FoxgloveResource resource;
  private final FoxgloveTransport transport;
  private final QualifierCompiler compiler;
  private final MessageDecoder decoder;
  private final ResultVerifier verifier;
  private final ObjectMapper mapper = new ObjectMapper();

  public ResourceScanner(FoxgloveResource resource,
      FoxgloveTransport transport) {
    this(resource, transport, new QualifierCompiler(), new MessageDecoder());
  }

  public ResourceScanner(FoxgloveResource resource,
      FoxgloveTransport transport, QualifierCompiler compiler,
      MessageDecoder decoder) {
    this.resource = resource;
    this.transport = transport;
    this.compiler = compiler;
    this.decoder = decoder;
    this.verifier = new ResultVerifier(resource.fieldMap());
  }

  public FoxgloveResource resource() {
    return resource;
  }

  /**
   * Returns the rows matching {@code request}.
   *
   * <p>Each row maps the requested column names, in order, to values;
   * columns without a value are present with null.
   *
   * @throws org.apache.calcite.adapter.foxglove.MissingRequiredSelectorException
   *     if the request lacks a selector the endpoint requires
   * @throws org.apache.calcite.adapter.foxglove.MalformedTimestampException
   *     if a pushed time bound cannot be parsed
   * @throws org.apache.calcite.adapter.foxglove.UpstreamRequestFailedException
   *     if the API call fails
   */
  public Iterator<Map<String, Object>> scan(ScanRequest request) {
    final List<String> columns = request.columns().isEmpty()
        ? resource.columnNames() : request.columns();
    for (String column : columns) {
      if (resource.column(column) == null) {
        throw new IllegalArgumentException("Unknown column '" + column
            + "' in " + resource.name());
      }
    }
    final CompiledRequest compiled =
        compiler.compile(resource.name(), request.qualifiers(),
            request.sortKeys(), request.limit(), resource.fieldMap(),
            resource.hook());

    Iterator<Map<String, Object>> rows;
    switch (resource.kind()) {
    case COLLECTION:
      rows = collectionRows(compiled);
      break;
    case STREAM:
      rows = streamRows(compiled, needsMessage(request, columns));
      break;
    default:
      throw new AssertionError(resource.kind());
    }

    rows = Iterators.filter(rows,
        row -> verifier.accepts(row, request.qualifiers()));

    final SortDirective sort = compiled.sort();
    if (sort != null && !compiled.isSortPushedDown()) {
      LOGGER.debug("{}: ordering by {} after retrieval", resource.name(),
          sort.field());
      rows = LocalSorter.sort(Lists.newArrayList(rows), sort,
          resource.fieldMap()).iterator();
    }

    final Map<String, Object> echoes = echoValues(compiled);
    Iterator<Map<String, Object>> projected =
        Iterators.transform(rows, row -> project(row, echoes, columns));
    if (request.limit() != null) {
      projected = Iterators.limit(projected, request.limit());
    }
    return projected;
  }

  /** Whether rows need the decoded payload, not just the requested columns. */
  private static boolean needsMessage(ScanRequest request, List<String> columns) {
    if (columns.contains(MESSAGE_COLUMN)) {
      return true;
    }
    for (SortDirective sort : request.sortKeys()) {
      if (sort.field().equals(MESSAGE_COLUMN)) {
        return true;
      }
    }
    for (Qualifier qualifier : request.qualifiers()) {
      if (qualifier.field().equals(MESSAGE_COLUMN)) {
        return true;
      }
    }
    return false;
  }

  private Iterator<Map<String, Object>> collectionRows(CompiledRequest compiled) {
    final JsonNode body = transport.get(resource.path(), compiled.queryParams());
    if (!body.isArray()) {
      throw new FoxgloveException(resource.name() + ": expected a JSON array from "
          + resource.path() + ", got " + body.getNodeType());
    }
    LOGGER.info("{}: upstream returned {} items", resource.name(), body.size());
    final RowMapper rowMapper = resource.rowMapper();
    if (rowMapper == null) {
      throw new IllegalStateException(resource.name() + " has no row mapper");
    }
    return Iterators.transform(body.elements(), rowMapper::map);
  }

  private Iterator<Map<String, Object>> streamRows(CompiledRequest compiled,
      boolean decode) {
    final ObjectNode body = mapper.createObjectNode();
    body.put("outputFormat", "mcap");
    for (Map.Entry<String, Object> param : compiled.params().entrySet()) {
      if (param.getValue() instanceof List) {
        ArrayNode values = body.putArray(param.getKey());
        for (Object value : (List<?>) param.getValue()) {
          values.add(String.valueOf(value));
        }
      } else {
        body.put(param.getKey(), String.valueOf(param.getValue()));
      }
    }
    final JsonNode response = transport.post(resource.path(), body);
    final JsonNode link = response.get("link");
    if (link == null || !link.isTextual() || link.asText().isEmpty()) {
      throw new FoxgloveException(resource.name()
          + ": stream response has no retrieval link");
    }
    final byte[] data = transport.download(link.asText());
    final McapReader reader = new McapReader(data);
    return Iterators.transform(reader.messages(),
        record -> messageRow(record, decode));
  }

  private Map<String, Object> messageRow(MessageRecord record, boolean decode) {
    Map<String, Object> row = new LinkedHashMap<>();
    row.put("timestamp", Instant.ofEpochSecond(0, record.logTimeNanos()).toString());
    row.put("topic", record.topic());
    row.put("schema_name", record.schemaName());
    row.put("channel_id", record.channelId());
    row.put("schema_id", record.schemaId());
    row.put("sequence_id", record.sequence());
    row.put("encoding", record.schemaEncoding());
    row.put(MESSAGE_COLUMN, decode ? decoder.decode(record) : null);
    return row;
  }

  private Map<String, Object> echoValues(CompiledRequest compiled) {
    Map<String, Object> echoes = new LinkedHashMap<>();
    for (Map.Entry<String, String> echo : resource.echoColumns().entrySet()) {
      echoes.put(echo.getKey(), compiled.param(echo.getValue()));
    }
    return echoes;
  }

  private static Map<String, Object> project(Map<String, Object> row,
      Map<String, Object> echoes, List<String> columns) {
    Map<String, Object> projected = new LinkedHashMap<>();
    for (String column : columns) {
      projected.put(column,
          echoes.containsKey(column) ? echoes.get(column) : row.get(column));
    }
    return projected;
  }
}
