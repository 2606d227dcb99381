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

import org.apache.calcite.adapter.foxglove.api.FoxgloveTransport;
import org.apache.calcite.adapter.foxglove.resource.FoxgloveColumn;
import org.apache.calcite.adapter.foxglove.resource.FoxgloveResource;
import org.apache.calcite.adapter.foxglove.resource.ResourceScanner;
import org.apache.calcite.adapter.foxglove.resource.ScanRequest;
import org.apache.calcite.adapter.java.AbstractQueryableTable;
import org.apache.calcite.linq4j.AbstractEnumerable;
import org.apache.calcite.linq4j.Enumerable;
import org.apache.calcite.linq4j.Enumerator;
import org.apache.calcite.linq4j.QueryProvider;
import org.apache.calcite.linq4j.Queryable;
import org.apache.calcite.plan.RelOptCluster;
import org.apache.calcite.plan.RelOptTable;
import org.apache.calcite.rel.RelNode;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;
import org.apache.calcite.schema.SchemaPlus;
import org.apache.calcite.schema.TranslatableTable;
import org.apache.calcite.schema.impl.AbstractTableQueryable;
import org.apache.calcite.sql.type.SqlTypeName;

import java.util.ArrayList;
import java.util.List;

/**
 * Table based on a Foxglove resource.
 */
public class FoxgloveTable extends AbstractQueryableTable
    implements TranslatableTable {

  private final FoxgloveResource resource;
  private final ResourceScanner scanner;

  FoxgloveTable(FoxgloveResource resource, FoxgloveTransport transport) {
    this(new ResourceScanner(resource, transport));
  }

  FoxgloveTable(ResourceScanner scanner) {
    super(Object[].class);
    this.resource = scanner.resource();
    this.scanner = scanner;
  }

  public FoxgloveResource getResource() {
    return resource;
  }

  @Override public String toString() {
    return "FoxgloveTable {" + resource.name() + "}";
  }

  @Override public RelDataType getRowType(RelDataTypeFactory typeFactory) {
    final RelDataTypeFactory.Builder builder = typeFactory.builder();
    for (FoxgloveColumn column : resource.columns()) {
      builder.add(column.name(), sqlType(column.type())).nullable(true);
    }
    return builder.build();
  }

  private static SqlTypeName sqlType(FoxgloveColumn.Type type) {
    switch (type) {
    case TIMESTAMP:
      return SqlTypeName.TIMESTAMP;
    case BIGINT:
      return SqlTypeName.BIGINT;
    case INTEGER:
      return SqlTypeName.INTEGER;
    case DOUBLE:
      return SqlTypeName.DOUBLE;
    case VARCHAR:
    case JSON:
    default:
      return SqlTypeName.VARCHAR;
    }
  }

  /**
   * Executes a scan. Rows are {@code Object[]}, or the bare value when a
   * single column is requested.
   */
  public Enumerable<Object> query(final ScanRequest request) {
    final List<String> fields = request.columns().isEmpty()
        ? resource.columnNames() : request.columns();
    final List<FoxgloveColumn.Type> types = new ArrayList<>();
    for (String field : fields) {
      FoxgloveColumn column = resource.column(field);
      if (column == null) {
        throw new IllegalArgumentException("Unknown column '" + field
            + "' in " + resource.name());
      }
      types.add(column.type());
    }
    return new AbstractEnumerable<Object>() {
      @Override public Enumerator<Object> enumerator() {
        return new FoxgloveEnumerator(scanner.scan(request), fields, types);
      }
    };
  }

  @Override public <T> Queryable<T> asQueryable(QueryProvider queryProvider,
      SchemaPlus schema, String tableName) {
    return new FoxgloveQueryable<>(queryProvider, schema, this, tableName);
  }

  @Override public RelNode toRel(RelOptTable.ToRelContext context,
      RelOptTable relOptTable) {
    final RelOptCluster cluster = context.getCluster();
    return new FoxgloveTableScan(cluster,
        cluster.traitSetOf(FoxgloveRel.CONVENTION), relOptTable, this);
  }

  /** Implementation of {@link Queryable} based on a {@link FoxgloveTable}.
   *
   * @param <T> element type */
  public static class FoxgloveQueryable<T> extends AbstractTableQueryable<T> {
    FoxgloveQueryable(QueryProvider queryProvider, SchemaPlus schema,
        FoxgloveTable table, String tableName) {
      super(queryProvider, schema, table, tableName);
    }

    @Override public Enumerator<T> enumerator() {
      //noinspection unchecked
      final Enumerable<T> enumerable =
          (Enumerable<T>) getTable().query(ScanRequest.builder().build());
      return enumerable.enumerator();
    }

    private FoxgloveTable getTable() {
      return (FoxgloveTable) table;
    }

    /** Called via code-generation.
     *
     * @see FoxgloveMethod#FOXGLOVE_QUERYABLE_QUERY
     */
    @SuppressWarnings("UnusedDeclaration")
    public Enumerable<Object> query(String requestJson) {
      return getTable().query(ScanRequest.fromJson(requestJson));
    }
  }
}
