// Copyright (c) 2018 Cloudera, Inc. All rights reserved.
package com.cloudera.cpe.source;

import com.cloudera.cpe.ColumnType;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Base for sources whose preview is held in memory as one list of raw values
 * per column. Subclasses fill in the columns when they are created.
 */
public abstract class AbstractTabularDataSource implements TabularDataSource {

  private final String name;
  private Map<String, List<String>> columns;
  private Map<String, ColumnType> declaredTypes;
  private long rowCount;

  protected AbstractTabularDataSource(
      String name,
      Map<String, List<String>> columns,
      Map<String, ColumnType> declaredTypes) {
    this.name = Preconditions.checkNotNull(name);
    Preconditions.checkNotNull(columns);
    Preconditions.checkNotNull(declaredTypes);
    long rows = -1;
    for (Map.Entry<String, List<String>> column : columns.entrySet()) {
      int size = column.getValue().size();
      Preconditions.checkArgument(rows == -1 || rows == size,
          "Column '%s' has %s values, expected %s", column.getKey(), size, rows);
      rows = size;
    }
    // Insertion order is the column order of the file.
    ImmutableMap.Builder<String, List<String>> copy = ImmutableMap.builder();
    for (Map.Entry<String, List<String>> column : columns.entrySet()) {
      // Nulls are missing values, so the lists cannot be ImmutableLists.
      copy.put(column.getKey(), Collections.unmodifiableList(column.getValue()));
    }
    this.columns = copy.build();
    this.declaredTypes = ImmutableMap.copyOf(declaredTypes);
    this.rowCount = Math.max(rows, 0);
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public List<String> getColumnNames() {
    return ImmutableList.copyOf(checkOpen().keySet());
  }

  @Override
  public long getRowCount() {
    checkOpen();
    return rowCount;
  }

  @Override
  public int getColumnCount() {
    return checkOpen().size();
  }

  @Override
  public List<String> getRawValues(String columnName) {
    List<String> values = checkOpen().get(columnName);
    if (values == null) {
      throw new DataSourceException(
          "Column '" + columnName + "' not found in " + name);
    }
    return values;
  }

  @Override
  public ColumnType getDeclaredType(String columnName) {
    if (!checkOpen().containsKey(columnName)) {
      throw new DataSourceException(
          "Column '" + columnName + "' not found in " + name);
    }
    return declaredTypes.get(columnName);
  }

  public boolean isClosed() {
    return columns == null;
  }

  @Override
  public void close() {
    columns = null;
    declaredTypes = null;
  }

  private Map<String, List<String>> checkOpen() {
    if (columns == null) {
      throw new DataSourceException(name + " is closed");
    }
    return columns;
  }
}
