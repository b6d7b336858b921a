// Copyright (c) 2018 Cloudera, Inc. All rights reserved.
package com.cloudera.cpe.model;

import com.cloudera.cpe.ColumnType;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

import java.util.Collections;
import java.util.List;

/**
 * Immutable snapshot of one column of a data preview. The values are already
 * converted to the column type: Long for INTEGER, Double for FLOAT, DateTime
 * for DATETIME, Boolean for BOOLEAN and String for STRING. A null entry is a
 * missing value.
 *
 * One snapshot is built per column when a file is loaded and it is dropped
 * with the data source.
 */
public class Column {

  private final String name;
  private final List<Object> values;
  private final ColumnType type;
  private final boolean nullable;

  public Column(
      final String name,
      final List<?> values,
      final ColumnType type,
      final boolean nullable) {
    this.name = Preconditions.checkNotNull(name);
    Preconditions.checkNotNull(values);
    this.type = Preconditions.checkNotNull(type);
    // ImmutableList rejects nulls, and nulls are data here.
    this.values = Collections.unmodifiableList(Lists.<Object>newArrayList(values));
    this.nullable = nullable;
  }

  public String getName() {
    return name;
  }

  public List<Object> getValues() {
    return values;
  }

  public ColumnType getType() {
    return type;
  }

  public boolean isNullable() {
    return nullable;
  }

  public int size() {
    return values.size();
  }
}
