// Copyright (c) 2018 Cloudera, Inc. All rights reserved.
package com.cloudera.cpe.inference;

import com.cloudera.cpe.ColumnType;
import com.cloudera.cpe.model.Column;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

import java.util.Collections;
import java.util.List;

/**
 * Struct-like class that holds the outcome of type inference: the inferred
 * type, the values converted to that type and whether any of them is null.
 */
public class InferenceResult {

  final ColumnType type;
  final List<Object> values;
  final boolean nullable;

  public InferenceResult(
      final ColumnType type,
      final List<?> values,
      final boolean nullable) {
    Preconditions.checkNotNull(type);
    Preconditions.checkNotNull(values);
    this.type = type;
    this.values = Collections.unmodifiableList(Lists.<Object>newArrayList(values));
    this.nullable = nullable;
  }

  public ColumnType getType() {
    return type;
  }

  public List<Object> getValues() {
    return values;
  }

  public boolean isNullable() {
    return nullable;
  }

  public Column toColumn(String name) {
    return new Column(name, values, type, nullable);
  }
}
