// Copyright (c) 2018 Cloudera, Inc. All rights reserved.
package com.cloudera.cpe.model;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * One row of a schema listing: the column name, the name of its type and
 * whether it holds nulls. The nullable flag is null when the column could not
 * be read.
 */
public class ColumnSchema {

  private final String name;
  private final String typeName;
  private final Boolean nullable;

  public ColumnSchema(String name, String typeName, Boolean nullable) {
    this.name = Preconditions.checkNotNull(name);
    this.typeName = Preconditions.checkNotNull(typeName);
    this.nullable = nullable;
  }

  public String getName() {
    return name;
  }

  public String getTypeName() {
    return typeName;
  }

  public Boolean getNullable() {
    return nullable;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ColumnSchema)) {
      return false;
    }
    ColumnSchema other = (ColumnSchema) o;
    return name.equals(other.name)
        && typeName.equals(other.typeName)
        && Objects.equal(nullable, other.nullable);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(name, typeName, nullable);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("name", name)
        .add("type", typeName)
        .add("nullable", nullable)
        .toString();
  }
}
