// Copyright (c) 2018 Cloudera, Inc. All rights reserved.
package com.cloudera.cpe.source;

import com.cloudera.cpe.ColumnType;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * A source built from values already in memory, for embedding the profiler
 * behind another reader and for tests.
 */
public class InMemoryTabularDataSource extends AbstractTabularDataSource {

  private final String formatName;
  private final long rawByteSize;

  private InMemoryTabularDataSource(Builder builder) {
    super(builder.name, builder.columns, builder.declaredTypes);
    this.formatName = builder.formatName;
    this.rawByteSize = builder.rawByteSize;
  }

  @Override
  public String getFormatName() {
    return formatName;
  }

  @Override
  public long getRawByteSize() {
    return rawByteSize;
  }

  public static Builder newBuilder(String name) {
    return new Builder(name);
  }

  public static class Builder {
    private final String name;
    private String formatName = "In-memory";
    private long rawByteSize = -1;
    private final Map<String, List<String>> columns = Maps.newLinkedHashMap();
    private final Map<String, ColumnType> declaredTypes = Maps.newHashMap();

    private Builder(String name) {
      this.name = Preconditions.checkNotNull(name);
    }

    public Builder setFormatName(String formatName) {
      this.formatName = Preconditions.checkNotNull(formatName);
      return this;
    }

    public Builder setRawByteSize(long rawByteSize) {
      this.rawByteSize = rawByteSize;
      return this;
    }

    public Builder addColumn(String columnName, String... values) {
      return addColumn(columnName, Arrays.asList(values));
    }

    public Builder addColumn(String columnName, List<String> values) {
      Preconditions.checkNotNull(columnName);
      Preconditions.checkNotNull(values);
      Preconditions.checkArgument(!columns.containsKey(columnName),
          "Duplicate column: %s", columnName);
      columns.put(columnName, Lists.newArrayList(values));
      return this;
    }

    /**
     * Adds a column whose type is declared rather than inferred.
     */
    public Builder addColumn(String columnName, ColumnType declaredType, List<String> values) {
      Preconditions.checkNotNull(declaredType);
      addColumn(columnName, values);
      declaredTypes.put(columnName, declaredType);
      return this;
    }

    public InMemoryTabularDataSource build() {
      return new InMemoryTabularDataSource(this);
    }
  }
}
