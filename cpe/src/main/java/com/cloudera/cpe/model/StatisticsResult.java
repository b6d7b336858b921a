// Copyright (c) 2018 Cloudera, Inc. All rights reserved.
package com.cloudera.cpe.model;

import com.cloudera.cpe.CPEConstants;
import com.cloudera.cpe.ColumnType;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import java.util.List;
import java.util.Map;

/**
 * The statistics computed for one column. Statistic values are already
 * formatted for display and kept in the order they were computed.
 *
 * A result can carry an error next to its statistics: when one type-specific
 * calculation fails the basic counts are still reported. A result that only
 * has an error and an unknown type means the column could not be read at all.
 */
public class StatisticsResult {

  final String columnName;
  final ColumnType type;
  final Boolean nullable;
  final ImmutableMap<String, String> statistics;
  final ImmutableMap<String, String> topValues;
  final String error;
  final String message;
  final ImmutableList<Double> numericSample;
  final long totalCount;
  final long distinctCount;

  public StatisticsResult(
      final String columnName,
      final ColumnType type,
      final Boolean nullable,
      final Map<String, String> statistics,
      final Map<String, String> topValues,
      final String error,
      final String message,
      final List<Double> numericSample,
      final long totalCount,
      final long distinctCount) {
    Preconditions.checkNotNull(columnName);
    Preconditions.checkNotNull(statistics);
    Preconditions.checkNotNull(topValues);
    Preconditions.checkArgument(totalCount >= 0);
    Preconditions.checkArgument(distinctCount >= 0);
    this.columnName = columnName;
    this.type = type;
    this.nullable = nullable;
    this.statistics = ImmutableMap.copyOf(statistics);
    this.topValues = ImmutableMap.copyOf(topValues);
    this.error = error;
    this.message = message;
    this.numericSample =
        numericSample == null ? null : ImmutableList.copyOf(numericSample);
    this.totalCount = totalCount;
    this.distinctCount = distinctCount;
  }

  /**
   * Builds the result reported when a column cannot be profiled at all.
   */
  public static StatisticsResult failure(String columnName, String error) {
    Preconditions.checkNotNull(error);
    return newBuilder()
        .setColumnName(columnName)
        .setError(error)
        .build();
  }

  public String getColumnName() {
    return columnName;
  }

  /**
   * The column type, or null if it is not known.
   */
  public ColumnType getType() {
    return type;
  }

  public String getTypeName() {
    return type == null ? CPEConstants.UNKNOWN : type.getTypeName();
  }

  /**
   * Whether the column holds nulls, or null if that is not known.
   */
  public Boolean getNullable() {
    return nullable;
  }

  public ImmutableMap<String, String> getStatistics() {
    return statistics;
  }

  public String getStatistic(String label) {
    return statistics.get(label);
  }

  /**
   * The most frequent values of a string column with their formatted counts,
   * most frequent first. Empty for other types.
   */
  public ImmutableMap<String, String> getTopValues() {
    return topValues;
  }

  public String getError() {
    return error;
  }

  public boolean hasError() {
    return error != null;
  }

  public String getMessage() {
    return message;
  }

  /**
   * The finite valid values of a numeric column in row order, for drawing a
   * histogram. Null for other types.
   */
  public ImmutableList<Double> getNumericSample() {
    return numericSample;
  }

  public long getTotalCount() {
    return totalCount;
  }

  public long getDistinctCount() {
    return distinctCount;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof StatisticsResult)) {
      return false;
    }
    StatisticsResult other = (StatisticsResult) o;
    return columnName.equals(other.columnName)
        && type == other.type
        && Objects.equal(nullable, other.nullable)
        // ImmutableMap equality ignores order, the display order matters here.
        && ImmutableList.copyOf(statistics.entrySet()).equals(
            ImmutableList.copyOf(other.statistics.entrySet()))
        && ImmutableList.copyOf(topValues.entrySet()).equals(
            ImmutableList.copyOf(other.topValues.entrySet()))
        && Objects.equal(error, other.error)
        && Objects.equal(message, other.message)
        && Objects.equal(numericSample, other.numericSample)
        && totalCount == other.totalCount
        && distinctCount == other.distinctCount;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(columnName, type, nullable, statistics, topValues,
        error, message, numericSample, totalCount, distinctCount);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("column", columnName)
        .add("type", getTypeName())
        .add("nullable", nullable)
        .add("statistics", statistics)
        .add("topValues", topValues)
        .add("error", error)
        .add("message", message)
        .toString();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder {
    private String columnName;
    private ColumnType type;
    private Boolean nullable;
    private final Map<String, String> statistics = Maps.newLinkedHashMap();
    private final Map<String, String> topValues = Maps.newLinkedHashMap();
    private String error;
    private String message;
    private List<Double> numericSample;
    private long totalCount;
    private long distinctCount;

    public Builder setColumnName(String columnName) {
      Preconditions.checkNotNull(columnName);
      this.columnName = columnName;
      return this;
    }

    public Builder setType(ColumnType type) {
      this.type = type;
      return this;
    }

    public Builder setNullable(Boolean nullable) {
      this.nullable = nullable;
      return this;
    }

    public Builder putStatistic(String label, String value) {
      Preconditions.checkNotNull(label);
      Preconditions.checkNotNull(value);
      statistics.put(label, value);
      return this;
    }

    public Builder putTopValue(String value, String count) {
      Preconditions.checkNotNull(value);
      Preconditions.checkNotNull(count);
      topValues.put(value, count);
      return this;
    }

    public Builder setError(String error) {
      this.error = error;
      return this;
    }

    public Builder setMessage(String message) {
      this.message = message;
      return this;
    }

    public Builder setNumericSample(List<Double> numericSample) {
      this.numericSample = numericSample;
      return this;
    }

    public Builder setTotalCount(long totalCount) {
      this.totalCount = totalCount;
      return this;
    }

    public Builder setDistinctCount(long distinctCount) {
      this.distinctCount = distinctCount;
      return this;
    }

    public StatisticsResult build() {
      return new StatisticsResult(columnName, type, nullable, statistics,
          topValues, error, message, numericSample, totalCount, distinctCount);
    }
  }
}
