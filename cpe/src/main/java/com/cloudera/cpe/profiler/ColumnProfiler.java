// Copyright (c) 2018 Cloudera, Inc. All rights reserved.
package com.cloudera.cpe.profiler;

import com.cloudera.cpe.CPEConstants;
import com.cloudera.cpe.ColumnType;
import com.cloudera.cpe.histogram.HistogramRenderer;
import com.cloudera.cpe.histogram.VisualizationPolicy;
import com.cloudera.cpe.histogram.VisualizationPolicy.Decision;
import com.cloudera.cpe.inference.TypeInferenceEngine;
import com.cloudera.cpe.model.Column;
import com.cloudera.cpe.model.ColumnSchema;
import com.cloudera.cpe.model.RenderedHistogram;
import com.cloudera.cpe.model.StatisticsResult;
import com.cloudera.cpe.source.DataSourceException;
import com.cloudera.cpe.source.TabularDataSource;
import com.cloudera.cpe.stats.ColumnStatisticsCalculator;
import com.cloudera.cpe.util.ProfileHumanizer;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Profiles the columns of one data source: infers each column's type,
 * computes its statistics and, when the column qualifies, draws its
 * histogram.
 *
 * Columns are read from the source the first time they are asked for and
 * kept until the profiler is dropped. A failure in one column is reported in
 * that column's result and never stops the others from being profiled.
 */
public class ColumnProfiler {

  private static final Logger LOG = LoggerFactory.getLogger(ColumnProfiler.class);

  public static final String SECTION_FILE_INFORMATION = "File Information";
  public static final String SECTION_DATA_STRUCTURE = "Data Structure";
  public static final String SECTION_COLUMN_TYPES = "Column Types Summary";

  private final TabularDataSource source;
  private final ProfilerOptions options;
  private final TypeInferenceEngine inferenceEngine;
  private final ColumnStatisticsCalculator calculator;
  private final VisualizationPolicy policy;
  private final HistogramRenderer renderer;
  private final ConcurrentMap<String, Column> columns = Maps.newConcurrentMap();

  public ColumnProfiler(TabularDataSource source, ProfilerOptions options) {
    this.source = Preconditions.checkNotNull(source);
    this.options = Preconditions.checkNotNull(options);
    this.inferenceEngine = new TypeInferenceEngine(options.getTimeFormatters());
    this.calculator = new ColumnStatisticsCalculator();
    this.policy = new VisualizationPolicy();
    this.renderer = new HistogramRenderer();
  }

  public TabularDataSource getSource() {
    return source;
  }

  public ProfilerOptions getOptions() {
    return options;
  }

  /**
   * Returns the typed snapshot of a column. A type declared by the source is
   * used as is; otherwise the type is inferred from the raw values.
   *
   * @throws DataSourceException if the column cannot be read
   */
  public Column getColumn(String name) {
    Preconditions.checkNotNull(name);
    Column column = columns.get(name);
    if (column != null) {
      return column;
    }
    List<String> raw = source.getRawValues(name);
    ColumnType declared = source.getDeclaredType(name);
    if (declared != null) {
      column = inferenceEngine.coerce(raw, declared).toColumn(name);
    } else {
      column = inferenceEngine.infer(raw).toColumn(name);
    }
    LOG.debug("Column '{}' read as {} ({} values, declared: {})",
        name, column.getType(), column.size(), declared);
    Column existing = columns.putIfAbsent(name, column);
    return existing == null ? column : existing;
  }

  /**
   * Computes the statistics of a column. Never throws for bad data: a column
   * that cannot be read, whatever the source throws, gives a result holding
   * only the error.
   */
  public StatisticsResult getColumnStats(String name) {
    Column column;
    try {
      column = getColumn(name);
    } catch (RuntimeException e) {
      LOG.error("Cannot read column '{}' from {}", name, source.getName(), e);
      return StatisticsResult.failure(name, describe(e));
    }
    try {
      return calculator.compute(column, column.getType());
    } catch (RuntimeException e) {
      LOG.error("Unexpected failure profiling column '{}'", name, e);
      return StatisticsResult.failure(name,
          "Failed to calculate statistics: " + e.getMessage());
    }
  }

  /**
   * Returns the histogram for a column's statistics: a plot if the column
   * qualifies, a note if it holds discrete values, and null otherwise.
   */
  public RenderedHistogram getHistogram(StatisticsResult stats) {
    Preconditions.checkNotNull(stats);
    Decision decision = decide(stats);
    switch (decision) {
    case SHOW:
      return renderer.renderSample(stats.getNumericSample(),
          options.getHistogramBins(), options.getHistogramWidth(),
          options.getHistogramHeight(), null);
    case DISCRETE:
      return RenderedHistogram.message(CPEConstants.MSG_DISCRETE_DATA);
    default:
      return null;
    }
  }

  private static String describe(RuntimeException e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }

  private Decision decide(StatisticsResult stats) {
    if (stats.hasError() || stats.getNumericSample() == null) {
      return Decision.NOT_NUMERIC;
    }
    return policy.evaluate(stats.getType(), stats.getDistinctCount(),
        stats.getTotalCount());
  }

  public ColumnProfile profileColumn(String name) {
    StatisticsResult stats = getColumnStats(name);
    Decision decision = decide(stats);
    LOG.debug("Histogram decision for column '{}': {}", name, decision);
    return new ColumnProfile(stats, decision, getHistogram(stats));
  }

  /**
   * Profiles every column, in source order.
   */
  public Map<String, ColumnProfile> profileAll() {
    Map<String, ColumnProfile> profiles = Maps.newLinkedHashMap();
    for (String name : source.getColumnNames()) {
      profiles.put(name, profileColumn(name));
    }
    return profiles;
  }

  /**
   * Lists the columns with their types. A column that cannot be read is
   * listed with the error in place of its type.
   */
  public List<ColumnSchema> getSchema() {
    ImmutableList.Builder<ColumnSchema> schema = ImmutableList.builder();
    for (String name : source.getColumnNames()) {
      try {
        Column column = getColumn(name);
        schema.add(new ColumnSchema(name, column.getType().getTypeName(),
            column.isNullable()));
      } catch (RuntimeException e) {
        LOG.warn("Cannot read schema of column '{}'", name, e);
        schema.add(new ColumnSchema(name, "[Error: " + describe(e) + "]", null));
      }
    }
    return schema.build();
  }

  /**
   * Summarizes the source as titled sections of label/value pairs, in
   * display order.
   */
  public Map<String, Map<String, String>> getMetadataSummary() {
    Map<String, String> fileInfo = Maps.newLinkedHashMap();
    fileInfo.put("Path", source.getName());
    fileInfo.put("Format", source.getFormatName());
    long size = source.getRawByteSize();
    fileInfo.put("Size", size < 0 ? CPEConstants.UNKNOWN : ProfileHumanizer.humanizeBytes(size));

    Map<String, String> structure = Maps.newLinkedHashMap();
    structure.put("Total Rows", ProfileHumanizer.formatCount(source.getRowCount()));
    structure.put("Total Columns", ProfileHumanizer.formatCount(source.getColumnCount()));

    EnumMap<ColumnType, Integer> typeCounts = Maps.newEnumMap(ColumnType.class);
    int unreadable = 0;
    for (String name : source.getColumnNames()) {
      try {
        ColumnType type = getColumn(name).getType();
        Integer count = typeCounts.get(type);
        typeCounts.put(type, count == null ? 1 : count + 1);
      } catch (RuntimeException e) {
        LOG.warn("Column '{}' left out of the type summary", name, e);
        unreadable++;
      }
    }
    Map<String, String> types = Maps.newLinkedHashMap();
    for (Map.Entry<ColumnType, Integer> entry : typeCounts.entrySet()) {
      types.put(entry.getKey().getSummaryLabel(),
          ProfileHumanizer.formatCount(entry.getValue()));
    }
    if (unreadable > 0) {
      types.put("Unreadable Columns", ProfileHumanizer.formatCount(unreadable));
    }

    return ImmutableMap.<String, Map<String, String>>of(
        SECTION_FILE_INFORMATION, fileInfo,
        SECTION_DATA_STRUCTURE, structure,
        SECTION_COLUMN_TYPES, types);
  }
}
