// Copyright (c) 2018 Cloudera, Inc. All rights reserved.
package com.cloudera.cpe.stats;

import com.cloudera.cpe.CPEConstants;
import com.cloudera.cpe.ColumnType;
import com.cloudera.cpe.model.Column;
import com.cloudera.cpe.model.StatisticsResult;
import com.cloudera.cpe.util.CPEUtils;
import com.cloudera.cpe.util.JodaUtil;
import com.cloudera.cpe.util.ProfileHumanizer;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Ordering;
import com.google.common.collect.Sets;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import org.joda.time.DateTime;
import org.joda.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the statistics of one column.
 *
 * The counts (total, valid, null, null percentage and distinct) are computed
 * for every column. On top of them each column type has its own calculation.
 * If that calculation fails it is abandoned and the failure is reported in
 * the result's error, but the counts are still returned.
 *
 * The calculator is stateless; every call recomputes from the column.
 */
public class ColumnStatisticsCalculator {

  private static final Logger LOG = LoggerFactory.getLogger(
      ColumnStatisticsCalculator.class);

  private static final int MEAN_DECIMALS = 4;
  private static final int FLOAT_DECIMALS = 4;

  /**
   * Computes the statistics of the column, interpreting its values as the
   * given type. The type is normally the column's own, but it is passed
   * separately so that a caller can profile a column under another reading.
   */
  public StatisticsResult compute(Column column, ColumnType type) {
    Preconditions.checkNotNull(column);
    Preconditions.checkNotNull(type);
    List<Object> values = column.getValues();
    long totalCount = values.size();

    StatisticsResult.Builder builder = StatisticsResult.newBuilder()
        .setColumnName(column.getName())
        .setType(type)
        .setTotalCount(totalCount);
    if (totalCount == 0) {
      return builder
          .setNullable(true)
          .setMessage(CPEConstants.MSG_NO_ROWS)
          .build();
    }

    List<Object> validValues = Lists.newArrayListWithCapacity(values.size());
    for (Object value : values) {
      if (value != null) {
        validValues.add(value);
      }
    }
    long validCount = validValues.size();
    long nullCount = totalCount - validCount;
    long distinctCount = Sets.newHashSet(validValues).size();
    builder
        .setNullable(nullCount > 0)
        .setDistinctCount(distinctCount)
        .putStatistic(CPEConstants.STAT_TOTAL_COUNT,
            ProfileHumanizer.formatCount(totalCount))
        .putStatistic(CPEConstants.STAT_VALID_COUNT,
            ProfileHumanizer.formatCount(validCount))
        .putStatistic(CPEConstants.STAT_NULL_COUNT,
            ProfileHumanizer.formatCount(nullCount))
        .putStatistic(CPEConstants.STAT_NULL_PERCENTAGE,
            ProfileHumanizer.formatPercentage(
                CPEUtils.computePercentage(nullCount, totalCount)))
        .putStatistic(CPEConstants.STAT_DISTINCT_COUNT,
            ProfileHumanizer.formatCount(distinctCount));

    if (validCount == 0) {
      return builder.setMessage(CPEConstants.MSG_ALL_NULL).build();
    }

    // The type-specific part writes into its own builder so that a failure
    // halfway through leaves no partial statistics behind.
    StatisticsResult.Builder typed = StatisticsResult.newBuilder();
    try {
      switch (type) {
      case INTEGER:
      case FLOAT:
        computeNumeric(validValues, type, typed);
        break;
      case DATETIME:
        computeDatetime(validValues, typed);
        break;
      case BOOLEAN:
        computeBoolean(validValues, typed);
        break;
      case STRING:
        computeString(validValues, typed);
        break;
      default:
        throw new IllegalStateException("Unexpected column type: " + type);
      }
    } catch (RuntimeException e) {
      LOG.warn("Error calculating {} statistics for column '{}'",
          type, column.getName(), e);
      return builder
          .setError("Failed to calculate " + type.getTypeName() +
              " statistics: " + e.getMessage())
          .build();
    }
    StatisticsResult typedResult = typed.setColumnName(column.getName()).build();
    for (Entry<String, String> entry : typedResult.getStatistics().entrySet()) {
      builder.putStatistic(entry.getKey(), entry.getValue());
    }
    for (Entry<String, String> entry : typedResult.getTopValues().entrySet()) {
      builder.putTopValue(entry.getKey(), entry.getValue());
    }
    return builder.setNumericSample(typedResult.getNumericSample()).build();
  }

  private void computeNumeric(
      List<Object> validValues,
      ColumnType type,
      StatisticsResult.Builder builder) {
    List<Double> doubles = Lists.newArrayListWithCapacity(validValues.size());
    List<Double> finite = Lists.newArrayListWithCapacity(validValues.size());
    double sum = 0;
    for (Object value : validValues) {
      double d = ((Number) value).doubleValue();
      doubles.add(d);
      if (!Double.isNaN(d) && !Double.isInfinite(d)) {
        finite.add(d);
      }
      sum += d;
    }
    int n = doubles.size();
    double mean = sum / n;
    double stdDev = 0;
    // The sample deviation of a single value is undefined; report 0 instead.
    if (n > 1) {
      double squares = 0;
      for (double d : doubles) {
        squares += (d - mean) * (d - mean);
      }
      stdDev = Math.sqrt(squares / (n - 1));
    }
    List<Double> sorted = Ordering.natural().sortedCopy(doubles);
    double median = n % 2 == 1 ?
        sorted.get(n / 2) :
        (sorted.get(n / 2 - 1) + sorted.get(n / 2)) / 2;

    if (type == ColumnType.INTEGER) {
      long min = Long.MAX_VALUE;
      long max = Long.MIN_VALUE;
      for (Object value : validValues) {
        long l = (Long) value;
        min = Math.min(min, l);
        max = Math.max(max, l);
      }
      builder.putStatistic(CPEConstants.STAT_MIN, ProfileHumanizer.formatCount(min));
      builder.putStatistic(CPEConstants.STAT_MAX, ProfileHumanizer.formatCount(max));
    } else {
      builder.putStatistic(CPEConstants.STAT_MIN,
          ProfileHumanizer.formatDecimal(sorted.get(0), FLOAT_DECIMALS));
      builder.putStatistic(CPEConstants.STAT_MAX,
          ProfileHumanizer.formatDecimal(sorted.get(n - 1), FLOAT_DECIMALS));
    }
    builder.putStatistic(CPEConstants.STAT_MEAN,
        ProfileHumanizer.formatDecimal(mean, MEAN_DECIMALS));
    builder.putStatistic(CPEConstants.STAT_MEDIAN, formatMedian(median, type));
    builder.putStatistic(CPEConstants.STAT_STDDEV,
        ProfileHumanizer.formatDecimal(stdDev, MEAN_DECIMALS));
    builder.setNumericSample(finite);
  }

  private static String formatMedian(double median, ColumnType type) {
    if (type == ColumnType.INTEGER && median == Math.rint(median)) {
      return ProfileHumanizer.formatCount((long) median);
    }
    return ProfileHumanizer.formatDecimal(median, FLOAT_DECIMALS);
  }

  private void computeDatetime(List<Object> validValues, StatisticsResult.Builder builder) {
    DateTime min = null;
    DateTime max = null;
    for (Object value : validValues) {
      DateTime datetime = (DateTime) value;
      if (min == null || datetime.isBefore(min)) {
        min = datetime;
      }
      if (max == null || datetime.isAfter(max)) {
        max = datetime;
      }
    }
    builder.putStatistic(CPEConstants.STAT_MIN, JodaUtil.FORMATTER.print(min));
    builder.putStatistic(CPEConstants.STAT_MAX, JodaUtil.FORMATTER.print(max));
    builder.putStatistic(CPEConstants.STAT_RANGE,
        ProfileHumanizer.humanizeDuration(new Duration(min, max)));
  }

  private void computeBoolean(List<Object> validValues, StatisticsResult.Builder builder) {
    long trueCount = 0;
    long falseCount = 0;
    for (Object value : validValues) {
      if ((Boolean) value) {
        trueCount++;
      } else {
        falseCount++;
      }
    }
    builder.putStatistic(CPEConstants.STAT_TRUE_COUNT,
        ProfileHumanizer.formatCount(trueCount));
    builder.putStatistic(CPEConstants.STAT_FALSE_COUNT,
        ProfileHumanizer.formatCount(falseCount));
    builder.putStatistic(CPEConstants.STAT_TRUE_PERCENTAGE,
        ProfileHumanizer.formatPercentage(
            CPEUtils.computePercentage(trueCount, (long) validValues.size())));
  }

  private void computeString(List<Object> validValues, StatisticsResult.Builder builder) {
    String min = null;
    String max = null;
    // Insertion order of the map is first-seen order, which breaks ties.
    Map<String, Long> counts = Maps.newLinkedHashMap();
    for (Object value : validValues) {
      String s = (String) value;
      if (min == null || s.compareTo(min) < 0) {
        min = s;
      }
      if (max == null || s.compareTo(max) > 0) {
        max = s;
      }
      Long count = counts.get(s);
      counts.put(s, count == null ? 1L : count + 1);
    }
    builder.putStatistic(CPEConstants.STAT_MIN, min);
    builder.putStatistic(CPEConstants.STAT_MAX, max);

    List<Entry<String, Long>> entries = Lists.newArrayList(counts.entrySet());
    // Collections.sort is stable, so equal counts keep first-seen order.
    Collections.sort(entries, new Ordering<Entry<String, Long>>() {
      @Override
      public int compare(Entry<String, Long> left, Entry<String, Long> right) {
        return Long.compare(right.getValue(), left.getValue());
      }
    });
    int limit = Math.min(CPEConstants.TOP_VALUES_LIMIT, entries.size());
    for (Entry<String, Long> entry : entries.subList(0, limit)) {
      builder.putTopValue(entry.getKey(),
          ProfileHumanizer.formatCount(entry.getValue()));
    }
  }
}
