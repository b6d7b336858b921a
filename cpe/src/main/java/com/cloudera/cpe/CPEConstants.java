// Copyright (c) 2018 Cloudera, Inc. All rights reserved.
package com.cloudera.cpe;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * Configuration constants used by the column profile engine. Also contains the
 * statistic labels, the fixed messages shown to users and the default values
 * for the profiler options, when none are set explicitly.
 */
public class CPEConstants {

  // Property names understood by ProfilerOptions.fromProperties().
  public static final String CPE_TIMEFORMAT_PROPERTY = "cpe-timeFormatters";
  public static final String CPE_HISTOGRAM_BINS_PROPERTY = "cpe-histogram-bins";
  public static final String CPE_HISTOGRAM_WIDTH_PROPERTY = "cpe-histogram-width";
  public static final String CPE_HISTOGRAM_HEIGHT_PROPERTY = "cpe-histogram-height";
  public static final String CPE_PREVIEW_ROWS_PROPERTY = "cpe-preview-rows";
  public static final String CPE_NULL_TOKENS_PROPERTY = "cpe-null-tokens";
  public static final String TIME_FORMAT_SEPARATOR = "|||";

  public static final ImmutableList<String> DEFAULT_TIME_FORMATS = ImmutableList.of(
      "yyyy-MM-dd HH:mm:ss.SSS",
      "yyyy-MM-dd HH:mm:ss",
      "yyyy-MM-dd'T'HH:mm:ss.SSSZZ",
      "yyyy-MM-dd'T'HH:mm:ssZZ",
      "yyyy-MM-dd'T'HH:mm:ss.SSS",
      "yyyy-MM-dd'T'HH:mm:ss",
      "yyyy-MM-dd",
      "yyyy/MM/dd",
      "MM/dd/yyyy",
      "dd-MMM-yyyy");
  public static final ImmutableSet<String> DEFAULT_NULL_TOKENS = ImmutableSet.of(
      "", "NULL", "null", "None", "N/A", "n/a", "NaN", "nan");
  public static final int DEFAULT_HISTOGRAM_BINS = 15;
  public static final int DEFAULT_HISTOGRAM_WIDTH = 60;
  public static final int DEFAULT_HISTOGRAM_HEIGHT = 8;
  public static final int DEFAULT_PREVIEW_ROWS = 50;

  // Type inference. A hypothesis is adopted when strictly more than this
  // fraction of the candidate values convert.
  public static final double TYPE_COVERAGE_THRESHOLD = 0.8;

  // Histogram visualization policy.
  public static final long MIN_HISTOGRAM_VALUES = 20;
  public static final long MIN_CONTINUOUS_DISTINCT_VALUES = 15;
  public static final double MAX_DISTINCT_RATIO = 0.95;

  public static final int TOP_VALUES_LIMIT = 5;

  public static final String STAT_TOTAL_COUNT = "Total Count";
  public static final String STAT_VALID_COUNT = "Valid Count";
  public static final String STAT_NULL_COUNT = "Null Count";
  public static final String STAT_NULL_PERCENTAGE = "Null Percentage";
  public static final String STAT_DISTINCT_COUNT = "Distinct Count";
  public static final String STAT_MIN = "Min";
  public static final String STAT_MAX = "Max";
  public static final String STAT_MEAN = "Mean";
  public static final String STAT_MEDIAN = "Median (50%)";
  public static final String STAT_STDDEV = "StdDev";
  public static final String STAT_RANGE = "Range";
  public static final String STAT_TRUE_COUNT = "True Count";
  public static final String STAT_FALSE_COUNT = "False Count";
  public static final String STAT_TRUE_PERCENTAGE = "True Percentage";
  public static final String STAT_TOP_VALUES = "Top Values";

  public static final String MSG_NO_ROWS = "Column contains no rows.";
  public static final String MSG_ALL_NULL = "Column contains only null values.";
  public static final String MSG_DISCRETE_DATA =
      "(Histogram not shown: column appears to hold discrete values)";

  // Histogram texts are shown as is by the presentation layer.
  public static final String HISTOGRAM_NO_DATA = "(No data available for histogram)";
  public static final String HISTOGRAM_NO_VALID_DATA = "(No valid numerical data to plot)";
  public static final String HISTOGRAM_IDENTICAL_VALUES = "(All values are identical: %s)";
  public static final String HISTOGRAM_TOO_NARROW =
      "(Terminal width too narrow to draw histogram)";
  public static final String HISTOGRAM_EMPTY_BINS = "(No data falls within histogram bins)";

  public static final String UNKNOWN = "Unknown";

  public static final long ONE_KILOBYTE = 1024L;
  public static final long ONE_MEGABYTE = 1024L * ONE_KILOBYTE;
  public static final long ONE_GIGABYTE = 1024L * ONE_MEGABYTE;
}
