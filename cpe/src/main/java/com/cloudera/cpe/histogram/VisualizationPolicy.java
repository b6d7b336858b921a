// Copyright (c) 2018 Cloudera, Inc. All rights reserved.
package com.cloudera.cpe.histogram;

import com.cloudera.cpe.CPEConstants;
import com.cloudera.cpe.ColumnType;

/**
 * Decides whether a column is worth drawing as a histogram. Only numeric
 * columns with enough values that look continuous qualify: columns with few
 * distinct values read better as a list of categories, and columns where
 * almost every value is unique (identifiers, row numbers) give a flat,
 * meaningless histogram.
 */
public class VisualizationPolicy {

  /**
   * The outcome of the policy. Only SHOW means a histogram is drawn; the other
   * values say which check failed.
   */
  public enum Decision {
    SHOW,
    NOT_NUMERIC,
    TOO_FEW_VALUES,
    DISCRETE,
    NEAR_UNIQUE
  }

  public boolean decide(ColumnType type, long distinctCount, long totalCount) {
    return evaluate(type, distinctCount, totalCount) == Decision.SHOW;
  }

  /**
   * Runs the checks in order and returns the first one that fails, or SHOW.
   * A null type never qualifies.
   */
  public Decision evaluate(ColumnType type, long distinctCount, long totalCount) {
    if (type == null || !type.isNumeric()) {
      return Decision.NOT_NUMERIC;
    }
    if (totalCount < CPEConstants.MIN_HISTOGRAM_VALUES || distinctCount <= 1) {
      return Decision.TOO_FEW_VALUES;
    }
    if (distinctCount < CPEConstants.MIN_CONTINUOUS_DISTINCT_VALUES) {
      return Decision.DISCRETE;
    }
    double distinctRatio = (double) distinctCount / totalCount;
    if (distinctRatio > CPEConstants.MAX_DISTINCT_RATIO) {
      return Decision.NEAR_UNIQUE;
    }
    return Decision.SHOW;
  }
}
