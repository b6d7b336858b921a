// Copyright (c) 2018 Cloudera, Inc. All rights reserved.
package com.cloudera.cpe.histogram;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits a numeric sample into equal-width bins between its minimum and
 * maximum.
 */
public class HistogramBinner {

  private static final Logger LOG = LoggerFactory.getLogger(
      HistogramBinner.class);

  // The range is widened by this fraction so that the maximum falls into the
  // last bin instead of one past it.
  private static final double RANGE_EPSILON_FRACTION = 1e-9;

  /**
   * Counts the finite values of the sample into binCount bins. Nulls, NaN
   * and infinities are skipped. The counts always add up to the number of
   * finite values.
   */
  public BinnedSample bin(List<? extends Number> values, int binCount) {
    Preconditions.checkNotNull(values);
    Preconditions.checkArgument(binCount > 0, "binCount must be positive: %s", binCount);
    List<Double> finite = Lists.newArrayListWithCapacity(values.size());
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    for (Number number : values) {
      if (number == null) {
        continue;
      }
      double value = number.doubleValue();
      if (Double.isInfinite(value) || Double.isNaN(value)) {
        continue;
      }
      finite.add(value);
      min = Math.min(min, value);
      max = Math.max(max, value);
    }
    if (finite.size() < values.size()) {
      LOG.debug("Skipped {} missing or non-finite values", values.size() - finite.size());
    }
    if (finite.isEmpty()) {
      return BinnedSample.noData();
    }
    if (min == max) {
      return BinnedSample.degenerate(min, finite.size());
    }

    double epsilon = (max - min) * RANGE_EPSILON_FRACTION;
    double range = (max - min) + epsilon;
    double binWidth = range / binCount;
    int[] counts = new int[binCount];
    for (double value : finite) {
      int index = (int) Math.floor((value - min) / binWidth);
      counts[Math.max(0, Math.min(binCount - 1, index))]++;
    }
    List<Integer> binCounts = Lists.newArrayListWithCapacity(binCount);
    for (int count : counts) {
      binCounts.add(count);
    }
    return new BinnedSample(BinnedSample.Outcome.BINNED, binCounts, min, max,
        binWidth, finite.size());
  }
}
