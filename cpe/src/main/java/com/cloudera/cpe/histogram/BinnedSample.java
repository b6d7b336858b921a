// Copyright (c) 2018 Cloudera, Inc. All rights reserved.
package com.cloudera.cpe.histogram;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Struct-like class that holds the outcome of binning a numeric sample.
 *
 * Bin i covers the half-open interval [min + i * w, min + (i + 1) * w) where
 * w is getBinWidth(); the last bin also holds the maximum.
 */
public class BinnedSample {

  /**
   * Whether the sample could be binned, and if not, why.
   */
  public enum Outcome {
    BINNED,
    // No finite value in the sample.
    NO_DATA,
    // All finite values are equal, so there is no range to split.
    DEGENERATE_RANGE
  }

  final Outcome outcome;
  final ImmutableList<Integer> binCounts;
  final double min;
  final double max;
  final double binWidth;
  final int valueCount;

  BinnedSample(
      final Outcome outcome,
      final List<Integer> binCounts,
      final double min,
      final double max,
      final double binWidth,
      final int valueCount) {
    Preconditions.checkNotNull(outcome);
    Preconditions.checkNotNull(binCounts);
    this.outcome = outcome;
    this.binCounts = ImmutableList.copyOf(binCounts);
    this.min = min;
    this.max = max;
    this.binWidth = binWidth;
    this.valueCount = valueCount;
  }

  static BinnedSample noData() {
    return new BinnedSample(Outcome.NO_DATA, ImmutableList.<Integer>of(),
        Double.NaN, Double.NaN, Double.NaN, 0);
  }

  static BinnedSample degenerate(double value, int valueCount) {
    return new BinnedSample(Outcome.DEGENERATE_RANGE, ImmutableList.<Integer>of(),
        value, value, 0, valueCount);
  }

  public Outcome getOutcome() {
    return outcome;
  }

  public boolean isBinned() {
    return outcome == Outcome.BINNED;
  }

  /**
   * The count of each bin, lowest bin first. Empty unless the sample was
   * binned.
   */
  public ImmutableList<Integer> getBinCounts() {
    return binCounts;
  }

  /**
   * The smallest finite value. NaN when there is no data.
   */
  public double getMin() {
    return min;
  }

  /**
   * The largest finite value. NaN when there is no data.
   */
  public double getMax() {
    return max;
  }

  public double getBinWidth() {
    return binWidth;
  }

  /**
   * The number of finite values that went into the bins.
   */
  public int getValueCount() {
    return valueCount;
  }

  /**
   * The inclusive lower bound of bin i.
   */
  public double getLowerBound(int i) {
    Preconditions.checkState(isBinned());
    Preconditions.checkElementIndex(i, binCounts.size());
    return min + i * binWidth;
  }

  /**
   * The exclusive upper bound of bin i.
   */
  public double getUpperBound(int i) {
    Preconditions.checkState(isBinned());
    Preconditions.checkElementIndex(i, binCounts.size());
    return min + (i + 1) * binWidth;
  }
}
