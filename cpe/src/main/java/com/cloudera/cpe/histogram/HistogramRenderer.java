// Copyright (c) 2018 Cloudera, Inc. All rights reserved.
package com.cloudera.cpe.histogram;

import com.cloudera.cpe.CPEConstants;
import com.cloudera.cpe.model.RenderedHistogram;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

import java.util.List;
import java.util.Locale;

import org.apache.commons.lang.StringUtils;

/**
 * Draws bin counts as a text histogram of a fixed size.
 *
 * A plot has a y-axis label column on the left, one bar column per character
 * of the remaining width and a line of x-axis labels at the bottom:
 *
 * <pre>
 * 12 | ▃█▆
 *    | ███▂
 * 0  +-████
 *       0  5  10
 * </pre>
 *
 * Every line of a plot is exactly as wide as requested and a plot has
 * height + 2 lines, plus one for the title. Inputs that cannot be drawn give
 * a single explanatory line instead; nothing here throws for bad data.
 */
public class HistogramRenderer {

  // From empty to full block; a partial cell picks one by its filled fraction.
  @VisibleForTesting
  static final char[] TICK_CHARS =
      {' ', '▂', '▃', '▄', '▅', '▆', '▇', '█'};
  private static final char FULL_BLOCK = TICK_CHARS[TICK_CHARS.length - 1];
  // Characters between the y-axis labels and the bars: " | " or " +-".
  private static final int AXIS_GUTTER = 3;
  private static final int MIN_LABEL_GAP = 4;

  private final HistogramBinner binner;

  public HistogramRenderer() {
    this(new HistogramBinner());
  }

  public HistogramRenderer(HistogramBinner binner) {
    this.binner = Preconditions.checkNotNull(binner);
  }

  /**
   * Bins the sample and draws it. Handles the inputs that have nothing to
   * draw: no values, no finite values and values that are all the same.
   *
   * @param title optional, null for none
   */
  public RenderedHistogram renderSample(
      List<? extends Number> values,
      int binCount,
      int width,
      int height,
      String title) {
    if (values == null || values.isEmpty()) {
      return RenderedHistogram.message(CPEConstants.HISTOGRAM_NO_DATA);
    }
    BinnedSample sample = binner.bin(values, binCount);
    switch (sample.getOutcome()) {
    case NO_DATA:
      return RenderedHistogram.message(CPEConstants.HISTOGRAM_NO_VALID_DATA);
    case DEGENERATE_RANGE:
      return RenderedHistogram.message(String.format(
          CPEConstants.HISTOGRAM_IDENTICAL_VALUES, formatAxisNumber(sample.getMin())));
    case BINNED:
      return render(sample.getBinCounts(), sample.getMin(), sample.getMax(),
          width, height, title);
    default:
      throw new IllegalStateException("Unexpected outcome: " + sample.getOutcome());
    }
  }

  /**
   * Draws the given bin counts. The number of bins does not depend on the
   * width: bins are stretched or shrunk to the plot width by picking, for each
   * output column, the bin at the same relative position.
   *
   * @param title optional, null for none
   */
  public RenderedHistogram render(
      List<Integer> binCounts,
      double min,
      double max,
      int width,
      int height,
      String title) {
    Preconditions.checkNotNull(binCounts);
    Preconditions.checkArgument(height > 0, "height must be positive: %s", height);
    int maxCount = 0;
    for (int count : binCounts) {
      maxCount = Math.max(maxCount, count);
    }
    if (maxCount == 0) {
      return RenderedHistogram.message(CPEConstants.HISTOGRAM_EMPTY_BINS);
    }

    int yAxisWidth = String.valueOf(maxCount).length();
    int plotWidth = width - yAxisWidth - AXIS_GUTTER;
    if (plotWidth <= 0) {
      return RenderedHistogram.message(CPEConstants.HISTOGRAM_TOO_NARROW);
    }
    int[] columns = resample(binCounts, plotWidth);

    List<String> lines = Lists.newArrayListWithCapacity(height + 3);
    if (title != null) {
      lines.add(fit(StringUtils.center(title, width), width));
    }
    for (int row = height; row >= 0; row--) {
      StringBuilder line = new StringBuilder(width);
      if (row == height) {
        line.append(StringUtils.rightPad(String.valueOf(maxCount), yAxisWidth)).append(" | ");
      } else if (row == 0) {
        line.append(StringUtils.rightPad("0", yAxisWidth)).append(" +-");
      } else {
        line.append(StringUtils.repeat(" ", yAxisWidth)).append(" | ");
      }
      for (int count : columns) {
        line.append(barCell((double) count / maxCount * height, row));
      }
      lines.add(line.toString());
    }
    lines.add(fit(StringUtils.repeat(" ", yAxisWidth + AXIS_GUTTER) +
        xAxisLabels(min, max, plotWidth), width));
    return RenderedHistogram.plot(lines);
  }

  private static int[] resample(List<Integer> binCounts, int plotWidth) {
    int numBins = binCounts.size();
    int[] columns = new int[plotWidth];
    for (int i = 0; i < plotWidth; i++) {
      columns[i] = binCounts.get((int) ((long) i * numBins / plotWidth));
    }
    return columns;
  }

  /**
   * The character of one bar at one row. Row 0 is the baseline.
   */
  @VisibleForTesting
  static char barCell(double scaledHeight, int row) {
    if (scaledHeight >= row) {
      return FULL_BLOCK;
    }
    if (scaledHeight > row - 1) {
      int index = (int) Math.floor((scaledHeight - row + 1) * (TICK_CHARS.length - 1));
      return TICK_CHARS[Math.max(0, index)];
    }
    if (row == 0) {
      return '-';
    }
    return ' ';
  }

  /**
   * Lays out min, midpoint and max labels across the plot width, falling back
   * to min and max alone when three labels do not fit.
   */
  @VisibleForTesting
  static String xAxisLabels(double min, double max, int plotWidth) {
    String minLabel = formatAxisNumber(min);
    String maxLabel = formatAxisNumber(max);
    String twoPoint = minLabel +
        StringUtils.repeat(" ", plotWidth - minLabel.length() - maxLabel.length()) +
        maxLabel;
    if (plotWidth - minLabel.length() - maxLabel.length() < MIN_LABEL_GAP) {
      return twoPoint;
    }
    String midLabel = formatAxisNumber((min + max) / 2);
    int half = plotWidth / 2;
    int spacing1 = half - minLabel.length() - midLabel.length() / 2;
    int spacing2 = (plotWidth - half) -
        (midLabel.length() - midLabel.length() / 2) - maxLabel.length();
    if (spacing1 < 1 || spacing2 < 1) {
      return twoPoint;
    }
    return minLabel + StringUtils.repeat(" ", spacing1) + midLabel +
        StringUtils.repeat(" ", spacing2) + maxLabel;
  }

  /**
   * Formats an axis value compactly: whole numbers without decimals, very
   * small or very large magnitudes in scientific notation, and otherwise one
   * or two decimals depending on the magnitude.
   */
  public static String formatAxisNumber(double value) {
    double abs = Math.abs(value);
    if ((abs < 1e-4 && value != 0) || abs >= 1e5) {
      return String.format(Locale.ROOT, "%.1e", value);
    }
    long truncated = (long) value;
    if (isClose(value, truncated)) {
      return Long.toString(truncated);
    }
    if (abs < 10) {
      return String.format(Locale.ROOT, "%.2f", value);
    }
    if (abs < 100) {
      return String.format(Locale.ROOT, "%.1f", value);
    }
    return Long.toString(truncated);
  }

  private static boolean isClose(double a, double b) {
    return Math.abs(a - b) <= 1e-9 * Math.max(Math.abs(a), Math.abs(b));
  }

  private static String fit(String line, int width) {
    String padded = StringUtils.rightPad(line, width);
    return padded.length() > width ? padded.substring(0, width) : padded;
  }
}
