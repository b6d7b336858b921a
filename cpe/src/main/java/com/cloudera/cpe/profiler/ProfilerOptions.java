// Copyright (c) 2018 Cloudera, Inc. All rights reserved.
package com.cloudera.cpe.profiler;

import com.cloudera.cpe.CPEConstants;
import com.cloudera.cpe.util.CPEUtils;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.joda.time.format.DateTimeFormatter;

/**
 * The settings of a profiler: the datetime patterns tried by type inference,
 * the histogram geometry, the preview size and the tokens read as null.
 * Options are read from a property map, see CPEConstants for the keys; a
 * property that is not set keeps its default.
 */
public class ProfilerOptions {

  private final ImmutableList<DateTimeFormatter> timeFormatters;
  private final int histogramBins;
  private final int histogramWidth;
  private final int histogramHeight;
  private final int previewRows;
  private final ImmutableSet<String> nullTokens;

  public ProfilerOptions(
      final List<DateTimeFormatter> timeFormatters,
      final int histogramBins,
      final int histogramWidth,
      final int histogramHeight,
      final int previewRows,
      final Set<String> nullTokens) {
    Preconditions.checkNotNull(timeFormatters);
    Preconditions.checkArgument(histogramBins > 0);
    Preconditions.checkArgument(histogramWidth > 0);
    Preconditions.checkArgument(histogramHeight > 0);
    Preconditions.checkArgument(previewRows > 0);
    Preconditions.checkNotNull(nullTokens);
    this.timeFormatters = ImmutableList.copyOf(timeFormatters);
    this.histogramBins = histogramBins;
    this.histogramWidth = histogramWidth;
    this.histogramHeight = histogramHeight;
    this.previewRows = previewRows;
    this.nullTokens = ImmutableSet.copyOf(nullTokens);
  }

  public static ProfilerOptions defaults() {
    return fromProperties(ImmutableMap.<String, String>of());
  }

  /**
   * Reads the options from a property map.
   *
   * @throws IllegalArgumentException if a property has an invalid value
   */
  public static ProfilerOptions fromProperties(Map<String, String> properties) {
    return new ProfilerOptions(
        CPEUtils.getTimeFormatsFromProperty(properties),
        CPEUtils.getPositiveIntProperty(CPEConstants.CPE_HISTOGRAM_BINS_PROPERTY,
            properties, CPEConstants.DEFAULT_HISTOGRAM_BINS),
        CPEUtils.getPositiveIntProperty(CPEConstants.CPE_HISTOGRAM_WIDTH_PROPERTY,
            properties, CPEConstants.DEFAULT_HISTOGRAM_WIDTH),
        CPEUtils.getPositiveIntProperty(CPEConstants.CPE_HISTOGRAM_HEIGHT_PROPERTY,
            properties, CPEConstants.DEFAULT_HISTOGRAM_HEIGHT),
        CPEUtils.getPositiveIntProperty(CPEConstants.CPE_PREVIEW_ROWS_PROPERTY,
            properties, CPEConstants.DEFAULT_PREVIEW_ROWS),
        CPEUtils.getNullTokensFromProperty(properties));
  }

  public ImmutableList<DateTimeFormatter> getTimeFormatters() {
    return timeFormatters;
  }

  public int getHistogramBins() {
    return histogramBins;
  }

  public int getHistogramWidth() {
    return histogramWidth;
  }

  public int getHistogramHeight() {
    return histogramHeight;
  }

  public int getPreviewRows() {
    return previewRows;
  }

  public ImmutableSet<String> getNullTokens() {
    return nullTokens;
  }
}
