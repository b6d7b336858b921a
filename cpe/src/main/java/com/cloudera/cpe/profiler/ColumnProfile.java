// Copyright (c) 2018 Cloudera, Inc. All rights reserved.
package com.cloudera.cpe.profiler;

import com.cloudera.cpe.histogram.VisualizationPolicy.Decision;
import com.cloudera.cpe.model.RenderedHistogram;
import com.cloudera.cpe.model.StatisticsResult;
import com.google.common.base.Preconditions;

/**
 * Everything shown for one selected column: its statistics, what the
 * visualization policy decided and, if anything is to be drawn, the
 * histogram lines.
 */
public class ColumnProfile {

  private final StatisticsResult statistics;
  private final Decision decision;
  private final RenderedHistogram histogram;

  public ColumnProfile(
      StatisticsResult statistics,
      Decision decision,
      RenderedHistogram histogram) {
    this.statistics = Preconditions.checkNotNull(statistics);
    this.decision = Preconditions.checkNotNull(decision);
    this.histogram = histogram;
  }

  public StatisticsResult getStatistics() {
    return statistics;
  }

  public Decision getDecision() {
    return decision;
  }

  /**
   * The histogram, a note explaining why none is drawn, or null if there is
   * nothing to show.
   */
  public RenderedHistogram getHistogram() {
    return histogram;
  }
}
