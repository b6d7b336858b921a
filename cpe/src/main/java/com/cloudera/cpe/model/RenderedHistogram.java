// Copyright (c) 2018 Cloudera, Inc. All rights reserved.
package com.cloudera.cpe.model;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Text lines ready to be placed in a monospace viewport. A plot has lines of
 * exactly the requested width; a message is a single explanatory line used
 * when there is nothing sensible to draw.
 */
public class RenderedHistogram {

  private final ImmutableList<String> lines;
  private final boolean plot;

  private RenderedHistogram(List<String> lines, boolean plot) {
    this.lines = ImmutableList.copyOf(lines);
    this.plot = plot;
  }

  public static RenderedHistogram plot(List<String> lines) {
    Preconditions.checkNotNull(lines);
    Preconditions.checkArgument(!lines.isEmpty());
    return new RenderedHistogram(lines, true);
  }

  public static RenderedHistogram message(String message) {
    Preconditions.checkNotNull(message);
    return new RenderedHistogram(ImmutableList.of(message), false);
  }

  public ImmutableList<String> getLines() {
    return lines;
  }

  /**
   * True if the lines draw a histogram, false if they explain why none was
   * drawn.
   */
  public boolean isPlot() {
    return plot;
  }

  @Override
  public String toString() {
    return String.join("\n", lines);
  }
}
