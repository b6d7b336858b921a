// Copyright (c) 2018 Cloudera, Inc. All rights reserved.
package com.cloudera.cpe.printer;

import com.cloudera.cpe.CPEConstants;
import com.cloudera.cpe.model.RenderedHistogram;
import com.cloudera.cpe.model.StatisticsResult;
import com.cloudera.cpe.printer.TableBuilder.Justification;
import com.cloudera.cpe.profiler.ColumnProfile;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.Lists;

import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import org.apache.commons.lang.StringUtils;

/**
 * Formats profiles as plain text lines for a monospace display.
 */
public class ProfilePrinter {

  public static final String NO_STATS =
      "  (No specific stats calculated for this type)";

  /**
   * Formats the statistics of one column: a header naming the column and its
   * type, then any error or message, then the statistics as a table.
   */
  public List<String> formatStatistics(StatisticsResult result) {
    Preconditions.checkNotNull(result);
    List<String> lines = Lists.newArrayList();
    String name = result.getColumnName();
    String typeName = result.getTypeName();
    lines.add("Column: `" + name + "`");
    lines.add("Type:   " + typeName + " (" + nullability(result.getNullable()) + ")");
    lines.add(StringUtils.repeat("─", name.length() + typeName.length() + 20));

    if (result.hasError()) {
      lines.add("Calculation Error:");
      for (String line : Splitter.on('\n').split(result.getError())) {
        lines.add("  " + line);
      }
      lines.add("");
    }
    if (result.getMessage() != null) {
      lines.add("Info: " + result.getMessage());
      lines.add("");
    }

    if (!result.getStatistics().isEmpty()) {
      lines.add("Calculated Statistics:");
      lines.addAll(new TablePrinter(statisticsTable(result)).lines());
    } else if (!result.hasError()) {
      lines.add("Calculated Statistics:");
      lines.add(NO_STATS);
    }
    return lines;
  }

  private static String nullability(Boolean nullable) {
    if (nullable == null) {
      return "Unknown Nullability";
    }
    return nullable ? "Nullable" : "Required";
  }

  private static TableBuilder statisticsTable(StatisticsResult result) {
    TableBuilder table = new TableBuilder()
        .startHeader()
        .cell("Statistic")
        .cell("Value")
        .endRow();
    for (Entry<String, String> entry : result.getStatistics().entrySet()) {
      table.startRow()
          .cell(entry.getKey())
          .cell(entry.getValue())
          .endRow();
    }
    if (!result.getTopValues().isEmpty()) {
      table.startRow()
          .cell(CPEConstants.STAT_TOP_VALUES)
          .startCell();
      for (Entry<String, String> entry : result.getTopValues().entrySet()) {
        table.value(entry.getKey() + ": " + entry.getValue());
      }
      table.endRow();
    }
    return table;
  }

  /**
   * Formats a metadata summary as one titled table per section.
   */
  public List<String> formatMetadata(Map<String, Map<String, String>> summary) {
    Preconditions.checkNotNull(summary);
    List<String> lines = Lists.newArrayList();
    for (Entry<String, Map<String, String>> section : summary.entrySet()) {
      if (!lines.isEmpty()) {
        lines.add("");
      }
      lines.add(section.getKey() + ":");
      TableBuilder table = new TableBuilder()
          .startHeader()
          .startCell().justify(Justification.LEFT)
          .startCell().justify(Justification.RIGHT)
          .endRow();
      for (Entry<String, String> entry : section.getValue().entrySet()) {
        table.startRow()
            .cell(entry.getKey())
            .cell(entry.getValue())
            .endRow();
      }
      List<String> tableLines = new TablePrinter(table).lines();
      if (tableLines.isEmpty()) {
        lines.add("  (none)");
      } else {
        lines.addAll(tableLines);
      }
    }
    return lines;
  }

  /**
   * Formats a column profile: its statistics followed by its histogram, if
   * it has one.
   */
  public List<String> formatProfile(ColumnProfile profile) {
    Preconditions.checkNotNull(profile);
    List<String> lines = formatStatistics(profile.getStatistics());
    RenderedHistogram histogram = profile.getHistogram();
    if (histogram != null) {
      lines.add("");
      if (histogram.isPlot()) {
        lines.add("Distribution:");
      }
      lines.addAll(histogram.getLines());
    }
    return lines;
  }
}
