// Copyright (c) 2018 Cloudera, Inc. All rights reserved.
package com.cloudera.cpe.printer;

import com.cloudera.cpe.printer.TableBuilder.Justification;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import java.util.List;

import org.apache.commons.lang.StringUtils;

/**
 * Lays out a table as bordered text lines:
 *
 * <pre>
 * +--------------+
 * | Name | Value |
 * |======|=======|
 * | a    | 1     |
 * |------|-------|
 * | b    | 2     |
 * +--------------+
 * </pre>
 *
 * Multi-line cells are aligned to the top of their row.
 */
public class TablePrinter {

  private static final Splitter LINE_SPLITTER = Splitter.on('\n');

  private final TableBuilder table;
  private int colCount;
  private int[] widths;

  public TablePrinter(TableBuilder table) {
    this.table = Preconditions.checkNotNull(table);
  }

  /**
   * Returns the lines of the table, or no lines for an empty table.
   */
  public List<String> lines() {
    List<List<String>> rows = table.getRows();
    if (rows.isEmpty()) {
      return ImmutableList.of();
    }
    calcWidths(rows);
    List<String> lines = Lists.newArrayList();
    lines.add(horizBorder('+', '-'));
    int first = 0;
    if (table.hasHeader()) {
      addRow(rows.get(0), lines);
      lines.add(horizBorder('|', '='));
      first = 1;
    }
    for (int i = first; i < rows.size(); i++) {
      if (i > first) {
        lines.add(horizBorder('|', '-'));
      }
      addRow(rows.get(i), lines);
    }
    lines.add(horizBorder('+', '-'));
    return lines;
  }

  private void calcWidths(List<List<String>> rows) {
    colCount = 0;
    for (List<String> row : rows) {
      colCount = Math.max(colCount, row.size());
    }
    widths = new int[colCount];
    for (List<String> row : rows) {
      for (int i = 0; i < row.size(); i++) {
        for (String line : LINE_SPLITTER.split(row.get(i))) {
          widths[i] = Math.max(widths[i], line.length());
        }
      }
    }
  }

  private void addRow(List<String> row, List<String> lines) {
    List<List<String>> cells = Lists.newArrayListWithCapacity(colCount);
    int height = 1;
    for (int i = 0; i < colCount; i++) {
      List<String> cellLines = i < row.size() ?
          LINE_SPLITTER.splitToList(row.get(i)) : ImmutableList.<String>of();
      cells.add(cellLines);
      height = Math.max(height, cellLines.size());
    }
    for (int line = 0; line < height; line++) {
      StringBuilder buf = new StringBuilder();
      for (int i = 0; i < colCount; i++) {
        List<String> cellLines = cells.get(i);
        String value = line < cellLines.size() ? cellLines.get(line) : "";
        buf.append("| ").append(justifyCell(i, value)).append(' ');
      }
      lines.add(buf.append('|').toString());
    }
  }

  private String justifyCell(int col, String value) {
    Justification just = table.getJustification(col);
    switch (just) {
    case CENTER:
      return StringUtils.center(value, widths[col]);
    case RIGHT:
      return StringUtils.leftPad(value, widths[col]);
    default:
      return StringUtils.rightPad(value, widths[col]);
    }
  }

  /**
   * The outer borders have no column joints; the separators inside the
   * table continue the column dividers.
   */
  private String horizBorder(char cross, char rule) {
    char joint = cross == '+' ? rule : cross;
    StringBuilder buf = new StringBuilder();
    for (int i = 0; i < colCount; i++) {
      buf.append(i == 0 ? cross : joint);
      buf.append(StringUtils.repeat(String.valueOf(rule), widths[i] + 2));
    }
    return buf.append(cross).toString();
  }
}
