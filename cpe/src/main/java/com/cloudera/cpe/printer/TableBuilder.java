// Copyright (c) 2018 Cloudera, Inc. All rights reserved.
package com.cloudera.cpe.printer;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import java.util.List;

/**
 * Collects the cells of a text table, row by row. A cell may span several
 * lines, either by adding values to it one at a time or by containing
 * newlines. Column justification is set on the header row.
 */
public class TableBuilder {

  public enum Justification {
    LEFT, CENTER, RIGHT
  }

  private boolean hasHeader;
  private final List<List<String>> rows = Lists.newArrayList();
  private final List<Justification> justification = Lists.newArrayList();
  private List<String> row;
  private int col;

  public TableBuilder startHeader() {
    Preconditions.checkState(!hasHeader, "Table already has a header");
    Preconditions.checkState(rows.isEmpty(), "Header must be the first row");
    hasHeader = true;
    return startRow();
  }

  public TableBuilder startRow() {
    Preconditions.checkState(row == null, "Row already started");
    row = Lists.newArrayList();
    rows.add(row);
    col = -1;
    return this;
  }

  public TableBuilder endRow() {
    Preconditions.checkState(row != null, "No row started");
    if (row.isEmpty()) {
      // A header row that only set justification is not a header.
      if (hasHeader && rows.size() == 1) {
        hasHeader = false;
      }
      rows.remove(rows.size() - 1);
    }
    row = null;
    return this;
  }

  /**
   * Moves to the next cell without giving it a value yet.
   */
  public TableBuilder startCell() {
    Preconditions.checkState(row != null, "No row started");
    col++;
    return this;
  }

  /**
   * Adds a value to the current cell. A second value goes on a new line of
   * the same cell.
   */
  public TableBuilder value(String value) {
    Preconditions.checkState(row != null, "No row started");
    Preconditions.checkState(col >= 0, "No cell started");
    Preconditions.checkNotNull(value);
    while (row.size() < col) {
      row.add("");
    }
    if (row.size() == col) {
      row.add(value);
    } else {
      String cellValue = row.get(col);
      row.set(col, cellValue.isEmpty() ? value : cellValue + "\n" + value);
    }
    return this;
  }

  public TableBuilder cell(String value) {
    return startCell().value(value);
  }

  public TableBuilder cell() {
    return cell("");
  }

  /**
   * Sets the justification of the current column. Only allowed in the
   * header row.
   */
  public TableBuilder justify(Justification just) {
    Preconditions.checkState(hasHeader && rows.size() == 1 && row != null,
        "Justification is set in the header row");
    Preconditions.checkState(col >= 0, "No cell started");
    while (justification.size() <= col) {
      justification.add(Justification.LEFT);
    }
    justification.set(col, just);
    return this;
  }

  public boolean hasHeader() {
    return hasHeader;
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  public List<List<String>> getRows() {
    return ImmutableList.copyOf(rows);
  }

  /**
   * The justification of a column, LEFT unless set.
   */
  public Justification getJustification(int column) {
    return column < justification.size() ?
        justification.get(column) : Justification.LEFT;
  }
}
