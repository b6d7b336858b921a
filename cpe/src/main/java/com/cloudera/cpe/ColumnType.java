// Copyright (c) 2018 Cloudera, Inc. All rights reserved.
package com.cloudera.cpe;

/**
 * The semantic type of a column. The set is closed: every consumer switches
 * over all of the values.
 */
public enum ColumnType {
  STRING("string", "Text Columns"),
  INTEGER("integer", "Integer Columns"),
  FLOAT("float", "Numeric Columns"),
  DATETIME("datetime", "Date/Time Columns"),
  BOOLEAN("boolean", "Boolean Columns");

  private final String typeName;
  private final String summaryLabel;

  private ColumnType(String typeName, String summaryLabel) {
    this.typeName = typeName;
    this.summaryLabel = summaryLabel;
  }

  /**
   * The lower-case name shown to users, e.g. "integer".
   */
  public String getTypeName() {
    return typeName;
  }

  /**
   * The label used when counting columns by type in a metadata summary.
   */
  public String getSummaryLabel() {
    return summaryLabel;
  }

  public boolean isNumeric() {
    return this == INTEGER || this == FLOAT;
  }

  /**
   * Looks up a type by its name, ignoring case and surrounding blanks.
   * Returns null for names that are not known so that callers can fall back
   * to inference.
   */
  public static ColumnType fromTypeName(String name) {
    if (name == null) {
      return null;
    }
    String trimmed = name.trim();
    for (ColumnType type : values()) {
      if (type.typeName.equalsIgnoreCase(trimmed)) {
        return type;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return typeName;
  }
}
