// Copyright (c) 2018 Cloudera, Inc. All rights reserved.
package com.cloudera.cpe.source;

import com.cloudera.cpe.ColumnType;

import java.io.Closeable;
import java.util.List;

/**
 * A tabular data file, already read into memory as a preview. The profiler
 * pulls raw column values from it; there is no streaming or partial read.
 *
 * Sources hold their data until closed. Callers open them in a
 * try-with-resources block, and implementations throw DataSourceException
 * when used after close().
 */
public interface TabularDataSource extends Closeable {

  /**
   * A name for the source that users recognize, usually the file path.
   */
  public String getName();

  /**
   * The file format, e.g. "CSV".
   */
  public String getFormatName();

  /**
   * The column names, in file order.
   */
  public List<String> getColumnNames();

  /**
   * The number of rows in the preview.
   */
  public long getRowCount();

  public int getColumnCount();

  /**
   * The size of the underlying file in bytes, or -1 if not known.
   */
  public long getRawByteSize();

  /**
   * Returns the raw values of a column, one per row, null for missing
   * values.
   *
   * @throws DataSourceException if there is no such column
   */
  public List<String> getRawValues(String columnName);

  /**
   * Returns the type the file declares for a column, or null if the file
   * does not declare one and the type must be inferred.
   *
   * @throws DataSourceException if there is no such column
   */
  public ColumnType getDeclaredType(String columnName);
}
