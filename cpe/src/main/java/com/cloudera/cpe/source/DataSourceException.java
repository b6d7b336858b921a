// Copyright (c) 2018 Cloudera, Inc. All rights reserved.
package com.cloudera.cpe.source;

/**
 * This exception is thrown if a tabular data source cannot provide what was
 * asked of it: the file cannot be read, a column does not exist, or the
 * source was already closed.
 */
public class DataSourceException extends RuntimeException {
  private static final long serialVersionUID = 7409461281763259512L;

  public DataSourceException(String message) {
    super(message);
  }

  public DataSourceException(String message, Throwable t) {
    super(message, t);
  }
}
