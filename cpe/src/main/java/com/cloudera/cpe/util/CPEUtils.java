// Copyright (c) 2018 Cloudera, Inc. All rights reserved.
package com.cloudera.cpe.util;

import com.cloudera.cpe.CPEConstants;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.util.List;
import java.util.Map;

import org.joda.time.format.DateTimeFormatter;

public class CPEUtils {

  /**
   * Compute the percentage returning null if either of the parameters is null
   * or if the denominator is zero.
   */
  public static Double computePercentage(Long numerator, Long denominator) {
    if (numerator == null || denominator == null) {
      return null;
    }
    // A column without rows has no meaningful percentage; callers decide
    // what to show instead.
    if (denominator == 0) {
      return null;
    }
    return 100.0 * numerator / (double) denominator;
  }

  /**
   * Returns a property, if present in the properties.
   */
  public static String getProperty(String propName, Map<String, String> properties) {
    Preconditions.checkNotNull(propName);
    if (properties == null) {
      return null;
    }
    if (properties.containsKey(propName)) {
      return properties.get(propName);
    }
    return null;
  }

  /**
   * Reads a positive integer property, returning the default when the
   * property is not set.
   */
  public static int getPositiveIntProperty(
      String propName,
      Map<String, String> properties,
      int defaultValue) {
    String val = getProperty(propName, properties);
    if (val == null) {
      return defaultValue;
    }
    int parsed;
    try {
      parsed = Integer.parseInt(val.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          "Invalid value for " + propName + ": " + val, e);
    }
    if (parsed <= 0) {
      throw new IllegalArgumentException(
          "Value for " + propName + " must be positive: " + val);
    }
    return parsed;
  }

  /**
   * Constructs the parsers for a list of datetime patterns.
   */
  public static ImmutableList<DateTimeFormatter> buildTimeFormatters(List<String> formats) {
    Preconditions.checkNotNull(formats);
    ImmutableList.Builder<DateTimeFormatter> timeFormatBuilder = ImmutableList
        .builder();
    for (String format : formats) {
      try {
        timeFormatBuilder.add(JodaUtil.parserForPattern(format));
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException(
            "Invalid time format: " + format, e);
      }
    }
    return timeFormatBuilder.build();
  }

  /**
   * Reads the datetime patterns used by type inference from the configuration.
   * Patterns are separated by "|||" since a pattern may contain commas.
   */
  public static ImmutableList<DateTimeFormatter> getTimeFormatsFromProperty(
      Map<String, String> properties) {
    String val = getProperty(CPEConstants.CPE_TIMEFORMAT_PROPERTY, properties);
    if (val == null) {
      return buildTimeFormatters(CPEConstants.DEFAULT_TIME_FORMATS);
    }
    List<String> formats = Splitter.on(CPEConstants.TIME_FORMAT_SEPARATOR)
        .trimResults()
        .omitEmptyStrings()
        .splitToList(val);
    if (formats.isEmpty()) {
      throw new IllegalArgumentException(
          "No time formats in " + CPEConstants.CPE_TIMEFORMAT_PROPERTY);
    }
    return buildTimeFormatters(formats);
  }

  /***
   * Reads the raw tokens that a data source treats as null.
   */
  public static ImmutableSet<String> getNullTokensFromProperty(Map<String, String> properties) {
    String val = getProperty(CPEConstants.CPE_NULL_TOKENS_PROPERTY, properties);
    if (val == null)
      return CPEConstants.DEFAULT_NULL_TOKENS;
    // The empty token is always null: a missing CSV cell has no other reading.
    return ImmutableSet.<String>builder()
        .add("")
        .addAll(Splitter.on(',').trimResults().split(val))
        .build();
  }
}
