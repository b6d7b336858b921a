// Copyright (c) 2018 Cloudera, Inc. All rights reserved.
package com.cloudera.cpe.inference;

import com.cloudera.cpe.CPEConstants;
import com.cloudera.cpe.ColumnType;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import org.joda.time.DateTime;
import org.joda.time.format.DateTimeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Infers the semantic type of a column from its raw text values.
 *
 * The hypotheses are tried in a fixed order and the first one that converts
 * enough values wins: numeric, then datetime, then boolean. A column that
 * matches none of them is a string column. For numeric and datetime the
 * coverage is measured against the non-null values; for boolean it is
 * measured against all values, so nulls count against it.
 *
 * Inference never fails: values that do not convert only lower the coverage,
 * and become null if their hypothesis is adopted anyway. The engine keeps no
 * state between calls and can be shared.
 */
public class TypeInferenceEngine {

  private static final Logger LOG = LoggerFactory.getLogger(
      TypeInferenceEngine.class);

  private static final Pattern INTEGER_PATTERN = Pattern.compile("[+-]?\\d+");
  private static final Pattern DECIMAL_PATTERN =
      Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
  private static final Pattern INFINITY_PATTERN =
      Pattern.compile("([+-]?)(inf|infinity)", Pattern.CASE_INSENSITIVE);
  // Doubles at or above 2^63 do not fit in a long.
  private static final double LONG_RANGE_LIMIT = Math.pow(2, 63);

  public static final ImmutableMap<String, Boolean> BOOLEAN_TOKENS =
      ImmutableMap.<String, Boolean>builder()
          .put("true", true)
          .put("false", false)
          .put("t", true)
          .put("f", false)
          .put("1", true)
          .put("0", false)
          .put("yes", true)
          .put("no", false)
          .put("y", true)
          .put("n", false)
          .build();

  private final ImmutableList<DateTimeFormatter> timeFormatters;

  public TypeInferenceEngine(List<DateTimeFormatter> timeFormatters) {
    Preconditions.checkNotNull(timeFormatters);
    this.timeFormatters = ImmutableList.copyOf(timeFormatters);
  }

  /**
   * Infers the type of the given values, nulls meaning missing values.
   */
  public InferenceResult infer(List<String> values) {
    Preconditions.checkNotNull(values);
    int total = values.size();
    int nonNull = 0;
    for (String value : values) {
      if (value != null) {
        nonNull++;
      }
    }
    if (nonNull == 0) {
      // Nothing to look at: an empty or all-null column is a nullable string.
      return new InferenceResult(ColumnType.STRING, values, true);
    }

    List<Number> numbers = Lists.newArrayListWithCapacity(total);
    int converted = 0;
    for (String value : values) {
      Number number = value == null ? null : parseNumber(value);
      if (number != null) {
        converted++;
      }
      numbers.add(number);
    }
    if (meetsThreshold(converted, nonNull)) {
      return narrowNumbers(numbers, converted < total);
    }

    List<DateTime> datetimes = Lists.newArrayListWithCapacity(total);
    converted = 0;
    for (String value : values) {
      DateTime datetime = value == null ? null : parseDateTime(value);
      if (datetime != null) {
        converted++;
      }
      datetimes.add(datetime);
    }
    if (meetsThreshold(converted, nonNull)) {
      LOG.debug("Inferred datetime for {} of {} non-null values", converted, nonNull);
      return new InferenceResult(ColumnType.DATETIME, datetimes, converted < total);
    }

    List<Boolean> booleans = Lists.newArrayListWithCapacity(total);
    converted = 0;
    for (String value : values) {
      Boolean bool = value == null ? null : parseBoolean(value);
      if (bool != null) {
        converted++;
      }
      booleans.add(bool);
    }
    if (meetsThreshold(converted, total)) {
      LOG.debug("Inferred boolean for {} of {} values", converted, total);
      return new InferenceResult(ColumnType.BOOLEAN, booleans, converted < total);
    }

    return new InferenceResult(ColumnType.STRING, values, nonNull < total);
  }

  /**
   * Converts the values to a type that is already known, for example one
   * declared by the data source. No threshold applies: every value that does
   * not convert becomes null.
   */
  public InferenceResult coerce(List<String> values, ColumnType type) {
    Preconditions.checkNotNull(values);
    Preconditions.checkNotNull(type);
    List<Object> converted = Lists.newArrayListWithCapacity(values.size());
    boolean hasNulls = false;
    for (String value : values) {
      Object typed = value == null ? null : convert(value, type);
      hasNulls |= typed == null;
      converted.add(typed);
    }
    return new InferenceResult(type, converted, hasNulls || values.isEmpty());
  }

  private Object convert(String value, ColumnType type) {
    switch (type) {
    case INTEGER:
      Number number = parseNumber(value);
      if (number == null || number instanceof Long) {
        return number;
      }
      return isWholeLong(number.doubleValue()) ? (Object) (long) number.doubleValue() : null;
    case FLOAT:
      Number decimal = parseNumber(value);
      return decimal == null ? null : (Object) decimal.doubleValue();
    case DATETIME:
      return parseDateTime(value);
    case BOOLEAN:
      return parseBoolean(value);
    case STRING:
      return value;
    default:
      throw new IllegalStateException("Unexpected column type: " + type);
    }
  }

  private static boolean meetsThreshold(int converted, int candidates) {
    return candidates > 0 &&
        (double) converted / candidates > CPEConstants.TYPE_COVERAGE_THRESHOLD;
  }

  /**
   * Picks INTEGER if every parsed number is a whole number that fits in a
   * long, FLOAT otherwise. Whole numbers beyond the long range and
   * infinities keep the column FLOAT rather than being truncated.
   */
  private static InferenceResult narrowNumbers(List<Number> numbers, boolean nullable) {
    boolean integral = true;
    for (Number number : numbers) {
      if (number != null && !(number instanceof Long) &&
          !isWholeLong(number.doubleValue())) {
        integral = false;
        break;
      }
    }
    List<Object> typed = Lists.newArrayListWithCapacity(numbers.size());
    for (Number number : numbers) {
      if (number == null) {
        typed.add(null);
      } else if (integral) {
        typed.add(number instanceof Long ? number : (long) number.doubleValue());
      } else {
        typed.add(number.doubleValue());
      }
    }
    ColumnType type = integral ? ColumnType.INTEGER : ColumnType.FLOAT;
    LOG.debug("Inferred {} for {} values", type, numbers.size());
    return new InferenceResult(type, typed, nullable);
  }

  @VisibleForTesting
  static boolean isWholeLong(double value) {
    return !Double.isNaN(value) && !Double.isInfinite(value)
        && value == Math.rint(value)
        && value >= -LONG_RANGE_LIMIT && value < LONG_RANGE_LIMIT;
  }

  /**
   * Parses a decimal number. Whole numbers that fit are returned as Long so
   * that no precision is lost, everything else as Double. Returns null for
   * text that is not a number, including NaN and Java-only forms such as
   * "1d" or hexadecimal literals.
   */
  @VisibleForTesting
  public static Number parseNumber(String value) {
    String trimmed = value.trim();
    if (INTEGER_PATTERN.matcher(trimmed).matches()) {
      try {
        return Long.parseLong(trimmed);
      } catch (NumberFormatException e) {
        // Too large for a long: still a number, just not an integer one.
        return Double.parseDouble(trimmed);
      }
    }
    if (DECIMAL_PATTERN.matcher(trimmed).matches()) {
      return Double.parseDouble(trimmed);
    }
    if (INFINITY_PATTERN.matcher(trimmed).matches()) {
      return trimmed.startsWith("-") ?
          Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
    }
    return null;
  }

  /**
   * Tries each configured pattern in order and returns the first successful
   * parse, or null.
   */
  @VisibleForTesting
  public DateTime parseDateTime(String value) {
    String trimmed = value.trim();
    if (trimmed.isEmpty()) {
      return null;
    }
    for (DateTimeFormatter formatter : timeFormatters) {
      try {
        return formatter.parseDateTime(trimmed);
      } catch (IllegalArgumentException e) {
        LOG.trace("No datetime match, trying next pattern: {}", e.getMessage());
      }
    }
    return null;
  }

  @VisibleForTesting
  public static Boolean parseBoolean(String value) {
    return BOOLEAN_TOKENS.get(value.trim().toLowerCase(Locale.ROOT));
  }
}
