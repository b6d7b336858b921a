// Copyright (c) 2011-2012 Cloudera, Inc. All rights reserved.

package com.cloudera.cpe.util;

import java.util.Locale;

import org.joda.time.DateTimeZone;
import org.joda.time.format.DateTimeFormat;
import org.joda.time.format.DateTimeFormatter;

public class JodaUtil {

  // Column values carry no zone of their own, so they are parsed and printed
  // in UTC. That keeps a printed Min/Max identical to the raw text.
  public static final DateTimeZone TZ_PROFILE = DateTimeZone.UTC;

  // A formatter for datetime statistics such as Min and Max.
  public static final DateTimeFormatter FORMATTER =
    DateTimeFormat.forPattern("yyyy-MM-dd HH:mm:ss").withZone(TZ_PROFILE);

  /**
   * Builds a parser for one of the configured datetime patterns.
   * @throws IllegalArgumentException if the pattern is invalid
   */
  public static DateTimeFormatter parserForPattern(String pattern) {
    // Month names such as "Jan" are matched in English whatever the JVM locale.
    return DateTimeFormat.forPattern(pattern)
        .withZone(TZ_PROFILE)
        .withLocale(Locale.ENGLISH);
  }
}
