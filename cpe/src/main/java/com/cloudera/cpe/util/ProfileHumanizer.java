// Copyright (c) 2018 Cloudera, Inc. All rights reserved.
package com.cloudera.cpe.util;

import com.cloudera.cpe.CPEConstants;
import com.google.common.base.Preconditions;

import java.util.Locale;

import org.joda.time.DateTimeConstants;
import org.joda.time.Duration;

/**
 * Turns raw numbers into the strings shown in statistics and metadata
 * summaries. All output uses a fixed locale so that results do not depend on
 * the JVM defaults.
 */
public class ProfileHumanizer {

  private static final Locale LOCALE = Locale.US;

  public static String formatCount(long value) {
    return String.format(LOCALE, "%,d", value);
  }

  public static String formatDecimal(double value, int decimals) {
    Preconditions.checkArgument(decimals >= 0);
    return String.format(LOCALE, "%,." + decimals + "f", value);
  }

  public static String formatPercentage(double percentage) {
    return String.format(LOCALE, "%.2f%%", percentage);
  }

  /**
   * Formats a byte count, e.g. "512 bytes", "1.5 KB" or "2.0 GB".
   */
  public static String humanizeBytes(long numBytes) {
    if (numBytes < CPEConstants.ONE_KILOBYTE) {
      return numBytes + " bytes";
    } else if (numBytes < CPEConstants.ONE_MEGABYTE) {
      return String.format(LOCALE, "%.1f KB",
          numBytes / (double) CPEConstants.ONE_KILOBYTE);
    } else if (numBytes < CPEConstants.ONE_GIGABYTE) {
      return String.format(LOCALE, "%.1f MB",
          numBytes / (double) CPEConstants.ONE_MEGABYTE);
    }
    return String.format(LOCALE, "%.1f GB",
        numBytes / (double) CPEConstants.ONE_GIGABYTE);
  }

  /**
   * Formats the span between two datetimes as "N days HH:mm:ss", with a
   * ".SSS" suffix only when the span has a millisecond part.
   */
  public static String humanizeDuration(Duration duration) {
    Preconditions.checkNotNull(duration);
    long millis = duration.getMillis();
    String sign = "";
    if (millis < 0) {
      sign = "-";
      millis = -millis;
    }
    long days = millis / DateTimeConstants.MILLIS_PER_DAY;
    long rest = millis % DateTimeConstants.MILLIS_PER_DAY;
    long hours = rest / DateTimeConstants.MILLIS_PER_HOUR;
    rest %= DateTimeConstants.MILLIS_PER_HOUR;
    long minutes = rest / DateTimeConstants.MILLIS_PER_MINUTE;
    rest %= DateTimeConstants.MILLIS_PER_MINUTE;
    long seconds = rest / DateTimeConstants.MILLIS_PER_SECOND;
    long fraction = rest % DateTimeConstants.MILLIS_PER_SECOND;
    String text = String.format(LOCALE, "%s%d %s %02d:%02d:%02d",
        sign, days, days == 1 ? "day" : "days", hours, minutes, seconds);
    if (fraction != 0) {
      text += String.format(LOCALE, ".%03d", fraction);
    }
    return text;
  }
}
