// Copyright (c) 2018 Cloudera, Inc. All rights reserved.
package com.cloudera.cpe.inference;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import com.cloudera.cpe.CPEConstants;
import com.cloudera.cpe.ColumnType;
import com.cloudera.cpe.util.CPEUtils;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import java.util.Arrays;
import java.util.List;

import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import org.junit.Test;

public class TestTypeInferenceEngine {

  private final TypeInferenceEngine engine = new TypeInferenceEngine(
      CPEUtils.buildTimeFormatters(CPEConstants.DEFAULT_TIME_FORMATS));

  @Test
  public void testIntegersWithUnparseableToken() {
    // "NULL" does not parse, but 5 of 6 values do, which is enough.
    InferenceResult result = engine.infer(
        Arrays.asList("1", "2", "3", "4", "NULL", "5"));
    assertEquals(ColumnType.INTEGER, result.getType());
    assertTrue(result.isNullable());
    assertEquals(Arrays.<Object>asList(1L, 2L, 3L, 4L, null, 5L), result.getValues());
  }

  @Test
  public void testFloats() {
    InferenceResult result = engine.infer(Arrays.asList("1.5", "2", "-3e2"));
    assertEquals(ColumnType.FLOAT, result.getType());
    assertFalse(result.isNullable());
    assertEquals(Arrays.<Object>asList(1.5, 2.0, -300.0), result.getValues());
  }

  @Test
  public void testWholeScientificNotationIsInteger() {
    InferenceResult result = engine.infer(Arrays.asList("1e3", "2", "3"));
    assertEquals(ColumnType.INTEGER, result.getType());
    assertEquals(Arrays.<Object>asList(1000L, 2L, 3L), result.getValues());
  }

  @Test
  public void testLongRange() {
    InferenceResult max = engine.infer(Arrays.asList("9223372036854775807", "1"));
    assertEquals(ColumnType.INTEGER, max.getType());
    assertEquals(Long.MAX_VALUE, max.getValues().get(0));

    // One past the long range keeps the column FLOAT.
    InferenceResult beyond = engine.infer(Arrays.asList("9223372036854775808", "1"));
    assertEquals(ColumnType.FLOAT, beyond.getType());
    assertEquals(1.0, beyond.getValues().get(1));
  }

  @Test
  public void testInfinityMakesFloat() {
    InferenceResult result = engine.infer(Arrays.asList("1", "inf", "3"));
    assertEquals(ColumnType.FLOAT, result.getType());
    assertEquals(Double.POSITIVE_INFINITY, result.getValues().get(1));
  }

  @Test
  public void testStrings() {
    InferenceResult result = engine.infer(Arrays.asList("a", "b", "1"));
    assertEquals(ColumnType.STRING, result.getType());
    assertFalse(result.isNullable());
    assertEquals(Arrays.<Object>asList("a", "b", "1"), result.getValues());
  }

  @Test
  public void testEmptyAndAllNull() {
    InferenceResult empty = engine.infer(ImmutableList.<String>of());
    assertEquals(ColumnType.STRING, empty.getType());
    assertTrue(empty.isNullable());

    List<String> nulls = Lists.newArrayList(null, null, null);
    InferenceResult allNull = engine.infer(nulls);
    assertEquals(ColumnType.STRING, allNull.getType());
    assertTrue(allNull.isNullable());
    assertEquals(3, allNull.getValues().size());
  }

  @Test
  public void testDatetimes() {
    InferenceResult result = engine.infer(
        Arrays.asList("2023-01-01", "2023-02-15", null, "2023-03-31"));
    assertEquals(ColumnType.DATETIME, result.getType());
    assertTrue(result.isNullable());
    assertEquals(new DateTime(2023, 1, 1, 0, 0, DateTimeZone.UTC),
        result.getValues().get(0));
    assertNull(result.getValues().get(2));
  }

  @Test
  public void testMixedDatetimeFormats() {
    InferenceResult result = engine.infer(Arrays.asList(
        "2023-01-01 10:00:00", "2023/01/02", "01/03/2023", "04-Jan-2023"));
    assertEquals(ColumnType.DATETIME, result.getType());
    assertEquals(new DateTime(2023, 1, 4, 0, 0, DateTimeZone.UTC),
        result.getValues().get(3));
  }

  @Test
  public void testBooleans() {
    InferenceResult result = engine.infer(Arrays.asList("true", "FALSE", "yes", "No"));
    assertEquals(ColumnType.BOOLEAN, result.getType());
    assertEquals(Arrays.<Object>asList(true, false, true, false), result.getValues());
  }

  @Test
  public void testBooleanCoverageCountsNulls() {
    // 4 of 5 values convert, which is not strictly more than 80%.
    InferenceResult result = engine.infer(
        Arrays.asList("true", null, "false", "true", "false"));
    assertEquals(ColumnType.STRING, result.getType());
    assertTrue(result.isNullable());
  }

  @Test
  public void testCoerce() {
    InferenceResult result = engine.coerce(Arrays.asList("1", "x", "3.0"),
        ColumnType.INTEGER);
    assertEquals(ColumnType.INTEGER, result.getType());
    assertTrue(result.isNullable());
    assertEquals(Arrays.<Object>asList(1L, null, 3L), result.getValues());

    InferenceResult strings = engine.coerce(Arrays.asList("1", "2"), ColumnType.STRING);
    assertEquals(Arrays.<Object>asList("1", "2"), strings.getValues());
    assertFalse(strings.isNullable());
  }

  @Test
  public void testParseNumber() {
    assertEquals(42L, TypeInferenceEngine.parseNumber(" 42 "));
    assertEquals(-7L, TypeInferenceEngine.parseNumber("-7"));
    assertEquals(0.5, TypeInferenceEngine.parseNumber(".5"));
    assertEquals(Double.NEGATIVE_INFINITY, TypeInferenceEngine.parseNumber("-Infinity"));
    assertNull(TypeInferenceEngine.parseNumber("NaN"));
    assertNull(TypeInferenceEngine.parseNumber("abc"));
    assertNull(TypeInferenceEngine.parseNumber("0x1F"));
    assertNull(TypeInferenceEngine.parseNumber("1d"));
    assertNull(TypeInferenceEngine.parseNumber(""));
  }

  @Test
  public void testParseBoolean() {
    assertEquals(Boolean.TRUE, TypeInferenceEngine.parseBoolean(" T "));
    assertEquals(Boolean.FALSE, TypeInferenceEngine.parseBoolean("n"));
    assertNull(TypeInferenceEngine.parseBoolean("maybe"));
  }

  @Test
  public void testIsWholeLong() {
    assertTrue(TypeInferenceEngine.isWholeLong(3.0));
    assertFalse(TypeInferenceEngine.isWholeLong(3.5));
    assertFalse(TypeInferenceEngine.isWholeLong(Math.pow(2, 63)));
    assertFalse(TypeInferenceEngine.isWholeLong(Double.NaN));
  }
}
