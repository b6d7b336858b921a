// Copyright (c) 2018 Cloudera, Inc. All rights reserved.
package com.cloudera.cpe.profiler;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import com.cloudera.cpe.CPEConstants;
import com.cloudera.cpe.ColumnType;
import com.cloudera.cpe.histogram.VisualizationPolicy.Decision;
import com.cloudera.cpe.model.ColumnSchema;
import com.cloudera.cpe.model.RenderedHistogram;
import com.cloudera.cpe.model.StatisticsResult;
import com.cloudera.cpe.source.AbstractTabularDataSource;
import com.cloudera.cpe.source.CsvTabularDataSource;
import com.cloudera.cpe.source.InMemoryTabularDataSource;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class TestColumnProfiler {

  private static final int ROWS = 25;

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private InMemoryTabularDataSource source;
  private ColumnProfiler profiler;

  @Before
  public void setUp() {
    List<String> scores = Lists.newArrayList();
    List<String> levels = Lists.newArrayList();
    List<String> names = Lists.newArrayList();
    for (int i = 0; i < ROWS; i++) {
      // 20 distinct scores over 25 rows.
      scores.add(String.valueOf(i % 20 + 1));
      levels.add(String.valueOf(i % 3));
      names.add("name" + i);
    }
    source = InMemoryTabularDataSource.newBuilder("test")
        .addColumn("score", scores)
        .addColumn("level", levels)
        .addColumn("name", names)
        .addColumn("code", ColumnType.STRING, scores)
        .build();
    profiler = new ColumnProfiler(source, ProfilerOptions.defaults());
  }

  @Test
  public void testGetColumnIsCached() {
    assertSame(profiler.getColumn("score"), profiler.getColumn("score"));
    assertEquals(ColumnType.INTEGER, profiler.getColumn("score").getType());
  }

  @Test
  public void testDeclaredTypeWins() {
    assertEquals(ColumnType.STRING, profiler.getColumn("code").getType());
    StatisticsResult stats = profiler.getColumnStats("code");
    assertNull(stats.getStatistic(CPEConstants.STAT_MEAN));
    assertFalse(stats.getTopValues().isEmpty());
  }

  @Test
  public void testContinuousColumnGetsPlot() {
    ColumnProfile profile = profiler.profileColumn("score");
    assertEquals(Decision.SHOW, profile.getDecision());
    RenderedHistogram histogram = profile.getHistogram();
    assertTrue(histogram.isPlot());
    assertEquals(CPEConstants.DEFAULT_HISTOGRAM_HEIGHT + 2, histogram.getLines().size());
    for (String line : histogram.getLines()) {
      assertEquals(CPEConstants.DEFAULT_HISTOGRAM_WIDTH, line.length());
    }
  }

  @Test
  public void testDiscreteColumnGetsNote() {
    ColumnProfile profile = profiler.profileColumn("level");
    assertEquals(Decision.DISCRETE, profile.getDecision());
    assertEquals(ImmutableList.of(CPEConstants.MSG_DISCRETE_DATA),
        profile.getHistogram().getLines());
  }

  @Test
  public void testStringColumnGetsNoHistogram() {
    ColumnProfile profile = profiler.profileColumn("name");
    assertEquals(Decision.NOT_NUMERIC, profile.getDecision());
    assertNull(profile.getHistogram());
  }

  @Test
  public void testUnknownColumn() {
    StatisticsResult stats = profiler.getColumnStats("missing");
    assertTrue(stats.hasError());
    assertNull(stats.getType());
    assertEquals(CPEConstants.UNKNOWN, stats.getTypeName());
    assertEquals("Column 'missing' not found in test", stats.getError());
    assertTrue(stats.getStatistics().isEmpty());
    assertNull(profiler.getHistogram(stats));
  }

  @Test
  public void testProfileAll() {
    Map<String, ColumnProfile> profiles = profiler.profileAll();
    assertEquals(ImmutableList.of("score", "level", "name", "code"),
        ImmutableList.copyOf(profiles.keySet()));
    for (ColumnProfile profile : profiles.values()) {
      assertFalse(profile.getStatistics().hasError());
    }
  }

  @Test
  public void testStatsAreRepeatable() {
    assertEquals(profiler.getColumnStats("score"), profiler.getColumnStats("score"));
  }

  @Test
  public void testClosedSourceIsReportedPerColumn() {
    profiler.getColumn("score");
    source.close();
    // Already read columns are still available.
    assertFalse(profiler.getColumnStats("score").hasError());
    assertEquals("test is closed", profiler.getColumnStats("name").getError());
  }

  @Test
  public void testSchema() {
    List<ColumnSchema> schema = profiler.getSchema();
    assertEquals(4, schema.size());
    assertEquals(new ColumnSchema("score", "integer", false), schema.get(0));
    assertEquals(new ColumnSchema("name", "string", false), schema.get(2));
    assertEquals(new ColumnSchema("code", "string", false), schema.get(3));
  }

  @Test
  public void testMetadataSummary() {
    Map<String, Map<String, String>> summary = profiler.getMetadataSummary();
    assertEquals(ImmutableList.of(
        ColumnProfiler.SECTION_FILE_INFORMATION,
        ColumnProfiler.SECTION_DATA_STRUCTURE,
        ColumnProfiler.SECTION_COLUMN_TYPES),
        ImmutableList.copyOf(summary.keySet()));
    assertEquals(ImmutableMap.of(
        "Path", "test",
        "Format", "In-memory",
        "Size", CPEConstants.UNKNOWN),
        summary.get(ColumnProfiler.SECTION_FILE_INFORMATION));
    assertEquals("25", summary.get(ColumnProfiler.SECTION_DATA_STRUCTURE).get("Total Rows"));
    assertEquals("4", summary.get(ColumnProfiler.SECTION_DATA_STRUCTURE).get("Total Columns"));
    assertEquals(ImmutableList.of("Text Columns", "Integer Columns"),
        ImmutableList.copyOf(summary.get(ColumnProfiler.SECTION_COLUMN_TYPES).keySet()));
    assertEquals("2", summary.get(ColumnProfiler.SECTION_COLUMN_TYPES).get("Integer Columns"));
  }

  @Test
  public void testHistogramHeightOption() {
    ColumnProfiler small = new ColumnProfiler(source, ProfilerOptions.fromProperties(
        ImmutableMap.of(
            CPEConstants.CPE_HISTOGRAM_HEIGHT_PROPERTY, "4",
            CPEConstants.CPE_HISTOGRAM_WIDTH_PROPERTY, "30")));
    RenderedHistogram histogram = small.profileColumn("score").getHistogram();
    assertEquals(6, histogram.getLines().size());
    assertEquals(30, histogram.getLines().get(0).length());
  }

  @Test
  public void testSingleRowColumn() {
    InMemoryTabularDataSource single = InMemoryTabularDataSource.newBuilder("one")
        .addColumn("x", Arrays.asList("42"))
        .build();
    ColumnProfile profile = new ColumnProfiler(single, ProfilerOptions.defaults())
        .profileColumn("x");
    assertEquals("42", profile.getStatistics().getStatistic(CPEConstants.STAT_MIN));
    assertEquals(Decision.TOO_FEW_VALUES, profile.getDecision());
    assertNull(profile.getHistogram());
  }

  @Test
  public void testCsvFile() throws IOException {
    File file = folder.newFile("orders.csv");
    Files.write(file.toPath(), (
        "id,amount,paid,day\n" +
        "1,10.5,yes,2024-01-01\n" +
        "2,NULL,no,2024-01-02\n" +
        "3,7.25,yes,\n" +
        "4,1,no,2024-01-04\n").getBytes(StandardCharsets.UTF_8));
    ProfilerOptions options = ProfilerOptions.defaults();
    try (CsvTabularDataSource csv = CsvTabularDataSource.open(
        file, options.getPreviewRows(), options.getNullTokens())) {
      ColumnProfiler csvProfiler = new ColumnProfiler(csv, options);
      assertEquals(ImmutableList.of(
          new ColumnSchema("id", "integer", false),
          new ColumnSchema("amount", "float", true),
          new ColumnSchema("paid", "boolean", false),
          new ColumnSchema("day", "datetime", true)),
          csvProfiler.getSchema());
      StatisticsResult amount = csvProfiler.getColumnStats("amount");
      assertEquals("1", amount.getStatistic(CPEConstants.STAT_NULL_COUNT));
      assertEquals("1.0000", amount.getStatistic(CPEConstants.STAT_MIN));
      assertEquals("2024-01-04 00:00:00",
          csvProfiler.getColumnStats("day").getStatistic(CPEConstants.STAT_MAX));
      Map<String, String> fileInfo = csvProfiler.getMetadataSummary()
          .get(ColumnProfiler.SECTION_FILE_INFORMATION);
      assertEquals("CSV", fileInfo.get("Format"));
      assertEquals(file.length() + " bytes", fileInfo.get("Size"));
    }
  }

  /**
   * A source whose "bad" column fails with an unchecked exception that is not
   * a DataSourceException.
   */
  private static class FailingSource extends AbstractTabularDataSource {

    FailingSource() {
      super("failing", ImmutableMap.<String, List<String>>of(
          "bad", Arrays.asList("1", "2"),
          "good", Arrays.asList("3", "4")),
          ImmutableMap.<String, ColumnType>of());
    }

    @Override
    public String getFormatName() {
      return "Test";
    }

    @Override
    public long getRawByteSize() {
      return -1;
    }

    @Override
    public List<String> getRawValues(String columnName) {
      if (columnName.equals("bad")) {
        throw new IllegalStateException("backend exploded");
      }
      return super.getRawValues(columnName);
    }
  }

  @Test
  public void testUncheckedSourceFailureIsIsolated() {
    ColumnProfiler failing = new ColumnProfiler(new FailingSource(),
        ProfilerOptions.defaults());

    StatisticsResult bad = failing.getColumnStats("bad");
    assertTrue(bad.hasError());
    assertEquals("backend exploded", bad.getError());
    assertNull(bad.getType());

    Map<String, ColumnProfile> profiles = failing.profileAll();
    assertEquals(ImmutableList.of("bad", "good"), ImmutableList.copyOf(profiles.keySet()));
    assertTrue(profiles.get("bad").getStatistics().hasError());
    assertEquals("4", profiles.get("good").getStatistics()
        .getStatistic(CPEConstants.STAT_MAX));

    assertEquals(ImmutableList.of(
        new ColumnSchema("bad", "[Error: backend exploded]", null),
        new ColumnSchema("good", "integer", false)),
        failing.getSchema());

    Map<String, String> types = failing.getMetadataSummary()
        .get(ColumnProfiler.SECTION_COLUMN_TYPES);
    assertEquals("1", types.get("Integer Columns"));
    assertEquals("1", types.get("Unreadable Columns"));
  }
}
