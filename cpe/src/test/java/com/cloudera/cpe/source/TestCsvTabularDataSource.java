// Copyright (c) 2018 Cloudera, Inc. All rights reserved.
package com.cloudera.cpe.source;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.cloudera.cpe.CPEConstants;
import com.google.common.collect.ImmutableList;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class TestCsvTabularDataSource {

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private File write(String name, String content) throws IOException {
    File file = folder.newFile(name);
    Files.write(file.toPath(), content.getBytes(StandardCharsets.UTF_8));
    return file;
  }

  private CsvTabularDataSource open(File file, int previewRows) {
    return CsvTabularDataSource.open(file, previewRows, CPEConstants.DEFAULT_NULL_TOKENS);
  }

  @Test
  public void testReadPreview() throws IOException {
    File file = write("scores.csv",
        "id,name,score\n" +
        "1,alice,3.5\n" +
        "2,,NULL\n" +
        "\n" +
        "3,carol\n");
    try (CsvTabularDataSource source = open(file, 50)) {
      assertEquals("CSV", source.getFormatName());
      assertEquals(file.length(), source.getRawByteSize());
      assertEquals(ImmutableList.of("id", "name", "score"), source.getColumnNames());
      assertEquals(3, source.getRowCount());
      assertEquals(Arrays.asList("1", "2", "3"), source.getRawValues("id"));
      assertEquals(Arrays.asList("alice", null, "carol"), source.getRawValues("name"));
      assertEquals(Arrays.asList("3.5", null, null), source.getRawValues("score"));
    }
  }

  @Test
  public void testPreviewLimit() throws IOException {
    File file = write("numbers.csv", "n\n1\n2\n3\n4\n");
    try (CsvTabularDataSource source = open(file, 2)) {
      assertEquals(2, source.getRowCount());
      assertEquals(Arrays.asList("1", "2"), source.getRawValues("n"));
    }
  }

  @Test
  public void testQuotedFields() throws IOException {
    File file = write("quoted.csv", "a,b\n\"x,y\",\"multi\nline\"\n");
    try (CsvTabularDataSource source = open(file, 50)) {
      assertEquals(Arrays.asList("x,y"), source.getRawValues("a"));
      assertEquals(Arrays.asList("multi\nline"), source.getRawValues("b"));
    }
  }

  @Test
  public void testBackslashesKept() throws IOException {
    File file = write("paths.csv", "path,note\nC:\\temp\\dir,\"say \"\"hi\"\"\"\na\\b,x\n");
    try (CsvTabularDataSource source = open(file, 50)) {
      assertEquals(Arrays.asList("C:\\temp\\dir", "a\\b"), source.getRawValues("path"));
      assertEquals(Arrays.asList("say \"hi\"", "x"), source.getRawValues("note"));
    }
  }

  @Test
  public void testHeaderNames() throws IOException {
    File file = write("header.csv", "a,a, ,a\n1,2,3,4\n");
    try (CsvTabularDataSource source = open(file, 50)) {
      assertEquals(ImmutableList.of("a", "a.1", "Unnamed: 2", "a.2"),
          source.getColumnNames());
    }
  }

  @Test
  public void testTabSeparated() throws IOException {
    File file = write("data.tsv", "x\ty\n1,5\t2\n");
    try (CsvTabularDataSource source = open(file, 50)) {
      assertEquals(ImmutableList.of("x", "y"), source.getColumnNames());
      assertEquals(Arrays.asList("1,5"), source.getRawValues("x"));
    }
  }

  @Test
  public void testLatin1Fallback() throws IOException {
    File file = folder.newFile("latin1.csv");
    Files.write(file.toPath(), "city\ncafé\n".getBytes(StandardCharsets.ISO_8859_1));
    try (CsvTabularDataSource source = open(file, 50)) {
      assertEquals(Arrays.asList("café"), source.getRawValues("city"));
    }
  }

  @Test
  public void testEmptyFile() throws IOException {
    File file = write("empty.csv", "");
    try {
      open(file, 50);
      fail();
    } catch (DataSourceException e) {
      assertEquals("CSV file 'empty.csv' is empty", e.getMessage());
    }
  }

  @Test
  public void testMissingFile() {
    try {
      open(new File(folder.getRoot(), "missing.csv"), 50);
      fail();
    } catch (DataSourceException e) {
      assertTrue(e.getMessage().startsWith("CSV file not found"));
    }
  }

  @Test
  public void testClose() throws IOException {
    CsvTabularDataSource source = open(write("c.csv", "a\n1\n"), 50);
    source.close();
    assertTrue(source.isClosed());
    // Closing twice is harmless.
    source.close();
  }
}
