// Copyright (c) 2018 Cloudera, Inc. All rights reserved.
package com.cloudera.cpe.source;

import com.cloudera.cpe.ColumnType;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.RFC4180ParserBuilder;
import com.opencsv.exceptions.CsvValidationException;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the header and the first rows of a CSV file (or a TSV file, by its
 * extension) into memory. CSV has no types, so every column is left to type
 * inference.
 *
 * The file is read completely when the source is opened and the reader is
 * closed before open() returns; the source itself only holds the preview.
 */
public class CsvTabularDataSource extends AbstractTabularDataSource {

  private static final Logger LOG = LoggerFactory.getLogger(
      CsvTabularDataSource.class);

  private final long rawByteSize;

  private CsvTabularDataSource(File file, Map<String, List<String>> columns) {
    super(file.getPath(), columns, ImmutableMap.<String, ColumnType>of());
    this.rawByteSize = file.length();
  }

  @Override
  public String getFormatName() {
    return "CSV";
  }

  @Override
  public long getRawByteSize() {
    return rawByteSize;
  }

  @Override
  public void close() {
    if (!isClosed()) {
      LOG.info("Closed CSV source for: {}", getName());
    }
    super.close();
  }

  /**
   * Opens a CSV file and reads up to previewRows data rows. Cells equal to one
   * of the null tokens become nulls, as do the missing cells of short rows.
   * The file is read as UTF-8, falling back to ISO-8859-1 for files that are
   * not valid UTF-8.
   *
   * @throws DataSourceException if the file does not exist, is empty or cannot
   *     be parsed
   */
  public static CsvTabularDataSource open(File file, int previewRows, Set<String> nullTokens) {
    Preconditions.checkNotNull(file);
    Preconditions.checkArgument(previewRows > 0);
    Preconditions.checkNotNull(nullTokens);
    if (!file.isFile()) {
      throw new DataSourceException(
          "CSV file not found or is not a regular file: " + file);
    }
    Map<String, List<String>> columns;
    try {
      columns = readPreview(file, StandardCharsets.UTF_8, previewRows, nullTokens);
    } catch (CharacterCodingException e) {
      LOG.warn("{} is not valid UTF-8, reading it as ISO-8859-1", file);
      try {
        columns = readPreview(file, StandardCharsets.ISO_8859_1, previewRows, nullTokens);
      } catch (CharacterCodingException latin1Error) {
        throw new DataSourceException(
            "Failed to read CSV file '" + file.getName() + "'", latin1Error);
      }
    }
    CsvTabularDataSource source = new CsvTabularDataSource(file, columns);
    LOG.info("Successfully opened CSV source for: {} ({} columns, {} preview rows)",
        file.getName(), source.getColumnCount(), source.getRowCount());
    return source;
  }

  private static Map<String, List<String>> readPreview(
      File file,
      Charset charset,
      int previewRows,
      Set<String> nullTokens) throws CharacterCodingException {
    try (CSVReader reader = openCsv(file, charset)) {
      String[] header = reader.readNext();
      if (header == null) {
        throw new DataSourceException("CSV file '" + file.getName() + "' is empty");
      }
      List<String> names = columnNames(header);
      List<List<String>> values = Lists.newArrayListWithCapacity(names.size());
      for (int i = 0; i < names.size(); i++) {
        values.add(Lists.<String>newArrayList());
      }
      int rows = 0;
      String[] row;
      while (rows < previewRows && (row = reader.readNext()) != null) {
        if (row.length == 0 || (row.length == 1 && row[0].isEmpty())) {
          // Blank line.
          continue;
        }
        for (int i = 0; i < names.size(); i++) {
          String cell = i < row.length ? row[i] : null;
          values.get(i).add(cell == null || nullTokens.contains(cell) ? null : cell);
        }
        rows++;
      }
      Map<String, List<String>> columns = Maps.newLinkedHashMap();
      for (int i = 0; i < names.size(); i++) {
        columns.put(names.get(i), values.get(i));
      }
      return columns;
    } catch (CharacterCodingException e) {
      throw e;
    } catch (IOException | CsvValidationException e) {
      throw new DataSourceException(
          "Failed to parse CSV file '" + file.getName() + "': " + e.getMessage(), e);
    }
  }

  /**
   * Opens a CSV reader, handling TSV files. Quotes are escaped by doubling
   * them; backslashes are ordinary characters.
   */
  private static CSVReader openCsv(File file, Charset charset) throws IOException {
    Reader reader = Files.newBufferedReader(file.toPath(), charset);
    char separator =
        file.getName().toLowerCase(Locale.ROOT).endsWith(".tsv") ? '\t' : ',';
    return new CSVReaderBuilder(reader)
        .withCSVParser(new RFC4180ParserBuilder().withSeparator(separator).build())
        .build();
  }

  /**
   * Makes header names usable as keys: blank names become "Unnamed: i" and
   * repeated names get a ".n" suffix.
   */
  private static List<String> columnNames(String[] header) {
    List<String> names = Lists.newArrayListWithCapacity(header.length);
    Set<String> seen = Sets.newHashSet();
    for (int i = 0; i < header.length; i++) {
      String base = header[i].trim().isEmpty() ? "Unnamed: " + i : header[i].trim();
      String name = base;
      for (int n = 1; seen.contains(name); n++) {
        name = base + "." + n;
      }
      seen.add(name);
      names.add(name);
    }
    return names;
  }
}
