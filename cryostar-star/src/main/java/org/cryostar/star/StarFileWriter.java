/**
 * cryostar: STAR metadata interchange for cryo-EM image processing.
 *
 * Copyright (C) 2015 The cryostar authors
 *
 * This file is part of cryostar.
 *
 * cryostar is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package org.cryostar.star;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;

/**
 * Writes STAR data to a {@link Writer}.
 * 
 * <p>
 * Tables can either be written as a whole using {@link #writeTable(StarTable)} or row-by-row using
 * {@link #writeLoopHeader(String, List)} followed by any number of calls to {@link #writeRow(StarRow)}, which allows
 * pass-through transformations of big tables without holding them in memory.
 * 
 * <p>
 * Tokens are padded to a minimum column width. Strings that are empty, contain whitespace or could be mistaken for STAR
 * syntax are quoted.
 */
public class StarFileWriter implements Closeable {
  private static final Logger logger = LoggerFactory.getLogger(StarFileWriter.class);

  public static final int DEFAULT_COLUMN_WIDTH = 12;

  private final Writer out;
  private final int columnWidth;

  /** Columns of the loop that is currently written, <code>null</code> if none. */
  private List<StarColumn> loopColumns;

  public StarFileWriter(Writer out, int columnWidth) {
    this.out = out;
    this.columnWidth = columnWidth;
  }

  public StarFileWriter(Writer out) {
    this(out, DEFAULT_COLUMN_WIDTH);
  }

  /**
   * Write the given tables to a new file (replacing any existing file).
   */
  public static void write(Path file, StarTable... tables) throws IOException {
    try (StarFileWriter writer = new StarFileWriter(Files.newBufferedWriter(file, StandardCharsets.UTF_8))) {
      for (StarTable table : tables)
        writer.writeTable(table);
    }
    logger.debug("Wrote {} tables to '{}'.", tables.length, file);
  }

  public static void write(Path file, StarFile starFile) throws IOException {
    write(file, starFile.getTables().toArray(new StarTable[starFile.size()]));
  }

  /**
   * Writes a comment line, prefixed with "# ".
   */
  public void writeComment(String comment) throws IOException {
    out.write("# " + comment + "\n");
  }

  /**
   * Writes a whole table.
   * 
   * @throws IllegalStateException
   *           If a non-looped table with columns does not have exactly one row.
   */
  public void writeTable(StarTable table) throws IOException {
    if (table.isLooped()) {
      writeLoopHeader(table.getName(), table.getColumns());
      for (StarRow row : table)
        writeRow(row);
      endLoop();
      return;
    }

    if (!table.getColumns().isEmpty() && table.size() != 1)
      throw new IllegalStateException("Non-looped table '" + table.getName() + "' must have exactly one row, but has "
          + table.size() + ".");

    endLoop();
    writeBlockHeader(table.getName());
    if (table.getColumns().isEmpty())
      return;
    int labelWidth = 0;
    for (StarColumn col : table.getColumns())
      labelWidth = Math.max(labelWidth, col.getName().length() + 1);
    StarRow row = table.getRow(0);
    for (int i = 0; i < row.size(); i++) {
      String label = Strings.padEnd("_" + row.getColumns().get(i).getName(), labelWidth, ' ');
      out.write(label + " " + formatToken(row.getValue(i)) + "\n");
    }
    out.write("\n");
  }

  /**
   * Starts a new looped block, rows are written using {@link #writeRow(StarRow)} afterwards.
   */
  public void writeLoopHeader(String tableName, List<StarColumn> columns) throws IOException {
    endLoop();
    writeBlockHeader(tableName);
    out.write(StarParser.LOOP_KEYWORD + "\n");
    for (int i = 0; i < columns.size(); i++)
      out.write("_" + columns.get(i).getName() + " #" + (i + 1) + "\n");
    loopColumns = new ArrayList<>(columns);
  }

  /**
   * Writes a row of the current loop. The values are matched to the loop columns by name.
   * 
   * @throws IllegalStateException
   *           If no loop is being written.
   * @throws IllegalArgumentException
   *           If the row does not provide a value for each column.
   */
  public void writeRow(StarRow row) throws IOException {
    if (loopColumns == null)
      throw new IllegalStateException("No loop header written.");
    Object[] values = new Object[loopColumns.size()];
    for (int i = 0; i < values.length; i++) {
      String name = loopColumns.get(i).getName();
      if (!row.has(name))
        throw new IllegalArgumentException("Row " + row.getColumnNames() + " has no value for column '" + name + "'.");
      values[i] = StarRow.coerce(loopColumns.get(i), row.get(name));
    }
    writeValues(values);
  }

  /**
   * Writes a row of the current loop, one value per column.
   */
  public void writeRow(Object... values) throws IOException {
    if (loopColumns == null)
      throw new IllegalStateException("No loop header written.");
    if (values.length != loopColumns.size())
      throw new IllegalArgumentException(
          "Expected " + loopColumns.size() + " values, but got " + values.length + ": " + Arrays.toString(values));
    Object[] coerced = new Object[values.length];
    for (int i = 0; i < values.length; i++)
      coerced[i] = StarRow.coerce(loopColumns.get(i), values[i]);
    writeValues(coerced);
  }

  private void writeValues(Object[] values) throws IOException {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < values.length; i++) {
      if (i > 0)
        sb.append(' ');
      sb.append(Strings.padStart(formatToken(values[i]), columnWidth, ' '));
    }
    sb.append('\n');
    out.write(sb.toString());
  }

  private void endLoop() throws IOException {
    if (loopColumns != null) {
      out.write("\n");
      loopColumns = null;
    }
  }

  private void writeBlockHeader(String tableName) throws IOException {
    out.write("\n" + StarParser.DATA_PREFIX + tableName + "\n\n");
  }

  /**
   * Formats a single value, quoting it if needed.
   */
  static String formatToken(Object value) {
    String res = LabelType.format(value);
    if (!needsQuotes(res))
      return res;
    if (!endsQuoteEarly(res, '"'))
      return '"' + res + '"';
    if (!endsQuoteEarly(res, '\''))
      return '\'' + res + '\'';
    throw new IllegalArgumentException("Value cannot be quoted: " + res);
  }

  private static boolean needsQuotes(String token) {
    if (token.isEmpty())
      return true;
    for (int i = 0; i < token.length(); i++)
      if (Character.isWhitespace(token.charAt(i)))
        return true;
    char first = token.charAt(0);
    return first == '"' || first == '\'' || first == '#' || first == '_' || token.startsWith(StarParser.DATA_PREFIX)
        || token.startsWith(StarParser.LOOP_KEYWORD);
  }

  private static boolean endsQuoteEarly(String token, char quote) {
    for (int i = 0; i < token.length() - 1; i++)
      if (token.charAt(i) == quote && Character.isWhitespace(token.charAt(i + 1)))
        return true;
    // a trailing quote char would be followed by the closing quote, which is fine.
    return false;
  }

  @Override
  public void close() throws IOException {
    endLoop();
    out.close();
  }

  /**
   * Flushes the underlying writer.
   */
  public void flush() throws IOException {
    out.flush();
  }

  /**
   * @return a writer writing to the given file, using a {@link BufferedWriter}.
   */
  public static StarFileWriter create(Path file, int columnWidth) throws IOException {
    return new StarFileWriter(Files.newBufferedWriter(file, StandardCharsets.UTF_8), columnWidth);
  }
}
