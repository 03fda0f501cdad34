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

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Pull parser of STAR text, reading one block header or row at a time.
 * 
 * <p>
 * Usage: call {@link #nextBlock()} to move to the next block, then {@link #readHeader()} to read its columns (and the
 * single row of a non-looped block), then {@link #nextRow()} until it returns <code>null</code>. Blocks that are not
 * of interest can be skipped by calling {@link #nextBlock()} again right away; the contents of skipped blocks are not
 * validated.
 */
final class StarParser implements Closeable {
  static final String DATA_PREFIX = "data_";
  static final String LOOP_KEYWORD = "loop_";

  private final BufferedReader reader;
  private final LabelTypeRegistry registry;
  private final String sourceName;

  private String pushedBack;
  private int lineNumber;

  private String blockName;
  private StarTable header;
  private int rowIndex;

  StarParser(BufferedReader reader, LabelTypeRegistry registry, String sourceName) {
    this.reader = reader;
    this.registry = registry;
    this.sourceName = sourceName;
  }

  /**
   * @return Name of the next block or <code>null</code> if there are no more blocks.
   */
  String nextBlock() throws IOException, StarFormatException {
    header = null;
    String line;
    while ((line = readLine()) != null) {
      String trimmed = line.trim();
      if (trimmed.startsWith(DATA_PREFIX)) {
        blockName = parseBlockName(trimmed);
        rowIndex = 0;
        return blockName;
      }
      if (blockName == null && !isIgnorable(trimmed))
        throw withContext(new StarFormatException("Found content before the first data_ block."));
    }
    return null;
  }

  private String parseBlockName(String trimmed) {
    String rest = trimmed.substring(DATA_PREFIX.length());
    int end = 0;
    while (end < rest.length() && !Character.isWhitespace(rest.charAt(end)))
      end++;
    return rest.substring(0, end);
  }

  /**
   * Reads the column declarations of the current block. For a non-looped block, the returned table contains the
   * single row, for a looped table it contains no rows; those are available from {@link #nextRow()}.
   */
  StarTable readHeader() throws IOException, StarException {
    if (blockName == null)
      throw new IllegalStateException("No current block.");

    List<StarColumn> columns = new ArrayList<>();
    List<Object> singleRowValues = new ArrayList<>();
    boolean inLoop = false;

    String line;
    while ((line = readLine()) != null) {
      String trimmed = line.trim();
      if (isIgnorable(trimmed))
        continue;
      if (trimmed.startsWith(DATA_PREFIX)) {
        pushBack(line);
        break;
      }
      if (isLoopKeyword(trimmed)) {
        if (inLoop || !columns.isEmpty())
          throw withContext(new StarFormatException("Unexpected loop_, a block can only hold one loop."));
        inLoop = true;
        continue;
      }
      if (trimmed.startsWith("_")) {
        List<String> tokens = tokenize(trimmed);
        String label = tokens.get(0).substring(1);
        if (label.isEmpty())
          throw withContext(new StarFormatException("Empty label."));
        for (StarColumn col : columns)
          if (col.getName().equals(label))
            throw withContext(new StarFormatException("Duplicate label '" + label + "'."));
        StarColumn column = registry.column(label);
        if (inLoop) {
          if (tokens.size() != 1)
            throw withContext(new StarFormatException("Loop label '" + label + "' must not have a value."));
        } else {
          if (tokens.size() != 2)
            throw withContext(new StarFormatException(
                "Expected exactly one value for label '" + label + "' but found " + (tokens.size() - 1) + "."));
          singleRowValues.add(parseValue(column, tokens.get(1)));
        }
        columns.add(column);
        continue;
      }

      if (!inLoop)
        throw withContext(new StarFormatException("Found value line outside of a loop."));
      if (columns.isEmpty())
        throw withContext(new StarFormatException("Found value line in a loop without labels."));
      pushBack(line);
      break;
    }

    header = new StarTable(blockName, columns);
    header.setLooped(inLoop);
    if (!inLoop && !columns.isEmpty())
      header.addRow(singleRowValues.toArray());
    return header;
  }

  /**
   * @return The next row of the current looped block or <code>null</code> if the block has no more rows.
   */
  StarRow nextRow() throws IOException, StarException {
    if (header == null || !header.isLooped())
      return null;

    String line;
    while ((line = readLine()) != null) {
      String trimmed = line.trim();
      if (isIgnorable(trimmed))
        continue;
      if (trimmed.startsWith(DATA_PREFIX)) {
        pushBack(line);
        return null;
      }
      if (isLoopKeyword(trimmed))
        throw withContext(new StarFormatException("Unexpected loop_, a block can only hold one loop."));
      if (trimmed.startsWith("_"))
        throw withContext(new StarFormatException("Label declared after the values of the loop."));

      List<String> tokens = tokenize(trimmed);
      List<StarColumn> columns = header.getColumns();
      if (tokens.size() != columns.size()) {
        StarFormatException e = new StarFormatException(
            "Row has " + tokens.size() + " values, but " + columns.size() + " labels are declared.");
        e.setRowIndex(rowIndex);
        throw withContext(e);
      }
      Object[] values = new Object[tokens.size()];
      for (int i = 0; i < values.length; i++)
        values[i] = parseValue(columns.get(i), tokens.get(i));
      rowIndex++;
      return new StarRow(header.getRowLayout(), values);
    }
    return null;
  }

  private Object parseValue(StarColumn column, String token) throws StarTypeException {
    try {
      return column.getType().parse(token);
    } catch (StarTypeException e) {
      e.setColumn(column.getName());
      e.setRowIndex(rowIndex);
      throw withContext(e);
    }
  }

  private <E extends StarException> E withContext(E e) {
    e.setSource(sourceName);
    if (blockName != null)
      e.setTable(blockName);
    e.setLineNumber(lineNumber);
    return e;
  }

  private String readLine() throws IOException {
    if (pushedBack != null) {
      String res = pushedBack;
      pushedBack = null;
      return res;
    }
    String res = reader.readLine();
    if (res != null)
      lineNumber++;
    return res;
  }

  private void pushBack(String line) {
    pushedBack = line;
  }

  private static boolean isIgnorable(String trimmed) {
    return trimmed.isEmpty() || trimmed.startsWith("#");
  }

  private static boolean isLoopKeyword(String trimmed) {
    return trimmed.equals(LOOP_KEYWORD) || (trimmed.startsWith(LOOP_KEYWORD)
        && Character.isWhitespace(trimmed.charAt(LOOP_KEYWORD.length())));
  }

  /**
   * Split a line into tokens. Tokens are separated by whitespace; a token starting with a single or double quote
   * extends to the next matching quote that is followed by whitespace or the end of the line. An unquoted '#' at the
   * start of a token starts a comment.
   */
  List<String> tokenize(String line) throws StarFormatException {
    List<String> res = new ArrayList<>();
    int len = line.length();
    int i = 0;
    while (i < len) {
      char c = line.charAt(i);
      if (Character.isWhitespace(c)) {
        i++;
        continue;
      }
      if (c == '#')
        break;
      if (c == '\'' || c == '"') {
        int end = -1;
        for (int j = i + 1; j < len; j++) {
          if (line.charAt(j) == c && (j + 1 == len || Character.isWhitespace(line.charAt(j + 1)))) {
            end = j;
            break;
          }
        }
        if (end < 0)
          throw withContext(new StarFormatException("Unterminated quoted value."));
        res.add(line.substring(i + 1, end));
        i = end + 1;
        continue;
      }
      int end = i;
      while (end < len && !Character.isWhitespace(line.charAt(end)))
        end++;
      res.add(line.substring(i, end));
      i = end;
    }
    return res;
  }

  @Override
  public void close() throws IOException {
    reader.close();
  }
}
