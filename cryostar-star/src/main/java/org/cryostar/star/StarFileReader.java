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
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.io.CharSource;
import com.google.common.io.MoreFiles;

/**
 * Reads STAR data from a {@link CharSource}.
 * 
 * <p>
 * Each method opens the source anew, therefore the source needs to be re-readable (which is true e.g. for files). The
 * types of the columns are resolved using a {@link LabelTypeRegistry}; columns of unknown labels are read as
 * {@link LabelType#STRING}.
 */
public class StarFileReader {
  private static final Logger logger = LoggerFactory.getLogger(StarFileReader.class);

  private final CharSource source;
  private final LabelTypeRegistry registry;
  private final String sourceName;

  /**
   * @param source
   *          The source to read from.
   * @param registry
   *          Types of labels.
   * @param sourceName
   *          Name of the source (e.g. the file name) that is used in messages of exceptions.
   */
  public StarFileReader(CharSource source, LabelTypeRegistry registry, String sourceName) {
    this.source = source;
    this.registry = registry;
    this.sourceName = sourceName;
  }

  public StarFileReader(Path file, LabelTypeRegistry registry) {
    this(MoreFiles.asCharSource(file, StandardCharsets.UTF_8), registry, file.toString());
  }

  public String getSourceName() {
    return sourceName;
  }

  /**
   * Reads all tables.
   * 
   * @throws StarException
   *           If the source cannot be read or its contents are invalid. No partial result is available then.
   */
  public StarFile read() throws StarException {
    StarFile res = new StarFile();
    try (StarParser parser = openParser()) {
      while (parser.nextBlock() != null)
        res.addTable(readTableContent(parser));
    } catch (IOException e) {
      throw ioException(e);
    } catch (IllegalArgumentException e) {
      // duplicate table names
      StarFormatException fe = new StarFormatException(e.getMessage(), e);
      fe.setSource(sourceName);
      throw fe;
    }
    logger.debug("Read {} tables from '{}'.", res.size(), sourceName);
    return res;
  }

  /**
   * Reads the names of all tables without parsing their contents.
   */
  public List<String> getTableNames() throws StarException {
    List<String> res = new ArrayList<>();
    try (StarParser parser = openParser()) {
      String name;
      while ((name = parser.nextBlock()) != null)
        res.add(name);
    } catch (IOException e) {
      throw ioException(e);
    }
    return res;
  }

  public boolean hasTable(String name) throws StarException {
    return getTableNames().contains(name);
  }

  /**
   * Reads a single table.
   * 
   * @param name
   *          Name of the table or <code>null</code> for the first table.
   * @throws StarSchemaException
   *           If there is no such table.
   */
  public StarTable readTable(String name) throws StarException {
    try (StarParser parser = openParser()) {
      seek(parser, name);
      StarTable res = readTableContent(parser);
      logger.debug("Read table '{}' with {} rows from '{}'.", res.getName(), res.size(), sourceName);
      return res;
    } catch (IOException e) {
      throw ioException(e);
    }
  }

  /**
   * Lazily iterates the rows of a table.
   * 
   * <p>
   * Each call to {@link Iterable#iterator()} re-opens the source and reads the rows one after the other. The source is
   * closed as soon as the last row has been returned. Errors are thrown as {@link StarIterationException}, whose
   * cause is the {@link StarException} (or {@link IOException}).
   * 
   * @param name
   *          Name of the table or <code>null</code> for the first table.
   */
  public Iterable<StarRow> iterRows(String name) {
    return () -> new RowIterator(name);
  }

  private StarTable readTableContent(StarParser parser) throws IOException, StarException {
    StarTable res = parser.readHeader();
    StarRow row;
    while ((row = parser.nextRow()) != null)
      res.addRow(row);
    return res;
  }

  private void seek(StarParser parser, String name) throws IOException, StarException {
    String blockName;
    while ((blockName = parser.nextBlock()) != null) {
      if (name == null || name.equals(blockName))
        return;
    }
    StarSchemaException e = new StarSchemaException(
        (name == null) ? "Source does not contain any table." : "Table '" + name + "' not found.");
    e.setSource(sourceName);
    e.setTable(name);
    throw e;
  }

  private StarParser openParser() throws IOException {
    return new StarParser(source.openBufferedStream(), registry, sourceName);
  }

  private StarException ioException(IOException e) {
    StarException res = new StarException("Could not read STAR data.", e);
    res.setSource(sourceName);
    return res;
  }

  private class RowIterator implements Iterator<StarRow> {
    private StarParser parser;
    private StarRow singleRow;
    private StarRow next;
    private boolean fetched = false;

    RowIterator(String name) {
      try {
        parser = openParser();
        seek(parser, name);
        StarTable header = parser.readHeader();
        if (!header.isLooped() && !header.isEmpty())
          singleRow = header.getRow(0);
      } catch (IOException | StarException e) {
        close();
        throw new StarIterationException("Could not iterate rows of '" + sourceName + "'.", e);
      }
    }

    @Override
    public boolean hasNext() {
      if (!fetched) {
        next = fetch();
        fetched = true;
      }
      return next != null;
    }

    @Override
    public StarRow next() {
      if (!hasNext())
        throw new NoSuchElementException();
      fetched = false;
      return next;
    }

    private StarRow fetch() {
      if (singleRow != null) {
        StarRow res = singleRow;
        singleRow = null;
        return res;
      }
      if (parser == null)
        return null;
      try {
        StarRow res = parser.nextRow();
        if (res == null)
          close();
        return res;
      } catch (IOException | StarException e) {
        close();
        throw new StarIterationException("Could not iterate rows of '" + sourceName + "'.", e);
      }
    }

    private void close() {
      if (parser == null)
        return;
      try {
        parser.close();
      } catch (IOException e) {
        logger.warn("Could not close '{}'.", sourceName, e);
      }
      parser = null;
    }
  }
}
