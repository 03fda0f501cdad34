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

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.cryostar.config.Config;
import org.cryostar.config.ConfigKey;
import org.cryostar.context.AutoInstatiate;

import com.google.common.io.CharSource;

/**
 * Factory for {@link StarFileReader}s and {@link StarFileWriter}s that are configured with the default
 * {@link LabelTypeRegistry} and the configured column width.
 */
@AutoInstatiate
public class StarFileFactory {
  @Config(ConfigKey.STAR_COLUMN_WIDTH)
  private int columnWidth = StarFileWriter.DEFAULT_COLUMN_WIDTH;

  private final LabelTypeRegistry registry;

  public StarFileFactory() {
    this(LabelTypeRegistry.createDefault());
  }

  /**
   * Create a factory using a custom registry, outside of a Spring context.
   */
  public StarFileFactory(LabelTypeRegistry registry) {
    this.registry = registry;
  }

  public LabelTypeRegistry getRegistry() {
    return registry;
  }

  public int getColumnWidth() {
    return columnWidth;
  }

  public StarFileReader createReader(Path file) {
    return new StarFileReader(file, registry);
  }

  public StarFileReader createReader(CharSource source, String sourceName) {
    return new StarFileReader(source, registry, sourceName);
  }

  public StarFileWriter createWriter(Writer out) {
    return new StarFileWriter(out, columnWidth);
  }

  /**
   * Creates a writer on a new file, replacing an existing one.
   */
  public StarFileWriter createWriter(Path file) throws IOException {
    return StarFileWriter.create(file, columnWidth);
  }

  /**
   * Reads the table a reference points to. A relative file name is resolved against the given directory.
   * 
   * @param baseDir
   *          Directory to resolve relative file names of the reference. May be <code>null</code>.
   */
  public StarTable readTable(StarTableRef ref, Path baseDir) throws StarException {
    Path file = Paths.get(ref.getFileName());
    if (baseDir != null)
      file = baseDir.resolve(file);
    return createReader(file).readTable(ref.getTableName());
  }
}
