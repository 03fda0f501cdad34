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
package org.cryostar.convert.classes;

import java.nio.file.Path;
import java.util.Locale;

/**
 * {@link IterationFiles} named like RELION does: "&lt;root&gt;_it&lt;nnn&gt;_data.star" and
 * "&lt;root&gt;_it&lt;nnn&gt;_model.star" in an output directory.
 */
public class RelionIterationFiles implements IterationFiles {
  private final Path dir;
  private final String rootName;

  /**
   * @param rootName
   *          Prefix of the file names, e.g. "run".
   */
  public RelionIterationFiles(Path dir, String rootName) {
    this.dir = dir;
    this.rootName = rootName;
  }

  @Override
  public Path getDataStar(int iteration) {
    return dir.resolve(fileName(iteration, "data"));
  }

  @Override
  public Path getModelStar(int iteration) {
    return dir.resolve(fileName(iteration, "model"));
  }

  private String fileName(int iteration, String kind) {
    return String.format(Locale.ROOT, "%s_it%03d_%s.star", rootName, iteration, kind);
  }
}
