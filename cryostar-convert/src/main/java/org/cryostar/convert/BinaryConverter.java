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
package org.cryostar.convert;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Makes the binary files referenced by metadata available under a new name, converting their format if needed.
 */
public interface BinaryConverter {
  /**
   * @param extension
   *          File extension without the dot.
   * @return true if files with this extension can be used as they are.
   */
  public boolean isSupported(String extension);

  /**
   * @return Extension (without the dot) of files of a format that needs conversion.
   */
  public String getDefaultExtension();

  /**
   * Makes the source file available at the target path. Supported files are linked or copied, others converted.
   */
  public void convert(Path source, Path target) throws IOException;
}
