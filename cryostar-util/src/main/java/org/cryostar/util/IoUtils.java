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
package org.cryostar.util;

import java.nio.file.Path;

import com.google.common.io.Files;

/**
 * Helpers for the file names that are referenced from metadata files.
 * 
 * <p>
 * These work on plain names and never touch the file system.
 */
public class IoUtils {
  /**
   * @return The extension of the given file name without the dot, or an empty string if it has none. Only the last
   *         path element is inspected.
   */
  public static String getExtension(String fileName) {
    return Files.getFileExtension(fileName);
  }

  /**
   * @return The last path element of the given file name with its extension replaced by the given one (no dot).
   */
  public static String replaceBaseExtension(String fileName, String newExtension) {
    return Files.getNameWithoutExtension(fileName) + "." + newExtension;
  }

  /**
   * Express a path relative to a root directory, if a root is given.
   * 
   * @param path
   *          The path to express.
   * @param rootDir
   *          The directory the result should be relative to, may be <code>null</code>.
   * @return The relative path as string using '/' separators, or the path itself if rootDir is <code>null</code>.
   */
  public static String relativize(Path path, Path rootDir) {
    Path res = path;
    if (rootDir != null)
      res = rootDir.toAbsolutePath().normalize().relativize(path.toAbsolutePath().normalize());
    return res.toString().replace('\\', '/');
  }
}
