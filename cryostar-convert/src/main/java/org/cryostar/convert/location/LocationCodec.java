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
package org.cryostar.convert.location;

import java.util.Locale;

import org.cryostar.data.image.ImageLocation;

/**
 * Encodes and decodes image locations in the "index@filename" notation of STAR files.
 * 
 * <p>
 * An index is always written with 6 digits, zero-padded ("000005@stack.mrcs"); a location without index
 * ({@link ImageLocation#NO_INDEX}) is written as the plain file name. A type suffix on the file name like ":mrc" is
 * part of the file name.
 */
public class LocationCodec {
  private static final char SEPARATOR = '@';

  private LocationCodec() {

  }

  public static String encode(int index, String fileName) {
    if (index == ImageLocation.NO_INDEX)
      return fileName;
    return String.format(Locale.ROOT, "%06d%c%s", index, SEPARATOR, fileName);
  }

  public static String encode(ImageLocation location) {
    return encode(location.getIndex(), location.getFileName());
  }

  /**
   * Decodes the given string, splitting on the first '@'.
   * 
   * @throws IllegalArgumentException
   *           If the part before the '@' is not a non-negative integer.
   */
  public static ImageLocation decode(String value) {
    int idx = value.indexOf(SEPARATOR);
    if (idx < 0)
      return new ImageLocation(ImageLocation.NO_INDEX, value);

    String indexPart = value.substring(0, idx);
    int index;
    try {
      index = Integer.parseInt(indexPart);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid index '" + indexPart + "' in location '" + value + "'.", e);
    }
    if (index < 0 || indexPart.startsWith("+") || indexPart.startsWith("-"))
      throw new IllegalArgumentException("Invalid index '" + indexPart + "' in location '" + value + "'.");
    return new ImageLocation(index, value.substring(idx + 1));
  }
}
