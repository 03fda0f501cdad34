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
package org.cryostar.data.image;

import java.util.Objects;

/**
 * Location of a single image: a file and, for files that contain a stack of images, the 1-based index of the image
 * within that stack.
 * 
 * <p>
 * A location of a file which is not a stack (e.g. a single micrograph) has index {@link #NO_INDEX}.
 */
public final class ImageLocation {
  /** Index value of locations that do not address a single image inside a stack. */
  public static final int NO_INDEX = 0;

  private final int index;
  private final String fileName;

  public ImageLocation(int index, String fileName) {
    if (index < NO_INDEX)
      throw new IllegalArgumentException("Negative image index " + index + " for " + fileName);
    this.index = index;
    this.fileName = Objects.requireNonNull(fileName, "fileName");
  }

  public ImageLocation(String fileName) {
    this(NO_INDEX, fileName);
  }

  public int getIndex() {
    return index;
  }

  public boolean hasIndex() {
    return index != NO_INDEX;
  }

  public String getFileName() {
    return fileName;
  }

  /**
   * @return A location pointing to the same index in a different file.
   */
  public ImageLocation withFileName(String newFileName) {
    return new ImageLocation(index, newFileName);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof ImageLocation))
      return false;
    ImageLocation o = (ImageLocation) obj;
    return index == o.index && fileName.equals(o.fileName);
  }

  @Override
  public int hashCode() {
    return 31 * index + fileName.hashCode();
  }

  @Override
  public String toString() {
    return "ImageLocation(" + index + ", " + fileName + ")";
  }
}
