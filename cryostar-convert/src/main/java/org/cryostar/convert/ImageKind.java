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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.cryostar.star.Labels;
import org.cryostar.star.StarLabel;

/**
 * The kinds of images that are written to STAR files, each with its table name, the label holding the file location
 * and the labels of its pixel size in an optics group.
 */
public enum ImageKind {
  MOVIES("movies", "mov", Labels.MICROGRAPH_MOVIE_NAME, Labels.MICROGRAPH_ORIGINAL_PIXEL_SIZE),

  MICROGRAPHS("micrographs", "mic", Labels.MICROGRAPH_NAME, Labels.MICROGRAPH_ORIGINAL_PIXEL_SIZE,
      Labels.MICROGRAPH_PIXEL_SIZE),

  PARTICLES("particles", "par", Labels.IMAGE_NAME, Labels.IMAGE_PIXEL_SIZE);

  private final String tableName;
  private final String filePrefix;
  private final StarLabel<String> nameLabel;
  private final List<StarLabel<Double>> pixelSizeLabels;

  @SafeVarargs
  private ImageKind(String tableName, String filePrefix, StarLabel<String> nameLabel,
      StarLabel<Double>... pixelSizeLabels) {
    this.tableName = tableName;
    this.filePrefix = filePrefix;
    this.nameLabel = nameLabel;
    this.pixelSizeLabels = Collections.unmodifiableList(Arrays.asList(pixelSizeLabels));
  }

  /**
   * @return Name of the table in RELION 3.1 files.
   */
  public String getTableName() {
    return tableName;
  }

  /**
   * @return Prefix of the names of relocated binary files.
   */
  public String getFilePrefix() {
    return filePrefix;
  }

  public StarLabel<String> getNameLabel() {
    return nameLabel;
  }

  public List<StarLabel<Double>> getPixelSizeLabels() {
    return pixelSizeLabels;
  }
}
