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
package org.cryostar.convert.coordinates;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.cryostar.data.image.Coordinate;
import org.cryostar.star.Labels;
import org.cryostar.star.StarColumn;
import org.cryostar.star.StarException;
import org.cryostar.star.StarFileFactory;
import org.cryostar.star.StarFileWriter;
import org.cryostar.star.StarLabel;
import org.cryostar.star.StarRow;
import org.cryostar.star.StarTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes the coordinate files of a single micrograph, as used by RELION particle picking and extraction.
 * 
 * <p>
 * Besides "rlnCoordinateX" and "rlnCoordinateY", the optional labels class number, autopick figure of merit and psi
 * angle are written if the first coordinate has them as attribute; they are read back into attributes.
 */
public class CoordinatesStarIO {
  private static final Logger logger = LoggerFactory.getLogger(CoordinatesStarIO.class);

  private static final List<StarLabel<?>> OPTIONAL_LABELS = Collections.unmodifiableList(
      Arrays.asList(Labels.CLASS_NUMBER, Labels.AUTOPICK_FIGURE_OF_MERIT, Labels.ANGLE_PSI));

  private final StarFileFactory starFileFactory;

  public CoordinatesStarIO(StarFileFactory starFileFactory) {
    this.starFileFactory = starFileFactory;
  }

  /**
   * @param scale
   *          Factor the coordinates are multiplied with, e.g. to account for binning.
   * @throws IllegalArgumentException
   *           If a coordinate misses an optional label the first coordinate has.
   */
  public void writeMicCoordinates(List<Coordinate> coordinates, Path starFile, double scale) throws IOException {
    List<StarColumn> columns = new ArrayList<>();
    columns.add(Labels.COORDINATE_X.toColumn());
    columns.add(Labels.COORDINATE_Y.toColumn());
    List<StarLabel<?>> optional = new ArrayList<>();
    if (!coordinates.isEmpty())
      for (StarLabel<?> label : OPTIONAL_LABELS)
        if (coordinates.get(0).hasAttribute(label.getName())) {
          optional.add(label);
          columns.add(label.toColumn());
        }

    StarTable table = new StarTable("", columns);
    for (Coordinate coord : coordinates) {
      List<Object> values = new ArrayList<>();
      values.add(coord.getX() * scale);
      values.add(coord.getY() * scale);
      for (StarLabel<?> label : optional)
        values.add(coord.getAttribute(label.getName()));
      table.addRow(values.toArray());
    }

    try (StarFileWriter writer = starFileFactory.createWriter(starFile)) {
      writer.writeTable(table);
    }
    logger.debug("Wrote {} coordinates to '{}'.", coordinates.size(), starFile);
  }

  /**
   * Reads the coordinates of the first table of the file. The micrograph name is set if the rows hold
   * "rlnMicrographName".
   */
  public List<Coordinate> readCoordinates(Path starFile) throws StarException {
    StarTable table = starFileFactory.createReader(starFile).readTable(null);
    List<Coordinate> res = new ArrayList<>();
    for (int i = 0; i < table.size(); i++) {
      StarRow row = table.getRow(i);
      try {
        Coordinate coord = new Coordinate(row.getRequired(Labels.COORDINATE_X), row.getRequired(Labels.COORDINATE_Y));
        coord.setMicName(row.get(Labels.MICROGRAPH_NAME));
        for (StarLabel<?> label : OPTIONAL_LABELS)
          if (row.has(label))
            coord.setAttribute(label.getName(), row.get(label));
        res.add(coord);
      } catch (StarException e) {
        e.setSource(starFile.toString());
        e.setTable(table.getName());
        e.setRowIndex(i);
        throw e;
      }
    }
    return res;
  }
}
