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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.cryostar.data.image.Coordinate;
import org.cryostar.star.StarException;
import org.cryostar.star.StarFileFactory;
import org.cryostar.star.StarSchemaException;
import org.cryostar.star.StarTable;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

/**
 * Tests {@link CoordinatesStarIO}.
 */
public class CoordinatesStarIOTest {
  private Path tempDir;
  private StarFileFactory starFileFactory;
  private CoordinatesStarIO io;

  @BeforeMethod
  public void setUp() throws IOException {
    tempDir = Files.createTempDirectory(CoordinatesStarIOTest.class.getSimpleName());
    starFileFactory = new StarFileFactory();
    io = new CoordinatesStarIO(starFileFactory);
  }

  @AfterMethod
  public void cleanup() throws IOException {
    if (tempDir != null && Files.exists(tempDir)) {
      Files.walk(tempDir).sorted((a, b) -> b.compareTo(a)).forEach(p -> p.toFile().delete());
    }
  }

  @Test
  public void scaledWithOptionalLabels() throws IOException, StarException {
    // GIVEN
    Coordinate first = new Coordinate(10., 20.);
    first.setAttribute("rlnAutopickFigureOfMerit", 0.75);
    first.setAttribute("rlnClassNumber", 2L);
    Coordinate second = new Coordinate(30., 40.);
    second.setAttribute("rlnAutopickFigureOfMerit", 0.5);
    second.setAttribute("rlnClassNumber", 1L);
    Path starFile = tempDir.resolve("mic_001_autopick.star");

    // WHEN
    io.writeMicCoordinates(Arrays.asList(first, second), starFile, 2.);

    // THEN
    StarTable table = starFileFactory.createReader(starFile).readTable(null);
    Assert.assertEquals(table.getName(), "", "Expected an unnamed table");
    Assert.assertEquals(table.getColumnNames(),
        Arrays.asList("rlnCoordinateX", "rlnCoordinateY", "rlnClassNumber", "rlnAutopickFigureOfMerit"));

    List<Coordinate> read = io.readCoordinates(starFile);
    Assert.assertEquals(read.size(), 2);
    Assert.assertEquals(read.get(1).getX(), 60., 1e-9, "Expected scaled coordinate");
    Assert.assertEquals(read.get(1).getY(), 80., 1e-9, "Expected scaled coordinate");
    Assert.assertEquals(read.get(0).getAttribute("rlnAutopickFigureOfMerit"), 0.75);
    Assert.assertEquals(read.get(0).getAttribute("rlnClassNumber"), 2L);
    Assert.assertFalse(read.get(0).hasAttribute("rlnAnglePsi"));
    Assert.assertNull(read.get(0).getMicName());
  }

  @Test
  public void emptyList() throws IOException, StarException {
    // GIVEN
    Path starFile = tempDir.resolve("empty.star");

    // WHEN
    io.writeMicCoordinates(Collections.<Coordinate> emptyList(), starFile, 1.);

    // THEN
    Assert.assertTrue(io.readCoordinates(starFile).isEmpty(), "Expected no coordinates");
  }

  @Test
  public void micrographNameIsRead() throws IOException, StarException {
    // GIVEN
    Path starFile = tempDir.resolve("coords.star");
    Files.write(starFile, Arrays.asList("data_", "loop_", "_rlnMicrographName #1", "_rlnCoordinateX #2",
        "_rlnCoordinateY #3", "Micrographs/mic_007.mrc 512.0 256.5"), StandardCharsets.UTF_8);

    // WHEN
    List<Coordinate> read = io.readCoordinates(starFile);

    // THEN
    Assert.assertEquals(read.get(0).getMicName(), "Micrographs/mic_007.mrc");
    Assert.assertEquals(read.get(0).getY(), 256.5, 1e-9);
  }

  @Test
  public void missingCoordinate() throws IOException, StarException {
    // GIVEN
    Path starFile = tempDir.resolve("coords.star");
    Files.write(starFile, Arrays.asList("data_", "loop_", "_rlnCoordinateX #1", "12.0", "13.0"),
        StandardCharsets.UTF_8);

    // WHEN
    try {
      io.readCoordinates(starFile);
      Assert.fail("Expected an exception");
    } catch (StarSchemaException e) {
      // THEN
      Assert.assertEquals(e.getRowIndex(), Integer.valueOf(0));
      Assert.assertEquals(e.getSource(), starFile.toString());
    }
  }
}
