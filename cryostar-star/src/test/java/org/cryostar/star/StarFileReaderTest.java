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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import com.google.common.io.CharSource;

/**
 * Tests {@link StarFileReader}, mainly on hand-written input.
 */
public class StarFileReaderTest {
  private static final String TWO_BLOCKS = "# version 30001\n" //
      + "\n" //
      + "data_optics\n" //
      + "\n" //
      + "loop_ \n" //
      + "_rlnOpticsGroupName #1 \n" //
      + "_rlnOpticsGroup #2 \n" //
      + "_rlnVoltage #3 \n" //
      + "opticsGroup1            1   300.000000 \n" //
      + "\n" //
      + "\n" //
      + "data_particles\n" //
      + "\n" //
      + "loop_ \n" //
      + "_rlnImageName #1 \n" //
      + "_rlnOpticsGroup #2 \n" //
      + "_rlnCustomThing #3 \n" //
      + "000001@Particles/stack.mrcs\t1  'quoted value' \n" //
      + "000002@Particles/stack.mrcs 1 plain # trailing comment\n" //
      + "000003@Particles/stack.mrcs 1 \"other's\" \n";

  private LabelTypeRegistry registry;

  @BeforeMethod
  public void setUp() {
    registry = LabelTypeRegistry.createDefault();
  }

  @Test
  public void readAll() throws StarException {
    // WHEN
    StarFile file = reader(TWO_BLOCKS).read();

    // THEN
    Assert.assertEquals(file.getTableNames(), Arrays.asList("optics", "particles"));
    StarTable particles = file.getTable("particles");
    Assert.assertEquals(particles.size(), 3, "Expected 3 rows");
    Assert.assertEquals(particles.getColumn("rlnCustomThing").getType(), LabelType.STRING,
        "Unknown labels should be strings");
    Assert.assertEquals(particles.getRow(0).get("rlnCustomThing"), "quoted value");
    Assert.assertEquals(particles.getRow(1).get("rlnCustomThing"), "plain");
    Assert.assertEquals(particles.getRow(2).get("rlnCustomThing"), "other's");
    Assert.assertEquals(file.getTable("optics").getRow(0).get(Labels.VOLTAGE), Double.valueOf(300.));
  }

  @Test
  public void tableNamesAndSingleTable() throws StarException {
    // GIVEN
    StarFileReader reader = reader(TWO_BLOCKS);

    // WHEN
    List<String> names = reader.getTableNames();
    StarTable first = reader.readTable(null);
    StarTable particles = reader.readTable("particles");

    // THEN
    Assert.assertEquals(names, Arrays.asList("optics", "particles"));
    Assert.assertEquals(first.getName(), "optics");
    Assert.assertEquals(particles.size(), 3);
  }

  @Test
  public void lazyIterationIsRestartable() {
    // GIVEN
    Iterable<StarRow> rows = reader(TWO_BLOCKS).iterRows("particles");

    // WHEN
    List<String> first = new ArrayList<>();
    for (StarRow row : rows)
      first.add(row.get(Labels.IMAGE_NAME));
    List<String> second = new ArrayList<>();
    for (StarRow row : rows)
      second.add(row.get(Labels.IMAGE_NAME));

    // THEN
    Assert.assertEquals(first.size(), 3, "Expected all rows");
    Assert.assertEquals(second, first, "Expected same rows on second iteration");
  }

  @Test
  public void lazyIterationOfSingleRowBlock() {
    // GIVEN
    String text = "data_general\n_rlnImageSize 64\n_rlnImagePixelSize 2.5\n";

    // WHEN
    Iterator<StarRow> it = reader(text).iterRows("general").iterator();

    // THEN
    Assert.assertTrue(it.hasNext());
    Assert.assertEquals(it.next().get(Labels.IMAGE_SIZE), Long.valueOf(64));
    Assert.assertFalse(it.hasNext());
  }

  @Test
  public void typeErrorHasContext() {
    // GIVEN
    String text = "data_particles\nloop_\n_rlnImageName\n_rlnDefocusU\n000001@a.mrcs 1000\n000002@a.mrcs abc\n";

    try {
      // WHEN
      reader(text).read();
      Assert.fail("Expected exception");
    } catch (StarException e) {
      // THEN
      Assert.assertTrue(e instanceof StarTypeException, "Expected type exception but got " + e);
      Assert.assertEquals(e.getColumn(), "rlnDefocusU");
      Assert.assertEquals(e.getRowIndex(), Integer.valueOf(1));
      Assert.assertEquals(e.getTable(), "particles");
      Assert.assertEquals(e.getLineNumber(), Integer.valueOf(6));
      Assert.assertTrue(e.getMessage().contains("file 'test'"), "Expected source in message: " + e.getMessage());
    }
  }

  @Test
  public void arityError() {
    String text = "data_particles\nloop_\n_rlnImageName\n_rlnDefocusU\n000001@a.mrcs 1000 3\n";
    try {
      reader(text).read();
      Assert.fail("Expected exception");
    } catch (StarException e) {
      Assert.assertTrue(e instanceof StarFormatException, "Expected format exception but got " + e);
      Assert.assertEquals(e.getRowIndex(), Integer.valueOf(0));
    }
  }

  @Test(expectedExceptions = StarFormatException.class)
  public void contentBeforeFirstBlock() throws StarException {
    reader("loop_\n_rlnImageName\n").read();
  }

  @Test(expectedExceptions = StarFormatException.class)
  public void labelAfterRows() throws StarException {
    reader("data_\nloop_\n_rlnImageName\na.mrc\n_rlnDefocusU\n").read();
  }

  @Test(expectedExceptions = StarFormatException.class)
  public void valueOutsideLoop() throws StarException {
    reader("data_\n_rlnImageName a.mrc\nb.mrc\n").read();
  }

  @Test(expectedExceptions = StarFormatException.class)
  public void unterminatedQuote() throws StarException {
    reader("data_\nloop_\n_rlnImageName\n\"a.mrc\n").read();
  }

  @Test(expectedExceptions = StarFormatException.class)
  public void duplicateLabel() throws StarException {
    reader("data_\nloop_\n_rlnImageName\n_rlnImageName\n").read();
  }

  @Test(expectedExceptions = StarTypeException.class)
  public void invalidIntIsNotCoerced() throws StarException {
    reader("data_\nloop_\n_rlnClassNumber\n1.5\n").read();
  }

  @Test
  public void missingTable() {
    try {
      reader(TWO_BLOCKS).readTable("micrographs");
      Assert.fail("Expected exception");
    } catch (StarException e) {
      Assert.assertTrue(e instanceof StarSchemaException, "Expected schema exception but got " + e);
      Assert.assertEquals(e.getTable(), "micrographs");
    }
  }

  @Test
  public void lazyIterationWrapsErrors() {
    // GIVEN
    String text = "data_\nloop_\n_rlnClassNumber\n1\nx\n";
    Iterator<StarRow> it = reader(text).iterRows(null).iterator();

    // WHEN
    it.next();
    try {
      it.next();
      Assert.fail("Expected exception");
    } catch (StarIterationException e) {
      // THEN
      Assert.assertTrue(e.getCause() instanceof StarTypeException, "Expected type exception as cause");
    }
  }

  @Test
  public void registryOverride() throws StarException {
    // GIVEN
    LabelTypeRegistry local = registry.copy();
    local.register("rlnCustomThing", LabelType.INT);

    // WHEN
    StarTable table = new StarFileReader(CharSource.wrap("data_\nloop_\n_rlnCustomThing\n7\n"), local, "test")
        .readTable(null);

    // THEN
    Assert.assertEquals(table.getRow(0).get("rlnCustomThing"), Long.valueOf(7));
    Assert.assertEquals(registry.typeOf("rlnCustomThing"), LabelType.STRING, "Default registry must be unchanged");
  }

  private StarFileReader reader(String text) {
    return new StarFileReader(CharSource.wrap(text), registry, "test");
  }
}
