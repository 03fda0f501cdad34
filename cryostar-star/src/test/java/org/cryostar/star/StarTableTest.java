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

import java.util.Arrays;

import org.testng.Assert;
import org.testng.annotations.Test;

/**
 * Tests structural edits of {@link StarTable} and {@link StarRow}, and value formatting of {@link LabelType}.
 */
public class StarTableTest {
  @Test
  public void addAndRemoveColumns() {
    // GIVEN
    StarTable table = StarTable.withLabels("particles", Labels.IMAGE_NAME, Labels.DEFOCUS_U);
    table.addRow("000001@a.mrcs", 10000.);
    table.addRow("000002@a.mrcs", 20000.);

    // WHEN
    table.addColumn(Labels.OPTICS_GROUP.toColumn(), 1);
    table.addColumn(Labels.DEFOCUS_V.toColumn(), row -> row.get(Labels.DEFOCUS_U) + 100.);
    table.removeColumn(Labels.IMAGE_NAME.getName());

    // THEN
    Assert.assertEquals(table.getColumnNames(), Arrays.asList("rlnDefocusU", "rlnOpticsGroup", "rlnDefocusV"));
    Assert.assertEquals(table.getRow(0).get(Labels.OPTICS_GROUP), Long.valueOf(1), "Expected value coerced to long");
    Assert.assertEquals(table.getRow(1).get(Labels.DEFOCUS_V), Double.valueOf(20100.));
    Assert.assertFalse(table.getRow(0).has(Labels.IMAGE_NAME), "Expected column to be removed from rows");
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void wrongArity() {
    StarTable table = StarTable.withLabels("t", Labels.IMAGE_NAME, Labels.DEFOCUS_U);
    table.addRow("a");
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void removeUnknownColumn() {
    StarTable.withLabels("t", Labels.IMAGE_NAME).removeColumn("rlnDefocusU");
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void invalidValue() {
    StarTable.withLabels("t", Labels.CLASS_NUMBER).addRow("abc");
  }

  @Test
  public void addRowMatchesByName() {
    // GIVEN
    StarTable table = StarTable.withLabels("t", Labels.IMAGE_NAME, Labels.CLASS_NUMBER);
    StarRow row = StarRow.create(Arrays.asList(Labels.CLASS_NUMBER.toColumn(), Labels.IMAGE_NAME.toColumn()),
        Arrays.asList(4, "x.mrc"));

    // WHEN
    table.addRow(row);

    // THEN
    Assert.assertEquals(table.getRow(0).getValue(0), "x.mrc");
    Assert.assertEquals(table.getRow(0).getValue(1), 4L);
  }

  @Test
  public void rowsAreImmutable() {
    // GIVEN
    StarTable table = StarTable.withLabels("t", Labels.IMAGE_NAME, Labels.CLASS_NUMBER);
    StarRow row = table.addRow("x.mrc", 1);

    // WHEN
    StarRow changed = row.with(Labels.CLASS_NUMBER, 2L).with(Labels.ANGLE_PSI, 3.);

    // THEN
    Assert.assertEquals(table.getRow(0).get(Labels.CLASS_NUMBER), Long.valueOf(1), "Expected table row unchanged");
    Assert.assertEquals(changed.get(Labels.CLASS_NUMBER), Long.valueOf(2));
    Assert.assertEquals(changed.getColumnNames(), Arrays.asList("rlnImageName", "rlnClassNumber", "rlnAnglePsi"));
    Assert.assertEquals(row.getColumnNames(), Arrays.asList("rlnImageName", "rlnClassNumber"));
  }

  @Test
  public void sortIsStable() {
    // GIVEN
    StarTable table = StarTable.withLabels("t", Labels.IMAGE_ID, Labels.IMAGE_NAME);
    table.addRow(3, "c");
    table.addRow(1, "a");
    table.addRow(3, "d");
    table.addRow(2, "b");

    // WHEN
    table.sort(Labels.IMAGE_ID.getName());

    // THEN
    StringBuilder order = new StringBuilder();
    for (StarRow row : table)
      order.append(row.get(Labels.IMAGE_NAME));
    Assert.assertEquals(order.toString(), "abcd");
  }

  @Test
  public void floatFormatting() {
    Assert.assertEquals(LabelType.format(300.), "300.0");
    Assert.assertEquals(LabelType.format(0.1), "0.1");
    Assert.assertEquals(LabelType.format(1e-7), "1.0E-7");
    Assert.assertEquals(LabelType.format(2.5e13), "2.5E13");
    Assert.assertEquals(LabelType.format(true), "1");
    Assert.assertEquals(LabelType.format(5L), "5");
  }

  @Test
  public void formattedFloatsParseToSameValue() throws StarTypeException {
    double[] values = new double[] { 0.1, 1. / 3., -123456.789, 1e-6, 9.99999999e11, Math.PI * 1e20, -0. };
    for (double d : values)
      Assert.assertEquals(LabelType.FLOAT.parse(LabelType.format(d)), Double.valueOf(d), "Value " + d);
  }

  @Test
  public void quoting() {
    Assert.assertEquals(StarFileWriter.formatToken("a b"), "\"a b\"");
    Assert.assertEquals(StarFileWriter.formatToken(""), "\"\"");
    Assert.assertEquals(StarFileWriter.formatToken("say\" hi"), "'say\" hi'");
    Assert.assertEquals(StarFileWriter.formatToken("data_x"), "\"data_x\"");
    Assert.assertEquals(StarFileWriter.formatToken("000001@a.mrcs"), "000001@a.mrcs");
  }

  @Test(expectedExceptions = IllegalStateException.class)
  public void singleRowTableNeedsOneRow() throws Exception {
    StarTable table = StarTable.withLabels("t", Labels.IMAGE_NAME);
    table.setLooped(false);
    table.addRow("a");
    table.addRow("b");
    new StarFileWriter(new java.io.StringWriter()).writeTable(table);
  }

  @Test
  public void tableRef() {
    Assert.assertEquals(StarTableRef.parse("particles@run_it001_data.star").getTableName(), "particles");
    Assert.assertEquals(StarTableRef.parse("particles@run_it001_data.star").getFileName(), "run_it001_data.star");
    Assert.assertNull(StarTableRef.parse("run_it001_data.star").getTableName());
    Assert.assertEquals(StarTableRef.of("model_classes", "m.star").toString(), "model_classes@m.star");
  }
}
