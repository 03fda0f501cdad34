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
package org.cryostar.convert.align;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import org.cryostar.convert.FormatVersion;
import org.cryostar.convert.optics.OpticsGroupReferenceException;
import org.cryostar.convert.optics.OpticsGroups;
import org.cryostar.data.image.AlignmentType;
import org.cryostar.data.image.Particle;
import org.cryostar.data.image.Transform;
import org.cryostar.star.LabelTypeRegistry;
import org.cryostar.star.Labels;
import org.cryostar.star.StarRow;
import org.cryostar.star.StarSchemaException;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

/**
 * Tests {@link AlignmentCodec} and {@link RelionEuler}.
 */
public class AlignmentCodecTest {
  private static final double ANGLE_TOLERANCE = 1e-4;
  private static final double SHIFT_TOLERANCE = 1e-3;

  private static StarRow row(Object... labelsAndValues) {
    Map<String, Object> values = new LinkedHashMap<>();
    for (int i = 0; i < labelsAndValues.length; i += 2)
      values.put((String) labelsAndValues[i], labelsAndValues[i + 1]);
    return StarRow.create(LabelTypeRegistry.createDefault(), values);
  }

  @Test
  public void matrixMatchesRelion() {
    // WHEN
    double[][] m = RelionEuler.matrix(90., 0., 0.);

    // THEN
    Assert.assertEquals(m[0][0], 0., 1e-12);
    Assert.assertEquals(m[0][1], 1., 1e-12);
    Assert.assertEquals(m[1][0], -1., 1e-12);
    Assert.assertEquals(m[1][1], 0., 1e-12);
    Assert.assertEquals(m[2][2], 1., 1e-12);
  }

  @DataProvider
  public Object[][] projRecords() {
    return new Object[][] { //
        { new AlignmentRecord(10., 20., 30., 1.5, -2.25, 0., false) }, //
        { new AlignmentRecord(-170., 90., 179.5, 0., 0., 0., false) }, //
        { new AlignmentRecord(45., 135., -60., 10., 3., 0.5, false) }, //
        { new AlignmentRecord(180., 0.5, -179., -7., 7., 0., true) }, //
        { new AlignmentRecord(-33.3, 179.5, 12., 2., 1., 0., true) }, //
    };
  }

  @Test(dataProvider = "projRecords")
  public void projDecomposeIsLeftInverse(AlignmentRecord record) {
    // GIVEN
    AlignmentCodec codec = new AlignmentCodec(FormatVersion.V30, AlignmentType.ALIGN_PROJ, 1.);

    // WHEN
    AlignmentRecord res = codec.decompose(codec.compose(record));

    // THEN
    Assert.assertTrue(res.isClose(record, ANGLE_TOLERANCE, SHIFT_TOLERANCE), "Expected " + record + ", got " + res);
  }

  @DataProvider
  public Object[][] records2d() {
    return new Object[][] { //
        { AlignmentRecord.of2d(0., 0., 0., false) }, //
        { AlignmentRecord.of2d(37.5, 1., -2., false) }, //
        { AlignmentRecord.of2d(-120., 0.25, 4., true) }, //
        { AlignmentRecord.of2d(180., -3., 3., true) }, //
    };
  }

  @Test(dataProvider = "records2d")
  public void inPlaneDecomposeIsLeftInverse(AlignmentRecord record) {
    // GIVEN
    AlignmentCodec codec = new AlignmentCodec(FormatVersion.V31, AlignmentType.ALIGN_2D, 1.);

    // WHEN
    Transform t = codec.compose(record);
    AlignmentRecord res = codec.decompose(t);

    // THEN
    Assert.assertTrue(res.isClose(record, ANGLE_TOLERANCE, SHIFT_TOLERANCE), "Expected " + record + ", got " + res);
    Assert.assertEquals(AlignmentCodec.isFlipped(t), record.isFlip());
    Assert.assertEquals(t.get(0, 3), record.getShiftX(), 1e-12, "Expected shifts in translation column");
  }

  @Test
  public void gimbalLockMovesRotationToPsi() {
    // GIVEN
    AlignmentCodec codec = new AlignmentCodec(FormatVersion.V30, AlignmentType.ALIGN_PROJ, 1.);
    AlignmentRecord record = new AlignmentRecord(30., 0., 40., 0., 0., 0., false);

    // WHEN
    AlignmentRecord res = codec.decompose(codec.compose(record));

    // THEN
    Assert.assertEquals(res.getRot(), 0., ANGLE_TOLERANCE, "Expected rot 0 at tilt 0");
    Assert.assertEquals(res.getTilt(), 0., ANGLE_TOLERANCE);
    Assert.assertEquals(res.getPsi(), 70., ANGLE_TOLERANCE, "Expected rot + psi in psi");
    Assert.assertTrue(codec.compose(res).isClose(codec.compose(record), 1e-9), "Expected same transform");
  }

  @Test
  public void angstromShiftsAreConvertedToPixels() throws Exception {
    // GIVEN
    AlignmentCodec codec = new AlignmentCodec(FormatVersion.V31, AlignmentType.ALIGN_2D, 0.5);
    StarRow row = row("rlnAnglePsi", 10., "rlnOriginXAngst", 2., "rlnOriginYAngst", -1.);

    // WHEN
    AlignmentRecord res = codec.readRecord(row);

    // THEN
    Assert.assertEquals(res.getShiftX(), 4., 1e-12, "Expected shift in pixels");
    Assert.assertEquals(res.getShiftY(), -2., 1e-12, "Expected shift in pixels");
    Assert.assertEquals(res.getPsi(), 10., 1e-12);
  }

  @Test
  public void pixelSizeOfOpticsGroup() throws Exception {
    // GIVEN
    OpticsGroups optics = OpticsGroups.create(mapOf("rlnImagePixelSize", 2.));
    AlignmentCodec codec = new AlignmentCodec(FormatVersion.V31, AlignmentType.ALIGN_2D, 0.5, optics);
    StarRow row = row("rlnOpticsGroup", 1, "rlnAnglePsi", 0., "rlnOriginXAngst", 4., "rlnOriginYAngst", 0.);

    // WHEN
    AlignmentRecord res = codec.readRecord(row);
    StarRow written = codec.writeRecord(res, row("rlnOpticsGroup", 1));

    // THEN
    Assert.assertEquals(res.getShiftX(), 2., 1e-12, "Expected pixel size of the optics group to be used");
    Assert.assertEquals(written.get(Labels.ORIGIN_X_ANGST), 4., 1e-12, "Expected shift in Angstrom");
  }

  @Test
  public void zShiftIsWrittenIfSet() throws Exception {
    // GIVEN
    AlignmentCodec codec = new AlignmentCodec(FormatVersion.V31, AlignmentType.ALIGN_PROJ, 2.);
    AlignmentRecord withZ = new AlignmentRecord(10., 20., 30., 1., -1., 1.5, false);
    AlignmentRecord withoutZ = new AlignmentRecord(10., 20., 30., 1., -1., 0., false);

    // WHEN
    StarRow written = codec.writeRecord(withZ, row("rlnOpticsGroup", 1));
    StarRow writtenWithoutZ = codec.writeRecord(withoutZ, row("rlnOpticsGroup", 1));

    // THEN
    Assert.assertEquals(written.get(Labels.ORIGIN_Z_ANGST), 3., 1e-12, "Expected Z shift in Angstrom");
    Assert.assertEquals(codec.readRecord(written).getShiftZ(), 1.5, 1e-12, "Expected Z shift to be read back");
    Assert.assertFalse(writtenWithoutZ.has(Labels.ORIGIN_Z_ANGST), "Expected no Z shift label for Z shift 0");
  }

  @Test
  public void pixelShiftsInV30() throws Exception {
    // GIVEN
    AlignmentCodec codec = new AlignmentCodec(FormatVersion.V30, AlignmentType.ALIGN_PROJ, 3.);
    StarRow row = row("rlnAngleRot", 1., "rlnAngleTilt", 2., "rlnAnglePsi", 3., "rlnOriginX", 5., "rlnOriginY", 6.);

    // WHEN
    AlignmentRecord res = codec.readRecord(row);

    // THEN
    Assert.assertEquals(res.getShiftX(), 5., 1e-12, "Expected shifts to be read as pixels");
    Assert.assertEquals(res.getShiftZ(), 0., 1e-12, "Expected default for missing Z shift");
    Assert.assertFalse(res.isFlip());
  }

  @Test
  public void missingLabels() throws Exception {
    // GIVEN
    AlignmentCodec codec = new AlignmentCodec(FormatVersion.V30, AlignmentType.ALIGN_PROJ, 1.);

    try {
      // WHEN
      codec.setParticleTransform(new Particle(), row("rlnAnglePsi", 3.), 7);
      Assert.fail("Expected exception");
    } catch (StarSchemaException e) {
      // THEN
      Assert.assertEquals(e.getMissing(), Arrays.asList("rlnAngleRot", "rlnAngleTilt", "rlnOriginX", "rlnOriginY"));
      Assert.assertEquals(e.getRowIndex(), Integer.valueOf(7));
    }
  }

  @Test(expectedExceptions = OpticsGroupReferenceException.class)
  public void unknownOpticsGroup() throws Exception {
    OpticsGroups optics = OpticsGroups.create(mapOf("rlnImagePixelSize", 2.));
    AlignmentCodec codec = new AlignmentCodec(FormatVersion.V31, AlignmentType.ALIGN_2D, 1., optics);

    codec.readRecord(row("rlnOpticsGroup", 2, "rlnAnglePsi", 0., "rlnOriginXAngst", 0., "rlnOriginYAngst", 0.));
  }

  @Test
  public void noAlignmentRemovesTransform() throws Exception {
    // GIVEN
    AlignmentCodec codec = new AlignmentCodec(FormatVersion.V31, AlignmentType.NONE, 1.);
    Particle particle = new Particle();
    particle.setTransform(new Transform());

    // WHEN
    codec.setParticleTransform(particle, row("rlnImageName", "1@a.mrcs"));

    // THEN
    Assert.assertNull(particle.getTransform());
    Assert.assertTrue(codec.getRequiredLabels().isEmpty());
  }

  @Test(expectedExceptions = UnsupportedOperationException.class)
  public void alignment3dNotSupported() {
    new AlignmentCodec(FormatVersion.V31, AlignmentType.ALIGN_3D, 1.)
        .compose(new AlignmentRecord(0., 0., 0., 0., 0., 0., false));
  }

  @Test
  public void flipIsWrittenAndRead() throws Exception {
    // GIVEN
    AlignmentCodec codec = new AlignmentCodec(FormatVersion.V30, AlignmentType.ALIGN_2D, 1.);
    codec.setWriteFlip(true);
    Transform flipped = codec.compose(AlignmentRecord.of2d(15., 1., 2., true));

    // WHEN
    StarRow row = codec.alignmentToRow(flipped, row("rlnImageName", "1@a.mrcs"));
    Particle particle = new Particle();
    codec.setParticleTransform(particle, row);

    // THEN
    Assert.assertEquals(row.get(Labels.IS_FLIP), Boolean.TRUE);
    Assert.assertEquals(row.get(Labels.ANGLE_PSI), 15., 1e-9);
    Assert.assertTrue(particle.getTransform().isClose(flipped, 1e-9), "Expected same transform after reading");
  }

  private static Map<String, Object> mapOf(String label, Object value) {
    Map<String, Object> res = new LinkedHashMap<>();
    res.put(label, value);
    return res;
  }
}
