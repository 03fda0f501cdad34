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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.cryostar.convert.FormatVersion;
import org.cryostar.convert.optics.OpticsGroupReferenceException;
import org.cryostar.convert.optics.OpticsGroups;
import org.cryostar.data.image.AlignmentType;
import org.cryostar.data.image.Image;
import org.cryostar.data.image.Transform;
import org.cryostar.star.Labels;
import org.cryostar.star.StarException;
import org.cryostar.star.StarLabel;
import org.cryostar.star.StarRow;
import org.cryostar.star.StarSchemaException;

/**
 * Converts between the alignment labels of STAR rows and the {@link Transform}s of images.
 * 
 * <p>
 * Internally shifts are always in pixels. For {@link FormatVersion#V31}, shifts in rows are in Angstrom and are
 * converted using the pixel size of the optics group of the row (if optics groups are available) or the pixel size
 * given on construction.
 * 
 * <p>
 * With F = diag(-1, 1, 1) if the image is flipped and identity otherwise, transforms are:
 * <ul>
 * <li>{@link AlignmentType#ALIGN_2D}: [R(0, 0, -psi) * F | s]
 * <li>{@link AlignmentType#ALIGN_PROJ}: inverse([R(rot, tilt, psi) * F | -s])
 * </ul>
 * where R is the rotation of {@link RelionEuler#matrix(double, double, double)} and s the shift vector.
 * {@link AlignmentType#ALIGN_3D} is not supported, {@link AlignmentType#NONE} results in no transform.
 */
public class AlignmentCodec {
  /** Z shifts (pixels) up to this absolute value are treated as 0 when writing. */
  private static final double MIN_SHIFT_Z = 1e-9;

  private static final StarLabel<?>[] REQUIRED_2D = new StarLabel<?>[] { Labels.ANGLE_PSI };
  private static final StarLabel<?>[] REQUIRED_PROJ =
      new StarLabel<?>[] { Labels.ANGLE_ROT, Labels.ANGLE_TILT, Labels.ANGLE_PSI };

  private final FormatVersion version;
  private final AlignmentType alignType;
  private final double pixelSize;
  private final OpticsGroups opticsGroups;
  private boolean writeFlip = false;

  /**
   * @param pixelSize
   *          Pixel size in Angstrom/pixel used to convert shifts stored in Angstrom.
   */
  public AlignmentCodec(FormatVersion version, AlignmentType alignType, double pixelSize) {
    this(version, alignType, pixelSize, null);
  }

  /**
   * @param opticsGroups
   *          If not <code>null</code>, rows that reference an optics group with a pixel size use that one instead of
   *          the given pixel size.
   */
  public AlignmentCodec(FormatVersion version, AlignmentType alignType, double pixelSize,
      OpticsGroups opticsGroups) {
    this.version = version;
    this.alignType = alignType;
    this.pixelSize = pixelSize;
    this.opticsGroups = opticsGroups;
  }

  public FormatVersion getVersion() {
    return version;
  }

  public AlignmentType getAlignmentType() {
    return alignType;
  }

  /**
   * @param writeFlip
   *          true if rows written should contain "rlnIsFlip". It is always read if available.
   */
  public void setWriteFlip(boolean writeFlip) {
    this.writeFlip = writeFlip;
  }

  public boolean isWriteFlip() {
    return writeFlip;
  }

  /**
   * @return The labels a row must have to be read, in order. Empty for {@link AlignmentType#NONE}.
   */
  public List<StarLabel<?>> getRequiredLabels() {
    List<StarLabel<?>> res = new ArrayList<>();
    switch (alignType) {
    case NONE:
      return res;
    case ALIGN_2D:
      res.addAll(Arrays.asList(REQUIRED_2D));
      break;
    case ALIGN_PROJ:
      res.addAll(Arrays.asList(REQUIRED_PROJ));
      break;
    default:
      throw unsupported();
    }
    res.add(version.getShiftX());
    res.add(version.getShiftY());
    return Collections.unmodifiableList(res);
  }

  public Transform compose(AlignmentRecord record) {
    switch (alignType) {
    case NONE:
      return null;
    case ALIGN_2D: {
      double[][] rot = multiplyFlip(RelionEuler.matrix(0., 0., -record.getPsi()), record.isFlip());
      return new Transform(homogeneous(rot, record.getShiftX(), record.getShiftY(), record.getShiftZ()));
    }
    case ALIGN_PROJ: {
      double[][] rot =
          multiplyFlip(RelionEuler.matrix(record.getRot(), record.getTilt(), record.getPsi()), record.isFlip());
      return new Transform(homogeneous(rot, -record.getShiftX(), -record.getShiftY(), -record.getShiftZ()))
          .inverse();
    }
    default:
      throw unsupported();
    }
  }

  /**
   * Inverse of {@link #compose(AlignmentRecord)}. A negative determinant of the rotational part marks a flipped
   * image.
   */
  public AlignmentRecord decompose(Transform transform) {
    switch (alignType) {
    case ALIGN_2D: {
      double[][] m = transform.getMatrix();
      boolean flip = determinant(m) < 0;
      double[] angles = RelionEuler.angles(multiplyFlip(m, flip));
      double psi = -RelionEuler.normalize(angles[0] + angles[2]);
      return AlignmentRecord.of2d(RelionEuler.normalize(psi), m[0][3], m[1][3], flip);
    }
    case ALIGN_PROJ: {
      double[][] m = transform.inverse().getMatrix();
      boolean flip = determinant(m) < 0;
      double[] angles = RelionEuler.angles(multiplyFlip(m, flip));
      return new AlignmentRecord(angles[0], angles[1], angles[2], -m[0][3], -m[1][3], -m[2][3], flip);
    }
    case NONE:
      throw new IllegalStateException("Cannot decompose a transform without alignment.");
    default:
      throw unsupported();
    }
  }

  /**
   * Reads the alignment of a row.
   * 
   * @param rowIndex
   *          Index of the row for error messages, may be <code>null</code>.
   * @throws StarSchemaException
   *           If a required label is missing.
   * @throws OpticsGroupReferenceException
   *           If the row references an unknown optics group.
   */
  public AlignmentRecord readRecord(StarRow row, Integer rowIndex) throws StarException {
    List<String> missing = new ArrayList<>();
    for (StarLabel<?> label : getRequiredLabels())
      if (!row.has(label))
        missing.add(label.getName());
    if (!missing.isEmpty()) {
      StarSchemaException e =
          new StarSchemaException("Alignment labels for " + alignType + " not available.", missing);
      e.setRowIndex(rowIndex);
      throw e;
    }

    double scale = version.isShiftInAngstrom() ? 1. / pixelSizeOf(row, rowIndex) : 1.;
    return new AlignmentRecord(row.getOrDefault(Labels.ANGLE_ROT, 0.), row.getOrDefault(Labels.ANGLE_TILT, 0.),
        row.get(Labels.ANGLE_PSI), row.get(version.getShiftX()) * scale, row.get(version.getShiftY()) * scale,
        row.getOrDefault(version.getShiftZ(), 0.) * scale, row.getOrDefault(Labels.IS_FLIP, false));
  }

  public AlignmentRecord readRecord(StarRow row) throws StarException {
    return readRecord(row, null);
  }

  /**
   * Sets the transform of the image to the alignment of the row; for {@link AlignmentType#NONE} the transform of the
   * image is removed.
   */
  public void setParticleTransform(Image item, StarRow row, Integer rowIndex) throws StarException {
    if (alignType == AlignmentType.NONE) {
      item.setTransform(null);
      return;
    }
    item.setTransform(compose(readRecord(row, rowIndex)));
  }

  public void setParticleTransform(Image item, StarRow row) throws StarException {
    setParticleTransform(item, row, null);
  }

  /**
   * @return The row with the alignment labels set. Shifts are written in the unit of the version, using the pixel
   *         size of the optics group the row references, if any. The Z shift is written only if it is not 0
   *         (ignoring rounding noise of matrix inversion).
   */
  public StarRow writeRecord(AlignmentRecord record, StarRow row) throws OpticsGroupReferenceException {
    double scale = version.isShiftInAngstrom() ? pixelSizeOf(row, null) : 1.;
    StarRow res = row;
    if (alignType == AlignmentType.ALIGN_PROJ) {
      res = res.with(Labels.ANGLE_ROT, record.getRot());
      res = res.with(Labels.ANGLE_TILT, record.getTilt());
    }
    res = res.with(Labels.ANGLE_PSI, record.getPsi());
    res = res.with(version.getShiftX(), record.getShiftX() * scale);
    res = res.with(version.getShiftY(), record.getShiftY() * scale);
    if (Math.abs(record.getShiftZ()) > MIN_SHIFT_Z)
      res = res.with(version.getShiftZ(), record.getShiftZ() * scale);
    if (writeFlip)
      res = res.with(Labels.IS_FLIP, record.isFlip());
    return res;
  }

  /**
   * @return The row with the alignment labels of the transform set, or the row itself if there is no transform or no
   *         alignment.
   */
  public StarRow alignmentToRow(Transform transform, StarRow row) throws OpticsGroupReferenceException {
    if (transform == null || alignType == AlignmentType.NONE)
      return row;
    return writeRecord(decompose(transform), row);
  }

  /**
   * @return true if the transform mirrors the image.
   */
  public static boolean isFlipped(Transform transform) {
    return transform != null && transform.getRotationDeterminant() < 0;
  }

  private double pixelSizeOf(StarRow row, Integer rowIndex) throws OpticsGroupReferenceException {
    if (opticsGroups != null && row.has(Labels.OPTICS_GROUP)) {
      Double res = opticsGroups.getOrFail(row.get(Labels.OPTICS_GROUP).intValue(), rowIndex).getPixelSize();
      if (res != null)
        return res;
    }
    return pixelSize;
  }

  private UnsupportedOperationException unsupported() {
    return new UnsupportedOperationException("Alignment type " + alignType + " is not supported.");
  }

  /**
   * @return The upper left 3x3 part of m, with the first column negated if flip is set (i.e. m * F).
   */
  private static double[][] multiplyFlip(double[][] m, boolean flip) {
    double[][] res = new double[3][3];
    for (int i = 0; i < 3; i++)
      for (int j = 0; j < 3; j++)
        res[i][j] = m[i][j];
    if (flip)
      for (int i = 0; i < 3; i++)
        res[i][0] = -res[i][0];
    return res;
  }

  private static double[][] homogeneous(double[][] rot, double x, double y, double z) {
    double[][] res = Transform.identity();
    for (int i = 0; i < 3; i++)
      for (int j = 0; j < 3; j++)
        res[i][j] = rot[i][j];
    res[0][3] = x;
    res[1][3] = y;
    res[2][3] = z;
    return res;
  }

  private static double determinant(double[][] m) {
    RealMatrix rot = MatrixUtils.createRealMatrix(m).getSubMatrix(0, 2, 0, 2);
    return new LUDecomposition(rot).getDeterminant();
  }
}
