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

import java.util.Objects;

/**
 * The alignment of one image as stored in STAR files: Euler angles in degrees, shifts in pixels and the flip flag.
 */
public final class AlignmentRecord {
  private final double rot;
  private final double tilt;
  private final double psi;
  private final double shiftX;
  private final double shiftY;
  private final double shiftZ;
  private final boolean flip;

  public AlignmentRecord(double rot, double tilt, double psi, double shiftX, double shiftY, double shiftZ,
      boolean flip) {
    this.rot = rot;
    this.tilt = tilt;
    this.psi = psi;
    this.shiftX = shiftX;
    this.shiftY = shiftY;
    this.shiftZ = shiftZ;
    this.flip = flip;
  }

  /**
   * An in-plane alignment.
   */
  public static AlignmentRecord of2d(double psi, double shiftX, double shiftY, boolean flip) {
    return new AlignmentRecord(0., 0., psi, shiftX, shiftY, 0., flip);
  }

  public double getRot() {
    return rot;
  }

  public double getTilt() {
    return tilt;
  }

  public double getPsi() {
    return psi;
  }

  public double getShiftX() {
    return shiftX;
  }

  public double getShiftY() {
    return shiftY;
  }

  public double getShiftZ() {
    return shiftZ;
  }

  public boolean isFlip() {
    return flip;
  }

  /**
   * @return true if angles differ by at most angleTolerance degrees (modulo 360) and shifts by at most shiftTolerance
   *         pixels.
   */
  public boolean isClose(AlignmentRecord other, double angleTolerance, double shiftTolerance) {
    return flip == other.flip && angleDiff(rot, other.rot) <= angleTolerance
        && angleDiff(tilt, other.tilt) <= angleTolerance && angleDiff(psi, other.psi) <= angleTolerance
        && Math.abs(shiftX - other.shiftX) <= shiftTolerance && Math.abs(shiftY - other.shiftY) <= shiftTolerance
        && Math.abs(shiftZ - other.shiftZ) <= shiftTolerance;
  }

  private static double angleDiff(double a, double b) {
    return Math.abs(RelionEuler.normalize(a - b));
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof AlignmentRecord))
      return false;
    AlignmentRecord other = (AlignmentRecord) obj;
    return rot == other.rot && tilt == other.tilt && psi == other.psi && shiftX == other.shiftX
        && shiftY == other.shiftY && shiftZ == other.shiftZ && flip == other.flip;
  }

  @Override
  public int hashCode() {
    return Objects.hash(rot, tilt, psi, shiftX, shiftY, shiftZ, flip);
  }

  @Override
  public String toString() {
    return "AlignmentRecord[rot=" + rot + ",tilt=" + tilt + ",psi=" + psi + ",shifts=(" + shiftX + "," + shiftY + ","
        + shiftZ + "),flip=" + flip + "]";
  }
}
