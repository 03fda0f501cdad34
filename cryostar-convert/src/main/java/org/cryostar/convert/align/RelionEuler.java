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

/**
 * Conversion between RELION Euler angles (rot, tilt, psi; ZYZ convention, degrees) and 3x3 rotation matrices.
 * 
 * <p>
 * {@link #matrix(double, double, double)} computes the same matrix as RELION's <code>Euler_angles2matrix</code>,
 * {@link #angles(double[][])} is its left inverse. Angles returned are in the ranges rot in (-180, 180], tilt in [0,
 * 180] and psi in (-180, 180]. If sin(tilt) is zero, rot and psi cannot be separated; rot is then 0 and the whole
 * in-plane rotation is returned as psi.
 */
public class RelionEuler {
  /** Values of sin(tilt) below this are treated as zero. */
  static final double GIMBAL_EPSILON = 1e-9;

  private RelionEuler() {

  }

  /**
   * @return The 3x3 rotation matrix, row-major.
   */
  public static double[][] matrix(double rot, double tilt, double psi) {
    double alpha = Math.toRadians(rot);
    double beta = Math.toRadians(tilt);
    double gamma = Math.toRadians(psi);

    double ca = Math.cos(alpha);
    double cb = Math.cos(beta);
    double cg = Math.cos(gamma);
    double sa = Math.sin(alpha);
    double sb = Math.sin(beta);
    double sg = Math.sin(gamma);
    double cc = cb * ca;
    double cs = cb * sa;
    double sc = sb * ca;
    double ss = sb * sa;

    double[][] res = new double[3][3];
    res[0][0] = cg * cc - sg * sa;
    res[0][1] = cg * cs + sg * ca;
    res[0][2] = -cg * sb;
    res[1][0] = -sg * cc - cg * sa;
    res[1][1] = -sg * cs + cg * ca;
    res[1][2] = sg * sb;
    res[2][0] = sc;
    res[2][1] = ss;
    res[2][2] = cb;
    return res;
  }

  /**
   * @param m
   *          A rotation matrix (at least 3x3, only the upper left 3x3 part is used).
   * @return rot, tilt and psi in degrees.
   */
  public static double[] angles(double[][] m) {
    double sinTilt = Math.sqrt(m[0][2] * m[0][2] + m[1][2] * m[1][2]);
    double tilt = Math.atan2(sinTilt, m[2][2]);
    double rot;
    double psi;
    if (sinTilt > GIMBAL_EPSILON) {
      rot = Math.atan2(m[2][1], m[2][0]);
      psi = Math.atan2(m[1][2], -m[0][2]);
    } else if (m[2][2] > 0) {
      // tilt = 0: the matrix is a rotation about z by rot + psi
      rot = 0.;
      psi = Math.atan2(m[0][1], m[0][0]);
    } else {
      // tilt = 180
      rot = 0.;
      psi = Math.atan2(m[0][1], -m[0][0]);
    }
    return new double[] { normalize(Math.toDegrees(rot)), Math.toDegrees(tilt), normalize(Math.toDegrees(psi)) };
  }

  /**
   * @return The angle mapped to (-180, 180].
   */
  static double normalize(double angle) {
    double res = angle % 360.;
    if (res <= -180.)
      res += 360.;
    else if (res > 180.)
      res -= 360.;
    return res;
  }
}
