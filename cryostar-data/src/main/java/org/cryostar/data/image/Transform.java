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

import java.util.Arrays;

import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * A homogeneous 4x4 transformation matrix (rotation and translation) attached to an image.
 * 
 * <p>
 * The matrix is stored row-major, the translation is held in the last column. Instances are mutable only through
 * {@link #setMatrix(double[][])}; all getters return copies.
 */
public class Transform {
  private double[][] matrix;

  /**
   * Create an identity transform.
   */
  public Transform() {
    this.matrix = identity();
  }

  public Transform(double[][] matrix) {
    setMatrix(matrix);
  }

  /**
   * @return A copy of the 4x4 matrix.
   */
  public double[][] getMatrix() {
    return copy(matrix);
  }

  public double get(int row, int col) {
    return matrix[row][col];
  }

  public void setMatrix(double[][] newMatrix) {
    if (newMatrix.length != 4)
      throw new IllegalArgumentException("Transform matrix must be 4x4, got " + newMatrix.length + " rows");
    for (double[] row : newMatrix)
      if (row.length != 4)
        throw new IllegalArgumentException("Transform matrix must be 4x4, got a row of length " + row.length);
    this.matrix = copy(newMatrix);
  }

  /**
   * @return The translation part (x, y, z) of the matrix.
   */
  public double[] getShifts() {
    return new double[] { matrix[0][3], matrix[1][3], matrix[2][3] };
  }

  /**
   * @return The inverse of this transform as a new object.
   */
  public Transform inverse() {
    RealMatrix m = MatrixUtils.createRealMatrix(matrix);
    return new Transform(MatrixUtils.inverse(m).getData());
  }

  /**
   * @return Determinant of the 3x3 rotational part. Negative values denote a mirrored transform.
   */
  public double getRotationDeterminant() {
    RealMatrix rot = MatrixUtils.createRealMatrix(matrix).getSubMatrix(0, 2, 0, 2);
    return new LUDecomposition(rot).getDeterminant();
  }

  /**
   * @return true if all entries of both matrices differ by at most the given tolerance.
   */
  public boolean isClose(Transform other, double tolerance) {
    for (int i = 0; i < 4; i++)
      for (int j = 0; j < 4; j++)
        if (Math.abs(matrix[i][j] - other.matrix[i][j]) > tolerance)
          return false;
    return true;
  }

  public Transform copy() {
    return new Transform(matrix);
  }

  public static double[][] identity() {
    double[][] res = new double[4][4];
    for (int i = 0; i < 4; i++)
      res[i][i] = 1.;
    return res;
  }

  private static double[][] copy(double[][] m) {
    double[][] res = new double[m.length][];
    for (int i = 0; i < m.length; i++)
      res[i] = Arrays.copyOf(m[i], m[i].length);
    return res;
  }

  @Override
  public String toString() {
    return "Transform" + Arrays.deepToString(matrix);
  }
}
