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

/**
 * CTF estimation of a micrograph or particle. Defocus values are in Angstrom, the angle in degrees.
 */
public class CtfModel {
  private double defocusU;
  private double defocusV;
  private double defocusAngle;
  private Double phaseShift;
  private Double fitQuality;
  private Double resolution;
  private String psdFile;

  public CtfModel() {
  }

  public CtfModel(double defocusU, double defocusV, double defocusAngle) {
    this.defocusU = defocusU;
    this.defocusV = defocusV;
    this.defocusAngle = defocusAngle;
  }

  public CtfModel copy() {
    CtfModel res = new CtfModel(defocusU, defocusV, defocusAngle);
    res.phaseShift = phaseShift;
    res.fitQuality = fitQuality;
    res.resolution = resolution;
    res.psdFile = psdFile;
    return res;
  }

  public double getDefocusU() {
    return defocusU;
  }

  public void setDefocusU(double defocusU) {
    this.defocusU = defocusU;
  }

  public double getDefocusV() {
    return defocusV;
  }

  public void setDefocusV(double defocusV) {
    this.defocusV = defocusV;
  }

  public double getDefocusAngle() {
    return defocusAngle;
  }

  public void setDefocusAngle(double defocusAngle) {
    this.defocusAngle = defocusAngle;
  }

  /**
   * @return Phase shift in degrees or <code>null</code> if not estimated.
   */
  public Double getPhaseShift() {
    return phaseShift;
  }

  public void setPhaseShift(Double phaseShift) {
    this.phaseShift = phaseShift;
  }

  public Double getFitQuality() {
    return fitQuality;
  }

  public void setFitQuality(Double fitQuality) {
    this.fitQuality = fitQuality;
  }

  public Double getResolution() {
    return resolution;
  }

  public void setResolution(Double resolution) {
    this.resolution = resolution;
  }

  public String getPsdFile() {
    return psdFile;
  }

  public void setPsdFile(String psdFile) {
    this.psdFile = psdFile;
  }
}
