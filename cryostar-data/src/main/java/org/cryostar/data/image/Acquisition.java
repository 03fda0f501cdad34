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

import java.util.Objects;

/**
 * Acquisition parameters of an image: microscope settings and, once assigned, the optics group the image belongs to.
 * 
 * <p>
 * Numeric values that were never set are <code>null</code>. Two acquisitions describing the same microscope settings
 * are {@link #equals(Object) equal}.
 */
public class Acquisition {
  private Double voltage;
  private Double sphericalAberration;
  private Double amplitudeContrast;
  private Double magnification;

  private Integer opticsGroupId;
  private String opticsGroupName;
  private String mtfFile;
  private Double beamTiltX;
  private Double beamTiltY;
  private String gainFile;
  private String defectFile;

  public Acquisition() {
  }

  public Acquisition(Double voltage, Double sphericalAberration, Double amplitudeContrast) {
    this.voltage = voltage;
    this.sphericalAberration = sphericalAberration;
    this.amplitudeContrast = amplitudeContrast;
  }

  public Acquisition copy() {
    Acquisition res = new Acquisition(voltage, sphericalAberration, amplitudeContrast);
    res.magnification = magnification;
    res.opticsGroupId = opticsGroupId;
    res.opticsGroupName = opticsGroupName;
    res.mtfFile = mtfFile;
    res.beamTiltX = beamTiltX;
    res.beamTiltY = beamTiltY;
    res.gainFile = gainFile;
    res.defectFile = defectFile;
    return res;
  }

  public Double getVoltage() {
    return voltage;
  }

  public void setVoltage(Double voltage) {
    this.voltage = voltage;
  }

  public Double getSphericalAberration() {
    return sphericalAberration;
  }

  public void setSphericalAberration(Double sphericalAberration) {
    this.sphericalAberration = sphericalAberration;
  }

  public Double getAmplitudeContrast() {
    return amplitudeContrast;
  }

  public void setAmplitudeContrast(Double amplitudeContrast) {
    this.amplitudeContrast = amplitudeContrast;
  }

  public Double getMagnification() {
    return magnification;
  }

  public void setMagnification(Double magnification) {
    this.magnification = magnification;
  }

  public Integer getOpticsGroupId() {
    return opticsGroupId;
  }

  public void setOpticsGroupId(Integer opticsGroupId) {
    this.opticsGroupId = opticsGroupId;
  }

  public String getOpticsGroupName() {
    return opticsGroupName;
  }

  public void setOpticsGroupName(String opticsGroupName) {
    this.opticsGroupName = opticsGroupName;
  }

  public String getMtfFile() {
    return mtfFile;
  }

  public void setMtfFile(String mtfFile) {
    this.mtfFile = mtfFile;
  }

  public Double getBeamTiltX() {
    return beamTiltX;
  }

  public void setBeamTiltX(Double beamTiltX) {
    this.beamTiltX = beamTiltX;
  }

  public Double getBeamTiltY() {
    return beamTiltY;
  }

  public void setBeamTiltY(Double beamTiltY) {
    this.beamTiltY = beamTiltY;
  }

  public String getGainFile() {
    return gainFile;
  }

  public void setGainFile(String gainFile) {
    this.gainFile = gainFile;
  }

  public String getDefectFile() {
    return defectFile;
  }

  public void setDefectFile(String defectFile) {
    this.defectFile = defectFile;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Acquisition))
      return false;
    Acquisition o = (Acquisition) obj;
    return Objects.equals(voltage, o.voltage) && Objects.equals(sphericalAberration, o.sphericalAberration)
        && Objects.equals(amplitudeContrast, o.amplitudeContrast) && Objects.equals(magnification, o.magnification)
        && Objects.equals(opticsGroupId, o.opticsGroupId) && Objects.equals(opticsGroupName, o.opticsGroupName)
        && Objects.equals(mtfFile, o.mtfFile) && Objects.equals(beamTiltX, o.beamTiltX)
        && Objects.equals(beamTiltY, o.beamTiltY) && Objects.equals(gainFile, o.gainFile)
        && Objects.equals(defectFile, o.defectFile);
  }

  @Override
  public int hashCode() {
    return Objects.hash(voltage, sphericalAberration, amplitudeContrast, magnification, opticsGroupId,
        opticsGroupName, mtfFile, beamTiltX, beamTiltY, gainFile, defectFile);
  }

  @Override
  public String toString() {
    return "Acquisition(voltage=" + voltage + ", cs=" + sphericalAberration + ", q0=" + amplitudeContrast
        + ", opticsGroup=" + opticsGroupId + "/" + opticsGroupName + ")";
  }
}
