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
package org.cryostar.convert.optics;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.cryostar.convert.ImageKind;
import org.cryostar.data.image.Acquisition;
import org.cryostar.data.image.Image;
import org.cryostar.star.LabelType;
import org.cryostar.star.Labels;
import org.cryostar.star.StarLabel;
import org.cryostar.star.StarRow;

/**
 * Maps {@link Acquisition}s and pixel sizes of images to STAR labels and back.
 */
public class AcquisitionLabels {
  /**
   * Acquisition labels that RELION 3.0 files hold on each row.
   */
  public static final List<StarLabel<Double>> ROW_LABELS = Collections.unmodifiableList(Arrays.asList(
      Labels.VOLTAGE, Labels.SPHERICAL_ABERRATION, Labels.AMPLITUDE_CONTRAST, Labels.MAGNIFICATION,
      Labels.DETECTOR_PIXEL_SIZE));

  /** Detector pixel sizes are given in micrometer, pixel sizes in Angstrom. */
  private static final double MICROMETER_IN_ANGSTROM = 1e4;

  private AcquisitionLabels() {

  }

  /**
   * Builds the optics parameters of an image.
   * 
   * @param acquisition
   *          Acquisition of the image, may be <code>null</code>.
   * @param pixelSize
   *          Pixel size of the image in Angstrom/pixel, may be <code>null</code>.
   * @param kind
   *          Defines the labels the pixel size is stored in.
   * @return Map from label to value, containing only values that are set.
   */
  public static Map<String, Object> toParams(Acquisition acquisition, Double pixelSize, ImageKind kind) {
    Map<String, Object> res = new LinkedHashMap<>();
    if (acquisition != null)
      put(res, Labels.MTF_FILE_NAME, acquisition.getMtfFile());
    if (pixelSize != null)
      for (StarLabel<Double> label : kind.getPixelSizeLabels())
        res.put(label.getName(), pixelSize);
    if (acquisition != null) {
      put(res, Labels.VOLTAGE, acquisition.getVoltage());
      put(res, Labels.SPHERICAL_ABERRATION, acquisition.getSphericalAberration());
      put(res, Labels.AMPLITUDE_CONTRAST, acquisition.getAmplitudeContrast());
      put(res, Labels.BEAM_TILT_X, acquisition.getBeamTiltX());
      put(res, Labels.BEAM_TILT_Y, acquisition.getBeamTiltY());
      put(res, Labels.MICROGRAPH_GAIN_NAME, acquisition.getGainFile());
      put(res, Labels.MICROGRAPH_DEFECT_FILE, acquisition.getDefectFile());
    }
    return res;
  }

  private static <T> void put(Map<String, Object> params, StarLabel<T> label, T value) {
    if (value != null)
      params.put(label.getName(), value);
  }

  /**
   * Builds the parameters of the implicit optics group of a RELION 3.0 file from the acquisition labels of one of its
   * rows. The pixel size is derived from magnification and detector pixel size, if both are available.
   */
  public static Map<String, Object> fromRow(StarRow row) {
    Map<String, Object> res = new LinkedHashMap<>();
    for (StarLabel<Double> label : ROW_LABELS)
      put(res, label, row.get(label));

    Double magnification = row.get(Labels.MAGNIFICATION);
    Double detectorPixelSize = row.get(Labels.DETECTOR_PIXEL_SIZE);
    if (magnification != null && detectorPixelSize != null && magnification > 0) {
      double pixelSize = detectorPixelSize * MICROMETER_IN_ANGSTROM / magnification;
      for (StarLabel<Double> label : kindOfRow(row).getPixelSizeLabels())
        res.put(label.getName(), pixelSize);
    }
    return res;
  }

  private static ImageKind kindOfRow(StarRow row) {
    if (row.has(Labels.IMAGE_NAME))
      return ImageKind.PARTICLES;
    if (row.has(Labels.MICROGRAPH_NAME))
      return ImageKind.MICROGRAPHS;
    return ImageKind.MOVIES;
  }

  /**
   * Sets the acquisition of the image (creating one if needed) to the values of the group, including group id and
   * name, and sets the sampling rate of the image to the pixel size of the group, if available.
   */
  public static void applyParams(OpticsGroup group, Image image) {
    Acquisition acquisition = image.getAcquisition();
    if (acquisition == null) {
      acquisition = new Acquisition();
      image.setAcquisition(acquisition);
    }
    acquisition.setOpticsGroupId(group.getId());
    acquisition.setOpticsGroupName(group.getName());
    if (group.getVoltage() != null)
      acquisition.setVoltage(group.getVoltage());
    if (group.getSphericalAberration() != null)
      acquisition.setSphericalAberration(group.getSphericalAberration());
    if (group.getAmplitudeContrast() != null)
      acquisition.setAmplitudeContrast(group.getAmplitudeContrast());
    if (group.has(Labels.MAGNIFICATION.getName()))
      acquisition.setMagnification(group.get(Labels.MAGNIFICATION));
    if (fileParam(group, Labels.MTF_FILE_NAME) != null)
      acquisition.setMtfFile(fileParam(group, Labels.MTF_FILE_NAME));
    if (group.getBeamTiltX() != null)
      acquisition.setBeamTiltX(group.getBeamTiltX());
    if (group.getBeamTiltY() != null)
      acquisition.setBeamTiltY(group.getBeamTiltY());
    if (fileParam(group, Labels.MICROGRAPH_GAIN_NAME) != null)
      acquisition.setGainFile(fileParam(group, Labels.MICROGRAPH_GAIN_NAME));
    if (fileParam(group, Labels.MICROGRAPH_DEFECT_FILE) != null)
      acquisition.setDefectFile(fileParam(group, Labels.MICROGRAPH_DEFECT_FILE));

    Double pixelSize = group.getPixelSize();
    if (pixelSize != null)
      image.setSamplingRate(pixelSize);
  }

  /**
   * @return The file name held in the group or <code>null</code> if there is none or the group holds the placeholder
   *         of a missing string.
   */
  private static String fileParam(OpticsGroup group, StarLabel<String> label) {
    String res = group.get(label);
    return LabelType.isMissingString(res) ? null : res;
  }
}
