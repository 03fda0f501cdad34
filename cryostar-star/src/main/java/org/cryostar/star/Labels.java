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

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The STAR labels cryostar knows about.
 * 
 * <p>
 * All of these are registered in {@link LabelTypeRegistry#createDefault()}.
 */
public class Labels {
  // optics
  public static final StarLabel<String> OPTICS_GROUP_NAME = StarLabel.ofString("rlnOpticsGroupName");
  public static final StarLabel<Long> OPTICS_GROUP = StarLabel.ofInt("rlnOpticsGroup");
  public static final StarLabel<String> MTF_FILE_NAME = StarLabel.ofString("rlnMtfFileName");
  public static final StarLabel<Double> MICROGRAPH_ORIGINAL_PIXEL_SIZE =
      StarLabel.ofFloat("rlnMicrographOriginalPixelSize");
  public static final StarLabel<Double> MICROGRAPH_PIXEL_SIZE = StarLabel.ofFloat("rlnMicrographPixelSize");
  public static final StarLabel<Double> IMAGE_PIXEL_SIZE = StarLabel.ofFloat("rlnImagePixelSize");
  public static final StarLabel<Long> IMAGE_SIZE = StarLabel.ofInt("rlnImageSize");
  public static final StarLabel<Long> IMAGE_DIMENSIONALITY = StarLabel.ofInt("rlnImageDimensionality");
  public static final StarLabel<Double> VOLTAGE = StarLabel.ofFloat("rlnVoltage");
  public static final StarLabel<Double> SPHERICAL_ABERRATION = StarLabel.ofFloat("rlnSphericalAberration");
  public static final StarLabel<Double> AMPLITUDE_CONTRAST = StarLabel.ofFloat("rlnAmplitudeContrast");
  public static final StarLabel<Double> MAGNIFICATION = StarLabel.ofFloat("rlnMagnification");
  public static final StarLabel<Double> DETECTOR_PIXEL_SIZE = StarLabel.ofFloat("rlnDetectorPixelSize");
  public static final StarLabel<Double> BEAM_TILT_X = StarLabel.ofFloat("rlnBeamTiltX");
  public static final StarLabel<Double> BEAM_TILT_Y = StarLabel.ofFloat("rlnBeamTiltY");
  public static final StarLabel<String> MICROGRAPH_GAIN_NAME = StarLabel.ofString("rlnMicrographGainName");
  public static final StarLabel<String> MICROGRAPH_DEFECT_FILE = StarLabel.ofString("rlnMicrographDefectFile");

  // entities
  public static final StarLabel<String> MICROGRAPH_MOVIE_NAME = StarLabel.ofString("rlnMicrographMovieName");
  public static final StarLabel<String> MICROGRAPH_NAME = StarLabel.ofString("rlnMicrographName");
  public static final StarLabel<Long> MICROGRAPH_ID = StarLabel.ofInt("rlnMicrographId");
  public static final StarLabel<String> IMAGE_NAME = StarLabel.ofString("rlnImageName");
  public static final StarLabel<Long> IMAGE_ID = StarLabel.ofInt("rlnImageId");
  public static final StarLabel<Double> COORDINATE_X = StarLabel.ofFloat("rlnCoordinateX");
  public static final StarLabel<Double> COORDINATE_Y = StarLabel.ofFloat("rlnCoordinateY");
  public static final StarLabel<Double> COORDINATE_Z = StarLabel.ofFloat("rlnCoordinateZ");
  public static final StarLabel<Double> AUTOPICK_FIGURE_OF_MERIT = StarLabel.ofFloat("rlnAutopickFigureOfMerit");
  public static final StarLabel<Long> RANDOM_SUBSET = StarLabel.ofInt("rlnRandomSubset");

  // ctf
  public static final StarLabel<String> CTF_IMAGE = StarLabel.ofString("rlnCtfImage");
  public static final StarLabel<Double> DEFOCUS_U = StarLabel.ofFloat("rlnDefocusU");
  public static final StarLabel<Double> DEFOCUS_V = StarLabel.ofFloat("rlnDefocusV");
  public static final StarLabel<Double> DEFOCUS_ANGLE = StarLabel.ofFloat("rlnDefocusAngle");
  public static final StarLabel<Double> CTF_ASTIGMATISM = StarLabel.ofFloat("rlnCtfAstigmatism");
  public static final StarLabel<Double> CTF_FIGURE_OF_MERIT = StarLabel.ofFloat("rlnCtfFigureOfMerit");
  public static final StarLabel<Double> CTF_MAX_RESOLUTION = StarLabel.ofFloat("rlnCtfMaxResolution");
  public static final StarLabel<Double> CTF_PHASE_SHIFT = StarLabel.ofFloat("rlnCtfPhaseShift");
  public static final StarLabel<Double> CTF_BFACTOR = StarLabel.ofFloat("rlnCtfBfactor");
  public static final StarLabel<Double> CTF_SCALEFACTOR = StarLabel.ofFloat("rlnCtfScalefactor");

  // alignment
  public static final StarLabel<Double> ANGLE_ROT = StarLabel.ofFloat("rlnAngleRot");
  public static final StarLabel<Double> ANGLE_TILT = StarLabel.ofFloat("rlnAngleTilt");
  public static final StarLabel<Double> ANGLE_PSI = StarLabel.ofFloat("rlnAnglePsi");
  public static final StarLabel<Double> ORIGIN_X = StarLabel.ofFloat("rlnOriginX");
  public static final StarLabel<Double> ORIGIN_Y = StarLabel.ofFloat("rlnOriginY");
  public static final StarLabel<Double> ORIGIN_Z = StarLabel.ofFloat("rlnOriginZ");
  public static final StarLabel<Double> ORIGIN_X_ANGST = StarLabel.ofFloat("rlnOriginXAngst");
  public static final StarLabel<Double> ORIGIN_Y_ANGST = StarLabel.ofFloat("rlnOriginYAngst");
  public static final StarLabel<Double> ORIGIN_Z_ANGST = StarLabel.ofFloat("rlnOriginZAngst");
  public static final StarLabel<Boolean> IS_FLIP = StarLabel.ofBool("rlnIsFlip");

  // refinement results
  public static final StarLabel<Long> CLASS_NUMBER = StarLabel.ofInt("rlnClassNumber");
  public static final StarLabel<Long> GROUP_NUMBER = StarLabel.ofInt("rlnGroupNumber");
  public static final StarLabel<String> GROUP_NAME = StarLabel.ofString("rlnGroupName");
  public static final StarLabel<Double> NORM_CORRECTION = StarLabel.ofFloat("rlnNormCorrection");
  public static final StarLabel<Double> LOG_LIKELI_CONTRIBUTION = StarLabel.ofFloat("rlnLogLikeliContribution");
  public static final StarLabel<Double> MAX_VALUE_PROB_DISTRIBUTION =
      StarLabel.ofFloat("rlnMaxValueProbDistribution");
  public static final StarLabel<Long> NR_OF_SIGNIFICANT_SAMPLES = StarLabel.ofInt("rlnNrOfSignificantSamples");

  // model classes
  public static final StarLabel<String> REFERENCE_IMAGE = StarLabel.ofString("rlnReferenceImage");
  public static final StarLabel<Double> CLASS_DISTRIBUTION = StarLabel.ofFloat("rlnClassDistribution");
  public static final StarLabel<Double> ACCURACY_ROTATIONS = StarLabel.ofFloat("rlnAccuracyRotations");
  public static final StarLabel<Double> ACCURACY_TRANSLATIONS = StarLabel.ofFloat("rlnAccuracyTranslations");
  public static final StarLabel<Double> ACCURACY_TRANSLATIONS_ANGST =
      StarLabel.ofFloat("rlnAccuracyTranslationsAngst");
  public static final StarLabel<Double> ESTIMATED_RESOLUTION = StarLabel.ofFloat("rlnEstimatedResolution");
  public static final StarLabel<Double> OVERALL_FOURIER_COMPLETENESS =
      StarLabel.ofFloat("rlnOverallFourierCompleteness");

  private static final List<StarLabel<?>> ALL_LABELS;

  static {
    List<StarLabel<?>> all = new ArrayList<>();
    for (Field f : Labels.class.getDeclaredFields()) {
      if (Modifier.isStatic(f.getModifiers()) && f.getType().equals(StarLabel.class)) {
        try {
          all.add((StarLabel<?>) f.get(null));
        } catch (IllegalAccessException e) {
          throw new IllegalStateException("Could not access label " + f.getName(), e);
        }
      }
    }
    ALL_LABELS = Collections.unmodifiableList(all);
  }

  private Labels() {

  }

  /**
   * @return All labels defined in this class.
   */
  public static List<StarLabel<?>> all() {
    return ALL_LABELS;
  }
}
