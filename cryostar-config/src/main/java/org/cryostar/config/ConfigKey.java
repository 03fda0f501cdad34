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
package org.cryostar.config;

/**
 * Configuration keys which can be used to resolve configuration values.
 * 
 * <p>
 * It's easiest to use these constants with the {@link Config} annotation.
 */
public class ConfigKey {
  /**
   * The STAR format version that is written when a caller does not request a specific one. Either "30" (RELION 3.0
   * layout, one table, acquisition values on each row, shifts in pixels) or "31" (RELION 3.1 layout with a separate
   * "optics" table and shifts in Angstrom).
   * 
   * <p>
   * When reading, the version is always detected from the file itself, this value is not consulted.
   */
  public static final String STAR_FORMAT_VERSION = "starFormatVersion";

  /**
   * Minimum width of each value column when writing looped STAR tables. Values are padded to this width, longer
   * values are written unchanged.
   */
  public static final String STAR_COLUMN_WIDTH = "starColumnWidth";

  /**
   * Maximum defocus span (Angstrom) of a single defocus group.
   */
  public static final String DEFOCUS_GROUP_DIFF = "defocusGroupDiff";

  /**
   * Minimum number of particles in a defocus group. Smaller groups are merged into a neighbour.
   */
  public static final String DEFOCUS_GROUP_MIN_SIZE = "defocusGroupMinSize";

  /**
   * Voltage (kV) of the default optics group that is created when no acquisition information is available.
   */
  public static final String OPTICS_DEFAULT_VOLTAGE = "opticsDefaultVoltage";

  /**
   * Spherical aberration (mm) of the default optics group.
   */
  public static final String OPTICS_DEFAULT_SPHERICAL_ABERRATION = "opticsDefaultSphericalAberration";

  /**
   * Amplitude contrast of the default optics group.
   */
  public static final String OPTICS_DEFAULT_AMPLITUDE_CONTRAST = "opticsDefaultAmplitudeContrast";

  /**
   * Pixel size (Angstrom/pixel) of the default optics group.
   */
  public static final String OPTICS_DEFAULT_PIXEL_SIZE = "opticsDefaultPixelSize";

  /**
   * Image size (pixels) of the default optics group. A value <= 0 leaves the size unset.
   */
  public static final String OPTICS_DEFAULT_IMAGE_SIZE = "opticsDefaultImageSize";
}
