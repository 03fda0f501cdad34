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
package org.cryostar.convert;

import java.util.LinkedHashMap;
import java.util.Map;

import javax.inject.Inject;

import org.cryostar.config.Config;
import org.cryostar.config.ConfigKey;
import org.cryostar.context.AutoInstatiate;
import org.cryostar.convert.classes.ClassesLoader;
import org.cryostar.convert.classes.IterationFiles;
import org.cryostar.convert.coordinates.CoordinatesStarIO;
import org.cryostar.convert.defocus.DefocusGroups;
import org.cryostar.convert.optics.OpticsGroups;
import org.cryostar.data.image.AlignmentType;
import org.cryostar.data.image.ImageSet;
import org.cryostar.data.image.Particle;
import org.cryostar.star.Labels;
import org.cryostar.star.StarFileFactory;

/**
 * Creates readers, writers and helpers of the conversion configured with the values of the configuration.
 */
@AutoInstatiate
public class ConverterFactory {
  @Config(ConfigKey.STAR_FORMAT_VERSION)
  private String formatVersion;

  @Config(ConfigKey.DEFOCUS_GROUP_DIFF)
  private double defocusGroupDiff;

  @Config(ConfigKey.DEFOCUS_GROUP_MIN_SIZE)
  private int defocusGroupMinSize;

  @Config(ConfigKey.OPTICS_DEFAULT_VOLTAGE)
  private double defaultVoltage;

  @Config(ConfigKey.OPTICS_DEFAULT_SPHERICAL_ABERRATION)
  private double defaultSphericalAberration;

  @Config(ConfigKey.OPTICS_DEFAULT_AMPLITUDE_CONTRAST)
  private double defaultAmplitudeContrast;

  @Config(ConfigKey.OPTICS_DEFAULT_PIXEL_SIZE)
  private double defaultPixelSize;

  @Config(ConfigKey.OPTICS_DEFAULT_IMAGE_SIZE)
  private long defaultImageSize;

  @Inject
  private StarFileFactory starFileFactory;

  public FormatVersion getDefaultVersion() {
    return FormatVersion.fromConfigValue(formatVersion);
  }

  public ImageSetReader createReader() {
    return new ImageSetReader(starFileFactory);
  }

  /**
   * @return A writer for the configured format version.
   */
  public ImageSetWriter createWriter() {
    return createWriter(getDefaultVersion());
  }

  public ImageSetWriter createWriter(FormatVersion version) {
    if (version == FormatVersion.V30)
      return new ImageSetWriter30(starFileFactory);
    ImageSetWriter31 res = new ImageSetWriter31(starFileFactory);
    res.setImageSize(defaultImageSize);
    return res;
  }

  public ClassesLoader createClassesLoader(IterationFiles files, AlignmentType alignType, double pixelSize) {
    return new ClassesLoader(files, alignType, pixelSize, starFileFactory);
  }

  /**
   * @return A single optics group with the configured default acquisition and pixel size.
   */
  public OpticsGroups createDefaultOpticsGroups() {
    Map<String, Object> params = new LinkedHashMap<>();
    params.put(Labels.IMAGE_PIXEL_SIZE.getName(), defaultPixelSize);
    params.put(Labels.VOLTAGE.getName(), defaultVoltage);
    params.put(Labels.SPHERICAL_ABERRATION.getName(), defaultSphericalAberration);
    params.put(Labels.AMPLITUDE_CONTRAST.getName(), defaultAmplitudeContrast);
    if (defaultImageSize > 0)
      params.put(Labels.IMAGE_SIZE.getName(), defaultImageSize);
    return OpticsGroups.create(params);
  }

  /**
   * @return Defocus groups of the particles, using the configured defocus difference and minimum group size.
   */
  public DefocusGroups createDefocusGroups(ImageSet<Particle> particles) {
    return DefocusGroups.fromParticles(particles, defocusGroupDiff, defocusGroupMinSize);
  }

  public CoordinatesStarIO createCoordinatesIO() {
    return new CoordinatesStarIO(starFileFactory);
  }

  public StarFileFactory getStarFileFactory() {
    return starFileFactory;
  }
}
