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

import java.io.IOException;
import java.nio.file.Path;

import org.cryostar.convert.align.AlignmentCodec;
import org.cryostar.data.image.Acquisition;
import org.cryostar.data.image.Image;
import org.cryostar.data.image.ImageSet;
import org.cryostar.star.Labels;
import org.cryostar.star.StarFileWriter;
import org.cryostar.star.StarFileFactory;
import org.cryostar.star.StarRow;
import org.cryostar.star.StarTable;

/**
 * Writes RELION 3.0 files: a single table, acquisition labels on each row and shifts in pixels.
 * 
 * <p>
 * The pixel size is written as magnification and detector pixel size (micrometer); if the acquisition has no
 * magnification, 10000 is used so that the detector pixel size equals the pixel size in Angstrom.
 */
public class ImageSetWriter30 extends ImageSetWriter {
  static final double DEFAULT_MAGNIFICATION = 10000.;

  public ImageSetWriter30(StarFileFactory starFileFactory) {
    super(starFileFactory);
  }

  @Override
  public FormatVersion getVersion() {
    return FormatVersion.V30;
  }

  @Override
  protected void beginSet(ImageSet<? extends Image> images, ImageKind kind) {
    // nothing to collect, all values are written per row.
  }

  @Override
  protected StarRow acquisitionToRow(Image image, ImageSet<? extends Image> set, ImageKind kind, StarRow row) {
    StarRow res = row;
    Acquisition acquisition = (image.getAcquisition() != null) ? image.getAcquisition() : set.getAcquisition();
    Double magnification = null;
    if (acquisition != null) {
      if (acquisition.getVoltage() != null)
        res = res.with(Labels.VOLTAGE, acquisition.getVoltage());
      if (acquisition.getSphericalAberration() != null)
        res = res.with(Labels.SPHERICAL_ABERRATION, acquisition.getSphericalAberration());
      if (acquisition.getAmplitudeContrast() != null)
        res = res.with(Labels.AMPLITUDE_CONTRAST, acquisition.getAmplitudeContrast());
      magnification = acquisition.getMagnification();
    }

    Double pixelSize = pixelSizeOf(image, set);
    if (pixelSize != null) {
      if (magnification == null)
        magnification = DEFAULT_MAGNIFICATION;
      res = res.with(Labels.MAGNIFICATION, magnification);
      res = res.with(Labels.DETECTOR_PIXEL_SIZE, pixelSize * magnification / DEFAULT_MAGNIFICATION);
    } else if (magnification != null)
      res = res.with(Labels.MAGNIFICATION, magnification);
    return res;
  }

  @Override
  protected AlignmentCodec createAlignmentCodec(ImageSet<? extends Image> images) {
    Double pixelSize = images.getSamplingRate();
    return new AlignmentCodec(getVersion(), images.getAlignmentType(), (pixelSize != null) ? pixelSize : 1.);
  }

  @Override
  protected void writeFile(Path starFile, StarTable entityTable, ImageKind kind) throws IOException {
    try (StarFileWriter writer = starFileFactory.createWriter(starFile)) {
      writer.writeTable(entityTable);
    }
  }
}
