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
import java.util.LinkedHashMap;
import java.util.Map;

import org.cryostar.convert.align.AlignmentCodec;
import org.cryostar.convert.optics.OpticsGroup;
import org.cryostar.convert.optics.OpticsGroups;
import org.cryostar.data.image.Acquisition;
import org.cryostar.data.image.Image;
import org.cryostar.data.image.ImageSet;
import org.cryostar.star.Labels;
import org.cryostar.star.StarFileFactory;
import org.cryostar.star.StarFileWriter;
import org.cryostar.star.StarRow;
import org.cryostar.star.StarTable;

/**
 * Writes RELION 3.1 files: an "optics" table followed by the table of the images, which reference their optics group.
 * Shifts are written in Angstrom.
 * 
 * <p>
 * The optics groups are built from the acquisitions and pixel sizes of the images unless groups are set with
 * {@link #setOpticsGroups(OpticsGroups)}; images then reference the group of their acquisition's optics group id, or
 * the first group.
 */
public class ImageSetWriter31 extends ImageSetWriter {
  /** Dimensionality of particle images. */
  private static final long IMAGE_DIMENSIONALITY = 2;

  private OpticsGroups fixedOpticsGroups = null;
  private long imageSize = -1;

  private OpticsGroups opticsGroups;

  public ImageSetWriter31(StarFileFactory starFileFactory) {
    super(starFileFactory);
  }

  @Override
  public FormatVersion getVersion() {
    return FormatVersion.V31;
  }

  /**
   * @param opticsGroups
   *          Groups to write instead of groups built from the images, <code>null</code> to build them.
   */
  public void setOpticsGroups(OpticsGroups opticsGroups) {
    this.fixedOpticsGroups = opticsGroups;
  }

  /**
   * @param imageSize
   *          Box size of particles in pixels written to the optics groups of particles, values &lt;= 0 for none.
   */
  public void setImageSize(long imageSize) {
    this.imageSize = imageSize;
  }

  /**
   * @return The optics groups of the set written last.
   */
  public OpticsGroups getOpticsGroups() {
    return opticsGroups;
  }

  @Override
  protected void beginSet(ImageSet<? extends Image> images, ImageKind kind) {
    opticsGroups = (fixedOpticsGroups != null) ? fixedOpticsGroups : new OpticsGroups(starFileFactory.getRegistry());
  }

  @Override
  protected StarRow acquisitionToRow(Image image, ImageSet<? extends Image> set, ImageKind kind, StarRow row) {
    OpticsGroup group;
    if (fixedOpticsGroups != null) {
      Acquisition acquisition = (image.getAcquisition() != null) ? image.getAcquisition() : set.getAcquisition();
      Integer id = (acquisition != null) ? acquisition.getOpticsGroupId() : null;
      group = (id != null) ? opticsGroups.get(id) : opticsGroups.first();
      if (group == null)
        throw new IllegalArgumentException("Image " + image.getObjId() + " references optics group " + id
            + ", which is not available: " + opticsGroups);
    } else
      group = opticsGroups.assign(image, set, kind);
    return row.with(Labels.OPTICS_GROUP, (long) group.getId());
  }

  @Override
  protected AlignmentCodec createAlignmentCodec(ImageSet<? extends Image> images) {
    Double pixelSize = images.getSamplingRate();
    return new AlignmentCodec(getVersion(), images.getAlignmentType(), (pixelSize != null) ? pixelSize : 1.,
        opticsGroups);
  }

  @Override
  protected void writeFile(Path starFile, StarTable entityTable, ImageKind kind) throws IOException {
    if (kind == ImageKind.PARTICLES && imageSize > 0) {
      Map<String, Object> sizes = new LinkedHashMap<>();
      sizes.put(Labels.IMAGE_SIZE.getName(), imageSize);
      sizes.put(Labels.IMAGE_DIMENSIONALITY.getName(), IMAGE_DIMENSIONALITY);
      opticsGroups.addColumns(sizes);
    }

    // built before the file is opened, a failure must not leave a partial file
    StarTable opticsTable = opticsGroups.toStarTable();
    try (StarFileWriter writer = starFileFactory.createWriter(starFile)) {
      writer.writeComment(FormatVersion.VERSION_COMMENT);
      writer.writeTable(opticsTable);
      writer.writeComment(FormatVersion.VERSION_COMMENT);
      writer.writeTable(entityTable);
    }
  }
}
