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

import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

import org.cryostar.convert.align.AlignmentCodec;
import org.cryostar.convert.location.LocationCodec;
import org.cryostar.convert.optics.AcquisitionLabels;
import org.cryostar.convert.optics.OpticsGroup;
import org.cryostar.convert.optics.OpticsGroups;
import org.cryostar.data.image.AlignmentType;
import org.cryostar.data.image.Coordinate;
import org.cryostar.data.image.CtfModel;
import org.cryostar.data.image.Image;
import org.cryostar.data.image.ImageLocation;
import org.cryostar.data.image.ImageSet;
import org.cryostar.data.image.Micrograph;
import org.cryostar.data.image.Movie;
import org.cryostar.data.image.Particle;
import org.cryostar.star.LabelType;
import org.cryostar.star.Labels;
import org.cryostar.star.StarException;
import org.cryostar.star.StarFile;
import org.cryostar.star.StarFileFactory;
import org.cryostar.star.StarFormatException;
import org.cryostar.star.StarLabel;
import org.cryostar.star.StarRow;
import org.cryostar.star.StarSchemaException;
import org.cryostar.star.StarTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads sets of images from STAR files of any {@link FormatVersion}.
 * 
 * <p>
 * The acquisition and sampling rate of each image are set from its optics group. Rows of RELION 3.1 files must
 * reference an existing group. Labels starting with "rln" that are not interpreted otherwise are kept as attributes
 * of the images.
 */
public class ImageSetReader {
  private static final Logger logger = LoggerFactory.getLogger(ImageSetReader.class);

  private static final String LABEL_PREFIX = "rln";

  /** Labels that are read into fields of the images, all other "rln" labels become attributes. */
  private static final Set<String> INTERPRETED_LABELS = new HashSet<>();

  static {
    List<StarLabel<?>> labels = Arrays.asList(Labels.OPTICS_GROUP, Labels.OPTICS_GROUP_NAME, Labels.IMAGE_ID,
        Labels.IMAGE_NAME, Labels.MICROGRAPH_NAME, Labels.MICROGRAPH_MOVIE_NAME, Labels.MICROGRAPH_ID,
        Labels.COORDINATE_X, Labels.COORDINATE_Y, Labels.CTF_IMAGE, Labels.DEFOCUS_U, Labels.DEFOCUS_V,
        Labels.DEFOCUS_ANGLE, Labels.CTF_ASTIGMATISM, Labels.CTF_FIGURE_OF_MERIT, Labels.CTF_MAX_RESOLUTION,
        Labels.CTF_PHASE_SHIFT, Labels.ANGLE_ROT, Labels.ANGLE_TILT, Labels.ANGLE_PSI, Labels.ORIGIN_X,
        Labels.ORIGIN_Y, Labels.ORIGIN_Z, Labels.ORIGIN_X_ANGST, Labels.ORIGIN_Y_ANGST, Labels.ORIGIN_Z_ANGST,
        Labels.IS_FLIP, Labels.CLASS_NUMBER, Labels.RANDOM_SUBSET);
    for (StarLabel<?> label : labels)
      INTERPRETED_LABELS.add(label.getName());
    for (StarLabel<?> label : AcquisitionLabels.ROW_LABELS)
      INTERPRETED_LABELS.add(label.getName());
  }

  private final StarFileFactory starFileFactory;

  public ImageSetReader(StarFileFactory starFileFactory) {
    this.starFileFactory = starFileFactory;
  }

  /**
   * @param alignType
   *          The alignment to read from the rows. {@link AlignmentType#NONE} ignores alignment labels.
   */
  public ImageSet<Particle> readSetOfParticles(Path starFile, AlignmentType alignType) throws StarException {
    return readSet(starFile, ImageKind.PARTICLES, alignType, Particle::new);
  }

  public ImageSet<Micrograph> readSetOfMicrographs(Path starFile) throws StarException {
    return readSet(starFile, ImageKind.MICROGRAPHS, AlignmentType.NONE, Micrograph::new);
  }

  public ImageSet<Movie> readSetOfMovies(Path starFile) throws StarException {
    return readSet(starFile, ImageKind.MOVIES, AlignmentType.NONE, Movie::new);
  }

  private <T extends Image> ImageSet<T> readSet(Path starFile, ImageKind kind, AlignmentType alignType,
      Supplier<T> factory) throws StarException {
    StarFile file = starFileFactory.createReader(starFile).read();
    FormatVersion version = FormatVersion.detect(file);
    OpticsGroups opticsGroups = OpticsGroups.fromStar(file, starFileFactory.getRegistry());
    StarTable table = entityTable(file, version, kind);

    OpticsGroup first = opticsGroups.first();
    Double defaultPixelSize = (first != null) ? first.getPixelSize() : null;
    AlignmentCodec codec = new AlignmentCodec(version, alignType,
        (defaultPixelSize != null) ? defaultPixelSize : 1., version.hasOpticsGroups() ? opticsGroups : null);

    ImageSet<T> res = new ImageSet<>();
    res.setAlignmentType(alignType);
    for (int i = 0; i < table.size(); i++) {
      StarRow row = table.getRow(i);
      try {
        T image = factory.get();
        rowToImage(row, i, image, kind, version, opticsGroups, codec);
        res.append(image);
      } catch (StarException e) {
        throw withContext(e, starFile, table, i);
      } catch (IllegalArgumentException e) {
        throw withContext(new StarFormatException(e.getMessage(), e), starFile, table, i);
      }
    }

    T firstImage = res.getFirstItem();
    if (firstImage != null) {
      res.setSamplingRate(firstImage.getSamplingRate());
      if (firstImage.getAcquisition() != null)
        res.setAcquisition(firstImage.getAcquisition().copy());
    }
    logger.info("Read {} {} from '{}' ({}, {} optics groups).", res.size(), kind.getTableName(), starFile, version,
        opticsGroups.size());
    return res;
  }

  private StarTable entityTable(StarFile file, FormatVersion version, ImageKind kind) throws StarSchemaException {
    if (version == FormatVersion.V30)
      return file.getFirstTable();
    StarTable res = file.getTable(kind.getTableName());
    if (res == null) {
      for (StarTable table : file)
        if (!table.getName().equals(FormatVersion.OPTICS_TABLE) && table.hasColumn(kind.getNameLabel()))
          return table;
      throw new StarSchemaException("No table '" + kind.getTableName() + "' available, tables are "
          + file.getTableNames());
    }
    return res;
  }

  private void rowToImage(StarRow row, int rowIndex, Image image, ImageKind kind, FormatVersion version,
      OpticsGroups opticsGroups, AlignmentCodec codec) throws StarException {
    String name = row.getRequired(kind.getNameLabel());
    if (kind == ImageKind.PARTICLES)
      image.setLocation(LocationCodec.decode(name));
    else
      image.setLocation(new ImageLocation(name));
    if (row.has(Labels.IMAGE_ID))
      image.setObjId(row.get(Labels.IMAGE_ID));

    OpticsGroup group;
    if (version.hasOpticsGroups())
      group = opticsGroups.getOrFail(row.getRequired(Labels.OPTICS_GROUP).intValue(), rowIndex);
    else
      group = opticsGroups.assign(AcquisitionLabels.fromRow(row));
    AcquisitionLabels.applyParams(group, image);

    if (row.has(Labels.DEFOCUS_U))
      image.setCtf(rowToCtf(row));

    if (image instanceof Particle) {
      Particle particle = (Particle) image;
      if (row.has(Labels.COORDINATE_X) && row.has(Labels.COORDINATE_Y)) {
        Coordinate coord = new Coordinate(row.get(Labels.COORDINATE_X), row.get(Labels.COORDINATE_Y));
        coord.setMicName(stringOrNull(row, Labels.MICROGRAPH_NAME));
        coord.setMicId(row.get(Labels.MICROGRAPH_ID));
        particle.setCoordinate(coord);
      }
      if (row.has(Labels.MICROGRAPH_ID))
        particle.setMicId(row.get(Labels.MICROGRAPH_ID));
      // classes and subsets are numbered from 1, 0 is written for particles without one
      if (row.has(Labels.CLASS_NUMBER) && row.get(Labels.CLASS_NUMBER) > 0)
        particle.setClassId(row.get(Labels.CLASS_NUMBER).intValue());
      if (row.has(Labels.RANDOM_SUBSET) && row.get(Labels.RANDOM_SUBSET) > 0)
        particle.setRandomSubset(row.get(Labels.RANDOM_SUBSET).intValue());
      codec.setParticleTransform(particle, row, rowIndex);
    }

    for (String label : row.getColumnNames())
      if (label.startsWith(LABEL_PREFIX) && !INTERPRETED_LABELS.contains(label))
        image.setAttribute(label, row.get(label));
  }

  private CtfModel rowToCtf(StarRow row) {
    double defocusU = row.get(Labels.DEFOCUS_U);
    CtfModel res = new CtfModel(defocusU, row.getOrDefault(Labels.DEFOCUS_V, defocusU),
        row.getOrDefault(Labels.DEFOCUS_ANGLE, 0.));
    res.setPsdFile(stringOrNull(row, Labels.CTF_IMAGE));
    res.setFitQuality(row.get(Labels.CTF_FIGURE_OF_MERIT));
    res.setResolution(row.get(Labels.CTF_MAX_RESOLUTION));
    res.setPhaseShift(row.get(Labels.CTF_PHASE_SHIFT));
    return res;
  }

  private static String stringOrNull(StarRow row, StarLabel<String> label) {
    String res = row.get(label);
    return LabelType.isMissingString(res) ? null : res;
  }

  private static StarException withContext(StarException e, Path source, StarTable table, int rowIndex) {
    if (e.getSource() == null)
      e.setSource(source.toString());
    if (e.getTable() == null)
      e.setTable(table.getName());
    if (e.getRowIndex() == null)
      e.setRowIndex(rowIndex);
    return e;
  }
}
