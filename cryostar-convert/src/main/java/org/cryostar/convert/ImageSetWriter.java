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
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.cryostar.convert.align.AlignmentCodec;
import org.cryostar.convert.location.LocationCodec;
import org.cryostar.convert.optics.OpticsGroupReferenceException;
import org.cryostar.data.image.AlignmentType;
import org.cryostar.data.image.Coordinate;
import org.cryostar.data.image.CtfModel;
import org.cryostar.data.image.Image;
import org.cryostar.data.image.ImageLocation;
import org.cryostar.data.image.ImageSet;
import org.cryostar.data.image.Micrograph;
import org.cryostar.data.image.Movie;
import org.cryostar.data.image.Particle;
import org.cryostar.star.Labels;
import org.cryostar.star.StarColumn;
import org.cryostar.star.StarException;
import org.cryostar.star.StarFileFactory;
import org.cryostar.star.StarRow;
import org.cryostar.star.StarTable;
import org.cryostar.util.IoUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes sets of images to STAR files in the layout of a specific {@link FormatVersion}.
 * 
 * <p>
 * If an output directory is set, the binary files the images reference are made available in that directory using
 * the {@link BinaryConverter}, and the STAR file references the new files, relative to the root directory if one is
 * set. New files are named "&lt;prefix&gt;_&lt;objId&gt;.&lt;ext&gt;", with the object id of the first image
 * referencing the file, or keep their base name.
 * 
 * <p>
 * Instances are not thread safe.
 */
public abstract class ImageSetWriter {
  private static final Logger logger = LoggerFactory.getLogger(ImageSetWriter.class);

  private static final String FAKE_MICROGRAPH_NAME = "fake_micrograph_%06d.mrc";

  /** Prefix of image attributes that are written as labels. */
  private static final String LABEL_PREFIX = "rln";

  protected final StarFileFactory starFileFactory;

  private Path outputDir = null;
  private Path rootDir = null;
  private boolean useBaseName = false;
  private BinaryConverter binaryConverter = new LinkingBinaryConverter();
  private Map<String, String> relocatedFiles = new HashMap<>();

  protected ImageSetWriter(StarFileFactory starFileFactory) {
    this.starFileFactory = starFileFactory;
  }

  public abstract FormatVersion getVersion();

  /**
   * @param outputDir
   *          Directory the binaries are made available in, <code>null</code> to reference the original files.
   */
  public void setOutputDir(Path outputDir) {
    this.outputDir = outputDir;
  }

  /**
   * @param rootDir
   *          Directory the paths of relocated binaries are relative to, <code>null</code> for unchanged paths.
   */
  public void setRootDir(Path rootDir) {
    this.rootDir = rootDir;
  }

  /**
   * @param useBaseName
   *          true if relocated binaries keep their base name instead of being named by object id.
   */
  public void setUseBaseName(boolean useBaseName) {
    this.useBaseName = useBaseName;
  }

  public void setBinaryConverter(BinaryConverter binaryConverter) {
    this.binaryConverter = binaryConverter;
  }

  public void writeSetOfMovies(ImageSet<Movie> movies, Path starFile) throws IOException, StarException {
    writeSet(movies, ImageKind.MOVIES, starFile);
  }

  public void writeSetOfMicrographs(ImageSet<Micrograph> micrographs, Path starFile)
      throws IOException, StarException {
    writeSet(micrographs, ImageKind.MICROGRAPHS, starFile);
  }

  public void writeSetOfParticles(ImageSet<Particle> particles, Path starFile) throws IOException, StarException {
    writeSet(particles, ImageKind.PARTICLES, starFile);
  }

  private void writeSet(ImageSet<? extends Image> images, ImageKind kind, Path starFile)
      throws IOException, StarException {
    relocatedFiles = new HashMap<>();
    beginSet(images, kind);

    AlignmentCodec codec = null;
    if (kind == ImageKind.PARTICLES && images.getAlignmentType() != AlignmentType.NONE) {
      codec = createAlignmentCodec(images);
      boolean anyFlip = false;
      for (Image image : images)
        anyFlip |= AlignmentCodec.isFlipped(image.getTransform());
      codec.setWriteFlip(anyFlip);
    }

    List<StarRow> rows = new ArrayList<>();
    for (Image image : images)
      rows.add(imageToRow(image, images, kind, codec));

    StarTable table = createTable(getVersion().getEntityTableName(kind), rows);
    writeFile(starFile, table, kind);
    logger.info("Wrote {} {} to '{}' ({}).", table.size(), kind.getTableName(), starFile, getVersion());
  }

  /**
   * Called before the rows of a set are created.
   */
  protected abstract void beginSet(ImageSet<? extends Image> images, ImageKind kind);

  /**
   * @return The row with the acquisition of the image set.
   */
  protected abstract StarRow acquisitionToRow(Image image, ImageSet<? extends Image> set, ImageKind kind,
      StarRow row);

  protected abstract AlignmentCodec createAlignmentCodec(ImageSet<? extends Image> images);

  protected abstract void writeFile(Path starFile, StarTable entityTable, ImageKind kind) throws IOException;

  private StarRow imageToRow(Image image, ImageSet<? extends Image> set, ImageKind kind, AlignmentCodec codec)
      throws IOException, OpticsGroupReferenceException {
    StarRow row = StarRow.create(Collections.<StarColumn> emptyList(), Collections.emptyList());
    row = row.with(kind.getNameLabel(), locationOf(image, kind));
    row = row.with(Labels.IMAGE_ID, image.getObjId());
    row = acquisitionToRow(image, set, kind, row);
    if (image.hasCtf())
      row = ctfToRow(image.getCtf(), row);

    if (image instanceof Particle) {
      Particle particle = (Particle) image;
      row = coordinateToRow(particle, row);
      if (codec != null)
        row = codec.alignmentToRow(particle.getTransform(), row);
      if (particle.getClassId() != null)
        row = row.with(Labels.CLASS_NUMBER, particle.getClassId().longValue());
      if (particle.getRandomSubset() != null)
        row = row.with(Labels.RANDOM_SUBSET, particle.getRandomSubset().longValue());
    }

    for (Map.Entry<String, Object> attribute : image.getAttributes().entrySet())
      if (attribute.getKey().startsWith(LABEL_PREFIX) && !row.has(attribute.getKey()))
        row = row.with(starFileFactory.getRegistry().column(attribute.getKey()), attribute.getValue());
    return row;
  }

  private StarRow ctfToRow(CtfModel ctf, StarRow row) {
    StarRow res = row;
    if (ctf.getPsdFile() != null)
      res = res.with(Labels.CTF_IMAGE, ctf.getPsdFile());
    res = res.with(Labels.DEFOCUS_U, ctf.getDefocusU());
    res = res.with(Labels.DEFOCUS_V, ctf.getDefocusV());
    res = res.with(Labels.CTF_ASTIGMATISM, ctf.getDefocusU() - ctf.getDefocusV());
    res = res.with(Labels.DEFOCUS_ANGLE, ctf.getDefocusAngle());
    if (ctf.getFitQuality() != null)
      res = res.with(Labels.CTF_FIGURE_OF_MERIT, ctf.getFitQuality());
    if (ctf.getResolution() != null)
      res = res.with(Labels.CTF_MAX_RESOLUTION, ctf.getResolution());
    if (ctf.getPhaseShift() != null)
      res = res.with(Labels.CTF_PHASE_SHIFT, ctf.getPhaseShift());
    return res;
  }

  private StarRow coordinateToRow(Particle particle, StarRow row) {
    Coordinate coord = particle.getCoordinate();
    Long micId = particle.getMicId();
    String micName = null;
    if (coord != null) {
      if (micId == null)
        micId = coord.getMicId();
      micName = coord.getMicName();
    }
    if (micName == null && micId != null)
      micName = String.format(Locale.ROOT, FAKE_MICROGRAPH_NAME, micId);

    StarRow res = row;
    if (micName != null)
      res = res.with(Labels.MICROGRAPH_NAME, micName);
    if (coord != null) {
      res = res.with(Labels.COORDINATE_X, coord.getX());
      res = res.with(Labels.COORDINATE_Y, coord.getY());
    }
    return res;
  }

  /**
   * @return The location of the image as written to the file, relocating the binary if needed.
   */
  private String locationOf(Image image, ImageKind kind) throws IOException {
    ImageLocation location = image.getLocation();
    if (location == null)
      throw new IllegalArgumentException("Image " + image.getObjId() + " has no location.");
    String fileName = relocate(location.getFileName(), image.getObjId(), kind);
    if (kind == ImageKind.PARTICLES)
      return LocationCodec.encode(location.getIndex(), fileName);
    return fileName;
  }

  private String relocate(String fileName, Long objId, ImageKind kind) throws IOException {
    if (outputDir == null)
      return fileName;
    String res = relocatedFiles.get(fileName);
    if (res != null)
      return res;

    String extension = IoUtils.getExtension(fileName);
    String newExtension = binaryConverter.isSupported(extension) ? extension : binaryConverter.getDefaultExtension();
    String newName;
    if (useBaseName)
      newName = IoUtils.replaceBaseExtension(fileName, newExtension);
    else
      newName = String.format(Locale.ROOT, "%s_%06d.%s", kind.getFilePrefix(), objId, newExtension);

    Path target = outputDir.resolve(newName);
    binaryConverter.convert(Paths.get(fileName), target);
    res = IoUtils.relativize(target, rootDir);
    relocatedFiles.put(fileName, res);
    return res;
  }

  /**
   * @return A table holding the rows; its columns are the columns of all rows in order of first occurrence. Cells of
   *         columns a row does not have get the fill value of the column type (see
   *         {@link org.cryostar.star.LabelType#getFillValue()}).
   */
  protected static StarTable createTable(String name, List<StarRow> rows) {
    Map<String, StarColumn> columns = new LinkedHashMap<>();
    for (StarRow row : rows)
      for (StarColumn column : row.getColumns())
        columns.putIfAbsent(column.getName(), column);
    StarTable res = new StarTable(name, new ArrayList<>(columns.values()));

    int filledRows = 0;
    for (StarRow row : rows) {
      if (row.size() == columns.size()) {
        res.addRow(row);
        continue;
      }
      List<Object> values = new ArrayList<>(columns.size());
      for (StarColumn column : columns.values())
        values.add(row.has(column.getName()) ? row.get(column.getName()) : column.getType().getFillValue());
      res.addRow(values.toArray());
      filledRows++;
    }
    if (filledRows > 0)
      logger.debug("Filled missing values of {} rows of table '{}'.", filledRows, name);
    return res;
  }

  /**
   * @return The pixel size of the image, defaulting to the one of the set.
   */
  protected static Double pixelSizeOf(Image image, ImageSet<? extends Image> set) {
    if (image.getSamplingRate() != null)
      return image.getSamplingRate();
    return set.getSamplingRate();
  }
}
