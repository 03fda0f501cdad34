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
package org.cryostar.convert.classes;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

import org.cryostar.convert.FormatVersion;
import org.cryostar.convert.align.AlignmentCodec;
import org.cryostar.convert.align.ExtraLabelSet;
import org.cryostar.convert.align.ExtraLabels;
import org.cryostar.convert.location.LocationCodec;
import org.cryostar.convert.optics.OpticsGroups;
import org.cryostar.data.classes.ClassItem;
import org.cryostar.data.classes.ClassSet;
import org.cryostar.data.image.AlignmentType;
import org.cryostar.data.image.ImageLocation;
import org.cryostar.data.image.Particle;
import org.cryostar.star.Labels;
import org.cryostar.star.StarException;
import org.cryostar.star.StarFileFactory;
import org.cryostar.star.StarFileReader;
import org.cryostar.star.StarFormatException;
import org.cryostar.star.StarIterationException;
import org.cryostar.star.StarLabel;
import org.cryostar.star.StarRow;
import org.cryostar.star.StarSchemaException;
import org.cryostar.star.StarTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the classes of an iteration of a RELION classification run (2D or 3D) into a {@link ClassSet}.
 * 
 * <p>
 * The model file of the iteration defines the classes: the n-th row of "model_classes" is class n. The data file
 * holds one row per input particle; rows are sorted by "rlnImageId" and matched to the input particles in order of
 * their object id.
 * 
 * <p>
 * Each load fully rebuilds the class set. {@link #getLoadedIteration()} is only updated when a load succeeds.
 */
public class ClassesLoader {
  private static final Logger logger = LoggerFactory.getLogger(ClassesLoader.class);

  public static final String MODEL_CLASSES_TABLE = "model_classes";

  /** Suffix RELION uses to mark a file as MRC volume. */
  public static final String MRC_SUFFIX = ":mrc";

  private static final List<StarLabel<Double>> CLASS_LABELS =
      Collections.unmodifiableList(Arrays.asList(Labels.CLASS_DISTRIBUTION, Labels.ACCURACY_ROTATIONS,
          Labels.ACCURACY_TRANSLATIONS, Labels.ACCURACY_TRANSLATIONS_ANGST, Labels.ESTIMATED_RESOLUTION,
          Labels.OVERALL_FOURIER_COMPLETENESS));

  private final IterationFiles files;
  private final AlignmentType alignType;
  private final double pixelSize;
  private final StarFileFactory starFileFactory;

  private Integer loadedIteration = null;
  private Map<Integer, ClassInfo> classesInfo = Collections.emptyMap();

  /**
   * @param pixelSize
   *          Pixel size of the input particles, used to convert shifts if the files do not provide one.
   */
  public ClassesLoader(IterationFiles files, AlignmentType alignType, double pixelSize,
      StarFileFactory starFileFactory) {
    this.files = files;
    this.alignType = alignType;
    this.pixelSize = pixelSize;
    this.starFileFactory = starFileFactory;
  }

  /**
   * Reads the classes of the model file of the given iteration.
   * 
   * @return Map from class id to class info, ordered by class id.
   */
  public Map<Integer, ClassInfo> loadClassesInfo(int iteration) throws StarException {
    Path modelStar = files.getModelStar(iteration);
    StarTable table = starFileFactory.createReader(modelStar).readTable(MODEL_CLASSES_TABLE);

    Map<Integer, ClassInfo> res = new LinkedHashMap<>();
    for (int i = 0; i < table.size(); i++) {
      StarRow row = table.getRow(i);
      try {
        ImageLocation location = LocationCodec.decode(row.getRequired(Labels.REFERENCE_IMAGE));
        Map<String, Object> attributes = new LinkedHashMap<>();
        for (StarLabel<Double> label : CLASS_LABELS)
          if (row.has(label))
            attributes.put(label.getName(), row.get(label));
        res.put(i + 1, new ClassInfo(i + 1, location, attributes));
      } catch (StarException e) {
        throw withContext(e, modelStar, table, i);
      } catch (IllegalArgumentException e) {
        throw withContext(new StarFormatException(e.getMessage(), e), modelStar, table, i);
      }
    }
    logger.debug("Read {} classes from '{}'.", res.size(), modelStar);
    return res;
  }

  /**
   * Replaces the classes of the class set by the classes of the given iteration.
   * 
   * @throws StarSchemaException
   *           If the data file does not provide "rlnImageId", "rlnClassNumber" or the alignment labels.
   * @throws StarFormatException
   *           If the number of rows in the data file does not match the number of input particles.
   */
  public void fillClassesFromIter(ClassSet classSet, int iteration) throws StarException {
    Map<Integer, ClassInfo> infos = loadClassesInfo(iteration);

    Path dataStar = files.getDataStar(iteration);
    StarFileReader reader = starFileFactory.createReader(dataStar);
    FormatVersion version = FormatVersion.detect(reader.getTableNames());
    OpticsGroups opticsGroups = null;
    if (version.hasOpticsGroups())
      opticsGroups = OpticsGroups.fromTable(reader.readTable(FormatVersion.OPTICS_TABLE),
          starFileFactory.getRegistry());

    StarTable data = reader.readTable(version.getParticlesTableName());
    List<String> missing = new ArrayList<>();
    for (StarLabel<?> label : Arrays.asList(Labels.IMAGE_ID, Labels.CLASS_NUMBER))
      if (!data.hasColumn(label))
        missing.add(label.getName());
    if (!missing.isEmpty())
      throw withContext(new StarSchemaException("Cannot read classes.", missing), dataStar, data, null);

    int numberOfParticles = classSet.getInputParticles().size();
    if (data.size() != numberOfParticles)
      throw withContext(new StarFormatException(
          "Expected one row per input particle (" + numberOfParticles + "), but found " + data.size() + " rows."),
          dataStar, data, null);
    data.sort(Labels.IMAGE_ID.getName());

    AlignmentCodec codec = new AlignmentCodec(version, alignType, pixelSize, opticsGroups);
    ExtraLabelSet extraLabels =
        ExtraLabels.discover(data.isEmpty() ? null : data.getRow(0), ExtraLabels.REFINEMENT_LABELS);
    logger.debug("Reading classes of '{}' ({}), extra labels {}", dataStar, version, extraLabels);

    int[] rowIndex = new int[] { 0 };
    try {
      classSet.classifyItems(data.iterator(), (particle, row) -> {
        int idx = rowIndex[0]++;
        try {
          updateParticle(particle, row, idx, codec, extraLabels);
        } catch (StarException e) {
          throw new StarIterationException(e.getMessage(), withContext(e, dataStar, data, idx));
        }
      }, classItem -> updateClass(classItem, infos.get(classItem.getId()), version));
    } catch (StarIterationException e) {
      if (e.getCause() instanceof StarException)
        throw (StarException) e.getCause();
      throw e;
    }

    loadedIteration = iteration;
    classesInfo = infos;
    logger.info("Loaded {} classes of iteration {} for {} particles.", classSet.size(), iteration, numberOfParticles);
  }

  private void updateParticle(Particle particle, StarRow row, int rowIndex, AlignmentCodec codec,
      ExtraLabelSet extraLabels) throws StarException {
    particle.setClassId(row.getRequired(Labels.CLASS_NUMBER).intValue());
    codec.setParticleTransform(particle, row, rowIndex);
    extraLabels.apply(row, particle);
  }

  private void updateClass(ClassItem classItem, ClassInfo info, FormatVersion version) {
    if (info == null) {
      logger.debug("No model information for class {}.", classItem.getId());
      return;
    }
    classItem.setAlignmentType(alignType);
    String fileName = info.getLocation().getFileName();
    if (alignType == AlignmentType.ALIGN_PROJ)
      fileName += MRC_SUFFIX;
    classItem.getRepresentative().setLocation(info.getLocation().getIndex(), fileName);

    for (StarLabel<Double> label : Arrays.asList(Labels.CLASS_DISTRIBUTION, Labels.ACCURACY_ROTATIONS,
        version.getAccuracyTranslations())) {
      Object value = info.getAttribute(label.getName());
      if (value != null)
        classItem.setAttribute(label.getName(), value);
    }
  }

  private static StarException withContext(StarException e, Path source, StarTable table, Integer rowIndex) {
    if (e.getSource() == null)
      e.setSource(source.toString());
    if (e.getTable() == null)
      e.setTable(table.getName());
    if (e.getRowIndex() == null && rowIndex != null)
      e.setRowIndex(rowIndex);
    return e;
  }

  /**
   * @return The iteration loaded last, empty if no iteration was loaded successfully.
   */
  public OptionalInt getLoadedIteration() {
    return (loadedIteration == null) ? OptionalInt.empty() : OptionalInt.of(loadedIteration);
  }

  /**
   * @return The classes of the iteration loaded last.
   */
  public Map<Integer, ClassInfo> getClassesInfo() {
    return Collections.unmodifiableMap(classesInfo);
  }

  public AlignmentType getAlignmentType() {
    return alignType;
  }
}
