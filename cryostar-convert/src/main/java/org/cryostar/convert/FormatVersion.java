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

import java.util.Collection;

import org.cryostar.star.Labels;
import org.cryostar.star.StarFile;
import org.cryostar.star.StarLabel;

/**
 * The STAR layouts of the RELION versions cryostar supports, and all conventions that differ between them.
 * 
 * <p>
 * <ul>
 * <li>{@link #V30}: one table per file, acquisition parameters on each row, shifts in pixels ("rlnOriginX").
 * <li>{@link #V31}: a table "optics" holding the optics groups, entity rows reference a group by "rlnOpticsGroup",
 * shifts in Angstrom ("rlnOriginXAngst").
 * </ul>
 * 
 * <p>
 * The version of a file is identified only by the presence of the "optics" table, see {@link #detect(Collection)}.
 */
public enum FormatVersion {
  V30(Labels.ORIGIN_X, Labels.ORIGIN_Y, Labels.ORIGIN_Z, false, Labels.ACCURACY_TRANSLATIONS),

  V31(Labels.ORIGIN_X_ANGST, Labels.ORIGIN_Y_ANGST, Labels.ORIGIN_Z_ANGST, true,
      Labels.ACCURACY_TRANSLATIONS_ANGST);

  public static final String OPTICS_TABLE = "optics";

  /** Comment RELION 3.1 writes before each table. */
  public static final String VERSION_COMMENT = "version 30001";

  private final StarLabel<Double> shiftX;
  private final StarLabel<Double> shiftY;
  private final StarLabel<Double> shiftZ;
  private final boolean opticsGroups;
  private final StarLabel<Double> accuracyTranslations;

  private FormatVersion(StarLabel<Double> shiftX, StarLabel<Double> shiftY, StarLabel<Double> shiftZ,
      boolean opticsGroups, StarLabel<Double> accuracyTranslations) {
    this.shiftX = shiftX;
    this.shiftY = shiftY;
    this.shiftZ = shiftZ;
    this.opticsGroups = opticsGroups;
    this.accuracyTranslations = accuracyTranslations;
  }

  /**
   * @return true if the tables contain an "optics" table, i.e. if this is {@link #V31}.
   */
  public static FormatVersion detect(Collection<String> tableNames) {
    return tableNames.contains(OPTICS_TABLE) ? V31 : V30;
  }

  public static FormatVersion detect(StarFile file) {
    return detect(file.getTableNames());
  }

  /**
   * @param value
   *          "30" or "31" (as in the config), optionally with a dot ("3.1").
   */
  public static FormatVersion fromConfigValue(String value) {
    switch (value.trim().replace(".", "")) {
    case "30":
      return V30;
    case "31":
      return V31;
    default:
      throw new IllegalArgumentException("Unknown STAR format version: " + value);
    }
  }

  /**
   * @return Name of the table holding the entities of the given kind when writing.
   */
  public String getEntityTableName(ImageKind kind) {
    if (this == V30 && kind == ImageKind.PARTICLES)
      return "";
    return kind.getTableName();
  }

  /**
   * @return Name of the particles table when reading refinement results, <code>null</code> meaning the first table.
   */
  public String getParticlesTableName() {
    return (this == V31) ? ImageKind.PARTICLES.getTableName() : null;
  }

  public StarLabel<Double> getShiftX() {
    return shiftX;
  }

  public StarLabel<Double> getShiftY() {
    return shiftY;
  }

  public StarLabel<Double> getShiftZ() {
    return shiftZ;
  }

  /**
   * @return true if shifts are stored in Angstrom, false if they are stored in pixels.
   */
  public boolean isShiftInAngstrom() {
    return this == V31;
  }

  /**
   * @return true if acquisition parameters are held in a separate "optics" table instead of on each row.
   */
  public boolean hasOpticsGroups() {
    return opticsGroups;
  }

  /**
   * @return Label of the translational accuracy of a class in "model_classes".
   */
  public StarLabel<Double> getAccuracyTranslations() {
    return accuracyTranslations;
  }
}
