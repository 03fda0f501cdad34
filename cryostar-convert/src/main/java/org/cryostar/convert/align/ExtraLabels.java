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
package org.cryostar.convert.align;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.cryostar.star.Labels;
import org.cryostar.star.StarLabel;
import org.cryostar.star.StarRow;

/**
 * Optional per-particle labels of refinement results that are copied to the images as attributes.
 */
public class ExtraLabels {
  /**
   * The labels RELION refinements write per particle in addition to class and alignment.
   */
  public static final List<StarLabel<?>> REFINEMENT_LABELS = Collections.unmodifiableList(Arrays.asList(
      Labels.NORM_CORRECTION, Labels.LOG_LIKELI_CONTRIBUTION, Labels.MAX_VALUE_PROB_DISTRIBUTION, Labels.GROUP_NAME));

  private ExtraLabels() {

  }

  /**
   * Finds which of the candidate labels are available. Only the given row is inspected; all rows of a table have the
   * same labels.
   * 
   * @param firstRow
   *          May be <code>null</code> for empty tables, which results in an empty set.
   */
  public static ExtraLabelSet discover(StarRow firstRow, List<? extends StarLabel<?>> candidates) {
    List<StarLabel<?>> present = new ArrayList<>();
    if (firstRow != null)
      for (StarLabel<?> label : candidates)
        if (firstRow.has(label))
          present.add(label);
    return new ExtraLabelSet(present);
  }
}
