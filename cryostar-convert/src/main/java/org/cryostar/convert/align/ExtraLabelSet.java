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

import java.util.List;

import org.cryostar.data.image.Image;
import org.cryostar.star.StarLabel;
import org.cryostar.star.StarRow;

import com.google.common.collect.ImmutableList;

/**
 * An immutable set of labels, found by {@link ExtraLabels#discover(StarRow, List)}, that are copied from rows to
 * image attributes.
 */
public final class ExtraLabelSet {
  private final ImmutableList<StarLabel<?>> labels;

  ExtraLabelSet(List<StarLabel<?>> labels) {
    this.labels = ImmutableList.copyOf(labels);
  }

  public List<StarLabel<?>> getLabels() {
    return labels;
  }

  public boolean isEmpty() {
    return labels.isEmpty();
  }

  /**
   * Sets the values of all labels of this set as attributes of the image, named by the label.
   * 
   * @throws IllegalArgumentException
   *           If the row does not have one of the labels.
   */
  public void apply(StarRow row, Image image) {
    for (StarLabel<?> label : labels) {
      Object value = row.get(label);
      if (value == null)
        throw new IllegalArgumentException("Row does not have label '" + label.getName() + "': " + row);
      image.setAttribute(label.getName(), value);
    }
  }

  @Override
  public String toString() {
    return "ExtraLabelSet" + labels;
  }
}
