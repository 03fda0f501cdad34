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
package org.cryostar.convert.optics;

import java.util.Collection;

import org.cryostar.star.StarException;

/**
 * A row references an optics group that does not exist.
 */
public class OpticsGroupReferenceException extends StarException {
  private static final long serialVersionUID = 1L;

  private final int groupId;

  public OpticsGroupReferenceException(int groupId, Integer rowIndex, Collection<Integer> knownIds) {
    super("Optics group " + groupId + " is referenced but not defined. Known optics groups: " + knownIds);
    this.groupId = groupId;
    setRowIndex(rowIndex);
  }

  public int getGroupId() {
    return groupId;
  }
}
