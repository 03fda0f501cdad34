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
package org.cryostar.convert.defocus;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * A group of particles with similar defocus: id (starting at 1), the defocus range in Angstrom and the object ids of
 * its members in ascending defocus order.
 */
public final class DefocusGroup {
  private final int id;
  private final double minDefocus;
  private final double maxDefocus;
  private final ImmutableList<Long> memberIds;

  public DefocusGroup(int id, double minDefocus, double maxDefocus, List<Long> memberIds) {
    this.id = id;
    this.minDefocus = minDefocus;
    this.maxDefocus = maxDefocus;
    this.memberIds = ImmutableList.copyOf(memberIds);
  }

  public int getId() {
    return id;
  }

  public double getMinDefocus() {
    return minDefocus;
  }

  public double getMaxDefocus() {
    return maxDefocus;
  }

  public double getSpan() {
    return maxDefocus - minDefocus;
  }

  public List<Long> getMemberIds() {
    return memberIds;
  }

  public int size() {
    return memberIds.size();
  }

  public boolean contains(double defocus) {
    return defocus >= minDefocus && defocus <= maxDefocus;
  }

  /**
   * @return Distance of the defocus to the nearest boundary of this group, 0 if it is contained.
   */
  public double distance(double defocus) {
    if (defocus < minDefocus)
      return minDefocus - defocus;
    if (defocus > maxDefocus)
      return defocus - maxDefocus;
    return 0.;
  }

  @Override
  public String toString() {
    return "DefocusGroup[" + id + ",[" + minDefocus + "," + maxDefocus + "]," + memberIds.size() + " members]";
  }
}
