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

import java.util.Map;

import org.cryostar.data.image.ImageLocation;

import com.google.common.collect.ImmutableMap;

/**
 * Information on one class of a refinement iteration, as read from "model_classes".
 */
public final class ClassInfo {
  private final int classId;
  private final ImageLocation location;
  private final ImmutableMap<String, Object> attributes;

  public ClassInfo(int classId, ImageLocation location, Map<String, Object> attributes) {
    this.classId = classId;
    this.location = location;
    this.attributes = ImmutableMap.copyOf(attributes);
  }

  public int getClassId() {
    return classId;
  }

  /**
   * @return Location of the reference image of the class.
   */
  public ImageLocation getLocation() {
    return location;
  }

  /**
   * @return Values of the class labels, by label name.
   */
  public Map<String, Object> getAttributes() {
    return attributes;
  }

  public Object getAttribute(String label) {
    return attributes.get(label);
  }

  @Override
  public String toString() {
    return "ClassInfo[" + classId + "," + location + "," + attributes + "]";
  }
}
