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
package org.cryostar.data.classes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.cryostar.data.image.AlignmentType;
import org.cryostar.data.image.Image;
import org.cryostar.data.image.Particle;

import com.google.common.collect.ImmutableList;

/**
 * A single 2D or 3D class resulting from a classification: the particles assigned to it and its representative (the
 * class average or the reconstructed volume).
 */
public class ClassItem {
  private final int id;
  private final Image representative;
  private final List<Particle> members = new ArrayList<>();
  private final Map<String, Object> attributes = new LinkedHashMap<>();
  private AlignmentType alignmentType = AlignmentType.NONE;

  public ClassItem(int id, Image representative) {
    this.id = id;
    this.representative = representative;
  }

  public int getId() {
    return id;
  }

  public Image getRepresentative() {
    return representative;
  }

  /* package */ void addMember(Particle particle) {
    members.add(particle);
  }

  /**
   * @return Snapshot of the members in the order they were assigned.
   */
  public List<Particle> getMembers() {
    return ImmutableList.copyOf(members);
  }

  public int size() {
    return members.size();
  }

  public AlignmentType getAlignmentType() {
    return alignmentType;
  }

  public void setAlignmentType(AlignmentType alignmentType) {
    this.alignmentType = alignmentType;
  }

  public Map<String, Object> getAttributes() {
    return Collections.unmodifiableMap(attributes);
  }

  public Object getAttribute(String label) {
    return attributes.get(label);
  }

  public void setAttribute(String label, Object value) {
    if (value == null)
      attributes.remove(label);
    else
      attributes.put(label, value);
  }

  @Override
  public String toString() {
    return "ClassItem(id=" + id + ", size=" + members.size() + ")";
  }
}
