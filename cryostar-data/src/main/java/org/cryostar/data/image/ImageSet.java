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
package org.cryostar.data.image;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * An ordered set of images of the same kind, indexed by their object id.
 * 
 * <p>
 * Images that are appended without an object id get the next free id (max id + 1, starting at 1). Properties that are
 * shared by all images of a set (sampling rate, acquisition, alignment type) are held by the set itself.
 */
public class ImageSet<T extends Image> implements Iterable<T> {
  private NavigableMap<Long, T> items = new TreeMap<>();
  private Double samplingRate;
  private Acquisition acquisition;
  private AlignmentType alignmentType = AlignmentType.NONE;

  /**
   * Append an image. If it has no object id yet, a new one is assigned.
   * 
   * @throws IllegalArgumentException
   *           If an image with the same object id is contained already.
   */
  public T append(T item) {
    if (item.getObjId() == null)
      item.setObjId(items.isEmpty() ? 1L : items.lastKey() + 1);
    if (items.containsKey(item.getObjId()))
      throw new IllegalArgumentException("Duplicate object id " + item.getObjId() + " in image set.");
    items.put(item.getObjId(), item);
    return item;
  }

  public T get(long objId) {
    return items.get(objId);
  }

  public T getFirstItem() {
    return items.isEmpty() ? null : items.firstEntry().getValue();
  }

  public int size() {
    return items.size();
  }

  public boolean isEmpty() {
    return items.isEmpty();
  }

  public void clear() {
    items.clear();
  }

  /**
   * Iterates the images in order of their object id.
   */
  @Override
  public Iterator<T> iterator() {
    return items.values().iterator();
  }

  /**
   * @return A new list of all images ordered by the given comparator; ties keep object id order.
   */
  public List<T> iterItems(Comparator<? super T> orderBy) {
    List<T> res = new ArrayList<>(items.values());
    res.sort(orderBy);
    return res;
  }

  public Double getSamplingRate() {
    return samplingRate;
  }

  public void setSamplingRate(Double samplingRate) {
    this.samplingRate = samplingRate;
  }

  public Acquisition getAcquisition() {
    return acquisition;
  }

  public void setAcquisition(Acquisition acquisition) {
    this.acquisition = acquisition;
  }

  public AlignmentType getAlignmentType() {
    return alignmentType;
  }

  public void setAlignmentType(AlignmentType alignmentType) {
    this.alignmentType = alignmentType;
  }

  /**
   * Copy the set-level properties (not the images) of another set.
   */
  public void copyInfo(ImageSet<?> other) {
    this.samplingRate = other.samplingRate;
    this.acquisition = (other.acquisition != null) ? other.acquisition.copy() : null;
    this.alignmentType = other.alignmentType;
  }
}
