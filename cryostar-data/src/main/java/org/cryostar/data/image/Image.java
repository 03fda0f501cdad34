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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class of all images (micrographs, movies, particles, volumes).
 * 
 * <p>
 * Besides the well-known properties, each image carries an ordered map of additional attributes. These are values
 * the object model does not interpret itself, keyed by their metadata label (e.g. "rlnNormCorrection"), and are
 * written back unchanged when the image is serialized again.
 */
public abstract class Image {
  private Long objId;
  private ImageLocation location;
  private Double samplingRate;
  private Acquisition acquisition;
  private CtfModel ctf;
  private Transform transform;
  private Integer classId;
  private Map<String, Object> attributes = new LinkedHashMap<>();

  public Long getObjId() {
    return objId;
  }

  public void setObjId(Long objId) {
    this.objId = objId;
  }

  public ImageLocation getLocation() {
    return location;
  }

  public void setLocation(ImageLocation location) {
    this.location = location;
  }

  public void setLocation(int index, String fileName) {
    this.location = new ImageLocation(index, fileName);
  }

  public String getFileName() {
    return (location != null) ? location.getFileName() : null;
  }

  /**
   * @return Pixel size in Angstrom/pixel, <code>null</code> if unknown.
   */
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

  public boolean hasCtf() {
    return ctf != null;
  }

  public CtfModel getCtf() {
    return ctf;
  }

  public void setCtf(CtfModel ctf) {
    this.ctf = ctf;
  }

  public boolean hasTransform() {
    return transform != null;
  }

  public Transform getTransform() {
    return transform;
  }

  public void setTransform(Transform transform) {
    this.transform = transform;
  }

  public Integer getClassId() {
    return classId;
  }

  public void setClassId(Integer classId) {
    this.classId = classId;
  }

  /**
   * @return Unmodifiable view of the additional attributes, in insertion order.
   */
  public Map<String, Object> getAttributes() {
    return Collections.unmodifiableMap(attributes);
  }

  public Object getAttribute(String label) {
    return attributes.get(label);
  }

  public boolean hasAttribute(String label) {
    return attributes.containsKey(label);
  }

  /**
   * Set an additional attribute, a <code>null</code> value removes it.
   */
  public void setAttribute(String label, Object value) {
    if (value == null)
      attributes.remove(label);
    else
      attributes.put(label, value);
  }

  /**
   * Copy all properties of this image into the given target. Mutable members are deep-copied.
   */
  protected void copyInto(Image target) {
    target.objId = objId;
    target.location = location;
    target.samplingRate = samplingRate;
    target.acquisition = (acquisition != null) ? acquisition.copy() : null;
    target.ctf = (ctf != null) ? ctf.copy() : null;
    target.transform = (transform != null) ? transform.copy() : null;
    target.classId = classId;
    target.attributes = new LinkedHashMap<>(attributes);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(id=" + objId + ", location=" + location + ")";
  }
}
