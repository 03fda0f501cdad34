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
 * Position of a picked particle on a micrograph, in pixels of that micrograph.
 */
public class Coordinate {
  private Long objId;
  private double x;
  private double y;
  private Long micId;
  private String micName;
  private Map<String, Object> attributes = new LinkedHashMap<>();

  public Coordinate() {
  }

  public Coordinate(double x, double y) {
    this.x = x;
    this.y = y;
  }

  public Coordinate copy() {
    Coordinate res = new Coordinate(x, y);
    res.objId = objId;
    res.micId = micId;
    res.micName = micName;
    res.attributes = new LinkedHashMap<>(attributes);
    return res;
  }

  public Long getObjId() {
    return objId;
  }

  public void setObjId(Long objId) {
    this.objId = objId;
  }

  public double getX() {
    return x;
  }

  public void setX(double x) {
    this.x = x;
  }

  public double getY() {
    return y;
  }

  public void setY(double y) {
    this.y = y;
  }

  public Long getMicId() {
    return micId;
  }

  public void setMicId(Long micId) {
    this.micId = micId;
  }

  public String getMicName() {
    return micName;
  }

  public void setMicName(String micName) {
    this.micName = micName;
  }

  public Map<String, Object> getAttributes() {
    return Collections.unmodifiableMap(attributes);
  }

  public Object getAttribute(String label) {
    return attributes.get(label);
  }

  public boolean hasAttribute(String label) {
    return attributes.containsKey(label);
  }

  public void setAttribute(String label, Object value) {
    if (value == null)
      attributes.remove(label);
    else
      attributes.put(label, value);
  }
}
