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

/**
 * A single particle image, usually one image inside a stack file that was extracted from a micrograph.
 */
public class Particle extends Image {
  private Coordinate coordinate;
  private Long micId;
  private Integer randomSubset;

  public Particle() {
  }

  public Particle(int index, String fileName) {
    setLocation(index, fileName);
  }

  public boolean hasCoordinate() {
    return coordinate != null;
  }

  public Coordinate getCoordinate() {
    return coordinate;
  }

  public void setCoordinate(Coordinate coordinate) {
    this.coordinate = coordinate;
  }

  public Long getMicId() {
    return micId;
  }

  public void setMicId(Long micId) {
    this.micId = micId;
  }

  /**
   * @return The half-set (1 or 2) this particle was assigned to for gold-standard refinement, <code>null</code> if
   *         none.
   */
  public Integer getRandomSubset() {
    return randomSubset;
  }

  public void setRandomSubset(Integer randomSubset) {
    this.randomSubset = randomSubset;
  }

  public Particle copy() {
    Particle res = new Particle();
    copyInto(res);
    res.coordinate = (coordinate != null) ? coordinate.copy() : null;
    res.micId = micId;
    res.randomSubset = randomSubset;
    return res;
  }
}
