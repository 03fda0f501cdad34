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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.cryostar.star.Labels;
import org.cryostar.star.StarLabel;

import com.google.common.collect.ImmutableMap;

/**
 * An immutable optics group: id, name and the acquisition parameters (STAR label to value) shared by its images.
 * 
 * <p>
 * The parameters never contain "rlnOpticsGroup" or "rlnOpticsGroupName", these are represented by id and name.
 * Values are of the Java types of the labels (see {@link org.cryostar.star.LabelType}).
 */
public final class OpticsGroup {
  private final int id;
  private final String name;
  private final ImmutableMap<String, Object> params;

  OpticsGroup(int id, String name, Map<String, Object> params) {
    if (id < 1)
      throw new IllegalArgumentException("Optics group ids start at 1, got " + id);
    this.id = id;
    this.name = name;
    this.params = ImmutableMap.copyOf(params);
  }

  public int getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  /**
   * @return The parameters in the order they were defined.
   */
  public Map<String, Object> getParams() {
    return params;
  }

  public boolean has(String label) {
    return params.containsKey(label);
  }

  public Object get(String label) {
    return params.get(label);
  }

  public <T> T get(StarLabel<T> label) {
    return label.cast(params.get(label.getName()));
  }

  /**
   * @return The pixel size (Angstrom/pixel) of the images of this group, looked up in the order image pixel size,
   *         micrograph pixel size, original micrograph pixel size, or <code>null</code>.
   */
  public Double getPixelSize() {
    Double res = get(Labels.IMAGE_PIXEL_SIZE);
    if (res == null)
      res = get(Labels.MICROGRAPH_PIXEL_SIZE);
    if (res == null)
      res = get(Labels.MICROGRAPH_ORIGINAL_PIXEL_SIZE);
    return res;
  }

  public Double getVoltage() {
    return get(Labels.VOLTAGE);
  }

  public Double getSphericalAberration() {
    return get(Labels.SPHERICAL_ABERRATION);
  }

  public Double getAmplitudeContrast() {
    return get(Labels.AMPLITUDE_CONTRAST);
  }

  public String getMtfFile() {
    return get(Labels.MTF_FILE_NAME);
  }

  public Double getBeamTiltX() {
    return get(Labels.BEAM_TILT_X);
  }

  public Double getBeamTiltY() {
    return get(Labels.BEAM_TILT_Y);
  }

  public Long getImageSize() {
    return get(Labels.IMAGE_SIZE);
  }

  /**
   * @return true if both groups have exactly the same parameters, regardless of id and name.
   */
  public boolean hasSameParams(OpticsGroup other) {
    return params.equals(other.params);
  }

  /**
   * @return A copy of this group with a different id.
   */
  public OpticsGroup withId(int newId) {
    return new OpticsGroup(newId, name, params);
  }

  public OpticsGroup withName(String newName) {
    return new OpticsGroup(id, newName, params);
  }

  /**
   * @return A copy of this group with the given parameter set. A <code>null</code> value removes the parameter.
   */
  public <T> OpticsGroup with(StarLabel<T> label, T value) {
    Map<String, Object> newParams = new LinkedHashMap<>(params);
    if (value == null)
      newParams.remove(label.getName());
    else
      newParams.put(label.getName(), label.cast(value));
    return new OpticsGroup(id, name, newParams);
  }

  /**
   * @param newParams
   *          Already type-converted parameters that are added or replace existing ones.
   */
  OpticsGroup withParams(Map<String, Object> newParams) {
    Map<String, Object> merged = new LinkedHashMap<>(params);
    merged.putAll(newParams);
    return new OpticsGroup(id, name, merged);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof OpticsGroup))
      return false;
    OpticsGroup other = (OpticsGroup) obj;
    return id == other.id && Objects.equals(name, other.name) && params.equals(other.params);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, name, params);
  }

  @Override
  public String toString() {
    return "OpticsGroup[" + id + "," + name + "," + params + "]";
  }
}
