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
package org.cryostar.star;

import java.util.Objects;

/**
 * A typed STAR label, used to access values of {@link StarRow}s in a type safe manner.
 * 
 * <p>
 * Constants of the labels known to cryostar are available in {@link Labels}.
 *
 * @param <T>
 *          Java type of the values, matching {@link LabelType#getJavaType()}.
 */
public final class StarLabel<T> {
  private final String name;
  private final LabelType type;
  private final Class<T> javaType;

  private StarLabel(String name, LabelType type, Class<T> javaType) {
    this.name = name;
    this.type = type;
    this.javaType = javaType;
  }

  public static StarLabel<Long> ofInt(String name) {
    return new StarLabel<>(name, LabelType.INT, Long.class);
  }

  public static StarLabel<Double> ofFloat(String name) {
    return new StarLabel<>(name, LabelType.FLOAT, Double.class);
  }

  public static StarLabel<String> ofString(String name) {
    return new StarLabel<>(name, LabelType.STRING, String.class);
  }

  public static StarLabel<Boolean> ofBool(String name) {
    return new StarLabel<>(name, LabelType.BOOL, Boolean.class);
  }

  /**
   * @return Name of the label, without leading underscore (e.g. "rlnImageName").
   */
  public String getName() {
    return name;
  }

  public LabelType getType() {
    return type;
  }

  public Class<T> getJavaType() {
    return javaType;
  }

  /**
   * @return A column of this label.
   */
  public StarColumn toColumn() {
    return new StarColumn(name, type);
  }

  /**
   * Convert any value to the Java type of this label.
   * 
   * @throws IllegalArgumentException
   *           if not convertible.
   */
  public T cast(Object value) {
    if (value == null)
      return null;
    return javaType.cast(type.coerce(value));
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof StarLabel))
      return false;
    StarLabel<?> other = (StarLabel<?>) obj;
    return name.equals(other.name) && type == other.type;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, type);
  }

  @Override
  public String toString() {
    return name;
  }
}
