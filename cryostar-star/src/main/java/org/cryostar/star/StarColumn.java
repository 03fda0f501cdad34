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
 * A column of a {@link StarTable}: the label name and its type.
 */
public final class StarColumn {
  private final String name;
  private final LabelType type;

  public StarColumn(String name, LabelType type) {
    if (name == null || name.isEmpty())
      throw new IllegalArgumentException("Column name must not be empty.");
    if (name.startsWith("_"))
      throw new IllegalArgumentException("Column name must not start with '_': " + name);
    this.name = name;
    this.type = type;
  }

  public String getName() {
    return name;
  }

  public LabelType getType() {
    return type;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof StarColumn))
      return false;
    StarColumn other = (StarColumn) obj;
    return name.equals(other.name) && type == other.type;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, type);
  }

  @Override
  public String toString() {
    return name + "(" + type + ")";
  }
}
