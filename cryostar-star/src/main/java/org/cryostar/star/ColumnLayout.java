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

import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Immutable ordered list of columns with a name index, shared by all rows of a table.
 */
final class ColumnLayout {
  static final ColumnLayout EMPTY = new ColumnLayout(ImmutableList.of());

  private final ImmutableList<StarColumn> columns;
  private final ImmutableMap<String, Integer> indexByName;

  ColumnLayout(List<StarColumn> columns) {
    this.columns = ImmutableList.copyOf(columns);
    ImmutableMap.Builder<String, Integer> builder = ImmutableMap.builder();
    for (int i = 0; i < this.columns.size(); i++)
      builder.put(this.columns.get(i).getName(), i);
    try {
      indexByName = builder.build();
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Duplicate column name in " + columns, e);
    }
  }

  ImmutableList<StarColumn> getColumns() {
    return columns;
  }

  int size() {
    return columns.size();
  }

  StarColumn get(int idx) {
    return columns.get(idx);
  }

  /**
   * @return index of the column or -1.
   */
  int indexOf(String name) {
    Integer res = indexByName.get(name);
    return (res == null) ? -1 : res;
  }

  ColumnLayout with(StarColumn column) {
    return new ColumnLayout(ImmutableList.<StarColumn> builder().addAll(columns).add(column).build());
  }

  ColumnLayout without(int idx) {
    ImmutableList.Builder<StarColumn> builder = ImmutableList.builder();
    for (int i = 0; i < columns.size(); i++)
      if (i != idx)
        builder.add(columns.get(i));
    return new ColumnLayout(builder.build());
  }

  @Override
  public boolean equals(Object obj) {
    return (obj instanceof ColumnLayout) && columns.equals(((ColumnLayout) obj).columns);
  }

  @Override
  public int hashCode() {
    return columns.hashCode();
  }
}
