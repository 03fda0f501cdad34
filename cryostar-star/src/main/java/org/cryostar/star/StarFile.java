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

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The tables of one STAR file, in file order.
 */
public class StarFile implements Iterable<StarTable> {
  private final Map<String, StarTable> tables = new LinkedHashMap<>();

  public StarFile() {
  }

  public StarFile(List<StarTable> tables) {
    for (StarTable table : tables)
      addTable(table);
  }

  /**
   * @throws IllegalArgumentException
   *           If there is a table with the same name already.
   */
  public void addTable(StarTable table) {
    if (tables.containsKey(table.getName()))
      throw new IllegalArgumentException("Duplicate table '" + table.getName() + "'.");
    tables.put(table.getName(), table);
  }

  /**
   * @return The table or <code>null</code>.
   */
  public StarTable getTable(String name) {
    return tables.get(name);
  }

  public boolean hasTable(String name) {
    return tables.containsKey(name);
  }

  /**
   * @return The first table or <code>null</code> if the file is empty.
   */
  public StarTable getFirstTable() {
    if (tables.isEmpty())
      return null;
    return tables.values().iterator().next();
  }

  public List<String> getTableNames() {
    return new ArrayList<>(tables.keySet());
  }

  public List<StarTable> getTables() {
    return new ArrayList<>(tables.values());
  }

  public int size() {
    return tables.size();
  }

  @Override
  public Iterator<StarTable> iterator() {
    return getTables().iterator();
  }

  @Override
  public boolean equals(Object obj) {
    return (obj instanceof StarFile) && getTables().equals(((StarFile) obj).getTables());
  }

  @Override
  public int hashCode() {
    return getTables().hashCode();
  }

  @Override
  public String toString() {
    return "StarFile" + getTables();
  }
}
