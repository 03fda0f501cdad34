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
 * Reference to a table in a STAR file, written as "table@file". A reference without table part refers to the first
 * table of the file.
 */
public final class StarTableRef {
  private final String tableName;
  private final String fileName;

  private StarTableRef(String tableName, String fileName) {
    this.tableName = tableName;
    this.fileName = fileName;
  }

  /**
   * @param tableName
   *          Name of the table or <code>null</code> for the first table of the file.
   */
  public static StarTableRef of(String tableName, String fileName) {
    if (fileName == null || fileName.isEmpty())
      throw new IllegalArgumentException("File name must not be empty.");
    return new StarTableRef(tableName, fileName);
  }

  /**
   * Parses "table@file" or "file".
   */
  public static StarTableRef parse(String ref) {
    int idx = ref.indexOf('@');
    if (idx < 0)
      return of(null, ref);
    return of(ref.substring(0, idx), ref.substring(idx + 1));
  }

  /**
   * @return Name of the table or <code>null</code> for the first table.
   */
  public String getTableName() {
    return tableName;
  }

  public String getFileName() {
    return fileName;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof StarTableRef))
      return false;
    StarTableRef other = (StarTableRef) obj;
    return Objects.equals(tableName, other.tableName) && fileName.equals(other.fileName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(tableName, fileName);
  }

  @Override
  public String toString() {
    return (tableName == null) ? fileName : tableName + "@" + fileName;
  }
}
