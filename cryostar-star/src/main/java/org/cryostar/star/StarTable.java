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
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * A table of a STAR file, i.e. a single "data_" block.
 * 
 * <p>
 * A table has a name (empty for an unnamed block), an ordered list of {@link StarColumn}s and an ordered list of
 * {@link StarRow}s, each of which has exactly one value per column. A table is either looped (written with "loop_",
 * any number of rows) or a single-row table (written as label/value pairs, exactly one row).
 * 
 * <p>
 * Not thread safe.
 */
public class StarTable implements Iterable<StarRow> {
  private final String name;
  private boolean looped = true;
  private ColumnLayout layout;
  private List<StarRow> rows = new ArrayList<>();

  public StarTable(String name) {
    this(name, Collections.emptyList());
  }

  public StarTable(String name, StarColumn... columns) {
    this(name, Arrays.asList(columns));
  }

  public StarTable(String name, List<StarColumn> columns) {
    this.name = (name == null) ? "" : name;
    this.layout = columns.isEmpty() ? ColumnLayout.EMPTY : new ColumnLayout(columns);
  }

  /**
   * Create a looped table with the columns of the given labels.
   */
  public static StarTable withLabels(String name, StarLabel<?>... labels) {
    List<StarColumn> columns = new ArrayList<>();
    for (StarLabel<?> label : labels)
      columns.add(label.toColumn());
    return new StarTable(name, columns);
  }

  /**
   * @return Name of the table, "" for an unnamed table. Never <code>null</code>.
   */
  public String getName() {
    return name;
  }

  public boolean isLooped() {
    return looped;
  }

  public void setLooped(boolean looped) {
    this.looped = looped;
  }

  ColumnLayout getRowLayout() {
    return layout;
  }

  public List<StarColumn> getColumns() {
    return layout.getColumns();
  }

  public List<String> getColumnNames() {
    List<String> res = new ArrayList<>();
    for (StarColumn col : layout.getColumns())
      res.add(col.getName());
    return res;
  }

  public boolean hasColumn(String label) {
    return layout.indexOf(label) >= 0;
  }

  public boolean hasColumn(StarLabel<?> label) {
    return hasColumn(label.getName());
  }

  /**
   * @return The column or <code>null</code>.
   */
  public StarColumn getColumn(String label) {
    int idx = layout.indexOf(label);
    return (idx < 0) ? null : layout.get(idx);
  }

  /**
   * Append a column to an empty table.
   * 
   * @throws IllegalStateException
   *           If the table already contains rows.
   */
  public void addColumn(StarColumn column) {
    if (!rows.isEmpty())
      throw new IllegalStateException(
          "Table '" + name + "' has rows, a value for new column '" + column.getName() + "' is needed.");
    addColumn(column, row -> null);
  }

  /**
   * Append a column, each existing row receives the given value.
   */
  public void addColumn(StarColumn column, Object value) {
    addColumn(column, row -> value);
  }

  /**
   * Append a column, the value of each existing row is calculated by the given function.
   * 
   * @throws IllegalArgumentException
   *           If the column exists already or the function returns an invalid value.
   */
  public void addColumn(StarColumn column, Function<StarRow, Object> valueFn) {
    if (hasColumn(column.getName()))
      throw new IllegalArgumentException("Table '" + name + "' has column '" + column.getName() + "' already.");
    ColumnLayout newLayout = layout.with(column);
    List<StarRow> newRows = new ArrayList<>(rows.size());
    for (StarRow row : rows) {
      Object[] values = new Object[newLayout.size()];
      for (int i = 0; i < row.size(); i++)
        values[i] = row.getValue(i);
      values[row.size()] = StarRow.coerce(column, valueFn.apply(row));
      newRows.add(new StarRow(newLayout, values));
    }
    layout = newLayout;
    rows = newRows;
  }

  /**
   * @throws IllegalArgumentException
   *           If the column does not exist.
   */
  public void removeColumn(String label) {
    int idx = layout.indexOf(label);
    if (idx < 0)
      throw new IllegalArgumentException("Table '" + name + "' has no column '" + label + "'.");
    ColumnLayout newLayout = layout.without(idx);
    List<StarRow> newRows = new ArrayList<>(rows.size());
    for (StarRow row : rows) {
      Object[] values = new Object[newLayout.size()];
      for (int i = 0, j = 0; i < row.size(); i++)
        if (i != idx)
          values[j++] = row.getValue(i);
      newRows.add(new StarRow(newLayout, values));
    }
    layout = newLayout;
    rows = newRows;
  }

  /**
   * Append a row with one value per column, in column order.
   * 
   * @throws IllegalArgumentException
   *           If the number of values does not match the number of columns or a value is invalid for its column.
   */
  public StarRow addRow(Object... values) {
    StarRow row = new StarRow(layout, StarRow.coerceAll(layout, values));
    rows.add(row);
    return row;
  }

  /**
   * Append a row, its values are matched to the columns of this table by name.
   * 
   * @throws IllegalArgumentException
   *           If the row does not have exactly the columns of this table.
   */
  public StarRow addRow(StarRow row) {
    StarRow res;
    if (row.getLayout().equals(layout))
      res = new StarRow(layout, toArray(row));
    else {
      if (row.size() != layout.size())
        throw new IllegalArgumentException("Row " + row.getColumnNames() + " does not match columns "
            + getColumnNames() + " of table '" + name + "'.");
      Object[] values = new Object[layout.size()];
      for (int i = 0; i < layout.size(); i++) {
        String colName = layout.get(i).getName();
        if (!row.has(colName))
          throw new IllegalArgumentException(
              "Row " + row.getColumnNames() + " has no value for column '" + colName + "' of table '" + name + "'.");
        values[i] = row.get(colName);
      }
      res = new StarRow(layout, StarRow.coerceAll(layout, values));
    }
    rows.add(res);
    return res;
  }

  private Object[] toArray(StarRow row) {
    Object[] res = new Object[row.size()];
    for (int i = 0; i < res.length; i++)
      res[i] = row.getValue(i);
    return res;
  }

  public void clearRows() {
    rows = new ArrayList<>();
  }

  /**
   * Stable sort of the rows by the values of the given column.
   */
  @SuppressWarnings({ "unchecked", "rawtypes" })
  public void sort(String label) {
    int idx = layout.indexOf(label);
    if (idx < 0)
      throw new IllegalArgumentException("Table '" + name + "' has no column '" + label + "'.");
    sort((a, b) -> ((Comparable) a.getValue(idx)).compareTo(b.getValue(idx)));
  }

  public void sort(Comparator<StarRow> comparator) {
    rows.sort(comparator);
  }

  public StarRow getRow(int idx) {
    return rows.get(idx);
  }

  /**
   * @return unmodifiable view on the rows.
   */
  public List<StarRow> getRows() {
    return Collections.unmodifiableList(rows);
  }

  public int size() {
    return rows.size();
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  @Override
  public Iterator<StarRow> iterator() {
    return getRows().iterator();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof StarTable))
      return false;
    StarTable other = (StarTable) obj;
    return name.equals(other.name) && looped == other.looped && layout.equals(other.layout)
        && rows.equals(other.rows);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, looped, layout, rows);
  }

  @Override
  public String toString() {
    return "StarTable[name=" + name + ",looped=" + looped + ",columns=" + getColumnNames() + ",rows=" + rows.size()
        + "]";
  }
}
