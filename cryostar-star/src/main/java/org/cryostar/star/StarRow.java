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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A single immutable row of a {@link StarTable}.
 * 
 * <p>
 * Values are accessed by label; use the {@link StarLabel} constants of {@link Labels} for typed access of known labels,
 * or the name based methods for anything else. All "modifying" methods return a new row.
 */
public final class StarRow {
  private final ColumnLayout layout;
  private final Object[] values;

  /**
   * @param values
   *          Must already be coerced to the column types. Ownership is taken.
   */
  StarRow(ColumnLayout layout, Object[] values) {
    this.layout = layout;
    this.values = values;
  }

  /**
   * Create a row from columns and corresponding values, which will be converted to the types of the columns.
   * 
   * @throws IllegalArgumentException
   *           If the number of values does not match, a value is null or cannot be converted.
   */
  public static StarRow create(List<StarColumn> columns, List<?> values) {
    ColumnLayout layout = new ColumnLayout(columns);
    return new StarRow(layout, coerceAll(layout, values.toArray()));
  }

  /**
   * Create a row holding the given label/value pairs, in iteration order of the map. Types of the labels are resolved
   * using the given registry.
   */
  public static StarRow create(LabelTypeRegistry registry, Map<String, ?> values) {
    List<StarColumn> columns = new ArrayList<>();
    for (String label : values.keySet())
      columns.add(registry.column(label));
    return create(columns, new ArrayList<>(values.values()));
  }

  static Object[] coerceAll(ColumnLayout layout, Object[] values) {
    if (values.length != layout.size())
      throw new IllegalArgumentException(
          "Expected " + layout.size() + " values for columns " + layout.getColumns() + ", but got " + values.length);
    Object[] res = new Object[values.length];
    for (int i = 0; i < values.length; i++)
      res[i] = coerce(layout.get(i), values[i]);
    return res;
  }

  static Object coerce(StarColumn column, Object value) {
    if (value == null)
      throw new IllegalArgumentException("Null value for column '" + column.getName() + "'.");
    try {
      return column.getType().coerce(value);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid value for column '" + column.getName() + "': " + e.getMessage(), e);
    }
  }

  ColumnLayout getLayout() {
    return layout;
  }

  public List<StarColumn> getColumns() {
    return layout.getColumns();
  }

  public List<String> getColumnNames() {
    List<String> res = new ArrayList<>(layout.size());
    for (StarColumn col : layout.getColumns())
      res.add(col.getName());
    return res;
  }

  public int size() {
    return values.length;
  }

  public boolean has(String label) {
    return layout.indexOf(label) >= 0;
  }

  public boolean has(StarLabel<?> label) {
    return has(label.getName());
  }

  /**
   * @return The value at the given column index.
   */
  public Object getValue(int columnIndex) {
    return values[columnIndex];
  }

  /**
   * @return The raw value of the label or <code>null</code> if the row does not have the label.
   */
  public Object get(String label) {
    int idx = layout.indexOf(label);
    if (idx < 0)
      return null;
    return values[idx];
  }

  /**
   * @return The value of the label converted to the labels Java type or <code>null</code> if the row does not have
   *         the label.
   * @throws IllegalArgumentException
   *           If the value is not convertible, e.g. because the column was read as an unknown string column.
   */
  public <T> T get(StarLabel<T> label) {
    return label.cast(get(label.getName()));
  }

  public <T> T getOrDefault(StarLabel<T> label, T defaultValue) {
    T res = get(label);
    return (res == null) ? defaultValue : res;
  }

  /**
   * @throws StarSchemaException
   *           If the row does not have the label.
   */
  public <T> T getRequired(StarLabel<T> label) throws StarSchemaException {
    if (!has(label))
      throw new StarSchemaException("Required label not available.", Arrays.asList(label.getName()));
    return get(label);
  }

  public Double getDouble(String label) {
    Object res = get(label);
    return (res == null) ? null : (Double) LabelType.FLOAT.coerce(res);
  }

  public Long getLong(String label) {
    Object res = get(label);
    return (res == null) ? null : (Long) LabelType.INT.coerce(res);
  }

  public Boolean getBoolean(String label) {
    Object res = get(label);
    return (res == null) ? null : (Boolean) LabelType.BOOL.coerce(res);
  }

  /**
   * @return The value formatted as it would be written to a STAR file.
   */
  public String getString(String label) {
    Object res = get(label);
    return (res == null) ? null : (String) LabelType.STRING.coerce(res);
  }

  public <T> StarRow with(StarLabel<T> label, T value) {
    return with(label.toColumn(), value);
  }

  /**
   * Sets the value of a column. If the row does not yet have the column, it is appended.
   */
  public StarRow with(StarColumn column, Object value) {
    int idx = layout.indexOf(column.getName());
    if (idx < 0) {
      Object[] newValues = Arrays.copyOf(values, values.length + 1);
      newValues[values.length] = coerce(column, value);
      return new StarRow(layout.with(column), newValues);
    }
    Object[] newValues = values.clone();
    newValues[idx] = coerce(layout.get(idx), value);
    return new StarRow(layout, newValues);
  }

  public StarRow without(String label) {
    int idx = layout.indexOf(label);
    if (idx < 0)
      return this;
    Object[] newValues = new Object[values.length - 1];
    System.arraycopy(values, 0, newValues, 0, idx);
    System.arraycopy(values, idx + 1, newValues, idx, values.length - idx - 1);
    return new StarRow(layout.without(idx), newValues);
  }

  /**
   * @return A new ordered map from label name to value.
   */
  public Map<String, Object> toMap() {
    Map<String, Object> res = new LinkedHashMap<>();
    for (int i = 0; i < values.length; i++)
      res.put(layout.get(i).getName(), values[i]);
    return res;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof StarRow))
      return false;
    StarRow other = (StarRow) obj;
    return layout.equals(other.layout) && Arrays.equals(values, other.values);
  }

  @Override
  public int hashCode() {
    return 31 * layout.hashCode() + Arrays.hashCode(values);
  }

  @Override
  public String toString() {
    return toMap().toString();
  }
}
