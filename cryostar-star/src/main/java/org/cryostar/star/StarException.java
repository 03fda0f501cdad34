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

/**
 * Base of all exceptions raised when reading, interpreting or writing STAR data.
 * 
 * <p>
 * Each exception carries the context it was raised in as far as it is known: the source (typically a file name), the
 * table, the row index (0-based within the table), the column label and the line number of the source. All available
 * context is rendered in {@link #getMessage()}.
 */
public class StarException extends Exception {
  private static final long serialVersionUID = 1L;

  private String source;
  private String table;
  private Integer rowIndex;
  private String column;
  private Integer lineNumber;

  public StarException(String msg) {
    super(msg);
  }

  public StarException(String msg, Throwable cause) {
    super(msg, cause);
  }

  public String getSource() {
    return source;
  }

  public void setSource(String source) {
    this.source = source;
  }

  public String getTable() {
    return table;
  }

  public void setTable(String table) {
    this.table = table;
  }

  /**
   * @return 0-based index of the row within its table or <code>null</code> if not available.
   */
  public Integer getRowIndex() {
    return rowIndex;
  }

  public void setRowIndex(Integer rowIndex) {
    this.rowIndex = rowIndex;
  }

  public String getColumn() {
    return column;
  }

  public void setColumn(String column) {
    this.column = column;
  }

  /**
   * @return 1-based line number in the source or <code>null</code> if not available.
   */
  public Integer getLineNumber() {
    return lineNumber;
  }

  public void setLineNumber(Integer lineNumber) {
    this.lineNumber = lineNumber;
  }

  /**
   * @return The message without any context information.
   */
  public String getPlainMessage() {
    return super.getMessage();
  }

  @Override
  public String getMessage() {
    StringBuilder context = new StringBuilder();
    if (source != null)
      appendContext(context, "file '" + source + "'");
    if (table != null)
      appendContext(context, "table '" + table + "'");
    if (rowIndex != null)
      appendContext(context, "row " + rowIndex);
    if (column != null)
      appendContext(context, "column '" + column + "'");
    if (lineNumber != null)
      appendContext(context, "line " + lineNumber);

    if (context.length() == 0)
      return super.getMessage();
    return super.getMessage() + " [" + context + "]";
  }

  private void appendContext(StringBuilder sb, String part) {
    if (sb.length() > 0)
      sb.append(", ");
    sb.append(part);
  }
}
