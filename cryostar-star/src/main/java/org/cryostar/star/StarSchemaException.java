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
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Columns or tables that are required for an operation are not available.
 */
public class StarSchemaException extends StarException {
  private static final long serialVersionUID = 1L;

  private final List<String> missing;

  public StarSchemaException(String msg) {
    super(msg);
    missing = Collections.emptyList();
  }

  /**
   * @param msg
   *          Description of the operation that failed.
   * @param missing
   *          All labels that are missing, these will be appended to the message.
   */
  public StarSchemaException(String msg, Collection<String> missing) {
    super(msg + " Missing: " + String.join(", ", missing));
    this.missing = Collections.unmodifiableList(new ArrayList<>(missing));
  }

  /**
   * @return The missing labels, may be empty if a whole table is missing.
   */
  public List<String> getMissing() {
    return missing;
  }
}
