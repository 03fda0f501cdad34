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
 * The structure of STAR data is invalid, for example a malformed block header, a row with the wrong number of values
 * or a value outside of any loop.
 */
public class StarFormatException extends StarException {
  private static final long serialVersionUID = 1L;

  public StarFormatException(String msg) {
    super(msg);
  }

  public StarFormatException(String msg, Throwable cause) {
    super(msg, cause);
  }
}
