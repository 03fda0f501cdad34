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
package org.cryostar.context;

import org.springframework.context.annotation.Profile;

/**
 * Profiles can be used with the annotation {@link Profile} on beans to enable/disable a specific "feature" (=creation
 * of a bean).
 */
public class Profiles {
  /**
   * Enable configuration system.
   */
  public static final String CONFIG = "Config";

  /**
   * All default profiles.
   */
  public static final String[] ALL = new String[] { CONFIG };

  /**
   * All profiles that should be launched when executing unit tests
   */
  public static final String[] UNIT_TEST = new String[] { CONFIG };
}
