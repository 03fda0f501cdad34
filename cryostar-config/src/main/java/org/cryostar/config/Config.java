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
package org.cryostar.config;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a field of a bean to be filled with the value of a configuration key, see {@link ConfigKey}.
 * 
 * <p>
 * Supported field types are String, int, long, double and boolean (and their boxed counterparts). Wiring is done by
 * {@link ConfigurationPostProcessor}.
 */
@Target({ ElementType.FIELD })
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Config {
  /**
   * @return The configuration key, one of the constants in {@link ConfigKey}.
   */
  String value();
}
