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

import java.util.HashMap;
import java.util.Map;

/**
 * Maps STAR label names to their {@link LabelType}.
 * 
 * <p>
 * Labels that are not registered are of type {@link LabelType#STRING}, which means their values are kept verbatim.
 * 
 * <p>
 * Instances are not thread safe; use {@link #copy()} to derive a registry with local overrides.
 */
public class LabelTypeRegistry {
  private final Map<String, LabelType> types;

  public LabelTypeRegistry() {
    this(new HashMap<>());
  }

  private LabelTypeRegistry(Map<String, LabelType> types) {
    this.types = types;
  }

  /**
   * @return A new registry containing all {@link Labels}.
   */
  public static LabelTypeRegistry createDefault() {
    LabelTypeRegistry res = new LabelTypeRegistry();
    for (StarLabel<?> label : Labels.all())
      res.register(label);
    return res;
  }

  public void register(String labelName, LabelType type) {
    types.put(labelName, type);
  }

  public void register(StarLabel<?> label) {
    register(label.getName(), label.getType());
  }

  public boolean isRegistered(String labelName) {
    return types.containsKey(labelName);
  }

  /**
   * @return The registered type of the label or {@link LabelType#STRING} if it is not registered.
   */
  public LabelType typeOf(String labelName) {
    LabelType res = types.get(labelName);
    if (res == null)
      return LabelType.STRING;
    return res;
  }

  public StarColumn column(String labelName) {
    return new StarColumn(labelName, typeOf(labelName));
  }

  public LabelTypeRegistry copy() {
    return new LabelTypeRegistry(new HashMap<>(types));
  }
}
