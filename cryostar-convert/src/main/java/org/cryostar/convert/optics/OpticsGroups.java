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
package org.cryostar.convert.optics;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;

import org.cryostar.convert.FormatVersion;
import org.cryostar.convert.ImageKind;
import org.cryostar.data.image.Acquisition;
import org.cryostar.data.image.Image;
import org.cryostar.data.image.ImageSet;
import org.cryostar.star.Labels;
import org.cryostar.star.LabelTypeRegistry;
import org.cryostar.star.StarColumn;
import org.cryostar.star.StarException;
import org.cryostar.star.StarFile;
import org.cryostar.star.StarFormatException;
import org.cryostar.star.StarRow;
import org.cryostar.star.StarSchemaException;
import org.cryostar.star.StarTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The optics groups of a set of images, ordered by id.
 * 
 * <p>
 * Groups are identified by their parameters: {@link #assign(Map, String)} returns an existing group if one has exactly
 * the same parameters, and creates a new one otherwise. Names are unique within a registry.
 */
public class OpticsGroups implements Iterable<OpticsGroup> {
  private static final Logger logger = LoggerFactory.getLogger(OpticsGroups.class);

  public static final String DEFAULT_NAME_PREFIX = "opticsGroup";

  private final LabelTypeRegistry registry;
  private final NavigableMap<Integer, OpticsGroup> groups = new TreeMap<>();

  public OpticsGroups() {
    this(LabelTypeRegistry.createDefault());
  }

  /**
   * @param registry
   *          Used to convert parameter values to the types of their labels.
   */
  public OpticsGroups(LabelTypeRegistry registry) {
    this.registry = registry;
  }

  /**
   * @return A registry with a single group "opticsGroup1" holding the given parameters.
   */
  public static OpticsGroups create(Map<String, ?> params) {
    OpticsGroups res = new OpticsGroups();
    res.assign(params, null);
    return res;
  }

  /**
   * Reads the groups from a table in the layout of the "optics" table.
   * 
   * @throws StarSchemaException
   *           If a row has no "rlnOpticsGroup".
   * @throws StarFormatException
   *           If ids or names are duplicated.
   */
  public static OpticsGroups fromTable(StarTable table, LabelTypeRegistry registry) throws StarException {
    OpticsGroups res = new OpticsGroups(registry);
    for (int i = 0; i < table.size(); i++) {
      StarRow row = table.getRow(i);
      try {
        int id = row.getRequired(Labels.OPTICS_GROUP).intValue();
        String name = row.getOrDefault(Labels.OPTICS_GROUP_NAME, DEFAULT_NAME_PREFIX + id);
        res.add(new OpticsGroup(id, name, res.canonicalize(row.toMap())));
      } catch (StarException e) {
        e.setTable(table.getName());
        e.setRowIndex(i);
        throw e;
      } catch (IllegalArgumentException e) {
        StarFormatException fe = new StarFormatException(e.getMessage());
        fe.setTable(table.getName());
        fe.setRowIndex(i);
        throw fe;
      }
    }
    logger.debug("Read {} optics groups from table '{}'.", res.size(), table.getName());
    return res;
  }

  /**
   * Reads the optics groups of a STAR file. A RELION 3.0 file does not have an "optics" table, it results in a single
   * implicit group built from the acquisition labels of the first row of the first table.
   */
  public static OpticsGroups fromStar(StarFile file, LabelTypeRegistry registry) throws StarException {
    if (FormatVersion.detect(file) == FormatVersion.V31)
      return fromTable(file.getTable(FormatVersion.OPTICS_TABLE), registry);

    OpticsGroups res = new OpticsGroups(registry);
    StarTable first = file.getFirstTable();
    Map<String, Object> params = new LinkedHashMap<>();
    if (first != null && !first.isEmpty())
      params = AcquisitionLabels.fromRow(first.getRow(0));
    res.assign(params, null);
    logger.debug("No optics table available, using implicit optics group {}", res.first());
    return res;
  }

  /**
   * Builds the groups of the given images. Acquisition and pixel size of an image default to the ones of the set. The
   * optics group name of an acquisition is used as name of a new group.
   */
  public static OpticsGroups fromImages(ImageSet<? extends Image> images, ImageKind kind) {
    OpticsGroups res = new OpticsGroups();
    for (Image image : images)
      res.assign(image, images, kind);
    return res;
  }

  /**
   * Assigns the optics group the given image belongs to.
   * 
   * @param set
   *          The set of the image, providing default acquisition and pixel size. May be <code>null</code>.
   */
  public OpticsGroup assign(Image image, ImageSet<?> set, ImageKind kind) {
    Acquisition acquisition = image.getAcquisition();
    if (acquisition == null && set != null)
      acquisition = set.getAcquisition();
    Double pixelSize = image.getSamplingRate();
    if (pixelSize == null && set != null)
      pixelSize = set.getSamplingRate();
    String name = (acquisition != null) ? acquisition.getOpticsGroupName() : null;
    return assign(AcquisitionLabels.toParams(acquisition, pixelSize, kind), name);
  }

  /**
   * Sets the acquisition and the sampling rate of each image to the values of its optics group. Images without an
   * optics group id belong to the first group.
   * 
   * @throws OpticsGroupReferenceException
   *           If an image references a group that does not exist.
   */
  public void toImages(ImageSet<? extends Image> images) throws OpticsGroupReferenceException {
    for (Image image : images) {
      Acquisition acquisition = image.getAcquisition();
      Integer id = (acquisition != null) ? acquisition.getOpticsGroupId() : null;
      OpticsGroup group = (id == null) ? first() : getOrFail(id, null);
      if (group != null)
        AcquisitionLabels.applyParams(group, image);
    }
  }

  /**
   * @return The group with exactly the given parameters. If there is none, a new group is created with the next free
   *         id and the preferred name (or "opticsGroup&lt;id&gt;"). A name that is taken already is suffixed with
   *         "_&lt;id&gt;".
   */
  public OpticsGroup assign(Map<String, ?> params, String preferredName) {
    Map<String, Object> canonical = canonicalize(params);
    for (OpticsGroup group : groups.values())
      if (group.getParams().equals(canonical))
        return group;

    int id = groups.isEmpty() ? 1 : groups.lastKey() + 1;
    String name = (preferredName != null && !preferredName.isEmpty()) ? preferredName : DEFAULT_NAME_PREFIX + id;
    if (get(name) != null)
      name = name + "_" + id;
    OpticsGroup res = new OpticsGroup(id, name, canonical);
    groups.put(id, res);
    logger.debug("Created {}", res);
    return res;
  }

  public OpticsGroup assign(Map<String, ?> params) {
    return assign(params, null);
  }

  /**
   * @throws IllegalArgumentException
   *           If a group with the same id or name exists.
   */
  public void add(OpticsGroup group) {
    if (groups.containsKey(group.getId()))
      throw new IllegalArgumentException("Duplicate optics group id " + group.getId());
    if (get(group.getName()) != null)
      throw new IllegalArgumentException("Duplicate optics group name '" + group.getName() + "'");
    groups.put(group.getId(), group);
  }

  /**
   * Sets the given parameters on one group, replacing existing values.
   * 
   * @throws IllegalArgumentException
   *           If there is no such group.
   */
  public OpticsGroup update(int id, Map<String, ?> params) {
    OpticsGroup group = groups.get(id);
    if (group == null)
      throw new IllegalArgumentException("Unknown optics group id " + id);
    OpticsGroup res = group.withParams(canonicalize(params));
    groups.put(id, res);
    return res;
  }

  public OpticsGroup update(String name, Map<String, ?> params) {
    OpticsGroup group = get(name);
    if (group == null)
      throw new IllegalArgumentException("Unknown optics group name '" + name + "'");
    return update(group.getId(), params);
  }

  /**
   * Sets the given parameters on all groups, replacing existing values.
   */
  public void updateAll(Map<String, ?> params) {
    Map<String, Object> canonical = canonicalize(params);
    for (Map.Entry<Integer, OpticsGroup> e : groups.entrySet())
      e.setValue(e.getValue().withParams(canonical));
  }

  /**
   * Adds parameters with default values to all groups that do not have them yet; existing values are kept.
   */
  public void addColumns(Map<String, ?> defaults) {
    Map<String, Object> canonical = canonicalize(defaults);
    for (Map.Entry<Integer, OpticsGroup> e : groups.entrySet()) {
      Map<String, Object> missing = new LinkedHashMap<>();
      for (Map.Entry<String, Object> param : canonical.entrySet())
        if (!e.getValue().has(param.getKey()))
          missing.put(param.getKey(), param.getValue());
      if (!missing.isEmpty())
        e.setValue(e.getValue().withParams(missing));
    }
  }

  /**
   * @return The group with the lowest id or <code>null</code> if there are no groups.
   */
  public OpticsGroup first() {
    return groups.isEmpty() ? null : groups.firstEntry().getValue();
  }

  public int size() {
    return groups.size();
  }

  public boolean isEmpty() {
    return groups.isEmpty();
  }

  /**
   * @return true if there are groups and all of them have the given parameter.
   */
  public boolean hasColumn(String label) {
    if (groups.isEmpty())
      return false;
    for (OpticsGroup group : groups.values())
      if (!group.has(label))
        return false;
    return true;
  }

  public OpticsGroup get(int id) {
    return groups.get(id);
  }

  public OpticsGroup get(String name) {
    for (OpticsGroup group : groups.values())
      if (group.getName().equals(name))
        return group;
    return null;
  }

  /**
   * @param rowIndex
   *          Index of the row that references the group, for the error message. May be <code>null</code>.
   * @throws OpticsGroupReferenceException
   *           If the group does not exist.
   */
  public OpticsGroup getOrFail(int id, Integer rowIndex) throws OpticsGroupReferenceException {
    OpticsGroup res = groups.get(id);
    if (res == null)
      throw new OpticsGroupReferenceException(id, rowIndex, groups.keySet());
    return res;
  }

  /**
   * Adds the groups of another registry. Groups with the same parameters as an existing one are merged into it.
   * 
   * @return Map from id in the other registry to id in this registry.
   */
  public Map<Integer, Integer> merge(OpticsGroups other) {
    Map<Integer, Integer> res = new LinkedHashMap<>();
    for (OpticsGroup group : other)
      res.put(group.getId(), assign(group.getParams(), group.getName()).getId());
    return res;
  }

  /**
   * @return The groups as "optics" table: name, id and the parameters of all groups, in order of first occurrence
   *         when walking the groups by id. A group lacking a parameter gets the fill value of the parameter's type
   *         (see {@link org.cryostar.star.LabelType#getFillValue()}).
   */
  public StarTable toStarTable() {
    Set<String> labels = new LinkedHashSet<>();
    for (OpticsGroup group : groups.values())
      labels.addAll(group.getParams().keySet());

    List<StarColumn> columns = new ArrayList<>();
    columns.add(Labels.OPTICS_GROUP_NAME.toColumn());
    columns.add(Labels.OPTICS_GROUP.toColumn());
    for (String label : labels)
      columns.add(registry.column(label));

    StarTable res = new StarTable(FormatVersion.OPTICS_TABLE, columns);
    for (OpticsGroup group : groups.values()) {
      List<Object> values = new ArrayList<>();
      values.add(group.getName());
      values.add(group.getId());
      for (StarColumn column : columns.subList(2, columns.size())) {
        Object value = group.get(column.getName());
        if (value == null) {
          logger.debug("Optics group {} has no value for '{}', writing a fill value.", group.getId(),
              column.getName());
          value = column.getType().getFillValue();
        }
        values.add(value);
      }
      res.addRow(values.toArray());
    }
    return res;
  }

  /**
   * Converts values to the types of their labels and drops id and name labels.
   */
  private Map<String, Object> canonicalize(Map<String, ?> params) {
    Map<String, Object> res = new LinkedHashMap<>();
    for (Map.Entry<String, ?> e : params.entrySet()) {
      String label = e.getKey();
      if (label.equals(Labels.OPTICS_GROUP.getName()) || label.equals(Labels.OPTICS_GROUP_NAME.getName()))
        continue;
      if (e.getValue() == null)
        throw new IllegalArgumentException("Null value for optics parameter '" + label + "'");
      res.put(label, registry.typeOf(label).coerce(e.getValue()));
    }
    return res;
  }

  @Override
  public Iterator<OpticsGroup> iterator() {
    return groups.values().iterator();
  }

  @Override
  public String toString() {
    return "OpticsGroups" + groups.values();
  }
}
