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
package org.cryostar.convert.defocus;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;

import org.cryostar.data.image.ImageSet;
import org.cryostar.data.image.Particle;
import org.cryostar.util.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

/**
 * Groups of particles by defocus, ordered by defocus and numbered from 1.
 * 
 * <p>
 * Created by {@link #splitByDiff(List, double, int)} in two passes:
 * <ol>
 * <li>The values are sorted ascending and partitioned greedily: a value starts a new group if it is more than
 * defocusDiff larger than the smallest value of the current group.
 * <li>As long as there is more than one group and a group smaller than minGroupSize, the smallest of these (lowest id
 * on ties) is merged into the neighbour that results in the smaller span (the left one on ties).
 * </ol>
 */
public class DefocusGroups implements Iterable<DefocusGroup> {
  private static final Logger logger = LoggerFactory.getLogger(DefocusGroups.class);

  private final ImmutableList<DefocusGroup> groups;

  private DefocusGroups(List<DefocusGroup> groups) {
    this.groups = ImmutableList.copyOf(groups);
  }

  /**
   * @param items
   *          Pairs of object id and defocus value (Angstrom).
   * @param defocusDiff
   *          Maximum defocus span of a group built in the first pass.
   * @param minGroupSize
   *          Minimum number of members of a group, unless there is only one group.
   */
  public static DefocusGroups splitByDiff(List<Pair<Long, Double>> items, double defocusDiff, int minGroupSize) {
    List<Pair<Long, Double>> sorted = new ArrayList<>(items);
    sorted.sort((a, b) -> Double.compare(a.getRight(), b.getRight()));

    List<List<Pair<Long, Double>>> parts = new ArrayList<>();
    List<Pair<Long, Double>> current = null;
    for (Pair<Long, Double> item : sorted) {
      if (current == null || item.getRight() - current.get(0).getRight() > defocusDiff) {
        current = new ArrayList<>();
        parts.add(current);
      }
      current.add(item);
    }

    while (parts.size() > 1) {
      int smallest = -1;
      for (int i = 0; i < parts.size(); i++)
        if (parts.get(i).size() < minGroupSize && (smallest < 0 || parts.get(i).size() < parts.get(smallest).size()))
          smallest = i;
      if (smallest < 0)
        break;

      int target;
      if (smallest == 0)
        target = 1;
      else if (smallest == parts.size() - 1)
        target = smallest - 1;
      else {
        double leftSpan = span(parts.get(smallest - 1), parts.get(smallest));
        double rightSpan = span(parts.get(smallest), parts.get(smallest + 1));
        target = (rightSpan < leftSpan) ? smallest + 1 : smallest - 1;
      }

      List<Pair<Long, Double>> merged = new ArrayList<>();
      int low = Math.min(smallest, target);
      merged.addAll(parts.get(low));
      merged.addAll(parts.get(low + 1));
      parts.set(low, merged);
      parts.remove(low + 1);
    }

    List<DefocusGroup> res = new ArrayList<>();
    for (List<Pair<Long, Double>> part : parts) {
      List<Long> ids = new ArrayList<>();
      for (Pair<Long, Double> item : part)
        ids.add(item.getLeft());
      res.add(new DefocusGroup(res.size() + 1, part.get(0).getRight(), part.get(part.size() - 1).getRight(), ids));
    }
    logger.info("Created {} defocus groups from {} items (defocus diff {}, min group size {}).", res.size(),
        items.size(), defocusDiff, minGroupSize);
    return new DefocusGroups(res);
  }

  /**
   * Groups particles by the defocusU of their CTF.
   * 
   * @throws IllegalArgumentException
   *           If a particle has no CTF.
   */
  public static DefocusGroups fromParticles(ImageSet<Particle> particles, double defocusDiff, int minGroupSize) {
    List<Pair<Long, Double>> items = new ArrayList<>();
    for (Particle particle : particles) {
      if (!particle.hasCtf())
        throw new IllegalArgumentException("Particle " + particle.getObjId() + " has no CTF.");
      items.add(new Pair<>(particle.getObjId(), particle.getCtf().getDefocusU()));
    }
    return splitByDiff(items, defocusDiff, minGroupSize);
  }

  /**
   * Span of two adjacent parts, both sorted ascending, the first lower than the second.
   */
  private static double span(List<Pair<Long, Double>> lower, List<Pair<Long, Double>> upper) {
    return upper.get(upper.size() - 1).getRight() - lower.get(0).getRight();
  }

  /**
   * @return The group containing the defocus or, if none contains it, the group with the nearest boundary (the lower
   *         id on ties). <code>null</code> if there are no groups.
   */
  public DefocusGroup getGroup(double defocus) {
    DefocusGroup res = null;
    for (DefocusGroup group : groups)
      if (res == null || group.distance(defocus) < res.distance(defocus))
        res = group;
    return res;
  }

  /**
   * @return The group the object with the given id was assigned to, or <code>null</code>.
   */
  public DefocusGroup getGroupOfMember(long objId) {
    for (DefocusGroup group : groups)
      if (group.getMemberIds().contains(objId))
        return group;
    return null;
  }

  public DefocusGroup get(int id) {
    return groups.get(id - 1);
  }

  public List<DefocusGroup> getGroups() {
    return groups;
  }

  public int size() {
    return groups.size();
  }

  @Override
  public Iterator<DefocusGroup> iterator() {
    return groups.iterator();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(">>> Defocus groups: ").append(groups.size()).append('\n');
    String rowFormat = "%15s%15s%10s%n";
    sb.append(String.format(Locale.ROOT, rowFormat, "Min (A)", "Max (A)", "Count"));
    for (DefocusGroup group : groups)
      sb.append(String.format(Locale.ROOT, rowFormat, String.format(Locale.ROOT, "%.3f", group.getMinDefocus()),
          String.format(Locale.ROOT, "%.3f", group.getMaxDefocus()), group.size()));
    return sb.toString();
  }
}
