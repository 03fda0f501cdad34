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
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import org.cryostar.data.image.CtfModel;
import org.cryostar.data.image.ImageSet;
import org.cryostar.data.image.Particle;
import org.cryostar.util.Pair;
import org.testng.Assert;
import org.testng.annotations.Test;

/**
 * Tests {@link DefocusGroups}.
 */
public class DefocusGroupsTest {
  private static List<Pair<Long, Double>> items(double... defocus) {
    List<Pair<Long, Double>> res = new ArrayList<>();
    for (int i = 0; i < defocus.length; i++)
      res.add(new Pair<>((long) i + 1, defocus[i]));
    return res;
  }

  @Test
  public void undersizedLastGroupIsMerged() {
    // WHEN
    DefocusGroups groups = DefocusGroups.splitByDiff(items(1000, 1200, 1250, 5000), 1000, 2);

    // THEN
    Assert.assertEquals(groups.size(), 1, "Expected group {5000} to be merged into the first one");
    Assert.assertEquals(groups.get(1).size(), 4);
    Assert.assertEquals(groups.get(1).getMinDefocus(), 1000.);
    Assert.assertEquals(groups.get(1).getMaxDefocus(), 5000.);
  }

  @Test
  public void greedyPartitionBySpan() {
    // WHEN
    DefocusGroups groups = DefocusGroups.splitByDiff(items(1000, 1200, 1250, 5000), 1000, 1);

    // THEN
    Assert.assertEquals(groups.size(), 2);
    Assert.assertEquals(groups.get(1).getMemberIds(), Arrays.asList(1L, 2L, 3L));
    Assert.assertEquals(groups.get(2).getMemberIds(), Arrays.asList(4L));
  }

  @Test
  public void mergeIntoNeighbourWithSmallerSpan() {
    // GIVEN: first pass results in {1000, 1100}, {2300}, {3400, 3500}
    List<Pair<Long, Double>> input = items(3500, 1000, 2300, 3400, 1100);

    // WHEN
    DefocusGroups groups = DefocusGroups.splitByDiff(input, 1000, 2);

    // THEN
    Assert.assertEquals(groups.size(), 2);
    Assert.assertEquals(groups.get(1).getMemberIds(), Arrays.asList(2L, 5L));
    Assert.assertEquals(groups.get(2).getMemberIds(), Arrays.asList(3L, 4L, 1L),
        "Expected 2300 to be merged to the right, which results in the smaller span");
    Assert.assertEquals(groups.get(2).getId(), 2, "Expected ids to be renumbered");
  }

  @Test
  public void partitionProperty() {
    // GIVEN
    Random random = new Random(42);
    double[] values = new double[500];
    for (int i = 0; i < values.length; i++)
      values[i] = 5000 + random.nextDouble() * 30000;

    // WHEN
    DefocusGroups groups = DefocusGroups.splitByDiff(items(values), 1500, 20);

    // THEN
    Set<Long> seen = new HashSet<>();
    int total = 0;
    double lastMax = Double.NEGATIVE_INFINITY;
    for (DefocusGroup group : groups) {
      Assert.assertTrue(group.size() >= 20 || groups.size() == 1, "Expected min size for group " + group);
      Assert.assertTrue(group.getMinDefocus() >= lastMax, "Expected groups ordered by defocus");
      lastMax = group.getMaxDefocus();
      for (Long id : group.getMemberIds()) {
        Assert.assertTrue(seen.add(id), "Expected each item in exactly one group: " + id);
        Assert.assertTrue(group.contains(values[(int) (id - 1)]));
      }
      total += group.size();
    }
    Assert.assertEquals(total, values.length, "Expected all items to be assigned");
  }

  @Test
  public void getGroupNearestBoundary() {
    // GIVEN
    DefocusGroups groups = DefocusGroups.splitByDiff(items(1000, 1100, 3000, 3100), 1000, 1);

    // WHEN/THEN
    Assert.assertEquals(groups.getGroup(1050).getId(), 1, "Expected containing group");
    Assert.assertEquals(groups.getGroup(500).getId(), 1, "Expected first group below the range");
    Assert.assertEquals(groups.getGroup(9000).getId(), 2, "Expected last group above the range");
    Assert.assertEquals(groups.getGroup(2000).getId(), 1, "Expected nearest boundary (1100)");
    Assert.assertEquals(groups.getGroup(2050).getId(), 1, "Expected lower id on equal distance");
    Assert.assertEquals(groups.getGroup(2950).getId(), 2, "Expected nearest boundary (3000)");
  }

  @Test
  public void fromParticles() {
    // GIVEN
    ImageSet<Particle> particles = new ImageSet<>();
    for (double d : new double[] { 20000, 10000, 10500 }) {
      Particle p = new Particle(1, "stack.mrcs");
      p.setCtf(new CtfModel(d, d, 0.));
      particles.append(p);
    }

    // WHEN
    DefocusGroups groups = DefocusGroups.fromParticles(particles, 1000, 1);

    // THEN
    Assert.assertEquals(groups.size(), 2);
    Assert.assertEquals(groups.get(1).getMemberIds(), Arrays.asList(2L, 3L));
    Assert.assertEquals(groups.getGroupOfMember(1L).getId(), 2);
    Assert.assertTrue(groups.toString().startsWith(">>> Defocus groups: 2\n"), groups.toString());
    Assert.assertTrue(groups.toString().contains("10000.000"), groups.toString());
  }

  @Test
  public void noItems() {
    Assert.assertEquals(DefocusGroups.splitByDiff(new ArrayList<>(), 1000, 10).size(), 0);
  }
}
