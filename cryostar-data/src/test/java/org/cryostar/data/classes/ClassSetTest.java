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
package org.cryostar.data.classes;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.cryostar.data.image.ImageSet;
import org.cryostar.data.image.Particle;
import org.cryostar.data.image.Volume;
import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

/**
 * Tests {@link ClassSet}.
 */
public class ClassSetTest {
  private ImageSet<Particle> particles;

  @BeforeMethod
  public void setUp() {
    particles = new ImageSet<>();
    for (int i = 1; i <= 4; i++)
      particles.append(new Particle(i, "stack.mrcs"));
  }

  @Test
  public void classify() {
    // GIVEN
    ClassSet classes = new ClassSet(particles, true);

    // WHEN
    classes.classifyItems(Arrays.asList(2, 1, 2, 0).iterator(), (p, classId) -> p.setClassId(classId),
        c -> c.setAttribute("rlnClassDistribution", c.size() / 4.));

    // THEN
    Assert.assertEquals(classes.size(), 2, "Expected two classes, particle with class 0 unassigned");
    Assert.assertEquals(classes.getClass(1).size(), 1);
    Assert.assertEquals(classes.getClass(2).size(), 2);
    Assert.assertEquals(classes.getClass(2).getAttribute("rlnClassDistribution"), 0.5);
    Assert.assertTrue(classes.getClass(2).getRepresentative() instanceof Volume);
    Assert.assertNull(particles.get(1L).getClassId(), "Input particles must not be changed");
  }

  @Test
  public void classifyAgainReplaces() {
    // GIVEN
    ClassSet classes = new ClassSet(particles, false);
    classes.classifyItems(Arrays.asList(1, 2, 3, 4).iterator(), (p, c) -> p.setClassId(c), c -> {
    });

    // WHEN
    classes.classifyItems(Arrays.asList(5, 5, 5, 5).iterator(), (p, c) -> p.setClassId(c), c -> {
    });

    // THEN
    Assert.assertEquals(classes.size(), 1);
    Assert.assertEquals(classes.getClasses().get(0).getId(), 5);
    Assert.assertEquals(classes.getClass(5).size(), 4);
  }

  @Test
  public void classesAndMembersAreSnapshots() {
    // GIVEN
    ClassSet classes = new ClassSet(particles, false);
    classes.classifyItems(Arrays.asList(1, 1, 2, 2).iterator(), (p, c) -> p.setClassId(c), c -> {
    });
    List<ClassItem> before = classes.getClasses();

    // WHEN
    classes.classifyItems(Arrays.asList(3, 3, 3, 3).iterator(), (p, c) -> p.setClassId(c), c -> {
    });

    // THEN
    Assert.assertEquals(before.size(), 2, "Expected classes returned earlier to stay unchanged");
    Assert.assertEquals(classes.getClasses().size(), 1);
    try {
      classes.getClass(3).getMembers().clear();
      Assert.fail("Expected members to be read-only");
    } catch (UnsupportedOperationException e) {
      // THEN
      Assert.assertEquals(classes.getClass(3).size(), 4);
    }
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void notEnoughData() {
    new ClassSet(particles, false).classifyItems(Collections.singletonList(1).iterator(),
        (p, c) -> p.setClassId(c), c -> {
        });
  }
}
