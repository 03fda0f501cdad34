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
package org.cryostar.convert;

import java.util.ArrayList;
import java.util.List;

import org.cryostar.context.Profiles;
import org.cryostar.convert.defocus.DefocusGroups;
import org.cryostar.convert.optics.OpticsGroup;
import org.cryostar.convert.optics.OpticsGroups;
import org.cryostar.data.image.CtfModel;
import org.cryostar.data.image.ImageSet;
import org.cryostar.data.image.Particle;
import org.cryostar.star.StarFileFactory;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

/**
 * Tests that {@link ConverterFactory} is wired with the default configuration.
 */
public class ConverterFactoryTest {
  private AnnotationConfigApplicationContext dataContext;
  private ConverterFactory factory;

  @BeforeMethod
  public void setUp() {
    dataContext = new AnnotationConfigApplicationContext();
    dataContext.getEnvironment().setActiveProfiles(Profiles.UNIT_TEST);
    dataContext.scan("org.cryostar");
    dataContext.refresh();

    factory = dataContext.getBean(ConverterFactory.class);
  }

  @AfterMethod
  public void cleanup() {
    dataContext.close();
  }

  @Test
  public void defaultWriterIsRelion31() {
    // WHEN
    ImageSetWriter writer = factory.createWriter();

    // THEN
    Assert.assertEquals(factory.getDefaultVersion(), FormatVersion.V31);
    Assert.assertTrue(writer instanceof ImageSetWriter31, "Expected RELION 3.1 writer, but was " + writer);
    Assert.assertTrue(factory.createWriter(FormatVersion.V30) instanceof ImageSetWriter30);
  }

  @Test
  public void defaultOpticsGroups() {
    // WHEN
    OpticsGroups groups = factory.createDefaultOpticsGroups();

    // THEN
    Assert.assertEquals(groups.size(), 1);
    OpticsGroup group = groups.first();
    Assert.assertEquals(group.getId(), 1);
    Assert.assertEquals(group.getName(), "opticsGroup1");
    Assert.assertEquals(group.getVoltage(), Double.valueOf(300.));
    Assert.assertEquals(group.getPixelSize(), Double.valueOf(1.));
    Assert.assertFalse(group.getParams().containsKey("rlnImageSize"), "Image size is disabled by default");
  }

  @Test
  public void defocusGroupsUseConfiguredDiff() {
    // GIVEN
    ImageSet<Particle> particles = new ImageSet<>();
    List<Double> defoci = new ArrayList<>();
    for (int i = 0; i < 10; i++)
      defoci.add(10000. + 50. * i);
    for (int i = 0; i < 10; i++)
      defoci.add(20000. + 50. * i);
    for (double defocus : defoci) {
      Particle particle = new Particle(particles.size() + 1, "stack.mrcs");
      particle.setCtf(new CtfModel(defocus, defocus, 0.));
      particles.append(particle);
    }

    // WHEN
    DefocusGroups groups = factory.createDefocusGroups(particles);

    // THEN
    Assert.assertEquals(groups.size(), 2, "Expected two groups of the minimum size");
    Assert.assertEquals(groups.getGroupOfMember(15L).getId(), 2);
  }

  @Test
  public void starFileFactoryIsShared() {
    // THEN
    Assert.assertSame(factory.getStarFileFactory(), dataContext.getBean(StarFileFactory.class));
  }
}
