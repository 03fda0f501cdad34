/**
 * cryostar: STAR metadata interchange for cryo-EM image processing.
 *
 * Copyright (C) 2015 The cryostar authors
 *
 * This file is part of cryostar.
 *
 * This program is free software: you can redistribute it and/or modify
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
package org.cryostar.convert.classes;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Map;
import java.util.OptionalInt;

import org.cryostar.data.classes.ClassItem;
import org.cryostar.data.classes.ClassSet;
import org.cryostar.data.image.AlignmentType;
import org.cryostar.data.image.ImageLocation;
import org.cryostar.data.image.ImageSet;
import org.cryostar.data.image.Particle;
import org.cryostar.star.StarException;
import org.cryostar.star.StarFileFactory;
import org.cryostar.star.StarFormatException;
import org.cryostar.star.StarSchemaException;
import org.mockito.Mockito;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import com.google.common.collect.ImmutableSet;

/**
 * Tests {@link ClassesLoader} on the iteration files in src/test/resources/iterations.
 */
public class ClassesLoaderTest {
  private static final double EPS = 1e-6;

  private Path iterationsDir;
  private Path tempDir;
  private StarFileFactory starFileFactory;

  @BeforeMethod
  public void setUp() throws URISyntaxException, IOException {
    iterationsDir = Paths.get(ClassesLoaderTest.class.getResource("/iterations").toURI());
    tempDir = Files.createTempDirectory(ClassesLoaderTest.class.getSimpleName());
    starFileFactory = new StarFileFactory();
  }

  @AfterMethod
  public void cleanup() throws IOException {
    if (tempDir != null && Files.exists(tempDir)) {
      Files.walk(tempDir).sorted((a, b) -> b.compareTo(a)).forEach(p -> p.toFile().delete());
    }
  }

  @Test
  public void projectionClassesV31() throws StarException {
    // GIVEN
    ClassesLoader loader = new ClassesLoader(new RelionIterationFiles(iterationsDir, "run31"),
        AlignmentType.ALIGN_PROJ, 1.0, starFileFactory);
    ClassSet classSet = new ClassSet(particles(3), true);

    // WHEN
    loader.fillClassesFromIter(classSet, 25);

    // THEN
    Assert.assertEquals(loader.getLoadedIteration(), OptionalInt.of(25));
    Assert.assertEquals(classSet.size(), 2, "Expected two classes");

    ClassItem class1 = classSet.getClass(1);
    Assert.assertEquals(class1.size(), 2, "Expected image ids 1 and 2 in class 1");
    Assert.assertEquals(class1.getAlignmentType(), AlignmentType.ALIGN_PROJ);
    Assert.assertEquals(class1.getRepresentative().getFileName(), "Class3D/run31_it025_class001.mrc:mrc",
        "Expected volume marked as mrc");
    Assert.assertEquals(class1.getAttribute("rlnClassDistribution"), 0.666667);
    Assert.assertEquals(class1.getAttribute("rlnAccuracyTranslationsAngst"), 1.6);

    Particle first = class1.getMembers().get(0);
    Assert.assertEquals((long) first.getObjId(), 1L);
    double[] shifts = first.getTransform().getShifts();
    Assert.assertEquals(shifts[0], 2., EPS, "Expected shift converted with optics pixel size");
    Assert.assertEquals(shifts[1], -1., EPS, "Expected shift converted with optics pixel size");
    Assert.assertEquals(first.getAttribute("rlnNormCorrection"), 1.05, "Expected extra label of image id 1");

    Particle third = classSet.getClass(2).getMembers().get(0);
    Assert.assertEquals((long) third.getObjId(), 3L);
    Assert.assertEquals(third.getAttribute("rlnNormCorrection"), 0.95, "Expected rows to be sorted by image id");

    Assert.assertNull(classSet.getInputParticles().get(1).getClassId(), "Input particles must not be changed");
  }

  @Test
  public void averagesV30() throws StarException {
    // GIVEN
    ClassesLoader loader = new ClassesLoader(new RelionIterationFiles(iterationsDir, "run30"),
        AlignmentType.ALIGN_2D, 1.5, starFileFactory);
    ClassSet classSet = new ClassSet(particles(2), false);

    // WHEN
    loader.fillClassesFromIter(classSet, 10);

    // THEN
    Assert.assertEquals(loader.getClassesInfo().size(), 3, "Expected all classes of the model");
    Assert.assertEquals(classSet.size(), 2, "Expected only classes with members");
    ClassItem class2 = classSet.getClass(2);
    Assert.assertEquals(class2.getRepresentative().getLocation(),
        new ImageLocation(2, "Class2D/run30_it010_classes.mrcs"));
    Assert.assertEquals(class2.getAttribute("rlnAccuracyTranslations"), 0.9);

    double[] shifts = classSet.getClass(1).getMembers().get(0).getTransform().getShifts();
    Assert.assertEquals(shifts[0], 3., EPS, "Expected pixel shifts to be used as-is");
    Assert.assertEquals(shifts[1], 1., EPS, "Expected pixel shifts to be used as-is");
  }

  @Test
  public void classesInfo() throws StarException {
    // GIVEN
    IterationFiles files = Mockito.mock(IterationFiles.class);
    Mockito.when(files.getModelStar(25)).thenReturn(iterationsDir.resolve("run31_it025_model.star"));
    ClassesLoader loader = new ClassesLoader(files, AlignmentType.ALIGN_PROJ, 1.0, starFileFactory);

    // WHEN
    Map<Integer, ClassInfo> infos = loader.loadClassesInfo(25);

    // THEN
    Assert.assertEquals(infos.keySet(), ImmutableSet.of(1, 2));
    Assert.assertEquals(infos.get(2).getLocation(), new ImageLocation("Class3D/run31_it025_class002.mrc"));
    Assert.assertEquals(infos.get(2).getAttribute("rlnEstimatedResolution"), 9.75);
    Assert.assertFalse(loader.getLoadedIteration().isPresent(), "Only loading classes counts as loaded iteration");
    Mockito.verify(files, Mockito.never()).getDataStar(Mockito.anyInt());
  }

  @Test
  public void rowCountMismatch() throws StarException {
    // GIVEN
    ClassesLoader loader = new ClassesLoader(new RelionIterationFiles(iterationsDir, "run31"),
        AlignmentType.ALIGN_PROJ, 1.0, starFileFactory);
    ClassSet classSet = new ClassSet(particles(2), true);

    // WHEN
    try {
      loader.fillClassesFromIter(classSet, 25);
      Assert.fail("Expected an exception");
    } catch (StarFormatException e) {
      // THEN
      Assert.assertEquals(e.getTable(), "particles");
    }
    Assert.assertFalse(loader.getLoadedIteration().isPresent(), "Failed load must not count as loaded");
    Assert.assertEquals(classSet.size(), 0);
  }

  @Test
  public void failedLoadKeepsPreviousIteration() throws StarException {
    // GIVEN
    ClassesLoader loader = new ClassesLoader(new RelionIterationFiles(iterationsDir, "run30"),
        AlignmentType.ALIGN_2D, 1.0, starFileFactory);
    ClassSet classSet = new ClassSet(particles(2), false);
    loader.fillClassesFromIter(classSet, 10);

    // WHEN
    try {
      loader.fillClassesFromIter(classSet, 11);
      Assert.fail("Expected iteration 11 to be missing");
    } catch (StarException e) {
      // THEN
      Assert.assertTrue(e.getSource().endsWith("run30_it011_model.star"), "Expected missing model file in error");
    }
    Assert.assertEquals(loader.getLoadedIteration(), OptionalInt.of(10));
    Assert.assertEquals(classSet.size(), 2, "Expected classes of iteration 10 to be kept");
  }

  @Test
  public void missingClassNumber() throws StarException, IOException {
    // GIVEN
    Path data = tempDir.resolve("data.star");
    Files.write(data, Arrays.asList("data_", "loop_", "_rlnImageId #1", "_rlnAnglePsi #2", "_rlnOriginX #3",
        "_rlnOriginY #4", "1 0.0 0.0 0.0", "2 0.0 0.0 0.0"), StandardCharsets.UTF_8);
    IterationFiles files = Mockito.mock(IterationFiles.class);
    Mockito.when(files.getModelStar(10)).thenReturn(iterationsDir.resolve("run30_it010_model.star"));
    Mockito.when(files.getDataStar(10)).thenReturn(data);
    ClassesLoader loader = new ClassesLoader(files, AlignmentType.ALIGN_2D, 1.0, starFileFactory);

    // WHEN
    try {
      loader.fillClassesFromIter(new ClassSet(particles(2), false), 10);
      Assert.fail("Expected an exception");
    } catch (StarSchemaException e) {
      // THEN
      Assert.assertEquals(e.getMissing(), Arrays.asList("rlnClassNumber"));
    }
  }

  private static ImageSet<Particle> particles(int count) {
    ImageSet<Particle> res = new ImageSet<>();
    for (int i = 1; i <= count; i++)
      res.append(new Particle(i, "Particles/stack.mrcs"));
    return res;
  }
}
