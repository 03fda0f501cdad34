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

import java.util.Iterator;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

import org.cryostar.data.image.Image;
import org.cryostar.data.image.ImageSet;
import org.cryostar.data.image.Particle;
import org.cryostar.data.image.Volume;

import com.google.common.collect.ImmutableList;

/**
 * A set of classes computed from a set of input particles.
 * 
 * <p>
 * The content is (re-)built by {@link #classifyItems(Iterator, BiConsumer, Consumer)}; each call replaces all classes
 * and assignments held before.
 */
public class ClassSet implements Iterable<ClassItem> {
  private final ImageSet<Particle> inputParticles;
  private final boolean volumeRepresentatives;
  private NavigableMap<Integer, ClassItem> classes = new TreeMap<>();

  /**
   * @param inputParticles
   *          The particles that are classified. These objects are never changed, classes hold copies.
   * @param volumeRepresentatives
   *          true for 3D classes (the representative of each class is a {@link Volume}), false for 2D classes (the
   *          representative is a {@link Particle}, the class average).
   */
  public ClassSet(ImageSet<Particle> inputParticles, boolean volumeRepresentatives) {
    this.inputParticles = inputParticles;
    this.volumeRepresentatives = volumeRepresentatives;
  }

  public ImageSet<Particle> getInputParticles() {
    return inputParticles;
  }

  /**
   * Classify all input particles.
   * 
   * <p>
   * The input particles are iterated in order of their object id, together with the next element of the given data
   * iterator. A copy of each particle is handed to updateItem together with its data element; updateItem is expected
   * to set the class id of the particle. Particles without a positive class id afterwards are not assigned to any
   * class. Once all particles are assigned, updateClass is called once for each class in order of the class id.
   * 
   * @throws IllegalArgumentException
   *           If the data iterator has fewer elements than there are input particles.
   */
  public <R> void classifyItems(Iterator<R> itemData, BiConsumer<Particle, R> updateItem,
      Consumer<ClassItem> updateClass) {
    NavigableMap<Integer, ClassItem> newClasses = new TreeMap<>();

    int numberOfItems = 0;
    for (Particle inputParticle : inputParticles) {
      if (!itemData.hasNext())
        throw new IllegalArgumentException("No data available for particle " + inputParticle.getObjId() + ", only "
            + numberOfItems + " data items for " + inputParticles.size() + " particles.");
      numberOfItems++;
      Particle particle = inputParticle.copy();
      updateItem.accept(particle, itemData.next());

      Integer classId = particle.getClassId();
      if (classId == null || classId <= 0)
        continue;

      ClassItem classItem = newClasses.get(classId);
      if (classItem == null) {
        classItem = new ClassItem(classId, createRepresentative());
        newClasses.put(classId, classItem);
      }
      classItem.addMember(particle);
    }

    for (ClassItem classItem : newClasses.values())
      updateClass.accept(classItem);

    classes = newClasses;
  }

  private Image createRepresentative() {
    return volumeRepresentatives ? new Volume() : new Particle();
  }

  public ClassItem getClass(int classId) {
    return classes.get(classId);
  }

  /**
   * @return Snapshot of the classes in order of class id.
   */
  public List<ClassItem> getClasses() {
    return ImmutableList.copyOf(classes.values());
  }

  public int size() {
    return classes.size();
  }

  public void clear() {
    classes = new TreeMap<>();
  }

  @Override
  public Iterator<ClassItem> iterator() {
    return classes.values().iterator();
  }
}
